package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingSpec;
import org.janelia.tiling.job.TileOutput;
import org.janelia.tiling.job.TileResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.Point;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

public class LabelMergePolicyTest
{
	private static final long[] DIMENSIONS = new long[] { 20, 40 };

	// only seen by the first tile
	private static final Interval OBJECT_A = new FinalInterval( new long[] { 2, 2 }, new long[] { 5, 5 } );

	// crosses the seam between the tiles, seen whole by both
	private static final Interval OBJECT_B = new FinalInterval( new long[] { 8, 17 }, new long[] { 11, 22 } );

	// only seen by the second tile
	private static final Interval OBJECT_C = new FinalInterval( new long[] { 14, 30 }, new long[] { 16, 35 } );

	private TilePartition partition;

	@Before
	public void setUp()
	{
		// tiles [0, 23] and [16, 39] along the second dimension, the seam is between 19 and 20
		partition = TilePartition.build( TilingSpec.absolute( DIMENSIONS, new long[] { 20, 24 }, 4, 8 ) );
		Assert.assertEquals( 2, partition.numTiles() );
	}

	@Test
	public void testObjectsGetUniqueIds() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.labels( segment( partition.getTile( 0 ), new int[] { 7, 3, 9 } ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.labels( segment( partition.getTile( 1 ), new int[] { 4, 1, 2 } ) ) ) );

		final StitchedResult stitched = new StitchEngine().stitch( partition, results, TilingConfig.defaults() );
		Assert.assertEquals( StitchedResult.Kind.LABELS, stitched.getKind() );
		final RandomAccessibleInterval< IntType > labels = stitched.getImg();
		Assert.assertArrayEquals( DIMENSIONS, Intervals.dimensionsAsLongArray( labels ) );

		final Map< Integer, Integer > idCounts = new HashMap<>();
		final Set< Integer > idsA = new HashSet<>(), idsB = new HashSet<>(), idsC = new HashSet<>();
		final Cursor< IntType > cursor = Views.flatIterable( labels ).localizingCursor();
		final long[] position = new long[ 2 ];
		while ( cursor.hasNext() )
		{
			final int id = cursor.next().get();
			cursor.localize( position );
			if ( Intervals.contains( OBJECT_A, new Point( position ) ) )
				idsA.add( id );
			else if ( Intervals.contains( OBJECT_B, new Point( position ) ) )
				idsB.add( id );
			else if ( Intervals.contains( OBJECT_C, new Point( position ) ) )
				idsC.add( id );
			else
				Assert.assertEquals( 0, id );

			if ( id != 0 )
				idCounts.merge( id, 1, Integer::sum );
		}

		Assert.assertEquals( 1, idsA.size() );
		Assert.assertEquals( 1, idsB.size() );
		Assert.assertEquals( 1, idsC.size() );
		Assert.assertFalse( idsA.contains( 0 ) || idsB.contains( 0 ) || idsC.contains( 0 ) );

		// every object has its own id and is written whole exactly once
		Assert.assertEquals( 3, idCounts.size() );
		Assert.assertEquals( Intervals.numElements( OBJECT_A ), idCounts.get( idsA.iterator().next() ).longValue() );
		Assert.assertEquals( Intervals.numElements( OBJECT_B ), idCounts.get( idsB.iterator().next() ).longValue() );
		Assert.assertEquals( Intervals.numElements( OBJECT_C ), idCounts.get( idsC.iterator().next() ).longValue() );
	}

	@Test
	public void testBackgroundOnly() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		for ( final Tile tile : partition.getTiles() )
			results.add( new TileResult( tile, TileOutput.labels( ArrayImgs.ints( Intervals.dimensionsAsLongArray( tile ) ) ) ) );

		final RandomAccessibleInterval< IntType > labels = new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getImg();
		for ( final IntType id : Views.iterable( labels ) )
			Assert.assertEquals( 0, id.get() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testExtraDimensionsAreRejected() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		for ( final Tile tile : partition.getTiles() )
			results.add( new TileResult( tile, TileOutput.labels( ArrayImgs.ints( tile.dimension( 0 ), tile.dimension( 1 ), 2 ) ) ) );
		new StitchEngine().stitch( partition, results, TilingConfig.defaults() );
	}

	/**
	 * Labels the parts of objects A, B and C visible in the tile with the given tile-local labels.
	 */
	private static ArrayImg< IntType, IntArray > segment( final Tile tile, final int[] localLabels )
	{
		final ArrayImg< IntType, IntArray > labels = ArrayImgs.ints( Intervals.dimensionsAsLongArray( tile ) );
		final Interval[] objects = new Interval[] { OBJECT_A, OBJECT_B, OBJECT_C };
		final Cursor< IntType > cursor = labels.localizingCursor();
		final long[] position = new long[ 2 ];
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.localize( position );
			for ( int d = 0; d < position.length; ++d )
				position[ d ] += tile.min( d );
			for ( int i = 0; i < objects.length; ++i )
				if ( Intervals.contains( objects[ i ], new Point( position ) ) )
					cursor.get().set( localLabels[ i ] );
		}
		return labels;
	}
}
