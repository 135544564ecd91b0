package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.janelia.tiling.IncompleteTileSetException;
import org.janelia.tiling.InvalidConfigException;
import org.janelia.tiling.OverlapMode;
import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingSpec;
import org.janelia.tiling.UnsupportedOutputTypeException;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.RawOutput;
import org.janelia.tiling.job.ScalarOutput;
import org.janelia.tiling.job.TileOutput;
import org.janelia.tiling.job.TileResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

public class StitchEngineTest
{
	private final StitchEngine engine = new StitchEngine();
	private TilePartition partition;

	@Before
	public void setUp()
	{
		partition = TilePartition.build( TilingSpec.absolute( new long[] { 100, 100 }, new long[] { 60, 60 }, 20, 20 ) );
	}

	@Test
	public void testPolicySelection() throws Exception
	{
		Assert.assertTrue( engine.selectPolicy( OutputKind.ARRAY ) instanceof ArrayBlendPolicy );
		Assert.assertTrue( engine.selectPolicy( OutputKind.LABELS ) instanceof LabelMergePolicy );
		Assert.assertTrue( engine.selectPolicy( OutputKind.OBJECTS ) instanceof ObjectMergePolicy );
		Assert.assertTrue( engine.selectPolicy( OutputKind.COORDINATES ) instanceof CoordinateMergePolicy );
		Assert.assertTrue( engine.selectPolicy( OutputKind.RAW ) instanceof PassthroughPolicy );
	}

	@Test
	public void testIncompleteTileSet() throws Exception
	{
		final List< TileResult > results = scalarResults();
		results.remove( 1 );
		try
		{
			engine.stitch( partition, results, TilingConfig.defaults(), new PassthroughPolicy() );
			Assert.fail( "Expected the tile set to be incomplete" );
		}
		catch ( final IncompleteTileSetException e )
		{
			Assert.assertEquals( 1, e.getMissingTiles().size() );
			Assert.assertEquals( partition.getTile( 1 ), e.getMissingTiles().get( 0 ) );
		}
	}

	@Test( expected = InvalidConfigException.class )
	public void testOverlapModeMismatch() throws Exception
	{
		final TilingConfig fractionConfig = TilingConfig.builder().overlapMode( OverlapMode.FRACTION ).build();
		engine.stitch( partition, scalarResults(), fractionConfig, new PassthroughPolicy() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testDuplicateResults() throws Exception
	{
		final List< TileResult > results = scalarResults();
		results.add( results.get( 0 ) );
		engine.stitch( partition, results, TilingConfig.defaults(), new PassthroughPolicy() );
	}

	@Test( expected = UnsupportedOutputTypeException.class )
	public void testScalarsNeedExplicitPolicy() throws Exception
	{
		engine.stitch( partition, scalarResults(), TilingConfig.defaults() );
	}

	@Test( expected = UnsupportedOutputTypeException.class )
	public void testMixedOutputKinds() throws Exception
	{
		final List< TileResult > results = scalarResults();
		results.set( 2, new TileResult( partition.getTile( 2 ), TileOutput.raw( "not a scalar" ) ) );
		engine.stitch( partition, results, TilingConfig.defaults(), new PassthroughPolicy() );
	}

	@Test( expected = UnsupportedOutputTypeException.class )
	public void testPolicyRejectsKind() throws Exception
	{
		engine.stitch( partition, scalarResults(), TilingConfig.defaults(), new ArrayBlendPolicy() );
	}

	@Test
	public void testPassthrough() throws Exception
	{
		final List< TileResult > results = scalarResults();
		Collections.reverse( results );

		final StitchedResult stitched = engine.stitch( partition, results, TilingConfig.defaults(), new PassthroughPolicy() );
		Assert.assertEquals( StitchedResult.Kind.TILES, stitched.getKind() );
		Assert.assertEquals( partition.numTiles(), stitched.getTiles().size() );
		for ( int i = 0; i < partition.numTiles(); ++i )
		{
			Assert.assertEquals( i, stitched.getTiles().get( i ).getTile().getIndex() );
			Assert.assertEquals( i, ( ( ScalarOutput ) stitched.getTiles().get( i ).getOutput() ).getValue(), 0 );
		}
	}

	@Test
	public void testRawOutputsArePassedThrough() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		for ( final Tile tile : partition.getTiles() )
			results.add( new TileResult( tile, TileOutput.raw( "tile " + tile.getIndex() ) ) );

		final StitchedResult stitched = engine.stitch( partition, results, TilingConfig.defaults() );
		Assert.assertEquals( "tile 3", ( ( RawOutput ) stitched.getTiles().get( 3 ).getOutput() ).getValue() );
	}

	@Test( expected = IllegalStateException.class )
	public void testWrongResultAccessor() throws Exception
	{
		engine.stitch( partition, scalarResults(), TilingConfig.defaults(), new PassthroughPolicy() ).getImg();
	}

	@Test
	public void testOrderIndependence() throws Exception
	{
		final Random rnd = new Random();
		final List< TileResult > results = new ArrayList<>();
		for ( final Tile tile : partition.getTiles() )
		{
			final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( Intervals.dimensionsAsLongArray( tile ) );
			for ( final FloatType value : img )
				value.set( rnd.nextFloat() );
			results.add( new TileResult( tile, TileOutput.array( img ) ) );
		}

		for ( final BlendMode blendMode : BlendMode.values() )
		{
			final TilingConfig config = TilingConfig.builder().blendMode( blendMode ).build();
			final RandomAccessibleInterval< FloatType > expected = engine.stitch( partition, results, config ).getImg();

			final List< TileResult > shuffledResults = new ArrayList<>( results );
			Collections.shuffle( shuffledResults, rnd );
			final RandomAccessibleInterval< FloatType > actual = engine.stitch( partition, shuffledResults, config ).getImg();

			final Cursor< FloatType > expectedCursor = Views.flatIterable( expected ).cursor();
			final Cursor< FloatType > actualCursor = Views.flatIterable( actual ).cursor();
			while ( expectedCursor.hasNext() )
				Assert.assertEquals( expectedCursor.next().get(), actualCursor.next().get(), 0 );
		}
	}

	private List< TileResult > scalarResults()
	{
		final List< TileResult > results = new ArrayList<>();
		for ( final Tile tile : partition.getTiles() )
			results.add( new TileResult( tile, TileOutput.scalar( tile.getIndex() ) ) );
		return results;
	}
}
