package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.job.LabelOutput;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.FinalDimensions;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.view.Views;

/**
 * Stitches label images so that every object gets one id that is unique within the whole image.
 * <p>
 * In the first pass, each tile contributes its stitch interval, without the objects that touch an interior seam
 * (a face of the stitch interval that is shared with a neighbor). The contributed objects are relabeled with fresh ids.
 * In the second pass, every seam-touching object is pasted whole from its tile's output, unless it collides
 * with an object that has already been written, which means that a neighboring tile has already contributed it.
 * Tiles are processed in tile order, and objects within a tile in label order.
 * </p>
 * <p>
 * The stitched labels are of {@link IntType}, 0 is background.
 * </p>
 */
public class LabelMergePolicy implements StitchPolicy
{
	private static final Logger LOG = LoggerFactory.getLogger( LabelMergePolicy.class );

	@Override
	public boolean accepts( final OutputKind kind )
	{
		return kind == OutputKind.LABELS;
	}

	@Override
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config )
	{
		final int n = partition.numDimensions();
		final LabelOutput< ? > firstOutput = ( LabelOutput< ? > ) results.get( 0 ).getOutput();
		final double[] scale = OutputScaling.resolveScale( partition, config, firstOutput.getLabels() );
		final TilePartition scaledPartition = partition.scale( scale );

		final RandomAccessibleInterval< IntType > stitched = BlendStrategy.createImg( new FinalDimensions( scaledPartition.getImageShape() ), new IntType() );
		final RandomAccess< IntType > stitchedAccess = stitched.randomAccess();
		final long[] nextId = new long[] { 1 };

		final List< Set< Long > > seamLabels = new ArrayList<>( results.size() );
		for ( final TileResult result : results )
		{
			final Tile tile = scaledPartition.getTile( result.getTile().getIndex() );
			final LabelOutput< ? > output = ( LabelOutput< ? > ) result.getOutput();
			if ( output.getLabels().numDimensions() != n )
				throw new IllegalArgumentException( "Labels of " + result.getTile() + " have dimensionality " + output.getLabels().numDimensions() + ", expected " + n );
			OutputScaling.checkOutputSize( tile, output.getLabels(), scale );

			seamLabels.add( writeStitchInterval( output.getLabels(), tile, stitchedAccess, nextId ) );
		}

		int numPasted = 0, numCollided = 0;
		for ( int i = 0; i < results.size(); ++i )
		{
			if ( seamLabels.get( i ).isEmpty() )
				continue;

			final Tile tile = scaledPartition.getTile( results.get( i ).getTile().getIndex() );
			final LabelOutput< ? > output = ( LabelOutput< ? > ) results.get( i ).getOutput();
			final Map< Long, List< long[] > > objects = collectObjects( output.getLabels(), tile, seamLabels.get( i ) );
			for ( final List< long[] > objectPixels : objects.values() )
			{
				if ( pasteObject( objectPixels, stitchedAccess, nextId[ 0 ] ) )
				{
					++nextId[ 0 ];
					++numPasted;
				}
				else
				{
					++numCollided;
				}
			}
		}

		LOG.info( "stitch: stitched {} object(s), {} of them pasted across seams, {} seam duplicate(s) dropped", nextId[ 0 ] - 1, numPasted, numCollided );
		return StitchedResult.ofLabels( stitched );
	}

	/**
	 * Writes the objects within the stitch interval of the tile that do not touch an interior seam.
	 *
	 * @return the labels of the objects that touch an interior seam
	 */
	private static < T extends IntegerType< T > > Set< Long > writeStitchInterval(
			final RandomAccessibleInterval< T > labels,
			final Tile tile,
			final RandomAccess< IntType > stitchedAccess,
			final long[] nextId )
	{
		final Interval stitchInterval = tile.getStitchInterval();
		final RandomAccessibleInterval< T > labelsInImage = Views.interval( Views.translate( labels, tileMin( tile ) ), stitchInterval );
		final long[] position = new long[ tile.numDimensions() ];

		final Set< Long > seamLabels = new TreeSet<>();
		final Cursor< T > seamCursor = Views.flatIterable( labelsInImage ).localizingCursor();
		while ( seamCursor.hasNext() )
		{
			final long label = seamCursor.next().getIntegerLong();
			if ( label != 0 )
			{
				seamCursor.localize( position );
				if ( isOnInteriorSeam( tile, stitchInterval, position ) )
					seamLabels.add( label );
			}
		}

		final Map< Long, Long > ids = new HashMap<>();
		final Cursor< T > cursor = Views.flatIterable( labelsInImage ).localizingCursor();
		while ( cursor.hasNext() )
		{
			final long label = cursor.next().getIntegerLong();
			if ( label != 0 && !seamLabels.contains( label ) )
			{
				Long id = ids.get( label );
				if ( id == null )
				{
					id = nextId[ 0 ]++;
					ids.put( label, id );
				}
				stitchedAccess.setPosition( cursor );
				stitchedAccess.get().setInteger( id );
			}
		}
		return seamLabels;
	}

	/**
	 * Collects the pixels of the given objects within the whole tile, in image coordinates.
	 */
	private static < T extends IntegerType< T > > Map< Long, List< long[] > > collectObjects(
			final RandomAccessibleInterval< T > labels,
			final Tile tile,
			final Set< Long > objectLabels )
	{
		final Map< Long, List< long[] > > objects = new TreeMap<>();
		final Cursor< T > cursor = Views.flatIterable( Views.translate( labels, tileMin( tile ) ) ).localizingCursor();
		while ( cursor.hasNext() )
		{
			final long label = cursor.next().getIntegerLong();
			if ( objectLabels.contains( label ) )
			{
				final long[] position = new long[ tile.numDimensions() ];
				cursor.localize( position );
				objects.computeIfAbsent( label, l -> new ArrayList<>() ).add( position );
			}
		}
		return objects;
	}

	private static boolean pasteObject( final List< long[] > objectPixels, final RandomAccess< IntType > stitchedAccess, final long id )
	{
		for ( final long[] position : objectPixels )
		{
			stitchedAccess.setPosition( position );
			if ( stitchedAccess.get().get() != 0 )
				return false;
		}

		for ( final long[] position : objectPixels )
		{
			stitchedAccess.setPosition( position );
			stitchedAccess.get().setInteger( id );
		}
		return true;
	}

	private static boolean isOnInteriorSeam( final Tile tile, final Interval stitchInterval, final long[] position )
	{
		for ( int d = 0; d < position.length; ++d )
		{
			if ( !tile.isBorderMin( d ) && position[ d ] == stitchInterval.min( d ) )
				return true;
			if ( !tile.isBorderMax( d ) && position[ d ] == stitchInterval.max( d ) )
				return true;
		}
		return false;
	}

	private static long[] tileMin( final Tile tile )
	{
		final long[] min = new long[ tile.numDimensions() ];
		tile.min( min );
		return min;
	}

	@Override
	public String toString()
	{
		return "label-merge";
	}
}
