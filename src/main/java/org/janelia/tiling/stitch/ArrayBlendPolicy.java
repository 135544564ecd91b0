package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.UnsupportedOutputTypeException;
import org.janelia.tiling.job.ArrayOutput;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.FinalDimensions;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Stitches dense tile outputs into one image of size {@code round(imageShape * outputScale)}.
 * <p>
 * Overlaps are combined by the configured {@link BlendStrategy}. With {@code drop_border_output},
 * each tile only contributes its stitch interval (the tile shrunk by half of every interior overlap margin),
 * and since these intervals do not overlap the values are written without blending.
 * Trailing dimensions of the outputs beyond the tiled dimensions (e.g. channels) are carried through.
 * </p>
 */
public class ArrayBlendPolicy implements StitchPolicy
{
	private static final Logger LOG = LoggerFactory.getLogger( ArrayBlendPolicy.class );

	@Override
	public boolean accepts( final OutputKind kind )
	{
		return kind == OutputKind.ARRAY;
	}

	@Override
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config ) throws UnsupportedOutputTypeException
	{
		return StitchedResult.ofArray( stitchFromFirst( partition, results, config, ( ArrayOutput< ? > ) results.get( 0 ).getOutput() ) );
	}

	private < T extends RealType< T > & NativeType< T > > RandomAccessibleInterval< T > stitchFromFirst(
			final TilePartition partition,
			final List< TileResult > results,
			final TilingConfig config,
			final ArrayOutput< T > firstOutput ) throws UnsupportedOutputTypeException
	{
		return stitchArrays( partition, results, config, firstOutput.getType() );
	}

	private < T extends RealType< T > & NativeType< T > > RandomAccessibleInterval< T > stitchArrays(
			final TilePartition partition,
			final List< TileResult > results,
			final TilingConfig config,
			final T type ) throws UnsupportedOutputTypeException
	{
		final int n = partition.numDimensions();
		final List< RandomAccessibleInterval< T > > outputs = new ArrayList<>( results.size() );
		for ( final TileResult result : results )
		{
			final ArrayOutput< ? > output = ( ArrayOutput< ? > ) result.getOutput();
			if ( !type.getClass().equals( output.getType().getClass() ) )
				throw new UnsupportedOutputTypeException( "Array outputs have different pixel types: " +
						type.getClass().getSimpleName() + " and " + output.getType().getClass().getSimpleName() + " (" + result.getTile() + ")" );

			@SuppressWarnings( "unchecked" )
			final RandomAccessibleInterval< T > img = ( RandomAccessibleInterval< T > ) output.getImg();
			outputs.add( img );
		}

		final RandomAccessibleInterval< T > firstImg = outputs.get( 0 );
		if ( firstImg.numDimensions() < n )
			throw new IllegalArgumentException( "Array output of dimensionality " + firstImg.numDimensions() + " cannot be stitched in a partition of dimensionality " + n );

		final long[] extraDimensions = new long[ firstImg.numDimensions() - n ];
		for ( int d = 0; d < extraDimensions.length; ++d )
			extraDimensions[ d ] = firstImg.dimension( n + d );

		final double[] scale = OutputScaling.resolveScale( partition, config, firstImg );
		final TilePartition scaledPartition = partition.scale( scale );
		final long[] scaledShape = scaledPartition.getImageShape();

		final long[] outDimensions = new long[ n + extraDimensions.length ];
		System.arraycopy( scaledShape, 0, outDimensions, 0, n );
		System.arraycopy( extraDimensions, 0, outDimensions, n, extraDimensions.length );

		final boolean dropBorderOutput = config.isDropBorderOutput();
		final BlendMode blendMode = dropBorderOutput ? BlendMode.CROP : config.getBlendMode();
		final BlendStrategy< T > blendStrategy = BlendStrategy.create( blendMode, new FinalDimensions( outDimensions ), type );

		LOG.debug( "stitchArrays: output size {}, scale {}, blend {}, drop border output {}",
				Arrays.toString( outDimensions ), Arrays.toString( scale ), blendMode, dropBorderOutput );

		final long[] position = new long[ outDimensions.length ];
		for ( int i = 0; i < results.size(); ++i )
		{
			final Tile scaledTile = scaledPartition.getTile( results.get( i ).getTile().getIndex() );
			final RandomAccessibleInterval< T > img = outputs.get( i );

			if ( img.numDimensions() != outDimensions.length )
				throw new IllegalArgumentException( "Output of " + results.get( i ).getTile() + " has dimensionality " + img.numDimensions() + ", expected " + outDimensions.length );
			for ( int d = 0; d < extraDimensions.length; ++d )
				if ( img.dimension( n + d ) != extraDimensions[ d ] )
					throw new IllegalArgumentException( "Output of " + results.get( i ).getTile() + " has size " + img.dimension( n + d ) + " in dimension " + ( n + d ) + ", expected " + extraDimensions[ d ] );
			OutputScaling.checkOutputSize( scaledTile, img, scale );

			final Interval writeInterval = OutputScaling.withExtraDimensions(
					dropBorderOutput ? scaledTile.getStitchInterval() : scaledTile,
					extraDimensions );

			final long[] translation = new long[ outDimensions.length ];
			for ( int d = 0; d < n; ++d )
				translation[ d ] = scaledTile.min( d );
			final RandomAccessibleInterval< T > imgInOutputSpace = Views.translate( img, translation );

			blendStrategy.setCursors( writeInterval );
			final Cursor< T > sourceCursor = Views.flatIterable( Views.interval( imgInOutputSpace, writeInterval ) ).localizingCursor();
			while ( sourceCursor.hasNext() )
			{
				blendStrategy.moveCursorsForward();
				sourceCursor.fwd();
				sourceCursor.localize( position );
				blendStrategy.updateValue( scaledTile, position, sourceCursor.get() );
			}
		}

		return blendStrategy.getResult();
	}

	@Override
	public String toString()
	{
		return "array-blend";
	}
}
