package org.janelia.tiling.stitch;

import java.util.Arrays;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;

import net.imglib2.Dimensions;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * Maps the tile partition onto the space of tile outputs whose resolution differs from the input,
 * either by the configured output scale or by the scale inferred from the first tile.
 */
class OutputScaling
{
	/**
	 * Returns the configured output scale, or the ratio of the first tile's output size to its input size.
	 */
	static double[] resolveScale( final TilePartition partition, final TilingConfig config, final Dimensions firstOutput )
	{
		final int n = partition.numDimensions();
		if ( config.hasOutputScale() )
			return config.getOutputScale( n );

		final Tile firstTile = partition.getTile( 0 );
		final double[] scale = new double[ n ];
		for ( int d = 0; d < n; ++d )
			scale[ d ] = ( double ) firstOutput.dimension( d ) / firstTile.dimension( d );
		return scale;
	}

	/**
	 * Returns the configured output scale, or no scaling.
	 */
	static double[] resolveScale( final TilePartition partition, final TilingConfig config )
	{
		final int n = partition.numDimensions();
		if ( config.hasOutputScale() )
			return config.getOutputScale( n );

		final double[] scale = new double[ n ];
		Arrays.fill( scale, 1 );
		return scale;
	}

	/**
	 * Checks that the spatial size of a tile output matches the tile in the scaled partition.
	 *
	 * @throws IllegalArgumentException if the sizes differ
	 */
	static void checkOutputSize( final Tile scaledTile, final Dimensions output, final double[] scale )
	{
		for ( int d = 0; d < scaledTile.numDimensions(); ++d )
		{
			if ( output.dimension( d ) != scaledTile.dimension( d ) )
			{
				final long[] outputSize = new long[ output.numDimensions() ];
				output.dimensions( outputSize );
				final long[] expectedSize = new long[ scaledTile.numDimensions() ];
				scaledTile.dimensions( expectedSize );
				throw new IllegalArgumentException( "Output of " + scaledTile + " has size " + Arrays.toString( outputSize ) +
						", expected " + Arrays.toString( expectedSize ) + " at output scale " + Arrays.toString( scale ) );
			}
		}
	}

	/**
	 * Extends a spatial interval by the trailing (untiled) dimensions of the output.
	 */
	static Interval withExtraDimensions( final Interval spatialInterval, final long[] extraDimensions )
	{
		final int n = spatialInterval.numDimensions();
		final long[] min = new long[ n + extraDimensions.length ], max = new long[ n + extraDimensions.length ];
		for ( int d = 0; d < n; ++d )
		{
			min[ d ] = spatialInterval.min( d );
			max[ d ] = spatialInterval.max( d );
		}
		for ( int d = 0; d < extraDimensions.length; ++d )
			max[ n + d ] = extraDimensions[ d ] - 1;
		return new FinalInterval( min, max );
	}
}
