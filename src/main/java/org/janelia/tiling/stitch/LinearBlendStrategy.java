package org.janelia.tiling.stitch;

import org.janelia.tiling.Tile;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Blends overlapping tiles with weights that ramp linearly across each overlap margin.
 * <p>
 * The weight of a tile is the product over dimensions of its ramps, {@code (x + 0.5) / m} within the lower margin
 * and {@code (size - x - 0.5) / m} within the upper margin, and 1 elsewhere, so that the weights of two
 * neighboring tiles sum to 1 across their shared margin. Values and weights are accumulated in double buffers,
 * and every pixel is normalized by the sum of its weights, which keeps the weights summing to 1
 * regardless of how many tiles contribute.
 * </p>
 */
public class LinearBlendStrategy< T extends RealType< T > & NativeType< T > > extends BlendStrategy< T >
{
	private final RandomAccessibleInterval< DoubleType > weights;
	private final RandomAccessibleInterval< DoubleType > values;

	private Cursor< DoubleType > weightsCursor;
	private Cursor< DoubleType > valuesCursor;
	private boolean normalized;

	public LinearBlendStrategy( final Dimensions dimensions, final T type )
	{
		super( dimensions, type );
		this.weights = createImg( dimensions, new DoubleType() );
		this.values = createImg( dimensions, new DoubleType() );
	}

	/**
	 * Weight of the tile's contribution at the given position, in (0, 1].
	 * Trailing dimensions beyond the dimensionality of the tile are ignored.
	 */
	public static double getBlendingWeight( final Tile tile, final long[] position )
	{
		double weight = 1;
		for ( int d = 0; d < tile.numDimensions(); ++d )
		{
			final long x = position[ d ] - tile.min( d );
			final long size = tile.dimension( d );
			double axisWeight = 1;

			final long lowerMargin = tile.getOverlapMin( d );
			if ( lowerMargin > 0 && x < lowerMargin )
				axisWeight = Math.min( axisWeight, ( x + 0.5 ) / lowerMargin );

			final long upperMargin = tile.getOverlapMax( d );
			if ( upperMargin > 0 && x >= size - upperMargin )
				axisWeight = Math.min( axisWeight, ( size - x - 0.5 ) / upperMargin );

			weight *= axisWeight;
		}
		return weight;
	}

	@Override
	public void setCursors( final Interval targetInterval )
	{
		weightsCursor = Views.flatIterable( Views.interval( weights, targetInterval ) ).cursor();
		valuesCursor = Views.flatIterable( Views.interval( values, targetInterval ) ).cursor();
	}

	@Override
	public void moveCursorsForward()
	{
		weightsCursor.fwd();
		valuesCursor.fwd();
	}

	@Override
	public void updateValue( final Tile tile, final long[] position, final T value )
	{
		if ( normalized )
			throw new IllegalStateException( "Populating out image after it has been filled" );

		final double weight = getBlendingWeight( tile, position );
		weightsCursor.get().setReal( weightsCursor.get().getRealDouble() + weight );
		valuesCursor.get().setReal( valuesCursor.get().getRealDouble() + value.getRealDouble() * weight );
	}

	@Override
	public RandomAccessibleInterval< T > getResult()
	{
		if ( normalized )
			return out;

		setCursors( out );
		final Cursor< T > outCursor = Views.flatIterable( out ).cursor();
		while ( outCursor.hasNext() )
		{
			final double weight = weightsCursor.next().getRealDouble();
			final double value = valuesCursor.next().getRealDouble();
			outCursor.next().setReal( weight == 0 ? 0 : value / weight );
		}
		normalized = true;
		return out;
	}
}
