package org.janelia.tiling.stitch;

import org.janelia.tiling.Tile;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.Interval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Keeps the elementwise maximum (or minimum) of all tile values at each pixel.
 */
public class ExtremumBlendStrategy< T extends RealType< T > & NativeType< T > > extends BlendStrategy< T >
{
	private final boolean max;
	private Cursor< T > outCursor;

	public ExtremumBlendStrategy( final Dimensions dimensions, final T type, final boolean max )
	{
		super( dimensions, type );
		this.max = max;

		// start from the extreme value of the type so that the first tile always wins
		final double initialValue = max ? type.getMinValue() : type.getMaxValue();
		for ( final T value : Views.flatIterable( out ) )
			value.setReal( initialValue );
	}

	@Override
	public void setCursors( final Interval targetInterval )
	{
		outCursor = Views.flatIterable( Views.interval( out, targetInterval ) ).cursor();
	}

	@Override
	public void moveCursorsForward()
	{
		outCursor.fwd();
	}

	@Override
	public void updateValue( final Tile tile, final long[] position, final T value )
	{
		final T current = outCursor.get();
		if ( max ? value.compareTo( current ) > 0 : value.compareTo( current ) < 0 )
			current.set( value );
	}
}
