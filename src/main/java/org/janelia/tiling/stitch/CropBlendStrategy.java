package org.janelia.tiling.stitch;

import org.janelia.tiling.Tile;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.Interval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Writes every value as is, so that in overlaps the tile processed last (the one with the highest index) wins.
 */
public class CropBlendStrategy< T extends RealType< T > & NativeType< T > > extends BlendStrategy< T >
{
	private Cursor< T > outCursor;

	public CropBlendStrategy( final Dimensions dimensions, final T type )
	{
		super( dimensions, type );
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
		outCursor.get().set( value );
	}
}
