package org.janelia.tiling.job;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Dense tile output. Its size may differ from the tile size if the tile function changes resolution,
 * and it may have extra trailing dimensions such as channels.
 */
public class ArrayOutput< T extends RealType< T > & NativeType< T > > extends TileOutput
{
	private static final long serialVersionUID = 2406387236047317521L;

	private final RandomAccessibleInterval< T > img;

	ArrayOutput( final RandomAccessibleInterval< T > img )
	{
		this.img = Views.isZeroMin( img ) ? img : Views.zeroMin( img );
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.ARRAY;
	}

	/**
	 * @return zero-min output image
	 */
	public RandomAccessibleInterval< T > getImg()
	{
		return img;
	}

	public T getType()
	{
		return Util.getTypeFromInterval( img );
	}

	@Override
	public String toString()
	{
		return "array of size " + Arrays.toString( Intervals.dimensionsAsLongArray( img ) );
	}
}
