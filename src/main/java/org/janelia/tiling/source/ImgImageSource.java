package org.janelia.tiling.source;

import java.util.Arrays;

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * {@link ImageSource} backed by an imglib2 image: an array image, a cell image, or a lazily loaded cached cell image.
 * Reading a region creates a view and only accesses the pixels (or cells) that are covered by it.
 * <p>
 * The image is translated to the origin, so that tile coordinates always start at 0.
 * This source is serializable only if the wrapped image is. For distributed execution,
 * prefer a source that opens its storage on the worker.
 * </p>
 */
public class ImgImageSource< T extends NativeType< T > > implements ImageSource< T >
{
	private static final long serialVersionUID = 2890517236642710387L;

	private final RandomAccessibleInterval< T > img;

	public ImgImageSource( final RandomAccessibleInterval< T > img )
	{
		this.img = Views.isZeroMin( img ) ? img : Views.zeroMin( img );
	}

	@Override
	public long[] dimensions()
	{
		return Intervals.dimensionsAsLongArray( img );
	}

	@Override
	public int numDimensions()
	{
		return img.numDimensions();
	}

	@Override
	public T getType()
	{
		return Util.getTypeFromInterval( img ).createVariable();
	}

	@Override
	public RandomAccessibleInterval< T > readRegion( final Interval region )
	{
		if ( !Intervals.contains( img, region ) )
			throw new IllegalArgumentException( "Region min=" + Arrays.toString( Intervals.minAsLongArray( region ) ) + ", max=" + Arrays.toString( Intervals.maxAsLongArray( region ) ) +
					" is outside of the image of size " + Arrays.toString( dimensions() ) );

		return Views.interval( img, region );
	}
}
