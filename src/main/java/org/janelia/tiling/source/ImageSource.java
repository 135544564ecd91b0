package org.janelia.tiling.source;

import java.io.Serializable;

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * Addressable image of known shape and pixel type, possibly chunked or stored out of core.
 * The tiling engine never assumes that the whole image is resident in memory and only requests the regions it needs.
 * <p>
 * Implementations that are used with a distributed executor are shipped to the workers and thus have to be serializable.
 * </p>
 */
public interface ImageSource< T extends NativeType< T > > extends Serializable
{
	/**
	 * @return image size in every dimension
	 */
	public long[] dimensions();

	public default int numDimensions()
	{
		return dimensions().length;
	}

	/**
	 * @return an instance of the pixel type
	 */
	public T getType();

	/**
	 * Returns the pixels within the given region.
	 * The returned image is defined on {@code region}, i.e. it is not translated to the origin.
	 *
	 * @param region
	 * 			Region in image coordinates, must be contained in the image
	 */
	public RandomAccessibleInterval< T > readRegion( final Interval region ) throws Exception;
}
