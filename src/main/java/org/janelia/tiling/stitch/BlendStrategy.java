package org.janelia.tiling.stitch;

import org.janelia.tiling.Tile;

import net.imglib2.Dimensions;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.img.cell.CellImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;

/**
 * Combines the values of overlapping tile outputs into the stitched image.
 * <p>
 * For every tile, the caller sets the cursors to the region written by the tile and then,
 * for every pixel of the region in flat iteration order, moves the cursors forward and passes the tile value.
 * </p>
 */
public abstract class BlendStrategy< T extends RealType< T > & NativeType< T > >
{
	protected final RandomAccessibleInterval< T > out;

	public BlendStrategy( final Dimensions dimensions, final T type )
	{
		this.out = createImg( dimensions, type );
	}

	public static < T extends RealType< T > & NativeType< T > > BlendStrategy< T > create(
			final BlendMode mode,
			final Dimensions dimensions,
			final T type )
	{
		switch ( mode )
		{
		case CROP:
			return new CropBlendStrategy<>( dimensions, type );
		case LINEAR:
			return new LinearBlendStrategy<>( dimensions, type );
		case MAX:
			return new ExtremumBlendStrategy<>( dimensions, type, true );
		case MIN:
			return new ExtremumBlendStrategy<>( dimensions, type, false );
		default:
			throw new IllegalArgumentException( "Unknown blend mode " + mode );
		}
	}

	/**
	 * Allocates an array image, or a cell image if the size exceeds the capacity of a single array.
	 */
	public static < S extends NativeType< S > > RandomAccessibleInterval< S > createImg( final Dimensions dimensions, final S type )
	{
		final long[] dims = Intervals.dimensionsAsLongArray( dimensions );
		if ( Intervals.numElements( dims ) < Integer.MAX_VALUE )
			return new ArrayImgFactory<>( type.createVariable() ).create( dims );
		else
			return new CellImgFactory<>( type.createVariable() ).create( dims );
	}

	/**
	 * @return the stitched image, must be called after all tiles have been processed
	 */
	public RandomAccessibleInterval< T > getResult()
	{
		return out;
	}

	public abstract void setCursors( final Interval targetInterval );
	public abstract void moveCursorsForward();

	/**
	 * @param tile
	 * 			tile in the output space that contributes the value
	 * @param position
	 * 			position of the current pixel in the output image
	 */
	public abstract void updateValue( final Tile tile, final long[] position, final T value );
}
