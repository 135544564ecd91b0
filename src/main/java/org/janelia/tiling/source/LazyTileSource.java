package org.janelia.tiling.source;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Exposes tile-shaped reads of an {@link ImageSource} laid out by a {@link TilePartition}.
 * <p>
 * The source may have more dimensions than the partition, e.g. channels or z-planes after the tiled dimensions.
 * Such extra dimensions are not tiled and are always read in full.
 * Every read returns a fresh zero-min copy, so that tile computations never share mutable state with the source or with each other.
 * </p>
 */
public class LazyTileSource< T extends NativeType< T > > implements Serializable
{
	private static final long serialVersionUID = -2128874617051722950L;

	private final ImageSource< T > source;
	private final TilePartition partition;

	public LazyTileSource( final ImageSource< T > source, final TilePartition partition )
	{
		final long[] sourceDimensions = source.dimensions();
		final long[] imageShape = partition.getImageShape();
		if ( sourceDimensions.length < imageShape.length )
			throw new IllegalArgumentException( "Source of dimensionality " + sourceDimensions.length + " cannot be read by a partition of dimensionality " + imageShape.length );

		for ( int d = 0; d < imageShape.length; ++d )
			if ( sourceDimensions[ d ] != imageShape[ d ] )
				throw new IllegalArgumentException( "Source size " + Arrays.toString( sourceDimensions ) + " does not match the partitioned image shape " + Arrays.toString( imageShape ) );

		this.source = source;
		this.partition = partition;
	}

	public ImageSource< T > getSource()
	{
		return source;
	}

	public TilePartition getPartition()
	{
		return partition;
	}

	public T getType()
	{
		return source.getType();
	}

	/**
	 * Region of the source covered by the tile, including the untiled extra dimensions.
	 */
	public Interval getRegion( final Tile tile )
	{
		if ( !partition.belongs( tile ) )
			throw new IllegalArgumentException( tile + " does not belong to " + partition );

		final long[] sourceDimensions = source.dimensions();
		final long[] min = new long[ sourceDimensions.length ], max = new long[ sourceDimensions.length ];
		for ( int d = 0; d < sourceDimensions.length; ++d )
		{
			if ( d < tile.numDimensions() )
			{
				min[ d ] = tile.min( d );
				max[ d ] = tile.max( d );
			}
			else
			{
				min[ d ] = 0;
				max[ d ] = sourceDimensions[ d ] - 1;
			}
		}
		return new FinalInterval( min, max );
	}

	/**
	 * Reads the pixels covered by the tile into a new zero-min image.
	 */
	public RandomAccessibleInterval< T > read( final Tile tile ) throws Exception
	{
		final Interval region = getRegion( tile );
		final RandomAccessibleInterval< T > regionImg = source.readRegion( region );
		if ( !Intervals.equals( regionImg, region ) )
			throw new IllegalStateException( "Source returned an image of size " + Arrays.toString( Intervals.dimensionsAsLongArray( regionImg ) ) +
					" for the region of size " + Arrays.toString( Intervals.dimensionsAsLongArray( region ) ) );

		final ArrayImg< T, ? > tileImg = new ArrayImgFactory<>( source.getType() ).create( Intervals.dimensionsAsLongArray( region ) );
		final Cursor< T > regionCursor = Views.flatIterable( regionImg ).cursor();
		final Cursor< T > tileCursor = tileImg.cursor();
		while ( tileCursor.hasNext() )
			tileCursor.next().set( regionCursor.next() );
		return tileImg;
	}
}
