package org.janelia.tiling;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Image shape together with the requested tile shape and overlap.
 * Serves as the cache key for {@link TilePartition}s.
 */
public class TilingSpec implements Serializable
{
	private static final long serialVersionUID = 7330417744963180265L;

	private final long[] imageShape;
	private final long[] tileShape;
	private final double[] overlap;
	private final OverlapMode overlapMode;

	public TilingSpec( final long[] imageShape, final long[] tileShape, final double[] overlap, final OverlapMode overlapMode )
	{
		if ( imageShape == null || tileShape == null || overlap == null || overlapMode == null )
			throw new InvalidTileSpecException( "image shape, tile shape, overlap and overlap mode are required" );
		this.imageShape = imageShape.clone();
		this.tileShape = tileShape.clone();
		this.overlap = overlap.clone();
		this.overlapMode = overlapMode;
	}

	public static TilingSpec absolute( final long[] imageShape, final long[] tileShape, final long... overlap )
	{
		return new TilingSpec( imageShape, tileShape, Arrays.stream( overlap ).asDoubleStream().toArray(), OverlapMode.ABSOLUTE );
	}

	public static TilingSpec fraction( final long[] imageShape, final long[] tileShape, final double... overlap )
	{
		return new TilingSpec( imageShape, tileShape, overlap, OverlapMode.FRACTION );
	}

	public int numDimensions()
	{
		return imageShape.length;
	}

	public long[] getImageShape()
	{
		return imageShape.clone();
	}

	public long[] getTileShape()
	{
		return tileShape.clone();
	}

	public double[] getOverlap()
	{
		return overlap.clone();
	}

	public OverlapMode getOverlapMode()
	{
		return overlapMode;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof TilingSpec ) )
			return false;
		final TilingSpec other = ( TilingSpec ) obj;
		return Arrays.equals( imageShape, other.imageShape )
				&& Arrays.equals( tileShape, other.tileShape )
				&& Arrays.equals( overlap, other.overlap )
				&& overlapMode == other.overlapMode;
	}

	@Override
	public int hashCode()
	{
		int result = Arrays.hashCode( imageShape );
		result = 31 * result + Arrays.hashCode( tileShape );
		result = 31 * result + Arrays.hashCode( overlap );
		result = 31 * result + overlapMode.hashCode();
		return result;
	}

	@Override
	public String toString()
	{
		return "shape=" + Arrays.toString( imageShape ) +
				", tile=" + Arrays.toString( tileShape ) +
				", overlap=" + Arrays.toString( overlap ) + " (" + overlapMode + ")";
	}
}
