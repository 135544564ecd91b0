package org.janelia.tiling;

import java.io.Serializable;
import java.util.Arrays;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.Positionable;
import net.imglib2.RealLocalizable;
import net.imglib2.RealPositionable;

/**
 * Immutable descriptor of a single tile within a {@link TilePartition}.
 * <p>
 * The tile is an {@link Interval} in the coordinate space of the untiled image.
 * Besides its bounds it carries provenance needed for stitching: its index in the grid,
 * the width of the region shared with the neighbor on each side, and whether each side touches the image border.
 * </p>
 */
public class Tile implements Interval, Serializable
{
	private static final long serialVersionUID = -3457108520843361372L;

	private final int index;
	private final long[] gridPosition;
	private final long[] min, max;
	private final long[] overlapMin, overlapMax;
	private final boolean[] borderMin, borderMax;

	Tile(
			final int index,
			final long[] gridPosition,
			final long[] min,
			final long[] max,
			final long[] overlapMin,
			final long[] overlapMax,
			final boolean[] borderMin,
			final boolean[] borderMax )
	{
		this.index = index;
		this.gridPosition = gridPosition.clone();
		this.min = min.clone();
		this.max = max.clone();
		this.overlapMin = overlapMin.clone();
		this.overlapMax = overlapMax.clone();
		this.borderMin = borderMin.clone();
		this.borderMax = borderMax.clone();
	}

	/**
	 * Position of the tile in row-major grid order.
	 */
	public int getIndex()
	{
		return index;
	}

	public long[] getGridPosition()
	{
		return gridPosition.clone();
	}

	public long getGridPosition( final int d )
	{
		return gridPosition[ d ];
	}

	/**
	 * Width of the region shared with the preceding neighbor in dimension {@code d} (0 on the image border).
	 */
	public long getOverlapMin( final int d )
	{
		return overlapMin[ d ];
	}

	/**
	 * Width of the region shared with the following neighbor in dimension {@code d} (0 on the image border).
	 */
	public long getOverlapMax( final int d )
	{
		return overlapMax[ d ];
	}

	public boolean isBorderMin( final int d )
	{
		return borderMin[ d ];
	}

	public boolean isBorderMax( final int d )
	{
		return borderMax[ d ];
	}

	public boolean isBorderTile()
	{
		for ( int d = 0; d < numDimensions(); ++d )
			if ( borderMin[ d ] || borderMax[ d ] )
				return true;
		return false;
	}

	/**
	 * Returns the part of the tile that is not shared with any neighbor,
	 * i.e. the tile shrunk by the full overlap margin on every non-border side.
	 *
	 * @return core interval, or null if the overlaps on both sides leave nothing unshared
	 */
	public FinalInterval getCoreInterval()
	{
		final long[] coreMin = new long[ numDimensions() ], coreMax = new long[ numDimensions() ];
		for ( int d = 0; d < numDimensions(); ++d )
		{
			coreMin[ d ] = min[ d ] + overlapMin[ d ];
			coreMax[ d ] = max[ d ] - overlapMax[ d ];
			if ( coreMin[ d ] > coreMax[ d ] )
				return null;
		}
		return new FinalInterval( coreMin, coreMax );
	}

	/**
	 * Returns the part of the tile that it contributes when overlaps are split down the middle,
	 * i.e. the tile shrunk by half the overlap margin on every non-border side.
	 * The lower side gives up {@code floor(m / 2)} pixels and the upper side {@code m - floor(m / 2)},
	 * so that the stitch intervals of all tiles cover the image exactly once.
	 */
	public FinalInterval getStitchInterval()
	{
		final long[] stitchMin = new long[ numDimensions() ], stitchMax = new long[ numDimensions() ];
		for ( int d = 0; d < numDimensions(); ++d )
		{
			stitchMin[ d ] = min[ d ] + overlapMin[ d ] / 2;
			stitchMax[ d ] = max[ d ] - ( overlapMax[ d ] - overlapMax[ d ] / 2 );
		}
		return new FinalInterval( stitchMin, stitchMax );
	}

	/**
	 * Checks if a real position in image coordinates falls into the stitch interval.
	 * Pixel {@code x} spans {@code [x, x + 1)}, so a position on a seam belongs to exactly one tile.
	 * Border sides do not limit the position.
	 */
	public boolean isInStitchInterval( final RealLocalizable position )
	{
		final FinalInterval stitchInterval = getStitchInterval();
		for ( int d = 0; d < numDimensions(); ++d )
		{
			final double x = position.getDoublePosition( d );
			if ( !borderMin[ d ] && x < stitchInterval.min( d ) )
				return false;
			if ( !borderMax[ d ] && x >= stitchInterval.max( d ) + 1 )
				return false;
		}
		return true;
	}

	@Override
	public int numDimensions()
	{
		return min.length;
	}

	@Override
	public long min( final int d )
	{
		return min[ d ];
	}

	@Override
	public void min( final long[] m )
	{
		for ( int d = 0; d < min.length; ++d )
			m[ d ] = min[ d ];
	}

	@Override
	public void min( final Positionable m )
	{
		m.setPosition( min );
	}

	@Override
	public long max( final int d )
	{
		return max[ d ];
	}

	@Override
	public void max( final long[] m )
	{
		for ( int d = 0; d < max.length; ++d )
			m[ d ] = max[ d ];
	}

	@Override
	public void max( final Positionable m )
	{
		m.setPosition( max );
	}

	@Override
	public double realMin( final int d )
	{
		return min[ d ];
	}

	@Override
	public void realMin( final double[] m )
	{
		for ( int d = 0; d < min.length; ++d )
			m[ d ] = min[ d ];
	}

	@Override
	public void realMin( final RealPositionable m )
	{
		m.setPosition( min );
	}

	@Override
	public double realMax( final int d )
	{
		return max[ d ];
	}

	@Override
	public void realMax( final double[] m )
	{
		for ( int d = 0; d < max.length; ++d )
			m[ d ] = max[ d ];
	}

	@Override
	public void realMax( final RealPositionable m )
	{
		m.setPosition( max );
	}

	@Override
	public void dimensions( final long[] dimensions )
	{
		for ( int d = 0; d < min.length; ++d )
			dimensions[ d ] = max[ d ] - min[ d ] + 1;
	}

	@Override
	public long dimension( final int d )
	{
		return max[ d ] - min[ d ] + 1;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Tile ) )
			return false;
		final Tile other = ( Tile ) obj;
		return index == other.index
				&& Arrays.equals( gridPosition, other.gridPosition )
				&& Arrays.equals( min, other.min )
				&& Arrays.equals( max, other.max )
				&& Arrays.equals( overlapMin, other.overlapMin )
				&& Arrays.equals( overlapMax, other.overlapMax )
				&& Arrays.equals( borderMin, other.borderMin )
				&& Arrays.equals( borderMax, other.borderMax );
	}

	@Override
	public int hashCode()
	{
		int result = index;
		result = 31 * result + Arrays.hashCode( gridPosition );
		result = 31 * result + Arrays.hashCode( min );
		result = 31 * result + Arrays.hashCode( max );
		return result;
	}

	@Override
	public String toString()
	{
		return "tile " + index + " at grid " + Arrays.toString( gridPosition ) + ": min=" + Arrays.toString( min ) + ", max=" + Arrays.toString( max );
	}
}
