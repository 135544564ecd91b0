package org.janelia.tiling.util;

import net.imglib2.FinalRealInterval;
import net.imglib2.Interval;
import net.imglib2.RealInterval;
import net.imglib2.RealLocalizable;

/**
 * Real-valued interval arithmetic for comparing detections and points with pixel intervals.
 */
public class IntervalsHelper
{
	/**
	 * Compute the intersection of two real intervals.
	 *
	 * @return intersection of input intervals, or null if they don't intersect
	 */
	public static FinalRealInterval intersectReal( final RealInterval intervalA, final RealInterval intervalB )
	{
		assert intervalA.numDimensions() == intervalB.numDimensions();

		final int n = intervalA.numDimensions();
		final double[] min = new double[ n ];
		final double[] max = new double[ n ];
		boolean intersects = true;
		for ( int d = 0; d < n; ++d )
		{
			min[ d ] = Math.max( intervalA.realMin( d ), intervalB.realMin( d ) );
			max[ d ] = Math.min( intervalA.realMax( d ), intervalB.realMax( d ) );
			intersects &= min[ d ] <= max[ d ];
		}
		return intersects ? new FinalRealInterval( min, max ) : null;
	}

	/**
	 * Returns true if the real interval lies entirely within the pixel interval
	 * (the pixel interval is treated as the closed range [min, max + 1] in each dimension).
	 */
	public static boolean containsReal( final Interval container, final RealInterval interval )
	{
		for ( int d = 0; d < container.numDimensions(); ++d )
			if ( interval.realMin( d ) < container.min( d ) || interval.realMax( d ) > container.max( d ) + 1 )
				return false;
		return true;
	}

	/**
	 * Euclidean distance from a point to a pixel interval (treated as the closed range [min, max + 1]),
	 * zero if the point is inside.
	 */
	public static double distance( final RealLocalizable point, final Interval interval )
	{
		double sumSq = 0;
		for ( int d = 0; d < interval.numDimensions(); ++d )
		{
			final double pos = point.getDoublePosition( d );
			final double diff;
			if ( pos < interval.min( d ) )
				diff = interval.min( d ) - pos;
			else if ( pos > interval.max( d ) + 1 )
				diff = pos - ( interval.max( d ) + 1 );
			else
				diff = 0;
			sumSq += diff * diff;
		}
		return Math.sqrt( sumSq );
	}

	public static double volume( final RealInterval interval )
	{
		double volume = 1;
		for ( int d = 0; d < interval.numDimensions(); ++d )
			volume *= Math.max( 0, interval.realMax( d ) - interval.realMin( d ) );
		return volume;
	}

	/**
	 * Intersection over union of two real intervals. Degenerate (zero-volume) intervals have IoU 0
	 * unless they are identical, in which case it is 1.
	 */
	public static double intersectionOverUnion( final RealInterval intervalA, final RealInterval intervalB )
	{
		final RealInterval intersection = intersectReal( intervalA, intervalB );
		if ( intersection == null )
			return 0;

		final double intersectionVolume = volume( intersection );
		final double unionVolume = volume( intervalA ) + volume( intervalB ) - intersectionVolume;
		if ( unionVolume <= 0 )
			return equalsReal( intervalA, intervalB ) ? 1 : 0;
		return intersectionVolume / unionVolume;
	}

	public static boolean equalsReal( final RealInterval intervalA, final RealInterval intervalB )
	{
		if ( intervalA.numDimensions() != intervalB.numDimensions() )
			return false;
		for ( int d = 0; d < intervalA.numDimensions(); ++d )
			if ( intervalA.realMin( d ) != intervalB.realMin( d ) || intervalA.realMax( d ) != intervalB.realMax( d ) )
				return false;
		return true;
	}
}
