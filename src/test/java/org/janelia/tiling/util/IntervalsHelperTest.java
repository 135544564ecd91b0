package org.janelia.tiling.util;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.FinalInterval;
import net.imglib2.FinalRealInterval;
import net.imglib2.Interval;
import net.imglib2.RealInterval;
import net.imglib2.RealPoint;
import net.imglib2.util.Intervals;

public class IntervalsHelperTest
{
	@Test
	public void intersectRealTest()
	{
		final FinalRealInterval a = new FinalRealInterval( new double[] { 0, 0 }, new double[] { 9.5, 9.5 } );
		final FinalRealInterval b = new FinalRealInterval( new double[] { 5, -3 }, new double[] { 12, 4.25 } );
		final RealInterval intersection = IntervalsHelper.intersectReal( a, b );
		Assert.assertArrayEquals( new double[] { 5, 0 }, Intervals.minAsDoubleArray( intersection ), 0 );
		Assert.assertArrayEquals( new double[] { 9.5, 4.25 }, Intervals.maxAsDoubleArray( intersection ), 0 );

		Assert.assertNull( IntervalsHelper.intersectReal( a, new FinalRealInterval( new double[] { 10, 0 }, new double[] { 12, 9 } ) ) );
	}

	@Test
	public void intersectionOverUnionTest()
	{
		final FinalRealInterval a = new FinalRealInterval( new double[] { 0, 0 }, new double[] { 10, 10 } );
		final FinalRealInterval b = new FinalRealInterval( new double[] { 5, 0 }, new double[] { 15, 10 } );
		Assert.assertEquals( 50. / 150, IntervalsHelper.intersectionOverUnion( a, b ), 1e-12 );
		Assert.assertEquals( 1, IntervalsHelper.intersectionOverUnion( a, a ), 0 );
		Assert.assertEquals( 0, IntervalsHelper.intersectionOverUnion( a, new FinalRealInterval( new double[] { 20, 20 }, new double[] { 30, 30 } ) ), 0 );

		final FinalRealInterval point = new FinalRealInterval( new double[] { 3, 3 }, new double[] { 3, 3 } );
		Assert.assertEquals( 1, IntervalsHelper.intersectionOverUnion( point, point ), 0 );
	}

	@Test
	public void containsRealTest()
	{
		// pixels 0..9 span the real range [0, 10]
		final Interval core = new FinalInterval( new long[] { 0, 0 }, new long[] { 9, 9 } );
		Assert.assertTrue( IntervalsHelper.containsReal( core, new FinalRealInterval( new double[] { 0, 2 }, new double[] { 10, 5.5 } ) ) );
		Assert.assertFalse( IntervalsHelper.containsReal( core, new FinalRealInterval( new double[] { 0, 2 }, new double[] { 10.5, 5.5 } ) ) );
		Assert.assertFalse( IntervalsHelper.containsReal( core, new FinalRealInterval( new double[] { -0.1, 2 }, new double[] { 3, 5.5 } ) ) );
	}

	@Test
	public void distanceTest()
	{
		final Interval interval = new FinalInterval( new long[] { 0, 0 }, new long[] { 9, 9 } );
		Assert.assertEquals( 0, IntervalsHelper.distance( new RealPoint( 5.5, 10 ), interval ), 0 );
		Assert.assertEquals( 2, IntervalsHelper.distance( new RealPoint( 5, 12 ), interval ), 1e-12 );
		Assert.assertEquals( 5, IntervalsHelper.distance( new RealPoint( -3, -4 ), interval ), 1e-12 );
	}
}
