package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingSpec;
import org.janelia.tiling.job.Detection;
import org.janelia.tiling.job.TileOutput;
import org.janelia.tiling.job.TileResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ObjectMergePolicyTest
{
	private TilePartition partition;
	private List< List< Detection > > detections;

	@Before
	public void setUp()
	{
		// tile 0 covers [0, 59] x [0, 59] with core [0, 39] x [0, 39], tile 2 covers [40, 99] x [0, 59]
		partition = TilePartition.build( TilingSpec.absolute( new long[] { 100, 100 }, new long[] { 60, 60 }, 20, 20 ) );
		detections = new ArrayList<>();
		for ( int i = 0; i < partition.numTiles(); ++i )
			detections.add( new ArrayList<>() );
	}

	@Test
	public void testCoreDetectionsAreKept() throws Exception
	{
		final double[] scores = new double[] { 0.1, 0.2, 0.3, 0.4 };
		for ( int i = 0; i < partition.numTiles(); ++i )
			detections.get( i ).add( box( 25, 25, 30, 30, scores[ i ] ) );

		final List< Detection > merged = stitch( TilingConfig.defaults() );
		Assert.assertEquals( 4, merged.size() );
		Assert.assertEquals( box( 25, 25, 30, 30, 0.1 ), merged.get( 0 ) );
		Assert.assertEquals( box( 25, 65, 30, 70, 0.2 ), merged.get( 1 ) );
		Assert.assertEquals( box( 65, 25, 70, 30, 0.3 ), merged.get( 2 ) );
		Assert.assertEquals( box( 65, 65, 70, 70, 0.4 ), merged.get( 3 ) );
	}

	@Test
	public void testDropBorderOutput() throws Exception
	{
		// stitch intervals of tiles 0 and 2 are [0, 49] and [50, 99] along the first dimension
		detections.get( 0 ).add( box( 44, 10, 48, 14, 0.5 ) );
		detections.get( 0 ).add( box( 52, 30, 56, 34, 0.6 ) );
		detections.get( 2 ).add( box( 0, 10, 4, 14, 0.7 ) );
		detections.get( 2 ).add( box( 12, 30, 16, 34, 0.8 ) );

		final List< Detection > merged = stitch( TilingConfig.builder().dropBorderOutput( true ).build() );
		Assert.assertEquals( Arrays.asList( box( 44, 10, 48, 14, 0.5 ), box( 52, 30, 56, 34, 0.8 ) ), merged );

		Assert.assertEquals( 3, stitch( TilingConfig.defaults() ).size() );
	}

	@Test
	public void testDuplicateKeepsHigherScore() throws Exception
	{
		detections.get( 0 ).add( box( 45, 10, 55, 20, 0.8 ) );
		detections.get( 2 ).add( box( 5, 10, 15, 20, 0.9 ) );

		final List< Detection > merged = stitch( TilingConfig.defaults() );
		Assert.assertEquals( Collections.singletonList( box( 45, 10, 55, 20, 0.9 ) ), merged );
	}

	@Test
	public void testTieKeepsLowerTileIndex() throws Exception
	{
		detections.get( 0 ).add( box( 45, 10, 55, 20, 0.8 ) );
		detections.get( 2 ).add( box( 6, 10, 16, 20, 0.8 ) );

		final List< Detection > merged = stitch( TilingConfig.defaults() );
		Assert.assertEquals( 1, merged.size() );
		Assert.assertEquals( 45, merged.get( 0 ).realMin( 0 ), 0 );

		// IoU of the two boxes is 90 / 110
		final List< Detection > mergedWithHigherThreshold = stitch( TilingConfig.builder().dedupThreshold( 0.9 ).build() );
		Assert.assertEquals( 2, mergedWithHigherThreshold.size() );
	}

	@Test
	public void testDistinctObjectsInOverlap() throws Exception
	{
		detections.get( 0 ).add( box( 42, 5, 44, 7, 0.5 ) );
		detections.get( 0 ).add( box( 52, 5, 54, 7, 0.5 ) );
		detections.get( 2 ).add( box( 12, 5, 14, 7, 0.6 ) );

		final List< Detection > merged = stitch( TilingConfig.defaults() );
		Assert.assertEquals( Arrays.asList( box( 42, 5, 44, 7, 0.5 ), box( 52, 5, 54, 7, 0.6 ) ), merged );
	}

	@Test
	public void testDuplicatesWithinTile() throws Exception
	{
		detections.get( 0 ).add( box( 45, 11, 55, 21, 0.5 ) );
		detections.get( 0 ).add( box( 45, 10, 55, 20, 0.9 ) );

		final List< Detection > merged = stitch( TilingConfig.defaults() );
		Assert.assertEquals( Collections.singletonList( box( 45, 10, 55, 20, 0.9 ) ), merged );
	}

	@Test
	public void testDistanceMetric() throws Exception
	{
		detections.get( 0 ).add( box( 45, 10, 55, 20, 0.9 ) );
		detections.get( 2 ).add( box( 5.5, 10, 15.5, 20, 0.7 ) );
		detections.get( 2 ).add( box( 8, 10, 18, 20, 0.6 ) );

		final TilingConfig config = TilingConfig.builder().dedupMetric( DedupMetric.DISTANCE ).build();
		final List< Detection > merged = stitch( config );
		Assert.assertEquals( Arrays.asList( box( 45, 10, 55, 20, 0.9 ), box( 48, 10, 58, 20, 0.6 ) ), merged );

		final List< Detection > mergedWithLargerRadius = stitch( TilingConfig.builder().dedupMetric( DedupMetric.DISTANCE ).dedupThreshold( 5 ).build() );
		Assert.assertEquals( Collections.singletonList( box( 45, 10, 55, 20, 0.9 ) ), mergedWithLargerRadius );
	}

	@Test
	public void testOrderIndependence() throws Exception
	{
		detections.get( 0 ).add( box( 45, 10, 55, 20, 0.8 ) );
		detections.get( 1 ).add( box( 10, 10, 20, 20, 0.3 ) );
		detections.get( 2 ).add( box( 6, 10, 16, 20, 0.8 ) );
		detections.get( 3 ).add( box( 1, 1, 3, 3, 0.7 ) );

		final List< TileResult > results = results();
		final List< Detection > expected = new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getObjects();

		Collections.reverse( results );
		Assert.assertEquals( expected, new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getObjects() );
	}

	private List< Detection > stitch( final TilingConfig config ) throws Exception
	{
		return new StitchEngine().stitch( partition, results(), config ).getObjects();
	}

	private List< TileResult > results()
	{
		final List< TileResult > results = new ArrayList<>();
		for ( int i = 0; i < partition.numTiles(); ++i )
			results.add( new TileResult( partition.getTile( i ), TileOutput.objects( detections.get( i ) ) ) );
		return results;
	}

	private static Detection box( final double minX, final double minY, final double maxX, final double maxY, final double score )
	{
		return new Detection( new double[] { minX, minY }, new double[] { maxX, maxY }, score );
	}
}
