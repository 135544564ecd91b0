package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.List;

import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingSpec;
import org.janelia.tiling.job.CoordinatesOutput;
import org.janelia.tiling.job.TileOutput;
import org.janelia.tiling.job.TileResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.RealPoint;

public class CoordinateMergePolicyTest
{
	private TilePartition partition;

	@Before
	public void setUp()
	{
		// tiles [0, 59] and [40, 99] with cores [0, 39] and [60, 99]
		partition = TilePartition.build( TilingSpec.absolute( new long[] { 100 }, new long[] { 60 }, 20 ) );
	}

	@Test
	public void testDuplicateKeepsPointFurtherFromTileEdge() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 5, 50 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 10.3, 50 ) ) ) );

		final List< RealPoint > merged = new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getPoints();
		assertPositions( new double[] { 5, 50.3, 90 }, merged );
	}

	@Test
	public void testPointsOnCoreBoundaryAreKept() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 40 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 0.5 ) ) ) );

		final List< RealPoint > merged = new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getPoints();
		assertPositions( new double[] { 40 }, merged );
	}

	@Test
	public void testCloseNeighborsWithinTileAreKept() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 45, 45.5 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( new ArrayList<>() ) ) );

		final List< RealPoint > merged = new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getPoints();
		assertPositions( new double[] { 45, 45.5 }, merged );
	}

	@Test
	public void testThreshold() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 53 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 15 ) ) ) );

		assertPositions( new double[] { 53, 55 }, new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getPoints() );

		// the point of the second tile is 5 pixels from its core, the one of the first tile is 13 pixels from its core
		final TilingConfig config = TilingConfig.builder().dedupThreshold( 3 ).build();
		assertPositions( new double[] { 55 }, new StitchEngine().stitch( partition, results, config ).getPoints() );
	}

	@Test
	public void testPointsAtThresholdDistanceAreKept() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 50 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 11 ) ) ) );

		assertPositions( new double[] { 50, 51 }, new StitchEngine().stitch( partition, results, TilingConfig.defaults() ).getPoints() );
	}

	@Test
	public void testDropBorderOutput() throws Exception
	{
		// stitch intervals are [0, 49] and [50, 99]
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 45, 50, 52 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 5, 10, 15 ) ) ) );

		final TilingConfig config = TilingConfig.builder().dropBorderOutput( true ).build();
		assertPositions( new double[] { 45, 50, 55 }, new StitchEngine().stitch( partition, results, config ).getPoints() );
	}

	@Test
	public void testTilePointsAreNotModified() throws Exception
	{
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 5 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 30 ) ) ) );

		final StitchEngine engine = new StitchEngine();
		assertPositions( new double[] { 5, 70 }, engine.stitch( partition, results, TilingConfig.defaults() ).getPoints() );
		assertPositions( new double[] { 5, 70 }, engine.stitch( partition, results, TilingConfig.defaults() ).getPoints() );
		assertPositions( new double[] { 30 }, ( ( CoordinatesOutput ) results.get( 1 ).getOutput() ).getPoints() );
	}

	@Test
	public void testOutputScale() throws Exception
	{
		// at scale 0.5 the tiles are [0, 29] and [20, 49]
		final List< TileResult > results = new ArrayList<>();
		results.add( new TileResult( partition.getTile( 0 ), TileOutput.coordinates( points( 2, 25 ) ) ) );
		results.add( new TileResult( partition.getTile( 1 ), TileOutput.coordinates( points( 5, 20 ) ) ) );

		final TilingConfig config = TilingConfig.builder().outputScale( 0.5 ).build();
		assertPositions( new double[] { 2, 25, 40 }, new StitchEngine().stitch( partition, results, config ).getPoints() );
	}

	private static List< RealPoint > points( final double... positions )
	{
		final List< RealPoint > points = new ArrayList<>();
		for ( final double position : positions )
			points.add( new RealPoint( position ) );
		return points;
	}

	private static void assertPositions( final double[] expected, final List< RealPoint > actual )
	{
		Assert.assertEquals( expected.length, actual.size() );
		for ( int i = 0; i < expected.length; ++i )
			Assert.assertEquals( expected[ i ], actual.get( i ).getDoublePosition( 0 ), 1e-9 );
	}
}
