package org.janelia.tiling;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.janelia.tiling.stitch.BlendMode;
import org.janelia.tiling.stitch.DedupMetric;
import org.junit.Assert;
import org.junit.Test;

public class TilingConfigTest
{
	@Test
	public void testDefaults()
	{
		final TilingConfig config = TilingConfig.defaults();
		Assert.assertEquals( OverlapMode.ABSOLUTE, config.getOverlapMode() );
		Assert.assertEquals( BlendMode.CROP, config.getBlendMode() );
		Assert.assertEquals( DedupMetric.IOU, config.getDedupMetric() );
		Assert.assertFalse( config.isDropBorderOutput() );
		Assert.assertFalse( config.isBatchAxis() );
		Assert.assertFalse( config.hasOutputScale() );
		Assert.assertNull( config.getOutputScale( 2 ) );
		Assert.assertEquals( 1, config.getBatchSize() );
		Assert.assertEquals( 0.7, config.getDedupThreshold( 0.7 ), 0 );
	}

	@Test
	public void testFromMap()
	{
		final Map< String, Object > options = new HashMap<>();
		options.put( "overlap_mode", "fraction" );
		options.put( "blend", "linear" );
		options.put( "output_scale", Arrays.asList( 0.5, 0.25 ) );
		options.put( "dedup_threshold", 0.3 );
		options.put( "batch_axis", true );
		options.put( "batch_size", 4 );
		options.put( "pad_final_batch", "true" );

		final TilingConfig config = TilingConfig.fromMap( options );
		Assert.assertEquals( OverlapMode.FRACTION, config.getOverlapMode() );
		Assert.assertEquals( BlendMode.LINEAR, config.getBlendMode() );
		Assert.assertArrayEquals( new double[] { 0.5, 0.25 }, config.getOutputScale( 2 ), 0 );
		Assert.assertEquals( 0.3, config.getDedupThreshold( 0.5 ), 0 );
		Assert.assertEquals( 4, config.getBatchSize() );
		Assert.assertTrue( config.isPadFinalBatch() );
	}

	@Test
	public void testOverlapModeCreatesTilingSpec()
	{
		final TilingConfig config = TilingConfig.fromMap( Collections.singletonMap( TilingConfig.OVERLAP_MODE, "fraction" ) );
		final TilingSpec spec = config.createTilingSpec( new long[] { 100, 100 }, new long[] { 60, 60 }, 0.25, 0.25 );
		Assert.assertEquals( OverlapMode.FRACTION, spec.getOverlapMode() );

		final TilePartition partition = TilePartition.build( spec );
		Assert.assertArrayEquals( new long[] { 15, 15 }, partition.getOverlapSize() );
		config.checkPartition( partition );
	}

	@Test( expected = InvalidConfigException.class )
	public void testOverlapModeMismatch()
	{
		final TilePartition partition = TilePartition.build( TilingSpec.absolute( new long[] { 100 }, new long[] { 60 }, 20 ) );
		TilingConfig.fromMap( Collections.singletonMap( TilingConfig.OVERLAP_MODE, "fraction" ) ).checkPartition( partition );
	}

	@Test
	public void testUniformScale()
	{
		final TilingConfig config = TilingConfig.builder().outputScale( 2 ).build();
		Assert.assertArrayEquals( new double[] { 2, 2, 2 }, config.getOutputScale( 3 ), 0 );
	}

	@Test
	public void testFromJson() throws Exception
	{
		final TilingConfig config = TilingConfig.fromJson( new StringReader( "{\"blend\": \"max\", \"drop_border_output\": false, \"output_scale\": [1, 0.5], \"dedup_metric\": \"distance\"}" ) );
		Assert.assertEquals( BlendMode.MAX, config.getBlendMode() );
		Assert.assertArrayEquals( new double[] { 1, 0.5 }, config.getOutputScale( 2 ), 0 );
		Assert.assertEquals( DedupMetric.DISTANCE, config.getDedupMetric() );

		final TilingConfig reparsed = TilingConfig.fromJson( new StringReader( config.toJson() ) );
		Assert.assertEquals( config.toJson(), reparsed.toJson() );
	}

	@Test
	public void testInvalidOptions()
	{
		assertInvalid( "unknown_option", 1 );
		assertInvalid( "blend", "gaussian" );
		assertInvalid( "overlap_mode", "relative" );
		assertInvalid( "drop_border_output", "maybe" );
		assertInvalid( "output_scale", 0 );
		assertInvalid( "output_scale", Arrays.asList( 1, -1 ) );
		assertInvalid( "dedup_threshold", -0.1 );
		assertInvalid( "dedup_threshold", "high" );
		assertInvalid( "batch_size", 4 );
		assertInvalid( "pad_final_batch", true );
	}

	@Test
	public void testContradictoryOptions()
	{
		final Map< String, Object > options = new HashMap<>();
		options.put( "drop_border_output", true );
		options.put( "blend", "linear" );
		try
		{
			TilingConfig.fromMap( options );
			Assert.fail( "Expected contradictory options to be rejected" );
		}
		catch ( final InvalidConfigException e )
		{
			Assert.assertTrue( e.getMessage().contains( "drop_border_output" ) );
		}

		options.put( "blend", "crop" );
		Assert.assertTrue( TilingConfig.fromMap( options ).isDropBorderOutput() );

		try
		{
			TilingConfig.builder().batchAxis( true ).batchSize( 0 ).build();
			Assert.fail( "Expected non-positive batch size to be rejected" );
		}
		catch ( final InvalidConfigException e )
		{
			Assert.assertNotNull( e.getMessage() );
		}
	}

	@Test( expected = InvalidConfigException.class )
	public void testMalformedJson() throws Exception
	{
		TilingConfig.fromJson( new StringReader( "{\"blend\": " ) );
	}

	@Test( expected = InvalidConfigException.class )
	public void testScaleDimensionalityMismatch()
	{
		TilingConfig.builder().outputScale( 1, 2 ).build().getOutputScale( 3 );
	}

	private static void assertInvalid( final String key, final Object value )
	{
		final Map< String, Object > options = new HashMap<>();
		options.put( key, value );
		try
		{
			TilingConfig.fromMap( options );
			Assert.fail( "Expected option " + key + "=" + value + " to be rejected" );
		}
		catch ( final InvalidConfigException e )
		{
			Assert.assertNotNull( e.getMessage() );
		}
	}
}
