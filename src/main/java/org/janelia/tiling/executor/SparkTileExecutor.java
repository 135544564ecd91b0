package org.janelia.tiling.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaFutureAction;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingSpec;
import org.janelia.tiling.job.ArrayOutput;
import org.janelia.tiling.job.CoordinatesOutput;
import org.janelia.tiling.job.Detection;
import org.janelia.tiling.job.LabelOutput;
import org.janelia.tiling.job.ObjectsOutput;
import org.janelia.tiling.job.RawOutput;
import org.janelia.tiling.job.ScalarOutput;
import org.janelia.tiling.job.TileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.serializers.JavaSerializer;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.img.array.ArrayImg;
import scala.Tuple2;

/**
 * Runs units of work as a Spark job, one RDD partition per unit.
 * <p>
 * The units and the tile function they carry are shipped to the workers with Java serialization,
 * the outcomes are sent back with the serializer configured for the context (see {@link #createSparkConf(String)}).
 * If the calling thread is interrupted while waiting, the Spark job is cancelled.
 * </p>
 */
public class SparkTileExecutor implements TileExecutor
{
	private static final Logger LOG = LoggerFactory.getLogger( SparkTileExecutor.class );

	private final transient JavaSparkContext sparkContext;

	public SparkTileExecutor( final JavaSparkContext sparkContext )
	{
		this.sparkContext = sparkContext;
	}

	public JavaSparkContext getSparkContext()
	{
		return sparkContext;
	}

	/**
	 * Creates a Spark configuration that uses Kryo and registers the classes exchanged by tiled jobs.
	 */
	public static SparkConf createSparkConf( final String appName )
	{
		return new SparkConf()
				.setAppName( appName )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
				.set( "spark.kryo.registrator", KryoRegistrator.class.getName() )
				.registerKryoClasses( new Class[] {
						Integer.class, Long.class, Double.class, long[].class, double[].class, boolean[].class, ArrayList.class, Tuple2.class,
						Interval.class, FinalInterval.class, ArrayImg.class,
						Tile.class, TilePartition.class, TilingSpec.class, TilingConfig.class, TileResult.class, TaskOutcome.class,
						ArrayOutput.class, LabelOutput.class, ObjectsOutput.class, CoordinatesOutput.class, ScalarOutput.class, RawOutput.class, Detection.class
					} );
	}

	@Override
	public < V > Map< Integer, TaskOutcome< V > > execute( final List< ? extends KeyedTask< V > > tasks ) throws InterruptedException, ExecutionException
	{
		final Map< Integer, TaskOutcome< V > > outcomes = new LinkedHashMap<>();
		if ( tasks.isEmpty() )
			return outcomes;

		final List< KeyedTask< V > > taskList = new ArrayList<>( tasks );
		final JavaFutureAction< List< Tuple2< Integer, TaskOutcome< V > > > > action = sparkContext
				.parallelize( taskList, taskList.size() )
				.map( task -> new Tuple2<>( task.getKey(), TaskOutcome.run( task ) ) )
				.collectAsync();

		LOG.info( "execute: submitted Spark job {} with {} task(s)", action.jobIds(), taskList.size() );

		final List< Tuple2< Integer, TaskOutcome< V > > > keyedOutcomes;
		try
		{
			keyedOutcomes = action.get();
		}
		catch ( final InterruptedException e )
		{
			LOG.warn( "execute: interrupted, cancelling Spark job {}", action.jobIds() );
			action.cancel( true );
			throw e;
		}

		for ( final Tuple2< Integer, TaskOutcome< V > > keyedOutcome : keyedOutcomes )
			outcomes.put( keyedOutcome._1(), keyedOutcome._2() );
		return outcomes;
	}

	/**
	 * Registers Java serialization for units of work, which carry the user function,
	 * and for exceptions carried by failed task outcomes.
	 */
	public static class KryoRegistrator implements org.apache.spark.serializer.KryoRegistrator
	{
		@Override
		public void registerClasses( final Kryo kryo )
		{
			kryo.addDefaultSerializer( KeyedTask.class, JavaSerializer.class );
			kryo.addDefaultSerializer( Throwable.class, JavaSerializer.class );
		}
	}
}
