package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

import org.janelia.tiling.Tile;
import org.janelia.tiling.executor.TaskOutcome;
import org.janelia.tiling.executor.TileExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.type.NativeType;

/**
 * Lazily executed tiled job.
 * <p>
 * Nothing runs until {@link #collect()} is called. The first call executes all units of work
 * and blocks until every tile has either completed or failed; subsequent calls return the same outcome.
 * If any tile has failed, all failures are reported together in one {@link TileComputationException}.
 * </p>
 * <p>
 * {@link #cancel()} interrupts the outstanding computation and discards the partial results.
 * A cancelled job cannot be collected.
 * </p>
 */
public class TileJob
{
	private static final Logger LOG = LoggerFactory.getLogger( TileJob.class );

	private final TileJobGraph< ? > graph;
	private final TileExecutor executor;
	private final FutureTask< List< TileResult > > execution;

	TileJob( final TileJobGraph< ? > graph, final TileExecutor executor )
	{
		this.graph = graph;
		this.executor = executor;
		this.execution = new FutureTask<>( this::execute );
	}

	public TileJobGraph< ? > getGraph()
	{
		return graph;
	}

	/**
	 * Runs the job (only on the first call) and returns the results of all tiles in tile order.
	 *
	 * @throws TileComputationException if the tile function has failed on any tile
	 * @throws CancellationException if the job has been cancelled
	 * @throws InterruptedException if the calling thread was interrupted while waiting
	 */
	public List< TileResult > collect() throws TileComputationException, InterruptedException
	{
		execution.run();
		try
		{
			return execution.get();
		}
		catch ( final CancellationException e )
		{
			// clear the interrupt that was used to stop the computation in this thread
			Thread.interrupted();
			throw e;
		}
		catch ( final ExecutionException e )
		{
			final Throwable cause = e.getCause();
			if ( cause instanceof TileComputationException )
				throw ( TileComputationException ) cause;
			if ( cause instanceof InterruptedException )
				throw ( InterruptedException ) cause;
			if ( cause instanceof RuntimeException )
				throw ( RuntimeException ) cause;
			if ( cause instanceof Error )
				throw ( Error ) cause;
			throw new IllegalStateException( "Job failed", cause );
		}
	}

	/**
	 * Cancels the job, interrupting the computation if it is running.
	 *
	 * @return false if the job has already completed or has been cancelled before
	 */
	public boolean cancel()
	{
		final boolean cancelled = execution.cancel( true );
		if ( cancelled )
			LOG.info( "cancel: cancelled job over {} tile(s)", graph.getPartition().numTiles() );
		return cancelled;
	}

	public boolean isCancelled()
	{
		return execution.isCancelled();
	}

	public boolean isDone()
	{
		return execution.isDone();
	}

	private List< TileResult > execute() throws TileComputationException, InterruptedException
	{
		final long startTime = System.currentTimeMillis();
		final List< ? extends TileTask< ? > > tasks = graph.getTasks();

		Map< Integer, TaskOutcome< List< TaskOutcome< TileResult > > > > outcomes;
		Throwable executorFailure = null;
		try
		{
			outcomes = executeTasks( graph );
		}
		catch ( final ExecutionException e )
		{
			LOG.warn( "execute: executor has failed", e );
			outcomes = null;
			executorFailure = e.getCause() != null ? e.getCause() : e;
		}

		final List< TileResult > results = new ArrayList<>();
		final List< TileFailure > failures = new ArrayList<>();
		for ( final TileTask< ? > task : tasks )
		{
			final TaskOutcome< List< TaskOutcome< TileResult > > > taskOutcome = outcomes != null ? outcomes.get( task.getKey() ) : null;
			final Throwable taskFailure;
			if ( executorFailure != null )
				taskFailure = executorFailure;
			else if ( taskOutcome == null )
				taskFailure = new IllegalStateException( "Executor reported no outcome for " + task );
			else
				taskFailure = taskOutcome.getFailure();

			final List< Tile > taskTiles = task.getTiles();
			for ( int i = 0; i < taskTiles.size(); ++i )
			{
				final Tile tile = taskTiles.get( i );
				if ( taskFailure != null )
				{
					failures.add( new TileFailure( tile, taskFailure ) );
				}
				else
				{
					final TaskOutcome< TileResult > tileOutcome = taskOutcome.getValue().get( i );
					if ( tileOutcome.isSuccess() )
						results.add( tileOutcome.getValue() );
					else
						failures.add( new TileFailure( tile, tileOutcome.getFailure() ) );
				}
			}
		}

		results.sort( Comparator.comparingInt( result -> result.getTile().getIndex() ) );
		failures.sort( Comparator.comparingInt( failure -> failure.getTile().getIndex() ) );

		final long elapsed = System.currentTimeMillis() - startTime;
		if ( !failures.isEmpty() )
		{
			LOG.warn( "execute: {} of {} tile(s) failed after {} ms", failures.size(), graph.getPartition().numTiles(), elapsed );
			for ( final TileFailure failure : failures )
				LOG.debug( "execute: failed {}", failure.getTile(), failure.getCause() );
			throw new TileComputationException( failures, results );
		}

		LOG.info( "execute: computed {} tile(s) in {} ms", results.size(), elapsed );
		return results;
	}

	private < T extends NativeType< T > > Map< Integer, TaskOutcome< List< TaskOutcome< TileResult > > > > executeTasks( final TileJobGraph< T > graph ) throws InterruptedException, ExecutionException
	{
		return executor.execute( graph.getTasks() );
	}
}
