package org.janelia.tiling.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs units of work on a fixed pool of local threads.
 * If the calling thread is interrupted while waiting, all outstanding units are cancelled.
 */
public class MultithreadedTileExecutor implements TileExecutor, AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger( MultithreadedTileExecutor.class );

	private final ExecutorService threadPool;
	private final int numThreads;

	public MultithreadedTileExecutor()
	{
		// reserve one thread for the OS
		this( Math.max( Runtime.getRuntime().availableProcessors() - 1, 1 ) );
	}

	public MultithreadedTileExecutor( final int numThreads )
	{
		this( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public MultithreadedTileExecutor( final ExecutorService threadPool, final int numThreads )
	{
		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	/**
	 * Creates an executor that runs all units one after another in the calling thread.
	 */
	public static MultithreadedTileExecutor sameThread()
	{
		return new MultithreadedTileExecutor( new SameThreadExecutorService(), 1 );
	}

	@Override
	public void close()
	{
		threadPool.shutdown();
	}

	public ExecutorService getThreadPool()
	{
		return threadPool;
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	@Override
	public < V > Map< Integer, TaskOutcome< V > > execute( final List< ? extends KeyedTask< V > > tasks ) throws InterruptedException
	{
		final List< Future< V > > futures = new ArrayList<>( tasks.size() );
		for ( final KeyedTask< V > task : tasks )
			futures.add( threadPool.submit( task ) );

		LOG.debug( "execute: submitted {} task(s) to {} thread(s)", tasks.size(), numThreads );

		final Map< Integer, TaskOutcome< V > > outcomes = new LinkedHashMap<>();
		try
		{
			for ( int i = 0; i < futures.size(); ++i )
			{
				final int key = tasks.get( i ).getKey();
				try
				{
					outcomes.put( key, TaskOutcome.success( futures.get( i ).get() ) );
				}
				catch ( final ExecutionException e )
				{
					outcomes.put( key, TaskOutcome.failure( e.getCause() != null ? e.getCause() : e ) );
				}
				catch ( final CancellationException e )
				{
					outcomes.put( key, TaskOutcome.failure( e ) );
				}
			}
		}
		catch ( final InterruptedException e )
		{
			LOG.warn( "execute: interrupted, cancelling {} outstanding task(s)", futures.size() - outcomes.size() );
			for ( final Future< V > future : futures )
				future.cancel( true );
			throw e;
		}
		return outcomes;
	}
}
