package org.janelia.tiling.executor;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executor service that runs every submitted task in the calling thread.
 * Used for deterministic single-threaded runs of tiled jobs.
 */
public class SameThreadExecutorService extends AbstractExecutorService
{
	private volatile boolean shutdown;

	@Override
	public void shutdown()
	{
		shutdown = true;
	}

	@Override
	public List< Runnable > shutdownNow()
	{
		shutdown = true;
		return Collections.emptyList();
	}

	@Override
	public boolean isShutdown()
	{
		return shutdown;
	}

	@Override
	public boolean isTerminated()
	{
		return shutdown;
	}

	@Override
	public boolean awaitTermination( final long time, final TimeUnit unit )
	{
		return true;
	}

	@Override
	public void execute( final Runnable runnable )
	{
		if ( shutdown )
			throw new RejectedExecutionException( "Executor has been shut down" );
		runnable.run();
	}
}
