package org.janelia.tiling.executor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Execution backend that runs independent units of work and reports the outcome of each of them by its key.
 * <p>
 * Every submitted unit has to either complete or report its failure: a failing unit never prevents the others from running.
 * Units may be retried on worker failure, as they are required to be idempotent.
 * </p>
 */
public interface TileExecutor
{
	/**
	 * Runs all tasks and blocks until every one of them has completed or failed.
	 *
	 * @return outcome of every task by its key
	 * @throws InterruptedException if the calling thread was interrupted, in which case the outstanding tasks are cancelled
	 * @throws ExecutionException if the backend itself has failed and could not report the outcomes of the tasks
	 */
	public < V > Map< Integer, TaskOutcome< V > > execute( final List< ? extends KeyedTask< V > > tasks ) throws InterruptedException, ExecutionException;
}
