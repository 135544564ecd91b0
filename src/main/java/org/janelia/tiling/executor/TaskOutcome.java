package org.janelia.tiling.executor;

import java.io.Serializable;
import java.util.concurrent.Callable;

/**
 * Either the value computed by a unit of work or the failure that prevented it.
 */
public class TaskOutcome< V > implements Serializable
{
	private static final long serialVersionUID = 8325637519018207625L;

	private final V value;
	private final Throwable failure;

	private TaskOutcome( final V value, final Throwable failure )
	{
		this.value = value;
		this.failure = failure;
	}

	public static < V > TaskOutcome< V > success( final V value )
	{
		return new TaskOutcome<>( value, null );
	}

	public static < V > TaskOutcome< V > failure( final Throwable failure )
	{
		if ( failure == null )
			throw new NullPointerException( "failure is null" );
		return new TaskOutcome<>( null, failure );
	}

	/**
	 * Runs the task in the current thread and captures its value or failure.
	 * An interruption is not captured but propagated, so that the caller can stop the remaining work.
	 */
	public static < V > TaskOutcome< V > run( final Callable< V > task ) throws InterruptedException
	{
		try
		{
			return success( task.call() );
		}
		catch ( final InterruptedException e )
		{
			throw e;
		}
		catch ( final Exception e )
		{
			return failure( e );
		}
	}

	public boolean isSuccess()
	{
		return failure == null;
	}

	/**
	 * @throws IllegalStateException if the task has failed
	 */
	public V getValue()
	{
		if ( failure != null )
			throw new IllegalStateException( "Task has failed", failure );
		return value;
	}

	/**
	 * @return the failure, or null if the task has succeeded
	 */
	public Throwable getFailure()
	{
		return failure;
	}

	@Override
	public String toString()
	{
		return isSuccess() ? "success: " + value : "failure: " + failure;
	}
}
