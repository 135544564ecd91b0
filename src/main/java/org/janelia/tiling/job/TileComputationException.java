package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.tiling.TilingException;

/**
 * Thrown when the tile function has failed on one or more tiles.
 * Reports every failing tile along with its cause, and keeps the results of the tiles that succeeded,
 * so that only the failing tiles need to be recomputed.
 */
public class TileComputationException extends TilingException
{
	private static final long serialVersionUID = 2305893512774032180L;

	private final List< TileFailure > failures;
	private final List< TileResult > completedResults;

	public TileComputationException( final List< TileFailure > failures, final List< TileResult > completedResults )
	{
		super( createMessage( failures ) );
		this.failures = Collections.unmodifiableList( new ArrayList<>( failures ) );
		this.completedResults = Collections.unmodifiableList( new ArrayList<>( completedResults ) );
		for ( final TileFailure failure : failures )
			if ( failure.getCause() != null )
				addSuppressed( failure.getCause() );
	}

	/**
	 * @return failures in tile order
	 */
	public List< TileFailure > getFailures()
	{
		return failures;
	}

	public List< Integer > getFailedTileIndices()
	{
		final List< Integer > indices = new ArrayList<>( failures.size() );
		for ( final TileFailure failure : failures )
			indices.add( failure.getTile().getIndex() );
		return indices;
	}

	/**
	 * @return results of the tiles that were computed successfully, in tile order
	 */
	public List< TileResult > getCompletedResults()
	{
		return completedResults;
	}

	private static String createMessage( final List< TileFailure > failures )
	{
		final StringBuilder sb = new StringBuilder( "Tile function failed on " + failures.size() + " tile(s):" );
		for ( final TileFailure failure : failures )
			sb.append( System.lineSeparator() ).append( "  " ).append( failure );
		return sb.toString();
	}
}
