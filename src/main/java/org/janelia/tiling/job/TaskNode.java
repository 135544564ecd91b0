package org.janelia.tiling.job;

import java.io.Serializable;

/**
 * Node of a {@link TileJobGraph}: one stage of the work done for one tile.
 */
public class TaskNode implements Serializable
{
	private static final long serialVersionUID = 6610215713386404451L;

	public enum Stage
	{
		READ,
		APPLY
	}

	private final int tileIndex;
	private final Stage stage;

	public TaskNode( final int tileIndex, final Stage stage )
	{
		this.tileIndex = tileIndex;
		this.stage = stage;
	}

	public int getTileIndex()
	{
		return tileIndex;
	}

	public Stage getStage()
	{
		return stage;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof TaskNode ) )
			return false;
		final TaskNode other = ( TaskNode ) obj;
		return tileIndex == other.tileIndex && stage == other.stage;
	}

	@Override
	public int hashCode()
	{
		return 31 * tileIndex + stage.hashCode();
	}

	@Override
	public String toString()
	{
		return "(" + tileIndex + ", " + stage + ")";
	}
}
