package org.janelia.tiling.job;

import java.io.Serializable;

import org.janelia.tiling.Tile;

/**
 * Failure of the tile function (or of reading the tile data) for a single tile.
 */
public class TileFailure implements Serializable
{
	private static final long serialVersionUID = -7019338207218964585L;

	private final Tile tile;
	private final Throwable cause;

	public TileFailure( final Tile tile, final Throwable cause )
	{
		this.tile = tile;
		this.cause = cause;
	}

	public Tile getTile()
	{
		return tile;
	}

	public Throwable getCause()
	{
		return cause;
	}

	@Override
	public String toString()
	{
		return tile + ": " + cause;
	}
}
