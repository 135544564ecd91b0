package org.janelia.tiling.job;

import java.io.Serializable;

import org.janelia.tiling.Tile;

/**
 * Output of the tile function paired with the tile it was computed for.
 */
public class TileResult implements Serializable
{
	private static final long serialVersionUID = -1183505950238723104L;

	private final Tile tile;
	private final TileOutput output;

	public TileResult( final Tile tile, final TileOutput output )
	{
		if ( tile == null || output == null )
			throw new NullPointerException( "tile and output are required" );
		this.tile = tile;
		this.output = output;
	}

	public Tile getTile()
	{
		return tile;
	}

	public TileOutput getOutput()
	{
		return output;
	}

	public OutputKind getKind()
	{
		return output.getKind();
	}

	@Override
	public String toString()
	{
		return tile + " -> " + output;
	}
}
