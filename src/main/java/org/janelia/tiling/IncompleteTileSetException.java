package org.janelia.tiling;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when stitching is attempted while some tiles of the partition have no result.
 */
public class IncompleteTileSetException extends TilingException
{
	private static final long serialVersionUID = -1718232574937047116L;

	private final List< Tile > missingTiles;

	public IncompleteTileSetException( final List< Tile > missingTiles )
	{
		super( createMessage( missingTiles ) );
		this.missingTiles = Collections.unmodifiableList( missingTiles );
	}

	public List< Tile > getMissingTiles()
	{
		return missingTiles;
	}

	private static String createMessage( final List< Tile > missingTiles )
	{
		final StringBuilder sb = new StringBuilder( missingTiles.size() + " tile(s) have no result:" );
		for ( final Tile tile : missingTiles )
			sb.append( System.lineSeparator() ).append( "  " ).append( tile );
		return sb.toString();
	}
}
