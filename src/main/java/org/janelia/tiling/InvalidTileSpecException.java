package org.janelia.tiling;

/**
 * Thrown when an image shape, tile shape or overlap cannot produce an advancing tile grid.
 */
public class InvalidTileSpecException extends IllegalArgumentException
{
	private static final long serialVersionUID = -6232717785839001432L;

	public InvalidTileSpecException( final String message )
	{
		super( message );
	}
}
