package org.janelia.tiling;

/**
 * Thrown when no stitch policy accepts the kind of output produced by the tile function.
 */
public class UnsupportedOutputTypeException extends TilingException
{
	private static final long serialVersionUID = 8121305667245203348L;

	public UnsupportedOutputTypeException( final String message )
	{
		super( message );
	}
}
