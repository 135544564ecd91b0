package org.janelia.tiling;

/**
 * Base class for failures of a tiled job that are detected after the job has been set up:
 * failed tile computations, incomplete result sets and outputs that cannot be stitched.
 */
public class TilingException extends Exception
{
	private static final long serialVersionUID = 4471638023914387290L;

	public TilingException()
	{
		super();
	}

	public TilingException( final String message )
	{
		super( message );
	}

	public TilingException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public TilingException( final Throwable cause )
	{
		super( cause );
	}
}
