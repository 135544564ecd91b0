package org.janelia.tiling;

/**
 * Thrown for unrecognized, malformed or contradictory job configuration options.
 */
public class InvalidConfigException extends IllegalArgumentException
{
	private static final long serialVersionUID = 2986309151174329871L;

	public InvalidConfigException( final String message )
	{
		super( message );
	}

	public InvalidConfigException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
