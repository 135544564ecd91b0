package org.janelia.tiling;

import java.util.Locale;

/**
 * How the overlap of a {@link TilingSpec} is expressed.
 */
public enum OverlapMode
{
	/** Overlap is given in pixels. */
	ABSOLUTE,

	/** Overlap is given as a fraction of the tile size and rounded to whole pixels. */
	FRACTION;

	public static OverlapMode fromString( final String str )
	{
		try
		{
			return valueOf( str.trim().toUpperCase( Locale.ROOT ) );
		}
		catch ( final IllegalArgumentException e )
		{
			throw new InvalidConfigException( "Invalid overlap mode '" + str + "'. Possible values are: 'absolute' or 'fraction'", e );
		}
	}

	@Override
	public String toString()
	{
		return name().toLowerCase( Locale.ROOT );
	}
}
