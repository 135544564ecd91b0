package org.janelia.tiling.stitch;

import java.util.Locale;

import org.janelia.tiling.InvalidConfigException;

/**
 * How overlapping array outputs are combined.
 */
public enum BlendMode
{
	/** Last writer wins, tiles are written in row-major order. */
	CROP,

	/** Each tile contributes with a weight that ramps linearly across its overlap margins. */
	LINEAR,

	MAX,

	MIN;

	public static BlendMode fromString( final String str )
	{
		try
		{
			return valueOf( str.trim().toUpperCase( Locale.ROOT ) );
		}
		catch ( final IllegalArgumentException e )
		{
			throw new InvalidConfigException( "Invalid blend mode '" + str + "'. Possible values are: 'crop', 'linear', 'max' or 'min'", e );
		}
	}

	@Override
	public String toString()
	{
		return name().toLowerCase( Locale.ROOT );
	}
}
