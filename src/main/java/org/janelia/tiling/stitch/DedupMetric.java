package org.janelia.tiling.stitch;

import java.util.Locale;

import org.janelia.tiling.InvalidConfigException;

/**
 * How two detections are compared against the deduplication threshold.
 */
public enum DedupMetric
{
	/** Suppress when the intersection over union of the bounding boxes exceeds the threshold. */
	IOU,

	/** Suppress when the distance between the bounding box centers does not exceed the threshold. */
	DISTANCE;

	public static DedupMetric fromString( final String str )
	{
		try
		{
			return valueOf( str.trim().toUpperCase( Locale.ROOT ) );
		}
		catch ( final IllegalArgumentException e )
		{
			throw new InvalidConfigException( "Invalid dedup metric '" + str + "'. Possible values are: 'iou' or 'distance'", e );
		}
	}

	@Override
	public String toString()
	{
		return name().toLowerCase( Locale.ROOT );
	}
}
