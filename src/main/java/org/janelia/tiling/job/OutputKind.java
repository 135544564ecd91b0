package org.janelia.tiling.job;

/**
 * Kinds of values a tile function can produce. Stitch policies declare which kinds they accept.
 */
public enum OutputKind
{
	/** Dense image with the same (possibly scaled) geometry as the tile. */
	ARRAY,
	/** Integer label image, where 0 is background and every other value identifies one object. */
	LABELS,
	/** Detected objects with bounding boxes and scores. */
	OBJECTS,
	/** Point coordinates. */
	COORDINATES,
	/** Single number per tile. */
	SCALAR,
	/** Arbitrary value that is only passed through. */
	RAW
}
