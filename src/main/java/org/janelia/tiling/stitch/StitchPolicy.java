package org.janelia.tiling.stitch;

import java.util.List;

import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingException;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;

/**
 * Strategy that combines the outputs of all tiles of a partition into one result.
 */
public interface StitchPolicy
{
	/**
	 * @return true if this policy can combine outputs of the given kind
	 */
	public boolean accepts( final OutputKind kind );

	/**
	 * Combines the tile results.
	 *
	 * @param results
	 * 			one result per tile of the partition, ordered by tile index, all of an accepted kind
	 */
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config ) throws TilingException;
}
