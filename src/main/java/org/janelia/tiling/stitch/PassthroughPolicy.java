package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;

/**
 * Returns the tile results unmodified, in tile order, for callers that do their own stitching.
 * When created without arguments it accepts every output kind, so it can always be requested explicitly.
 */
public class PassthroughPolicy implements StitchPolicy
{
	private final Set< OutputKind > acceptedKinds;

	public PassthroughPolicy()
	{
		this( EnumSet.allOf( OutputKind.class ) );
	}

	public PassthroughPolicy( final Set< OutputKind > acceptedKinds )
	{
		this.acceptedKinds = EnumSet.copyOf( acceptedKinds );
	}

	@Override
	public boolean accepts( final OutputKind kind )
	{
		return acceptedKinds.contains( kind );
	}

	@Override
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config )
	{
		return StitchedResult.ofTiles( new ArrayList<>( results ) );
	}

	@Override
	public String toString()
	{
		return "passthrough";
	}
}
