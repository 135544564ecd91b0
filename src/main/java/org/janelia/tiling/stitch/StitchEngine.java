package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.TilingException;
import org.janelia.tiling.UnsupportedOutputTypeException;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the set of tile results and hands it over to a {@link StitchPolicy}.
 * <p>
 * Unless a policy is given explicitly, the first registered policy that accepts the output kind is used.
 * The default registry handles arrays, labels, objects and coordinates, and passes raw outputs through.
 * Scalar outputs have no default policy.
 * </p>
 * <p>
 * Results are ordered by tile index before they are combined, so the stitched result
 * does not depend on the order in which the tiles were computed.
 * </p>
 */
public class StitchEngine
{
	private static final Logger LOG = LoggerFactory.getLogger( StitchEngine.class );

	private final List< StitchPolicy > policies;

	public StitchEngine()
	{
		this( defaultPolicies() );
	}

	public StitchEngine( final List< StitchPolicy > policies )
	{
		this.policies = Collections.unmodifiableList( new ArrayList<>( policies ) );
	}

	public static List< StitchPolicy > defaultPolicies()
	{
		return Arrays.asList(
				new ArrayBlendPolicy(),
				new LabelMergePolicy(),
				new ObjectMergePolicy(),
				new CoordinateMergePolicy(),
				new PassthroughPolicy( EnumSet.of( OutputKind.RAW ) ) );
	}

	public List< StitchPolicy > getPolicies()
	{
		return policies;
	}

	/**
	 * Stitches the results with the policy selected by their output kind.
	 *
	 * @throws org.janelia.tiling.IncompleteTileSetException if any tile of the partition has no result
	 * @throws UnsupportedOutputTypeException if the results are of different kinds, or no policy accepts their kind
	 */
	public StitchedResult stitch( final TilePartition partition, final Collection< TileResult > results, final TilingConfig config ) throws TilingException
	{
		return stitch( partition, results, config, null );
	}

	/**
	 * Stitches the results with the given policy, or with the policy selected by their output kind if {@code policy} is null.
	 *
	 * @throws org.janelia.tiling.IncompleteTileSetException if any tile of the partition has no result
	 * @throws UnsupportedOutputTypeException if the results are of different kinds, or the policy does not accept their kind
	 * @throws IllegalArgumentException if a result does not belong to the partition or a tile has more than one result
	 * @throws org.janelia.tiling.InvalidConfigException if the partition does not follow the configured overlap mode
	 */
	public StitchedResult stitch(
			final TilePartition partition,
			final Collection< TileResult > results,
			final TilingConfig config,
			final StitchPolicy policy ) throws TilingException
	{
		config.checkPartition( partition );
		partition.verifyComplete( results );
		if ( results.size() != partition.numTiles() )
			throw new IllegalArgumentException( "Expected one result per tile, got " + results.size() + " result(s) for " + partition.numTiles() + " tile(s)" );

		final List< TileResult > sortedResults = new ArrayList<>( results );
		sortedResults.sort( Comparator.comparingInt( result -> result.getTile().getIndex() ) );

		final Set< OutputKind > kinds = EnumSet.noneOf( OutputKind.class );
		for ( final TileResult result : sortedResults )
			kinds.add( result.getKind() );
		if ( kinds.size() != 1 )
			throw new UnsupportedOutputTypeException( "Tile outputs are of different kinds " + kinds + " and cannot be stitched together" );
		final OutputKind kind = kinds.iterator().next();

		final StitchPolicy selectedPolicy;
		if ( policy != null )
		{
			if ( !policy.accepts( kind ) )
				throw new UnsupportedOutputTypeException( "Policy " + policy + " does not accept outputs of kind " + kind );
			selectedPolicy = policy;
		}
		else
		{
			selectedPolicy = selectPolicy( kind );
		}

		LOG.info( "stitch: stitching {} tile(s) of kind {} with {}", sortedResults.size(), kind, selectedPolicy );
		final StitchedResult stitchedResult = selectedPolicy.stitch( partition, sortedResults, config );
		LOG.debug( "stitch: {}", stitchedResult );
		return stitchedResult;
	}

	public StitchPolicy selectPolicy( final OutputKind kind ) throws UnsupportedOutputTypeException
	{
		for ( final StitchPolicy policy : policies )
			if ( policy.accepts( kind ) )
				return policy;
		throw new UnsupportedOutputTypeException( "No stitch policy accepts outputs of kind " + kind + ", a policy has to be specified explicitly" );
	}
}
