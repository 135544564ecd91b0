package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.job.CoordinatesOutput;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;
import org.janelia.tiling.util.IntervalsHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;

/**
 * Merges point coordinates of all tiles into one list in image coordinates.
 * <p>
 * Points within the core interval of their tile are kept unconditionally.
 * The remaining points are visited by increasing distance to the core interval of their own tile
 * (ties broken by tile index, then by point order), and dropped if a point already kept from another tile
 * lies closer than {@code dedup_threshold} (default 1.0). This way, of two detections of the same point
 * the one further away from its tile edge survives.
 * </p>
 * <p>
 * With {@code drop_border_output}, points outside the stitch interval of their tile are discarded first.
 * </p>
 */
public class CoordinateMergePolicy implements StitchPolicy
{
	private static final Logger LOG = LoggerFactory.getLogger( CoordinateMergePolicy.class );

	public static final double DEFAULT_THRESHOLD = 1.0;

	@Override
	public boolean accepts( final OutputKind kind )
	{
		return kind == OutputKind.COORDINATES;
	}

	@Override
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config )
	{
		final double threshold = config.getDedupThreshold( DEFAULT_THRESHOLD );
		final TilePartition scaledPartition = partition.scale( OutputScaling.resolveScale( partition, config ) );
		final boolean dropBorderOutput = config.isDropBorderOutput();

		// translate to image coordinates
		final List< Candidate > candidates = new ArrayList<>();
		int numDroppedAtBorders = 0;
		for ( final TileResult result : results )
		{
			final Tile tile = scaledPartition.getTile( result.getTile().getIndex() );
			final FinalInterval core = tile.getCoreInterval();

			final List< RealPoint > points = ( ( CoordinatesOutput ) result.getOutput() ).getPoints();
			for ( int i = 0; i < points.size(); ++i )
			{
				if ( points.get( i ).numDimensions() != tile.numDimensions() )
					throw new IllegalArgumentException( "Point " + points.get( i ) + " of " + result.getTile() + " does not match dimensionality " + tile.numDimensions() );

				final RealPoint point = new RealPoint( points.get( i ) );
				for ( int d = 0; d < point.numDimensions(); ++d )
					point.move( tile.min( d ), d );

				if ( dropBorderOutput && !tile.isInStitchInterval( point ) )
				{
					++numDroppedAtBorders;
					continue;
				}

				final double distanceToCore = core != null ? IntervalsHelper.distance( point, core ) : Double.POSITIVE_INFINITY;
				candidates.add( new Candidate( candidates.size(), tile.getIndex(), i, point, distanceToCore ) );
			}
		}

		if ( candidates.isEmpty() )
			return StitchedResult.ofCoordinates( new ArrayList<>() );

		final boolean[] kept = new boolean[ candidates.size() ];
		final List< Candidate > contested = new ArrayList<>();
		for ( final Candidate candidate : candidates )
		{
			if ( candidate.distanceToCore == 0 )
				kept[ candidate.id ] = true;
			else
				contested.add( candidate );
		}

		contested.sort( Comparator
				.comparingDouble( ( Candidate c ) -> c.distanceToCore )
				.thenComparingInt( c -> c.tileIndex )
				.thenComparingInt( c -> c.order ) );

		final List< RealPoint > positions = new ArrayList<>( candidates.size() );
		for ( final Candidate candidate : candidates )
			positions.add( candidate.point );
		final KDTree< Candidate > tree = new KDTree<>( candidates, positions );
		final RadiusNeighborSearchOnKDTree< Candidate > search = new RadiusNeighborSearchOnKDTree<>( tree );

		int numDropped = 0;
		for ( final Candidate candidate : contested )
		{
			search.search( candidate.point, threshold, false );

			// the search radius is inclusive, only points strictly closer than the threshold are duplicates
			boolean duplicate = false;
			for ( int i = 0; i < search.numNeighbors() && !duplicate; ++i )
			{
				final Candidate neighbor = search.getSampler( i ).get();
				duplicate = neighbor.tileIndex != candidate.tileIndex && kept[ neighbor.id ] && search.getDistance( i ) < threshold;
			}

			if ( duplicate )
				++numDropped;
			else
				kept[ candidate.id ] = true;
		}

		final List< RealPoint > merged = new ArrayList<>();
		for ( final Candidate candidate : candidates )
			if ( kept[ candidate.id ] )
				merged.add( candidate.point );

		LOG.info( "stitch: kept {} of {} point(s), {} dropped at tile borders, {} dropped as duplicates (threshold {})",
				merged.size(), candidates.size() + numDroppedAtBorders, numDroppedAtBorders, numDropped, threshold );
		return StitchedResult.ofCoordinates( merged );
	}

	@Override
	public String toString()
	{
		return "coordinate-merge";
	}

	private static class Candidate
	{
		final int id;
		final int tileIndex;
		final int order;
		final RealPoint point;
		final double distanceToCore;

		Candidate( final int id, final int tileIndex, final int order, final RealPoint point, final double distanceToCore )
		{
			this.id = id;
			this.tileIndex = tileIndex;
			this.order = order;
			this.point = point;
			this.distanceToCore = distanceToCore;
		}
	}
}
