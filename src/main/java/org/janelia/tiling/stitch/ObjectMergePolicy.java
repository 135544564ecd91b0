package org.janelia.tiling.stitch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.job.Detection;
import org.janelia.tiling.job.ObjectsOutput;
import org.janelia.tiling.job.OutputKind;
import org.janelia.tiling.job.TileResult;
import org.janelia.tiling.util.IntervalsHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;
import net.imglib2.util.Util;

/**
 * Merges detected objects of all tiles into one list in image coordinates.
 * <p>
 * Objects lying entirely within the core interval of their tile are seen by no other tile and are kept unconditionally.
 * The remaining objects are visited by descending score (ties broken by tile index, then by detection order)
 * and suppressed if they match an object that has already been kept, within a tile or across tiles.
 * Two objects match if their IoU exceeds the threshold ({@code dedup_metric = iou}, default threshold 0.5),
 * or if the distance between their centers does not exceed the threshold ({@code dedup_metric = distance}, default 1.0).
 * </p>
 * <p>
 * With {@code drop_border_output}, objects whose center lies outside the stitch interval of their tile are discarded first.
 * </p>
 */
public class ObjectMergePolicy implements StitchPolicy
{
	private static final Logger LOG = LoggerFactory.getLogger( ObjectMergePolicy.class );

	public static final double DEFAULT_IOU_THRESHOLD = 0.5;
	public static final double DEFAULT_DISTANCE_THRESHOLD = 1.0;

	@Override
	public boolean accepts( final OutputKind kind )
	{
		return kind == OutputKind.OBJECTS;
	}

	@Override
	public StitchedResult stitch( final TilePartition partition, final List< TileResult > results, final TilingConfig config )
	{
		final DedupMetric metric = config.getDedupMetric();
		final double threshold = config.getDedupThreshold( metric == DedupMetric.IOU ? DEFAULT_IOU_THRESHOLD : DEFAULT_DISTANCE_THRESHOLD );
		final TilePartition scaledPartition = partition.scale( OutputScaling.resolveScale( partition, config ) );
		final boolean dropBorderOutput = config.isDropBorderOutput();

		// translate to image coordinates
		final List< Candidate > candidates = new ArrayList<>();
		int numDropped = 0;
		for ( final TileResult result : results )
		{
			final Tile tile = scaledPartition.getTile( result.getTile().getIndex() );
			final FinalInterval core = tile.getCoreInterval();
			final double[] offset = new double[ tile.numDimensions() ];
			for ( int d = 0; d < offset.length; ++d )
				offset[ d ] = tile.min( d );

			final List< Detection > detections = ( ( ObjectsOutput ) result.getOutput() ).getDetections();
			for ( int i = 0; i < detections.size(); ++i )
			{
				final Detection detection = detections.get( i ).translate( offset );
				if ( detection.numDimensions() != tile.numDimensions() )
					throw new IllegalArgumentException( "Detection " + detections.get( i ) + " of " + result.getTile() + " does not match dimensionality " + tile.numDimensions() );

				if ( dropBorderOutput && !tile.isInStitchInterval( detection.getCenter() ) )
				{
					++numDropped;
					continue;
				}

				final boolean inCore = core != null && IntervalsHelper.containsReal( core, detection );
				candidates.add( new Candidate( candidates.size(), tile.getIndex(), i, detection, inCore ) );
			}
		}

		if ( candidates.isEmpty() )
			return StitchedResult.ofObjects( new ArrayList<>() );

		final boolean[] kept = new boolean[ candidates.size() ];
		final List< Candidate > contested = new ArrayList<>();
		double maxDiagonal = 0;
		for ( final Candidate candidate : candidates )
		{
			if ( candidate.inCore )
				kept[ candidate.id ] = true;
			else
				contested.add( candidate );
			maxDiagonal = Math.max( maxDiagonal, candidate.diagonal );
		}

		contested.sort( Comparator
				.comparingDouble( ( Candidate c ) -> -c.detection.getScore() )
				.thenComparingInt( c -> c.tileIndex )
				.thenComparingInt( c -> c.order ) );

		final List< RealPoint > centers = new ArrayList<>( candidates.size() );
		for ( final Candidate candidate : candidates )
			centers.add( candidate.center );
		final KDTree< Candidate > tree = new KDTree<>( candidates, centers );
		final RadiusNeighborSearchOnKDTree< Candidate > search = new RadiusNeighborSearchOnKDTree<>( tree );

		int numSuppressed = 0;
		for ( final Candidate candidate : contested )
		{
			// boxes that intersect have their centers closer than half of the sum of their diagonals
			final double radius = metric == DedupMetric.IOU ? ( candidate.diagonal + maxDiagonal ) / 2 : threshold;
			search.search( candidate.center, radius, false );

			boolean suppressed = false;
			for ( int i = 0; i < search.numNeighbors() && !suppressed; ++i )
			{
				final Candidate neighbor = search.getSampler( i ).get();
				if ( neighbor.id != candidate.id && kept[ neighbor.id ] )
					suppressed = matches( candidate, neighbor, metric, threshold );
			}

			if ( suppressed )
				++numSuppressed;
			else
				kept[ candidate.id ] = true;
		}

		final List< Detection > merged = new ArrayList<>();
		for ( final Candidate candidate : candidates )
			if ( kept[ candidate.id ] )
				merged.add( candidate.detection );

		LOG.info( "stitch: kept {} of {} object(s), {} dropped at tile borders, {} in tile cores, {} suppressed as duplicates (metric {}, threshold {})",
				merged.size(), candidates.size() + numDropped, numDropped, candidates.size() - contested.size(), numSuppressed, metric, threshold );
		return StitchedResult.ofObjects( merged );
	}

	private static boolean matches( final Candidate a, final Candidate b, final DedupMetric metric, final double threshold )
	{
		switch ( metric )
		{
		case IOU:
			return IntervalsHelper.intersectionOverUnion( a.detection, b.detection ) > threshold;
		case DISTANCE:
			return Util.distance( a.center, b.center ) <= threshold;
		default:
			throw new IllegalArgumentException( "Unknown dedup metric " + metric );
		}
	}

	@Override
	public String toString()
	{
		return "object-merge";
	}

	private static class Candidate
	{
		final int id;
		final int tileIndex;
		final int order;
		final Detection detection;
		final RealPoint center;
		final double diagonal;
		final boolean inCore;

		Candidate( final int id, final int tileIndex, final int order, final Detection detection, final boolean inCore )
		{
			this.id = id;
			this.tileIndex = tileIndex;
			this.order = order;
			this.detection = detection;
			this.center = detection.getCenter();
			this.inCore = inCore;

			double sumSq = 0;
			for ( int d = 0; d < detection.numDimensions(); ++d )
			{
				final double size = detection.realMax( d ) - detection.realMin( d );
				sumSq += size * size;
			}
			this.diagonal = Math.sqrt( sumSq );
		}
	}
}
