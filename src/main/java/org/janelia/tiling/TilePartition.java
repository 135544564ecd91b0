package org.janelia.tiling;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.janelia.tiling.job.TileResult;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.iterator.IntervalIterator;

/**
 * Materialized tile layout for one image shape and tiling spec.
 * <p>
 * Tiles are stored in row-major grid order (first dimension varies slowest).
 * Building a partition twice from the same {@link TilingSpec} yields identical tiles in identical order.
 * Instances are immutable and can be shared between jobs operating on images of the same shape.
 * </p>
 */
public class TilePartition implements Serializable
{
	private static final long serialVersionUID = 1690548329072217408L;

	private final TilingSpec spec;
	private final long[] imageShape;
	private final long[] overlapSize;
	private final long[] gridSize;
	private final List< Tile > tiles;

	private TilePartition( final TilingSpec spec, final long[] imageShape, final long[] overlapSize, final long[][][] bounds )
	{
		this.spec = spec;
		this.imageShape = imageShape;
		this.overlapSize = overlapSize;
		this.gridSize = new long[ bounds.length ];
		for ( int d = 0; d < bounds.length; ++d )
			gridSize[ d ] = bounds[ d ].length;
		this.tiles = Collections.unmodifiableList( TileGeometry.createTiles( bounds ) );
	}

	/**
	 * Builds the partition for the given spec. Use {@link TilePartitionCache} to reuse partitions across jobs.
	 *
	 * @throws InvalidTileSpecException if the spec does not produce an advancing grid
	 */
	public static TilePartition build( final TilingSpec spec )
	{
		TileGeometry.validate( spec );
		final long[] imageShape = spec.getImageShape();
		final long[] overlapSize = TileGeometry.resolveOverlap( spec.getTileShape(), spec.getOverlap(), spec.getOverlapMode() );
		final long[][][] bounds = TileGeometry.axisBounds( imageShape, spec.getTileShape(), overlapSize );
		return new TilePartition( spec, imageShape, overlapSize, bounds );
	}

	public static TilePartition build( final long[] imageShape, final long[] tileShape, final double[] overlap, final OverlapMode overlapMode )
	{
		return build( new TilingSpec( imageShape, tileShape, overlap, overlapMode ) );
	}

	/**
	 * Derives the partition of an output that was resampled by {@code scale} relative to the input image.
	 * The grid is the same, tile bounds and overlap margins are mapped to the resampled space.
	 */
	public TilePartition scale( final double[] scale )
	{
		if ( scale.length != numDimensions() )
			throw new InvalidConfigException( "Output scale " + Arrays.toString( scale ) + " does not match dimensionality " + numDimensions() );

		boolean identity = true;
		for ( final double s : scale )
			identity &= s == 1;
		if ( identity )
			return this;

		final long[] scaledImageShape = TileGeometry.scaleShape( imageShape, scale );
		final long[][][] scaledBounds = TileGeometry.scaleAxisBounds( axisBounds(), imageShape, scaledImageShape );
		final long[] scaledOverlapSize = new long[ numDimensions() ];
		for ( int d = 0; d < scaledOverlapSize.length; ++d )
			scaledOverlapSize[ d ] = Math.round( overlapSize[ d ] * scaledImageShape[ d ] / ( double ) imageShape[ d ] );
		return new TilePartition( spec, scaledImageShape, scaledOverlapSize, scaledBounds );
	}

	public TilingSpec getSpec()
	{
		return spec;
	}

	public int numDimensions()
	{
		return imageShape.length;
	}

	public long[] getImageShape()
	{
		return imageShape.clone();
	}

	public Interval getImageInterval()
	{
		return new FinalInterval( imageShape );
	}

	/**
	 * Overlap between neighboring tiles in pixels (as resolved from the spec).
	 */
	public long[] getOverlapSize()
	{
		return overlapSize.clone();
	}

	public long[] getGridSize()
	{
		return gridSize.clone();
	}

	public int numTiles()
	{
		return tiles.size();
	}

	/**
	 * @return all tiles in row-major grid order
	 */
	public List< Tile > getTiles()
	{
		return tiles;
	}

	public Tile getTile( final int index )
	{
		return tiles.get( index );
	}

	public Tile getTile( final long... gridPosition )
	{
		return tiles.get( linearIndex( gridPosition ) );
	}

	public int linearIndex( final long... gridPosition )
	{
		if ( gridPosition.length != numDimensions() )
			throw new IllegalArgumentException( "Grid position " + Arrays.toString( gridPosition ) + " does not match dimensionality " + numDimensions() );

		long index = 0;
		for ( int d = 0; d < gridPosition.length; ++d )
		{
			if ( gridPosition[ d ] < 0 || gridPosition[ d ] >= gridSize[ d ] )
				throw new IndexOutOfBoundsException( "Grid position " + Arrays.toString( gridPosition ) + " is outside of the grid " + Arrays.toString( gridSize ) );
			index = index * gridSize[ d ] + gridPosition[ d ];
		}
		return ( int ) index;
	}

	/**
	 * Returns the tiles adjacent to the given tile in the grid, including diagonal neighbors, in row-major order.
	 */
	public List< Tile > getNeighbors( final Tile tile )
	{
		final int n = numDimensions();
		final long[] searchMin = new long[ n ], searchMax = new long[ n ];
		for ( int d = 0; d < n; ++d )
		{
			searchMin[ d ] = Math.max( tile.getGridPosition( d ) - 1, 0 );
			searchMax[ d ] = Math.min( tile.getGridPosition( d ) + 1, gridSize[ d ] - 1 );
		}

		// IntervalIterator moves dimension 0 fastest, so collect and sort to keep the row-major order
		final IntervalIterator neighborIterator = new IntervalIterator( searchMin, searchMax );
		final long[] neighborPosition = new long[ n ];
		final List< Tile > neighbors = new ArrayList<>();
		while ( neighborIterator.hasNext() )
		{
			neighborIterator.fwd();
			neighborIterator.localize( neighborPosition );
			final int neighborIndex = linearIndex( neighborPosition );
			if ( neighborIndex != tile.getIndex() )
				neighbors.add( tiles.get( neighborIndex ) );
		}
		neighbors.sort( ( a, b ) -> Integer.compare( a.getIndex(), b.getIndex() ) );
		return neighbors;
	}

	/**
	 * Checks that every tile of this partition has a result.
	 *
	 * @throws IncompleteTileSetException if any tile has no corresponding result
	 * @throws IllegalArgumentException if a result refers to a tile that does not belong to this partition
	 */
	public void verifyComplete( final Collection< ? extends TileResult > results ) throws IncompleteTileSetException
	{
		final boolean[] covered = new boolean[ tiles.size() ];
		for ( final TileResult result : results )
		{
			final Tile tile = result.getTile();
			if ( !belongs( tile ) )
				throw new IllegalArgumentException( "Result for " + tile + " does not belong to the partition " + spec );
			covered[ tile.getIndex() ] = true;
		}

		final List< Tile > missing = new ArrayList<>();
		for ( int i = 0; i < covered.length; ++i )
			if ( !covered[ i ] )
				missing.add( tiles.get( i ) );

		if ( !missing.isEmpty() )
			throw new IncompleteTileSetException( missing );
	}

	public boolean belongs( final Tile tile )
	{
		return tile.getIndex() >= 0 && tile.getIndex() < tiles.size() && tiles.get( tile.getIndex() ).equals( tile );
	}

	private long[][][] axisBounds()
	{
		final long[][][] bounds = new long[ numDimensions() ][][];
		for ( int d = 0; d < bounds.length; ++d )
		{
			bounds[ d ] = new long[ ( int ) gridSize[ d ] ][ 2 ];
			final long[] gridPosition = new long[ numDimensions() ];
			for ( int i = 0; i < gridSize[ d ]; ++i )
			{
				gridPosition[ d ] = i;
				final Tile tile = getTile( gridPosition );
				bounds[ d ][ i ][ 0 ] = tile.min( d );
				bounds[ d ][ i ][ 1 ] = tile.max( d );
			}
		}
		return bounds;
	}

	@Override
	public String toString()
	{
		return "TilePartition[" + spec + ", grid=" + Arrays.toString( gridSize ) + "]";
	}
}
