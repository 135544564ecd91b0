package org.janelia.tiling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pure functions computing the tile grid for an image: number of tiles per dimension,
 * tile bounds and the overlap margins shared with neighboring tiles.
 * <p>
 * Along every dimension, tile {@code i} starts at {@code i * (T - O)} and ends at
 * {@code min(start + T, S)}, i.e. the last tile is clipped to the image rather than padded.
 * </p>
 */
public class TileGeometry
{
	/**
	 * Checks that the given spec yields an advancing grid.
	 *
	 * @throws InvalidTileSpecException if any of the shapes or the resolved overlap has non-positive values,
	 * 			the dimensionalities don't match, or the resolved overlap is not smaller than the tile size
	 */
	public static void validate( final TilingSpec spec )
	{
		final long[] imageShape = spec.getImageShape(), tileShape = spec.getTileShape();
		final double[] overlap = spec.getOverlap();

		if ( imageShape.length == 0 )
			throw new InvalidTileSpecException( "Image shape is empty" );

		if ( tileShape.length != imageShape.length || overlap.length != imageShape.length )
			throw new InvalidTileSpecException( "Dimensionality mismatch: " + spec );

		for ( int d = 0; d < imageShape.length; ++d )
		{
			if ( imageShape[ d ] <= 0 )
				throw new InvalidTileSpecException( "Image shape must be positive: " + Arrays.toString( imageShape ) );
			if ( tileShape[ d ] <= 0 )
				throw new InvalidTileSpecException( "Tile shape must be positive: " + Arrays.toString( tileShape ) );
			if ( overlap[ d ] <= 0 || Double.isNaN( overlap[ d ] ) || Double.isInfinite( overlap[ d ] ) )
				throw new InvalidTileSpecException( "Overlap must be positive: " + Arrays.toString( overlap ) );
		}

		final long[] overlapSize = resolveOverlap( tileShape, overlap, spec.getOverlapMode() );
		for ( int d = 0; d < imageShape.length; ++d )
		{
			// a small fraction may round down to no overlap at all
			if ( overlapSize[ d ] <= 0 )
				throw new InvalidTileSpecException( "Overlap " + overlap[ d ] + " resolves to " + overlapSize[ d ] + " pixels in dimension " + d );
			if ( tileShape[ d ] <= overlapSize[ d ] )
				throw new InvalidTileSpecException( "Tile size " + tileShape[ d ] + " must be larger than overlap " + overlapSize[ d ] + " in dimension " + d );
		}
	}

	/**
	 * Converts the overlap into pixels.
	 * Fractions are multiplied by the tile size and rounded to the nearest integer.
	 */
	public static long[] resolveOverlap( final long[] tileShape, final double[] overlap, final OverlapMode mode )
	{
		final long[] overlapSize = new long[ overlap.length ];
		for ( int d = 0; d < overlap.length; ++d )
		{
			switch ( mode )
			{
			case ABSOLUTE:
				if ( overlap[ d ] != Math.rint( overlap[ d ] ) )
					throw new InvalidTileSpecException( "Absolute overlap must be a whole number of pixels: " + Arrays.toString( overlap ) );
				overlapSize[ d ] = ( long ) overlap[ d ];
				break;
			case FRACTION:
				overlapSize[ d ] = Math.round( tileShape[ d ] * overlap[ d ] );
				break;
			default:
				throw new InvalidTileSpecException( "Unknown overlap mode " + mode );
			}
		}
		return overlapSize;
	}

	/**
	 * Number of tiles per dimension: {@code ceil((S - O) / (T - O))}, at least 1.
	 */
	public static long[] gridSize( final long[] imageShape, final long[] tileShape, final long[] overlapSize )
	{
		final long[] gridSize = new long[ imageShape.length ];
		for ( int d = 0; d < gridSize.length; ++d )
			gridSize[ d ] = numTiles( imageShape[ d ], tileShape[ d ], overlapSize[ d ] );
		return gridSize;
	}

	public static long numTiles( final long imageSize, final long tileSize, final long overlapSize )
	{
		final long step = tileSize - overlapSize;
		final long covered = imageSize - overlapSize;
		if ( covered <= 0 )
			return 1;
		return Math.max( 1, ( covered + step - 1 ) / step );
	}

	public static long tileMin( final long i, final long tileSize, final long overlapSize )
	{
		return i * ( tileSize - overlapSize );
	}

	/**
	 * Inclusive max coordinate of tile {@code i}, clipped to the image.
	 */
	public static long tileMax( final long i, final long imageSize, final long tileSize, final long overlapSize )
	{
		return Math.min( tileMin( i, tileSize, overlapSize ) + tileSize, imageSize ) - 1;
	}

	/**
	 * Tile bounds along each dimension. Returns {@code [dimension][tile][0 = min, 1 = max]}.
	 */
	public static long[][][] axisBounds( final long[] imageShape, final long[] tileShape, final long[] overlapSize )
	{
		final long[] gridSize = gridSize( imageShape, tileShape, overlapSize );
		final long[][][] bounds = new long[ imageShape.length ][][];
		for ( int d = 0; d < imageShape.length; ++d )
		{
			bounds[ d ] = new long[ ( int ) gridSize[ d ] ][ 2 ];
			for ( int i = 0; i < gridSize[ d ]; ++i )
			{
				bounds[ d ][ i ][ 0 ] = tileMin( i, tileShape[ d ], overlapSize[ d ] );
				bounds[ d ][ i ][ 1 ] = tileMax( i, imageShape[ d ], tileShape[ d ], overlapSize[ d ] );
			}
		}
		return bounds;
	}

	/**
	 * Maps tile bounds onto a resampled image of size {@code round(S * scale)}.
	 * Bounds are multiplied by the effective scale {@code round(S * scale) / S} and rounded,
	 * which keeps neighboring tiles adjacent or overlapping after scaling.
	 *
	 * @throws InvalidTileSpecException if a tile collapses to zero size
	 */
	public static long[][][] scaleAxisBounds( final long[][][] bounds, final long[] imageShape, final long[] scaledImageShape )
	{
		final long[][][] scaledBounds = new long[ bounds.length ][][];
		for ( int d = 0; d < bounds.length; ++d )
		{
			final double effectiveScale = ( double ) scaledImageShape[ d ] / imageShape[ d ];
			scaledBounds[ d ] = new long[ bounds[ d ].length ][ 2 ];
			for ( int i = 0; i < bounds[ d ].length; ++i )
			{
				scaledBounds[ d ][ i ][ 0 ] = Math.round( bounds[ d ][ i ][ 0 ] * effectiveScale );
				scaledBounds[ d ][ i ][ 1 ] = Math.round( ( bounds[ d ][ i ][ 1 ] + 1 ) * effectiveScale ) - 1;
				if ( scaledBounds[ d ][ i ][ 1 ] < scaledBounds[ d ][ i ][ 0 ] )
					throw new InvalidTileSpecException( "Tile " + i + " in dimension " + d + " collapses to zero size at scale " + effectiveScale );
			}
		}
		return scaledBounds;
	}

	public static long[] scaleShape( final long[] imageShape, final double[] scale )
	{
		final long[] scaledShape = new long[ imageShape.length ];
		for ( int d = 0; d < scaledShape.length; ++d )
		{
			scaledShape[ d ] = Math.round( imageShape[ d ] * scale[ d ] );
			if ( scaledShape[ d ] <= 0 )
				throw new InvalidTileSpecException( "Scaled image shape must be positive, got " + Arrays.toString( scaledShape ) + " for scale " + Arrays.toString( scale ) );
		}
		return scaledShape;
	}

	/**
	 * Creates tiles from per-dimension bounds. The first dimension varies slowest.
	 * Overlap margins are derived from the bounds of the neighboring tiles.
	 */
	public static List< Tile > createTiles( final long[][][] bounds )
	{
		final List< Tile > tiles = new ArrayList<>();
		createTilesRecursive(
				bounds,
				tiles,
				new long[ bounds.length ],
				0
			);
		return tiles;
	}

	private static void createTilesRecursive(
			final long[][][] bounds,
			final List< Tile > tiles,
			final long[] gridPosition,
			final int currDim )
	{
		if ( currDim == bounds.length )
		{
			tiles.add( createTile( bounds, tiles.size(), gridPosition ) );
			return;
		}

		for ( int i = 0; i < bounds[ currDim ].length; ++i )
		{
			final long[] newGridPosition = gridPosition.clone();
			newGridPosition[ currDim ] = i;
			createTilesRecursive(
					bounds,
					tiles,
					newGridPosition,
					currDim + 1
				);
		}
	}

	private static Tile createTile( final long[][][] bounds, final int index, final long[] gridPosition )
	{
		final int n = bounds.length;
		final long[] min = new long[ n ], max = new long[ n ];
		final long[] overlapMin = new long[ n ], overlapMax = new long[ n ];
		final boolean[] borderMin = new boolean[ n ], borderMax = new boolean[ n ];
		for ( int d = 0; d < n; ++d )
		{
			final int i = ( int ) gridPosition[ d ];
			final long[][] axis = bounds[ d ];
			min[ d ] = axis[ i ][ 0 ];
			max[ d ] = axis[ i ][ 1 ];

			borderMin[ d ] = i == 0;
			borderMax[ d ] = i == axis.length - 1;

			overlapMin[ d ] = borderMin[ d ] ? 0 : Math.max( 0, axis[ i - 1 ][ 1 ] - axis[ i ][ 0 ] + 1 );
			overlapMax[ d ] = borderMax[ d ] ? 0 : Math.max( 0, axis[ i ][ 1 ] - axis[ i + 1 ][ 0 ] + 1 );
		}
		return new Tile( index, gridPosition, min, max, overlapMin, overlapMax, borderMin, borderMax );
	}
}
