package org.janelia.tiling.job;

import java.io.Serializable;

import org.janelia.tiling.Tile;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * User function applied independently to the data of every tile.
 * <p>
 * The function receives a zero-min copy of the tile data and must not depend on where the tile is located in the image.
 * Functions that need the tile position implement {@link PositionAwareTileFunction} instead.
 * Tiles may be processed concurrently and more than once, so the function must not rely on shared mutable state.
 * </p>
 */
@FunctionalInterface
public interface TileFunction< T extends NativeType< T > > extends Serializable
{
	public TileOutput apply( final RandomAccessibleInterval< T > tileData ) throws Exception;

	/**
	 * Called by the job for every tile. Ignores the tile unless the function is position-aware.
	 */
	public default TileOutput apply( final RandomAccessibleInterval< T > tileData, final Tile tile ) throws Exception
	{
		return apply( tileData );
	}
}
