package org.janelia.tiling.job;

import org.janelia.tiling.Tile;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * Tile function that is explicitly given the {@link Tile} it is applied to,
 * i.e. its bounding box in the image, overlap margins and border flags.
 */
@FunctionalInterface
public interface PositionAwareTileFunction< T extends NativeType< T > > extends TileFunction< T >
{
	@Override
	public TileOutput apply( final RandomAccessibleInterval< T > tileData, final Tile tile ) throws Exception;

	@Override
	public default TileOutput apply( final RandomAccessibleInterval< T > tileData ) throws Exception
	{
		throw new UnsupportedOperationException( "Position-aware tile function requires a tile" );
	}
}
