package org.janelia.tiling.job;

import java.io.Serializable;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * User function that processes several tiles in one call, e.g. a model that is evaluated on a stack of inputs.
 * It has to return one output per input, in the same order.
 * If the final batch is padded to the full batch size, the outputs for the padding are discarded.
 */
@FunctionalInterface
public interface BatchTileFunction< T extends NativeType< T > > extends Serializable
{
	public List< TileOutput > apply( final List< RandomAccessibleInterval< T > > batch ) throws Exception;
}
