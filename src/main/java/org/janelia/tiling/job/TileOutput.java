package org.janelia.tiling.job;

import java.io.Serializable;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealLocalizable;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;

/**
 * Value produced by a tile function for a single tile, tagged with its {@link OutputKind}.
 * <p>
 * Coordinates of array outputs, detections and points are local to the tile, i.e. relative to the tile min.
 * They are translated into image coordinates when stitching.
 * </p>
 */
public abstract class TileOutput implements Serializable
{
	private static final long serialVersionUID = -3935128472069140538L;

	public abstract OutputKind getKind();

	public static < T extends RealType< T > & NativeType< T > > ArrayOutput< T > array( final RandomAccessibleInterval< T > img )
	{
		return new ArrayOutput<>( img );
	}

	public static < T extends IntegerType< T > & NativeType< T > > LabelOutput< T > labels( final RandomAccessibleInterval< T > labels )
	{
		return new LabelOutput<>( labels );
	}

	public static ObjectsOutput objects( final List< Detection > detections )
	{
		return new ObjectsOutput( detections );
	}

	public static CoordinatesOutput coordinates( final List< ? extends RealLocalizable > points )
	{
		return new CoordinatesOutput( points );
	}

	public static ScalarOutput scalar( final double value )
	{
		return new ScalarOutput( value );
	}

	public static RawOutput raw( final Serializable value )
	{
		return new RawOutput( value );
	}
}
