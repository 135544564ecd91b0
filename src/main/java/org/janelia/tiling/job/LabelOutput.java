package org.janelia.tiling.job;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Label image of a tile. Label 0 is background, other values are object ids that are only unique within the tile.
 */
public class LabelOutput< T extends IntegerType< T > & NativeType< T > > extends TileOutput
{
	private static final long serialVersionUID = -6211839018576410443L;

	private final RandomAccessibleInterval< T > labels;

	LabelOutput( final RandomAccessibleInterval< T > labels )
	{
		this.labels = Views.isZeroMin( labels ) ? labels : Views.zeroMin( labels );
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.LABELS;
	}

	public RandomAccessibleInterval< T > getLabels()
	{
		return labels;
	}

	public T getType()
	{
		return Util.getTypeFromInterval( labels );
	}

	@Override
	public String toString()
	{
		return "labels of size " + Arrays.toString( Intervals.dimensionsAsLongArray( labels ) );
	}
}
