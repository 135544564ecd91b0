package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.RealLocalizable;
import net.imglib2.RealPoint;

public class CoordinatesOutput extends TileOutput
{
	private static final long serialVersionUID = -772541086405620932L;

	private final double[][] points;

	CoordinatesOutput( final List< ? extends RealLocalizable > points )
	{
		this.points = new double[ points.size() ][];
		for ( int i = 0; i < this.points.length; ++i )
		{
			this.points[ i ] = new double[ points.get( i ).numDimensions() ];
			points.get( i ).localize( this.points[ i ] );
		}
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.COORDINATES;
	}

	public int numPoints()
	{
		return points.length;
	}

	/**
	 * @return copies of the points in the order they were produced
	 */
	public List< RealPoint > getPoints()
	{
		final List< RealPoint > list = new ArrayList<>( points.length );
		for ( final double[] point : points )
			list.add( new RealPoint( point ) );
		return list;
	}

	@Override
	public String toString()
	{
		return points.length + " point(s)";
	}
}
