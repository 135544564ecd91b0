package org.janelia.tiling.job;

import java.io.Serializable;
import java.util.Arrays;

import net.imglib2.RealInterval;
import net.imglib2.RealPoint;
import net.imglib2.RealPositionable;

/**
 * Detected object: a real-valued bounding box with a confidence score and a class id.
 * Point-like detections have {@code min == max}.
 */
public class Detection implements RealInterval, Serializable
{
	private static final long serialVersionUID = 1480927410346519208L;

	private final double[] min, max;
	private final double score;
	private final int classId;

	public Detection( final double[] min, final double[] max, final double score, final int classId )
	{
		if ( min.length != max.length )
			throw new IllegalArgumentException( "Dimensionality mismatch: min=" + Arrays.toString( min ) + ", max=" + Arrays.toString( max ) );
		for ( int d = 0; d < min.length; ++d )
			if ( min[ d ] > max[ d ] )
				throw new IllegalArgumentException( "Invalid bounding box: min=" + Arrays.toString( min ) + ", max=" + Arrays.toString( max ) );

		this.min = min.clone();
		this.max = max.clone();
		this.score = score;
		this.classId = classId;
	}

	public Detection( final double[] min, final double[] max, final double score )
	{
		this( min, max, score, 0 );
	}

	public double getScore()
	{
		return score;
	}

	public int getClassId()
	{
		return classId;
	}

	public RealPoint getCenter()
	{
		final double[] center = new double[ min.length ];
		for ( int d = 0; d < center.length; ++d )
			center[ d ] = ( min[ d ] + max[ d ] ) / 2;
		return new RealPoint( center );
	}

	public Detection translate( final double... translation )
	{
		final double[] translatedMin = min.clone(), translatedMax = max.clone();
		for ( int d = 0; d < translation.length; ++d )
		{
			translatedMin[ d ] += translation[ d ];
			translatedMax[ d ] += translation[ d ];
		}
		return new Detection( translatedMin, translatedMax, score, classId );
	}

	@Override
	public int numDimensions()
	{
		return min.length;
	}

	@Override
	public double realMin( final int d )
	{
		return min[ d ];
	}

	@Override
	public void realMin( final double[] m )
	{
		System.arraycopy( min, 0, m, 0, min.length );
	}

	@Override
	public void realMin( final RealPositionable m )
	{
		m.setPosition( min );
	}

	@Override
	public double realMax( final int d )
	{
		return max[ d ];
	}

	@Override
	public void realMax( final double[] m )
	{
		System.arraycopy( max, 0, m, 0, max.length );
	}

	@Override
	public void realMax( final RealPositionable m )
	{
		m.setPosition( max );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Detection ) )
			return false;
		final Detection other = ( Detection ) obj;
		return Arrays.equals( min, other.min )
				&& Arrays.equals( max, other.max )
				&& Double.compare( score, other.score ) == 0
				&& classId == other.classId;
	}

	@Override
	public int hashCode()
	{
		int result = Arrays.hashCode( min );
		result = 31 * result + Arrays.hashCode( max );
		result = 31 * result + Double.hashCode( score );
		result = 31 * result + classId;
		return result;
	}

	@Override
	public String toString()
	{
		return "detection min=" + Arrays.toString( min ) + ", max=" + Arrays.toString( max ) + ", score=" + score + ", class=" + classId;
	}
}
