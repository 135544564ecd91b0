package org.janelia.tiling.stitch;

import java.util.Collections;
import java.util.List;

import org.janelia.tiling.job.Detection;
import org.janelia.tiling.job.TileResult;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealPoint;

/**
 * Global result of stitching, tagged with its {@link Kind}. Coordinates are in the (possibly scaled) image space.
 */
public class StitchedResult
{
	public enum Kind
	{
		ARRAY,
		LABELS,
		OBJECTS,
		COORDINATES,
		TILES
	}

	private final Kind kind;
	private final RandomAccessibleInterval< ? > img;
	private final List< Detection > objects;
	private final List< RealPoint > points;
	private final List< TileResult > tiles;

	private StitchedResult(
			final Kind kind,
			final RandomAccessibleInterval< ? > img,
			final List< Detection > objects,
			final List< RealPoint > points,
			final List< TileResult > tiles )
	{
		this.kind = kind;
		this.img = img;
		this.objects = objects;
		this.points = points;
		this.tiles = tiles;
	}

	public static StitchedResult ofArray( final RandomAccessibleInterval< ? > img )
	{
		return new StitchedResult( Kind.ARRAY, img, null, null, null );
	}

	public static StitchedResult ofLabels( final RandomAccessibleInterval< ? > labels )
	{
		return new StitchedResult( Kind.LABELS, labels, null, null, null );
	}

	public static StitchedResult ofObjects( final List< Detection > objects )
	{
		return new StitchedResult( Kind.OBJECTS, null, Collections.unmodifiableList( objects ), null, null );
	}

	public static StitchedResult ofCoordinates( final List< RealPoint > points )
	{
		return new StitchedResult( Kind.COORDINATES, null, null, Collections.unmodifiableList( points ), null );
	}

	public static StitchedResult ofTiles( final List< TileResult > tiles )
	{
		return new StitchedResult( Kind.TILES, null, null, null, Collections.unmodifiableList( tiles ) );
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * @return stitched image for {@link Kind#ARRAY} and {@link Kind#LABELS} results
	 */
	@SuppressWarnings( "unchecked" )
	public < T > RandomAccessibleInterval< T > getImg()
	{
		checkKind( Kind.ARRAY, Kind.LABELS );
		return ( RandomAccessibleInterval< T > ) img;
	}

	public List< Detection > getObjects()
	{
		checkKind( Kind.OBJECTS );
		return objects;
	}

	public List< RealPoint > getPoints()
	{
		checkKind( Kind.COORDINATES );
		return points;
	}

	/**
	 * @return unmodified tile results in tile order
	 */
	public List< TileResult > getTiles()
	{
		checkKind( Kind.TILES );
		return tiles;
	}

	private void checkKind( final Kind... expected )
	{
		for ( final Kind k : expected )
			if ( kind == k )
				return;
		throw new IllegalStateException( "Stitched result is of kind " + kind );
	}

	@Override
	public String toString()
	{
		switch ( kind )
		{
		case OBJECTS:
			return "stitched " + objects.size() + " object(s)";
		case COORDINATES:
			return "stitched " + points.size() + " point(s)";
		case TILES:
			return "passed through " + tiles.size() + " tile(s)";
		default:
			return "stitched " + kind.toString().toLowerCase() + " image";
		}
	}
}
