package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ObjectsOutput extends TileOutput
{
	private static final long serialVersionUID = 5106298391012371284L;

	private final List< Detection > detections;

	ObjectsOutput( final List< Detection > detections )
	{
		this.detections = Collections.unmodifiableList( new ArrayList<>( detections ) );
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.OBJECTS;
	}

	/**
	 * @return detections in the order they were produced, which is used to break ties when stitching
	 */
	public List< Detection > getDetections()
	{
		return detections;
	}

	@Override
	public String toString()
	{
		return detections.size() + " object(s)";
	}
}
