package org.janelia.tiling.job;

import java.io.Serializable;

public class RawOutput extends TileOutput
{
	private static final long serialVersionUID = -4452916078232097103L;

	private final Serializable value;

	RawOutput( final Serializable value )
	{
		this.value = value;
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.RAW;
	}

	public Serializable getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return "raw " + value;
	}
}
