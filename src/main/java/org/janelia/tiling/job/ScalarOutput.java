package org.janelia.tiling.job;

public class ScalarOutput extends TileOutput
{
	private static final long serialVersionUID = 3017718566219480417L;

	private final double value;

	ScalarOutput( final double value )
	{
		this.value = value;
	}

	@Override
	public OutputKind getKind()
	{
		return OutputKind.SCALAR;
	}

	public double getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return "scalar " + value;
	}
}
