package org.janelia.tiling.executor;

/**
 * Returns its key squared, or fails if asked to.
 */
public class IndexTask implements KeyedTask< Integer >
{
	private static final long serialVersionUID = -2750217453694431280L;

	private final int key;
	private final boolean fail;

	public IndexTask( final int key, final boolean fail )
	{
		this.key = key;
		this.fail = fail;
	}

	@Override
	public int getKey()
	{
		return key;
	}

	@Override
	public Integer call() throws Exception
	{
		if ( fail )
			throw new IllegalArgumentException( "task " + key + " has failed" );
		return key * key;
	}
}
