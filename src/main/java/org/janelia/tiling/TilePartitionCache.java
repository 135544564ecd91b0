package org.janelia.tiling;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of {@link TilePartition}s keyed by {@link TilingSpec}.
 * Entries are created on first request and removed only by {@link #clear()}, never evicted while a job may use them.
 */
public class TilePartitionCache
{
	private static final Logger LOG = LoggerFactory.getLogger( TilePartitionCache.class );

	private static final TilePartitionCache INSTANCE = new TilePartitionCache();

	private final Map< TilingSpec, TilePartition > partitions = new ConcurrentHashMap<>();

	public static TilePartitionCache getInstance()
	{
		return INSTANCE;
	}

	public TilePartition getOrBuild( final TilingSpec spec )
	{
		// validate outside of computeIfAbsent so that an invalid spec never reaches the map
		TileGeometry.validate( spec );
		return partitions.computeIfAbsent( spec, key ->
			{
				final TilePartition partition = TilePartition.build( key );
				LOG.debug( "getOrBuild: built partition {}", partition );
				return partition;
			} );
	}

	public boolean contains( final TilingSpec spec )
	{
		return partitions.containsKey( spec );
	}

	public int size()
	{
		return partitions.size();
	}

	public void clear()
	{
		LOG.info( "clear: dropping {} cached partition(s)", partitions.size() );
		partitions.clear();
	}
}
