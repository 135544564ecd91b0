package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.tiling.Tile;
import org.janelia.tiling.TilePartition;
import org.janelia.tiling.TilingConfig;
import org.janelia.tiling.executor.TileExecutor;
import org.janelia.tiling.source.ImageSource;
import org.janelia.tiling.source.LazyTileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.type.NativeType;

/**
 * Explicit task graph of a tiled job.
 * <p>
 * Every tile contributes two nodes, {@code (tile, READ)} and {@code (tile, APPLY)}, connected by a read-before-apply edge.
 * There are no edges between tiles, so all tiles can be processed in parallel.
 * The nodes are grouped into {@link TileTask}s, the units handed to the executor: one per tile,
 * or one per batch of consecutive tiles if batching is enabled.
 * </p>
 * <p>
 * Building the graph does not read or compute anything. Work starts once the {@link TileJob} returned by {@link #submit(TileExecutor)} is collected.
 * </p>
 */
public class TileJobGraph< T extends NativeType< T > >
{
	private static final Logger LOG = LoggerFactory.getLogger( TileJobGraph.class );

	private final TilePartition partition;
	private final LazyTileSource< T > source;
	private final TilingConfig config;
	private final Map< TaskNode, List< TaskNode > > successors;
	private final List< TileTask< T > > tasks;

	private TileJobGraph( final TilePartition partition, final LazyTileSource< T > source, final TilingConfig config, final List< TileTask< T > > tasks )
	{
		this.partition = partition;
		this.source = source;
		this.config = config;
		this.tasks = Collections.unmodifiableList( tasks );

		successors = new LinkedHashMap<>();
		for ( final Tile tile : partition.getTiles() )
		{
			final TaskNode readNode = new TaskNode( tile.getIndex(), TaskNode.Stage.READ );
			final TaskNode applyNode = new TaskNode( tile.getIndex(), TaskNode.Stage.APPLY );
			successors.put( readNode, Collections.singletonList( applyNode ) );
			successors.put( applyNode, Collections.emptyList() );
		}
	}

	/**
	 * Builds the graph for a function that processes one tile at a time.
	 * If batching is enabled, several tiles are processed one after another within one unit of work.
	 *
	 * @throws IllegalArgumentException if the source does not match the partition
	 * @throws org.janelia.tiling.InvalidConfigException if the partition does not follow the configured overlap mode
	 */
	public static < T extends NativeType< T > > TileJobGraph< T > build(
			final TilePartition partition,
			final ImageSource< T > source,
			final TileFunction< T > function,
			final TilingConfig config )
	{
		config.checkPartition( partition );
		final LazyTileSource< T > tileSource = new LazyTileSource<>( source, partition );
		final List< TileTask< T > > tasks = new ArrayList<>();
		for ( final List< Tile > unitTiles : groupTiles( partition, config ) )
			tasks.add( new TileTask<>( unitTiles, tileSource, function ) );
		return new TileJobGraph<>( partition, tileSource, config, tasks );
	}

	/**
	 * Builds the graph for a function that processes a list of tiles in one call.
	 * Without batching, every call receives a single tile.
	 *
	 * @throws IllegalArgumentException if the source does not match the partition
	 */
	public static < T extends NativeType< T > > TileJobGraph< T > build(
			final TilePartition partition,
			final ImageSource< T > source,
			final BatchTileFunction< T > batchFunction,
			final TilingConfig config )
	{
		config.checkPartition( partition );
		final LazyTileSource< T > tileSource = new LazyTileSource<>( source, partition );
		final int padToSize = config.isBatchAxis() && config.isPadFinalBatch() ? config.getBatchSize() : 0;
		final List< TileTask< T > > tasks = new ArrayList<>();
		for ( final List< Tile > unitTiles : groupTiles( partition, config ) )
			tasks.add( new TileTask<>( unitTiles, tileSource, batchFunction, padToSize ) );
		return new TileJobGraph<>( partition, tileSource, config, tasks );
	}

	private static List< List< Tile > > groupTiles( final TilePartition partition, final TilingConfig config )
	{
		final int unitSize = config.isBatchAxis() ? config.getBatchSize() : 1;
		final List< Tile > tiles = partition.getTiles();
		final List< List< Tile > > groups = new ArrayList<>();
		for ( int i = 0; i < tiles.size(); i += unitSize )
			groups.add( tiles.subList( i, Math.min( i + unitSize, tiles.size() ) ) );
		return groups;
	}

	public TilePartition getPartition()
	{
		return partition;
	}

	public LazyTileSource< T > getSource()
	{
		return source;
	}

	public TilingConfig getConfig()
	{
		return config;
	}

	/**
	 * @return all nodes, two per tile in tile order
	 */
	public List< TaskNode > getNodes()
	{
		return new ArrayList<>( successors.keySet() );
	}

	/**
	 * @return nodes that have to be completed before the given node
	 */
	public List< TaskNode > getDependencies( final TaskNode node )
	{
		checkNode( node );
		return node.getStage() == TaskNode.Stage.APPLY
				? Collections.singletonList( new TaskNode( node.getTileIndex(), TaskNode.Stage.READ ) )
				: Collections.emptyList();
	}

	/**
	 * @return nodes that depend on the given node
	 */
	public List< TaskNode > getSuccessors( final TaskNode node )
	{
		checkNode( node );
		return successors.get( node );
	}

	/**
	 * @return units of work in tile order
	 */
	public List< TileTask< T > > getTasks()
	{
		return tasks;
	}

	/**
	 * @return the unit of work that processes the given tile
	 */
	public TileTask< T > getTask( final Tile tile )
	{
		for ( final TileTask< T > task : tasks )
			if ( task.getTiles().contains( tile ) )
				return task;
		throw new IllegalArgumentException( tile + " does not belong to " + partition );
	}

	/**
	 * Hands the graph over to the executor. Execution is deferred until {@link TileJob#collect()} is called.
	 */
	public TileJob submit( final TileExecutor executor )
	{
		LOG.info( "submit: job over {} tile(s) of grid {} in {} unit(s), config {}",
				partition.numTiles(), Arrays.toString( partition.getGridSize() ), tasks.size(), config );
		return new TileJob( this, executor );
	}

	private void checkNode( final TaskNode node )
	{
		if ( !successors.containsKey( node ) )
			throw new IllegalArgumentException( "Node " + node + " is not part of the graph" );
	}
}
