package org.janelia.tiling.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.tiling.Tile;
import org.janelia.tiling.executor.KeyedTask;
import org.janelia.tiling.executor.TaskOutcome;
import org.janelia.tiling.source.LazyTileSource;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * Unit of work submitted to the executor: reads and processes one tile, or one batch of consecutive tiles.
 * Keyed by the index of its first tile.
 * <p>
 * A single-tile function is applied to each tile separately, so a failure only affects the tile it occurred on.
 * A batch function is applied once, so its failure is reported for every tile of the batch.
 * </p>
 */
public class TileTask< T extends NativeType< T > > implements KeyedTask< List< TaskOutcome< TileResult > > >
{
	private static final long serialVersionUID = -6420986173370315924L;

	private final List< Tile > tiles;
	private final LazyTileSource< T > source;
	private final TileFunction< T > function;
	private final BatchTileFunction< T > batchFunction;
	private final int padToSize;

	TileTask( final List< Tile > tiles, final LazyTileSource< T > source, final TileFunction< T > function )
	{
		this.tiles = Collections.unmodifiableList( new ArrayList<>( tiles ) );
		this.source = source;
		this.function = function;
		this.batchFunction = null;
		this.padToSize = 0;
	}

	TileTask( final List< Tile > tiles, final LazyTileSource< T > source, final BatchTileFunction< T > batchFunction, final int padToSize )
	{
		this.tiles = Collections.unmodifiableList( new ArrayList<>( tiles ) );
		this.source = source;
		this.function = null;
		this.batchFunction = batchFunction;
		this.padToSize = padToSize;
	}

	@Override
	public int getKey()
	{
		return tiles.get( 0 ).getIndex();
	}

	/**
	 * @return tiles processed by this unit in tile order
	 */
	public List< Tile > getTiles()
	{
		return tiles;
	}

	public boolean isBatch()
	{
		return batchFunction != null;
	}

	/**
	 * @return outcome for every tile of this unit, in tile order
	 */
	@Override
	public List< TaskOutcome< TileResult > > call() throws Exception
	{
		return batchFunction != null ? callBatch() : callEach();
	}

	private List< TaskOutcome< TileResult > > callEach() throws InterruptedException
	{
		final List< TaskOutcome< TileResult > > outcomes = new ArrayList<>( tiles.size() );
		for ( final Tile tile : tiles )
		{
			outcomes.add( TaskOutcome.run( () ->
				{
					final RandomAccessibleInterval< T > tileData = source.read( tile );
					return createResult( tile, function.apply( tileData, tile ) );
				} ) );
		}
		return outcomes;
	}

	private List< TaskOutcome< TileResult > > callBatch() throws InterruptedException
	{
		final TaskOutcome< List< TileResult > > batchOutcome = TaskOutcome.run( () ->
			{
				final List< RandomAccessibleInterval< T > > batch = new ArrayList<>( Math.max( tiles.size(), padToSize ) );
				for ( final Tile tile : tiles )
					batch.add( source.read( tile ) );

				// repeat the last tile to keep the batch size constant
				while ( batch.size() < padToSize )
					batch.add( batch.get( tiles.size() - 1 ) );

				final List< TileOutput > outputs = batchFunction.apply( batch );
				if ( outputs == null || outputs.size() != batch.size() )
					throw new IllegalStateException( "Batch function returned " + ( outputs == null ? "null" : outputs.size() + " output(s)" ) + " for a batch of " + batch.size() + " tile(s)" );

				final List< TileResult > results = new ArrayList<>( tiles.size() );
				for ( int i = 0; i < tiles.size(); ++i )
					results.add( createResult( tiles.get( i ), outputs.get( i ) ) );
				return results;
			} );

		final List< TaskOutcome< TileResult > > outcomes = new ArrayList<>( tiles.size() );
		for ( int i = 0; i < tiles.size(); ++i )
		{
			if ( batchOutcome.isSuccess() )
				outcomes.add( TaskOutcome.success( batchOutcome.getValue().get( i ) ) );
			else
				outcomes.add( TaskOutcome.failure( batchOutcome.getFailure() ) );
		}
		return outcomes;
	}

	private static TileResult createResult( final Tile tile, final TileOutput output )
	{
		if ( output == null )
			throw new NullPointerException( "Tile function returned null for " + tile );
		return new TileResult( tile, output );
	}

	@Override
	public String toString()
	{
		return "task " + getKey() + " (" + tiles.size() + " tile(s)" + ( isBatch() ? ", batched" : "" ) + ")";
	}
}
