package org.janelia.tiling;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.janelia.tiling.stitch.BlendMode;
import org.janelia.tiling.stitch.DedupMetric;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Per-job options of the tiling engine.
 * <p>
 * Can be created with a {@link Builder}, from a map of options, or from a JSON object.
 * The recognized option keys are listed in {@link #KEYS}; any other key is rejected.
 * </p>
 */
public class TilingConfig implements Serializable
{
	private static final long serialVersionUID = -5036720385623617743L;

	public static final String OVERLAP_MODE = "overlap_mode";
	public static final String DROP_BORDER_OUTPUT = "drop_border_output";
	public static final String OUTPUT_SCALE = "output_scale";
	public static final String BATCH_AXIS = "batch_axis";
	public static final String BLEND = "blend";
	public static final String DEDUP_THRESHOLD = "dedup_threshold";
	public static final String BATCH_SIZE = "batch_size";
	public static final String PAD_FINAL_BATCH = "pad_final_batch";
	public static final String DEDUP_METRIC = "dedup_metric";

	public static final Set< String > KEYS = Collections.unmodifiableSet( new LinkedHashSet<>( Arrays.asList(
			OVERLAP_MODE,
			DROP_BORDER_OUTPUT,
			OUTPUT_SCALE,
			BATCH_AXIS,
			BLEND,
			DEDUP_THRESHOLD,
			BATCH_SIZE,
			PAD_FINAL_BATCH,
			DEDUP_METRIC ) ) );

	private static final TilingConfig DEFAULT = new Builder().build();

	private final OverlapMode overlapMode;
	private final boolean dropBorderOutput;
	private final double[] outputScale;
	private final boolean batchAxis;
	private final BlendMode blendMode;
	private final Double dedupThreshold;
	private final int batchSize;
	private final boolean padFinalBatch;
	private final DedupMetric dedupMetric;

	private TilingConfig( final Builder builder )
	{
		this.overlapMode = builder.overlapMode;
		this.dropBorderOutput = builder.dropBorderOutput;
		this.outputScale = builder.outputScale == null ? null : builder.outputScale.clone();
		this.batchAxis = builder.batchAxis;
		this.blendMode = builder.blendMode == null ? BlendMode.CROP : builder.blendMode;
		this.dedupThreshold = builder.dedupThreshold;
		this.batchSize = builder.batchSize == null ? 1 : builder.batchSize;
		this.padFinalBatch = builder.padFinalBatch != null && builder.padFinalBatch;
		this.dedupMetric = builder.dedupMetric == null ? DedupMetric.IOU : builder.dedupMetric;
	}

	public static TilingConfig defaults()
	{
		return DEFAULT;
	}

	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a config from an option map, e.g. {@code {"blend": "linear", "output_scale": [0.5, 0.5]}}.
	 *
	 * @throws InvalidConfigException for unrecognized keys, malformed values or contradictory options
	 */
	public static TilingConfig fromMap( final Map< String, ? > options )
	{
		final Builder builder = new Builder();
		for ( final Map.Entry< String, ? > option : options.entrySet() )
		{
			final String key = option.getKey();
			final Object value = option.getValue();
			if ( value == null )
				throw new InvalidConfigException( "Option '" + key + "' has no value" );

			switch ( key )
			{
			case OVERLAP_MODE:
				builder.overlapMode( OverlapMode.fromString( asString( key, value ) ) );
				break;
			case DROP_BORDER_OUTPUT:
				builder.dropBorderOutput( asBoolean( key, value ) );
				break;
			case OUTPUT_SCALE:
				builder.outputScale( asDoubleArray( key, value ) );
				break;
			case BATCH_AXIS:
				builder.batchAxis( asBoolean( key, value ) );
				break;
			case BLEND:
				builder.blendMode( BlendMode.fromString( asString( key, value ) ) );
				break;
			case DEDUP_THRESHOLD:
				builder.dedupThreshold( asDouble( key, value ) );
				break;
			case BATCH_SIZE:
				builder.batchSize( asInt( key, value ) );
				break;
			case PAD_FINAL_BATCH:
				builder.padFinalBatch( asBoolean( key, value ) );
				break;
			case DEDUP_METRIC:
				builder.dedupMetric( DedupMetric.fromString( asString( key, value ) ) );
				break;
			default:
				throw new InvalidConfigException( "Unrecognized option '" + key + "'. Recognized options are: " + KEYS );
			}
		}
		return builder.build();
	}

	/**
	 * Reads a config from a JSON object, e.g. {@code {"blend": "linear", "dedup_threshold": 0.3}}.
	 */
	public static TilingConfig fromJson( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final JsonElement root = JsonParser.parseReader( closeableReader );
			if ( !root.isJsonObject() )
				throw new InvalidConfigException( "Config must be a JSON object, got: " + root );

			final Map< String, Object > options = new LinkedHashMap<>();
			for ( final Map.Entry< String, JsonElement > entry : root.getAsJsonObject().entrySet() )
				options.put( entry.getKey(), fromJsonElement( entry.getKey(), entry.getValue() ) );
			return fromMap( options );
		}
		catch ( final JsonParseException e )
		{
			throw new InvalidConfigException( "Malformed JSON config: " + e.getMessage(), e );
		}
	}

	public String toJson()
	{
		final JsonObject json = new JsonObject();
		json.addProperty( OVERLAP_MODE, overlapMode.toString() );
		json.addProperty( DROP_BORDER_OUTPUT, dropBorderOutput );
		if ( outputScale != null )
		{
			final JsonArray scale = new JsonArray();
			for ( final double s : outputScale )
				scale.add( s );
			json.add( OUTPUT_SCALE, scale );
		}
		json.addProperty( BATCH_AXIS, batchAxis );
		json.addProperty( BLEND, blendMode.toString() );
		if ( dedupThreshold != null )
			json.addProperty( DEDUP_THRESHOLD, dedupThreshold );
		if ( batchAxis )
		{
			json.addProperty( BATCH_SIZE, batchSize );
			json.addProperty( PAD_FINAL_BATCH, padFinalBatch );
		}
		json.addProperty( DEDUP_METRIC, dedupMetric.toString() );
		return json.toString();
	}

	public OverlapMode getOverlapMode()
	{
		return overlapMode;
	}

	/**
	 * Interprets the overlap in the configured overlap mode.
	 */
	public TilingSpec createTilingSpec( final long[] imageShape, final long[] tileShape, final double... overlap )
	{
		return new TilingSpec( imageShape, tileShape, overlap, overlapMode );
	}

	/**
	 * @throws InvalidConfigException if the partition has been built with a different overlap mode
	 */
	public void checkPartition( final TilePartition partition )
	{
		final OverlapMode partitionOverlapMode = partition.getSpec().getOverlapMode();
		if ( partitionOverlapMode != overlapMode )
			throw new InvalidConfigException( "Option '" + OVERLAP_MODE + "' is " + overlapMode + " but the partition has been built with overlap mode " + partitionOverlapMode + ": " + partition );
	}

	public boolean isDropBorderOutput()
	{
		return dropBorderOutput;
	}

	public boolean hasOutputScale()
	{
		return outputScale != null;
	}

	/**
	 * Returns the per-dimension output scale, expanding a single value to all dimensions.
	 *
	 * @return output scale, or null if it has not been configured
	 */
	public double[] getOutputScale( final int numDimensions )
	{
		if ( outputScale == null )
			return null;

		if ( outputScale.length == 1 )
		{
			final double[] uniformScale = new double[ numDimensions ];
			Arrays.fill( uniformScale, outputScale[ 0 ] );
			return uniformScale;
		}

		if ( outputScale.length != numDimensions )
			throw new InvalidConfigException( "Output scale " + Arrays.toString( outputScale ) + " does not match dimensionality " + numDimensions );

		return outputScale.clone();
	}

	public boolean isBatchAxis()
	{
		return batchAxis;
	}

	public BlendMode getBlendMode()
	{
		return blendMode;
	}

	/**
	 * @return the configured threshold, or {@code defaultValue} if it has not been set
	 */
	public double getDedupThreshold( final double defaultValue )
	{
		return dedupThreshold != null ? dedupThreshold : defaultValue;
	}

	public int getBatchSize()
	{
		return batchSize;
	}

	public boolean isPadFinalBatch()
	{
		return padFinalBatch;
	}

	public DedupMetric getDedupMetric()
	{
		return dedupMetric;
	}

	@Override
	public String toString()
	{
		return toJson();
	}

	private static Object fromJsonElement( final String key, final JsonElement element )
	{
		if ( element.isJsonNull() )
			return null;

		if ( element.isJsonArray() )
		{
			final JsonArray array = element.getAsJsonArray();
			final double[] values = new double[ array.size() ];
			for ( int i = 0; i < values.length; ++i )
				values[ i ] = asDouble( key, fromJsonElement( key, array.get( i ) ) );
			return values;
		}

		if ( element.isJsonPrimitive() )
		{
			final JsonPrimitive primitive = element.getAsJsonPrimitive();
			if ( primitive.isBoolean() )
				return primitive.getAsBoolean();
			if ( primitive.isNumber() )
				return primitive.getAsDouble();
			return primitive.getAsString();
		}

		throw new InvalidConfigException( "Option '" + key + "' has an unsupported value: " + element );
	}

	private static String asString( final String key, final Object value )
	{
		if ( value instanceof String )
			return ( String ) value;
		if ( value instanceof Enum )
			return ( ( Enum< ? > ) value ).name();
		throw new InvalidConfigException( "Option '" + key + "' expects a string, got: " + value );
	}

	private static boolean asBoolean( final String key, final Object value )
	{
		if ( value instanceof Boolean )
			return ( Boolean ) value;
		if ( value instanceof String )
		{
			final String str = ( ( String ) value ).trim();
			if ( str.equalsIgnoreCase( "true" ) )
				return true;
			if ( str.equalsIgnoreCase( "false" ) )
				return false;
		}
		throw new InvalidConfigException( "Option '" + key + "' expects a boolean, got: " + value );
	}

	private static double asDouble( final String key, final Object value )
	{
		if ( value instanceof Number )
			return ( ( Number ) value ).doubleValue();
		if ( value instanceof String )
		{
			try
			{
				return Double.parseDouble( ( ( String ) value ).trim() );
			}
			catch ( final NumberFormatException e )
			{
				throw new InvalidConfigException( "Option '" + key + "' expects a number, got: " + value, e );
			}
		}
		throw new InvalidConfigException( "Option '" + key + "' expects a number, got: " + value );
	}

	private static int asInt( final String key, final Object value )
	{
		final double doubleValue = asDouble( key, value );
		if ( doubleValue != Math.rint( doubleValue ) || Math.abs( doubleValue ) > Integer.MAX_VALUE )
			throw new InvalidConfigException( "Option '" + key + "' expects an integer, got: " + value );
		return ( int ) doubleValue;
	}

	private static double[] asDoubleArray( final String key, final Object value )
	{
		if ( value instanceof double[] )
			return ( ( double[] ) value ).clone();
		if ( value instanceof Collection )
		{
			final Collection< ? > collection = ( Collection< ? > ) value;
			final double[] values = new double[ collection.size() ];
			int i = 0;
			for ( final Object element : collection )
				values[ i++ ] = asDouble( key, element );
			return values;
		}
		return new double[] { asDouble( key, value ) };
	}

	public static class Builder
	{
		private OverlapMode overlapMode = OverlapMode.ABSOLUTE;
		private boolean dropBorderOutput = false;
		private double[] outputScale = null;
		private boolean batchAxis = false;
		private BlendMode blendMode = null;
		private Double dedupThreshold = null;
		private Integer batchSize = null;
		private Boolean padFinalBatch = null;
		private DedupMetric dedupMetric = null;

		public Builder overlapMode( final OverlapMode overlapMode )
		{
			this.overlapMode = overlapMode;
			return this;
		}

		public Builder dropBorderOutput( final boolean dropBorderOutput )
		{
			this.dropBorderOutput = dropBorderOutput;
			return this;
		}

		public Builder outputScale( final double... outputScale )
		{
			this.outputScale = outputScale;
			return this;
		}

		public Builder batchAxis( final boolean batchAxis )
		{
			this.batchAxis = batchAxis;
			return this;
		}

		public Builder blendMode( final BlendMode blendMode )
		{
			this.blendMode = blendMode;
			return this;
		}

		public Builder dedupThreshold( final double dedupThreshold )
		{
			this.dedupThreshold = dedupThreshold;
			return this;
		}

		public Builder batchSize( final int batchSize )
		{
			this.batchSize = batchSize;
			return this;
		}

		public Builder padFinalBatch( final boolean padFinalBatch )
		{
			this.padFinalBatch = padFinalBatch;
			return this;
		}

		public Builder dedupMetric( final DedupMetric dedupMetric )
		{
			this.dedupMetric = dedupMetric;
			return this;
		}

		/**
		 * @throws InvalidConfigException if the options contradict each other or have invalid values
		 */
		public TilingConfig build()
		{
			if ( overlapMode == null )
				throw new InvalidConfigException( "Overlap mode is required" );

			if ( outputScale != null )
			{
				if ( outputScale.length == 0 )
					throw new InvalidConfigException( "Output scale is empty" );
				for ( final double s : outputScale )
					if ( !( s > 0 ) || Double.isInfinite( s ) )
						throw new InvalidConfigException( "Output scale must be positive: " + Arrays.toString( outputScale ) );
			}

			if ( dedupThreshold != null && ( !( dedupThreshold >= 0 ) || Double.isInfinite( dedupThreshold ) ) )
				throw new InvalidConfigException( "Dedup threshold must be a non-negative number, got " + dedupThreshold );

			if ( !batchAxis && batchSize != null )
				throw new InvalidConfigException( "'" + BATCH_SIZE + "' requires '" + BATCH_AXIS + "' to be enabled" );

			if ( !batchAxis && padFinalBatch != null )
				throw new InvalidConfigException( "'" + PAD_FINAL_BATCH + "' requires '" + BATCH_AXIS + "' to be enabled" );

			if ( batchSize != null && batchSize < 1 )
				throw new InvalidConfigException( "Batch size must be at least 1, got " + batchSize );

			if ( dropBorderOutput && blendMode != null && blendMode != BlendMode.CROP )
				throw new InvalidConfigException( "'" + DROP_BORDER_OUTPUT + "' writes every tile without blending and cannot be combined with blend mode '" + blendMode + "'" );

			return new TilingConfig( this );
		}
	}
}
