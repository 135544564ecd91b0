package org.janelia.tiling.executor;

import java.io.Serializable;
import java.util.concurrent.Callable;

/**
 * Independent unit of work addressable by a caller-supplied key.
 * Units may be run concurrently, in any order and more than once, so {@link #call()} must not depend on shared mutable state.
 */
public interface KeyedTask< V > extends Callable< V >, Serializable
{
	public int getKey();
}
