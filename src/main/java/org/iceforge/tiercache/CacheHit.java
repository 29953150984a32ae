package org.iceforge.tiercache;

import java.nio.file.Path;

/**
 * A cache hit: the output id stored for the action and the local path of its blob.
 */
public record CacheHit(String outputId, Path diskPath) {}
