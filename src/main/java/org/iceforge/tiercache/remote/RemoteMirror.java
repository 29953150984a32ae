package org.iceforge.tiercache.remote;

import org.iceforge.tiercache.cache.CacheCounters;

import java.io.InputStream;
import java.util.Optional;

/**
 * Remote object-store tier. Objects are keyed {@code <prefix>/<actionId>} and carry
 * their output id as user metadata under {@link #OUTPUT_ID_METADATA_KEY}.
 * <p>
 * Every read resolves to exactly one of three outcomes:
 * <ul>
 *   <li>hit: a present {@link RemoteObject};</li>
 *   <li>miss: {@link Optional#empty()}, the key does not exist;</li>
 *   <li>error: {@link RemoteAccessException}, including an object that exists but has
 *       no output id, since content without identity is unusable.</li>
 * </ul>
 * Implementations never retry.
 */
public interface RemoteMirror {

    String OUTPUT_ID_METADATA_KEY = "outputid";

    /**
     * Uploads {@code size} bytes from {@code body}. A zero size uploads an explicit empty body.
     *
     * @throws RemoteAccessException if the upload fails
     */
    void put(String actionId, String outputId, long size, InputStream body);

    Optional<RemoteObject> get(String actionId);

    /** Key prefix inside the bucket. */
    String prefix();

    CacheCounters counters();
}
