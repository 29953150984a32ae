package org.iceforge.tiercache.local;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk record for one action id, stored as {@code a-<actionId>}.
 *
 * @param version   format version, currently {@link #CURRENT_VERSION}
 * @param outputId  hex output id of the blob
 * @param size      blob size in bytes
 * @param timeNanos write time, unix epoch nanoseconds
 */
public record IndexEntry(
        @JsonProperty("v") int version,
        @JsonProperty("o") String outputId,
        @JsonProperty("n") long size,
        @JsonProperty("t") long timeNanos
) {
    public static final int CURRENT_VERSION = 1;
}
