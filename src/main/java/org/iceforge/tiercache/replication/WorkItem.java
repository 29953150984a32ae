package org.iceforge.tiercache.replication;

import java.nio.file.Path;

/**
 * One pending remote write: the blob for {@code outputId} at {@code diskPath}, to be
 * mirrored under {@code actionId}.
 */
public record WorkItem(String actionId, String outputId, long size, Path diskPath) {}
