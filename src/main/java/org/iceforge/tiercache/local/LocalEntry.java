package org.iceforge.tiercache.local;

import java.nio.file.Path;

public record LocalEntry(String outputId, Path blobPath) {}
