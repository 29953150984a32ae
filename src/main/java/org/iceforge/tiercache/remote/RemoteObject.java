package org.iceforge.tiercache.remote;

import java.io.IOException;
import java.io.InputStream;

/**
 * A remote hit. The caller owns {@code body} and must close it.
 */
public record RemoteObject(String outputId, long size, InputStream body) implements AutoCloseable {
    @Override
    public void close() throws IOException {
        body.close();
    }
}
