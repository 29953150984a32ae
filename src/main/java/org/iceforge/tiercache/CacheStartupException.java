package org.iceforge.tiercache;

/**
 * The cache could not start: either the disk tier failed to come up, or the remote
 * probe failed and the disk tier was closed again.
 */
public class CacheStartupException extends RuntimeException {
    public CacheStartupException(String message, Throwable cause) { super(message, cause); }
    public CacheStartupException(String message) { super(message); }
}
