package org.iceforge.tiercache.local;

public class ContentStoreException extends RuntimeException {
    public ContentStoreException(String message, Throwable cause) { super(message, cause); }
    public ContentStoreException(String message) { super(message); }
}
