package org.iceforge.tiercache.remote;

public class RemoteAccessException extends RuntimeException {
    public RemoteAccessException(String message, Throwable cause) { super(message, cause); }
    public RemoteAccessException(String message) { super(message); }
}
