package com.relaychat.ingest;

/**
 * An inbound frame could not be decoded into a complete message.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
