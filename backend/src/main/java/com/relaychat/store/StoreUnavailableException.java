package com.relaychat.store;

/**
 * The primary store could not be reached, rejected the operation, or did not
 * answer in time.
 */
public class StoreUnavailableException extends Exception {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
