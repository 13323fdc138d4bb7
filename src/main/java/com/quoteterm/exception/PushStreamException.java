package com.quoteterm.exception;

/**
 * Unrecoverable loss of the push subscription stream. Terminates the ingestion loop;
 * reconnection is left to whoever owns the gateway.
 */
public class PushStreamException extends BaseException {

    public PushStreamException(String message) {
        super(ErrorCode.STREAM_LOST, message);
    }

    public PushStreamException(String message, Throwable cause) {
        super(ErrorCode.STREAM_LOST, message, cause);
    }
}
