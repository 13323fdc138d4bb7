package com.quoteterm.exception;

public class DecodeException extends BaseException {

    public DecodeException(String message) {
        super(ErrorCode.DECODE_ERROR, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorCode.DECODE_ERROR, message, cause);
    }
}
