package com.quoteterm.exception;

import java.nio.file.Path;
import java.util.Map;

public class StorageException extends BaseException {

    public StorageException(Path path, String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message + ": " + path, Map.of("path", path.toString()), cause);
    }
}
