package com.quoteterm.exception;

import java.nio.file.Path;
import java.util.Map;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Thrown at startup when another terminal process already holds the lock on the data directory.
 * Spring Boot picks up the exit code when this aborts the context.
 */
public class InstanceLockedException extends BaseException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 3;

    public InstanceLockedException(Path lockPath) {
        super(
                ErrorCode.INSTANCE_LOCKED,
                "Another QuoteTerm instance is already running (lock held on " + lockPath + ")",
                Map.of("path", lockPath.toString()));
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
