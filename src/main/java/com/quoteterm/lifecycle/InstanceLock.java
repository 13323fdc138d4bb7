package com.quoteterm.lifecycle;

import com.quoteterm.config.StorageConfig;
import com.quoteterm.exception.InstanceLockedException;
import com.quoteterm.exception.StorageException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Exclusive lock on {@code <data-dir>/quoteterm.lock} so that only one terminal process works on
 * a data directory at a time.
 *
 * <p>The lock is an OS file lock taken without waiting; it disappears with the process, so a
 * crashed terminal never leaves a stale lock behind. The file itself holds the owner's pid for
 * diagnostics and is left in place on release.
 */
@Component
public class InstanceLock {

    private static final Logger log = LoggerFactory.getLogger(InstanceLock.class);

    private final StorageConfig storageConfig;

    // guarded by this
    private FileChannel channel;
    private FileLock fileLock;

    public InstanceLock(StorageConfig storageConfig) {
        this.storageConfig = storageConfig;
    }

    /**
     * Takes the lock. Does nothing when this instance already holds it.
     *
     * @throws InstanceLockedException if another holder has the lock
     * @throws StorageException        if the lock file cannot be created or locked
     */
    public synchronized void acquire() {
        if (fileLock != null) {
            return;
        }
        Path path = storageConfig.lockPath().toAbsolutePath();
        FileChannel opened;
        try {
            Files.createDirectories(path.getParent());
            opened = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException(path, "Cannot open instance lock file", e);
        }

        FileLock acquired;
        try {
            acquired = opened.tryLock();
        } catch (OverlappingFileLockException e) {
            // held by another channel in this JVM
            acquired = null;
        } catch (IOException e) {
            close(opened, path);
            throw new StorageException(path, "Cannot lock instance lock file", e);
        }
        if (acquired == null) {
            close(opened, path);
            throw new InstanceLockedException(path);
        }

        channel = opened;
        fileLock = acquired;
        writeOwner(path);
        log.info("Acquired instance lock {}", path);
    }

    /** Releases the lock if held. */
    public synchronized void release() {
        if (fileLock == null) {
            return;
        }
        Path path = storageConfig.lockPath().toAbsolutePath();
        try {
            fileLock.release();
        } catch (IOException e) {
            log.warn("Failed to release instance lock {}: {}", path, e.getMessage());
        } finally {
            close(channel, path);
            fileLock = null;
            channel = null;
        }
        log.info("Released instance lock {}", path);
    }

    public synchronized boolean isHeld() {
        return fileLock != null && fileLock.isValid();
    }

    private void writeOwner(Path path) {
        try {
            channel.truncate(0);
            channel.write(ByteBuffer.wrap((ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.UTF_8)), 0);
            channel.force(false);
        } catch (IOException e) {
            log.debug("Could not record pid in {}: {}", path, e.getMessage());
        }
    }

    private static void close(FileChannel fileChannel, Path path) {
        try {
            fileChannel.close();
        } catch (IOException e) {
            log.debug("Failed to close {}: {}", path, e.getMessage());
        }
    }
}
