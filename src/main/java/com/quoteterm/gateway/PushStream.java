package com.quoteterm.gateway;

import com.quoteterm.exception.PushStreamException;
import java.time.Duration;
import java.util.Optional;

/**
 * Source of raw push frames for subscribed instruments. Frames are JSON text in the form
 * {@code {"symbol":"700.HK","category":"quote","data":{...}}}.
 *
 * <p>A single consumer polls the stream; implementations need not support concurrent polls.
 */
public interface PushStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the frame, or empty if none arrived in time
     * @throws PushStreamException  if the stream has failed and will deliver nothing more
     * @throws InterruptedException if the polling thread is interrupted
     */
    Optional<String> poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
