package com.quoteterm.simulator;

import com.quoteterm.exception.PushStreamException;
import com.quoteterm.gateway.PushStream;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue-backed {@link PushStream}. Producers {@link #offer} frames; {@link #fail} makes the next
 * poll throw once the queued frames are consumed.
 */
public class SimulatedPushStream implements PushStream {

    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private volatile PushStreamException failure;
    private volatile boolean closed;

    public void offer(String frame) {
        if (!closed) {
            frames.offer(frame);
        }
    }

    public void fail(PushStreamException error) {
        this.failure = error;
    }

    @Override
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        String frame = frames.poll();
        if (frame != null) {
            return Optional.of(frame);
        }
        checkFailed();
        frame = frames.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (frame == null) {
            checkFailed();
        }
        return Optional.ofNullable(frame);
    }

    @Override
    public void close() {
        closed = true;
        frames.clear();
    }

    public int pending() {
        return frames.size();
    }

    private void checkFailed() {
        if (failure != null) {
            throw failure;
        }
        if (closed) {
            throw new PushStreamException("Push stream closed");
        }
    }
}
