package com.quoteterm.ingestion;

import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.DepthBook;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.MarketSnapshot;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.domain.model.TradeTape;
import com.quoteterm.event.EventPublisherHelper;
import com.quoteterm.exception.DecodeException;
import com.quoteterm.exception.PushStreamException;
import com.quoteterm.gateway.PushStream;
import com.quoteterm.store.ChangeNotification;
import com.quoteterm.store.MarketStateStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Single consumer of the push stream: decode, apply to the store, broadcast.
 *
 * <p>Runs on one dedicated {@code push-ingest} thread, so updates for an instrument and category
 * are applied in the order they were received. There is no batching; each accepted update
 * produces exactly one {@link com.quoteterm.event.MarketChangeEvent}, and listeners run inline
 * on this thread.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>Undecodable frames are logged at WARN, counted and skipped.</li>
 *   <li>A listener failure is logged and the loop continues with the next frame.</li>
 *   <li>A {@link PushStreamException} ends the loop: the error is recorded, a
 *       {@link com.quoteterm.event.StreamLostEvent} is published and the termination future
 *       completes exceptionally. The loop does not reconnect.</li>
 * </ul>
 *
 * <p>Quote pushes do not carry the previous close; it is carried over from the stored quote so
 * change figures survive every push.
 */
@Service
@EnableConfigurationProperties(IngestionConfig.class)
public class PushIngestionLoop {

    private static final Logger log = LoggerFactory.getLogger(PushIngestionLoop.class);

    private final PushEventDecoder pushEventDecoder;
    private final MarketStateStore marketStateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final IngestionConfig ingestionConfig;
    private final Clock clock;

    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong updatesApplied = new AtomicLong();
    private final AtomicLong staleRejected = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();

    private volatile boolean running;
    private volatile Throwable terminalError;
    private volatile CompletableFuture<Void> termination = CompletableFuture.completedFuture(null);

    public PushIngestionLoop(
            PushEventDecoder pushEventDecoder,
            MarketStateStore marketStateStore,
            EventPublisherHelper eventPublisherHelper,
            IngestionConfig ingestionConfig,
            Clock clock) {
        this.pushEventDecoder = pushEventDecoder;
        this.marketStateStore = marketStateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.ingestionConfig = ingestionConfig;
        this.clock = clock;
    }

    /**
     * Starts consuming {@code pushStream} on a new thread.
     *
     * @return future completed when the loop exits; exceptional if the stream was lost
     */
    public synchronized CompletableFuture<Void> start(PushStream pushStream) {
        if (running) {
            log.warn("Push ingestion already running, ignoring start request");
            return termination;
        }
        running = true;
        terminalError = null;
        CompletableFuture<Void> future = new CompletableFuture<>();
        termination = future;

        Thread thread = new Thread(() -> run(pushStream, future), "push-ingest");
        thread.setDaemon(true);
        thread.start();
        log.info("Push ingestion started (poll timeout {}ms)", ingestionConfig.getPollTimeout().toMillis());
        return future;
    }

    /** Asks the loop to exit. It does so within one poll timeout. */
    public void stop() {
        if (running) {
            running = false;
            log.info("Push ingestion stopping");
        }
    }

    public boolean isRunning() {
        return running;
    }

    public CompletableFuture<Void> getTermination() {
        return termination;
    }

    /** The error that ended the loop, or empty if it is running or exited normally. */
    public Optional<Throwable> getTerminalError() {
        return Optional.ofNullable(terminalError);
    }

    public long getFramesReceived() {
        return framesReceived.get();
    }

    public long getUpdatesApplied() {
        return updatesApplied.get();
    }

    public long getStaleRejected() {
        return staleRejected.get();
    }

    public long getDecodeFailures() {
        return decodeFailures.get();
    }

    /**
     * Decodes and applies one frame, then publishes the resulting change.
     *
     * @return true if the store accepted the update
     */
    public boolean processFrame(String frame) {
        framesReceived.incrementAndGet();
        DecodedPushEvent decoded;
        try {
            decoded = pushEventDecoder.decode(frame);
        } catch (DecodeException e) {
            decodeFailures.incrementAndGet();
            log.warn("Skipping undecodable push frame: {}", e.getMessage());
            return false;
        }

        Optional<ChangeNotification> notification = apply(decoded);
        if (notification.isEmpty()) {
            staleRejected.incrementAndGet();
            return false;
        }
        updatesApplied.incrementAndGet();

        try {
            eventPublisherHelper.publishMarketChange(this, notification.get());
        } catch (RuntimeException e) {
            log.error("Market change listener failed for {} {}", decoded.instrument(), decoded.category(), e);
        }
        return true;
    }

    // ---- Internal ----

    private void run(PushStream pushStream, CompletableFuture<Void> future) {
        Duration pollTimeout = ingestionConfig.getPollTimeout();
        try {
            while (running) {
                Optional<String> frame = pushStream.poll(pollTimeout);
                if (frame.isPresent()) {
                    processFrame(frame.get());
                }
            }
            log.info("Push ingestion stopped after {} frames", framesReceived.get());
            running = false;
            future.complete(null);
        } catch (PushStreamException e) {
            terminalError = e;
            running = false;
            log.error("Push stream lost, ingestion terminated: {}", e.getMessage(), e);
            try {
                eventPublisherHelper.publishStreamLost(this, e, clock.instant());
            } finally {
                future.completeExceptionally(e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Push ingestion interrupted");
            future.complete(null);
        } catch (RuntimeException e) {
            terminalError = e;
            running = false;
            log.error("Push ingestion failed unexpectedly", e);
            future.completeExceptionally(e);
        } finally {
            running = false;
        }
    }

    private Optional<ChangeNotification> apply(DecodedPushEvent decoded) {
        InstrumentId instrument = decoded.instrument();
        return switch (decoded.category()) {
            case QUOTE -> marketStateStore.updateQuote(
                    instrument, withCarriedPrevClose(instrument, decoded.payloadAs(Quote.class)));
            case DEPTH -> marketStateStore.updateDepth(instrument, decoded.payloadAs(DepthBook.class));
            case TRADES -> marketStateStore.updateTrades(instrument, decoded.payloadAs(TradeTape.class));
            case CANDLES -> marketStateStore.updateCandles(instrument, decoded.payloadAs(CandleSeries.class));
        };
    }

    private Quote withCarriedPrevClose(InstrumentId instrument, Quote quote) {
        if (quote.getPrevClose() != null) {
            return quote;
        }
        return marketStateStore
                .get(instrument)
                .flatMap(MarketSnapshot::quote)
                .map(Quote::getPrevClose)
                .map(prevClose -> quote.toBuilder().prevClose(prevClose).build())
                .orElse(quote);
    }
}
