package com.quoteterm.simulator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.SubscriptionFlag;
import com.quoteterm.domain.enums.TradeDirection;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.Candle;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.OrderTicket;
import com.quoteterm.domain.model.Position;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.exception.GatewayException;
import com.quoteterm.gateway.MarketDataGateway;
import com.quoteterm.gateway.PushStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Offline implementation of {@link MarketDataGateway} for local runs and tests.
 *
 * <p>Each subscribed instrument follows a bounded random walk. On every push round a quote frame
 * is emitted per instrument, plus depth and trade frames for instruments subscribed to those
 * channels. Frames use the same JSON shape as the live feed, so they exercise the real decoder.
 *
 * <p>Snapshot queries report a fixed previous close (the starting price) so change-percent
 * figures and rules work. Positions are empty; submitted orders are acknowledged with a
 * generated id and otherwise ignored.
 */
@Service
@EnableConfigurationProperties(SimulatorConfig.class)
public class SimulatedMarketDataGateway implements MarketDataGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataGateway.class);

    private static final int DEPTH_LEVELS = 5;

    private final SimulatorConfig simulatorConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Random random;

    private final Map<InstrumentId, Set<SubscriptionFlag>> subscriptions = new ConcurrentHashMap<>();
    private final Map<InstrumentId, PriceWalk> walks = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();

    private volatile SimulatedPushStream pushStream;
    private volatile ScheduledExecutorService feedExecutor;

    public SimulatedMarketDataGateway(SimulatorConfig simulatorConfig, ObjectMapper objectMapper, Clock clock) {
        this.simulatorConfig = simulatorConfig;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.random = new Random(simulatorConfig.getSeed());
    }

    @Override
    public synchronized void connect() {
        if (pushStream != null) {
            return;
        }
        pushStream = new SimulatedPushStream();
        feedExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("sim-feed-"));
        long periodMs = Math.max(1, simulatorConfig.getPushInterval().toMillis());
        feedExecutor.scheduleAtFixedRate(this::pushRound, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Simulated gateway connected, pushing every {}ms", periodMs);
    }

    @Override
    public synchronized void disconnect() {
        if (feedExecutor != null) {
            feedExecutor.shutdownNow();
            feedExecutor = null;
        }
        if (pushStream != null) {
            pushStream.close();
            pushStream = null;
        }
        subscriptions.clear();
        log.info("Simulated gateway disconnected");
    }

    @Override
    public boolean isConnected() {
        return pushStream != null;
    }

    @Override
    public void subscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags) {
        requireConnected();
        for (InstrumentId instrument : instruments) {
            subscriptions
                    .computeIfAbsent(instrument, k -> ConcurrentHashMap.newKeySet())
                    .addAll(flags);
            walkFor(instrument);
        }
    }

    @Override
    public void unsubscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags) {
        for (InstrumentId instrument : instruments) {
            Set<SubscriptionFlag> current = subscriptions.get(instrument);
            if (current != null) {
                current.removeAll(flags);
                if (current.isEmpty()) {
                    subscriptions.remove(instrument);
                }
            }
        }
    }

    @Override
    public PushStream pushStream() {
        SimulatedPushStream stream = pushStream;
        if (stream == null) {
            throw new GatewayException("Not connected");
        }
        return stream;
    }

    @Override
    public Map<InstrumentId, Quote> quoteSnapshot(Collection<InstrumentId> instruments) {
        requireConnected();
        Map<InstrumentId, Quote> quotes = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (InstrumentId instrument : instruments) {
            quotes.put(instrument, walkFor(instrument).toQuote(now));
        }
        return quotes;
    }

    @Override
    public CandleSeries candles(InstrumentId instrument, ChartPeriod period, int count) {
        requireConnected();
        PriceWalk walk = walkFor(instrument);
        Duration step = periodLength(period);
        Instant end = clock.instant();
        Candle[] candles = new Candle[Math.max(0, count)];
        BigDecimal close;
        synchronized (walk) {
            close = walk.price;
        }
        for (int i = candles.length - 1; i >= 0; i--) {
            BigDecimal open = move(close);
            candles[i] = Candle.builder()
                    .timestamp(end.minus(step.multipliedBy(candles.length - 1L - i)))
                    .open(open)
                    .high(open.max(close))
                    .low(open.min(close))
                    .close(close)
                    .volume(1_000L + nextInt(50_000))
                    .turnover(close.multiply(BigDecimal.valueOf(10_000)))
                    .build();
            close = open;
        }
        return new CandleSeries(period, Arrays.asList(candles));
    }

    @Override
    public List<Position> positions() {
        requireConnected();
        return List.of();
    }

    @Override
    public String submitOrder(OrderTicket orderTicket) {
        requireConnected();
        String orderId = "SIM-" + orderSequence.incrementAndGet();
        log.debug("Simulator accepted order {} for {}", orderId, orderTicket.getInstrument());
        return orderId;
    }

    /** Pushes one round of frames immediately. Exposed so tests need not wait for the timer. */
    public void pushRound() {
        SimulatedPushStream stream = pushStream;
        if (stream == null) {
            return;
        }
        try {
            Instant now = clock.instant();
            for (Map.Entry<InstrumentId, Set<SubscriptionFlag>> entry : subscriptions.entrySet()) {
                InstrumentId instrument = entry.getKey();
                Set<SubscriptionFlag> flags = Set.copyOf(entry.getValue());
                PriceWalk walk = walkFor(instrument);
                synchronized (walk) {
                    walk.step();
                    if (flags.contains(SubscriptionFlag.QUOTE)) {
                        stream.offer(frame(instrument, UpdateCategory.QUOTE, quoteData(walk, now)));
                    }
                    if (flags.contains(SubscriptionFlag.DEPTH)) {
                        stream.offer(frame(instrument, UpdateCategory.DEPTH, depthData(walk, now)));
                    }
                    if (flags.contains(SubscriptionFlag.TRADES)) {
                        stream.offer(frame(instrument, UpdateCategory.TRADES, tradesData(walk, now)));
                    }
                }
            }
        } catch (RuntimeException e) {
            // a failure here would cancel the scheduled task silently
            log.error("Simulated push round failed", e);
        }
    }

    // ---- Internal ----

    private void requireConnected() {
        if (pushStream == null) {
            throw new GatewayException("Not connected");
        }
    }

    private PriceWalk walkFor(InstrumentId instrument) {
        return walks.computeIfAbsent(instrument, id -> {
            BigDecimal start = simulatorConfig.getInitialPrices().getOrDefault(
                    id.symbol(), simulatorConfig.getDefaultPrice());
            return new PriceWalk(start);
        });
    }

    private int nextInt(int bound) {
        synchronized (random) {
            return random.nextInt(bound);
        }
    }

    private BigDecimal move(BigDecimal price) {
        synchronized (random) {
            double percent = (random.nextDouble() * 2 - 1) * simulatorConfig.getMaxMovePercent();
            BigDecimal moved = price.multiply(BigDecimal.valueOf(1 + percent / 100));
            return moved.max(BigDecimal.valueOf(0.001)).setScale(3, RoundingMode.HALF_UP);
        }
    }

    private String frame(InstrumentId instrument, UpdateCategory category, ObjectNode data) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("symbol", instrument.symbol());
        frame.put("category", category.wireName());
        frame.set("data", data);
        return frame.toString();
    }

    private ObjectNode quoteData(PriceWalk walk, Instant now) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("lastPrice", walk.price);
        data.put("open", walk.open);
        data.put("high", walk.high);
        data.put("low", walk.low);
        data.put("volume", walk.volume);
        data.put("turnover", walk.price.multiply(BigDecimal.valueOf(walk.volume)));
        data.put("timestamp", now.toString());
        data.put("tradeStatus", "NORMAL");
        return data;
    }

    private ObjectNode depthData(PriceWalk walk, Instant now) {
        ObjectNode data = objectMapper.createObjectNode();
        BigDecimal tick = walk.price.multiply(BigDecimal.valueOf(0.001)).setScale(3, RoundingMode.HALF_UP);
        ArrayNode bids = data.putArray("bids");
        ArrayNode asks = data.putArray("asks");
        for (int level = 1; level <= DEPTH_LEVELS; level++) {
            BigDecimal offset = tick.multiply(BigDecimal.valueOf(level));
            bids.add(depthLevel(level, walk.price.subtract(offset)));
            asks.add(depthLevel(level, walk.price.add(offset)));
        }
        data.put("timestamp", now.toString());
        return data;
    }

    private ObjectNode depthLevel(int position, BigDecimal price) {
        ObjectNode level = objectMapper.createObjectNode();
        level.put("position", position);
        level.put("price", price);
        level.put("volume", 100 + nextInt(10_000));
        level.put("orderCount", 1 + nextInt(40));
        return level;
    }

    private ObjectNode tradesData(PriceWalk walk, Instant now) {
        ObjectNode data = objectMapper.createObjectNode();
        ObjectNode trade = data.putArray("trades").addObject();
        trade.put("price", walk.price);
        trade.put("volume", walk.lastTradeVolume);
        trade.put("timestamp", now.toString());
        trade.put("tradeType", "AUTO_MATCH");
        trade.put("direction", walk.direction.name());
        data.put("timestamp", now.toString());
        return data;
    }

    private static Duration periodLength(ChartPeriod period) {
        return switch (period) {
            case MINUTE_1 -> Duration.ofMinutes(1);
            case MINUTE_5 -> Duration.ofMinutes(5);
            case MINUTE_15 -> Duration.ofMinutes(15);
            case MINUTE_30 -> Duration.ofMinutes(30);
            case HOUR_1 -> Duration.ofHours(1);
            case DAY -> Duration.ofDays(1);
            case WEEK -> Duration.ofDays(7);
            case MONTH -> Duration.ofDays(30);
            case YEAR -> Duration.ofDays(365);
        };
    }

    private final class PriceWalk {

        private final BigDecimal prevClose;
        private final BigDecimal open;
        private BigDecimal price;
        private BigDecimal high;
        private BigDecimal low;
        private long volume;
        private long lastTradeVolume;
        private TradeDirection direction = TradeDirection.NEUTRAL;

        private PriceWalk(BigDecimal start) {
            this.prevClose = start.setScale(3, RoundingMode.HALF_UP);
            this.open = prevClose;
            this.price = prevClose;
            this.high = prevClose;
            this.low = prevClose;
        }

        private synchronized void step() {
            BigDecimal next = move(price);
            int cmp = next.compareTo(price);
            direction = cmp > 0 ? TradeDirection.UP : cmp < 0 ? TradeDirection.DOWN : TradeDirection.NEUTRAL;
            price = next;
            high = high.max(next);
            low = low.min(next);
            lastTradeVolume = 100L * (1 + nextInt(50));
            volume += lastTradeVolume;
        }

        private synchronized Quote toQuote(Instant now) {
            return Quote.builder()
                    .lastPrice(price)
                    .prevClose(prevClose)
                    .open(open)
                    .high(high)
                    .low(low)
                    .volume(volume)
                    .turnover(price.multiply(BigDecimal.valueOf(volume)))
                    .timestamp(now)
                    .tradeStatus("NORMAL")
                    .build();
        }
    }
}
