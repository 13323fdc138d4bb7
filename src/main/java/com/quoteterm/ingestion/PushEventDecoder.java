package com.quoteterm.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.TradeDirection;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.Candle;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.DepthBook;
import com.quoteterm.domain.model.DepthLevel;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.domain.model.TradePrint;
import com.quoteterm.domain.model.TradeTape;
import com.quoteterm.exception.DecodeException;
import com.quoteterm.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps raw push frames to domain objects.
 *
 * <p>Frame shape: {@code {"symbol":"700.HK","category":"quote","data":{...}}}. Payload fields per
 * category:
 * <ul>
 *   <li>{@code quote}: lastPrice and timestamp required; prevClose, open, high, low, volume,
 *       turnover, tradeStatus, tradeSession optional</li>
 *   <li>{@code depth}: bids, asks (arrays of position/price/volume/orderCount), timestamp</li>
 *   <li>{@code trades}: trades (array of price/volume/timestamp/tradeType/direction), timestamp
 *       defaulting to the newest trade's</li>
 *   <li>{@code candles}: period (enum name or label, e.g. {@code WEEK} or {@code Week}), candles</li>
 * </ul>
 *
 * <p>Numbers may be JSON numbers or numeric strings. Timestamps are ISO-8601 instants or epoch
 * milliseconds. Any structural problem is reported as a {@link DecodeException}; the decoder
 * holds no state and is safe to share.
 */
@Component
public class PushEventDecoder {

    private final ObjectMapper objectMapper;

    public PushEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DecodedPushEvent decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed push frame: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Push frame is not a JSON object");
        }

        InstrumentId instrument;
        try {
            instrument = InstrumentId.of(root.path("symbol").asText(null));
        } catch (ValidationException e) {
            throw new DecodeException("Push frame has no symbol", e);
        }

        String categoryName = root.path("category").asText(null);
        UpdateCategory category = UpdateCategory.fromWireName(categoryName);
        if (category == null) {
            throw new DecodeException("Unknown push category '" + categoryName + "' for " + instrument);
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new DecodeException("Push frame for " + instrument + " has no data object");
        }

        Object payload = switch (category) {
            case QUOTE -> toQuote(data);
            case DEPTH -> toDepth(data);
            case TRADES -> toTrades(data);
            case CANDLES -> toCandles(data);
        };
        return new DecodedPushEvent(instrument, category, payload);
    }

    // ---- Category mappers ----

    private Quote toQuote(JsonNode data) {
        return Quote.builder()
                .lastPrice(requiredDecimal(data, "lastPrice"))
                .prevClose(optionalDecimal(data, "prevClose"))
                .open(optionalDecimal(data, "open"))
                .high(optionalDecimal(data, "high"))
                .low(optionalDecimal(data, "low"))
                .volume(data.path("volume").asLong(0))
                .turnover(optionalDecimal(data, "turnover"))
                .timestamp(requiredInstant(data, "timestamp"))
                .tradeStatus(data.path("tradeStatus").asText(null))
                .tradeSession(data.path("tradeSession").asText(null))
                .build();
    }

    private DepthBook toDepth(JsonNode data) {
        return DepthBook.builder()
                .bids(depthLevels(data.path("bids")))
                .asks(depthLevels(data.path("asks")))
                .timestamp(requiredInstant(data, "timestamp"))
                .build();
    }

    private List<DepthLevel> depthLevels(JsonNode array) {
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new DecodeException("Depth side is not an array");
        }
        List<DepthLevel> levels = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            levels.add(DepthLevel.builder()
                    .position(node.path("position").asInt(levels.size() + 1))
                    .price(requiredDecimal(node, "price"))
                    .volume(node.path("volume").asLong(0))
                    .orderCount(node.path("orderCount").asLong(0))
                    .build());
        }
        return levels;
    }

    private TradeTape toTrades(JsonNode data) {
        JsonNode array = data.path("trades");
        if (!array.isArray()) {
            throw new DecodeException("Trades payload has no trades array");
        }
        List<TradePrint> prints = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            prints.add(TradePrint.builder()
                    .price(requiredDecimal(node, "price"))
                    .volume(node.path("volume").asLong(0))
                    .timestamp(requiredInstant(node, "timestamp"))
                    .tradeType(node.path("tradeType").asText(null))
                    .direction(direction(node.path("direction").asText(null)))
                    .build());
        }
        Instant timestamp = data.has("timestamp")
                ? requiredInstant(data, "timestamp")
                : prints.isEmpty() ? null : prints.get(prints.size() - 1).getTimestamp();
        if (timestamp == null) {
            throw new DecodeException("Trades payload has neither a timestamp nor any trades");
        }
        return new TradeTape(prints, timestamp);
    }

    private CandleSeries toCandles(JsonNode data) {
        ChartPeriod period = period(data.path("period").asText(null));
        JsonNode array = data.path("candles");
        if (!array.isArray()) {
            throw new DecodeException("Candles payload has no candles array");
        }
        List<Candle> candles = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            candles.add(Candle.builder()
                    .timestamp(requiredInstant(node, "timestamp"))
                    .open(requiredDecimal(node, "open"))
                    .high(requiredDecimal(node, "high"))
                    .low(requiredDecimal(node, "low"))
                    .close(requiredDecimal(node, "close"))
                    .volume(node.path("volume").asLong(0))
                    .turnover(optionalDecimal(node, "turnover"))
                    .build());
        }
        return new CandleSeries(period, candles);
    }

    // ---- Field helpers ----

    private static BigDecimal requiredDecimal(JsonNode node, String field) {
        BigDecimal value = optionalDecimal(node, field);
        if (value == null) {
            throw new DecodeException("Missing numeric field '" + field + "'");
        }
        return value;
    }

    private static BigDecimal optionalDecimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual() && !value.asText().isBlank()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new DecodeException("Field '" + field + "' is not numeric: " + value.asText(), e);
            }
        }
        throw new DecodeException("Field '" + field + "' is not numeric");
    }

    private static Instant requiredInstant(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new DecodeException("Missing timestamp field '" + field + "'");
        }
        if (value.isIntegralNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new DecodeException("Field '" + field + "' is not an ISO-8601 instant: " + value.asText(), e);
        }
    }

    private static TradeDirection direction(String name) {
        if (name == null) {
            return TradeDirection.NEUTRAL;
        }
        for (TradeDirection direction : TradeDirection.values()) {
            if (direction.name().equalsIgnoreCase(name)) {
                return direction;
            }
        }
        return TradeDirection.NEUTRAL;
    }

    private static ChartPeriod period(String name) {
        if (name == null) {
            throw new DecodeException("Candles payload has no period");
        }
        for (ChartPeriod period : ChartPeriod.values()) {
            if (period.name().equalsIgnoreCase(name) || period.label().equalsIgnoreCase(name)) {
                return period;
            }
        }
        throw new DecodeException("Unknown chart period '" + name + "'");
    }
}
