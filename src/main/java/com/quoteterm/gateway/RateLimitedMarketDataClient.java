package com.quoteterm.gateway;

import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.SubscriptionFlag;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.OrderTicket;
import com.quoteterm.domain.model.Position;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.ratelimit.RateGovernor;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The only path from the terminal to the vendor. Every call, subscriptions and order hand-offs
 * included, is executed through the {@link RateGovernor}, so the process as a whole stays inside
 * the vendor's request budget no matter which component is calling.
 *
 * <p>Errors are not translated here: callers see {@link com.quoteterm.exception.GatewayException}
 * or {@link com.quoteterm.exception.RateLimitExhaustedException} and decide for themselves.
 */
@Component
public class RateLimitedMarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedMarketDataClient.class);

    private final MarketDataGateway marketDataGateway;
    private final RateGovernor rateGovernor;

    public RateLimitedMarketDataClient(MarketDataGateway marketDataGateway, RateGovernor rateGovernor) {
        this.marketDataGateway = marketDataGateway;
        this.rateGovernor = rateGovernor;
    }

    public void connect() {
        rateGovernor.execute("connect", () -> {
            marketDataGateway.connect();
            return null;
        });
        log.info("Connected to market data gateway");
    }

    /** Local teardown; not governed because it must work while the budget is exhausted. */
    public void disconnect() {
        marketDataGateway.disconnect();
        log.info("Disconnected from market data gateway");
    }

    public boolean isConnected() {
        return marketDataGateway.isConnected();
    }

    public void subscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags) {
        if (instruments.isEmpty()) {
            return;
        }
        rateGovernor.execute("subscribe", () -> {
            marketDataGateway.subscribe(instruments, flags);
            return null;
        });
        log.debug("Subscribed {} to {}", instruments, flags);
    }

    public void unsubscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags) {
        if (instruments.isEmpty()) {
            return;
        }
        rateGovernor.execute("unsubscribe", () -> {
            marketDataGateway.unsubscribe(instruments, flags);
            return null;
        });
        log.debug("Unsubscribed {} from {}", instruments, flags);
    }

    public PushStream pushStream() {
        return marketDataGateway.pushStream();
    }

    public Map<InstrumentId, Quote> quoteSnapshot(Collection<InstrumentId> instruments) {
        if (instruments.isEmpty()) {
            return Map.of();
        }
        return rateGovernor.execute("quoteSnapshot", () -> marketDataGateway.quoteSnapshot(instruments));
    }

    public CandleSeries candles(InstrumentId instrument, ChartPeriod period, int count) {
        return rateGovernor.execute("candles", () -> marketDataGateway.candles(instrument, period, count));
    }

    public List<Position> positions() {
        return rateGovernor.execute("positions", marketDataGateway::positions);
    }

    public String submitOrder(OrderTicket orderTicket) {
        String orderId = rateGovernor.execute("submitOrder", () -> marketDataGateway.submitOrder(orderTicket));
        log.info(
                "Order handed to vendor: {} {} x{} -> {}",
                orderTicket.getSide(),
                orderTicket.getInstrument(),
                orderTicket.getQuantity(),
                orderId);
        return orderId;
    }
}
