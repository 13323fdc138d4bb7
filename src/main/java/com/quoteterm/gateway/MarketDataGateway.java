package com.quoteterm.gateway;

import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.SubscriptionFlag;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.OrderTicket;
import com.quoteterm.domain.model.Position;
import com.quoteterm.domain.model.Quote;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Abstraction over the market-data and account vendor. Components never call an implementation
 * directly: outbound calls go through {@link RateLimitedMarketDataClient} so that every request
 * takes a rate permit.
 *
 * <p>Failures surface as {@link com.quoteterm.exception.GatewayException}; status 429 marks a
 * rate-limit rejection.
 */
public interface MarketDataGateway {

    // ---- Session ----

    void connect();

    void disconnect();

    boolean isConnected();

    // ---- Push ----

    /**
     * Starts pushes of the given channels for the instruments. Subscribing twice is harmless.
     */
    void subscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags);

    void unsubscribe(Set<InstrumentId> instruments, Set<SubscriptionFlag> flags);

    /**
     * The push stream of this session. Valid after {@link #connect()}; the same stream is returned
     * on every call until the gateway is disconnected.
     */
    PushStream pushStream();

    // ---- Request/response ----

    /**
     * Current quotes, including the previous close that pushes do not carry. Instruments the
     * vendor does not know are absent from the result.
     */
    Map<InstrumentId, Quote> quoteSnapshot(Collection<InstrumentId> instruments);

    /**
     * The most recent {@code count} candles, oldest first.
     */
    CandleSeries candles(InstrumentId instrument, ChartPeriod period, int count);

    List<Position> positions();

    /**
     * Hands an order to the vendor unchanged.
     *
     * @return the vendor's order id
     */
    String submitOrder(OrderTicket orderTicket);
}
