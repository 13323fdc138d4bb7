package com.quoteterm.render;

import com.quoteterm.domain.enums.DirtyRegion;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.MarketSnapshot;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.workspace.Navigation;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Line-oriented stand-in for the full-screen drawing layer. Prints what changed in each frame:
 * watch list prices, the detail instrument, the feed status and new alerts.
 */
@Component
public class TextRenderSink implements RenderSink {

    private final PrintStream out;
    private final boolean enabled;

    @Autowired
    public TextRenderSink(RenderConfig renderConfig) {
        this(System.out, renderConfig.isConsoleOutput());
    }

    public TextRenderSink(PrintStream out, boolean enabled) {
        this.out = out;
        this.enabled = enabled;
    }

    @Override
    public void render(RenderFrame frame) {
        if (!enabled) {
            return;
        }
        StringBuilder text = new StringBuilder();
        if (frame.isDirty(DirtyRegion.WATCHLIST) || frame.isDirty(DirtyRegion.QUOTE)) {
            Set<InstrumentId> instruments = frame.getMarket().instruments();
            for (MarketSnapshot snapshot : frame.getMarket().getMany(instruments).values()) {
                snapshot.quote().ifPresent(quote -> text.append(quoteLine(snapshot.getInstrument(), quote)));
            }
        }
        Navigation navigation = frame.getNavigation();
        if (navigation != null && navigation.isDetailOpen() && frame.isDirty(DirtyRegion.STOCK_DETAIL)) {
            text.append(detailLine(frame, navigation.getDetailInstrument()));
        }
        for (AlertEvent alert : frame.getAlerts()) {
            text.append(String.format(
                    "! ALERT %s %s %s (now %s)%n",
                    alert.getInstrument(),
                    alert.getKind(),
                    alert.getThreshold().toPlainString(),
                    alert.getTriggeringValue().toPlainString()));
        }
        if (frame.isDirty(DirtyRegion.STATUS_BAR) && frame.getFeedStatus() != null) {
            text.append(String.format(
                    "-- feed %s, last update %s%n",
                    frame.getFeedStatus().getFeedStatus(),
                    frame.getFeedStatus().getLastSuccessAt().map(Object::toString).orElse("never")));
        }
        if (text.length() > 0) {
            out.print(text);
            out.flush();
        }
    }

    private static String quoteLine(InstrumentId instrument, Quote quote) {
        String change = quote.changePercent()
                .map(pct -> (pct.signum() >= 0 ? "+" : "")
                        + pct.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%")
                .orElse("--");
        return String.format(
                "%-10s %12s %9s  vol %d%n", instrument, plain(quote.getLastPrice()), change, quote.getVolume());
    }

    private static String detailLine(RenderFrame frame, InstrumentId instrument) {
        return frame.getMarket()
                .get(instrument)
                .map(snapshot -> String.format(
                        "[%s] depth %s, trades %s, candles %s%n",
                        instrument,
                        snapshot.depth().map(book -> book.getBids().size() + "x" + book.getAsks().size()).orElse("-"),
                        snapshot.trades().map(tape -> String.valueOf(tape.getTrades().size())).orElse("-"),
                        snapshot.candles().map(series -> series.getPeriod().label() + "/" + series.getCandles().size())
                                .orElse("-")))
                .orElse("");
    }

    private static String plain(BigDecimal value) {
        return value == null ? "--" : value.toPlainString();
    }
}
