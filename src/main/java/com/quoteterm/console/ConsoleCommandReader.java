package com.quoteterm.console;

import com.quoteterm.alert.AlertEngine;
import com.quoteterm.domain.enums.AlertRuleKind;
import com.quoteterm.domain.enums.AppView;
import com.quoteterm.domain.enums.OrderSide;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.domain.model.AlertRule;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.OrderTicket;
import com.quoteterm.exception.BaseException;
import com.quoteterm.exception.ValidationException;
import com.quoteterm.gateway.RateLimitedMarketDataClient;
import com.quoteterm.render.RenderScheduler;
import com.quoteterm.service.WatchlistService;
import com.quoteterm.workspace.Navigation;
import com.quoteterm.workspace.NavigationCommand;
import com.quoteterm.workspace.NavigationState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reads one command per line from the terminal and dispatches it.
 *
 * <p>Navigation commands are applied to {@link NavigationState}; alert and watch list commands
 * go to their services. Every handled line counts as user input and makes the render scheduler
 * repaint the whole screen. Command failures are reported back on the console and never stop
 * the reader.
 *
 * <pre>
 * add SYM | rm SYM | sel SYM | open SYM | close | group N | sort N | view NAME
 * period next|prev | shift N | hide | log
 * alert add SYM KIND THRESHOLD [COOLDOWN_SECONDS] | alert list | alert on|off|rm ID | alert history
 * order buy|sell SYM QTY [LIMIT] | help | quit
 * </pre>
 */
@Component
@EnableConfigurationProperties(ConsoleConfig.class)
public class ConsoleCommandReader {

    private static final Logger log = LoggerFactory.getLogger(ConsoleCommandReader.class);

    static final String HELP = String.join(
            System.lineSeparator(),
            "add SYM | rm SYM | sel SYM | open SYM | close | group N | sort N | view NAME",
            "period next|prev | shift N | hide | log",
            "alert add SYM KIND THRESHOLD [COOLDOWN_SECONDS] | alert list | alert on|off|rm ID | alert history",
            "order buy|sell SYM QTY [LIMIT] | help | quit");

    private final NavigationState navigationState;
    private final WatchlistService watchlistService;
    private final AlertEngine alertEngine;
    private final RenderScheduler renderScheduler;
    private final RateLimitedMarketDataClient marketDataClient;
    private final ConsoleConfig consoleConfig;
    private final InputStream in;
    private final PrintStream out;

    private volatile boolean running;
    private volatile Runnable quitHandler = () -> log.info("Quit requested");

    @Autowired
    public ConsoleCommandReader(
            NavigationState navigationState,
            WatchlistService watchlistService,
            AlertEngine alertEngine,
            RenderScheduler renderScheduler,
            RateLimitedMarketDataClient marketDataClient,
            ConsoleConfig consoleConfig) {
        this(navigationState, watchlistService, alertEngine, renderScheduler, marketDataClient, consoleConfig,
                System.in, System.out);
    }

    public ConsoleCommandReader(
            NavigationState navigationState,
            WatchlistService watchlistService,
            AlertEngine alertEngine,
            RenderScheduler renderScheduler,
            RateLimitedMarketDataClient marketDataClient,
            ConsoleConfig consoleConfig,
            InputStream in,
            PrintStream out) {
        this.navigationState = navigationState;
        this.watchlistService = watchlistService;
        this.alertEngine = alertEngine;
        this.renderScheduler = renderScheduler;
        this.marketDataClient = marketDataClient;
        this.consoleConfig = consoleConfig;
        this.in = in;
        this.out = out;
    }

    /** Starts the {@code console-input} daemon thread, if the console is enabled. */
    public synchronized void start() {
        if (running || !consoleConfig.isEnabled()) {
            return;
        }
        running = true;
        Thread thread = new Thread(this::readLoop, "console-input");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        running = false;
    }

    public void setQuitHandler(Runnable quitHandler) {
        this.quitHandler = quitHandler;
    }

    /**
     * Executes one command line.
     *
     * @return the reply shown to the user; empty for blank lines
     */
    public String handle(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] words = trimmed.split("\\s+");
        String reply;
        try {
            reply = dispatch(words[0].toLowerCase(Locale.ROOT), Arrays.copyOfRange(words, 1, words.length));
        } catch (BaseException e) {
            log.debug("Command '{}' failed: {}", trimmed, e.getMessage());
            reply = "error: " + e.getMessage();
        }
        renderScheduler.submitUserInput("console");
        return reply;
    }

    // ---- Internal ----

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                String reply = handle(line);
                if (!reply.isEmpty()) {
                    out.println(reply);
                }
            }
        } catch (IOException e) {
            log.error("Console input failed, commands disabled", e);
        } finally {
            running = false;
        }
    }

    private String dispatch(String command, String[] args) {
        return switch (command) {
            case "add" -> {
                InstrumentId instrument = instrument(args, 0);
                watchlistService.addInstrument(instrument);
                yield "watching " + instrument;
            }
            case "rm" -> {
                InstrumentId instrument = instrument(args, 0);
                watchlistService.removeInstrument(instrument);
                yield "removed " + instrument;
            }
            case "sel" -> describe(navigationState.apply(new NavigationCommand.SelectInstrument(instrument(args, 0))));
            case "open" -> {
                InstrumentId instrument = instrument(args, 0);
                Navigation navigation = navigationState.apply(new NavigationCommand.OpenDetail(instrument));
                watchlistService.openDetail(instrument, navigation.getChartPeriod());
                yield describe(navigation);
            }
            case "close" -> {
                watchlistService.closeDetail();
                yield describe(navigationState.apply(new NavigationCommand.CloseDetail()));
            }
            case "group" -> describe(navigationState.apply(new NavigationCommand.SelectGroup(longArg(args, 0))));
            case "sort" -> describe(navigationState.apply(new NavigationCommand.SortWatchlist(intArg(args, 0))));
            case "view" -> describe(navigationState.apply(new NavigationCommand.SwitchView(view(args))));
            case "period" -> {
                boolean forward = !"prev".equalsIgnoreCase(arg(args, 0));
                Navigation navigation = navigationState.apply(new NavigationCommand.CycleChartPeriod(forward));
                if (navigation.isDetailOpen()) {
                    watchlistService.refreshCandles(navigation.getDetailInstrument(), navigation.getChartPeriod());
                }
                yield describe(navigation);
            }
            case "shift" -> describe(navigationState.apply(new NavigationCommand.ShiftChartOffset(intArg(args, 0))));
            case "hide" -> describe(navigationState.apply(new NavigationCommand.ToggleWatchlistHidden()));
            case "log" -> describe(navigationState.apply(new NavigationCommand.ToggleLogPanel()));
            case "alert" -> alert(args);
            case "order" -> order(args);
            case "help" -> HELP;
            case "quit", "exit" -> {
                running = false;
                quitHandler.run();
                yield "bye";
            }
            default -> throw new ValidationException("Unknown command '" + command + "', try help");
        };
    }

    private String alert(String[] args) {
        String action = arg(args, 0).toLowerCase(Locale.ROOT);
        return switch (action) {
            case "add" -> {
                InstrumentId instrument = instrument(args, 1);
                AlertRuleKind kind = alertKind(arg(args, 2));
                BigDecimal threshold = decimalArg(args, 3);
                AlertRule rule = args.length > 4
                        ? alertEngine.createRule(instrument, kind, threshold, Duration.ofSeconds(longArg(args, 4)))
                        : alertEngine.createRule(instrument, kind, threshold);
                yield "created " + describe(rule);
            }
            case "list" -> {
                List<AlertRule> rules = alertEngine.listRules();
                yield rules.isEmpty()
                        ? "no alert rules"
                        : String.join(System.lineSeparator(), rules.stream().map(this::describe).toList());
            }
            case "on" -> "enabled " + describe(alertEngine.enableRule(arg(args, 1)));
            case "off" -> "disabled " + describe(alertEngine.disableRule(arg(args, 1)));
            case "rm" -> {
                alertEngine.deleteRule(arg(args, 1));
                yield "deleted " + arg(args, 1);
            }
            case "history" -> {
                List<AlertEvent> recent = alertEngine.recentAlerts(consoleConfig.getHistoryLimit());
                yield recent.isEmpty()
                        ? "no alerts yet"
                        : String.join(
                                System.lineSeparator(),
                                recent.stream()
                                        .map(event -> event.getTriggeredAt() + " " + event.getInstrument() + " "
                                                + event.getKind() + " " + event.getThreshold().toPlainString()
                                                + " @ " + event.getTriggeringValue().toPlainString())
                                        .toList());
            }
            default -> throw new ValidationException("Unknown alert action '" + action + "'");
        };
    }

    private String order(String[] args) {
        OrderSide side = switch (arg(args, 0).toLowerCase(Locale.ROOT)) {
            case "buy" -> OrderSide.BUY;
            case "sell" -> OrderSide.SELL;
            default -> throw new ValidationException("Order side must be buy or sell");
        };
        OrderTicket ticket = OrderTicket.builder()
                .instrument(instrument(args, 1))
                .side(side)
                .quantity(longArg(args, 2))
                .limitPrice(args.length > 3 ? decimalArg(args, 3) : null)
                .build();
        return "order submitted: " + marketDataClient.submitOrder(ticket);
    }

    private String describe(Navigation navigation) {
        return "view " + navigation.getView()
                + (navigation.getSelectedInstrument() != null ? ", selected " + navigation.getSelectedInstrument() : "")
                + (navigation.isDetailOpen() ? ", detail " + navigation.getDetailInstrument() : "")
                + ", chart " + navigation.getChartPeriod().label()
                + (navigation.getChartOffset() > 0 ? " -" + navigation.getChartOffset() : "");
    }

    private String describe(AlertRule rule) {
        return rule.getId() + " " + rule.getInstrument() + " " + rule.getKind() + " "
                + rule.getThreshold().toPlainString() + " [" + rule.getStatus() + ", cooldown "
                + rule.getCooldownSeconds() + "s]";
    }

    private static String arg(String[] args, int index) {
        if (index >= args.length) {
            throw new ValidationException("Missing argument " + (index + 1) + ", try help");
        }
        return args[index];
    }

    private static InstrumentId instrument(String[] args, int index) {
        return InstrumentId.of(arg(args, index).toUpperCase(Locale.ROOT));
    }

    private static int intArg(String[] args, int index) {
        try {
            return Integer.parseInt(arg(args, index));
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a number: " + args[index]);
        }
    }

    private static long longArg(String[] args, int index) {
        try {
            return Long.parseLong(arg(args, index));
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a number: " + args[index]);
        }
    }

    private static BigDecimal decimalArg(String[] args, int index) {
        try {
            return new BigDecimal(arg(args, index));
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a number: " + args[index]);
        }
    }

    private static AlertRuleKind alertKind(String name) {
        String normalized = name.toUpperCase(Locale.ROOT).replace('-', '_');
        for (AlertRuleKind kind : AlertRuleKind.values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new ValidationException("Unknown alert kind '" + name + "', expected one of "
                + Arrays.toString(AlertRuleKind.values()));
    }

    private static AppView view(String[] args) {
        String name = arg(args, 0).toUpperCase(Locale.ROOT).replace('-', '_');
        for (AppView view : AppView.values()) {
            if (view.name().equals(name)) {
                return view;
            }
        }
        throw new ValidationException("Unknown view '" + args[0] + "'");
    }
}
