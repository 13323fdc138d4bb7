package com.quoteterm.workspace;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holder of the current {@link Navigation}. Changed only by applying commands (or by a restore at
 * startup); readers always see a complete value.
 */
@Component
public class NavigationState {

    private static final Logger log = LoggerFactory.getLogger(NavigationState.class);

    private final AtomicReference<Navigation> current = new AtomicReference<>(Navigation.INITIAL);

    public Navigation apply(NavigationCommand command) {
        Navigation next = current.updateAndGet(command::applyTo);
        log.debug("Applied {} -> view {}", command, next.getView());
        return next;
    }

    public Navigation current() {
        return current.get();
    }

    void restore(Navigation navigation) {
        current.set(navigation);
    }
}
