package com.quoteterm.alert;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link AlertEngine} under the {@code quoteterm.alerts} prefix.
 *
 * <ul>
 *   <li>{@code enabled}: master toggle for evaluation; rules can still be managed when off</li>
 *   <li>{@code defaultCooldown}: cooldown for rules created without one</li>
 *   <li>{@code maxRules}: cap on stored rules</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.alerts")
public class AlertEngineConfig {

    private boolean enabled = true;
    private Duration defaultCooldown = Duration.ofSeconds(30);
    private int maxRules = 200;
}
