package com.quoteterm.workspace;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for {@link WorkspacePersistence} under the {@code quoteterm.workspace}
 * prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.workspace")
public class WorkspaceConfig {

    /** Longest wait for the workspace save at shutdown. */
    private Duration saveTimeout = Duration.ofSeconds(2);

    private boolean restoreOnStart = true;
}
