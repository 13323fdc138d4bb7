package com.quoteterm.config;

import java.nio.file.Path;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for local files under the {@code quoteterm.storage} prefix.
 *
 * <p>The data directory defaults to {@code ~/.local/share/quoteterm}; application.properties
 * lets the {@code QUOTETERM_DATA_DIR} environment variable override it.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.storage")
public class StorageConfig {

    private Path dataDir = Path.of(System.getProperty("user.home"), ".local", "share", "quoteterm");

    private String alertsFile = "alerts.json";
    private String alertLogFile = "alerts.log";
    private String workspaceFile = "workspace.json";
    private String lockFile = "quoteterm.lock";

    public Path alertsPath() {
        return dataDir.resolve(alertsFile);
    }

    public Path alertLogPath() {
        return dataDir.resolve(alertLogFile);
    }

    public Path workspacePath() {
        return dataDir.resolve(workspaceFile);
    }

    public Path lockPath() {
        return dataDir.resolve(lockFile);
    }
}
