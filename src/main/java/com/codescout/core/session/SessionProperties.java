package com.codescout.core.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "codescout.session")
public class SessionProperties {

    private Path directory = Path.of(System.getProperty("user.home"), ".codescout", "sessions");

    /** How long a review waits for a busy session; zero rejects immediately. */
    private Duration lockTimeout = Duration.ZERO;

    private int maxStoredMessages = 200;

    public Path getDirectory() {
        return directory;
    }

    public void setDirectory(Path directory) {
        this.directory = directory;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public int getMaxStoredMessages() {
        return maxStoredMessages;
    }

    public void setMaxStoredMessages(int maxStoredMessages) {
        this.maxStoredMessages = maxStoredMessages;
    }
}
