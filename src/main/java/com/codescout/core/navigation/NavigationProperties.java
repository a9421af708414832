package com.codescout.core.navigation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "codescout.navigation")
public class NavigationProperties {

    private int readMaxChars = 100_000;
    private int maxResults = 100;

    public int getReadMaxChars() {
        return readMaxChars;
    }

    public void setReadMaxChars(int readMaxChars) {
        this.readMaxChars = readMaxChars;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }
}
