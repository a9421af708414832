package com.codescout.core.review;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "codescout.review")
public class ReviewProperties {

    private int maxToolCalls = 20;
    private Duration maxDuration = Duration.ofSeconds(300);
    private int maxDistinctFiles = 30;

    /** When non-empty, project roots must lie under one of these directories. */
    private List<String> allowedRoots = new ArrayList<>();

    private int seedTreeMaxLines = 200;
    private int digestMaxChars = 4000;
    private int historyMaxChars = 6000;

    /** Project roots whose index stays cached between reviews. */
    private int indexCacheSize = 8;

    public ExplorationBounds defaultBounds() {
        return new ExplorationBounds(maxToolCalls, maxDuration, maxDistinctFiles);
    }

    public int getMaxToolCalls() {
        return maxToolCalls;
    }

    public void setMaxToolCalls(int maxToolCalls) {
        this.maxToolCalls = maxToolCalls;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public void setMaxDuration(Duration maxDuration) {
        this.maxDuration = maxDuration;
    }

    public int getMaxDistinctFiles() {
        return maxDistinctFiles;
    }

    public void setMaxDistinctFiles(int maxDistinctFiles) {
        this.maxDistinctFiles = maxDistinctFiles;
    }

    public List<String> getAllowedRoots() {
        return allowedRoots;
    }

    public void setAllowedRoots(List<String> allowedRoots) {
        this.allowedRoots = allowedRoots;
    }

    public int getSeedTreeMaxLines() {
        return seedTreeMaxLines;
    }

    public void setSeedTreeMaxLines(int seedTreeMaxLines) {
        this.seedTreeMaxLines = seedTreeMaxLines;
    }

    public int getDigestMaxChars() {
        return digestMaxChars;
    }

    public void setDigestMaxChars(int digestMaxChars) {
        this.digestMaxChars = digestMaxChars;
    }

    public int getHistoryMaxChars() {
        return historyMaxChars;
    }

    public void setHistoryMaxChars(int historyMaxChars) {
        this.historyMaxChars = historyMaxChars;
    }

    public int getIndexCacheSize() {
        return indexCacheSize;
    }

    public void setIndexCacheSize(int indexCacheSize) {
        this.indexCacheSize = indexCacheSize;
    }
}
