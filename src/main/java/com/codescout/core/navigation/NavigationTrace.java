package com.codescout.core.navigation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only log of the navigation calls made during one review.
 */
public final class NavigationTrace {

    private final List<TraceEntry> entries = new ArrayList<>();

    void append(TraceEntry entry) {
        entries.add(entry);
    }

    public List<TraceEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public NavigationSummary summary() {
        Set<String> filesRead = new LinkedHashSet<>();
        int symbolsSearched = 0;
        int cached = 0;
        for (TraceEntry entry : entries) {
            boolean success = entry.reasonTag().equals(ToolOutcome.OK.tag())
                    || entry.reasonTag().equals(ToolOutcome.CACHED.tag());
            if (entry.tool().equals(NavigationOperation.READ_FILE.toolName()) && success) {
                filesRead.add(entry.arguments().get("filepath"));
            }
            if (entry.tool().equals(NavigationOperation.SEARCH_SYMBOL.toolName())
                    || entry.tool().equals(NavigationOperation.FIND_USAGES.toolName())) {
                symbolsSearched++;
            }
            if (entry.reasonTag().equals(ToolOutcome.CACHED.tag())) {
                cached++;
            }
        }
        return new NavigationSummary(List.copyOf(filesRead), symbolsSearched, entries.size(), cached);
    }
}
