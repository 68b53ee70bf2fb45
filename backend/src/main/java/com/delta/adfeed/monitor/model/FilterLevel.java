package com.delta.adfeed.monitor.model;

import java.util.List;

/**
 * One AND-ed filter stage. A title satisfies the level when any keyword is a
 * case-insensitive substring of it.
 */
public record FilterLevel(String name, int order, List<String> keywords) {
    public FilterLevel {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
