package com.delta.adfeed.monitor.model;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered filter levels of one target. Levels are kept sorted by their numeric suffix.
 */
public record FilterSpec(List<FilterLevel> levels) {
    private static final FilterSpec EMPTY = new FilterSpec(List.of());

    public FilterSpec {
        levels = levels == null
            ? List.of()
            : levels.stream().sorted(Comparator.comparingInt(FilterLevel::order)).toList();
    }

    public static FilterSpec empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    public Map<String, List<String>> toLevelMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (FilterLevel level : levels) {
            out.put(level.name(), level.keywords());
        }
        return out;
    }
}
