package com.delta.adfeed.monitor.filter;

import com.delta.adfeed.monitor.model.FilterLevel;
import com.delta.adfeed.monitor.model.FilterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword filter applied to candidate titles: AND across levels, OR within a level,
 * case-insensitive substring containment. No tokenization or stemming.
 */
@Component
public class FilterEngine {
    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);
    public static final Pattern LEVEL_NAME = Pattern.compile("^level(\\d+)$");

    public boolean accepts(FilterSpec filterSpec, String title) {
        if (filterSpec == null || filterSpec.isEmpty()) {
            return true;
        }
        String normalizedTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        for (FilterLevel level : filterSpec.levels()) {
            if (!levelMatches(level, normalizedTitle)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Builds a filter spec from raw level entries. Keys that are not {@code levelN} and values that are
     * not lists of strings are logged and skipped, which leaves that level automatically satisfied.
     */
    public FilterSpec compile(Map<String, ?> rawLevels) {
        if (rawLevels == null || rawLevels.isEmpty()) {
            return FilterSpec.empty();
        }
        List<FilterLevel> levels = new ArrayList<>();
        for (Map.Entry<String, ?> entry : rawLevels.entrySet()) {
            Integer order = levelOrder(entry.getKey());
            if (order == null) {
                log.warn("Skipping filter level with unsupported name '{}'", entry.getKey());
                continue;
            }
            List<String> keywords = keywords(entry.getValue());
            if (keywords == null) {
                log.warn("Skipping malformed filter level '{}': expected a list of strings", entry.getKey());
                continue;
            }
            levels.add(new FilterLevel(entry.getKey(), order, keywords));
        }
        return new FilterSpec(levels);
    }

    public static Integer levelOrder(String name) {
        if (name == null) {
            return null;
        }
        Matcher matcher = LEVEL_NAME.matcher(name);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean levelMatches(FilterLevel level, String normalizedTitle) {
        if (level.keywords().isEmpty()) {
            return true;
        }
        for (String keyword : level.keywords()) {
            if (keyword != null && normalizedTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private List<String> keywords(Object value) {
        if (!(value instanceof Collection<?> collection)) {
            return null;
        }
        List<String> out = new ArrayList<>(collection.size());
        for (Object item : collection) {
            if (!(item instanceof String keyword)) {
                return null;
            }
            out.add(keyword);
        }
        return out;
    }
}
