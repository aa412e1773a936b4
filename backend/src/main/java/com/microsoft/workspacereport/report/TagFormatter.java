package com.microsoft.workspacereport.report;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders workspace tags as {@code key:value} pairs joined by {@code ;}, ordered by key.
 */
public final class TagFormatter {

    private TagFormatter() {
    }

    public static String format(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return new TreeMap<>(tags).entrySet().stream()
                .map(tag -> tag.getKey() + ":" + (tag.getValue() == null ? "" : tag.getValue()))
                .collect(Collectors.joining(";"));
    }
}
