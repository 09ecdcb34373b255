package com.underwriting.engine.override;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Override counts over a trailing window.
 *
 * @param overrideRate overrides per hundred cases created in the window
 */
public record OverrideStatistics(
        int periodDays,
        long totalOverrides,
        Map<String, Long> byType,
        Map<String, Long> byDirection,
        List<ReasonCount> topReasons,
        double overrideRate) {

    public OverrideStatistics {
        byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
        byDirection = Collections.unmodifiableMap(new LinkedHashMap<>(byDirection));
        topReasons = List.copyOf(topReasons);
    }

    public record ReasonCount(String reason, long count) {
    }
}
