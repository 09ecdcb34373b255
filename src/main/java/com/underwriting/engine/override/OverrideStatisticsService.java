package com.underwriting.engine.override;

import com.underwriting.engine.domain.OverrideRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class OverrideStatisticsService {

    @Inject
    OverrideRepository repository;

    @Inject
    CaseSnapshotSource caseSource;

    @ConfigProperty(name = "app.overrides.top-reasons", defaultValue = "10")
    int topReasonsLimit = 10;

    Clock clock = Clock.systemUTC();

    /**
     * Summarizes overrides created in the last {@code days} days. Reasons are
     * counted per reasoning tag; an override with several tags counts once
     * for each.
     */
    public OverrideStatistics summarize(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive, got " + days);
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<OverrideRecord> overrides = repository.findCreatedSince(since);

        Map<String, Long> byType = new LinkedHashMap<>();
        Map<String, Long> byDirection = new LinkedHashMap<>();
        Map<String, Long> reasons = new LinkedHashMap<>();
        for (OverrideRecord override : overrides) {
            byType.merge(override.getOverrideType().getValue(), 1L, Long::sum);
            byDirection.merge(override.getDirection().getValue(), 1L, Long::sum);
            for (String tag : override.getReasoningTags()) {
                reasons.merge(tag, 1L, Long::sum);
            }
        }

        List<OverrideStatistics.ReasonCount> topReasons = new ArrayList<>();
        reasons.forEach((reason, count) -> topReasons.add(new OverrideStatistics.ReasonCount(reason, count)));
        topReasons.sort(Comparator.comparingLong(OverrideStatistics.ReasonCount::count).reversed());

        long cases = caseSource.countCasesCreatedSince(since);
        double rate = cases > 0 ? (double) overrides.size() / cases * 100 : 0.0;

        return new OverrideStatistics(days, overrides.size(), byType, byDirection,
                topReasons.subList(0, Math.min(topReasonsLimit, topReasons.size())), rate);
    }
}
