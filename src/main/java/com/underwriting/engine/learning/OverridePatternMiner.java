package com.underwriting.engine.learning;

import com.underwriting.engine.domain.OverrideDirection;
import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.domain.OverrideType;
import com.underwriting.engine.override.OverrideRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups overrides into recurring patterns that may point at rules worth
 * revisiting.
 */
@ApplicationScoped
public class OverridePatternMiner {

    private static final Logger LOG = Logger.getLogger(OverridePatternMiner.class);

    static final int MIN_GROUP_SIZE = 2;
    static final int MAX_EXAMPLES = 3;
    static final int SUGGESTION_MIN_COUNT = 5;
    static final double SUGGESTION_MIN_PERCENTAGE = 10.0;

    @Inject
    OverrideRepository repository;

    /**
     * Mines every stored override, or only those of {@code type} when it is
     * not {@code null}.
     */
    public List<OverridePattern> analyze(OverrideType type) {
        List<OverrideRecord> overrides = repository.findByType(type);
        List<OverridePattern> patterns = minePatterns(overrides);
        LOG.debugf("Mined %d pattern(s) from %d override(s)", patterns.size(), overrides.size());
        return patterns;
    }

    /**
     * Patterns of at least {@value #MIN_GROUP_SIZE} overrides, largest first.
     * Groups of equal size keep the order in which they were first seen.
     */
    public List<OverridePattern> minePatterns(List<OverrideRecord> overrides) {
        Map<PatternKey, List<OverrideRecord>> groups = new LinkedHashMap<>();
        for (OverrideRecord override : overrides) {
            PatternKey key = new PatternKey(override.getOverrideType(), override.getDirection(), override.getPrimaryTag());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(override);
        }

        List<OverridePattern> patterns = new ArrayList<>();
        for (Map.Entry<PatternKey, List<OverrideRecord>> entry : groups.entrySet()) {
            List<OverrideRecord> group = entry.getValue();
            if (group.size() < MIN_GROUP_SIZE) {
                continue;
            }
            patterns.add(toPattern(entry.getKey(), group, overrides.size()));
        }
        patterns.sort(Comparator.comparingInt(OverridePattern::count).reversed());
        return patterns;
    }

    private static OverridePattern toPattern(PatternKey key, List<OverrideRecord> group, int total) {
        String type = key.type().getValue();
        String direction = key.direction().getValue();
        double percentage = (double) group.size() / total * 100;

        String suggestedAction = null;
        if (group.size() >= SUGGESTION_MIN_COUNT && percentage >= SUGGESTION_MIN_PERCENTAGE) {
            suggestedAction = "Consider updating " + type + " rules to account for \"" + key.tag() + "\" scenarios";
        }

        List<OverridePattern.Example> examples = new ArrayList<>();
        for (OverrideRecord override : group.subList(0, Math.min(MAX_EXAMPLES, group.size()))) {
            examples.add(new OverridePattern.Example(
                    override.getCaseId(), override.getReasoning(), override.getUnderwriterName()));
        }

        return new OverridePattern(type, direction, key.tag(),
                direction + " " + type + " due to " + key.tag(),
                group.size(), percentage, examples, suggestedAction);
    }

    private record PatternKey(OverrideType type, OverrideDirection direction, String tag) {
    }
}
