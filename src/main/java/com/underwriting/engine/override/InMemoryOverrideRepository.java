package com.underwriting.engine.override;

import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.domain.OverrideType;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Override store kept in memory, in insertion order. Used when no persistent
 * repository bean is provided.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryOverrideRepository implements OverrideRepository {

    private final Map<String, OverrideRecord> overrides = new LinkedHashMap<>();

    @Override
    public synchronized OverrideRecord save(OverrideRecord override) {
        overrides.put(override.getId(), override);
        return override;
    }

    @Override
    public synchronized Optional<OverrideRecord> findById(String id) {
        return Optional.ofNullable(overrides.get(id));
    }

    @Override
    public List<OverrideRecord> findByCase(String caseId) {
        List<OverrideRecord> result = select(o -> o.getCaseId().equals(caseId));
        result.sort(Comparator.comparing(OverrideRecord::getCreatedAt).reversed());
        return result;
    }

    @Override
    public List<OverrideRecord> findPendingValidation(int limit) {
        return select(o -> !o.isValidated() && !o.isFlaggedForReview()).stream()
                .sorted(Comparator.comparing(OverrideRecord::getCreatedAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<OverrideRecord> findByType(OverrideType type) {
        return select(o -> type == null || o.getOverrideType() == type);
    }

    @Override
    public List<OverrideRecord> findCreatedSince(Instant since) {
        return select(o -> o.getCreatedAt().isAfter(since));
    }

    private synchronized List<OverrideRecord> select(Predicate<OverrideRecord> filter) {
        List<OverrideRecord> result = new ArrayList<>();
        for (OverrideRecord override : overrides.values()) {
            if (filter.test(override)) {
                result.add(override);
            }
        }
        return result;
    }
}
