package com.underwriting.engine.override;

import com.underwriting.engine.domain.CaseRecord;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Case source kept in memory. Overrides are joined from the
 * {@link OverrideRepository} on every read, so a returned case always carries
 * the overrides recorded against it so far.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryCaseSnapshotSource implements CaseSnapshotSource {

    private final Map<String, CaseRecord> cases = new LinkedHashMap<>();

    @Inject
    OverrideRepository overrideRepository;

    public synchronized void save(CaseRecord caseRecord) {
        cases.put(caseRecord.getId(), caseRecord);
    }

    @Override
    public synchronized Optional<CaseRecord> findCase(String caseId) {
        return Optional.ofNullable(cases.get(caseId)).map(this::withOverrides);
    }

    @Override
    public synchronized List<CaseRecord> findCompletedCases(int limit) {
        List<CaseRecord> result = new ArrayList<>();
        for (CaseRecord caseRecord : cases.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (caseRecord.isCompleted()) {
                result.add(withOverrides(caseRecord));
            }
        }
        return result;
    }

    @Override
    public synchronized long countCasesCreatedSince(Instant since) {
        return cases.values().stream()
                .filter(c -> c.getCreatedAt() != null && c.getCreatedAt().isAfter(since))
                .count();
    }

    private CaseRecord withOverrides(CaseRecord caseRecord) {
        if (overrideRepository == null) {
            return caseRecord;
        }
        return caseRecord.withOverrides(overrideRepository.findByCase(caseRecord.getId()));
    }
}
