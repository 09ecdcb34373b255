package com.underwriting.engine.override;

import com.underwriting.engine.domain.CaseRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCaseSnapshotSourceTest {

    private InMemoryCaseSnapshotSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryCaseSnapshotSource();
        source.overrideRepository = new InMemoryOverrideRepository();
    }

    private void save(String id, String status, Instant createdAt) {
        CaseRecord caseRecord = new CaseRecord(id);
        caseRecord.setStatus(status);
        caseRecord.setCreatedAt(createdAt);
        source.save(caseRecord);
    }

    @Test
    void completedCasesInStorageOrderUpToLimit() {
        save("a", "completed", null);
        save("b", "in_review", null);
        save("c", "COMPLETED", null);
        save("d", "completed", null);

        assertThat(source.findCompletedCases(2)).extracting(CaseRecord::getId).containsExactly("a", "c");
    }

    @Test
    void countsCasesCreatedAfterCutoff() {
        Instant cutoff = Instant.parse("2026-10-01T00:00:00Z");
        save("a", "completed", cutoff.minusSeconds(1));
        save("b", "completed", cutoff);
        save("c", "completed", cutoff.plusSeconds(1));
        save("d", "completed", null);

        assertThat(source.countCasesCreatedSince(cutoff)).isEqualTo(1);
    }

    @Test
    void unknownCaseIsEmpty() {
        assertThat(source.findCase("nope")).isEmpty();
    }
}
