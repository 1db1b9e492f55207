package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.dto.ScoredReport;
import com.goormthonuniv.factcheck.verify.ConfidenceLevel;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryReportRepositoryTest {

    static ScoredReport report(String id, OffsetDateTime at) {
        return new ScoredReport(id, at, null, "title " + id, null, ConfidenceLevel.LOW, 0, 0, 0, 0,
                null, null, "s", null, null, null, null, null);
    }

    @Test
    void findsByIdAndListsNewestFirst() {
        InMemoryReportRepository repo = new InMemoryReportRepository();
        OffsetDateTime t0 = OffsetDateTime.parse("2024-05-01T10:00:00Z");
        repo.save(report("a", t0));
        repo.save(report("b", t0.plusMinutes(5)));
        repo.save(report("c", t0.plusMinutes(1)));

        assertThat(repo.findById("b")).isPresent();
        assertThat(repo.findById("zzz")).isEmpty();
        assertThat(repo.findRecent(2)).extracting(ScoredReport::reportId).containsExactly("b", "c");
        assertThat(repo.findRecent(50)).hasSize(3);
    }
}
