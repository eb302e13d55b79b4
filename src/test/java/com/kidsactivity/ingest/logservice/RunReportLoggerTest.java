package com.kidsactivity.ingest.logservice;

import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.enums.ChangeType;
import com.kidsactivity.ingest.enums.RegistrationStatus;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.FieldChange;
import com.kidsactivity.ingest.model.RunStats;
import com.kidsactivity.ingest.model.UpsertOutcome;
import com.kidsactivity.ingest.repository.ActivityRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunReportLoggerTest {

    @Mock
    private ActivityRepository activityRepository;

    @InjectMocks
    private RunReportLogger reportLogger;

    private final Provider provider = Provider.builder().id(1L).name("NVRC").build();

    private static ActivityCandidate candidate(String id, String category, String cost, RegistrationStatus status) {
        return ActivityCandidate.builder()
                .externalId(id)
                .name("Activity " + id)
                .category(category)
                .cost(cost == null ? null : new BigDecimal(cost))
                .registrationStatus(status)
                .build();
    }

    private static UpsertOutcome outcome(ChangeType type, String id, FieldChange... changes) {
        Activity activity = Activity.builder().externalId(id).name("Activity " + id).build();
        return new UpsertOutcome(type, activity, List.of(changes));
    }

    @Test
    void buildReport_listsCountsCategoriesAndPriceRange() {
        RunStats stats = new RunStats();
        stats.addFound(4);
        stats.incrementCreated();
        stats.incrementUpdated();
        stats.incrementUnchanged();
        stats.incrementDiscarded();
        stats.addDeactivated(2);

        List<ActivityCandidate> candidates = List.of(
                candidate("1", "Aquatics", "85.00", RegistrationStatus.OPEN),
                candidate("2", "Aquatics", "42.50", RegistrationStatus.FULL),
                candidate("3", "Camps", "1250.50", RegistrationStatus.OPEN));

        String report = reportLogger.buildReport(provider, stats, candidates,
                List.of(outcome(ChangeType.CREATE, "1"),
                        outcome(ChangeType.UPDATE, "2", new FieldChange("spotsAvailable", 5, 3)),
                        outcome(ChangeType.UNCHANGED, "3")),
                Duration.ofSeconds(125), Map.of(RegistrationStatus.OPEN, 7L));

        assertThat(report)
                .contains("NVRC INGESTION REPORT")
                .contains("Duration: 2m 05s")
                .contains("Entries found:     4")
                .contains("Deactivated:       2")
                .contains("Discarded (no id): 1")
                .contains("Aquatics: 2")
                .contains("Camps: 1")
                .contains("ACTIVE IN STORE")
                .contains("Minimum: $42.50")
                .contains("Maximum: $1250.50")
                .contains("NEW ACTIVITIES (1)")
                .contains("- Activity 1 [1]")
                .contains("UPDATED ACTIVITIES (1)")
                .contains("spotsAvailable: 5 -> 3");
    }

    @Test
    void buildReport_noCostsAndNoStoreCounts_saysSo() {
        String report = reportLogger.buildReport(provider, new RunStats(),
                List.of(candidate("1", null, null, RegistrationStatus.UNKNOWN)),
                List.of(), Duration.ZERO, Map.of());

        assertThat(report)
                .contains("No price information available")
                .contains("(none): 1")
                .doesNotContain("ACTIVE IN STORE")
                .doesNotContain("NEW ACTIVITIES");
    }

    @Test
    void buildReport_manyCreations_capsTheList() {
        List<UpsertOutcome> outcomes = new ArrayList<>();
        for (int i = 1; i <= 13; i++) {
            outcomes.add(outcome(ChangeType.CREATE, String.valueOf(i)));
        }

        String report = reportLogger.buildReport(provider, new RunStats(), List.of(), outcomes, Duration.ZERO, Map.of());

        assertThat(report)
                .contains("NEW ACTIVITIES (13)")
                .contains("- Activity 10 [10]")
                .doesNotContain("- Activity 11 [11]")
                .contains("... and 3 more");
    }

    @Test
    void logRunReport_storeCountsUnavailable_stillLogs() {
        when(activityRepository.countActiveByRegistrationStatus(1L)).thenThrow(new IllegalStateException("connection reset"));

        assertThatCode(() -> reportLogger.logRunReport(provider, new RunStats(), List.of(), List.of(), Duration.ofSeconds(3)))
                .doesNotThrowAnyException();
        verify(activityRepository).countActiveByRegistrationStatus(1L);
    }
}
