package com.kidsactivity.ingest.logservice;

import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.enums.ChangeType;
import com.kidsactivity.ingest.enums.RegistrationStatus;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.RunOptions;
import com.kidsactivity.ingest.model.RunStats;
import com.kidsactivity.ingest.model.UpsertOutcome;
import com.kidsactivity.ingest.repository.ActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Lifecycle and end-of-run logging for ingestion runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunReportLogger {

    private static final String EMOJI_START = "🚀";
    private static final String EMOJI_REPORT = "📊";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_WARNING = "⚠️";

    private static final int MAX_LISTED_CHANGES = 10;

    private final ActivityRepository activityRepository;

    // ==========================================
    // LIFECYCLE
    // ==========================================

    public void logRunStart(Provider provider, RunOptions options, Long scrapeRunId) {
        log.info("{} Ingestion run {} starting | Provider: {} | Concurrency: {} | Headless: {}",
                EMOJI_START, scrapeRunId, provider.getName(), options.getConcurrency(), options.isHeadless());
    }

    public void logRunFailed(Provider provider, Long scrapeRunId, String message, RunStats stats) {
        log.error("{} Ingestion run {} FAILED | Provider: {} | Reason: {} | {}",
                EMOJI_ERROR, scrapeRunId, provider == null ? "?" : provider.getName(), message, stats);
    }

    public void logDiscarded(int discarded, int found) {
        if (discarded > 0) {
            log.warn("{} Discarded {}/{} entries without an identifier", EMOJI_WARNING, discarded, found);
        }
    }

    // ==========================================
    // REPORT
    // ==========================================

    public void logRunReport(Provider provider, RunStats stats, List<ActivityCandidate> candidates,
                             List<UpsertOutcome> outcomes, Duration duration) {
        Map<RegistrationStatus, Long> activeByStatus = new TreeMap<>();
        try {
            for (Object[] row : activityRepository.countActiveByRegistrationStatus(provider.getId())) {
                activeByStatus.put((RegistrationStatus) row[0], (Long) row[1]);
            }
        } catch (RuntimeException e) {
            log.warn("{} Could not load active status counts: {}", EMOJI_WARNING, e.getMessage());
        }

        log.info("{} {}", EMOJI_REPORT, buildReport(provider, stats, candidates, outcomes, duration, activeByStatus));
        log.info("{} Run complete | {}", EMOJI_SUCCESS, stats);
    }

    String buildReport(Provider provider, RunStats stats, List<ActivityCandidate> candidates,
                       List<UpsertOutcome> outcomes, Duration duration, Map<RegistrationStatus, Long> activeByStatus) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n").append(provider.getName()).append(" INGESTION REPORT\n");
        sb.append("========================================\n");
        sb.append("Duration: ").append(formatDuration(duration)).append("\n\n");

        sb.append("SUMMARY\n-------\n");
        sb.append("Entries found:     ").append(stats.getFound()).append('\n');
        sb.append("Created:           ").append(stats.getCreated()).append('\n');
        sb.append("Updated:           ").append(stats.getUpdated()).append('\n');
        sb.append("Unchanged:         ").append(stats.getUnchanged()).append('\n');
        sb.append("Deactivated:       ").append(stats.getDeactivated()).append('\n');
        sb.append("Discarded (no id): ").append(stats.getDiscarded()).append('\n');
        sb.append("Errors:            ").append(stats.getErrors()).append("\n\n");

        long enriched = candidates.stream().filter(ActivityCandidate::isEnriched).count();
        long withSessions = candidates.stream().filter(c -> !c.getSessions().isEmpty()).count();
        long withPrereqs = candidates.stream().filter(c -> !c.getPrerequisites().isEmpty()).count();
        sb.append("ENRICHMENT\n----------\n");
        sb.append("With details:       ").append(enriched).append('\n');
        sb.append("With sessions:      ").append(withSessions).append('\n');
        sb.append("With prerequisites: ").append(withPrereqs).append("\n\n");

        Map<String, Long> byCategory = new TreeMap<>();
        Map<RegistrationStatus, Long> byStatus = new TreeMap<>();
        BigDecimal min = null;
        BigDecimal max = null;
        for (ActivityCandidate c : candidates) {
            byCategory.merge(Objects.requireNonNullElse(c.getCategory(), "(none)"), 1L, Long::sum);
            byStatus.merge(c.getRegistrationStatus(), 1L, Long::sum);
            if (c.getCost() != null) {
                min = min == null || c.getCost().compareTo(min) < 0 ? c.getCost() : min;
                max = max == null || c.getCost().compareTo(max) > 0 ? c.getCost() : max;
            }
        }

        sb.append("BY CATEGORY\n-----------\n");
        byCategory.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
        sb.append("\nBY REGISTRATION STATUS (this run)\n---------------------------------\n");
        byStatus.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
        if (!activeByStatus.isEmpty()) {
            sb.append("\nACTIVE IN STORE\n---------------\n");
            activeByStatus.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
        }

        sb.append("\nPRICE RANGE\n-----------\n");
        if (min == null) {
            sb.append("No price information available\n");
        } else {
            sb.append("Minimum: $").append(min.toPlainString()).append('\n');
            sb.append("Maximum: $").append(max.toPlainString()).append('\n');
        }

        appendOutcomes(sb, "NEW ACTIVITIES", outcomes, ChangeType.CREATE);
        appendOutcomes(sb, "UPDATED ACTIVITIES", outcomes, ChangeType.UPDATE);
        return sb.toString();
    }

    private void appendOutcomes(StringBuilder sb, String title, List<UpsertOutcome> outcomes, ChangeType type) {
        List<UpsertOutcome> matching = outcomes.stream().filter(o -> o.type() == type).toList();
        if (matching.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(" (").append(matching.size()).append(")\n");
        sb.append("-".repeat(title.length())).append('\n');
        matching.stream().limit(MAX_LISTED_CHANGES).forEach(o -> {
            sb.append("- ").append(o.activity().getName()).append(" [").append(o.activity().getExternalId()).append("]\n");
            o.changes().forEach(change -> sb.append("    ").append(change).append('\n'));
        });
        if (matching.size() > MAX_LISTED_CHANGES) {
            sb.append("  ... and ").append(matching.size() - MAX_LISTED_CHANGES).append(" more\n");
        }
    }

    private static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format("%dm %02ds", seconds / 60, seconds % 60);
    }
}
