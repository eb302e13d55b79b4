package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.entity.ScrapeRun;
import com.kidsactivity.ingest.enums.ScrapeRunStatus;
import com.kidsactivity.ingest.model.RunStats;
import com.kidsactivity.ingest.repository.ScrapeRunRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Writes the ScrapeRun audit row: RUNNING at start, then COMPLETED or FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeRunService {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 2048;

    private final ScrapeRunRepository scrapeRunRepository;

    @Transactional
    public ScrapeRun start(Provider provider, Instant now) {
        ScrapeRun run = scrapeRunRepository.save(ScrapeRun.builder()
                .providerId(provider.getId())
                .status(ScrapeRunStatus.RUNNING)
                .startedAt(now)
                .build());
        log.info("Scrape run {} started for provider {}", run.getId(), provider.getName());
        return run;
    }

    @Transactional
    public ScrapeRun complete(ScrapeRun run, RunStats stats, Instant now) {
        return finish(run, ScrapeRunStatus.COMPLETED, stats, null, now);
    }

    @Transactional
    public ScrapeRun fail(ScrapeRun run, RunStats stats, String errorMessage, Instant now) {
        return finish(run, ScrapeRunStatus.FAILED, stats, errorMessage, now);
    }

    public Optional<ScrapeRun> findLastCompleted(Long providerId) {
        return scrapeRunRepository.findFirstByProviderIdAndStatusOrderByStartedAtDesc(providerId, ScrapeRunStatus.COMPLETED);
    }

    private ScrapeRun finish(ScrapeRun run, ScrapeRunStatus status, RunStats stats, String errorMessage, Instant now) {
        run.setStatus(status);
        run.setCompletedAt(now);
        run.setActivitiesFound(stats.getFound());
        run.setActivitiesCreated(stats.getCreated());
        run.setActivitiesUpdated(stats.getUpdated());
        run.setActivitiesUnchanged(stats.getUnchanged());
        run.setActivitiesDeactivated(stats.getDeactivated());
        run.setEntriesDiscarded(stats.getDiscarded());
        run.setErrorCount(stats.getErrors());
        if (errorMessage != null) {
            run.setErrorMessage(errorMessage.length() > MAX_ERROR_MESSAGE_LENGTH
                    ? errorMessage.substring(0, MAX_ERROR_MESSAGE_LENGTH)
                    : errorMessage);
        }
        return scrapeRunRepository.save(run);
    }
}
