package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.config.IngestConfig;
import com.kidsactivity.ingest.enricher.DetailEnricher;
import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.entity.ScrapeRun;
import com.kidsactivity.ingest.enums.ScrapeRunStatus;
import com.kidsactivity.ingest.extractor.FieldExtractor;
import com.kidsactivity.ingest.logservice.RunReportLogger;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.EnrichmentResult;
import com.kidsactivity.ingest.model.EnumerationResult;
import com.kidsactivity.ingest.model.RawListing;
import com.kidsactivity.ingest.model.RunOptions;
import com.kidsactivity.ingest.model.RunResult;
import com.kidsactivity.ingest.model.RunStats;
import com.kidsactivity.ingest.model.UpsertOutcome;
import com.kidsactivity.ingest.navigator.ListingNavigator;
import com.kidsactivity.ingest.service.ActivityPersistenceService;
import com.kidsactivity.ingest.service.LocationResolver;
import com.kidsactivity.ingest.service.ProviderService;
import com.kidsactivity.ingest.service.Reconciler;
import com.kidsactivity.ingest.service.ScrapeRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single entry point of the pipeline: enumerate, extract, enrich, persist, reconcile.
 *
 * <p>One run at a time. A fatal error never escapes {@link #run}; it is recorded on the ScrapeRun
 * row and returned as a FAILED result, and reconciliation is skipped. Reconciliation is also
 * skipped when the listing tree was only partly read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final String EMOJI_LIST = "📋";
    private static final String EMOJI_SAVE = "💾";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private final IngestConfig ingestConfig;
    private final BrowserSessionFactory sessionFactory;
    private final ListingNavigator listingNavigator;
    private final FieldExtractor fieldExtractor;
    private final DetailEnricher detailEnricher;
    private final LocationResolver locationResolver;
    private final ActivityPersistenceService persistenceService;
    private final Reconciler reconciler;
    private final ScrapeRunService scrapeRunService;
    private final ProviderService providerService;
    private final RunReportLogger reportLogger;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RunResult run(RunOptions options) {
        if (!running.compareAndSet(false, true)) {
            log.warn("{} A run is already in progress, refusing to start another", EMOJI_WARNING);
            return RunResult.builder()
                    .status(ScrapeRunStatus.FAILED)
                    .errorMessage("Another run is already in progress")
                    .stats(new RunStats())
                    .activities(List.of())
                    .build();
        }
        try {
            return doRun(options);
        } finally {
            running.set(false);
        }
    }

    private RunResult doRun(RunOptions options) {
        RunStats stats = new RunStats();
        Instant startedAt = clock.instant();

        Provider provider;
        ScrapeRun scrapeRun;
        try {
            provider = providerService.findOrCreate(ingestConfig.getProviderName(),
                    ingestConfig.getProviderBaseUrl(), ingestConfig.getProviderListingUrl(), startedAt);
            scrapeRun = scrapeRunService.start(provider, startedAt);
        } catch (RuntimeException e) {
            log.error("{} Could not register run: {}", EMOJI_ERROR, e.getMessage(), e);
            return failed(null, stats, "Could not register run: " + e.getMessage());
        }

        reportLogger.logRunStart(provider, options, scrapeRun.getId());
        scrapeRunService.findLastCompleted(provider.getId()).ifPresent(last ->
                log.info("Previous completed run {} at {} found {} entries",
                        last.getId(), last.getStartedAt(), last.getActivitiesFound()));

        try (BrowserPool pool = new BrowserPool(sessionFactory)) {
            pool.start(options.getConcurrency(), options.isHeadless());

            EnumerationResult enumeration = enumerate(pool, provider);
            stats.addFound(enumeration.listings().size());
            stats.addErrors(enumeration.failures());

            List<ActivityCandidate> candidates = extract(enumeration.listings(), stats);
            reportLogger.logDiscarded(stats.getDiscarded(), stats.getFound());

            EnrichmentResult enrichment = detailEnricher.enrich(pool, candidates);
            stats.addErrors(enrichment.errors());

            Instant now = clock.instant();
            List<UpsertOutcome> outcomes = persist(provider, enrichment.candidates(), stats, now);

            Set<String> seenIds = new HashSet<>();
            List<Activity> activities = new ArrayList<>(outcomes.size());
            for (UpsertOutcome outcome : outcomes) {
                seenIds.add(outcome.activity().getExternalId());
                activities.add(outcome.activity());
            }
            if (enumeration.isComplete()) {
                stats.addDeactivated(reconciler.reconcile(provider, seenIds, now));
            } else {
                log.warn("{} Listing tree only partly read ({} groups failed, {} entries unreadable), skipping reconciliation",
                        EMOJI_WARNING, enumeration.failedGroups(), enumeration.unreadableEntries());
            }

            Instant completedAt = clock.instant();
            scrapeRunService.complete(scrapeRun, stats, completedAt);
            reportLogger.logRunReport(provider, stats, enrichment.candidates(), outcomes,
                    Duration.between(startedAt, completedAt));

            return RunResult.builder()
                    .scrapeRunId(scrapeRun.getId())
                    .status(ScrapeRunStatus.COMPLETED)
                    .stats(stats)
                    .activities(activities)
                    .build();

        } catch (Exception e) {
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("{} Run {} aborted: {}", EMOJI_ERROR, scrapeRun.getId(), message, e);
            try {
                scrapeRunService.fail(scrapeRun, stats, message, clock.instant());
            } catch (RuntimeException persistError) {
                log.error("{} Could not mark run {} as failed: {}", EMOJI_ERROR, scrapeRun.getId(), persistError.getMessage());
            }
            reportLogger.logRunFailed(provider, scrapeRun.getId(), message, stats);
            return failed(scrapeRun.getId(), stats, message);
        }
    }

    private EnumerationResult enumerate(BrowserPool pool, Provider provider) throws InterruptedException, ExecutionException {
        BrowserSession lead = pool.acquire();
        try {
            return lead.submit(page -> listingNavigator.enumerate(page, provider)).get();
        } catch (ExecutionException e) {
            // Surface the navigator's own exception as the failure reason
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            pool.release(lead);
        }
    }

    /**
     * Extracts every listing and drops duplicates by external id, keeping the first occurrence.
     */
    List<ActivityCandidate> extract(List<RawListing> listings, RunStats stats) {
        Map<String, ActivityCandidate> byId = new LinkedHashMap<>();
        int duplicates = 0;
        for (RawListing listing : listings) {
            Optional<ActivityCandidate> candidate = fieldExtractor.extract(listing);
            if (candidate.isEmpty()) {
                stats.incrementDiscarded();
                continue;
            }
            if (byId.putIfAbsent(candidate.get().getExternalId(), candidate.get()) != null) {
                duplicates++;
            }
        }
        log.info("{} Extracted {} unique candidates ({} duplicates, {} discarded)",
                EMOJI_LIST, byId.size(), duplicates, stats.getDiscarded());
        return new ArrayList<>(byId.values());
    }

    private List<UpsertOutcome> persist(Provider provider, List<ActivityCandidate> candidates, RunStats stats, Instant now) {
        List<UpsertOutcome> outcomes = new ArrayList<>(candidates.size());
        for (ActivityCandidate candidate : candidates) {
            try {
                candidate.setLocationId(resolveLocation(candidate));
                UpsertOutcome outcome = persistenceService.upsert(provider, candidate, now);
                switch (outcome.type()) {
                    case CREATE -> stats.incrementCreated();
                    case UPDATE -> stats.incrementUpdated();
                    case UNCHANGED -> stats.incrementUnchanged();
                }
                outcomes.add(outcome);
            } catch (RuntimeException e) {
                stats.incrementErrors();
                log.error("{} {} Failed to save activity {}: {}",
                        EMOJI_ERROR, EMOJI_SAVE, candidate.getExternalId(), e.getMessage());
            }
        }
        log.info("{} Saved {} activities | created={} updated={} unchanged={}",
                EMOJI_SAVE, outcomes.size(), stats.getCreated(), stats.getUpdated(), stats.getUnchanged());
        return outcomes;
    }

    private Long resolveLocation(ActivityCandidate candidate) {
        try {
            return locationResolver.resolve(candidate.toLocationHint());
        } catch (RuntimeException e) {
            log.warn("{} Location '{}' unresolved for {}: {}",
                    EMOJI_WARNING, candidate.getLocationName(), candidate.getExternalId(), e.getMessage());
            return null;
        }
    }

    private RunResult failed(Long scrapeRunId, RunStats stats, String message) {
        return RunResult.builder()
                .scrapeRunId(scrapeRunId)
                .status(ScrapeRunStatus.FAILED)
                .errorMessage(message)
                .stats(stats)
                .activities(List.of())
                .build();
    }
}
