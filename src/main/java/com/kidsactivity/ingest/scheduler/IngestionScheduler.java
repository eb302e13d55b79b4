package com.kidsactivity.ingest.scheduler;

import com.kidsactivity.ingest.config.IngestConfig;
import com.kidsactivity.ingest.manager.IngestionOrchestrator;
import com.kidsactivity.ingest.model.RunOptions;
import com.kidsactivity.ingest.model.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers pipeline runs on startup and on a cron schedule.
 *
 * Both triggers are off by default. The schedule is nightly at 03:00 server time and can be
 * overridden with ingest.schedule.cron.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionScheduler {

    private static final String EMOJI_CLOCK = "⏰";

    private final IngestionOrchestrator orchestrator;
    private final IngestConfig ingestConfig;

    @Value("${ingest.schedule.cron:0 0 3 * * *}")
    private String cron;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (ingestConfig.isRunOnStartup()) {
            log.info("{} ingest.run-on-startup=true, starting run", EMOJI_CLOCK);
            trigger();
        } else if (ingestConfig.isScheduleEnabled()) {
            log.info("{} Ingestion ready. Schedule: {}", EMOJI_CLOCK, cron);
        } else {
            log.info("{} Ingestion ready. No automatic runs configured", EMOJI_CLOCK);
        }
    }

    @Scheduled(cron = "${ingest.schedule.cron:0 0 3 * * *}")
    public void scheduledRun() {
        if (!ingestConfig.isScheduleEnabled()) {
            return;
        }
        log.info("{} Scheduled run triggered", EMOJI_CLOCK);
        trigger();
    }

    RunResult trigger() {
        RunOptions options = RunOptions.builder()
                .concurrency(ingestConfig.getConcurrency())
                .headless(ingestConfig.isHeadless())
                .build();
        RunResult result = orchestrator.run(options);
        if (!result.isSuccess()) {
            log.error("Run {} failed: {}", result.getScrapeRunId(), result.getErrorMessage());
        }
        return result;
    }
}
