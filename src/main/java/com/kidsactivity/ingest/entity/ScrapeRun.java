package com.kidsactivity.ingest.entity;

import com.kidsactivity.ingest.enums.ScrapeRunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One end-to-end execution of the pipeline against one provider.
 * Written at start (RUNNING) and finalized as COMPLETED or FAILED.
 */
@Entity
@Table(
        name = "scrape_run",
        indexes = @Index(name = "idx_scrape_run_provider_started", columnList = "providerId,startedAt")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class ScrapeRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long providerId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    @Builder.Default
    private ScrapeRunStatus status = ScrapeRunStatus.RUNNING;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    @Builder.Default
    private int activitiesFound = 0;
    @Builder.Default
    private int activitiesCreated = 0;
    @Builder.Default
    private int activitiesUpdated = 0;
    @Builder.Default
    private int activitiesUnchanged = 0;
    @Builder.Default
    private int activitiesDeactivated = 0;
    @Builder.Default
    private int entriesDiscarded = 0;
    @Builder.Default
    private int errorCount = 0;

    @Column(length = 2048)
    private String errorMessage;

    @Transient
    public Duration getDuration() {
        if (startedAt == null || completedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, completedAt);
    }
}
