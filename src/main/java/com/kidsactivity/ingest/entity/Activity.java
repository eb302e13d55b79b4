package com.kidsactivity.ingest.entity;

import com.kidsactivity.ingest.converter.JsonMapConverter;
import com.kidsactivity.ingest.converter.StringListConverter;
import com.kidsactivity.ingest.enums.RegistrationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single offered program as last observed on the provider's site.
 * Keyed by (providerId, externalId); never hard-deleted by the pipeline.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(
        name = "activity",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_activity_provider_external", columnNames = {"providerId", "externalId"})
        },
        indexes = {
                @Index(name = "idx_activity_provider_active", columnList = "providerId,active"),
                @Index(name = "idx_activity_location", columnList = "locationId")
        }
)
@ToString(exclude = {"sessions", "prerequisites", "rawSnapshot"})
public class Activity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long providerId;

    @Column(length = 128, nullable = false)
    private String externalId;

    @Column(length = 255, nullable = false)
    private String name;

    @Column(length = 128)
    private String category;

    @Column(length = 255)
    private String subcategory;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Schedule
    @Column(length = 255)
    private String schedule;

    @Convert(converter = StringListConverter.class)
    @Column(length = 128)
    @Builder.Default
    private List<String> daysOfWeek = new ArrayList<>();

    private LocalDate dateStart;
    private LocalDate dateEnd;

    @Column(length = 16)
    private String startTime;

    @Column(length = 16)
    private String endTime;

    // Registration window
    private LocalDate registrationDate;
    private LocalDate registrationEndDate;

    @Column(length = 16)
    private String registrationEndTime;

    // Demographics, null bound means unbounded
    private Integer ageMin;
    private Integer ageMax;

    // Pricing
    @Column(precision = 10, scale = 2)
    private BigDecimal cost;

    @Builder.Default
    @Column(nullable = false)
    private boolean costIncludesTax = true;

    @Column(precision = 10, scale = 2)
    private BigDecimal taxAmount;

    // Capacity
    private Integer spotsAvailable;
    private Integer totalSpots;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    @Builder.Default
    private RegistrationStatus registrationStatus = RegistrationStatus.UNKNOWN;

    // Location
    private Long locationId;

    @Column(length = 255)
    private String locationName;

    @Column(length = 1024)
    private String registrationUrl;

    // Detail-page fields
    @Column(length = 255)
    private String instructor;

    @Column(columnDefinition = "TEXT")
    private String fullDescription;

    @Column(columnDefinition = "TEXT")
    private String whatToBring;

    @Column(columnDefinition = "TEXT")
    private String prerequisitesText;

    @Column(columnDefinition = "TEXT")
    private String courseDetails;

    @Column(length = 512)
    private String fullAddress;

    private Double latitude;
    private Double longitude;

    @Builder.Default
    private boolean hasMultipleSessions = false;

    @Builder.Default
    private int sessionCount = 0;

    @Builder.Default
    private boolean hasPrerequisites = false;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> rawSnapshot = new LinkedHashMap<>();

    // Lifecycle
    private Instant lastSeenAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Builder.Default
    @OneToMany(mappedBy = "activity", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("sessionNumber ASC")
    private List<ActivitySession> sessions = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "activity", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<ActivityPrerequisite> prerequisites = new ArrayList<>();

    /* -------------------- Lifecycle helpers -------------------- */

    public void markSeen(Instant now) {
        this.lastSeenAt = now;
        this.active = true;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }

    public void replaceSessions(List<ActivitySession> newSessions) {
        this.sessions.clear();
        for (ActivitySession session : newSessions) {
            session.setActivity(this);
            this.sessions.add(session);
        }
        this.sessionCount = this.sessions.size();
        this.hasMultipleSessions = this.sessions.size() > 1;
    }

    public void replacePrerequisites(List<ActivityPrerequisite> newPrerequisites) {
        this.prerequisites.clear();
        for (ActivityPrerequisite prerequisite : newPrerequisites) {
            prerequisite.setActivity(this);
            this.prerequisites.add(prerequisite);
        }
        this.hasPrerequisites = !this.prerequisites.isEmpty();
    }
}
