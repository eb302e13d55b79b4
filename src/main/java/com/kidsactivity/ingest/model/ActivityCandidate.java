package com.kidsactivity.ingest.model;

import com.kidsactivity.ingest.enums.RegistrationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-flight, not-yet-persisted form of an activity. Produced by the field extractor,
 * optionally enriched from the detail page, then handed to the persistence gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ActivityCandidate {

    private String externalId;
    private String name;
    private String category;
    private String subcategory;
    private String description;

    private String schedule;
    @Builder.Default
    private List<String> daysOfWeek = new ArrayList<>();
    private LocalDate dateStart;
    private LocalDate dateEnd;
    private String startTime;
    private String endTime;

    private LocalDate registrationDate;
    private LocalDate registrationEndDate;
    private String registrationEndTime;

    private Integer ageMin;
    private Integer ageMax;

    private BigDecimal cost;
    @Builder.Default
    private boolean costIncludesTax = true;
    private BigDecimal taxAmount;

    private Integer spotsAvailable;
    private Integer totalSpots;

    @Builder.Default
    private RegistrationStatus registrationStatus = RegistrationStatus.UNKNOWN;

    private String locationName;
    /** Set after location resolution; null when unresolved. */
    private Long locationId;
    private String registrationUrl;

    // Detail page
    private String instructor;
    private String fullDescription;
    private String whatToBring;
    private String prerequisitesText;
    private String courseDetails;
    private String fullAddress;
    private String city;
    private String postalCode;
    private Double latitude;
    private Double longitude;
    private boolean enriched;

    @Builder.Default
    private List<SessionInfo> sessions = new ArrayList<>();

    @Builder.Default
    private List<PrerequisiteInfo> prerequisites = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> rawSnapshot = new LinkedHashMap<>();

    public LocationHint toLocationHint() {
        return LocationHint.builder()
                .name(locationName)
                .address(fullAddress)
                .city(city)
                .postalCode(postalCode)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }
}
