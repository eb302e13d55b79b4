package com.kidsactivity.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fields read from an activity's detail page. Null means "not found on the page".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DetailInfo {
    private String name;
    private String courseId;
    private String instructor;
    private String fullDescription;
    private String whatToBring;
    private String prerequisitesText;
    private String courseDetails;

    private LocalDate dateStart;
    private LocalDate dateEnd;
    private String startTime;
    private String endTime;
    private LocalDate registrationEndDate;
    private String registrationEndTime;

    private BigDecimal cost;
    private Boolean costIncludesTax;
    private BigDecimal taxAmount;
    private Integer spotsAvailable;
    private Integer totalSpots;

    private String locationName;
    private String fullAddress;
    private String city;
    private String postalCode;
    private Double latitude;
    private Double longitude;

    @Builder.Default
    private List<SessionInfo> sessions = new ArrayList<>();

    @Builder.Default
    private List<PrerequisiteInfo> prerequisites = new ArrayList<>();
}
