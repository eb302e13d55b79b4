package com.kidsactivity.ingest.entity;

import com.kidsactivity.ingest.enums.FacilityType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
        name = "location",
        indexes = {
                @Index(name = "idx_location_normalized_name", columnList = "normalizedName"),
                @Index(name = "idx_location_name_address", columnList = "name,address")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class Location {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255, nullable = false)
    private String name;

    /** Case-folded, synonym-collapsed form of {@link #name}. */
    @Column(length = 255, nullable = false)
    private String normalizedName;

    @Builder.Default
    @Column(length = 512, nullable = false)
    private String address = "";

    @Column(length = 128)
    private String city;

    @Column(length = 16)
    private String postalCode;

    private Double latitude;
    private Double longitude;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    @Builder.Default
    private FacilityType facilityType = FacilityType.OTHER;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
