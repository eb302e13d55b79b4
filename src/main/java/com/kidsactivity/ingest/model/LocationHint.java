package com.kidsactivity.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whatever the pipeline knows about a venue when it resolves the owning activity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LocationHint {
    private String name;
    private String address;
    private String city;
    private String postalCode;
    private Double latitude;
    private Double longitude;
}
