package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.config.IngestConfig;
import com.kidsactivity.ingest.entity.Location;
import com.kidsactivity.ingest.enums.FacilityType;
import com.kidsactivity.ingest.model.LocationHint;
import com.kidsactivity.ingest.repository.LocationRepository;
import com.kidsactivity.ingest.utils.LocationNameNormalizer;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a venue hint onto a stored {@link Location}, creating one when nothing matches.
 * Match order: exact name and address, normalized name, case-insensitive substring, create.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocationResolver {

    private static final String EMOJI_PIN = "📍";

    private final LocationRepository locationRepository;
    private final IngestConfig ingestConfig;
    private final Clock clock;

    /**
     * @return the location id, or null when the hint carries no usable name
     */
    @Transactional
    public Long resolve(LocationHint hint) {
        if (hint == null || hint.getName() == null || hint.getName().isBlank()) {
            return null;
        }
        String name = hint.getName().trim();
        String address = hint.getAddress() == null ? "" : hint.getAddress().trim();

        Optional<Location> exact = locationRepository.findFirstByNameAndAddressOrderByIdAsc(name, address);
        if (exact.isPresent()) {
            return fillGaps(exact.get(), hint).getId();
        }

        String normalized = LocationNameNormalizer.normalize(name);
        Optional<Location> byNormalized = locationRepository.findFirstByNormalizedNameOrderByIdAsc(normalized);
        if (byNormalized.isPresent()) {
            log.debug("{} '{}' matched '{}' by normalized name", EMOJI_PIN, name, byNormalized.get().getName());
            return fillGaps(byNormalized.get(), hint).getId();
        }

        int minLength = ingestConfig.getLocationMinSubstringLength();
        if (name.length() >= minLength) {
            String lowered = name.toLowerCase(Locale.ROOT);
            Optional<Location> match = locationRepository.findAllByOrderByIdAsc().stream()
                    .filter(l -> l.getName() != null && l.getName().length() >= minLength)
                    .filter(l -> containsEitherWay(l.getName().toLowerCase(Locale.ROOT), lowered))
                    .findFirst();
            if (match.isPresent()) {
                log.debug("{} '{}' matched '{}' by substring", EMOJI_PIN, name, match.get().getName());
                return fillGaps(match.get(), hint).getId();
            }
        }

        Location created = locationRepository.save(Location.builder()
                .name(name)
                .normalizedName(normalized)
                .address(address)
                .city(hint.getCity())
                .postalCode(hint.getPostalCode())
                .latitude(hint.getLatitude())
                .longitude(hint.getLongitude())
                .facilityType(FacilityType.fromName(name))
                .createdAt(clock.instant())
                .build());
        log.info("{} Created location '{}' ({})", EMOJI_PIN, created.getName(), created.getFacilityType());
        return created.getId();
    }

    // Plain text containment, so '%' and '_' in venue names are literal
    private static boolean containsEitherWay(String stored, String hint) {
        return stored.contains(hint) || hint.contains(stored);
    }

    /**
     * Geocode and postal details only ever fill blanks on an existing venue.
     */
    private Location fillGaps(Location location, LocationHint hint) {
        boolean dirty = false;
        if (location.getLatitude() == null && hint.getLatitude() != null && hint.getLongitude() != null) {
            location.setLatitude(hint.getLatitude());
            location.setLongitude(hint.getLongitude());
            dirty = true;
        }
        if (location.getCity() == null && hint.getCity() != null) {
            location.setCity(hint.getCity());
            dirty = true;
        }
        if (location.getPostalCode() == null && hint.getPostalCode() != null) {
            location.setPostalCode(hint.getPostalCode());
            dirty = true;
        }
        return dirty ? locationRepository.save(location) : location;
    }
}
