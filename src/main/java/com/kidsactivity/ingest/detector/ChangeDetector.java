package com.kidsactivity.ingest.detector;

import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.ChangeSet;
import com.kidsactivity.ingest.model.FieldChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Decides whether a fresh observation differs from the stored record in any way that matters.
 *
 * <p>Only the fields in {@link #SIGNIFICANT_FIELDS} count. Everything else (raw snapshot,
 * sessions, geocode, timestamps) may drift without producing an update.
 */
@Component
@Slf4j
public class ChangeDetector {

    static final List<Field> SIGNIFICANT_FIELDS = List.of(
            new Field("name", Activity::getName, ActivityCandidate::getName),
            new Field("description", Activity::getDescription, ActivityCandidate::getDescription),
            new Field("schedule", Activity::getSchedule, ActivityCandidate::getSchedule),
            new Field("dateStart", Activity::getDateStart, ActivityCandidate::getDateStart),
            new Field("dateEnd", Activity::getDateEnd, ActivityCandidate::getDateEnd),
            new Field("ageMin", Activity::getAgeMin, ActivityCandidate::getAgeMin),
            new Field("ageMax", Activity::getAgeMax, ActivityCandidate::getAgeMax),
            new Field("cost", Activity::getCost, ActivityCandidate::getCost),
            new Field("spotsAvailable", Activity::getSpotsAvailable, ActivityCandidate::getSpotsAvailable),
            new Field("totalSpots", Activity::getTotalSpots, ActivityCandidate::getTotalSpots),
            new Field("locationId", Activity::getLocationId, ActivityCandidate::getLocationId),
            new Field("registrationUrl", Activity::getRegistrationUrl, ActivityCandidate::getRegistrationUrl),
            new Field("registrationStatus", Activity::getRegistrationStatus, ActivityCandidate::getRegistrationStatus),
            new Field("instructor", Activity::getInstructor, ActivityCandidate::getInstructor),
            new Field("fullDescription", Activity::getFullDescription, ActivityCandidate::getFullDescription),
            new Field("whatToBring", Activity::getWhatToBring, ActivityCandidate::getWhatToBring)
    );

    public ChangeSet classify(Activity existing, ActivityCandidate candidate) {
        if (existing == null) {
            return ChangeSet.create();
        }

        List<FieldChange> changes = new ArrayList<>();
        for (Field field : SIGNIFICANT_FIELDS) {
            Object oldValue = field.stored().apply(existing);
            Object newValue = field.observed().apply(candidate);
            if (!sameValue(oldValue, newValue)) {
                changes.add(new FieldChange(field.name(), oldValue, newValue));
            }
        }

        if (!changes.isEmpty()) {
            log.debug("Activity {} changed: {}", existing.getExternalId(), changes);
        }
        return ChangeSet.of(changes);
    }

    /**
     * Blank strings equal null; decimals compare by numeric value so 85 equals 85.00.
     */
    static boolean sameValue(Object a, Object b) {
        Object left = blankToNull(a);
        Object right = blankToNull(b);
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            return l.compareTo(r) == 0;
        }
        if (left instanceof String l && right instanceof String r) {
            return l.trim().equals(r.trim());
        }
        return Objects.equals(left, right);
    }

    private static Object blankToNull(Object value) {
        if (value instanceof String s && s.isBlank()) {
            return null;
        }
        return value;
    }

    record Field(String name, Function<Activity, Object> stored, Function<ActivityCandidate, Object> observed) {
    }
}
