package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.detector.ChangeDetector;
import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.entity.ActivityPrerequisite;
import com.kidsactivity.ingest.entity.ActivitySession;
import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.enums.ChangeType;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.ChangeSet;
import com.kidsactivity.ingest.model.PrerequisiteInfo;
import com.kidsactivity.ingest.model.SessionInfo;
import com.kidsactivity.ingest.model.UpsertOutcome;
import com.kidsactivity.ingest.repository.ActivityRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Idempotent write of one candidate, keyed on (providerId, externalId).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityPersistenceService {

    private static final String EMOJI_NEW = "🆕";
    private static final String EMOJI_UPDATE = "🔄";

    private final ActivityRepository activityRepository;
    private final ChangeDetector changeDetector;

    /**
     * CREATE stamps every timestamp; UPDATE rewrites the record and bumps {@code updatedAt};
     * UNCHANGED only advances {@code lastSeenAt}. Any sighting reactivates the record.
     */
    @Transactional
    public UpsertOutcome upsert(Provider provider, ActivityCandidate candidate, Instant now) {
        Activity existing = activityRepository
                .findByProviderIdAndExternalId(provider.getId(), candidate.getExternalId())
                .orElse(null);

        ActivityCandidate observed = existing != null && !candidate.isEnriched()
                ? carryDetailFields(existing, candidate)
                : candidate;

        ChangeSet changeSet = changeDetector.classify(existing, observed);

        if (changeSet.type() == ChangeType.CREATE) {
            Activity activity = Activity.builder()
                    .providerId(provider.getId())
                    .externalId(observed.getExternalId())
                    .createdAt(now)
                    .build();
            apply(activity, observed);
            activity.setUpdatedAt(now);
            activity.markSeen(now);
            Activity saved = activityRepository.save(activity);
            log.debug("{} Created activity {} '{}'", EMOJI_NEW, saved.getExternalId(), saved.getName());
            return new UpsertOutcome(ChangeType.CREATE, saved, List.of());
        }

        if (changeSet.type() == ChangeType.UPDATE) {
            apply(existing, observed);
            existing.setUpdatedAt(now);
            existing.markSeen(now);
            Activity saved = activityRepository.save(existing);
            log.debug("{} Updated activity {}: {}", EMOJI_UPDATE, saved.getExternalId(), changeSet.changes());
            return new UpsertOutcome(ChangeType.UPDATE, saved, changeSet.changes());
        }

        existing.markSeen(now);
        return new UpsertOutcome(ChangeType.UNCHANGED, activityRepository.save(existing), List.of());
    }

    private void apply(Activity activity, ActivityCandidate c) {
        activity.setName(c.getName());
        activity.setCategory(c.getCategory());
        activity.setSubcategory(c.getSubcategory());
        activity.setDescription(c.getDescription());
        activity.setSchedule(c.getSchedule());
        activity.setDaysOfWeek(new ArrayList<>(c.getDaysOfWeek()));
        activity.setDateStart(c.getDateStart());
        activity.setDateEnd(c.getDateEnd());
        activity.setStartTime(c.getStartTime());
        activity.setEndTime(c.getEndTime());
        activity.setRegistrationDate(c.getRegistrationDate());
        activity.setRegistrationEndDate(c.getRegistrationEndDate());
        activity.setRegistrationEndTime(c.getRegistrationEndTime());
        activity.setAgeMin(c.getAgeMin());
        activity.setAgeMax(c.getAgeMax());
        activity.setCost(c.getCost());
        activity.setCostIncludesTax(c.isCostIncludesTax());
        activity.setTaxAmount(c.getTaxAmount());
        activity.setSpotsAvailable(c.getSpotsAvailable());
        activity.setTotalSpots(c.getTotalSpots());
        activity.setRegistrationStatus(c.getRegistrationStatus());
        activity.setLocationId(c.getLocationId());
        activity.setLocationName(c.getLocationName());
        activity.setRegistrationUrl(c.getRegistrationUrl());
        activity.setInstructor(c.getInstructor());
        activity.setFullDescription(c.getFullDescription());
        activity.setWhatToBring(c.getWhatToBring());
        activity.setPrerequisitesText(c.getPrerequisitesText());
        activity.setCourseDetails(c.getCourseDetails());
        activity.setFullAddress(c.getFullAddress());
        activity.setLatitude(c.getLatitude());
        activity.setLongitude(c.getLongitude());
        activity.setRawSnapshot(new LinkedHashMap<>(c.getRawSnapshot()));

        if (c.isEnriched() && !c.getSessions().isEmpty()) {
            activity.replaceSessions(c.getSessions().stream().map(this::toSession).toList());
        }
        if (c.isEnriched() && !c.getPrerequisites().isEmpty()) {
            activity.replacePrerequisites(c.getPrerequisites().stream().map(this::toPrerequisite).toList());
        }
    }

    /**
     * A candidate whose detail page was not read this run keeps the stored detail values,
     * so a failed visit never looks like the provider blanked those fields.
     */
    private ActivityCandidate carryDetailFields(Activity existing, ActivityCandidate candidate) {
        ActivityCandidate.ActivityCandidateBuilder b = candidate.toBuilder()
                .instructor(existing.getInstructor())
                .fullDescription(existing.getFullDescription())
                .whatToBring(existing.getWhatToBring())
                .prerequisitesText(existing.getPrerequisitesText())
                .courseDetails(existing.getCourseDetails())
                .fullAddress(existing.getFullAddress())
                .latitude(existing.getLatitude())
                .longitude(existing.getLongitude())
                .registrationEndDate(existing.getRegistrationEndDate())
                .registrationEndTime(existing.getRegistrationEndTime())
                .taxAmount(existing.getTaxAmount());

        if (candidate.getDescription() == null) b.description(existing.getDescription());
        if (candidate.getTotalSpots() == null) b.totalSpots(existing.getTotalSpots());
        return b.build();
    }

    private ActivitySession toSession(SessionInfo info) {
        return ActivitySession.builder()
                .sessionNumber(info.getSessionNumber())
                .sessionDate(info.getDate())
                .dayOfWeek(info.getDayOfWeek())
                .startTime(info.getStartTime())
                .endTime(info.getEndTime())
                .location(info.getLocation())
                .instructor(info.getInstructor())
                .build();
    }

    private ActivityPrerequisite toPrerequisite(PrerequisiteInfo info) {
        return ActivityPrerequisite.builder()
                .name(info.getName())
                .url(info.getUrl())
                .courseId(info.getCourseId())
                .build();
    }
}
