package com.kidsactivity.ingest.enricher;

import com.kidsactivity.ingest.enums.RegistrationStatus;
import com.kidsactivity.ingest.manager.BrowserPool;
import com.kidsactivity.ingest.manager.PooledWorkExecutor;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.DetailInfo;
import com.kidsactivity.ingest.model.DetailPage;
import com.kidsactivity.ingest.model.EnrichmentResult;
import com.kidsactivity.ingest.model.WorkResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visits each candidate's detail page across the browser pool and merges what it finds.
 * A failed visit leaves the candidate exactly as it was and counts one error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DetailEnricher {

    private static final String EMOJI_ENRICH = "🔍";
    private static final String EMOJI_SUCCESS = "✅";

    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final PooledWorkExecutor workExecutor;
    private final DetailPageReader pageReader;
    private final DetailPageParser pageParser;

    public EnrichmentResult enrich(BrowserPool pool, List<ActivityCandidate> candidates) {
        List<ActivityCandidate> withLink = new ArrayList<>();
        for (ActivityCandidate candidate : candidates) {
            if (candidate.getRegistrationUrl() != null && !candidate.getRegistrationUrl().isBlank()) {
                withLink.add(candidate);
            }
        }
        log.info("{} Enriching {}/{} candidates with detail pages", EMOJI_ENRICH, withLink.size(), candidates.size());

        WorkResult<ActivityCandidate> work = workExecutor.execute(
                pool.liveSessions(),
                withLink,
                (page, candidate) -> {
                    DetailPage detail = pageReader.read(page, candidate.getRegistrationUrl());
                    return merge(candidate, pageParser.parse(detail), detail);
                },
                candidate -> candidate);

        Map<String, ActivityCandidate> enriched = new LinkedHashMap<>();
        for (ActivityCandidate c : work.results()) {
            enriched.put(c.getExternalId(), c);
        }

        List<ActivityCandidate> merged = new ArrayList<>(candidates.size());
        for (ActivityCandidate candidate : candidates) {
            merged.add(enriched.getOrDefault(candidate.getExternalId(), candidate));
        }

        log.info("{} Enrichment done: {} enriched, {} failed", EMOJI_SUCCESS,
                withLink.size() - work.failures(), work.failures());
        return new EnrichmentResult(merged, work.failures());
    }

    /**
     * Detail values win where present; everything else keeps the listing value.
     */
    ActivityCandidate merge(ActivityCandidate candidate, DetailInfo detail, DetailPage page) {
        ActivityCandidate.ActivityCandidateBuilder b = candidate.toBuilder().enriched(true);

        if (isBlank(candidate.getName()) && detail.getName() != null) b.name(detail.getName());
        if (detail.getInstructor() != null) b.instructor(detail.getInstructor());
        if (detail.getFullDescription() != null) {
            b.fullDescription(detail.getFullDescription());
            if (isBlank(candidate.getDescription())) {
                b.description(abbreviate(detail.getFullDescription().replaceAll("\\s+", " "), MAX_DESCRIPTION_LENGTH));
            }
        }
        if (detail.getWhatToBring() != null) b.whatToBring(detail.getWhatToBring());
        if (detail.getPrerequisitesText() != null) b.prerequisitesText(detail.getPrerequisitesText());
        if (detail.getCourseDetails() != null) b.courseDetails(detail.getCourseDetails());

        if (detail.getDateStart() != null) b.dateStart(detail.getDateStart());
        if (detail.getDateEnd() != null) b.dateEnd(detail.getDateEnd());
        if (detail.getStartTime() != null) b.startTime(detail.getStartTime());
        if (detail.getEndTime() != null) b.endTime(detail.getEndTime());
        if (detail.getRegistrationEndDate() != null) b.registrationEndDate(detail.getRegistrationEndDate());
        if (detail.getRegistrationEndTime() != null) b.registrationEndTime(detail.getRegistrationEndTime());

        if (detail.getCost() != null) b.cost(detail.getCost());
        if (detail.getCostIncludesTax() != null) b.costIncludesTax(detail.getCostIncludesTax());
        if (detail.getTaxAmount() != null) b.taxAmount(detail.getTaxAmount());
        if (detail.getSpotsAvailable() != null) b.spotsAvailable(detail.getSpotsAvailable());
        if (detail.getTotalSpots() != null) b.totalSpots(detail.getTotalSpots());

        if (detail.getLocationName() != null) b.locationName(detail.getLocationName());
        if (detail.getFullAddress() != null) b.fullAddress(detail.getFullAddress());
        if (detail.getCity() != null) b.city(detail.getCity());
        if (detail.getPostalCode() != null) b.postalCode(detail.getPostalCode());
        if (detail.getLatitude() != null) b.latitude(detail.getLatitude());
        if (detail.getLongitude() != null) b.longitude(detail.getLongitude());

        if (!detail.getSessions().isEmpty()) b.sessions(new ArrayList<>(detail.getSessions()));
        if (!detail.getPrerequisites().isEmpty()) b.prerequisites(new ArrayList<>(detail.getPrerequisites()));

        if (candidate.getRegistrationStatus() == RegistrationStatus.UNKNOWN
                && detail.getSpotsAvailable() != null && detail.getSpotsAvailable() > 0) {
            b.registrationStatus(RegistrationStatus.OPEN);
        }

        Map<String, Object> raw = new LinkedHashMap<>(candidate.getRawSnapshot());
        Map<String, Object> detailRaw = new LinkedHashMap<>();
        detailRaw.put("url", page.getUrl());
        detailRaw.put("title", page.getTitle());
        detailRaw.put("courseId", detail.getCourseId());
        raw.put("detail", detailRaw);
        b.rawSnapshot(raw);

        return b.build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
