package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.repository.ActivityRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flips active records the latest completed run did not see to inactive.
 * Callers must only invoke this after a run that enumerated and enriched successfully.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Reconciler {

    private static final String EMOJI_ARCHIVE = "🗄️";
    private static final String EMOJI_WARNING = "⚠️";

    private final ActivityRepository activityRepository;

    @Transactional
    public int reconcile(Provider provider, Set<String> seenIds, Instant now) {
        if (seenIds.isEmpty()) {
            log.warn("{} Run for {} saw no activities; skipping reconciliation (likely a selector failure)",
                    EMOJI_WARNING, provider.getName());
            return 0;
        }

        List<Activity> stale = new ArrayList<>();
        for (Activity activity : activityRepository.findByProviderIdAndActiveTrue(provider.getId())) {
            if (!seenIds.contains(activity.getExternalId())) {
                activity.deactivate(now);
                stale.add(activity);
            }
        }
        activityRepository.saveAll(stale);

        log.info("{} Deactivated {} activities no longer offered by {}", EMOJI_ARCHIVE, stale.size(), provider.getName());
        return stale.size();
    }
}
