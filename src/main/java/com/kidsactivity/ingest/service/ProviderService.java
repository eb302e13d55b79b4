package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.repository.ProviderRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderService {

    private static final String EMOJI_NEW = "🆕";

    private final ProviderRepository providerRepository;

    /**
     * Looks the provider up by name, creating it on first use. Stored URLs follow configuration.
     */
    @Transactional
    public Provider findOrCreate(String name, String baseUrl, String listingUrl, Instant now) {
        return providerRepository.findByName(name)
                .map(existing -> {
                    if (!Objects.equals(existing.getBaseUrl(), baseUrl) || !Objects.equals(existing.getListingUrl(), listingUrl)) {
                        existing.setBaseUrl(baseUrl);
                        existing.setListingUrl(listingUrl);
                        existing.setUpdatedAt(now);
                        return providerRepository.save(existing);
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    log.info("{} Registering provider '{}'", EMOJI_NEW, name);
                    return providerRepository.save(Provider.builder()
                            .name(name)
                            .baseUrl(baseUrl)
                            .listingUrl(listingUrl)
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                });
    }
}
