package com.kidsactivity.ingest.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@Data
@Configuration
public class IngestConfig {

    // ==================== PROVIDER ====================

    @Value("${ingest.provider.name:NVRC}")
    private String providerName;

    @Value("${ingest.provider.base-url:https://www.nvrc.ca}")
    private String providerBaseUrl;

    @Value("${ingest.provider.listing-url:https://nvrc.perfectmind.com/23734/Clients/BookMe4?widgetId=a28b2c65-61af-407f-80d1-eaa58f30a94a}")
    private String providerListingUrl;

    // ==================== RUN ====================

    @Value("${ingest.concurrency:3}")
    private int concurrency;

    @Value("${ingest.headless:true}")
    private boolean headless;

    @Value("${ingest.run-on-startup:false}")
    private boolean runOnStartup;

    @Value("${ingest.schedule.enabled:false}")
    private boolean scheduleEnabled;

    // ==================== POLICY ====================

    /** Hint names shorter than this never take part in substring location matching. */
    @Value("${ingest.location.min-substring-length:6}")
    private int locationMinSubstringLength;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
