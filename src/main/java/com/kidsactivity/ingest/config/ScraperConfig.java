package com.kidsactivity.ingest.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
@Data
@Configuration
public class ScraperConfig {
    private final List<String> BROWSER_FLAGS = Arrays.asList(
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    // ==================== TIMEOUTS ====================

    @Value("${scraper.navigation.timeout-ms:60000}")
    private int navigationTimeoutMs;

    @Value("${scraper.selector.timeout-ms:30000}")
    private int selectorTimeoutMs;

    @Value("${scraper.detail.timeout-ms:30000}")
    private int detailTimeoutMs;

    /** Settle time after an expand/collapse click before the subtree is read. */
    @Value("${scraper.navigator.settle-ms:1500}")
    private int settleMs;

    @Value("${scraper.health.check.timeout-ms:5000}")
    private int healthCheckTimeoutMs;

    // ==================== FACETS ====================

    @Value("#{'${scraper.navigator.age-bands:0 - 6 years, Parent Participation;0 - 6 years, On My Own;5 - 13 years, School Age;10 - 18 years, Youth}'.split(';')}")
    private List<String> ageBands;

    @Value("${scraper.selector.category-checkbox:form input[type='checkbox'][name*='activity']}")
    private String categoryCheckboxSelector;

    @Value("${scraper.navigator.select-all-locations-text:Select all locations available}")
    private String selectAllLocationsText;

    @Value("${scraper.navigator.show-results-text:Show Results}")
    private String showResultsText;

    // ==================== LISTING TREE ====================

    @Value("${scraper.selector.results:.bm-group-list}")
    private String resultsSelector;

    @Value("${scraper.selector.category:.bm-category}")
    private String categorySelector;

    @Value("${scraper.selector.category-title:.bm-category-title-row}")
    private String categoryTitleSelector;

    @Value("${scraper.selector.subcategory:.bm-group}")
    private String subcategorySelector;

    @Value("${scraper.selector.subcategory-title:.bm-group-title-row}")
    private String subcategoryTitleSelector;

    @Value("${scraper.selector.item:.bm-group-item-row}")
    private String itemSelector;

    @Value("${scraper.selector.item-name:.bm-group-item-name}")
    private String itemNameSelector;

    @Value("${scraper.selector.item-id:.bm-group-item-course-id}")
    private String itemIdSelector;

    @Value("${scraper.selector.next-page:.bm-pager-next:not(.disabled)}")
    private String nextPageSelector;

    @Value("${scraper.navigator.max-pages:20}")
    private int maxPages;

    // ==================== DETAIL PAGE ====================

    @Value("${scraper.selector.detail-title:.bm-course-primary-event-name, .bm-event-name-h1, h1}")
    private String detailTitleSelector;

    @Value("${scraper.selector.detail-venue:.bm-location-map .bm-map-address}")
    private String detailVenueSelector;

    // ==================== DIAGNOSTICS ====================

    @Value("${scraper.screenshot.dir:screenshots}")
    private String screenshotDir;
}
