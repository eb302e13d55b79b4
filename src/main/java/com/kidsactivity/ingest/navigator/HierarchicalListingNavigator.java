package com.kidsactivity.ingest.navigator;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.exception.NavigationException;
import com.kidsactivity.ingest.model.EnumerationResult;
import com.kidsactivity.ingest.model.ListingLink;
import com.kidsactivity.ingest.model.RawListing;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Navigator for the grouped booking widget: facet form, then category → subcategory → entry rows.
 *
 * <p>The tree re-renders on every expand and collapse, so nothing here keeps an element handle.
 * Every access goes through a {@link Locator} chain rebuilt from the page at the moment of use.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HierarchicalListingNavigator implements ListingNavigator {

    private static final String EMOJI_NAV = "🧭";
    private static final String EMOJI_FOLDER = "📂";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_CAMERA = "📸";

    private final ScraperConfig scraperConfig;
    private final Clock clock;

    @Override
    public EnumerationResult enumerate(Page page, Provider provider) {
        String url = provider.getListingUrl();
        log.info("{} Enumerating listings for {} at {}", EMOJI_NAV, provider.getName(), url);

        open(page, url);
        selectFacets(page);
        showResults(page);

        Tally tally = new Tally();
        int categoryCount = page.locator(scraperConfig.getCategorySelector()).count();
        log.info("{} Found {} categories", EMOJI_NAV, categoryCount);

        for (int c = 0; c < categoryCount; c++) {
            try {
                walkCategory(page, c, tally);
            } catch (PlaywrightException e) {
                tally.failedGroups++;
                log.warn("{} Category #{} failed, continuing: {}", EMOJI_WARNING, c, e.getMessage());
            }
        }

        EnumerationResult result = new EnumerationResult(tally.listings, tally.failedGroups, tally.unreadable);
        if (result.isComplete()) {
            log.info("{} Enumerated {} entries across {} categories",
                    EMOJI_SUCCESS, result.listings().size(), categoryCount);
        } else {
            log.warn("{} Enumerated {} entries across {} categories, incomplete: {} groups failed, {} entries unreadable",
                    EMOJI_WARNING, result.listings().size(), categoryCount, result.failedGroups(), result.unreadableEntries());
        }
        return result;
    }

    // ==================== LOAD ====================

    private void open(Page page, String url) {
        try {
            Response response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(scraperConfig.getNavigationTimeoutMs())
                    .setWaitUntil(WaitUntilState.NETWORKIDLE));
            if (response != null && !response.ok()) {
                throw fatal(page, "Listing page returned HTTP " + response.status(), null);
            }
        } catch (PlaywrightException e) {
            throw fatal(page, "Failed to load listing page " + url, e);
        }
    }

    private void selectFacets(Page page) {
        for (String band : scraperConfig.getAgeBands()) {
            String label = band.trim();
            try {
                Locator box = page.getByLabel(label, new Page.GetByLabelOptions().setExact(true));
                if (box.count() == 0) {
                    log.warn("{} Age band '{}' not found", EMOJI_WARNING, label);
                    continue;
                }
                box.first().check();
            } catch (PlaywrightException e) {
                log.warn("{} Could not select age band '{}': {}", EMOJI_WARNING, label, e.getMessage());
            }
        }

        // Category checkboxes only render after an age band is picked
        try {
            Locator categories = page.locator(scraperConfig.getCategoryCheckboxSelector());
            categories.first().waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(scraperConfig.getSelectorTimeoutMs()));
            int count = categories.count();
            for (int i = 0; i < count; i++) {
                page.locator(scraperConfig.getCategoryCheckboxSelector()).nth(i).check();
            }
            log.info("{} Selected {} category checkboxes", EMOJI_NAV, count);
        } catch (PlaywrightException e) {
            log.warn("{} Category checkboxes unavailable: {}", EMOJI_WARNING, e.getMessage());
        }

        try {
            Locator allLocations = page.getByText(scraperConfig.getSelectAllLocationsText());
            if (allLocations.count() > 0) {
                allLocations.first().click();
            } else {
                log.warn("{} '{}' control not found", EMOJI_WARNING, scraperConfig.getSelectAllLocationsText());
            }
        } catch (PlaywrightException e) {
            log.warn("{} Could not select all locations: {}", EMOJI_WARNING, e.getMessage());
        }
    }

    private void showResults(Page page) {
        try {
            Locator show = page.getByText(scraperConfig.getShowResultsText());
            if (show.count() == 0) {
                throw fatal(page, "'" + scraperConfig.getShowResultsText() + "' control not found", null);
            }
            show.first().click();
            page.waitForSelector(scraperConfig.getResultsSelector(), new Page.WaitForSelectorOptions()
                    .setTimeout(scraperConfig.getNavigationTimeoutMs()));
        } catch (PlaywrightException e) {
            throw fatal(page, "Results never appeared", e);
        }
    }

    // ==================== TREE WALK ====================

    private void walkCategory(Page page, int c, Tally tally) {
        Locator titleRow = category(page, c).locator(scraperConfig.getCategoryTitleSelector()).first();
        if (titleRow.count() == 0) {
            log.warn("{} Category #{} has no title row, skipping", EMOJI_WARNING, c);
            return;
        }
        String categoryName = cleanTitle(titleRow.innerText());
        log.info("{} Category: {}", EMOJI_FOLDER, categoryName);

        titleRow.click();
        page.waitForTimeout(scraperConfig.getSettleMs());

        int subCount = category(page, c).locator(scraperConfig.getSubcategorySelector()).count();
        if (subCount == 0) {
            log.warn("{} Category '{}' expanded with no subcategories", EMOJI_WARNING, categoryName);
        }

        for (int s = 0; s < subCount; s++) {
            try {
                walkSubcategory(page, c, s, categoryName, tally);
            } catch (PlaywrightException e) {
                tally.failedGroups++;
                log.warn("{} Subcategory #{} of '{}' failed: {}", EMOJI_WARNING, s, categoryName, e.getMessage());
            }
        }

        // Collapse so the next category's indices are not shifted by this subtree
        Locator collapse = category(page, c).locator(scraperConfig.getCategoryTitleSelector()).first();
        if (collapse.count() > 0) {
            collapse.click();
        }
    }

    private void walkSubcategory(Page page, int c, int s, String categoryName, Tally tally) {
        Locator titleRow = subcategory(page, c, s).locator(scraperConfig.getSubcategoryTitleSelector()).first();
        if (titleRow.count() == 0) {
            log.debug("Subcategory #{} of '{}' has no title row", s, categoryName);
            return;
        }
        String subcategoryName = cleanTitle(titleRow.innerText());

        titleRow.click();
        page.waitForTimeout(scraperConfig.getSettleMs());

        int before = tally.listings.size();
        for (int pageNo = 1; pageNo <= scraperConfig.getMaxPages(); pageNo++) {
            Locator rows = subcategory(page, c, s).locator(scraperConfig.getItemSelector());
            int rowCount = rows.count();
            for (int r = 0; r < rowCount; r++) {
                harvest(page, subcategory(page, c, s).locator(scraperConfig.getItemSelector()).nth(r),
                        categoryName, subcategoryName, tally);
            }

            Locator next = subcategory(page, c, s).locator(scraperConfig.getNextPageSelector());
            if (next.count() == 0) {
                break;
            }
            if (pageNo == scraperConfig.getMaxPages()) {
                tally.failedGroups++;
                log.warn("{} '{} / {}' hit the page cap of {}, later pages not read", EMOJI_WARNING, categoryName, subcategoryName, pageNo);
                break;
            }
            next.first().click();
            page.waitForTimeout(scraperConfig.getSettleMs());
        }

        Locator collapse = subcategory(page, c, s).locator(scraperConfig.getSubcategoryTitleSelector()).first();
        if (collapse.count() > 0) {
            collapse.click();
        }
        log.debug("{} '{} / {}': {} entries", EMOJI_FOLDER, categoryName, subcategoryName,
                tally.listings.size() - before);
    }

    private void harvest(Page page, Locator row, String category, String subcategory, Tally tally) {
        try {
            String text = row.innerText();
            if (text == null || text.isBlank()) {
                return;
            }

            List<ListingLink> links = new ArrayList<>();
            Locator anchors = row.locator("a[href]");
            int linkCount = anchors.count();
            for (int i = 0; i < linkCount; i++) {
                Locator anchor = anchors.nth(i);
                String href = anchor.getAttribute("href");
                if (href == null || href.isBlank() || href.startsWith("javascript:")) {
                    continue;
                }
                links.add(new ListingLink(anchor.innerText().trim(), absolutize(page.url(), href)));
            }

            tally.listings.add(RawListing.builder()
                    .category(category)
                    .subcategory(subcategory)
                    .nameText(optionalText(row, scraperConfig.getItemNameSelector()))
                    .idElementText(optionalText(row, scraperConfig.getItemIdSelector()))
                    .text(text.trim())
                    .links(links)
                    .build());
        } catch (PlaywrightException e) {
            tally.unreadable++;
            log.warn("{} Entry in '{} / {}' unreadable: {}", EMOJI_WARNING, category, subcategory, e.getMessage());
        }
    }

    // ==================== HELPERS ====================

    private static final class Tally {
        private final List<RawListing> listings = new ArrayList<>();
        private int failedGroups;
        private int unreadable;
    }

    private Locator category(Page page, int c) {
        return page.locator(scraperConfig.getCategorySelector()).nth(c);
    }

    private Locator subcategory(Page page, int c, int s) {
        return category(page, c).locator(scraperConfig.getSubcategorySelector()).nth(s);
    }

    private String optionalText(Locator row, String selector) {
        Locator el = row.locator(selector);
        if (el.count() == 0) {
            return null;
        }
        String text = el.first().innerText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /** Drops the trailing entry count the widget appends to group titles. */
    static String cleanTitle(String raw) {
        if (raw == null) return "";
        return raw.replaceAll("\\s+", " ").trim().replaceAll("\\s*\\(\\d+\\)$", "").trim();
    }

    static String absolutize(String base, String href) {
        try {
            return URI.create(base).resolve(href.trim()).toString();
        } catch (IllegalArgumentException e) {
            return href.trim();
        }
    }

    private NavigationException fatal(Page page, String message, Throwable cause) {
        log.error("{} {}", EMOJI_ERROR, message);
        saveScreenshot(page);
        return cause == null ? new NavigationException(message) : new NavigationException(message, cause);
    }

    private void saveScreenshot(Page page) {
        try {
            Path dir = Paths.get(scraperConfig.getScreenshotDir());
            Files.createDirectories(dir);
            Path file = dir.resolve("navigation-failure-" + clock.millis() + ".png");
            page.screenshot(new Page.ScreenshotOptions().setPath(file).setFullPage(true));
            log.info("{} Saved failure screenshot to {}", EMOJI_CAMERA, file);
        } catch (Exception e) {
            log.warn("{} Could not save failure screenshot: {}", EMOJI_WARNING, e.getMessage());
        }
    }
}
