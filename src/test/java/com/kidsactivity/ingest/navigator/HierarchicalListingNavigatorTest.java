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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HierarchicalListingNavigatorTest {

    private static final String LISTING_URL = "https://nvrc.perfectmind.com/23734/Clients/BookMe4?widgetId=w";

    @TempDir
    Path screenshots;

    private ScraperConfig config;
    private Page page;
    private HierarchicalListingNavigator navigator;
    private Provider provider;

    @BeforeEach
    void setUp() {
        config = new ScraperConfig();
        config.setNavigationTimeoutMs(1000);
        config.setSelectorTimeoutMs(1000);
        config.setSettleMs(0);
        config.setAgeBands(List.of("0 - 6 years, On My Own", "5 - 13 years, School Age"));
        config.setCategoryCheckboxSelector("input.category");
        config.setSelectAllLocationsText("Select all locations available");
        config.setShowResultsText("Show Results");
        config.setResultsSelector(".bm-group-list");
        config.setCategorySelector(".bm-category");
        config.setCategoryTitleSelector(".bm-category-title-row");
        config.setSubcategorySelector(".bm-group");
        config.setSubcategoryTitleSelector(".bm-group-title-row");
        config.setItemSelector(".bm-group-item-row");
        config.setItemNameSelector(".bm-group-item-name");
        config.setItemIdSelector(".bm-group-item-course-id");
        config.setNextPageSelector(".bm-pager-next:not(.disabled)");
        config.setMaxPages(3);
        config.setScreenshotDir(screenshots.toString());

        page = mock(Page.class, RETURNS_DEEP_STUBS);
        navigator = new HierarchicalListingNavigator(config,
                Clock.fixed(Instant.parse("2025-03-01T03:00:00Z"), ZoneOffset.UTC));
        provider = Provider.builder().id(1L).name("NVRC").listingUrl(LISTING_URL).build();
    }

    private void listingLoads() {
        Response ok = mock(Response.class);
        when(ok.ok()).thenReturn(true);
        when(page.navigate(anyString(), any(Page.NavigateOptions.class))).thenReturn(ok);
        when(page.url()).thenReturn(LISTING_URL);
    }

    private void resultsShow() {
        when(page.getByText("Show Results").count()).thenReturn(1);
    }

    private Locator category(int c) {
        return page.locator(".bm-category").nth(c);
    }

    private Locator subcategory(int c, int s) {
        return category(c).locator(".bm-group").nth(s);
    }

    private Locator stubEntry(int c, String categoryTitle, String subcategoryTitle, String rowText) {
        Locator categoryTitleRow = category(c).locator(".bm-category-title-row").first();
        when(categoryTitleRow.count()).thenReturn(1);
        when(categoryTitleRow.innerText()).thenReturn(categoryTitle);
        when(category(c).locator(".bm-group").count()).thenReturn(1);

        Locator subTitleRow = subcategory(c, 0).locator(".bm-group-title-row").first();
        when(subTitleRow.count()).thenReturn(1);
        when(subTitleRow.innerText()).thenReturn(subcategoryTitle);
        when(subcategory(c, 0).locator(".bm-group-item-row").count()).thenReturn(1);

        Locator row = subcategory(c, 0).locator(".bm-group-item-row").nth(0);
        when(row.innerText()).thenReturn(rowText);
        when(row.locator(".bm-group-item-course-id").count()).thenReturn(1);
        when(row.locator(".bm-group-item-course-id").first().innerText()).thenReturn("#123456");
        when(row.locator("a[href]").count()).thenReturn(2);
        when(row.locator("a[href]").nth(0).getAttribute("href")).thenReturn("javascript:void(0)");
        when(row.locator("a[href]").nth(1).getAttribute("href")).thenReturn("/23734/Clients/BookMe4?courseId=123456");
        when(row.locator("a[href]").nth(1).innerText()).thenReturn(" Register ");
        return categoryTitleRow;
    }

    @Nested
    @DisplayName("Fatal load failures")
    class FatalLoadFailures {

        @Test
        void enumerate_navigationTimesOut_throwsAndSavesScreenshot() {
            when(page.navigate(anyString(), any(Page.NavigateOptions.class)))
                    .thenThrow(new PlaywrightException("Timeout 1000ms exceeded"));

            assertThatThrownBy(() -> navigator.enumerate(page, provider))
                    .isInstanceOf(NavigationException.class)
                    .hasMessageContaining("Failed to load listing page")
                    .hasCauseInstanceOf(PlaywrightException.class);
            verify(page).screenshot(any(Page.ScreenshotOptions.class));
        }

        @Test
        void enumerate_httpError_throws() {
            Response unavailable = mock(Response.class);
            when(unavailable.ok()).thenReturn(false);
            when(unavailable.status()).thenReturn(503);
            when(page.navigate(anyString(), any(Page.NavigateOptions.class))).thenReturn(unavailable);

            assertThatThrownBy(() -> navigator.enumerate(page, provider))
                    .isInstanceOf(NavigationException.class)
                    .hasMessageContaining("HTTP 503");
        }

        @Test
        void enumerate_showResultsMissing_throws() {
            listingLoads();

            assertThatThrownBy(() -> navigator.enumerate(page, provider))
                    .isInstanceOf(NavigationException.class)
                    .hasMessageContaining("Show Results");
        }

        @Test
        void enumerate_resultsNeverRender_throws() {
            listingLoads();
            resultsShow();
            when(page.waitForSelector(anyString(), any(Page.WaitForSelectorOptions.class)))
                    .thenThrow(new PlaywrightException("Timeout waiting for .bm-group-list"));

            assertThatThrownBy(() -> navigator.enumerate(page, provider))
                    .isInstanceOf(NavigationException.class)
                    .hasMessageContaining("Results never appeared");
        }

        @Test
        void enumerate_screenshotFailure_stillThrowsNavigationException() {
            when(page.navigate(anyString(), any(Page.NavigateOptions.class)))
                    .thenThrow(new PlaywrightException("net::ERR_NAME_NOT_RESOLVED"));
            when(page.screenshot(any(Page.ScreenshotOptions.class))).thenThrow(new PlaywrightException("Target closed"));

            assertThatThrownBy(() -> navigator.enumerate(page, provider)).isInstanceOf(NavigationException.class);
        }
    }

    @Nested
    @DisplayName("Tree walk")
    class TreeWalk {

        @Test
        void enumerate_harvestsEntryWithCleanTitlesAndAbsoluteLinks() {
            listingLoads();
            resultsShow();
            when(page.locator(".bm-category").count()).thenReturn(1);
            Locator categoryTitleRow = stubEntry(0, "Aquatics  (12)", "Swim Lessons (3)", "  Learn to Swim Level 2\nSat 10:00am - 10:45am  ");

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.isComplete()).isTrue();
            assertThat(result.listings()).singleElement().satisfies(l -> {
                assertThat(l.getCategory()).isEqualTo("Aquatics");
                assertThat(l.getSubcategory()).isEqualTo("Swim Lessons");
                assertThat(l.getText()).isEqualTo("Learn to Swim Level 2\nSat 10:00am - 10:45am");
                assertThat(l.getIdElementText()).isEqualTo("#123456");
                assertThat(l.getNameText()).isNull();
                assertThat(l.getLinks()).containsExactly(new ListingLink("Register",
                        "https://nvrc.perfectmind.com/23734/Clients/BookMe4?courseId=123456"));
            });
            // expand, then collapse
            verify(categoryTitleRow, times(2)).click();
            verify(page, never()).screenshot(any(Page.ScreenshotOptions.class));
        }

        @Test
        void enumerate_pageCapReached_stopsAndReportsGroupAsIncomplete() {
            listingLoads();
            resultsShow();
            when(page.locator(".bm-category").count()).thenReturn(1);
            stubEntry(0, "Camps", "Day Camps", "Art Camp #123456");
            Locator next = subcategory(0, 0).locator(".bm-pager-next:not(.disabled)");
            when(next.count()).thenReturn(1);

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.listings()).hasSize(3);
            assertThat(result.failedGroups()).isEqualTo(1);
            assertThat(result.isComplete()).isFalse();
            verify(next.first(), times(2)).click();
        }

        @Test
        void enumerate_failingCategory_othersHarvestedAndFailureReported() {
            listingLoads();
            resultsShow();
            when(page.locator(".bm-category").count()).thenReturn(2);
            Locator brokenTitle = category(0).locator(".bm-category-title-row").first();
            when(brokenTitle.count()).thenReturn(1);
            when(brokenTitle.innerText()).thenThrow(new PlaywrightException("Timeout 30000ms exceeded"));
            stubEntry(1, "Arts", "Pottery", "Wheel Throwing #123456");

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.listings()).extracting(RawListing::getCategory).containsExactly("Arts");
            assertThat(result.failedGroups()).isEqualTo(1);
            assertThat(result.isComplete()).isFalse();
        }

        @Test
        void enumerate_failingSubcategory_isCountedAsFailedGroup() {
            listingLoads();
            resultsShow();
            when(page.locator(".bm-category").count()).thenReturn(1);
            stubEntry(0, "Aquatics", "Swim Lessons", "Learn to Swim #123456");
            when(category(0).locator(".bm-group").count()).thenReturn(2);
            Locator brokenSubTitle = subcategory(0, 1).locator(".bm-group-title-row").first();
            when(brokenSubTitle.count()).thenReturn(1);
            when(brokenSubTitle.innerText()).thenThrow(new PlaywrightException("Element is not attached to the DOM"));

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.listings()).hasSize(1);
            assertThat(result.failedGroups()).isEqualTo(1);
            assertThat(result.failures()).isEqualTo(1);
        }

        @Test
        void enumerate_unreadableRow_isCountedAndSiblingsKept() {
            listingLoads();
            resultsShow();
            when(page.locator(".bm-category").count()).thenReturn(1);
            stubEntry(0, "Aquatics", "Swim Lessons", "Learn to Swim #123456");
            when(subcategory(0, 0).locator(".bm-group-item-row").count()).thenReturn(2);
            when(subcategory(0, 0).locator(".bm-group-item-row").nth(1).innerText())
                    .thenThrow(new PlaywrightException("Element is not attached to the DOM"));

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.listings()).hasSize(1);
            assertThat(result.unreadableEntries()).isEqualTo(1);
            assertThat(result.failedGroups()).isZero();
            assertThat(result.isComplete()).isFalse();
        }

        @Test
        void enumerate_noCategories_returnsEmpty() {
            listingLoads();
            resultsShow();

            EnumerationResult result = navigator.enumerate(page, provider);

            assertThat(result.listings()).isEmpty();
            assertThat(result.isComplete()).isTrue();
        }
    }

    @Test
    void cleanTitle_stripsTrailingCountOnly() {
        assertThat(HierarchicalListingNavigator.cleanTitle("  Learn to Swim\n Level 2 (14) ")).isEqualTo("Learn to Swim Level 2");
        assertThat(HierarchicalListingNavigator.cleanTitle("Level 2")).isEqualTo("Level 2");
        assertThat(HierarchicalListingNavigator.cleanTitle(null)).isEmpty();
    }

    @Test
    void absolutize_resolvesRelativeAgainstPage() {
        assertThat(HierarchicalListingNavigator.absolutize(LISTING_URL, "/23734/Clients/BookMe4?courseId=9"))
                .isEqualTo("https://nvrc.perfectmind.com/23734/Clients/BookMe4?courseId=9");
        assertThat(HierarchicalListingNavigator.absolutize(LISTING_URL, "https://other.org/x")).isEqualTo("https://other.org/x");
    }
}
