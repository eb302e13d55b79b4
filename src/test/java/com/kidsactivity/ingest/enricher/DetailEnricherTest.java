package com.kidsactivity.ingest.enricher;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.enums.RegistrationStatus;
import com.kidsactivity.ingest.exception.NavigationException;
import com.kidsactivity.ingest.manager.BrowserPool;
import com.kidsactivity.ingest.manager.BrowserSession;
import com.kidsactivity.ingest.manager.FakeBrowserSession;
import com.kidsactivity.ingest.manager.PooledWorkExecutor;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.DetailInfo;
import com.kidsactivity.ingest.model.DetailPage;
import com.kidsactivity.ingest.model.EnrichmentResult;
import com.kidsactivity.ingest.model.SessionInfo;
import com.microsoft.playwright.Page;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetailEnricherTest {

    @Mock
    DetailPageReader pageReader;

    @Mock
    BrowserPool pool;

    private DetailEnricher enricher;

    @BeforeEach
    void setUp() {
        ScraperConfig config = new ScraperConfig();
        ReflectionTestUtils.setField(config, "detailTimeoutMs", 5000);
        enricher = new DetailEnricher(new PooledWorkExecutor(config), pageReader, new DetailPageParser());
    }

    private static ActivityCandidate candidate(String id) {
        return ActivityCandidate.builder()
                .externalId(id)
                .name("Activity " + id)
                .registrationUrl("https://example.org/BookMe4?courseId=" + id)
                .spotsAvailable(2)
                .rawSnapshot(new LinkedHashMap<>(Map.of("text", "raw " + id)))
                .build();
    }

    private static DetailPage page(String url) {
        return DetailPage.builder()
                .url(url)
                .title("Title")
                .bodyText("Instructor: Sam Lee\n4 spots left")
                .build();
    }

    @Test
    void enrich_oneOfFiveFails_othersEnrichedAndOneErrorCounted() {
        List<BrowserSession> sessions = List.of(new FakeBrowserSession(0), new FakeBrowserSession(1));
        when(pool.liveSessions()).thenReturn(sessions);
        when(pageReader.read(any(Page.class), anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(1);
            if (url.endsWith("=3")) {
                throw new NavigationException("timeout loading " + url);
            }
            return page(url);
        });
        List<ActivityCandidate> input = IntStream.rangeClosed(1, 5).mapToObj(i -> candidate(String.valueOf(i))).toList();

        EnrichmentResult result = enricher.enrich(pool, input);

        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.candidates()).extracting(ActivityCandidate::getExternalId).containsExactly("1", "2", "3", "4", "5");
        assertThat(result.candidates()).filteredOn(ActivityCandidate::isEnriched)
                .hasSize(4)
                .allSatisfy(c -> {
                    assertThat(c.getInstructor()).isEqualTo("Sam Lee");
                    assertThat(c.getSpotsAvailable()).isEqualTo(4);
                });
        ActivityCandidate failed = result.candidates().get(2);
        assertThat(failed).isSameAs(input.get(2));
        assertThat(failed.getSpotsAvailable()).isEqualTo(2);
    }

    @Test
    void enrich_candidatesWithoutLink_areNotVisited() {
        when(pool.liveSessions()).thenReturn(List.of(new FakeBrowserSession(0)));
        ActivityCandidate noLink = candidate("9").toBuilder().registrationUrl(null).build();

        EnrichmentResult result = enricher.enrich(pool, List.of(noLink));

        assertThat(result.candidates()).containsExactly(noLink);
        assertThat(result.errors()).isZero();
        verify(pageReader, never()).read(any(), anyString());
    }

    @Test
    void merge_detailValuesWinAndListingValuesSurvive() {
        ActivityCandidate listing = candidate("42").toBuilder()
                .category("Arts")
                .cost(new BigDecimal("50.00"))
                .locationName("Lynn Valley")
                .registrationStatus(RegistrationStatus.UNKNOWN)
                .build();
        DetailInfo detail = DetailInfo.builder()
                .instructor("Ana")
                .fullDescription("Clay   and\nglaze basics")
                .cost(new BigDecimal("55.00"))
                .costIncludesTax(false)
                .spotsAvailable(6)
                .fullAddress("3590 Mountain Hwy, North Vancouver")
                .latitude(49.33)
                .longitude(-123.04)
                .sessions(List.of(SessionInfo.builder().sessionNumber(1).date("2025-04-05").build()))
                .courseId("42")
                .build();
        DetailPage page = DetailPage.builder().url("https://example.org/BookMe4?courseId=42").title("Pottery").build();

        ActivityCandidate merged = enricher.merge(listing, detail, page);

        assertThat(merged.isEnriched()).isTrue();
        assertThat(merged.getCategory()).isEqualTo("Arts");
        assertThat(merged.getLocationName()).isEqualTo("Lynn Valley");
        assertThat(merged.getInstructor()).isEqualTo("Ana");
        assertThat(merged.getDescription()).isEqualTo("Clay and glaze basics");
        assertThat(merged.getCost()).isEqualByComparingTo("55.00");
        assertThat(merged.isCostIncludesTax()).isFalse();
        assertThat(merged.getSpotsAvailable()).isEqualTo(6);
        assertThat(merged.getRegistrationStatus()).isEqualTo(RegistrationStatus.OPEN);
        assertThat(merged.getSessions()).hasSize(1);
        assertThat(merged.getRawSnapshot()).containsKeys("text", "detail");
        assertThat(listing.isEnriched()).isFalse();
        assertThat(listing.getRawSnapshot()).doesNotContainKey("detail");
    }
}
