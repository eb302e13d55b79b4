package com.kidsactivity.ingest.enricher;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.exception.NavigationException;
import com.kidsactivity.ingest.model.DetailPage;
import com.kidsactivity.ingest.model.ListingLink;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class PlaywrightDetailPageReader implements DetailPageReader {

    private static final String LINKS_SCRIPT =
            "() => Array.from(document.querySelectorAll('a[href]'))" +
            ".map(a => ({ text: (a.textContent || '').trim(), href: a.href }))";

    private final ScraperConfig scraperConfig;

    @Override
    public DetailPage read(Page page, String url) {
        Response response = page.navigate(url, new Page.NavigateOptions()
                .setTimeout(scraperConfig.getDetailTimeoutMs())
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        if (response != null && !response.ok()) {
            throw new NavigationException("Detail page " + url + " returned HTTP " + response.status());
        }

        Locator title = page.locator(scraperConfig.getDetailTitleSelector());
        try {
            title.first().waitFor(new Locator.WaitForOptions().setTimeout(scraperConfig.getSelectorTimeoutMs()));
        } catch (PlaywrightException e) {
            log.debug("No title element on {} within timeout: {}", url, e.getMessage());
        }

        return DetailPage.builder()
                .url(url)
                .title(title.count() > 0 ? title.first().innerText().trim() : page.title())
                .bodyText(page.innerText("body"))
                .html(page.content())
                .links(readLinks(page))
                .venueLines(page.locator(scraperConfig.getDetailVenueSelector()).allInnerTexts())
                .build();
    }

    private List<ListingLink> readLinks(Page page) {
        List<ListingLink> links = new ArrayList<>();
        Object raw = page.evaluate(LINKS_SCRIPT);
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    Object href = map.get("href");
                    Object text = map.get("text");
                    if (href != null) {
                        links.add(new ListingLink(text == null ? "" : text.toString(), href.toString()));
                    }
                }
            }
        }
        return links;
    }
}
