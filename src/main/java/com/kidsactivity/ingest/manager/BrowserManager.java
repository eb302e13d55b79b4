package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.model.profile.UserAgentProfile;
import com.kidsactivity.ingest.model.profile.ViewPort;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserManager {

    private static final String DEFAULT_LOCALE = "en-CA";
    private static final String DEFAULT_TIMEZONE = "America/Vancouver";

    private final ScraperConfig scraperConfig;

    public BrowserType.LaunchOptions createLaunchOptions(boolean headless) {
        return new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(scraperConfig.getBROWSER_FLAGS());
    }

    public Browser.NewContextOptions createStealthContextOptions(UserAgentProfile profile) {
        log.debug("Creating stealth context options for profile {}", profile.getId());
        ViewPort viewPort = profile.getViewport();
        Map<String, String> headers = profile.getHeaders() == null ? Map.of() : profile.getHeaders();

        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setUserAgent(profile.getUserAgent())
                .setLocale(profile.getLocale() != null ? profile.getLocale() : DEFAULT_LOCALE)
                .setTimezoneId(profile.getTimeZone() != null ? profile.getTimeZone() : DEFAULT_TIMEZONE)
                .setExtraHTTPHeaders(headers)
                .setIgnoreHTTPSErrors(true)
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);

        if (viewPort != null) {
            options.setViewportSize(viewPort.getWidth(), viewPort.getHeight());
        }
        return options;
    }
}
