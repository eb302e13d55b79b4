package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.exception.BrowserPoolException;
import com.kidsactivity.ingest.model.profile.UserAgentProfile;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class PlaywrightSessionFactory implements BrowserSessionFactory {

    private final BrowserManager browserManager;
    private final ProfileManager profileManager;
    private final ScraperConfig scraperConfig;

    @Override
    public BrowserSession create(int id, boolean headless) {
        UserAgentProfile profile = profileManager.profileFor(id);
        PlaywrightBrowserSession session = new PlaywrightBrowserSession(id, scraperConfig.getHealthCheckTimeoutMs());

        try {
            session.launch(new PlaywrightBrowserSession.Launcher() {
                @Override
                public Browser browser(Playwright playwright) {
                    return playwright.chromium().launch(browserManager.createLaunchOptions(headless));
                }

                @Override
                public BrowserContext context(Browser browser) {
                    BrowserContext context = browser.newContext(browserManager.createStealthContextOptions(profile));
                    context.setDefaultTimeout(scraperConfig.getSelectorTimeoutMs());
                    context.setDefaultNavigationTimeout(scraperConfig.getNavigationTimeoutMs());
                    return context;
                }

                @Override
                public PageHealthMonitor healthMonitor(Page page, Browser browser) {
                    return new PageHealthMonitor(page, browser,
                            scraperConfig.getHealthCheckTimeoutMs(), scraperConfig.getSelectorTimeoutMs());
                }
            }, scraperConfig.getNavigationTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while launching session " + id, e);
        } catch (Exception e) {
            throw new BrowserPoolException("Failed to launch session " + id, e);
        }

        log.debug("Session {} uses profile {}", id, profile.getId());
        return session;
    }
}
