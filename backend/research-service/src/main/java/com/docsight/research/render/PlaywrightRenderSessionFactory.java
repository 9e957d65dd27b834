package com.docsight.research.render;

import com.docsight.research.config.ResearchProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Headless Chromium sessions via Playwright. Each session owns its own driver
 * process and browser, both torn down in {@link RenderSession#close()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightRenderSessionFactory implements RenderSessionFactory {

    private final ResearchProperties properties;

    @Override
    public RenderSession open() {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(properties.getRender().isHeadless()));
            return new PlaywrightRenderSession(playwright, browser, properties.getFetch().getUserAgent());
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    static class PlaywrightRenderSession implements RenderSession {

        private final Playwright playwright;
        private final Browser browser;
        private final String userAgent;

        PlaywrightRenderSession(Playwright playwright, Browser browser, String userAgent) {
            this.playwright = playwright;
            this.browser = browser;
            this.userAgent = userAgent;
        }

        @Override
        public RenderedPage render(String url, Duration timeout) {
            BrowserContext context = browser.newContext(new Browser.NewContextOptions().setUserAgent(userAgent));
            try {
                Page page = context.newPage();
                page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.NETWORKIDLE)
                        .setTimeout(timeout.toMillis()));
                return new RenderedPage(url, page.content(), page.title());
            } finally {
                context.close();
            }
        }

        @Override
        public void close() {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                log.warn("Failed to close browser: {}", e.getMessage());
            } finally {
                try {
                    playwright.close();
                } catch (PlaywrightException e) {
                    log.warn("Failed to stop Playwright driver: {}", e.getMessage());
                }
            }
        }
    }
}
