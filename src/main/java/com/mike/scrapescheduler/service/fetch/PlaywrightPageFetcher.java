package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.config.ScraperProperties;
import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.Scraper;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightPageFetcher implements PageFetcher {

    private final RenderingSession session;
    private final ScraperProperties props;

    @Override
    public FetchMethod method() {
        return FetchMethod.RENDERED;
    }

    @Override
    public String fetch(Scraper scraper, String url) {
        int navigationTimeoutMs = props.getRendered().getNavigationTimeoutMs();

        return session.withContext(ctx -> {
            Page page = ctx.newPage();
            try {
                page.setDefaultTimeout(navigationTimeoutMs);
                page.setDefaultNavigationTimeout(navigationTimeoutMs);

                Response response = page.navigate(url,
                        new Page.NavigateOptions()
                                .setWaitUntil(WaitUntilState.NETWORKIDLE)
                                .setTimeout(navigationTimeoutMs));

                if (response != null && response.status() >= 400) {
                    throw new FetchException("Rendered fetch of " + url + " returned HTTP " + response.status());
                }

                // let late scripts settle
                if (scraper.getDelaySeconds() > 0) {
                    page.waitForTimeout(scraper.getDelaySeconds() * 1000.0);
                }

                String html = page.content();
                log.debug("PlaywrightPageFetcher: {} -> {} chars (finalUrl={})",
                        url, html == null ? 0 : html.length(), page.url());
                return html;
            } finally {
                try { page.close(); }
                catch (PlaywrightException e) { log.warn("PlaywrightPageFetcher: page close failed for {}: {}", url, e.getMessage()); }
            }
        });
    }
}
