package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.config.ScraperProperties;
import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.Scraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
@Slf4j
public class JsoupPageFetcher implements PageFetcher {

    private final ScraperProperties props;

    @Override
    public FetchMethod method() {
        return FetchMethod.LIGHTWEIGHT;
    }

    @Override
    public String fetch(Scraper scraper, String url) {
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .userAgent(props.getIdentity().getUserAgent())
                    .referrer(props.getIdentity().getReferrer())
                    .timeout(props.getLightweight().getTimeoutMs())
                    .maxBodySize(props.getLightweight().getMaxBodyBytes())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException("Lightweight fetch of " + url + " failed: " + e, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException("Lightweight fetch of " + url + " returned HTTP " + status);
        }

        String body = response.body();
        log.debug("JsoupPageFetcher: {} -> HTTP {} {} chars", url, status, body.length());
        return body;
    }
}
