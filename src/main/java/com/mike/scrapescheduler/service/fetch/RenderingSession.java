package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.config.ScraperProperties;
import com.microsoft.playwright.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * One headless Chromium shared by all rendered fetches.
 * <p>
 * Playwright objects may only be used from the thread that created them, so the browser lives on
 * a dedicated thread and callers submit work to it. The browser is launched on first use and
 * relaunched if it has disconnected. Each call gets its own {@link BrowserContext}, closed when
 * the call ends.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenderingSession implements DisposableBean {

    private final ScraperProperties props;

    private final ExecutorService sessionThread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "rendering-session");
        t.setDaemon(true);
        return t;
    });

    // confined to sessionThread
    private Playwright playwright;
    private Browser browser;

    private volatile boolean closed;

    public <T> T withContext(Function<BrowserContext, T> work) {
        if (closed) {
            throw new FetchException("Rendering session is closed");
        }

        Future<T> future = sessionThread.submit(() -> {
            try (BrowserContext ctx = browser().newContext(contextOptions())) {
                return work.apply(ctx);
            }
        });

        long timeoutMs = props.getRendered().getCallTimeoutMs();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchException("Rendered fetch timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new FetchException("Rendered fetch failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetchException("Interrupted while waiting for rendered fetch", e);
        }
    }

    private Browser browser() {
        if (browser != null && browser.isConnected()) {
            return browser;
        }
        if (browser != null) {
            log.warn("RenderingSession: browser disconnected, relaunching");
        }
        closeQuietly();

        log.info("RenderingSession: launching headless={} chromium", props.getRendered().isHeadless());
        Playwright created = createDriver();
        try {
            browser = created.chromium().launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(props.getRendered().isHeadless())
                            .setArgs(props.getRendered().getLaunchArgs())
            );
        } catch (RuntimeException e) {
            try { created.close(); }
            catch (PlaywrightException closeError) { e.addSuppressed(closeError); }
            throw e;
        }
        playwright = created;
        return browser;
    }

    Playwright createDriver() {
        return Playwright.create();
    }

    private Browser.NewContextOptions contextOptions() {
        return new Browser.NewContextOptions()
                .setUserAgent(props.getIdentity().getUserAgent())
                .setExtraHTTPHeaders(Map.of("Referer", props.getIdentity().getReferrer()));
    }

    @Override
    public void destroy() {
        closed = true;
        try {
            sessionThread.submit(this::closeQuietly).get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("RenderingSession: close did not finish cleanly: {}", e.toString());
        } finally {
            sessionThread.shutdownNow();
        }
    }

    private void closeQuietly() {
        if (browser != null) {
            try { browser.close(); }
            catch (PlaywrightException e) { log.warn("RenderingSession: browser close failed: {}", e.getMessage()); }
            browser = null;
        }
        if (playwright != null) {
            try { playwright.close(); }
            catch (PlaywrightException e) { log.warn("RenderingSession: playwright close failed: {}", e.getMessage()); }
            playwright = null;
            log.info("RenderingSession: closed");
        }
    }
}
