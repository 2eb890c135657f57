package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.config.ScraperProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RenderingSessionTest {

    private ScraperProperties props;
    private final List<Playwright> drivers = new ArrayList<>();
    private RenderingSession session;

    @BeforeEach
    void setUp() {
        props = new ScraperProperties();
    }

    @AfterEach
    void tearDown() {
        if (session != null) session.destroy();
    }

    private RenderingSession sessionWith(Supplier<Playwright> driverFactory) {
        return new RenderingSession(props) {
            @Override
            Playwright createDriver() {
                Playwright driver = driverFactory.get();
                drivers.add(driver);
                return driver;
            }
        };
    }

    private static Playwright workingDriver(BrowserContext ctx) {
        Playwright driver = mock(Playwright.class);
        BrowserType chromium = mock(BrowserType.class);
        Browser browser = mock(Browser.class);
        when(driver.chromium()).thenReturn(chromium);
        when(chromium.launch(any(BrowserType.LaunchOptions.class))).thenReturn(browser);
        when(browser.isConnected()).thenReturn(true);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(ctx);
        return driver;
    }

    private static Playwright brokenDriver() {
        Playwright driver = mock(Playwright.class);
        BrowserType chromium = mock(BrowserType.class);
        when(driver.chromium()).thenReturn(chromium);
        when(chromium.launch(any(BrowserType.LaunchOptions.class)))
                .thenThrow(new PlaywrightException("Executable doesn't exist"));
        return driver;
    }

    @Test
    void failed_launch_closes_the_driver_every_time() {
        session = sessionWith(RenderingSessionTest::brokenDriver);

        assertThrows(PlaywrightException.class, () -> session.withContext(ctx -> "never"));
        assertThrows(PlaywrightException.class, () -> session.withContext(ctx -> "never"));

        assertEquals(2, drivers.size());
        verify(drivers.get(0)).close();
        verify(drivers.get(1)).close();
    }

    @Test
    void browser_is_reused_and_context_closed_after_each_call() {
        BrowserContext ctx = mock(BrowserContext.class);
        session = sessionWith(() -> workingDriver(ctx));

        assertEquals("a", session.withContext(c -> "a"));
        assertEquals("b", session.withContext(c -> "b"));

        assertEquals(1, drivers.size());
        verify(ctx, times(2)).close();
    }

    @Test
    void context_is_closed_when_the_work_throws() {
        BrowserContext ctx = mock(BrowserContext.class);
        session = sessionWith(() -> workingDriver(ctx));

        FetchException ex = assertThrows(FetchException.class, () -> session.withContext(c -> {
            throw new FetchException("HTTP 503");
        }));

        assertEquals("HTTP 503", ex.getMessage());
        verify(ctx).close();
    }

    @Test
    void slow_call_times_out() {
        props.getRendered().setCallTimeoutMs(50);
        BrowserContext ctx = mock(BrowserContext.class);
        session = sessionWith(() -> workingDriver(ctx));

        FetchException ex = assertThrows(FetchException.class, () -> session.withContext(c -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }));

        assertTrue(ex.getMessage().contains("timed out"));
    }

    @Test
    void destroy_closes_driver_and_rejects_further_calls() {
        BrowserContext ctx = mock(BrowserContext.class);
        session = sessionWith(() -> workingDriver(ctx));
        session.withContext(c -> "warm-up");

        session.destroy();

        verify(drivers.get(0)).close();
        assertThrows(FetchException.class, () -> session.withContext(c -> "after"));
        session = null;
    }
}
