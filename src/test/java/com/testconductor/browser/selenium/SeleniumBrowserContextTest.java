package com.testconductor.browser.selenium;

import com.testconductor.browser.BrowserPage;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Window ownership in the Selenium context, driven by a WebDriver that only
 * knows about window handles.
 */
public class SeleniumBrowserContextTest {

    private static final Duration WAIT = Duration.ofMillis(300);

    private HandlesOnlyDriver      driver;
    private SeleniumBrowserContext context;

    @BeforeMethod
    public void setUp() {
        driver  = new HandlesOnlyDriver("main");
        context = new SeleniumBrowserContext(driver);
    }

    // ════════════════════════════════════════════════════════════════════════
    // waitForNewPage
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void windowsPresentAtStart_areNeverReportedAsNew() {
        assertThat(context.waitForNewPage(WAIT)).isEmpty();
    }

    @Test
    public void newWindow_isReportedOnce() {
        driver.open("popup");

        Optional<BrowserPage> first  = context.waitForNewPage(WAIT);
        Optional<BrowserPage> second = context.waitForNewPage(WAIT);

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
    }

    @Test
    public void concurrentWaiters_onlyOneClaimsTheWindow() throws Exception {
        driver.open("popup");
        int waiters = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(waiters);
        try {
            List<Future<Optional<BrowserPage>>> futures = new ArrayList<>();
            for (int i = 0; i < waiters; i++) {
                Callable<Optional<BrowserPage>> wait = () -> {
                    start.await();
                    return context.waitForNewPage(WAIT);
                };
                futures.add(pool.submit(wait));
            }
            start.countDown();

            int claimed = 0;
            for (Future<Optional<BrowserPage>> f : futures) {
                if (f.get(5, TimeUnit.SECONDS).isPresent()) claimed++;
            }
            assertThat(claimed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test double
    // ════════════════════════════════════════════════════════════════════════

    /** Answers window-handle queries; every other command is unsupported. */
    private static final class HandlesOnlyDriver implements WebDriver {

        private final Set<String> handles = new CopyOnWriteArraySet<>();
        private final String      current;

        HandlesOnlyDriver(String initial) {
            handles.add(initial);
            current = initial;
        }

        void open(String handle) { handles.add(handle); }

        @Override public Set<String> getWindowHandles()          { return new LinkedHashSet<>(handles); }
        @Override public String getWindowHandle()                { return current; }

        @Override public void get(String url)                    { throw unsupported(); }
        @Override public String getCurrentUrl()                  { throw unsupported(); }
        @Override public String getTitle()                       { throw unsupported(); }
        @Override public List<WebElement> findElements(By by)    { throw unsupported(); }
        @Override public WebElement findElement(By by)           { throw unsupported(); }
        @Override public String getPageSource()                  { throw unsupported(); }
        @Override public void close()                            { throw unsupported(); }
        @Override public void quit()                             { throw unsupported(); }
        @Override public TargetLocator switchTo()                { throw unsupported(); }
        @Override public Navigation navigate()                   { throw unsupported(); }
        @Override public Options manage()                        { throw unsupported(); }

        private static UnsupportedOperationException unsupported() {
            return new UnsupportedOperationException("Not needed for window ownership");
        }
    }
}
