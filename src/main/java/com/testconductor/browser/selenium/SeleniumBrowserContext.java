package com.testconductor.browser.selenium;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import org.openqa.selenium.NoSuchWindowException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.support.ui.FluentWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link BrowserContext} over one WebDriver session: every window handle is a page.
 *
 * WebDriver is single-threaded and has one current window, so every command runs
 * under a lock after switching to the page's window. Waits poll: the lock is
 * taken for each probe and released while sleeping, letting other task threads
 * drive their own pages in between.
 *
 * Windows opened through {@link #newPage()} and those present at construction
 * are owned; any other window (a wallet popup) is reported once by
 * {@link #waitForNewPage(Duration)}.
 */
public class SeleniumBrowserContext implements BrowserContext {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserContext.class);
    static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final WebDriver                           driver;
    private final ReentrantLock                       lock     = new ReentrantLock(true);
    private final Map<String, SeleniumBrowserPage>    pages    = new ConcurrentHashMap<>();
    private final Set<String>                         claimed  = ConcurrentHashMap.newKeySet();
    private volatile String                           currentHandle;

    public SeleniumBrowserContext(WebDriver driver) {
        this.driver = driver;
        lock.lock();
        try {
            claimed.addAll(driver.getWindowHandles());
            currentHandle = driver.getWindowHandle();
        } finally {
            lock.unlock();
        }
    }

    public WebDriver getDriver() { return driver; }

    // ── BrowserContext ────────────────────────────────────────────────────────

    @Override
    public BrowserPage newPage() {
        lock.lock();
        try {
            driver.switchTo().newWindow(WindowType.TAB);
            String handle = driver.getWindowHandle();
            claimed.add(handle);
            currentHandle = handle;
            log.debug("SeleniumBrowserContext: opened page {}", handle);
            return pageFor(handle);
        } catch (WebDriverException e) {
            throw new BrowserException("Could not open a new page: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<BrowserPage> pages() {
        List<BrowserPage> result = new ArrayList<>();
        for (String handle : windowHandles()) {
            result.add(pageFor(handle));
        }
        return result;
    }

    @Override
    public Optional<BrowserPage> waitForNewPage(Duration timeout) {
        try {
            String handle = new FluentWait<>(this)
                .withTimeout(timeout)
                .pollingEvery(POLL_INTERVAL)
                .until(ctx -> ctx.windowHandles().stream()
                    .filter(claimed::add)      // the claim itself: one caller per handle
                    .findFirst()
                    .orElse(null));
            log.debug("SeleniumBrowserContext: new page appeared {}", handle);
            return Optional.of(pageFor(handle));
        } catch (TimeoutException e) {
            return Optional.empty();
        }
    }

    // ── Page support ──────────────────────────────────────────────────────────

    /** Runs {@code command} with the driver switched to {@code handle}, under the lock. */
    <T> T onPage(String handle, Function<WebDriver, T> command) {
        lock.lock();
        try {
            if (!handle.equals(currentHandle)) {
                driver.switchTo().window(handle);
                currentHandle = handle;
            }
            return command.apply(driver);
        } catch (NoSuchWindowException e) {
            currentHandle = null;
            throw new BrowserException("Page " + handle + " is closed", e);
        } finally {
            lock.unlock();
        }
    }

    Set<String> windowHandles() {
        lock.lock();
        try {
            return driver.getWindowHandles();
        } catch (WebDriverException e) {
            throw new BrowserException("Could not list pages: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    void closeWindow(String handle) {
        lock.lock();
        try {
            if (!driver.getWindowHandles().contains(handle)) return;
            driver.switchTo().window(handle);
            driver.close();
            currentHandle = null;
        } catch (WebDriverException e) {
            throw new BrowserException("Could not close page " + handle + ": " + e.getMessage(), e);
        } finally {
            pages.remove(handle);
            lock.unlock();
        }
    }

    private SeleniumBrowserPage pageFor(String handle) {
        return pages.computeIfAbsent(handle, h -> new SeleniumBrowserPage(this, h));
    }
}
