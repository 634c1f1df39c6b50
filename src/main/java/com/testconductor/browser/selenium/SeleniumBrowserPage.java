package com.testconductor.browser.selenium;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import com.testconductor.model.WaitPolicy;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chromium.ChromiumDriver;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * One window of a {@link SeleniumBrowserContext}.
 *
 * Element actions wait for their target the way the task asked for (visible,
 * clickable) and then act inside the same locked probe, so another task cannot
 * switch windows between the check and the action.
 */
class SeleniumBrowserPage implements BrowserPage {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserPage.class);
    private static final Duration CLOSE_POLL = Duration.ofMillis(100);

    private final SeleniumBrowserContext context;
    private final String                 handle;
    private volatile boolean             closed;

    SeleniumBrowserPage(SeleniumBrowserContext context, String handle) {
        this.context = context;
        this.handle  = handle;
    }

    String handle() { return handle; }

    @Override
    public BrowserContext context() { return context; }

    @Override
    public String url() {
        return command("read URL", WebDriver::getCurrentUrl);
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    @Override
    public void navigate(String url, WaitPolicy waitPolicy, Duration timeout) {
        command("navigate to " + url, d -> { d.get(url); return true; });
        switch (waitPolicy) {
            case COMMIT, DOM_CONTENT_LOADED -> { }
            case LOAD -> await(timeout, "load of " + url, d -> "complete".equals(readyState(d)));
            case NETWORK_IDLE -> awaitNetworkIdle(url, timeout);
        }
    }

    // ── Element actions ───────────────────────────────────────────────────────

    @Override
    public void click(String selector, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, "click " + selector, d -> {
            WebElement el = ExpectedConditions.elementToBeClickable(by).apply(d);
            if (el == null) return null;
            el.click();
            return true;
        });
    }

    @Override
    public void fill(String selector, String value, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, "fill " + selector, d -> {
            WebElement el = ExpectedConditions.visibilityOfElementLocated(by).apply(d);
            if (el == null || !el.isEnabled()) return null;
            el.clear();
            el.sendKeys(value);
            return true;
        });
    }

    @Override
    public void selectOption(String selector, String value, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, "select in " + selector, d -> {
            WebElement el = ExpectedConditions.visibilityOfElementLocated(by).apply(d);
            if (el == null) return null;
            Select select = new Select(el);
            try {
                select.selectByValue(value);
            } catch (NoSuchElementException byValue) {
                select.selectByVisibleText(value);
            }
            return true;
        });
    }

    @Override
    public void check(String selector, Duration timeout) {
        setChecked(selector, true, timeout);
    }

    @Override
    public void uncheck(String selector, Duration timeout) {
        setChecked(selector, false, timeout);
    }

    @Override
    public void hover(String selector, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, "hover " + selector, d -> {
            WebElement el = ExpectedConditions.visibilityOfElementLocated(by).apply(d);
            if (el == null) return null;
            new Actions(d).moveToElement(el).perform();
            return true;
        });
    }

    @Override
    public void type(String selector, String text, long delayMs) {
        By by = Locators.toBy(selector);
        for (int i = 0; i < text.length(); i++) {
            String ch = String.valueOf(text.charAt(i));
            command("type into " + selector, d -> { d.findElement(by).sendKeys(ch); return true; });
            if (delayMs > 0 && i < text.length() - 1) waitForTimeout(delayMs);
        }
    }

    @Override
    public void press(String selector, String key) {
        By by = Locators.toBy(selector);
        CharSequence keys = Locators.toKeys(key);
        command("press " + key, d -> { d.findElement(by).sendKeys(keys); return true; });
    }

    // ── Waits ─────────────────────────────────────────────────────────────────

    @Override
    public void waitForTimeout(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserException("Interrupted while waiting " + ms + "ms", e);
        }
    }

    @Override
    public void waitForSelector(String selector, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, "visible " + selector, d -> ExpectedConditions.visibilityOfElementLocated(by).apply(d));
    }

    @Override
    public boolean waitForClose(Duration timeout) {
        try {
            new FluentWait<>(context)
                .withTimeout(timeout)
                .pollingEvery(CLOSE_POLL)
                .until(ctx -> !ctx.windowHandles().contains(handle));
            closed = true;
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    // ── Page content ──────────────────────────────────────────────────────────

    @Override
    public Object evaluate(String script) {
        String returning = asReturningScript(script);
        Object raw = command("evaluate script", d -> ((JavascriptExecutor) d).executeScript(returning));
        return toPlain(raw);
    }

    @Override
    public byte[] screenshot(boolean fullPage) {
        return command("screenshot", d -> {
            if (fullPage && d instanceof ChromiumDriver chromium) {
                return fullPageScreenshot(chromium);
            }
            return ((TakesScreenshot) d).getScreenshotAs(OutputType.BYTES);
        });
    }

    @Override
    public String innerText() {
        return command("read text", d -> String.valueOf(((JavascriptExecutor) d)
            .executeScript("return document.body ? document.body.innerText : '';")));
    }

    @Override
    public String innerHtml() {
        return command("read markup", d -> String.valueOf(((JavascriptExecutor) d)
            .executeScript("return document.body ? document.body.innerHTML : '';")));
    }

    @Override
    public boolean isActionable(String selector) {
        By by = Locators.toBy(selector);
        return command("probe " + selector, d -> {
            for (WebElement el : d.findElements(by)) {
                if (isUsable(el)) return true;
            }
            return false;
        });
    }

    /** False for elements detached between lookup and probe. */
    private static boolean isUsable(WebElement el) {
        try {
            return el.isDisplayed() && el.isEnabled();
        } catch (StaleElementReferenceException e) {
            return false;
        }
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public boolean isClosed() {
        if (!closed && !context.windowHandles().contains(handle)) closed = true;
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        context.closeWindow(handle);
        closed = true;
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private <T> T command(String description, Function<WebDriver, T> command) {
        try {
            return context.onPage(handle, command);
        } catch (WebDriverException e) {
            throw new BrowserException("Could not " + description + ": " + e.getMessage(), e);
        }
    }

    private <T> T await(Duration timeout, String description, Function<WebDriver, T> probe) {
        try {
            return new FluentWait<>(handle)
                .withTimeout(timeout)
                .pollingEvery(SeleniumBrowserContext.POLL_INTERVAL)
                .ignoring(NoSuchElementException.class)
                .ignoring(StaleElementReferenceException.class)
                .ignoring(ElementClickInterceptedException.class)
                .ignoring(ElementNotInteractableException.class)
                .until(h -> context.onPage(h, probe));
        } catch (TimeoutException e) {
            throw new BrowserException("Timed out after " + timeout.toMillis() + "ms waiting to " + description, e);
        } catch (WebDriverException e) {
            throw new BrowserException("Could not " + description + ": " + e.getMessage(), e);
        }
    }

    private void setChecked(String selector, boolean checked, Duration timeout) {
        By by = Locators.toBy(selector);
        await(timeout, (checked ? "check " : "uncheck ") + selector, d -> {
            WebElement el = ExpectedConditions.elementToBeClickable(by).apply(d);
            if (el == null) return null;
            if (el.isSelected() != checked) el.click();
            return true;
        });
    }

    private void awaitNetworkIdle(String url, Duration timeout) {
        await(timeout, "load of " + url, d -> "complete".equals(readyState(d)));
        long[] last = {-1};
        await(timeout, "network idle on " + url, d -> {
            long count = ((Number) ((JavascriptExecutor) d)
                .executeScript("return performance.getEntriesByType('resource').length;")).longValue();
            boolean idle = count == last[0];
            last[0] = count;
            return idle ? Boolean.TRUE : null;
        });
    }

    private static String readyState(WebDriver d) {
        return String.valueOf(((JavascriptExecutor) d).executeScript("return document.readyState;"));
    }

    private static byte[] fullPageScreenshot(ChromiumDriver driver) {
        Map<String, Object> clip = contentClip(driver.executeCdpCommand("Page.getLayoutMetrics", Map.of()));
        if (clip == null) {
            log.warn("SeleniumBrowserPage: no content size in layout metrics, capturing the viewport");
            return driver.getScreenshotAs(OutputType.BYTES);
        }
        Map<String, Object> shot = driver.executeCdpCommand("Page.captureScreenshot",
            Map.of("format", "png", "captureBeyondViewport", true, "clip", clip));
        return Base64.getDecoder().decode((String) shot.get("data"));
    }

    /** Clip covering the whole document, or null when the metrics carry no content size. */
    static Map<String, Object> contentClip(Map<String, Object> metrics) {
        if (metrics == null
                || !(metrics.get("cssContentSize") instanceof Map<?, ?> size)
                || !(size.get("width") instanceof Number width)
                || !(size.get("height") instanceof Number height)) {
            return null;
        }
        Map<String, Object> clip = new LinkedHashMap<>();
        clip.put("x", 0);
        clip.put("y", 0);
        clip.put("width", width.doubleValue());
        clip.put("height", height.doubleValue());
        clip.put("scale", 1);
        return clip;
    }

    /**
     * Turns an expression ({@code document.title}) or a function
     * ({@code () => 42}) into a script whose value WebDriver returns. Scripts that
     * already {@code return}, or that hold several statements, run unchanged.
     */
    static String asReturningScript(String script) {
        String s = script.trim();
        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        if (s.startsWith("return ") || s.contains(";") || s.contains("\n")) return script;
        if (s.startsWith("function") || s.startsWith("async ") || s.matches("^\\(?[\\w\\s,]*\\)?\\s*=>[\\s\\S]*")) {
            return "return (" + s + ")();";
        }
        return "return (" + s + ");";
    }

    /** Converts script results into values Jackson can write into a report. */
    static Object toPlain(Object value) {
        if (value instanceof WebElement el) {
            return "<" + el.getTagName() + ">";
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            map.forEach((k, v) -> plain.put(String.valueOf(k), toPlain(v)));
            return plain;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(SeleniumBrowserPage::toPlain).toList();
        }
        return value;
    }
}
