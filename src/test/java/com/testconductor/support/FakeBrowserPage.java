package com.testconductor.support;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import com.testconductor.model.WaitPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A page of a {@link FakeBrowserContext}: either a task page, whose actions are
 * recorded as {@code "<taskId>:<action> <target>"} events, or a scripted popup
 * with fixed text and a set of actionable controls.
 */
public class FakeBrowserPage implements BrowserPage {

    private final FakeBrowserContext context;
    private final String             owner;       // task id for task pages, null for popups
    private final boolean            taskPage;
    private final String             text;
    private final String             html;
    private final Set<String>        actionable;
    private final boolean            closeOnClick;
    private final boolean            unreadable;

    private final List<String> clicked = Collections.synchronizedList(new ArrayList<>());
    private volatile String    url;
    private volatile boolean   closed;

    private FakeBrowserPage(FakeBrowserContext context, String owner, boolean taskPage, String url,
                            String text, String html, Set<String> actionable,
                            boolean closeOnClick, boolean unreadable) {
        this.context      = context;
        this.owner        = owner;
        this.taskPage     = taskPage;
        this.url          = url;
        this.text         = text;
        this.html         = html;
        this.actionable   = actionable;
        this.closeOnClick = closeOnClick;
        this.unreadable   = unreadable;
    }

    static FakeBrowserPage taskPage(FakeBrowserContext context, String taskId) {
        return new FakeBrowserPage(context, taskId, true, "about:blank", "", "", Set.of(), false, false);
    }

    /** A wallet popup showing {@code text} whose {@code controls} can be clicked; clicking closes it. */
    public static FakeBrowserPage popup(FakeBrowserContext context, String text, String... controls) {
        return new FakeBrowserPage(context, null, false,
            "chrome-extension://wallet/notification.html", text, "<div>" + text + "</div>",
            Set.of(controls), true, false);
    }

    /** A popup that stays open after a control is clicked. */
    public static FakeBrowserPage stickyPopup(FakeBrowserContext context, String text, String... controls) {
        return new FakeBrowserPage(context, null, false,
            "chrome-extension://wallet/notification.html", text, "<div>" + text + "</div>",
            Set.of(controls), false, false);
    }

    /** A popup whose content cannot be read. */
    public static FakeBrowserPage unreadablePopup(FakeBrowserContext context, String... controls) {
        return new FakeBrowserPage(context, null, false,
            "chrome-extension://wallet/notification.html", "", "", Set.of(controls), true, true);
    }

    /** Controls clicked on this page, in order. */
    public List<String> clicked() {
        synchronized (clicked) { return List.copyOf(clicked); }
    }

    // ── BrowserPage ───────────────────────────────────────────────────────────

    @Override public BrowserContext context() { return context; }
    @Override public String url()             { return url; }

    @Override
    public void navigate(String url, WaitPolicy waitPolicy, Duration timeout) {
        act("navigate", url);
        this.url = url;
    }

    @Override
    public void click(String selector, Duration timeout) {
        if (!taskPage) {
            if (!actionable.contains(selector)) throw new BrowserException("No control " + selector);
            clicked.add(selector);
            if (closeOnClick) closed = true;
            return;
        }
        act("click", selector);
        Consumer<FakeBrowserPage> action = context.clickAction(selector);
        if (action != null) action.accept(this);
    }

    @Override public void fill(String selector, String value, Duration timeout)         { act("fill", selector); }
    @Override public void selectOption(String selector, String value, Duration timeout) { act("select", selector); }
    @Override public void check(String selector, Duration timeout)                      { act("check", selector); }
    @Override public void uncheck(String selector, Duration timeout)                    { act("uncheck", selector); }
    @Override public void hover(String selector, Duration timeout)                      { act("hover", selector); }
    @Override public void type(String selector, String text, long delayMs)              { act("type", selector); }
    @Override public void press(String selector, String key)                            { act("press", selector + " " + key); }

    @Override
    public void waitForTimeout(long ms) {
        act("wait", ms + "ms");
    }

    @Override
    public void waitForSelector(String selector, Duration timeout) {
        if (!taskPage) {
            if (actionable.isEmpty()) throw new BrowserException("Timed out waiting for " + selector);
            return;
        }
        act("waitForSelector", selector);
    }

    @Override
    public Object evaluate(String script) {
        act("evaluate", script);
        return context.scriptResult(script);
    }

    @Override
    public byte[] screenshot(boolean fullPage) {
        if (context.isFailScreenshots()) throw new BrowserException("Screenshot failed");
        act("screenshot", fullPage ? "full" : "viewport");
        return new byte[] {(byte) 0x89, 'P', 'N', 'G'};
    }

    @Override
    public String innerText() {
        if (unreadable) throw new BrowserException("Target page, context or browser has been closed");
        return text;
    }

    @Override
    public String innerHtml() {
        if (unreadable) throw new BrowserException("Target page, context or browser has been closed");
        return html;
    }

    @Override
    public boolean isActionable(String selector) {
        return !closed && actionable.contains(selector);
    }

    @Override
    public boolean waitForClose(Duration timeout) {
        return closed;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (taskPage) context.taskPageClosed();
    }

    private void act(String action, String target) {
        if (closed) throw new BrowserException("Page is closed");
        context.checkSelector(target);
        context.record(owner + ":" + action + " " + target);
    }
}
