package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One scripted UI action inside a {@link Task}.
 *
 * The set of step kinds is closed: the only subclasses are the nested final
 * classes below (the base constructor is private), and each corresponds to one
 * {@link ActionType}. Task files select the kind with the {@code action}
 * property; an unknown action name is rejected when the file is loaded, never
 * at execution time.
 *
 * Steps are immutable. Every kind additionally carries:
 *
 *   interruptPolicy -- popup handling after click-class steps (default: approve)
 *   screenshot      -- optional file name for an evidence screenshot taken after the step
 *   fullPage        -- capture the whole page rather than the viewport
 *
 * Timeouts are in milliseconds; {@code null} means "use the action's default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Step.Navigate.class,        name = "navigate"),
    @JsonSubTypes.Type(value = Step.Click.class,           name = "click"),
    @JsonSubTypes.Type(value = Step.Fill.class,            name = "fill"),
    @JsonSubTypes.Type(value = Step.Select.class,          name = "select"),
    @JsonSubTypes.Type(value = Step.Check.class,           name = "check"),
    @JsonSubTypes.Type(value = Step.Uncheck.class,         name = "uncheck"),
    @JsonSubTypes.Type(value = Step.Wait.class,            name = "wait"),
    @JsonSubTypes.Type(value = Step.WaitForSelector.class, name = "waitForSelector"),
    @JsonSubTypes.Type(value = Step.Screenshot.class,      name = "screenshot"),
    @JsonSubTypes.Type(value = Step.Evaluate.class,        name = "evaluate"),
    @JsonSubTypes.Type(value = Step.Type.class,            name = "type"),
    @JsonSubTypes.Type(value = Step.Hover.class,           name = "hover"),
    @JsonSubTypes.Type(value = Step.Press.class,           name = "press")
})
public abstract class Step {

    private final ActionType      action;
    private final InterruptPolicy interruptPolicy;
    private final String          screenshot;
    private final boolean         fullPage;

    private Step(ActionType action, InterruptPolicy interruptPolicy, String screenshot, boolean fullPage) {
        this.action          = action;
        this.interruptPolicy = interruptPolicy;
        this.screenshot      = (screenshot != null && !screenshot.isBlank()) ? screenshot : null;
        this.fullPage        = fullPage;
    }

    // ── Common accessors ──────────────────────────────────────────────────────

    @JsonIgnore
    public ActionType getAction() { return action; }

    /** The popup policy, defaulting to {@link InterruptPolicy#APPROVE} when not given. */
    @JsonIgnore
    public InterruptPolicy getInterruptPolicy() {
        return interruptPolicy != null ? interruptPolicy : InterruptPolicy.APPROVE;
    }

    @JsonProperty("interruptPolicy")
    InterruptPolicy getDeclaredInterruptPolicy() { return interruptPolicy; }

    public String getScreenshot() { return screenshot; }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isFullPage() { return fullPage; }

    /** True when this step should be followed by popup detection. */
    @JsonIgnore
    public boolean isInterruptible() {
        return action.isClickClass() && getInterruptPolicy() != InterruptPolicy.IGNORE;
    }

    /** Short human-readable description for logs and reports. */
    public abstract String describe();

    @Override
    public String toString() {
        return "Step{" + describe() + "}";
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    public static Navigate navigate(String url) {
        return new Navigate(url, null, null, null, null, false);
    }

    public static Click click(String selector) {
        return new Click(selector, null, null, null, false);
    }

    public static Click click(String selector, InterruptPolicy policy) {
        return new Click(selector, null, policy, null, false);
    }

    public static Fill fill(String selector, String value) {
        return new Fill(selector, value, null, null, null, false);
    }

    public static Select select(String selector, String value) {
        return new Select(selector, value, null, null, null, false);
    }

    public static Check check(String selector) {
        return new Check(selector, null, null, null, false);
    }

    public static Uncheck uncheck(String selector) {
        return new Uncheck(selector, null, null, null, false);
    }

    public static Wait waitMs(long ms) {
        return new Wait(ms, null, null, false);
    }

    public static WaitForSelector waitForSelector(String selector) {
        return new WaitForSelector(selector, null, null, null, false);
    }

    public static Screenshot screenshot(String name, boolean fullPage) {
        return new Screenshot(name, null, fullPage);
    }

    public static Evaluate evaluate(String script) {
        return new Evaluate(script, null, null, false);
    }

    public static Type type(String selector, String text) {
        return new Type(selector, text, null, null, null, false);
    }

    public static Hover hover(String selector) {
        return new Hover(selector, null, null, null, false);
    }

    public static Press press(String selector, String key) {
        return new Press(selector, key, null, null, false);
    }

    private static String require(String value, String field, String action) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required for " + action);
        }
        return value;
    }

    // ── Kinds ─────────────────────────────────────────────────────────────────

    public static final class Navigate extends Step {
        private final String     url;
        private final WaitPolicy waitPolicy;
        private final Long       timeout;

        @JsonCreator
        public Navigate(@JsonProperty("url") String url,
                        @JsonProperty("waitPolicy") @JsonAlias("waitUntil") WaitPolicy waitPolicy,
                        @JsonProperty("timeout") Long timeout,
                        @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                        @JsonProperty("screenshot") String screenshot,
                        @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.NAVIGATE, interruptPolicy, screenshot, fullPage);
            this.url        = require(url, "url", "navigate");
            this.waitPolicy = waitPolicy;
            this.timeout    = timeout;
        }

        public String getUrl()            { return url; }
        public Long   getTimeout()        { return timeout; }

        /** The load state to wait for; {@link WaitPolicy#LOAD} unless the task says otherwise. */
        public WaitPolicy getWaitPolicy() { return waitPolicy != null ? waitPolicy : WaitPolicy.LOAD; }

        @Override
        public String describe() { return "navigate " + url; }
    }

    public static final class Click extends Step {
        private final String selector;
        private final Long   timeout;

        @JsonCreator
        public Click(@JsonProperty("selector") String selector,
                     @JsonProperty("timeout") Long timeout,
                     @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                     @JsonProperty("screenshot") String screenshot,
                     @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.CLICK, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "click");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "click " + selector; }
    }

    public static final class Fill extends Step {
        private final String selector;
        private final String value;
        private final Long   timeout;

        @JsonCreator
        public Fill(@JsonProperty("selector") String selector,
                    @JsonProperty("value") String value,
                    @JsonProperty("timeout") Long timeout,
                    @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                    @JsonProperty("screenshot") String screenshot,
                    @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.FILL, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "fill");
            this.value    = value != null ? value : "";
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public String getValue()    { return value; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "fill " + selector; }
    }

    public static final class Select extends Step {
        private final String selector;
        private final String value;
        private final Long   timeout;

        @JsonCreator
        public Select(@JsonProperty("selector") String selector,
                      @JsonProperty("value") String value,
                      @JsonProperty("timeout") Long timeout,
                      @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                      @JsonProperty("screenshot") String screenshot,
                      @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.SELECT, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "select");
            this.value    = require(value, "value", "select");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public String getValue()    { return value; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "select " + selector + " = " + value; }
    }

    public static final class Check extends Step {
        private final String selector;
        private final Long   timeout;

        @JsonCreator
        public Check(@JsonProperty("selector") String selector,
                     @JsonProperty("timeout") Long timeout,
                     @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                     @JsonProperty("screenshot") String screenshot,
                     @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.CHECK, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "check");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "check " + selector; }
    }

    public static final class Uncheck extends Step {
        private final String selector;
        private final Long   timeout;

        @JsonCreator
        public Uncheck(@JsonProperty("selector") String selector,
                       @JsonProperty("timeout") Long timeout,
                       @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                       @JsonProperty("screenshot") String screenshot,
                       @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.UNCHECK, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "uncheck");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "uncheck " + selector; }
    }

    public static final class Wait extends Step {
        private final Long ms;

        @JsonCreator
        public Wait(@JsonProperty("ms") Long ms,
                    @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                    @JsonProperty("screenshot") String screenshot,
                    @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.WAIT, interruptPolicy, screenshot, fullPage);
            if (ms != null && ms < 0) throw new IllegalArgumentException("'ms' must not be negative for wait");
            this.ms = ms;
        }

        public Long getMs() { return ms; }

        @Override
        public String describe() { return "wait " + (ms != null ? ms + "ms" : "default"); }
    }

    public static final class WaitForSelector extends Step {
        private final String selector;
        private final Long   timeout;

        @JsonCreator
        public WaitForSelector(@JsonProperty("selector") String selector,
                               @JsonProperty("timeout") Long timeout,
                               @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                               @JsonProperty("screenshot") String screenshot,
                               @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.WAIT_FOR_SELECTOR, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "waitForSelector");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "waitForSelector " + selector; }
    }

    public static final class Screenshot extends Step {
        private final String name;

        @JsonCreator
        public Screenshot(@JsonProperty("name") String name,
                          @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                          @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.SCREENSHOT, interruptPolicy, null, fullPage);
            this.name = (name != null && !name.isBlank()) ? name : null;
        }

        /** File name for the capture; {@code null} lets the store generate one. */
        public String getName() { return name; }

        @Override
        public String describe() { return "screenshot " + (name != null ? name : "(auto)"); }
    }

    public static final class Evaluate extends Step {
        private final String script;

        @JsonCreator
        public Evaluate(@JsonProperty("script") String script,
                        @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                        @JsonProperty("screenshot") String screenshot,
                        @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.EVALUATE, interruptPolicy, screenshot, fullPage);
            this.script = require(script, "script", "evaluate");
        }

        public String getScript() { return script; }

        @Override
        public String describe() { return "evaluate script (" + script.length() + " chars)"; }
    }

    public static final class Type extends Step {
        private final String selector;
        private final String text;
        private final Long   delay;

        @JsonCreator
        public Type(@JsonProperty("selector") String selector,
                    @JsonProperty("text") String text,
                    @JsonProperty("delay") Long delay,
                    @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                    @JsonProperty("screenshot") String screenshot,
                    @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.TYPE, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "type");
            this.text     = text != null ? text : "";
            this.delay    = delay;
        }

        public String getSelector() { return selector; }
        public String getText()     { return text; }
        public Long   getDelay()    { return delay; }

        @Override
        public String describe() { return "type into " + selector; }
    }

    public static final class Hover extends Step {
        private final String selector;
        private final Long   timeout;

        @JsonCreator
        public Hover(@JsonProperty("selector") String selector,
                     @JsonProperty("timeout") Long timeout,
                     @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                     @JsonProperty("screenshot") String screenshot,
                     @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.HOVER, interruptPolicy, screenshot, fullPage);
            this.selector = require(selector, "selector", "hover");
            this.timeout  = timeout;
        }

        public String getSelector() { return selector; }
        public Long   getTimeout()  { return timeout; }

        @Override
        public String describe() { return "hover " + selector; }
    }

    public static final class Press extends Step {
        private final String selector;
        private final String key;

        @JsonCreator
        public Press(@JsonProperty("selector") String selector,
                     @JsonProperty("key") String key,
                     @JsonProperty("interruptPolicy") @JsonAlias("walletAction") InterruptPolicy interruptPolicy,
                     @JsonProperty("screenshot") String screenshot,
                     @JsonProperty("fullPage") boolean fullPage) {
            super(ActionType.PRESS, interruptPolicy, screenshot, fullPage);
            this.selector = (selector != null && !selector.isBlank()) ? selector : "body";
            this.key      = require(key, "key", "press");
        }

        public String getSelector() { return selector; }
        public String getKey()      { return key; }

        @Override
        public String describe() { return "press " + key + " on " + selector; }
    }
}
