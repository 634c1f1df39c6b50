package com.testconductor.core;

import com.testconductor.scheduler.SchedulerOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration for a TestConductor run.
 *
 * Load from environment variables (recommended) or construct programmatically.
 *
 * Recognised environment variables:
 *   CONDUCTOR_MAX_PARALLEL             - Max tasks in flight at once (default: 5)
 *   CONDUCTOR_FAIL_FAST                - Stop dispatching after the first task failure (default: false)
 *   CONDUCTOR_STOP_RUNNING_ON_ABORT    - After an abort, in-flight tasks stop at their next step boundary (default: false)
 *   CONDUCTOR_OUTPUT_DIR               - Root for run evidence (default: test-output)
 *   CONDUCTOR_SCREENSHOTS_DIR          - Screenshot directory (default: test-output/screenshots)
 *   CONDUCTOR_REPORT_PATH              - Where the JSON run report is written (default: test-output/run-report.json)
 *   CONDUCTOR_POPUP_WAIT_MS            - Wait for a wallet popup to open after a click (default: 3000)
 *   CONDUCTOR_POPUP_SETTLE_MS          - Delay before looking for a popup (default: 300)
 *   CONDUCTOR_POPUP_READY_MS           - Wait for the popup's controls to render (default: 2000)
 *   CONDUCTOR_POPUP_CLOSE_MS           - Wait for the popup to close after approving (default: 3000)
 *   CONDUCTOR_WALLET_EXTENSION_ID      - Wallet extension id; enables probing its notification page (optional)
 *   CONDUCTOR_FAIL_ON_UNRESOLVED_POPUP - Fail the step when a popup has no clickable control (default: true)
 *   CONDUCTOR_HEADLESS                 - Run Chrome headless (default: true)
 *   CONDUCTOR_WALLET_EXTENSION_PATH    - Unpacked wallet extension to load into Chrome (optional)
 */
public class ConductorConfig {

    public static final int  DEFAULT_MAX_PARALLEL     = 5;
    public static final long DEFAULT_POPUP_WAIT_MS    = 3_000;
    public static final long DEFAULT_POPUP_SETTLE_MS  = 300;
    public static final long DEFAULT_POPUP_READY_MS   = 2_000;
    public static final long DEFAULT_POPUP_CLOSE_MS   = 3_000;
    public static final Path DEFAULT_OUTPUT_DIR       = Paths.get("test-output");
    public static final Path DEFAULT_SCREENSHOTS_DIR  = DEFAULT_OUTPUT_DIR.resolve("screenshots");
    public static final Path DEFAULT_REPORT_PATH      = DEFAULT_OUTPUT_DIR.resolve("run-report.json");

    private final int      maxParallel;
    private final boolean  failFast;
    private final boolean  stopRunningOnAbort;
    private final Path     outputDir;
    private final Path     screenshotsDir;
    private final Path     reportPath;          // null = report not written
    private final Duration popupWait;
    private final Duration popupSettle;
    private final Duration popupReady;
    private final Duration popupClose;
    private final String   walletExtensionId;   // null = no notification-page probe
    private final boolean  failOnUnresolvedPopup;
    private final boolean  headless;
    private final Path     walletExtensionPath; // null = plain Chrome

    private ConductorConfig(Builder b) {
        this.maxParallel           = b.maxParallel;
        this.failFast              = b.failFast;
        this.stopRunningOnAbort    = b.stopRunningOnAbort;
        this.outputDir             = b.outputDir;
        this.screenshotsDir        = b.screenshotsDir != null ? b.screenshotsDir : b.outputDir.resolve("screenshots");
        this.reportPath            = b.reportPath;
        this.popupWait             = b.popupWait;
        this.popupSettle           = b.popupSettle;
        this.popupReady            = b.popupReady;
        this.popupClose            = b.popupClose;
        this.walletExtensionId     = b.walletExtensionId;
        this.failOnUnresolvedPopup = b.failOnUnresolvedPopup;
        this.headless              = b.headless;
        this.walletExtensionPath   = b.walletExtensionPath;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ConductorConfig defaults() {
        return builder().build();
    }

    public static ConductorConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ConductorConfig fromEnvironment(Function<String, String> env) {
        Path outputDir = pathOrDefault(env, "CONDUCTOR_OUTPUT_DIR", DEFAULT_OUTPUT_DIR);
        return builder()
            .maxParallel(intOrDefault(env, "CONDUCTOR_MAX_PARALLEL", DEFAULT_MAX_PARALLEL))
            .failFast(boolOrDefault(env, "CONDUCTOR_FAIL_FAST", false))
            .stopRunningOnAbort(boolOrDefault(env, "CONDUCTOR_STOP_RUNNING_ON_ABORT", false))
            .outputDir(outputDir)
            .screenshotsDir(pathOrDefault(env, "CONDUCTOR_SCREENSHOTS_DIR", outputDir.resolve("screenshots")))
            .reportPath(reportPathFrom(env, outputDir))
            .popupWaitMs(longOrDefault(env, "CONDUCTOR_POPUP_WAIT_MS", DEFAULT_POPUP_WAIT_MS))
            .popupSettleMs(longOrDefault(env, "CONDUCTOR_POPUP_SETTLE_MS", DEFAULT_POPUP_SETTLE_MS))
            .popupReadyMs(longOrDefault(env, "CONDUCTOR_POPUP_READY_MS", DEFAULT_POPUP_READY_MS))
            .popupCloseMs(longOrDefault(env, "CONDUCTOR_POPUP_CLOSE_MS", DEFAULT_POPUP_CLOSE_MS))
            .walletExtensionId(stringOrNull(env, "CONDUCTOR_WALLET_EXTENSION_ID"))
            .failOnUnresolvedPopup(boolOrDefault(env, "CONDUCTOR_FAIL_ON_UNRESOLVED_POPUP", true))
            .headless(boolOrDefault(env, "CONDUCTOR_HEADLESS", true))
            .walletExtensionPath(pathOrDefault(env, "CONDUCTOR_WALLET_EXTENSION_PATH", null))
            .build();
    }

    /** The scheduler-facing subset of this configuration. */
    public SchedulerOptions toSchedulerOptions() {
        return new SchedulerOptions(maxParallel, failFast, stopRunningOnAbort);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int      getMaxParallel()           { return maxParallel; }
    public boolean  isFailFast()               { return failFast; }
    public boolean  isStopRunningOnAbort()     { return stopRunningOnAbort; }
    public Path     getOutputDir()             { return outputDir; }
    public Path     getScreenshotsDir()        { return screenshotsDir; }
    public Path     getReportPath()            { return reportPath; }
    public boolean  isReportEnabled()          { return reportPath != null; }
    public Duration getPopupWait()             { return popupWait; }
    public Duration getPopupSettle()           { return popupSettle; }
    public Duration getPopupReady()            { return popupReady; }
    public Duration getPopupClose()            { return popupClose; }
    public String   getWalletExtensionId()     { return walletExtensionId; }
    public boolean  isFailOnUnresolvedPopup()  { return failOnUnresolvedPopup; }
    public boolean  isHeadless()               { return headless; }
    public Path     getWalletExtensionPath()   { return walletExtensionPath; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int      maxParallel           = DEFAULT_MAX_PARALLEL;
        private boolean  failFast              = false;
        private boolean  stopRunningOnAbort    = false;
        private Path     outputDir             = DEFAULT_OUTPUT_DIR;
        private Path     screenshotsDir        = null;
        private Path     reportPath            = DEFAULT_REPORT_PATH;
        private Duration popupWait             = Duration.ofMillis(DEFAULT_POPUP_WAIT_MS);
        private Duration popupSettle           = Duration.ofMillis(DEFAULT_POPUP_SETTLE_MS);
        private Duration popupReady            = Duration.ofMillis(DEFAULT_POPUP_READY_MS);
        private Duration popupClose            = Duration.ofMillis(DEFAULT_POPUP_CLOSE_MS);
        private String   walletExtensionId     = null;
        private boolean  failOnUnresolvedPopup = true;
        private boolean  headless              = true;
        private Path     walletExtensionPath   = null;

        public Builder maxParallel(int n)                   { this.maxParallel = n; return this; }
        public Builder failFast(boolean b)                  { this.failFast = b; return this; }
        public Builder stopRunningOnAbort(boolean b)        { this.stopRunningOnAbort = b; return this; }
        public Builder outputDir(Path path)                 { this.outputDir = path; return this; }
        public Builder screenshotsDir(Path path)            { this.screenshotsDir = path; return this; }
        public Builder reportPath(Path path)                { this.reportPath = path; return this; }
        public Builder popupWaitMs(long ms)                 { this.popupWait = Duration.ofMillis(ms); return this; }
        public Builder popupSettleMs(long ms)               { this.popupSettle = Duration.ofMillis(ms); return this; }
        public Builder popupReadyMs(long ms)                { this.popupReady = Duration.ofMillis(ms); return this; }
        public Builder popupCloseMs(long ms)                { this.popupClose = Duration.ofMillis(ms); return this; }
        public Builder walletExtensionId(String id)         { this.walletExtensionId = id; return this; }
        public Builder failOnUnresolvedPopup(boolean b)     { this.failOnUnresolvedPopup = b; return this; }
        public Builder headless(boolean b)                  { this.headless = b; return this; }
        public Builder walletExtensionPath(Path path)       { this.walletExtensionPath = path; return this; }

        public ConductorConfig build() {
            if (outputDir == null) outputDir = DEFAULT_OUTPUT_DIR;
            if (walletExtensionId != null && walletExtensionId.isBlank()) walletExtensionId = null;
            return new ConductorConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static Path reportPathFrom(Function<String, String> env, Path outputDir) {
        String val = env.apply("CONDUCTOR_REPORT_PATH");
        if (val == null) return outputDir.resolve("run-report.json");
        return val.isBlank() ? null : Paths.get(val.trim());
    }

    private static String stringOrNull(Function<String, String> env, String key) {
        String val = env.apply(key);
        return (val != null && !val.isBlank()) ? val.trim() : null;
    }

    private static int intOrDefault(Function<String, String> env, String key, int defaultValue) {
        try {
            String val = env.apply(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long longOrDefault(Function<String, String> env, String key, long defaultValue) {
        try {
            String val = env.apply(key);
            return (val != null && !val.isBlank()) ? Long.parseLong(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolOrDefault(Function<String, String> env, String key, boolean defaultValue) {
        String val = env.apply(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static Path pathOrDefault(Function<String, String> env, String key, Path defaultValue) {
        String val = env.apply(key);
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : defaultValue;
    }
}
