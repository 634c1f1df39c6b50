package com.testconductor.core;

import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ConductorConfigTest {

    private static ConductorConfig fromEnv(Map<String, String> env) {
        return ConductorConfig.fromEnvironment(env::get);
    }

    @Test
    public void emptyEnvironment_usesDefaults() {
        ConductorConfig config = fromEnv(Map.of());

        assertThat(config.getMaxParallel()).isEqualTo(5);
        assertThat(config.isFailFast()).isFalse();
        assertThat(config.isStopRunningOnAbort()).isFalse();
        assertThat(config.getPopupWait()).isEqualTo(Duration.ofMillis(3_000));
        assertThat(config.getPopupSettle()).isEqualTo(Duration.ofMillis(300));
        assertThat(config.isFailOnUnresolvedPopup()).isTrue();
        assertThat(config.isHeadless()).isTrue();
        assertThat(config.getWalletExtensionId()).isNull();
        assertThat(config.getScreenshotsDir()).isEqualTo(Paths.get("test-output", "screenshots"));
        assertThat(config.getReportPath()).isEqualTo(Paths.get("test-output", "run-report.json"));
        assertThat(config.isReportEnabled()).isTrue();
    }

    @Test
    public void environment_overridesDefaults() {
        ConductorConfig config = fromEnv(Map.of(
            "CONDUCTOR_MAX_PARALLEL", "2",
            "CONDUCTOR_FAIL_FAST", "true",
            "CONDUCTOR_STOP_RUNNING_ON_ABORT", "1",
            "CONDUCTOR_OUTPUT_DIR", "out",
            "CONDUCTOR_POPUP_WAIT_MS", "500",
            "CONDUCTOR_WALLET_EXTENSION_ID", " nkbihfbeogaeaoehlefnkodbefgpgknn ",
            "CONDUCTOR_FAIL_ON_UNRESOLVED_POPUP", "false",
            "CONDUCTOR_HEADLESS", "false"));

        assertThat(config.getMaxParallel()).isEqualTo(2);
        assertThat(config.isFailFast()).isTrue();
        assertThat(config.isStopRunningOnAbort()).isTrue();
        assertThat(config.getPopupWait()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.getWalletExtensionId()).isEqualTo("nkbihfbeogaeaoehlefnkodbefgpgknn");
        assertThat(config.isFailOnUnresolvedPopup()).isFalse();
        assertThat(config.isHeadless()).isFalse();
        assertThat(config.getScreenshotsDir()).isEqualTo(Paths.get("out", "screenshots"));
        assertThat(config.getReportPath()).isEqualTo(Paths.get("out", "run-report.json"));
    }

    @Test
    public void blankReportPath_disablesReport() {
        ConductorConfig config = fromEnv(Map.of("CONDUCTOR_REPORT_PATH", " "));

        assertThat(config.isReportEnabled()).isFalse();
    }

    @Test
    public void unparsableNumber_fallsBackToDefault() {
        assertThat(fromEnv(Map.of("CONDUCTOR_MAX_PARALLEL", "many")).getMaxParallel()).isEqualTo(5);
    }

    @Test
    public void toSchedulerOptions_carriesSchedulingFields() {
        ConductorConfig config = ConductorConfig.builder().maxParallel(3).failFast(true).build();

        assertThat(config.toSchedulerOptions().getMaxParallel()).isEqualTo(3);
        assertThat(config.toSchedulerOptions().isFailFast()).isTrue();
    }
}
