package com.testconductor.browser.selenium;

import org.testng.annotations.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pure helpers of the Selenium page: full-page clip and script wrapping.
 */
public class SeleniumBrowserPageTest {

    // ════════════════════════════════════════════════════════════════════════
    // contentClip
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void contentClip_coversWholeDocument() {
        Map<String, Object> metrics = Map.of(
            "cssContentSize", Map.of("x", 0, "y", 0, "width", 1280L, "height", 4321.5));

        Map<String, Object> clip = SeleniumBrowserPage.contentClip(metrics);

        assertThat(clip).containsEntry("x", 0)
                        .containsEntry("y", 0)
                        .containsEntry("width", 1280.0)
                        .containsEntry("height", 4321.5)
                        .containsEntry("scale", 1);
    }

    @Test
    public void contentClip_isNullWithoutContentSize() {
        assertThat(SeleniumBrowserPage.contentClip(Map.of())).isNull();
        assertThat(SeleniumBrowserPage.contentClip(null)).isNull();
        assertThat(SeleniumBrowserPage.contentClip(Map.of("cssContentSize", "n/a"))).isNull();
        assertThat(SeleniumBrowserPage.contentClip(
            Map.of("cssContentSize", Map.of("width", "wide", "height", 10)))).isNull();
    }

    // ════════════════════════════════════════════════════════════════════════
    // asReturningScript
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void asReturningScript_wrapsExpressionsAndFunctions() {
        assertThat(SeleniumBrowserPage.asReturningScript("document.title"))
            .isEqualTo("return (document.title);");
        assertThat(SeleniumBrowserPage.asReturningScript("() => 42"))
            .isEqualTo("return (() => 42)();");
        assertThat(SeleniumBrowserPage.asReturningScript("return 1;"))
            .isEqualTo("return 1;");
    }
}
