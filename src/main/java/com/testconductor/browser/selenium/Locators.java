package com.testconductor.browser.selenium;

import org.openqa.selenium.By;
import org.openqa.selenium.Keys;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates task selectors and key names into Selenium terms.
 *
 * Selectors:
 *   {@code xpath=//div}, {@code //div}, {@code (//div)[2]}  -- XPath
 *   {@code button:has-text("Sign")}                          -- CSS, filtered by contained text
 *   anything else                                            -- CSS
 *
 * Key names follow the DOM {@code KeyboardEvent.key} values ({@code Enter},
 * {@code ArrowDown}, {@code Escape}); a single character is typed as is.
 */
public final class Locators {

    private static final Pattern HAS_TEXT =
        Pattern.compile("^(.*?):has-text\\((\"|')(.*)\\2\\)$");

    private static final Map<String, Keys> KEY_ALIASES = Map.ofEntries(
        Map.entry("ARROWUP",    Keys.ARROW_UP),
        Map.entry("ARROWDOWN",  Keys.ARROW_DOWN),
        Map.entry("ARROWLEFT",  Keys.ARROW_LEFT),
        Map.entry("ARROWRIGHT", Keys.ARROW_RIGHT),
        Map.entry("PAGEUP",     Keys.PAGE_UP),
        Map.entry("PAGEDOWN",   Keys.PAGE_DOWN),
        Map.entry("ESC",        Keys.ESCAPE),
        Map.entry("CONTROL",    Keys.CONTROL),
        Map.entry("META",       Keys.META),
        Map.entry("SPACE",      Keys.SPACE)
    );

    private Locators() {}

    public static By toBy(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("Selector must not be blank");
        }
        String s = selector.trim();
        if (s.startsWith("xpath=")) return By.xpath(s.substring("xpath=".length()));
        if (s.startsWith("//") || s.startsWith("(//")) return By.xpath(s);

        Matcher m = HAS_TEXT.matcher(s);
        if (m.matches()) {
            String css = m.group(1).isBlank() ? "*" : m.group(1).trim();
            return new ByCssContainingText(css, m.group(3));
        }
        return By.cssSelector(s);
    }

    public static CharSequence toKeys(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must not be empty");
        }
        if (key.length() == 1) return key;

        String normalized = key.replace("_", "").toUpperCase(Locale.ROOT);
        Keys alias = KEY_ALIASES.get(normalized);
        if (alias != null) return alias;
        try {
            return Keys.valueOf(key.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown key: " + key, e);
        }
    }

    /** CSS match restricted to elements whose visible text contains a string. */
    static final class ByCssContainingText extends By {
        private final String css;
        private final String text;

        ByCssContainingText(String css, String text) {
            this.css  = css;
            this.text = text;
        }

        @Override
        public List<WebElement> findElements(SearchContext context) {
            return context.findElements(By.cssSelector(css)).stream()
                .filter(e -> e.getText() != null && e.getText().contains(text))
                .toList();
        }

        String css()  { return css; }
        String text() { return text; }

        @Override
        public String toString() {
            return "By.cssContainingText: " + css + " \"" + text + "\"";
        }
    }
}
