package com.testconductor.interrupt;

/**
 * Snapshot of a popup page handed to the classification rules.
 *
 * @param text visible body text
 * @param html body markup
 */
public record PopupContent(String text, String html) {

    public PopupContent {
        text = text != null ? text : "";
        html = html != null ? html : "";
    }

    public boolean textContains(String needle) {
        return text.contains(needle);
    }

    public boolean textOrMarkupContains(String needle) {
        return text.contains(needle) || html.contains(needle);
    }
}
