package com.testconductor.interrupt;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import com.testconductor.model.WaitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Finds the wallet popup page in a browsing context.
 *
 * Search order:
 *   1. an already-open extension page whose URL looks like a popup
 *      ({@code chrome-extension://...} containing notification, popup or confirm)
 *   2. when the wallet extension id is known, the extension's notification page
 *      opened directly; kept only if it actually shows a pending request
 *   3. a new page opening in the context within the wait timeout
 */
public class PopupLocator {

    private static final Logger log = LoggerFactory.getLogger(PopupLocator.class);

    static final String EXTENSION_SCHEME = "chrome-extension://";
    private static final List<String> POPUP_URL_MARKERS = List.of("notification", "popup", "confirm");

    private static final Duration PROBE_LOAD_TIMEOUT   = Duration.ofSeconds(5);
    private static final Duration PROBE_BUTTON_TIMEOUT = Duration.ofSeconds(2);
    private static final int      PROBE_MIN_TEXT_CHARS = 50;

    private final String walletExtensionId;

    public PopupLocator(String walletExtensionId) {
        this.walletExtensionId = (walletExtensionId != null && !walletExtensionId.isBlank())
            ? walletExtensionId : null;
    }

    public Optional<BrowserPage> locate(BrowserContext context, Duration waitTimeout) {
        Optional<BrowserPage> existing = findOpenPopup(context);
        if (existing.isPresent()) {
            log.debug("PopupLocator: found open popup {}", existing.get().url());
            return existing;
        }

        if (walletExtensionId != null) {
            Optional<BrowserPage> probed = probeNotificationPage(context);
            if (probed.isPresent()) return probed;
        }

        Optional<BrowserPage> opened = context.waitForNewPage(waitTimeout);
        opened.ifPresent(p -> log.debug("PopupLocator: new page opened {}", p.url()));
        return opened;
    }

    static boolean isPopupUrl(String url) {
        return url != null
            && url.startsWith(EXTENSION_SCHEME)
            && POPUP_URL_MARKERS.stream().anyMatch(url::contains);
    }

    private Optional<BrowserPage> findOpenPopup(BrowserContext context) {
        for (BrowserPage page : context.pages()) {
            try {
                if (!page.isClosed() && isPopupUrl(page.url())) return Optional.of(page);
            } catch (BrowserException e) {
                log.debug("PopupLocator: page closed while scanning: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<BrowserPage> probeNotificationPage(BrowserContext context) {
        String url = EXTENSION_SCHEME + walletExtensionId + "/notification.html";
        BrowserPage probe = context.newPage();
        try {
            probe.navigate(url, WaitPolicy.DOM_CONTENT_LOADED, PROBE_LOAD_TIMEOUT);
            try {
                probe.waitForSelector("button", PROBE_BUTTON_TIMEOUT);
            } catch (BrowserException e) {
                log.debug("PopupLocator: notification page has no buttons yet");
            }
            String text = probe.innerText();
            if (text != null && text.trim().length() > PROBE_MIN_TEXT_CHARS) {
                log.debug("PopupLocator: pending request found on {}", url);
                return Optional.of(probe);
            }
        } catch (BrowserException e) {
            log.debug("PopupLocator: could not open {}: {}", url, e.getMessage());
        }
        closeQuietly(probe);
        return Optional.empty();
    }

    private static void closeQuietly(BrowserPage page) {
        try {
            page.close();
        } catch (BrowserException e) {
            log.warn("PopupLocator: could not close probe page: {}", e.getMessage());
        }
    }
}
