package com.testconductor.interrupt;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import com.testconductor.core.ConductorConfig;
import com.testconductor.model.InterruptPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Answers wallet popups that open as a result of a click.
 *
 * Protocol for one call:
 *   1. settle briefly so a popup triggered by the click has time to open
 *   2. locate the popup ({@link PopupLocator}); none found means {@code hasPopup=false}
 *   3. wait, bounded, for the popup's controls to render
 *   4. classify it ({@link PopupClassifier}); a classifier exception counts as an error
 *   5. an error forces a reject and {@code testFailed=true}, whatever the policy;
 *      otherwise the policy picks approve (kind-specific controls) or reject
 *   6. after approving, wait for the popup to close; timing out is tolerated
 *
 * The popup page belongs to this call only. It is closed if a control was clicked
 * and it is still open; if no control could be clicked it is left open so the
 * next interrupt check can find it again.
 */
public class PopupInterruptHandler implements InterruptHandler {

    private static final Logger log = LoggerFactory.getLogger(PopupInterruptHandler.class);

    static final Duration CONTROL_CLICK_TIMEOUT = Duration.ofSeconds(5);
    private static final String READY_SELECTOR = "button";

    private final PopupClassifier classifier;
    private final PopupLocator    locator;
    private final Duration        settle;
    private final Duration        ready;
    private final Duration        closeWait;

    public PopupInterruptHandler(ConductorConfig config) {
        this(new RuleBasedPopupClassifier(), new PopupLocator(config.getWalletExtensionId()),
            config.getPopupSettle(), config.getPopupReady(), config.getPopupClose());
    }

    public PopupInterruptHandler(PopupClassifier classifier, PopupLocator locator,
                                 Duration settle, Duration ready, Duration closeWait) {
        this.classifier = classifier;
        this.locator    = locator;
        this.settle     = settle;
        this.ready      = ready;
        this.closeWait  = closeWait;
    }

    @Override
    public InterruptResult handle(BrowserContext context, InterruptPolicy policy, Duration waitTimeout) {
        if (policy == InterruptPolicy.IGNORE) return InterruptResult.noPopup();

        if (!pause(settle)) return InterruptResult.noPopup();

        Optional<BrowserPage> found = locator.locate(context, waitTimeout);
        if (found.isEmpty()) {
            log.debug("PopupInterruptHandler: no popup within {}ms", waitTimeout.toMillis());
            return InterruptResult.noPopup();
        }
        BrowserPage popup = found.get();

        awaitControls(popup);
        PopupClassification classification = classify(popup);
        log.info("PopupInterruptHandler: popup detected: {}", classification);

        boolean forcedReject = classification.hasError();
        PopupAction action = (forcedReject || policy == InterruptPolicy.REJECT)
            ? PopupAction.REJECTED : PopupAction.APPROVED;
        List<String> selectors = action == PopupAction.REJECTED
            ? PopupControls.rejectSelectors()
            : PopupControls.approveSelectors(classification.getKind());

        Optional<String> clicked = clickFirstActionable(popup, selectors);
        if (clicked.isEmpty()) {
            log.warn("PopupInterruptHandler: no {} control found in {} popup",
                action.jsonName(), classification.getKind().jsonName());
            return InterruptResult.unresolved(classification, action);
        }

        if (action == PopupAction.APPROVED && !popup.waitForClose(closeWait)) {
            log.debug("PopupInterruptHandler: popup still open {}ms after approve", closeWait.toMillis());
        }
        closeIfOpen(popup);

        if (forcedReject) {
            log.warn("PopupInterruptHandler: rejected popup showing error '{}'", classification.getErrorText());
            return InterruptResult.rejectedForError(classification, clicked.get());
        }
        log.info("PopupInterruptHandler: {} {} popup via {}",
            action.jsonName(), classification.getKind().jsonName(), clicked.get());
        return InterruptResult.resolved(classification, action, clicked.get());
    }

    // ── Protocol steps ────────────────────────────────────────────────────────

    private void awaitControls(BrowserPage popup) {
        try {
            popup.waitForSelector(READY_SELECTOR, ready);
        } catch (BrowserException e) {
            log.debug("PopupInterruptHandler: popup controls not ready after {}ms", ready.toMillis());
        }
    }

    private PopupClassification classify(BrowserPage popup) {
        try {
            return classifier.classify(new PopupContent(popup.innerText(), popup.innerHtml()));
        } catch (RuntimeException e) {
            log.warn("PopupInterruptHandler: could not classify popup: {}", e.getMessage());
            return PopupClassification.unreadable(e);
        }
    }

    private Optional<String> clickFirstActionable(BrowserPage popup, List<String> selectors) {
        for (String selector : selectors) {
            try {
                if (popup.isActionable(selector)) {
                    popup.click(selector, CONTROL_CLICK_TIMEOUT);
                    return Optional.of(selector);
                }
            } catch (BrowserException e) {
                log.debug("PopupInterruptHandler: control '{}' not clickable: {}", selector, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private void closeIfOpen(BrowserPage popup) {
        try {
            if (!popup.isClosed()) popup.close();
        } catch (BrowserException e) {
            log.warn("PopupInterruptHandler: could not close popup: {}", e.getMessage());
        }
    }

    /** Sleeps for {@code d}; false if the thread was interrupted. */
    private static boolean pause(Duration d) {
        if (d.isZero() || d.isNegative()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
