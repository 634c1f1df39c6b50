package com.testconductor.executor;

import com.testconductor.browser.BrowserPage;
import com.testconductor.core.ConductorConfig;
import com.testconductor.core.ScreenshotStore;
import com.testconductor.interrupt.InterruptHandler;
import com.testconductor.interrupt.InterruptResult;
import com.testconductor.interrupt.PopupInterruptHandler;
import com.testconductor.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Executes one {@link Step} against a task's page.
 *
 * For each step:
 *   1. dispatch to the {@link ActionHandler} registered for its action type
 *   2. after a click-class step whose policy is not {@code ignore}, run the
 *      {@link InterruptHandler} against the page's browsing context
 *   3. take the optional after-step screenshot (best-effort)
 *
 * A failed action, a popup rejected because it showed an error, and (when
 * configured) a popup with no clickable control all raise {@link StepException}.
 *
 * Stateless apart from its collaborators; one instance serves every task thread.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ActionHandlerRegistry registry;
    private final InterruptHandler      interruptHandler;
    private final ScreenshotStore       screenshots;
    private final Duration              popupWait;
    private final boolean               failOnUnresolvedPopup;

    public StepExecutor(ConductorConfig config) {
        this(new ActionHandlerRegistry(), new PopupInterruptHandler(config),
            new ScreenshotStore(config.getScreenshotsDir()),
            config.getPopupWait(), config.isFailOnUnresolvedPopup());
    }

    public StepExecutor(ActionHandlerRegistry registry, InterruptHandler interruptHandler,
                        ScreenshotStore screenshots, Duration popupWait, boolean failOnUnresolvedPopup) {
        this.registry              = registry;
        this.interruptHandler      = interruptHandler;
        this.screenshots           = screenshots;
        this.popupWait             = popupWait;
        this.failOnUnresolvedPopup = failOnUnresolvedPopup;
    }

    public StepResult execute(BrowserPage page, Step step) throws StepException {
        long start = System.currentTimeMillis();

        ActionHandler handler = registry.find(step.getAction()).orElseThrow(() ->
            new StepException(step, StepException.Reason.NO_HANDLER,
                "No handler registered for action " + step.getAction(), null, null, elapsed(start)));

        log.debug("StepExecutor: {}", step.describe());
        ActionResult result = handler.execute(new ActionContext(page, step, screenshots));
        if (result.isFailed()) {
            throw new StepException(step, StepException.Reason.ACTION_FAILED,
                result.getMessage(), result.getError(), null, elapsed(start));
        }
        if (result.isSkipped()) {
            log.debug("StepExecutor: {} skipped: {}", step.describe(), result.getMessage());
        }

        InterruptResult interrupt = InterruptResult.noPopup();
        if (step.isInterruptible()) {
            interrupt = interruptHandler.handle(page.context(), step.getInterruptPolicy(), popupWait);
            if (interrupt.isTestFailed()) {
                throw new StepException(step, StepException.Reason.INTERRUPT_REJECTED_ERROR,
                    "Wallet popup rejected: " + interrupt.getError(), null, interrupt, elapsed(start));
            }
            if (interrupt.hasPopup() && !interrupt.isSuccess() && failOnUnresolvedPopup) {
                throw new StepException(step, StepException.Reason.INTERRUPT_UNRESOLVED,
                    interrupt.getError(), null, interrupt, elapsed(start));
            }
        }

        String evidence = null;
        if (step.getScreenshot() != null) {
            Optional<Path> saved = screenshots.capture(page, step.getScreenshot(), step.isFullPage());
            evidence = saved.map(Path::toString).orElse(null);
        }

        return StepResult.succeeded(step, result.getValue(), evidence, interrupt, elapsed(start));
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
