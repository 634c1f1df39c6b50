package com.testconductor.executor;

import com.testconductor.browser.BrowserPage;
import com.testconductor.core.ScreenshotStore;
import com.testconductor.model.Step;

/**
 * Passed to every {@link ActionHandler} when it is invoked: the task's page,
 * the step being executed and the evidence store.
 */
public class ActionContext {

    private final BrowserPage     page;
    private final Step            step;
    private final ScreenshotStore screenshots;

    public ActionContext(BrowserPage page, Step step, ScreenshotStore screenshots) {
        this.page        = page;
        this.step        = step;
        this.screenshots = screenshots;
    }

    public BrowserPage     getPage()        { return page; }
    public Step            getStep()        { return step; }
    public ScreenshotStore getScreenshots() { return screenshots; }

    /**
     * The step as its concrete kind. Handlers are registered per action type, so a
     * mismatch here means a handler is registered under the wrong type.
     */
    public <T extends Step> T getStep(Class<T> kind) {
        if (!kind.isInstance(step)) {
            throw new IllegalStateException(
                "Handler for " + kind.getSimpleName() + " received " + step.getClass().getSimpleName());
        }
        return kind.cast(step);
    }
}
