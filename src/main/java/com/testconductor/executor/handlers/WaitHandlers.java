package com.testconductor.executor.handlers;

import com.testconductor.executor.ActionContext;
import com.testconductor.executor.ActionHandler;
import com.testconductor.executor.ActionResult;
import com.testconductor.executor.HandlesAction;
import com.testconductor.model.ActionType;
import com.testconductor.model.Step;

import java.time.Duration;

// ── WAIT ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.WAIT)
class WaitHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Wait step = ctx.getStep(Step.Wait.class);
        long ms = step.getMs() != null ? step.getMs() : DefaultTimeouts.WAIT_MS;
        try {
            ctx.getPage().waitForTimeout(ms);
            return ActionResult.executed("Waited " + ms + "ms");
        } catch (RuntimeException e) {
            return ActionResult.failed("Wait interrupted: " + e.getMessage(), e);
        }
    }
}

// ── WAIT_FOR_SELECTOR ─────────────────────────────────────────────────────────

@HandlesAction(ActionType.WAIT_FOR_SELECTOR)
class WaitForSelectorHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.WaitForSelector step = ctx.getStep(Step.WaitForSelector.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.WAIT_FOR_SELECTOR_MS);
        try {
            ctx.getPage().waitForSelector(step.getSelector(), timeout);
            return ActionResult.executed("Element visible: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Element '" + step.getSelector() + "' not visible within " +
                timeout.toMillis() + "ms: " + e.getMessage(), e);
        }
    }
}
