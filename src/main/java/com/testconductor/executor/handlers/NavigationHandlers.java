package com.testconductor.executor.handlers;

import com.testconductor.executor.ActionContext;
import com.testconductor.executor.ActionHandler;
import com.testconductor.executor.ActionResult;
import com.testconductor.executor.HandlesAction;
import com.testconductor.model.ActionType;
import com.testconductor.model.Step;

import java.time.Duration;

// ── NAVIGATE ──────────────────────────────────────────────────────────────────

/**
 * Loads a URL and waits for the step's load state, {@code load} by default.
 * Pages kept busy by long polling never reach network idle, so that is only
 * used when a task asks for it.
 */
@HandlesAction(ActionType.NAVIGATE)
class NavigateHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Navigate step = ctx.getStep(Step.Navigate.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.NAVIGATE_MS);
        try {
            ctx.getPage().navigate(step.getUrl(), step.getWaitPolicy(), timeout);
            return ActionResult.executed("Navigated to: " + step.getUrl());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not navigate to '" + step.getUrl() + "': " + e.getMessage(), e);
        }
    }
}
