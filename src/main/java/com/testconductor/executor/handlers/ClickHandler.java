package com.testconductor.executor.handlers;

import com.testconductor.executor.ActionContext;
import com.testconductor.executor.ActionHandler;
import com.testconductor.executor.ActionResult;
import com.testconductor.executor.HandlesAction;
import com.testconductor.model.ActionType;
import com.testconductor.model.Step;

import java.time.Duration;

@HandlesAction(ActionType.CLICK)
class ClickHandler implements ActionHandler {

    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Click step = ctx.getStep(Step.Click.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().click(step.getSelector(), timeout);
            return ActionResult.executed("Clicked element: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not click '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}
