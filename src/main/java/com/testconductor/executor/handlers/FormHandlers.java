package com.testconductor.executor.handlers;

import com.testconductor.executor.ActionContext;
import com.testconductor.executor.ActionHandler;
import com.testconductor.executor.ActionResult;
import com.testconductor.executor.HandlesAction;
import com.testconductor.model.ActionType;
import com.testconductor.model.Step;

import java.time.Duration;

// ── FILL ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.FILL)
class FillHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Fill step = ctx.getStep(Step.Fill.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().fill(step.getSelector(), step.getValue(), timeout);
            return ActionResult.executed("Filled: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not fill '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}

// ── SELECT ────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.SELECT)
class SelectHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Select step = ctx.getStep(Step.Select.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().selectOption(step.getSelector(), step.getValue(), timeout);
            return ActionResult.executed("Selected '" + step.getValue() + "' in " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not select '" + step.getValue() + "' in '" +
                step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}

// ── CHECK ─────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.CHECK)
class CheckHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Check step = ctx.getStep(Step.Check.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().check(step.getSelector(), timeout);
            return ActionResult.executed("Checked: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not check '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}

// ── UNCHECK ───────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.UNCHECK)
class UncheckHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Uncheck step = ctx.getStep(Step.Uncheck.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().uncheck(step.getSelector(), timeout);
            return ActionResult.executed("Unchecked: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not uncheck '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}

// ── TYPE ──────────────────────────────────────────────────────────────────────

/** Key-by-key typing for inputs that react to individual key events. */
@HandlesAction(ActionType.TYPE)
class TypeHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Type step = ctx.getStep(Step.Type.class);
        long delay = step.getDelay() != null ? step.getDelay() : DefaultTimeouts.TYPE_DELAY_MS;
        try {
            ctx.getPage().type(step.getSelector(), step.getText(), delay);
            return ActionResult.executed("Typed " + step.getText().length() + " chars into " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not type into '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}
