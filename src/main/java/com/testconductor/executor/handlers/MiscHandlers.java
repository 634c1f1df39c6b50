package com.testconductor.executor.handlers;

import com.testconductor.executor.ActionContext;
import com.testconductor.executor.ActionHandler;
import com.testconductor.executor.ActionResult;
import com.testconductor.executor.HandlesAction;
import com.testconductor.model.ActionType;
import com.testconductor.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

// ── SCREENSHOT ────────────────────────────────────────────────────────────────

/** Evidence only: a screenshot that cannot be saved skips rather than fails. */
@HandlesAction(ActionType.SCREENSHOT)
class ScreenshotHandler implements ActionHandler {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotHandler.class);

    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Screenshot step = ctx.getStep(Step.Screenshot.class);
        Optional<Path> saved = ctx.getScreenshots().capture(ctx.getPage(), step.getName(), step.isFullPage());
        if (saved.isEmpty()) {
            return ActionResult.skipped("Screenshot not saved");
        }
        log.info("ScreenshotHandler: saved {}", saved.get());
        return ActionResult.executed("Screenshot saved: " + saved.get(), saved.get().toString());
    }
}

// ── EVALUATE ──────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.EVALUATE)
class EvaluateHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Evaluate step = ctx.getStep(Step.Evaluate.class);
        try {
            Object value = ctx.getPage().evaluate(step.getScript());
            return ActionResult.executed("Script evaluated", value);
        } catch (RuntimeException e) {
            return ActionResult.failed("Script failed: " + e.getMessage(), e);
        }
    }
}

// ── HOVER ─────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.HOVER)
class HoverHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Hover step = ctx.getStep(Step.Hover.class);
        Duration timeout = DefaultTimeouts.orDefault(step.getTimeout(), DefaultTimeouts.INTERACTION_MS);
        try {
            ctx.getPage().hover(step.getSelector(), timeout);
            return ActionResult.executed("Hovered: " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not hover '" + step.getSelector() + "': " + e.getMessage(), e);
        }
    }
}

// ── PRESS ─────────────────────────────────────────────────────────────────────

@HandlesAction(ActionType.PRESS)
class PressHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        Step.Press step = ctx.getStep(Step.Press.class);
        try {
            ctx.getPage().press(step.getSelector(), step.getKey());
            return ActionResult.executed("Pressed " + step.getKey() + " on " + step.getSelector());
        } catch (RuntimeException e) {
            return ActionResult.failed("Could not press '" + step.getKey() + "': " + e.getMessage(), e);
        }
    }
}
