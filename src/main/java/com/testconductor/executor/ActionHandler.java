package com.testconductor.executor;

/**
 * Performs one kind of {@link com.testconductor.model.Step} against a page.
 *
 * <h3>Registration</h3>
 * Implementations must be annotated with {@link HandlesAction}, have a no-arg
 * constructor and live in {@code com.testconductor.executor.handlers}; the
 * {@link ActionHandlerRegistry} finds them at startup.
 *
 * <h3>Implementation rules</h3>
 * <ul>
 *   <li>Never throw -- catch and return {@link ActionResult#failed}</li>
 *   <li>Apply the action's default timeout when the step gives none</li>
 *   <li>Be stateless -- one instance serves every task thread</li>
 * </ul>
 */
public interface ActionHandler {
    ActionResult execute(ActionContext context);
}
