package io.surfworks.songfolder.state.session;

import io.surfworks.songfolder.state.StepResult;

/**
 * Result of applying one {@link PlayerEvent}.
 *
 * @param changed whether the application state was modified
 * @param step    outcome of a next/previous step, or null for other events
 * @param save    what the event did about persistence, or null if it did not ask
 */
public record EventResult(boolean changed, StepResult step, SaveOutcome save) {

    public static EventResult unchanged() {
        return new EventResult(false, null, null);
    }

    public static EventResult changed(SaveOutcome save) {
        return new EventResult(true, null, save);
    }

    public static EventResult stepped(StepResult step, SaveOutcome save) {
        return new EventResult(step.moved(), step, save);
    }
}
