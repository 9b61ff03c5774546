package io.surfworks.songfolder.state.session;

/**
 * Receives user-facing notices from a {@link PlayerSession}.
 *
 * <p>Called on whichever session thread raised the notice; implementations must
 * return quickly and must not call back into the session synchronously.
 */
@FunctionalInterface
public interface SessionListener {

    void onNotice(SessionNotice notice);
}
