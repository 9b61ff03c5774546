package io.surfworks.songfolder.state.session;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything that can happen to a player session, from the interface layer, the
 * playback engine or the autosave timer. Events are applied one at a time in
 * arrival order by {@link PlayerSession}.
 */
public sealed interface PlayerEvent permits
    PlayerEvent.OpenFolder, PlayerEvent.SelectTrack, PlayerEvent.UpdatePosition,
    PlayerEvent.SetShuffle, PlayerEvent.Reshuffle, PlayerEvent.ToggleLoop,
    PlayerEvent.Next, PlayerEvent.Previous, PlayerEvent.EndOfTrack,
    PlayerEvent.SetVolume, PlayerEvent.AdjustVolume, PlayerEvent.Zoom,
    PlayerEvent.TogglePause, PlayerEvent.SeekRelative, PlayerEvent.RestartTrack,
    PlayerEvent.ForgetFolder, PlayerEvent.AutosaveTick {

    /**
     * Open a folder and make it the active playlist.
     */
    record OpenFolder(Path folder) implements PlayerEvent {
        public OpenFolder {
            Objects.requireNonNull(folder, "folder cannot be null");
        }
    }

    /**
     * The user picked the track at a display position.
     */
    record SelectTrack(int displayPosition) implements PlayerEvent {
    }

    /**
     * The playback engine reported a new position within the current track.
     */
    record UpdatePosition(long positionMs) implements PlayerEvent {
        public UpdatePosition {
            if (positionMs < 0) {
                throw new IllegalArgumentException("positionMs cannot be negative: " + positionMs);
            }
        }
    }

    record SetShuffle(boolean enabled) implements PlayerEvent {
    }

    record Reshuffle() implements PlayerEvent {
    }

    record ToggleLoop() implements PlayerEvent {
    }

    record Next() implements PlayerEvent {
    }

    record Previous() implements PlayerEvent {
    }

    /**
     * The playback engine finished the current track.
     */
    record EndOfTrack() implements PlayerEvent {
    }

    record SetVolume(int volume) implements PlayerEvent {
    }

    record AdjustVolume(int delta) implements PlayerEvent {
    }

    record Zoom(ZoomChange change) implements PlayerEvent {
        public Zoom {
            Objects.requireNonNull(change, "change cannot be null");
        }
    }

    enum ZoomChange {
        IN, OUT, RESET
    }

    record TogglePause() implements PlayerEvent {
    }

    /**
     * Seek forward (positive) or backward (negative) within the current track.
     */
    record SeekRelative(int seconds) implements PlayerEvent {
    }

    record RestartTrack() implements PlayerEvent {
    }

    /**
     * Remove a folder from the recent list. Its playlist state is kept.
     */
    record ForgetFolder(Path folder) implements PlayerEvent {
        public ForgetFolder {
            Objects.requireNonNull(folder, "folder cannot be null");
        }
    }

    /**
     * Periodic timer tick: capture the engine position and save if dirty.
     */
    record AutosaveTick() implements PlayerEvent {
    }
}
