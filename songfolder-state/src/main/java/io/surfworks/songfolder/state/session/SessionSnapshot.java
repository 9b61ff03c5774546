package io.surfworks.songfolder.state.session;

import io.surfworks.songfolder.state.PlaybackMode;
import io.surfworks.songfolder.state.PlaylistEntry;
import io.surfworks.songfolder.state.lock.InstanceRole;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of a session for rendering, taken on the dispatch thread.
 *
 * @param role            this instance's role
 * @param degradedLock    true if locking failed and the role is read-only by default
 * @param folder          active folder key, or null if none is open
 * @param folderAvailable whether the active folder could be scanned
 * @param mode            ordering mode of the active playlist
 * @param loopEnabled     whether the active playlist loops
 * @param currentIndex    current display position
 * @param positionMs      stored position within the current track
 * @param entries         tracks in display order
 * @param volume          volume 0-100
 * @param zoomLevel       zoom 0.5-2.0
 * @param recentFolders   recent folders, most recent first
 * @param playing         whether the engine is playing
 */
public record SessionSnapshot(
    InstanceRole role,
    boolean degradedLock,
    String folder,
    boolean folderAvailable,
    PlaybackMode mode,
    boolean loopEnabled,
    int currentIndex,
    long positionMs,
    List<PlaylistEntry> entries,
    int volume,
    double zoomLevel,
    List<String> recentFolders,
    boolean playing
) {

    public SessionSnapshot {
        entries = List.copyOf(entries);
        recentFolders = List.copyOf(recentFolders);
    }

    public boolean readOnly() {
        return !role.canSave();
    }

    public Optional<PlaylistEntry> currentEntry() {
        return entries.stream().filter(PlaylistEntry::current).findFirst();
    }
}
