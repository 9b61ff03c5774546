package io.surfworks.songfolder.state;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Most-recent-first list of opened folders, unique and bounded.
 *
 * <p>Evicting a folder from this list does not touch its {@link PlaylistState}.
 */
public final class RecentFolders implements Iterable<String> {

    /** Maximum number of folders remembered */
    public static final int MAX_SIZE = 10;

    private final List<String> folders = new ArrayList<>(MAX_SIZE + 1);

    public RecentFolders() {
    }

    /**
     * Build a list from stored entries, dropping blanks and duplicates and
     * trimming to {@link #MAX_SIZE}. Earlier entries win.
     */
    public static RecentFolders of(List<String> entries) {
        RecentFolders recent = new RecentFolders();
        for (String entry : entries) {
            if (recent.folders.size() == MAX_SIZE) {
                break;
            }
            if (entry != null && !entry.isBlank() && !recent.folders.contains(entry)) {
                recent.folders.add(entry);
            }
        }
        return recent;
    }

    /**
     * Move a folder to the front, inserting it if absent.
     *
     * @return true if the list changed
     */
    public boolean add(String folder) {
        if (folder == null || folder.isBlank()) {
            throw new IllegalArgumentException("folder cannot be blank");
        }
        if (!folders.isEmpty() && folders.get(0).equals(folder)) {
            return false;
        }
        folders.remove(folder);
        folders.add(0, folder);
        while (folders.size() > MAX_SIZE) {
            folders.remove(folders.size() - 1);
        }
        return true;
    }

    /**
     * Forget a folder.
     *
     * @return true if it was present
     */
    public boolean remove(String folder) {
        return folders.remove(folder);
    }

    public boolean contains(String folder) {
        return folders.contains(folder);
    }

    public Optional<String> mostRecent() {
        return folders.isEmpty() ? Optional.empty() : Optional.of(folders.get(0));
    }

    public int size() {
        return folders.size();
    }

    public boolean isEmpty() {
        return folders.isEmpty();
    }

    /**
     * Snapshot of the entries, most recent first.
     */
    public List<String> asList() {
        return List.copyOf(folders);
    }

    @Override
    public Iterator<String> iterator() {
        return asList().iterator();
    }

    public RecentFolders copy() {
        RecentFolders copy = new RecentFolders();
        copy.folders.addAll(folders);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RecentFolders && folders.equals(((RecentFolders) o).folders));
    }

    @Override
    public int hashCode() {
        return folders.hashCode();
    }

    @Override
    public String toString() {
        return folders.toString();
    }
}
