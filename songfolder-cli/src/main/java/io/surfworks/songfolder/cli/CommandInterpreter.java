package io.surfworks.songfolder.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.songfolder.state.PlaylistEntry;
import io.surfworks.songfolder.state.StepResult;
import io.surfworks.songfolder.state.session.EventResult;
import io.surfworks.songfolder.state.session.PlayerEvent;
import io.surfworks.songfolder.state.session.PlayerSession;
import io.surfworks.songfolder.state.session.SessionSnapshot;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one CLI command against a started {@link PlayerSession} and renders the
 * result as text or JSON.
 */
final class CommandInterpreter {

    static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final PlayerSession session;
    private final PrintStream out;
    private final boolean json;

    CommandInterpreter(PlayerSession session, PrintStream out, boolean json) {
        this.session = session;
        this.out = out;
        this.json = json;
    }

    /**
     * Execute a tokenized command line.
     *
     * @return false if the command asks to leave the shell
     * @throws IllegalArgumentException for unknown commands and bad arguments
     * @throws IOException if JSON output fails
     */
    boolean execute(List<String> tokens) throws IOException {
        if (tokens.isEmpty()) {
            return true;
        }
        String command = tokens.get(0);
        List<String> args = tokens.subList(1, tokens.size());

        switch (command) {
            case "status" -> printStatus();
            case "open" -> handleOpen(args);
            case "play" -> handlePlay(args);
            case "pause" -> handlePause();
            case "next" -> printStep(session.send(new PlayerEvent.Next()));
            case "prev", "previous" -> printStep(session.send(new PlayerEvent.Previous()));
            case "shuffle" -> handleShuffle(args);
            case "reshuffle" -> handleReshuffle();
            case "loop" -> handleLoop();
            case "list" -> handleList(args);
            case "recent" -> handleRecent();
            case "forget" -> handleForget(args);
            case "volume" -> handleVolume(args);
            case "zoom" -> handleZoom(args);
            case "seek" -> handleSeek(args);
            case "restart" -> {
                session.send(new PlayerEvent.RestartTrack());
                printStatus();
            }
            case "help" -> printCommands(out);
            case "quit", "exit" -> {
                return false;
            }
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        }
        return true;
    }

    private void handleOpen(List<String> args) throws IOException {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Usage: open <folder>");
        }
        session.send(new PlayerEvent.OpenFolder(Path.of(args.get(0))));
        printStatus();
    }

    private void handlePlay(List<String> args) throws IOException {
        if (args.isEmpty()) {
            if (!session.snapshot().playing()) {
                session.send(new PlayerEvent.TogglePause());
            }
        } else {
            int number = parseInt(args.get(0), "track number");
            session.send(new PlayerEvent.SelectTrack(number - 1));
            if (!session.snapshot().playing()) {
                session.send(new PlayerEvent.TogglePause());
            }
        }
        printStatus();
    }

    private void handlePause() throws IOException {
        if (session.snapshot().playing()) {
            session.send(new PlayerEvent.TogglePause());
        }
        printStatus();
    }

    private void handleShuffle(List<String> args) throws IOException {
        if (args.size() != 1 || !(args.get(0).equals("on") || args.get(0).equals("off"))) {
            throw new IllegalArgumentException("Usage: shuffle on|off");
        }
        session.send(new PlayerEvent.SetShuffle(args.get(0).equals("on")));
        printStatus();
    }

    private void handleReshuffle() throws IOException {
        EventResult result = session.send(new PlayerEvent.Reshuffle());
        if (!result.changed() && !json) {
            out.println("Reshuffle only applies in shuffle mode.");
            return;
        }
        printStatus();
    }

    private void handleLoop() throws IOException {
        session.send(new PlayerEvent.ToggleLoop());
        printStatus();
    }

    private void handleList(List<String> args) throws IOException {
        String filter = flagValue(args, "--filter");
        List<PlaylistEntry> entries = filter != null ? session.filter(filter) : session.snapshot().entries();

        if (json) {
            List<TrackView> tracks = new ArrayList<>();
            for (PlaylistEntry entry : entries) {
                tracks.add(TrackView.of(entry));
            }
            out.println(JSON.writeValueAsString(tracks));
            return;
        }
        if (entries.isEmpty()) {
            out.println(filter != null ? "No tracks match '" + filter + "'." : "No tracks.");
            return;
        }
        for (PlaylistEntry entry : entries) {
            out.printf("%s%4d  %s%n", entry.current() ? ">" : " ", entry.displayPosition() + 1, entry.name());
        }
    }

    private void handleRecent() throws IOException {
        List<String> recent = session.snapshot().recentFolders();
        if (json) {
            out.println(JSON.writeValueAsString(recent));
            return;
        }
        if (recent.isEmpty()) {
            out.println("No recent folders.");
            return;
        }
        for (int i = 0; i < recent.size(); i++) {
            out.printf("%2d  %s%n", i + 1, recent.get(i));
        }
    }

    private void handleForget(List<String> args) throws IOException {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Usage: forget <folder>");
        }
        EventResult result = session.send(new PlayerEvent.ForgetFolder(Path.of(args.get(0))));
        if (json) {
            out.println(JSON.writeValueAsString(new ForgetView(args.get(0), result.changed())));
        } else {
            out.println(result.changed() ? "Forgot " + args.get(0) : args.get(0) + " is not a recent folder.");
        }
    }

    private void handleVolume(List<String> args) throws IOException {
        if (args.size() > 1) {
            throw new IllegalArgumentException("Usage: volume [<0-100>|+<n>|-<n>]");
        }
        if (args.size() == 1) {
            String value = args.get(0);
            int amount = parseInt(value, "volume");
            if (value.startsWith("+") || value.startsWith("-")) {
                session.send(new PlayerEvent.AdjustVolume(amount));
            } else {
                session.send(new PlayerEvent.SetVolume(amount));
            }
        }
        printStatus();
    }

    private void handleZoom(List<String> args) throws IOException {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Usage: zoom in|out|reset");
        }
        PlayerEvent.ZoomChange change = switch (args.get(0)) {
            case "in" -> PlayerEvent.ZoomChange.IN;
            case "out" -> PlayerEvent.ZoomChange.OUT;
            case "reset" -> PlayerEvent.ZoomChange.RESET;
            default -> throw new IllegalArgumentException("Usage: zoom in|out|reset");
        };
        session.send(new PlayerEvent.Zoom(change));
        printStatus();
    }

    private void handleSeek(List<String> args) throws IOException {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Usage: seek <+/-seconds>");
        }
        session.send(new PlayerEvent.SeekRelative(parseInt(args.get(0), "seconds")));
        printStatus();
    }

    // ===== Rendering =====

    void printStatus() throws IOException {
        SessionSnapshot snapshot = session.snapshot();
        if (json) {
            out.println(JSON.writeValueAsString(StatusView.of(snapshot)));
            return;
        }
        out.println("SongFolder" + (snapshot.readOnly() ? " [READ-ONLY]" : ""));
        out.println("-".repeat(40));
        if (snapshot.folder() == null) {
            out.println("Folder:   (none)");
        } else {
            out.println("Folder:   " + snapshot.folder() + (snapshot.folderAvailable() ? "" : " (not found)"));
            out.println("Mode:     " + snapshot.mode().name().toLowerCase(Locale.ROOT)
                    + ", loop " + (snapshot.loopEnabled() ? "on" : "off"));
            snapshot.currentEntry().ifPresentOrElse(
                    entry -> out.println("Track:    " + (entry.displayPosition() + 1) + "/"
                            + snapshot.entries().size() + "  " + entry.name()),
                    () -> out.println("Track:    (no tracks)"));
            out.println("Position: " + formatPosition(snapshot.positionMs()));
            out.println("State:    " + (snapshot.playing() ? "playing" : "paused"));
        }
        out.println("Volume:   " + snapshot.volume());
        out.println("Zoom:     " + Math.round(snapshot.zoomLevel() * 100) + "%");
    }

    private void printStep(EventResult result) throws IOException {
        if (json || result.step() == null || result.step().moved()) {
            printStatus();
            return;
        }
        StepResult step = result.step();
        out.println(switch (step) {
            case END_OF_PLAYLIST -> "End of playlist.";
            case EMPTY -> "No tracks.";
            default -> step.name();
        });
    }

    static String formatPosition(long positionMs) {
        long seconds = Math.max(0, positionMs) / 1000;
        if (seconds < 3600) {
            return String.format("%d:%02d", seconds / 60, seconds % 60);
        }
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    static void printCommands(PrintStream out) {
        out.println("Commands:");
        out.println("  status                 Show the active folder and player state");
        out.println("  open <folder>          Open a folder as the active playlist");
        out.println("  play [<n>]             Play, or jump to track n");
        out.println("  pause                  Pause playback");
        out.println("  next, prev             Step through the playlist");
        out.println("  shuffle on|off         Switch shuffle mode");
        out.println("  reshuffle              New shuffle order");
        out.println("  loop                   Toggle looping");
        out.println("  list [--filter <text>] List tracks in play order");
        out.println("  recent                 List recently opened folders");
        out.println("  forget <folder>        Remove a folder from the recent list");
        out.println("  volume [<n>|+n|-n]     Show or change the volume");
        out.println("  zoom in|out|reset      Change the zoom level");
        out.println("  seek <+/-seconds>      Seek within the current track");
        out.println("  restart                Restart the current track");
        out.println("  shell                  Interactive session");
    }

    // ===== Argument helpers =====

    private static int parseInt(String value, String what) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
    }

    static String flagValue(List<String> args, String flag) {
        int index = args.indexOf(flag);
        if (index >= 0 && index < args.size() - 1) {
            return args.get(index + 1);
        }
        return null;
    }

    /**
     * Split a shell line on whitespace, honouring single and double quotes.
     */
    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote");
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    // ===== Response records for JSON output =====

    record StatusView(
            String role,
            boolean readOnly,
            String folder,
            boolean folderAvailable,
            String mode,
            boolean loopEnabled,
            int trackCount,
            Integer currentTrack,
            String currentName,
            long positionMs,
            boolean playing,
            int volume,
            double zoomLevel
    ) {
        static StatusView of(SessionSnapshot snapshot) {
            PlaylistEntry current = snapshot.currentEntry().orElse(null);
            return new StatusView(
                    snapshot.role().name(),
                    snapshot.readOnly(),
                    snapshot.folder(),
                    snapshot.folderAvailable(),
                    snapshot.mode().name(),
                    snapshot.loopEnabled(),
                    snapshot.entries().size(),
                    current != null ? current.displayPosition() + 1 : null,
                    current != null ? current.name() : null,
                    snapshot.positionMs(),
                    snapshot.playing(),
                    snapshot.volume(),
                    snapshot.zoomLevel());
        }
    }

    record TrackView(int number, String name, boolean current) {
        static TrackView of(PlaylistEntry entry) {
            return new TrackView(entry.displayPosition() + 1, entry.name(), entry.current());
        }
    }

    record ForgetView(String folder, boolean forgotten) {}
}
