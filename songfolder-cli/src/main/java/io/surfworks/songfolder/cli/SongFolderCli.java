package io.surfworks.songfolder.cli;

import io.surfworks.songfolder.media.SilentPlaybackEngine;
import io.surfworks.songfolder.state.config.SongFolderConfig;
import io.surfworks.songfolder.state.config.SongFolderConfigLoader;
import io.surfworks.songfolder.state.session.PlayerSession;
import io.surfworks.songfolder.state.session.SaveOutcome;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SongFolder CLI - headless front end for per-folder playlists.
 *
 * <p>Each invocation starts a session (taking the writer role if no other instance
 * holds it), reopens the most recent folder, runs one command and saves on exit.
 * {@code shell} keeps the session open and reads commands from standard input.
 *
 * <p>Global options:
 * <ul>
 *   <li>--json - Output as JSON</li>
 *   <li>--state-dir &lt;dir&gt; - Use another state directory</li>
 *   <li>--track-length &lt;seconds&gt; - Length reported by the silent engine</li>
 *   <li>--verbose - Log lifecycle detail to stderr</li>
 * </ul>
 */
public class SongFolderCli {

    private static final String VERSION = "0.1.0";

    /** Parent of every project logger; held here so a level set on it is not lost */
    static final Logger APP_LOGGER = Logger.getLogger("io.surfworks.songfolder");

    /** Tick of the simulated playback clock in shell mode */
    private static final long CLOCK_TICK_MS = 250;

    public static void main(String[] args) {
        configureLogging();
        int exitCode = run(args, System.in, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Run the CLI.
     *
     * @return the process exit code
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (options.command().isEmpty() || options.command().get(0).equals("--help")
                || options.command().get(0).equals("-h")) {
            printHelp(out);
            return 0;
        }
        String command = options.command().get(0);
        if (command.equals("--version") || command.equals("-v")) {
            out.println("songfolder " + VERSION);
            return 0;
        }
        if (options.verbose()) {
            APP_LOGGER.setLevel(Level.FINE);
        }

        SongFolderConfig config = options.stateDir() != null
                ? SongFolderConfigLoader.load(options.stateDir())
                : SongFolderConfigLoader.load();
        SilentPlaybackEngine engine = new SilentPlaybackEngine(options.trackLengthMs());

        PlayerSession session = PlayerSession.create(config, engine);
        session.addListener(notice -> err.println("[" + notice.kind() + "] " + notice.message()));
        try {
            session.start(true);
            CommandInterpreter interpreter = new CommandInterpreter(session, out, options.json());
            if (command.equals("shell")) {
                runShell(interpreter, session, engine, in, out, err);
            } else {
                interpreter.execute(options.command());
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } finally {
            session.close();
        }

        if (session.finalSave() == SaveOutcome.FAILED) {
            err.println("Error: state could not be saved");
            return 1;
        }
        return 0;
    }

    private static void runShell(CommandInterpreter interpreter, PlayerSession session,
                                 SilentPlaybackEngine engine, InputStream in,
                                 PrintStream out, PrintStream err) throws IOException {
        ScheduledExecutorService clock = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "songfolder-clock");
            t.setDaemon(true);
            return t;
        });
        clock.scheduleAtFixedRate(() -> engine.advance(CLOCK_TICK_MS),
                CLOCK_TICK_MS, CLOCK_TICK_MS, TimeUnit.MILLISECONDS);

        String prompt = session.lock().isWriter() ? "songfolder> " : "songfolder [read-only]> ";
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            interpreter.printStatus();
            while (true) {
                out.print(prompt);
                out.flush();
                String line = reader.readLine();
                if (line == null) {
                    out.println();
                    return;
                }
                try {
                    List<String> tokens = CommandInterpreter.tokenize(line);
                    if (!tokens.isEmpty() && tokens.get(0).equals("shell")) {
                        err.println("Already in the shell.");
                        continue;
                    }
                    if (!interpreter.execute(tokens)) {
                        return;
                    }
                } catch (IllegalArgumentException e) {
                    err.println("Error: " + e.getMessage());
                }
            }
        } finally {
            clock.shutdownNow();
        }
    }

    /**
     * Install {@code logging.properties} from the classpath unless the user
     * configured logging explicitly.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = SongFolderCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not configure logging: " + e.getMessage());
        }
    }

    // ===== Help output =====

    private static void printHelp(PrintStream out) {
        out.println("SongFolder - Per-folder playlists that remember where you were");
        out.println();
        out.println("Usage: songfolder [options] <command> [args]");
        out.println();
        CommandInterpreter.printCommands(out);
        out.println();
        out.println("Options:");
        out.println("  --json                    Output as JSON");
        out.println("  --state-dir <dir>         State directory (default: $SONGFOLDER_HOME,");
        out.println("                            $XDG_CONFIG_HOME/songfolder or ~/.config/songfolder)");
        out.println("  --track-length <seconds>  Track length for the silent engine (default: unknown)");
        out.println("  --verbose                 Log lifecycle detail");
        out.println("  -h, --help                Show help");
        out.println("  -v, --version             Show version");
        out.println();
        out.println("Examples:");
        out.println("  songfolder open ~/Music/Album");
        out.println("  songfolder shuffle on");
        out.println("  songfolder list --filter live");
        out.println("  songfolder --json status");
    }

    /**
     * Parsed global options and the remaining command tokens.
     */
    record Options(boolean json, boolean verbose, Path stateDir, long trackLengthMs, List<String> command) {

        static Options parse(String[] args) {
            boolean json = false;
            boolean verbose = false;
            Path stateDir = null;
            long trackLengthMs = -1;
            List<String> command = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--json" -> json = true;
                    case "--verbose" -> verbose = true;
                    case "--state-dir" -> stateDir = Path.of(requireValue(args, i++));
                    case "--track-length" -> {
                        String value = requireValue(args, i++);
                        try {
                            trackLengthMs = Long.parseLong(value) * 1000;
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid --track-length: " + value);
                        }
                    }
                    default -> command.add(args[i]);
                }
            }
            return new Options(json, verbose, stateDir, trackLengthMs, List.copyOf(command));
        }

        private static String requireValue(String[] args, int flagIndex) {
            if (flagIndex + 1 >= args.length) {
                throw new IllegalArgumentException(args[flagIndex] + " requires a value");
            }
            return args[flagIndex + 1];
        }
    }
}
