package io.surfworks.songfolder.state.lock;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Child process for {@link FileLockCoordinatorTest}: takes the lock, prints its
 * role, and holds the lock until a line arrives on stdin.
 */
public final class LockHolderProcess {

    private LockHolderProcess() {
    }

    public static void main(String[] args) throws IOException {
        try (FileLockCoordinator coordinator = new FileLockCoordinator(Path.of(args[0]))) {
            System.out.println(coordinator.acquire().role());
            System.out.flush();
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
        }
    }
}
