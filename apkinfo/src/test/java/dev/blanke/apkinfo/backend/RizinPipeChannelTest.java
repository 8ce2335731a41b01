package dev.blanke.apkinfo.backend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the channel against shell scripts imitating the pipe protocol of rizin.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
final class RizinPipeChannelTest {

    @TempDir
    Path directory;

    private Path script(final String body) throws IOException {
        final var script = directory.resolve("rizin");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script;
    }

    @Test
    void testExecute() throws IOException {
        final var executable = script("""
            printf '\\0'
            while read -r command; do
                if [ "$command" = q ]; then
                    exit 0
                fi
                printf '[{"command":"%s","file":"%s"}]\\0' "$command" "$2"
            done
            """);

        try (final var channel = RizinPipeChannel.open(executable, directory.resolve("classes.dex"))) {
            assertEquals("[{\"command\":\"isj\",\"file\":\"" + directory.resolve("classes.dex") + "\"}]",
                channel.execute("isj"));
            assertEquals("[{\"command\":\"axtj @ 20\",\"file\":\"" + directory.resolve("classes.dex") + "\"}]",
                channel.execute("axtj @ 20"));
        }
    }

    @Test
    void testExecuteAfterClose() throws IOException {
        final var executable = script("""
            printf '\\0'
            while read -r command; do
                exit 0
            done
            """);

        final var channel = RizinPipeChannel.open(executable, directory.resolve("classes.dex"));
        channel.close();

        assertThrows(BackendFailureException.class, () -> channel.execute("isj"));
    }

    @Test
    void testTerminatedBackend() throws IOException {
        final var executable = script("""
            printf '\\0'
            read -r command
            exit 3
            """);

        try (final var channel = RizinPipeChannel.open(executable, directory.resolve("classes.dex"))) {
            final var exception = assertThrows(BackendFailureException.class, () -> channel.execute("aa"));
            assertTrue(exception.getMessage().contains("3"));
        }
    }

    @Test
    void testMissingPrompt() throws IOException {
        final var executable = script("exit 1\n");

        assertThrows(BackendFailureException.class,
            () -> RizinPipeChannel.open(executable, directory.resolve("classes.dex")));
    }

    @Test
    void testMissingExecutable() {
        assertThrows(BackendFailureException.class,
            () -> RizinPipeChannel.open(directory.resolve("missing"), directory.resolve("classes.dex")));
    }
}
