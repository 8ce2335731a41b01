package dev.blanke.apkinfo.backend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.blanke.apkinfo.UnsupportedInputKindException;
import dev.blanke.apkinfo.util.Fixtures;
import dev.blanke.apkinfo.util.ScriptedChannel;

import static org.junit.jupiter.api.Assertions.*;

final class AnalysisSessionTest {

    @TempDir
    Path directory;

    @Nested
    final class Open {

        @Test
        void testOpenDex() throws IOException {
            final var channel = Fixtures.channel();
            final var session = AnalysisSession.open(1, Fixtures.dexFile(directory, "classes2.dex"),
                path -> new RizinBackend(channel));

            assertEquals(AnalysisSession.State.ANALYZED, session.getState());
            assertEquals(1, session.getSubImageIndex());
            assertEquals(List.of("aa"), channel.getCommands());
        }

        @Test
        void testOpenContainer() throws IOException {
            final var container = Files.write(directory.resolve("sample.apk"), new byte[] { 'P', 'K', 3, 4, 0 });
            final var factoryCalls = new AtomicInteger();

            final var exception = assertThrows(UnsupportedInputKindException.class,
                () -> AnalysisSession.open(0, container, path -> {
                    factoryCalls.incrementAndGet();
                    return new RizinBackend(new ScriptedChannel());
                }));
            assertEquals(container, exception.getPath());
            assertEquals(0, factoryCalls.get());
        }

        @Test
        void testOpenMissingFile() {
            assertThrows(UncheckedIOException.class, () -> AnalysisSession.open(0, directory.resolve("missing.dex"),
                path -> new RizinBackend(new ScriptedChannel())));
        }

        @Test
        void testOpenFailingAnalysis() throws IOException {
            final var channel = new ScriptedChannel().fail("aa");
            final var dex = Fixtures.dexFile(directory, "classes.dex");

            assertThrows(BackendFailureException.class,
                () -> AnalysisSession.open(0, dex, path -> new RizinBackend(channel)));
            assertTrue(channel.isClosed());
        }

        @Test
        void testOpenAnalysisThrowingUnexpectedly() throws IOException {
            final var channel = new ScriptedChannel().fail("aa", new IllegalStateException("unexpected reply"));
            final var dex = Fixtures.dexFile(directory, "classes.dex");

            assertThrows(IllegalStateException.class,
                () -> AnalysisSession.open(0, dex, path -> new RizinBackend(channel)));
            assertTrue(channel.isClosed());
        }
    }

    @Nested
    final class Queries {

        @Test
        void testQueryBeforeAnalysis() {
            final var session = new AnalysisSession(0, directory.resolve("classes.dex"),
                new RizinBackend(Fixtures.channel()));

            assertEquals(AnalysisSession.State.OPENED, session.getState());
            assertThrows(IllegalStateException.class, session::listSymbols);
        }

        @Test
        void testQueryAfterFailure() {
            final var channel = Fixtures.channel().fail("icj");
            final var session = new AnalysisSession(0, directory.resolve("classes.dex"), new RizinBackend(channel));
            session.analyze();

            assertThrows(BackendFailureException.class, session::listClasses);
            assertEquals(AnalysisSession.State.FAILED, session.getState());

            // The session must not talk to the backend anymore.
            assertThrows(BackendFailureException.class, session::listSymbols);
            assertEquals(0, channel.count("isj"));
        }

        @Test
        void testQueryAfterClose() {
            final var channel = Fixtures.channel();
            final var session = new AnalysisSession(0, directory.resolve("classes.dex"), new RizinBackend(channel));
            session.analyze();
            session.close();
            session.close();

            assertEquals(AnalysisSession.State.CLOSED, session.getState());
            assertTrue(channel.isClosed());
            assertThrows(IllegalStateException.class, () -> session.xrefsTo(Fixtures.SEND_ADDRESS));
        }

        @Test
        void testAnalyzeTwice() {
            final var session = new AnalysisSession(0, directory.resolve("classes.dex"),
                new RizinBackend(Fixtures.channel()));
            session.analyze();

            assertThrows(IllegalStateException.class, session::analyze);
        }
    }
}
