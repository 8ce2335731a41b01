package dev.blanke.apkinfo.table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.blanke.apkinfo.backend.AnalysisSession;
import dev.blanke.apkinfo.backend.BackendFailureException;
import dev.blanke.apkinfo.backend.RizinBackend;
import dev.blanke.apkinfo.model.BackendHandle;
import dev.blanke.apkinfo.util.ScriptedChannel;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.apkinfo.util.Fixtures.*;

final class MethodTableBuilderTest {

    private ScriptedChannel channel;

    private MethodTableBuilder builder;

    @BeforeEach
    void setUp(@TempDir final Path directory) throws IOException {
        channel = channel();
        final var session = AnalysisSession.open(0, dexFile(directory, "classes.dex"),
            path -> new RizinBackend(channel));
        builder = new MethodTableBuilder(index -> session);
    }

    @Test
    void testBuildGroupsByClass() {
        final var table = builder.build(0);

        assertEquals(0, table.getSubImageIndex());
        assertEquals(Set.of("Lcom/example/google/service/WebServiceCalling;", "Landroid/telephony/SmsManager;",
            "Ljava/util/concurrent/FutureTask;"), table.classes());
        assertEquals(Set.of(REQUEST, SEND), table.methods("Lcom/example/google/service/WebServiceCalling;"));
        assertEquals(Set.of(SEND_TEXT_MESSAGE), table.methods("Landroid/telephony/SmsManager;"));
        assertTrue(table.methods("Lcom/example/Unknown;").isEmpty());
    }

    @Test
    void testBuildCollapsesDuplicates() {
        final var table = builder.build(0);

        assertEquals(4, table.size());
        assertEquals(4, table.allMethods().count());
    }

    @Test
    void testBuildKeepsHandles() {
        final var table = builder.build(0);

        final var request = table.canonical(REQUEST);
        assertNotNull(request);
        assertEquals(new BackendHandle(0, REQUEST_ADDRESS, false), request.handle());

        final var sendTextMessage = table.canonical(SEND_TEXT_MESSAGE);
        assertNotNull(sendTextMessage);
        assertTrue(sendTextMessage.isImported());
    }

    @Test
    void testBuildIsMemoized() {
        final var first  = builder.build(0);
        final var second = builder.build(0);

        assertSame(first, second);
        assertEquals(1, channel.count("isj"));
    }

    @Test
    void testBuildConcurrently() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final var futures = IntStream.range(0, 8)
                .mapToObj(attempt -> CompletableFuture.supplyAsync(() -> builder.build(0), executor))
                .toList();
            final var first = futures.get(0).get();
            for (final var future : futures) {
                assertSame(first, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testInvalidate() {
        final var first = builder.build(0);
        builder.invalidate(0);
        final var second = builder.build(0);

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(2, channel.count("isj"));
    }

    @Test
    void testBuildFailure() {
        channel.fail("isj");

        assertThrows(BackendFailureException.class, () -> builder.build(0));
    }
}
