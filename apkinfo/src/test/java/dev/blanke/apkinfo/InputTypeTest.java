package dev.blanke.apkinfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.blanke.apkinfo.util.Fixtures;

import static org.junit.jupiter.api.Assertions.*;

final class InputTypeTest {

    @TempDir
    Path directory;

    @Test
    void testDetermineDex() throws IOException {
        assertEquals(InputType.DEX, InputType.determine(Fixtures.dexFile(directory, "classes.dex")));
    }

    @Test
    void testDetermineApk() throws IOException {
        final var apk = Files.write(directory.resolve("sample.apk"), new byte[] { 'P', 'K', 3, 4, 20, 0 });

        assertEquals(InputType.APK, InputType.determine(apk));
    }

    @Test
    void testDetermineUnknown() throws IOException {
        final var elf = Files.write(directory.resolve("libnative.so"), new byte[] { 0x7F, 'E', 'L', 'F', 2, 1 });

        assertThrows(UnsupportedInputKindException.class, () -> InputType.determine(elf));
    }

    @Test
    void testDetermineTooShort() throws IOException {
        final var empty = Files.write(directory.resolve("empty.dex"), new byte[] { 'd', 'e' });

        assertThrows(UnsupportedInputKindException.class, () -> InputType.determine(empty));
    }

    @Test
    void testUnpackDex() throws IOException {
        final var dex = Fixtures.dexFile(directory, "classes.dex");

        final var contents = InputType.unpack(dex, null);
        assertEquals(List.of(dex), contents.subImages());
        assertNull(contents.manifest());
    }

    @Test
    void testUnpackApk() throws IOException {
        final var apk = Files.write(directory.resolve("sample.apk"), new byte[] { 'P', 'K', 3, 4, 20, 0 });
        final var first  = Fixtures.dexFile(directory, "classes.dex");
        final var second = Fixtures.dexFile(directory, "classes2.dex");

        final var contents = InputType.unpack(apk,
            container -> new PackageContents(List.of(first, second), () -> Set.of("android.permission.SEND_SMS")));
        assertEquals(List.of(first, second), contents.subImages());
        assertNotNull(contents.manifest());
        assertEquals(Set.of("android.permission.SEND_SMS"), contents.manifest().permissions());
    }

    @Test
    void testUnpackApkWithoutExtractor() throws IOException {
        final var apk = Files.write(directory.resolve("sample.apk"), new byte[] { 'P', 'K', 3, 4, 20, 0 });

        assertThrows(UnsupportedInputKindException.class, () -> InputType.unpack(apk, null));
    }
}
