package dev.blanke.apkinfo;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Distinguishes the kinds of input files from which methods can be extracted.
 * <p>
 * {@link InputType#determine(Path)} can be used to retrieve the correct {@code InputType} for the input file located
 * at the provided path.
 */
public enum InputType {

    /**
     * A single Dalvik executable, which is analyzed directly as the only sub-image.
     */
    DEX {
        @Override
        PackageContents contentsOf(final Path input, final @Nullable PackageExtractor extractor) {
            return new PackageContents(List.of(input), null);
        }
    },

    /**
     * An application package whose sub-images and manifest have to be extracted first.
     */
    APK {
        @Override
        PackageContents contentsOf(final Path input, final @Nullable PackageExtractor extractor) throws IOException {
            if (extractor == null)
                throw new UnsupportedInputKindException(input, "no package extractor is available for containers");
            return extractor.extract(input);
        }
    };

    private static final int DEX_MAGIC = 0x6465780A; // "dex\n"

    private static final int ZIP_MAGIC = 0x504B0304; // "PK\3\4"

    /**
     * Determines the sub-images, and the manifest if there is one, making up the provided {@code input}.
     *
     * @param input The path of the input file, which must be of this {@code InputType}.
     *
     * @param extractor Extracts containers. May be {@code null} if containers are not supported by the caller.
     *
     * @throws IOException If reading the input or extracting its contents fails.
     */
    abstract PackageContents contentsOf(Path input, @Nullable PackageExtractor extractor) throws IOException;

    /**
     * Determines the correct {@code InputType} to be used for the file located at the provided {@code path} by checking
     * its magic number.
     *
     * @param path Path of the file that should be analyzed.
     *
     * @return The {@code InputType} of the file at the {@code path}.
     *
     * @throws IOException If reading the file located at the {@code path} fails.
     *
     * @throws UnsupportedInputKindException If the file is neither a DEX file nor a ZIP-based application package.
     */
    public static InputType determine(final Path path) throws IOException {
        try (final var inputStream = new DataInputStream(Files.newInputStream(path))) {
            return switch (inputStream.readInt()) {
                case DEX_MAGIC -> DEX;
                case ZIP_MAGIC -> APK;
                default -> throw new UnsupportedInputKindException(path, "unknown magic number");
            };
        } catch (final EOFException exception) {
            throw new UnsupportedInputKindException(path, "file is too short");
        }
    }

    /**
     * Determines the {@code InputType} of the provided {@code input} and unpacks it into its sub-images.
     *
     * @see #determine(Path)
     */
    public static PackageContents unpack(final Path input,
                                         final @Nullable PackageExtractor extractor) throws IOException {
        return determine(input).contentsOf(input, extractor);
    }
}
