package dev.blanke.apkinfo;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.ProviderNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.zip.ZipException;

/**
 * A {@link PackageExtractor} copying the DEX files at the root of a ZIP-based application package into a directory.
 * <p>
 * The binary manifest is not decoded, so the returned {@link PackageContents} carry no {@link ManifestReader} and
 * report no permissions.
 */
public final class ZipPackageExtractor implements PackageExtractor {

    private static final Logger LOGGER = System.getLogger(ZipPackageExtractor.class.getName());

    /**
     * Matches {@code classes.dex}, {@code classes2.dex}, and so on, capturing the number of the sub-image.
     */
    private static final Pattern SUB_IMAGE_NAME = Pattern.compile("classes(\\d{0,4})\\.dex");

    private final Path outputDirectory;

    /**
     * @param outputDirectory The directory below which the sub-images of each container are extracted. Each container
     *                        gets a fresh subdirectory.
     */
    public ZipPackageExtractor(final Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory);
    }

    /**
     * @throws UnsupportedInputKindException If the {@code container} is not a valid ZIP file or contains no DEX file.
     */
    @Override
    public PackageContents extract(final Path container) throws IOException {
        try (final var fileSystem = FileSystems.newFileSystem(container)) {
            final List<Path> entries;
            try (final var rootEntries = Files.list(fileSystem.getPath("/"))) {
                entries = rootEntries
                    .filter(entry -> subImageNumber(entry) > 0)
                    .sorted(Comparator.comparingInt(ZipPackageExtractor::subImageNumber))
                    .collect(Collectors.toList());
            }
            if (entries.isEmpty())
                throw new UnsupportedInputKindException(container, "package contains no DEX files");

            final var targetDirectory = Files.createTempDirectory(outputDirectory, baseName(container) + "-");
            final var subImages = new ArrayList<Path>(entries.size());
            for (final var entry : entries) {
                subImages.add(Files.copy(entry, targetDirectory.resolve(entry.getFileName().toString())));
            }
            LOGGER.log(Level.DEBUG, "Extracted {0} sub-images of {1} to {2}", subImages.size(), container,
                targetDirectory);
            return new PackageContents(subImages, null);
        } catch (final ZipException | ProviderNotFoundException exception) {
            // The ZIP provider rejects corrupt archives not named *.zip or *.jar as ProviderNotFoundException.
            LOGGER.log(Level.DEBUG, "Cannot open " + container + " as ZIP archive", exception);
            throw new UnsupportedInputKindException(container, "not a valid ZIP archive");
        }
    }

    /**
     * @return The 1-based number of the sub-image stored at {@code entry}, or {@code 0} if the entry is no sub-image.
     */
    private static int subImageNumber(final Path entry) {
        final var fileName = entry.getFileName();
        if (fileName == null)
            return 0;
        final Matcher matcher = SUB_IMAGE_NAME.matcher(fileName.toString());
        if (!matcher.matches())
            return 0;
        return matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
    }

    private static String baseName(final Path container) {
        final var fileName = container.getFileName().toString();
        final int extension = fileName.lastIndexOf('.');
        return (extension > 0) ? fileName.substring(0, extension) : fileName;
    }
}
