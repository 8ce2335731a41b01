package dev.blanke.apkinfo;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts the sub-images and the manifest out of an application package container.
 */
@FunctionalInterface
public interface PackageExtractor {

    /**
     * @param container The path of the application package.
     *
     * @return The extracted sub-images along with a reader for the extracted manifest.
     *
     * @throws IOException If reading the container or writing the extracted files fails.
     */
    PackageContents extract(Path container) throws IOException;
}
