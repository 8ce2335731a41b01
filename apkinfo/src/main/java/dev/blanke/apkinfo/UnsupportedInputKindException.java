package dev.blanke.apkinfo;

import java.nio.file.Path;

/**
 * An {@code UnsupportedInputKindException} is thrown if an input file is neither a recognized sub-image nor a
 * recognized container of sub-images.
 *
 * @implNote Cannot be a checked {@link Exception}, as analysis sessions are created from within
 *           {@link java.util.concurrent.ConcurrentHashMap#computeIfAbsent} callbacks.
 */
public final class UnsupportedInputKindException extends RuntimeException {

    private final Path path;

    public UnsupportedInputKindException(final Path path, final String reason) {
        super("Unsupported input " + path + ": " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
