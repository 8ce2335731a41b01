package dev.blanke.apkinfo;

import java.util.Set;

/**
 * Read access to an application package's binary manifest.
 */
@FunctionalInterface
public interface ManifestReader {

    /**
     * Returns the names of all permissions requested via {@code <uses-permission>}, e.g.
     * {@code android.permission.SEND_SMS}.
     */
    Set<String> permissions();
}
