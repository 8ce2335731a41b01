package dev.blanke.apkinfo;

import java.nio.file.Path;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * The parts of an application package the extraction engine works on.
 *
 * @param subImages The DEX files of the package in their original order, e.g. {@code classes.dex},
 *                  {@code classes2.dex}.
 *
 * @param manifest The already extracted manifest, or {@code null} if the input has none.
 */
public record PackageContents(List<Path> subImages, @Nullable ManifestReader manifest) {

    public PackageContents {
        subImages = List.copyOf(subImages);
    }
}
