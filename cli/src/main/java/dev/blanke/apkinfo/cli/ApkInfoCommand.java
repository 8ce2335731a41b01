package dev.blanke.apkinfo.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import dev.blanke.apkinfo.InputType;
import dev.blanke.apkinfo.ManifestReader;
import dev.blanke.apkinfo.PackageContents;
import dev.blanke.apkinfo.PackageExtractor;
import dev.blanke.apkinfo.SessionApkInfo;
import dev.blanke.apkinfo.UnsupportedInputKindException;
import dev.blanke.apkinfo.ZipPackageExtractor;
import dev.blanke.apkinfo.backend.AnalysisBackend;
import dev.blanke.apkinfo.backend.BackendFailureException;
import dev.blanke.apkinfo.backend.RizinBackend;
import dev.blanke.apkinfo.model.MethodSignature;

/**
 * The {@code ApkInfoCommand} class serves as the entry point to the extraction tool via {@link #main(String...)} and
 * {@link #call()}.
 * <p>
 * Query results are written to the command's standard output, one item per line, while diagnostics go to its error
 * output.
 */
@Command(
    name                     = "apkinfo",
    mixinStandardHelpOptions = true,
    description              = "Extracts methods, strings, and call relationships from Android APK and DEX files.")
public final class ApkInfoCommand implements Callable<Integer> {

    private static final Logger LOGGER = System.getLogger(ApkInfoCommand.class.getName());

    static final int EXIT_UNSUPPORTED_INPUT = 1;

    static final int EXIT_BACKEND_FAILURE = 3;

    /**
     * The parsed command-line arguments.
     *
     * @implNote The {@code @Mixin} annotation allows this class to define {@link #call()} while keeping the fields
     *           representing options and parameters in the {@link Arguments} class.
     */
    @Mixin
    private Arguments arguments = new Arguments();

    @Spec
    private CommandSpec spec;

    /**
     * Creates the backend factory for the configured rizin executable.
     */
    private final Function<Path, AnalysisBackend.Factory> backendFactories;

    /**
     * @param backendFactories Creates a backend factory given the path to the rizin executable. Tests pass a factory
     *                         returning scripted backends.
     */
    public ApkInfoCommand(final Function<Path, AnalysisBackend.Factory> backendFactories) {
        this.backendFactories = backendFactories;
    }

    /**
     * Launches the tool by delegating command-line argument parsing to Picocli, running the {@link #call()} method,
     * and exiting with the returned exit code.
     *
     * @param args The command-line arguments parsed into an {@link Arguments} instance by Picocli.
     */
    public static void main(final String... args) {
        final int exitCode = new CommandLine(new ApkInfoCommand(RizinBackend::factory)).execute(args);
        System.exit(exitCode);
    }

    /**
     * Unpacks the inputs, opens all sub-images, and runs the requested queries.
     *
     * @return {@code 0} on success, {@value #EXIT_UNSUPPORTED_INPUT} if an input is neither a readable DEX file nor a
     *         readable APK, or {@value #EXIT_BACKEND_FAILURE} if the backend fails.
     */
    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        Path extractionDirectory = null;
        try {
            extractionDirectory = Files.createTempDirectory("apkinfo-");
            final var contents = unpack(arguments.getInputs(), new ZipPackageExtractor(extractionDirectory));
            try (final var apkInfo = new SessionApkInfo(contents,
                    backendFactories.apply(arguments.getRizinExecutable()))) {
                // Aggregating queries skip failing sub-images, so failures are surfaced here instead.
                for (int subImageIndex = 0; subImageIndex < apkInfo.getSubImageCount(); ++subImageIndex) {
                    apkInfo.session(subImageIndex);
                }

                if (arguments.getListMethods()) {
                    apkInfo.allMethods().forEach(out::println);
                }
                if (arguments.getListStrings()) {
                    apkInfo.getStrings().forEach(out::println);
                }
                if (arguments.getMethod() != null) {
                    printCallRelationships(apkInfo, arguments.getMethod(), out, err);
                }
                if (arguments.getSuperclassOf() != null) {
                    apkInfo.superclassOf(arguments.getSuperclassOf()).forEach(out::println);
                }
            }
            out.flush();
            return 0;
        } catch (final UnsupportedInputKindException exception) {
            err.println(exception.getMessage());
            return EXIT_UNSUPPORTED_INPUT;
        } catch (final IOException exception) {
            err.printf("Cannot read input: %s%n", exception.getMessage());
            return EXIT_UNSUPPORTED_INPUT;
        } catch (final UncheckedIOException exception) {
            err.printf("Cannot read input: %s%n", exception.getCause().getMessage());
            return EXIT_UNSUPPORTED_INPUT;
        } catch (final BackendFailureException exception) {
            err.printf("""
                The analysis backend failed: %s
                Make sure that '%s' points to a working rizin installation.
                """, exception.getMessage(), arguments.getRizinExecutable());
            return EXIT_BACKEND_FAILURE;
        } finally {
            if (extractionDirectory != null) {
                deleteRecursively(extractionDirectory);
            }
        }
    }

    /**
     * Unpacks each input into its sub-images, keeping the order of the inputs. The manifest of the first input having
     * one is used.
     */
    static PackageContents unpack(final List<Path> inputs, final PackageExtractor extractor) throws IOException {
        final var subImages = new ArrayList<Path>();
        ManifestReader manifest = null;
        for (final var input : inputs) {
            final var contents = InputType.unpack(input, extractor);
            subImages.addAll(contents.subImages());
            if (manifest == null) {
                manifest = contents.manifest();
            }
        }
        return new PackageContents(subImages, manifest);
    }

    private static void deleteRecursively(final Path directory) {
        try (final var paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (final IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        } catch (final IOException | UncheckedIOException exception) {
            LOGGER.log(Level.WARNING, "Cannot delete extracted sub-images in {0}: {1}", directory,
                exception.getMessage());
        }
    }

    private static void printCallRelationships(final SessionApkInfo apkInfo, final MethodSignature reference,
                                               final PrintWriter out, final PrintWriter err) {
        final var method = apkInfo.findMethod(reference.classDescriptor(), reference.name(), reference.descriptor());
        if (method == null) {
            err.printf("Method %s not found.%n", reference.reference());
            return;
        }
        apkInfo.upperfunc(method).forEach(caller -> out.println("caller " + caller));
        apkInfo.lowerfunc(method).forEach(call ->
            out.printf("callee %s +0x%x%n", call.callee(), call.offset()));
    }

    Arguments getArguments() {
        return arguments;
    }
}
