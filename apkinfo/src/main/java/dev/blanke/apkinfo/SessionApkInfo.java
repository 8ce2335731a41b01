package dev.blanke.apkinfo;

import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.backend.AnalysisBackend;
import dev.blanke.apkinfo.backend.AnalysisSession;
import dev.blanke.apkinfo.backend.BackendFailureException;
import dev.blanke.apkinfo.backend.DisassembledOp;
import dev.blanke.apkinfo.disassembly.DisassemblyLineParser;
import dev.blanke.apkinfo.disassembly.InstructionParseException;
import dev.blanke.apkinfo.disassembly.WrapperEvidenceExtractor;
import dev.blanke.apkinfo.model.BackendHandle;
import dev.blanke.apkinfo.model.BytecodeInstruction;
import dev.blanke.apkinfo.model.MethodCall;
import dev.blanke.apkinfo.model.MethodSignature;
import dev.blanke.apkinfo.model.WrapperEvidence;
import dev.blanke.apkinfo.table.MethodTable;
import dev.blanke.apkinfo.table.MethodTableBuilder;
import dev.blanke.apkinfo.xref.CrossReferenceResolver;

/**
 * An {@link ApkInfo} opening one {@link AnalysisSession} per sub-image on first use.
 * <p>
 * Sessions and everything derived from them are memoized until the session of a sub-image they depend on is discarded
 * via {@link #discardSession(int)} or this instance is closed.
 */
public final class SessionApkInfo implements ApkInfo {

    private static final Logger LOGGER = System.getLogger(SessionApkInfo.class.getName());

    /**
     * Class hierarchy of all sub-images, keyed by class name.
     */
    private record ClassHierarchy(Map<String, Set<String>> superclasses, Map<String, Set<String>> subclasses) {}

    private final List<Path> subImages;

    private final @Nullable ManifestReader manifest;

    private final AnalysisBackend.Factory backendFactory;

    private final Map<Integer, AnalysisSession> sessions = new ConcurrentHashMap<>();

    private final MethodTableBuilder methodTables;

    private final CrossReferenceResolver crossReferences;

    private final WrapperEvidenceExtractor wrapperEvidence;

    private @Nullable ClassHierarchy classHierarchy;

    private volatile boolean closed;

    /**
     * @param contents The sub-images and manifest of the package to analyze.
     *
     * @param backendFactory Opens a backend for each sub-image once it is first needed.
     */
    public SessionApkInfo(final PackageContents contents, final AnalysisBackend.Factory backendFactory) {
        this.subImages      = contents.subImages();
        this.manifest       = contents.manifest();
        this.backendFactory = Objects.requireNonNull(backendFactory);

        methodTables    = new MethodTableBuilder(this::session);
        crossReferences = new CrossReferenceResolver(this::session, methodTables);
        wrapperEvidence = new WrapperEvidenceExtractor(this::session);
    }

    public int getSubImageCount() {
        return subImages.size();
    }

    /**
     * Returns the analysis session of the sub-image with the provided index, opening and analyzing it on first use.
     *
     * @throws IndexOutOfBoundsException If there is no sub-image with the provided index.
     *
     * @throws UnsupportedInputKindException If the sub-image is not a DEX file.
     *
     * @throws BackendFailureException If the backend cannot be started or fails to analyze the sub-image.
     */
    public @NotNull AnalysisSession session(final int subImageIndex) {
        if (closed)
            throw new IllegalStateException("ApkInfo has already been closed.");
        final var subImage = subImages.get(subImageIndex);
        return sessions.computeIfAbsent(subImageIndex,
            index -> AnalysisSession.open(index, subImage, backendFactory));
    }

    /**
     * Closes the session of the provided sub-image, if there is one, and drops everything memoized for it. The next
     * query involving the sub-image opens a fresh session.
     */
    public void discardSession(final int subImageIndex) {
        final var session = sessions.remove(subImageIndex);
        methodTables.invalidate(subImageIndex);
        crossReferences.invalidate(subImageIndex);
        invalidateClassHierarchy();
        if (session != null) {
            LOGGER.log(Level.INFO, "Discarding {0} session of sub-image {1}", session.getState(), subImageIndex);
            session.close();
        }
    }

    @Override
    public @NotNull Set<String> permissions() {
        return (manifest != null) ? manifest.permissions() : Set.of();
    }

    @Override
    public @NotNull Set<MethodSignature> androidApis() {
        return filterMethods(method -> method.isImported() && method.isAndroidApi());
    }

    @Override
    public @NotNull Set<MethodSignature> customMethods() {
        return filterMethods(method -> !method.isImported());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A method found in several sub-images is represented by its instance from the first of them.
     */
    @Override
    public @NotNull Set<MethodSignature> allMethods() {
        return forEachSubImage(subImageIndex -> methodTables.build(subImageIndex).allMethods())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public @Nullable MethodSignature findMethod(final @Nullable String classDescriptor, final @Nullable String name,
                                                final @Nullable String descriptor) {
        return forEachSubImage(subImageIndex -> {
            final MethodTable table = methodTables.build(subImageIndex);
            final Stream<MethodSignature> candidates = (classDescriptor != null)
                ? table.methods(classDescriptor).stream()
                : table.allMethods();
            return candidates
                .filter(method -> (name == null) || name.equals(method.name()))
                .filter(method -> (descriptor == null) || descriptor.equals(method.descriptor()))
                .limit(1);
        }).findFirst().orElse(null);
    }

    @Override
    public @NotNull Set<MethodSignature> upperfunc(final MethodSignature method) {
        return crossReferences.upperfunc(method);
    }

    @Override
    public @NotNull List<MethodCall> lowerfunc(final MethodSignature method) {
        return crossReferences.lowerfunc(method);
    }

    @Override
    public @NotNull Iterable<BytecodeInstruction> getMethodBytecode(final MethodSignature method) {
        final BackendHandle handle = method.handle();
        if (handle == null)
            throw new IllegalArgumentException("Method has not been produced by a backend: " + method);
        if (handle.imported()) {
            LOGGER.log(Level.DEBUG, "Imported method {0} has no bytecode", method);
            return List.of();
        }
        return () -> session(handle.subImageIndex()).disassembleFunction(handle.address()).stream()
            .map(op -> parseInstruction(op, method))
            .filter(Objects::nonNull)
            .iterator();
    }

    @Override
    public @NotNull Set<String> getStrings() {
        return forEachSubImage(subImageIndex -> session(subImageIndex).listStrings().stream())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public @NotNull WrapperEvidence getWrapperEvidence(final MethodSignature parent, final MethodSignature first,
                                                       final MethodSignature second) {
        return wrapperEvidence.extract(parent, first, second);
    }

    @Override
    public @NotNull Set<String> superclassOf(final String className) {
        return classHierarchy().superclasses().getOrDefault(className, Set.of());
    }

    @Override
    public @NotNull Set<String> subclassesOf(final String className) {
        return classHierarchy().subclasses().getOrDefault(className, Set.of());
    }

    @Override
    public void close() {
        closed = true;
        for (final var subImageIndex : List.copyOf(sessions.keySet())) {
            discardSession(subImageIndex);
        }
    }

    private synchronized ClassHierarchy classHierarchy() {
        if (classHierarchy != null)
            return classHierarchy;

        final var superclasses = new HashMap<String, Set<String>>();
        final var subclasses   = new HashMap<String, Set<String>>();
        forEachSubImage(subImageIndex -> session(subImageIndex).listClasses().stream()).forEach(entry -> {
            superclasses.computeIfAbsent(entry.className(),  key -> new LinkedHashSet<>()).add(entry.superClass());
            subclasses  .computeIfAbsent(entry.superClass(), key -> new LinkedHashSet<>()).add(entry.className());
        });
        return classHierarchy = new ClassHierarchy(freeze(superclasses), freeze(subclasses));
    }

    private synchronized void invalidateClassHierarchy() {
        classHierarchy = null;
    }

    /**
     * Filters the deduplicated {@link #allMethods()}, so that a method imported by one sub-image but defined in an
     * earlier one is classified by its defining instance only.
     */
    private Set<MethodSignature> filterMethods(final Predicate<MethodSignature> filter) {
        return allMethods().stream()
            .filter(filter)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Lazily concatenates the results of the {@code query} for all sub-images in order, skipping sub-images for which
     * the query fails. A sub-image is only queried once the stream reaches it.
     */
    private <T> Stream<T> forEachSubImage(final IntFunction<Stream<T>> query) {
        return IntStream.range(0, subImages.size()).boxed().flatMap(subImageIndex -> {
            try {
                return query.apply(subImageIndex);
            } catch (final BackendFailureException | UnsupportedInputKindException | UncheckedIOException exception) {
                LOGGER.log(Level.WARNING, "Skipping sub-image {0} ({1}): {2}", subImageIndex,
                    subImages.get(subImageIndex), exception.getMessage());
                return Stream.<T>empty();
            }
        });
    }

    private static @Nullable BytecodeInstruction parseInstruction(final DisassembledOp op,
                                                                  final MethodSignature method) {
        if (op.disassembly() == null)
            return null;
        try {
            return DisassemblyLineParser.parse(DisassemblyLineParser.stripComment(op.disassembly()));
        } catch (final InstructionParseException exception) {
            LOGGER.log(Level.WARNING, "Skipping instruction at {0} of {1}: {2}", op.offset(), method,
                exception.getMessage());
            return null;
        }
    }

    private static Map<String, Set<String>> freeze(final Map<String, Set<String>> relation) {
        final var frozen = new HashMap<String, Set<String>>();
        relation.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }
}
