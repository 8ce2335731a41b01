package dev.blanke.apkinfo.xref;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.backend.AnalysisSession;
import dev.blanke.apkinfo.backend.DisassembledOp;
import dev.blanke.apkinfo.model.BackendHandle;
import dev.blanke.apkinfo.model.MethodCall;
import dev.blanke.apkinfo.model.MethodSignature;
import dev.blanke.apkinfo.signature.SymbolDemangler;
import dev.blanke.apkinfo.table.MethodTableBuilder;

/**
 * Computes the callers and callees of methods from the cross-references recorded by the disassembly backend.
 * <p>
 * Results are memoized per sub-image and code address until {@link #invalidate(int)} is called for the sub-image.
 */
public final class CrossReferenceResolver {

    private static final Logger LOGGER = System.getLogger(CrossReferenceResolver.class.getName());

    /**
     * Identifies a code address inside a specific sub-image.
     */
    private record AddressKey(int subImageIndex, long address) {}

    private final IntFunction<AnalysisSession> sessions;

    private final MethodTableBuilder methodTables;

    private final Map<AddressKey, Set<MethodSignature>> callers = new ConcurrentHashMap<>();

    private final Map<AddressKey, List<MethodCall>> callees = new ConcurrentHashMap<>();

    private final Map<AddressKey, Optional<MethodSignature>> owners = new ConcurrentHashMap<>();

    /**
     * @param sessions Returns the analysis session of the sub-image with the given index.
     *
     * @param methodTables Provides the canonical signatures of each sub-image.
     */
    public CrossReferenceResolver(final IntFunction<AnalysisSession> sessions, final MethodTableBuilder methodTables) {
        this.sessions     = Objects.requireNonNull(sessions);
        this.methodTables = Objects.requireNonNull(methodTables);
    }

    /**
     * Returns the methods calling the provided {@code method}.
     * <p>
     * Call sites whose containing method cannot be determined are logged and left out.
     *
     * @param method A method carrying a {@link BackendHandle}.
     *
     * @return The set of calling methods. Empty if the method is never called.
     *
     * @throws IllegalArgumentException If the {@code method} has no backend handle.
     */
    public @NotNull Set<MethodSignature> upperfunc(final MethodSignature method) {
        final var key = keyOf(method);
        final var cached = callers.get(key);
        if (cached != null)
            return cached;

        final var result = new LinkedHashSet<MethodSignature>();
        for (final var xref : sessions.apply(key.subImageIndex()).xrefsTo(key.address())) {
            if (!xref.isCall())
                continue;
            if (xref.from() == null) {
                LOGGER.log(Level.DEBUG, "Call reference without source address to {0}", method);
                continue;
            }
            final var caller = resolve(key.subImageIndex(), xref.from());
            if (caller != null) {
                result.add(caller);
            }
        }
        return memoize(callers, key, Collections.unmodifiableSet(result));
    }

    /**
     * Returns the methods called by the provided {@code method} along with the offset of each call site.
     * <p>
     * The result contains one entry per call site, so a method invoking the same callee twice yields two entries with
     * different offsets. Imported methods have no code and therefore yield an empty list.
     *
     * @param method A method carrying a {@link BackendHandle}.
     *
     * @return The called methods in instruction order.
     *
     * @throws IllegalArgumentException If the {@code method} has no backend handle.
     */
    public @NotNull List<MethodCall> lowerfunc(final MethodSignature method) {
        final var key = keyOf(method);
        final var cached = callees.get(key);
        if (cached != null)
            return cached;

        if (method.isImported()) {
            LOGGER.log(Level.DEBUG, "Imported method {0} has no callees", method);
            return memoize(callees, key, List.of());
        }

        final var result = new ArrayList<MethodCall>();
        for (final DisassembledOp op : sessions.apply(key.subImageIndex()).disassembleFunction(key.address())) {
            for (final var target : op.outgoingReferences()) {
                if (!target.isCall())
                    continue;

                final var callee = resolve(key.subImageIndex(), target.address());
                if (callee == null)
                    continue;

                final long offset = op.offset() - key.address();
                if (offset < 0) {
                    LOGGER.log(Level.WARNING, "Call site {0} lies before the start of {1}", op.offset(), method);
                    continue;
                }
                result.add(new MethodCall(callee, offset));
            }
        }
        return memoize(callees, key, List.copyOf(result));
    }

    /**
     * Resolves the method containing the provided {@code address}.
     *
     * @return The canonical signature of the method, or {@code null} if no method or more than one distinct method
     *         is located at the {@code address}.
     */
    public @Nullable MethodSignature resolve(final int subImageIndex, final long address) {
        final var key = new AddressKey(subImageIndex, address);
        final var cached = owners.get(key);
        if (cached != null)
            return cached.orElse(null);

        final var candidates = new LinkedHashSet<MethodSignature>();
        for (final var symbol : sessions.apply(subImageIndex).symbolsAt(address)) {
            final var method = SymbolDemangler.parse(symbol, subImageIndex);
            if (method != null) {
                candidates.add(method);
            }
        }

        MethodSignature owner = null;
        if (candidates.isEmpty()) {
            LOGGER.log(Level.DEBUG, "Cannot identify function at {0} in sub-image {1}", address, subImageIndex);
        } else if (candidates.size() > 1) {
            LOGGER.log(Level.WARNING, "Ambiguous function at {0} in sub-image {1}: {2}", address, subImageIndex,
                candidates);
        } else {
            owner = candidates.iterator().next();
            final var canonical = methodTables.build(subImageIndex).canonical(owner);
            if (canonical != null) {
                owner = canonical;
            }
        }
        return memoize(owners, key, Optional.ofNullable(owner)).orElse(null);
    }

    /**
     * Drops all memoized results of the provided sub-image, e.g. after its session has been discarded.
     */
    public void invalidate(final int subImageIndex) {
        callers.keySet().removeIf(key -> key.subImageIndex() == subImageIndex);
        callees.keySet().removeIf(key -> key.subImageIndex() == subImageIndex);
        owners.keySet().removeIf(key -> key.subImageIndex() == subImageIndex);
    }

    private static AddressKey keyOf(final MethodSignature method) {
        final BackendHandle handle = method.handle();
        if (handle == null)
            throw new IllegalArgumentException("Method has not been produced by a backend: " + method);
        return new AddressKey(handle.subImageIndex(), handle.address());
    }

    /**
     * Stores the {@code value} unless another thread has already stored a value for the {@code key}, returning the
     * value that ended up in the {@code cache}.
     */
    private static <V> V memoize(final Map<AddressKey, V> cache, final AddressKey key, final V value) {
        final var previous = cache.putIfAbsent(key, value);
        return (previous != null) ? previous : value;
    }
}
