package dev.blanke.apkinfo.table;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

import org.jetbrains.annotations.NotNull;

import dev.blanke.apkinfo.backend.AnalysisSession;
import dev.blanke.apkinfo.signature.SymbolDemangler;

/**
 * Builds and memoizes the {@link MethodTable} of each sub-image from the symbol listing of its analysis session.
 */
public final class MethodTableBuilder {

    private static final Logger LOGGER = System.getLogger(MethodTableBuilder.class.getName());

    private final IntFunction<AnalysisSession> sessions;

    private final Map<Integer, MethodTable> tables = new ConcurrentHashMap<>();

    /**
     * @param sessions Returns the analysis session of the sub-image with the given index.
     */
    public MethodTableBuilder(final IntFunction<AnalysisSession> sessions) {
        this.sessions = Objects.requireNonNull(sessions);
    }

    /**
     * Returns the method table of the sub-image with the provided index, building it on first use.
     * <p>
     * Symbols which cannot be demangled are logged and left out. Concurrent first calls for the same sub-image may
     * both query the backend, but all callers receive the same table instance.
     *
     * @throws dev.blanke.apkinfo.backend.BackendFailureException If the symbol listing cannot be retrieved.
     */
    public @NotNull MethodTable build(final int subImageIndex) {
        final var cached = tables.get(subImageIndex);
        if (cached != null)
            return cached;

        final var table    = buildTable(subImageIndex);
        final var previous = tables.putIfAbsent(subImageIndex, table);
        return (previous != null) ? previous : table;
    }

    /**
     * Drops the memoized table of the provided sub-image, e.g. after its session has been discarded.
     */
    public void invalidate(final int subImageIndex) {
        tables.remove(subImageIndex);
    }

    private MethodTable buildTable(final int subImageIndex) {
        final var symbols = sessions.apply(subImageIndex).listSymbols();
        final var builder = MethodTable.builder(subImageIndex);

        int skipped = 0;
        for (final var symbol : symbols) {
            final var method = SymbolDemangler.parse(symbol, subImageIndex);
            if (method == null) {
                ++skipped;
                continue;
            }
            builder.add(method);
        }
        final var table = builder.build();
        LOGGER.log(Level.INFO, "Sub-image {0}: {1} methods in {2} classes, {3} symbols skipped", subImageIndex,
            table.size(), table.classes().size(), skipped);
        return table;
    }
}
