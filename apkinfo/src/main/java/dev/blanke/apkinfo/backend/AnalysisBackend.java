package dev.blanke.apkinfo.backend;

import java.nio.file.Path;
import java.util.List;

/**
 * The set of queries the extraction engine needs from a disassembly backend which has opened one sub-image.
 * <p>
 * Address-based queries are only meaningful after {@link #analyze()} has completed. Implementations must report
 * channel and protocol errors as {@link BackendFailureException}s, while empty responses yield empty results.
 */
public interface AnalysisBackend extends AutoCloseable {

    /**
     * Runs the backend's control-flow analysis over the whole sub-image. May take minutes for large inputs.
     */
    void analyze();

    List<SymbolRecord> listSymbols();

    List<ClassRecord> listClasses();

    List<String> listStrings();

    /**
     * Returns the cross-references pointing at the provided {@code address}, i.e. its callers for a method address.
     */
    List<XrefRecord> xrefsTo(long address);

    /**
     * Disassembles the whole function containing the provided {@code address}.
     */
    List<DisassembledOp> disassembleFunction(long address);

    /**
     * Returns the symbols located at the provided {@code address}.
     */
    List<SymbolRecord> symbolsAt(long address);

    @Override
    void close();

    /**
     * Creates {@link AnalysisBackend}s for sub-images.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * Opens the sub-image located at the provided {@code path}. The returned backend has not been analyzed yet.
         *
         * @throws BackendFailureException If the backend could not be started.
         */
        AnalysisBackend open(Path path);
    }
}
