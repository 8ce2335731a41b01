package dev.blanke.apkinfo.backend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;

import dev.blanke.apkinfo.InputType;
import dev.blanke.apkinfo.UnsupportedInputKindException;

/**
 * Owns the {@link AnalysisBackend} of a single sub-image and serializes all queries sent to it.
 * <p>
 * A session is {@link State#ANALYZED} once {@link #open(int, Path, AnalysisBackend.Factory)} returns. The first query
 * failing with a {@link BackendFailureException} moves it to {@link State#FAILED}, after which every query fails
 * immediately: a partially completed exchange may have left the backend in an inconsistent state, so the session
 * must be closed and replaced instead of being retried.
 */
public final class AnalysisSession implements AutoCloseable {

    private static final Logger LOGGER = System.getLogger(AnalysisSession.class.getName());

    public enum State {
        OPENED,
        ANALYZED,
        FAILED,
        CLOSED
    }

    private final int subImageIndex;

    private final Path subImage;

    private final AnalysisBackend backend;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile State state = State.OPENED;

    AnalysisSession(final int subImageIndex, final Path subImage, final AnalysisBackend backend) {
        this.subImageIndex = subImageIndex;
        this.subImage      = Objects.requireNonNull(subImage);
        this.backend       = Objects.requireNonNull(backend);
    }

    /**
     * Opens the sub-image located at {@code subImage} using a backend created by the {@code factory} and runs the
     * backend's control-flow analysis.
     *
     * @param subImageIndex The index of the sub-image inside its application package.
     *
     * @param subImage The path of the DEX file to open.
     *
     * @param factory Creates the backend for the sub-image.
     *
     * @return An {@link State#ANALYZED} session.
     *
     * @throws UnsupportedInputKindException If the file at {@code subImage} is not a DEX file.
     *
     * @throws UncheckedIOException If the file at {@code subImage} cannot be read.
     *
     * @throws BackendFailureException If the backend could not be started or failed during the analysis.
     */
    public static @NotNull AnalysisSession open(final int subImageIndex, final Path subImage,
                                                final AnalysisBackend.Factory factory) {
        final InputType inputType;
        try {
            inputType = InputType.determine(subImage);
        } catch (final IOException exception) {
            throw new UncheckedIOException(exception);
        }
        if (inputType != InputType.DEX)
            throw new UnsupportedInputKindException(subImage, "only DEX files can be analyzed directly");

        final var session = new AnalysisSession(subImageIndex, subImage, factory.open(subImage));
        session.analyze();
        return session;
    }

    void analyze() {
        lock.lock();
        try {
            if (state != State.OPENED)
                throw new IllegalStateException("Session for " + subImage + " is " + state);
            LOGGER.log(Level.INFO, "Analyzing sub-image {0} ({1})...", subImageIndex, subImage);
            backend.analyze();
            state = State.ANALYZED;
        } catch (final RuntimeException exception) {
            state = State.FAILED;
            backend.close();
            throw exception;
        } finally {
            lock.unlock();
        }
    }

    public List<SymbolRecord> listSymbols() {
        return query(AnalysisBackend::listSymbols);
    }

    public List<ClassRecord> listClasses() {
        return query(AnalysisBackend::listClasses);
    }

    public List<String> listStrings() {
        return query(AnalysisBackend::listStrings);
    }

    public List<XrefRecord> xrefsTo(final long address) {
        return query(backend -> backend.xrefsTo(address));
    }

    public List<DisassembledOp> disassembleFunction(final long address) {
        return query(backend -> backend.disassembleFunction(address));
    }

    public List<SymbolRecord> symbolsAt(final long address) {
        return query(backend -> backend.symbolsAt(address));
    }

    /**
     * Runs the provided {@code query} while holding this session's lock.
     *
     * @throws BackendFailureException If the session has failed before or the {@code query} fails.
     *
     * @throws IllegalStateException If the session has not been analyzed or has already been closed.
     */
    private <T> T query(final Function<AnalysisBackend, T> query) {
        lock.lock();
        try {
            switch (state) {
                case ANALYZED -> {
                }
                case FAILED -> throw new BackendFailureException(
                    "Session for " + subImage + " has failed before and must be discarded.");
                default -> throw new IllegalStateException("Session for " + subImage + " is " + state);
            }
            try {
                return query.apply(backend);
            } catch (final BackendFailureException exception) {
                state = State.FAILED;
                throw exception;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (state == State.CLOSED)
                return;
            state = State.CLOSED;
            backend.close();
        } finally {
            lock.unlock();
        }
    }

    public int getSubImageIndex() {
        return subImageIndex;
    }

    public Path getSubImage() {
        return subImage;
    }

    public State getState() {
        return state;
    }
}
