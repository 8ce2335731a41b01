package dev.blanke.apkinfo.backend;

/**
 * A {@code BackendFailureException} is thrown if the channel to the disassembly backend was closed, the backend
 * process crashed, or it answered with a malformed response.
 * <p>
 * The {@link AnalysisSession} which issued the failing query is unusable afterwards and must be discarded.
 *
 * @implNote Cannot be a checked {@link Exception}, as sessions are created and queried from within
 *           {@link java.util.concurrent.ConcurrentHashMap#computeIfAbsent} callbacks.
 */
public final class BackendFailureException extends RuntimeException {

    public BackendFailureException(final String message) {
        super(message);
    }

    public BackendFailureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
