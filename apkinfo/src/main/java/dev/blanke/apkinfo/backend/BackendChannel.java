package dev.blanke.apkinfo.backend;

/**
 * A request/response channel to a running disassembly backend.
 * <p>
 * Requests and responses travel as one ordered stream. Implementations are therefore not safe for concurrent use;
 * {@link AnalysisSession} serializes access.
 */
public interface BackendChannel extends AutoCloseable {

    /**
     * Sends the provided {@code command} to the backend and waits for its complete textual response.
     *
     * @param command A single backend command, e.g. {@code isj}.
     *
     * @return The response of the backend. May be empty.
     *
     * @throws BackendFailureException If the channel is closed or the backend terminated.
     */
    String execute(String command);

    @Override
    void close();
}
