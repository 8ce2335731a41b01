package dev.blanke.apkinfo.backend;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link BackendChannel} speaking the {@code rzpipe} protocol with a spawned {@code rizin} process.
 * <p>
 * The process is started as {@code rizin -q0 <file>}. Each command is written as a single line to its standard input,
 * and the response is everything the process writes to its standard output up to the next NUL byte.
 */
public final class RizinPipeChannel implements BackendChannel {

    private static final Logger LOGGER = System.getLogger(RizinPipeChannel.class.getName());

    private static final long EXIT_TIMEOUT_SECONDS = 5;

    private final Process process;

    private final OutputStream commandStream;

    private final InputStream responseStream;

    private boolean closed;

    private RizinPipeChannel(final Process process) {
        this.process        = process;
        this.commandStream  = process.getOutputStream();
        this.responseStream = new BufferedInputStream(process.getInputStream());
    }

    /**
     * Spawns a {@code rizin} process opening the provided {@code file}.
     *
     * @param executable The path to the {@code rizin} executable, or just its name if it can be found on the
     *                   {@code PATH}.
     *
     * @param file The file the backend should open.
     *
     * @return A channel connected to the spawned process.
     *
     * @throws BackendFailureException If the process could not be started or did not send its initial prompt.
     */
    public static @NotNull RizinPipeChannel open(final Path executable, final Path file) {
        final Process process;
        try {
            process = new ProcessBuilder(executable.toString(), "-q0", file.toString())
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (final IOException exception) {
            throw new BackendFailureException("Unable to start " + executable, exception);
        }
        LOGGER.log(Level.INFO, "Spawned {0} for {1}", executable, file);

        final var channel = new RizinPipeChannel(process);
        try {
            // rizin acknowledges the opened file with an empty, NUL-terminated response.
            channel.readResponse();
        } catch (final BackendFailureException exception) {
            process.destroyForcibly();
            throw exception;
        }
        return channel;
    }

    @Override
    public String execute(final String command) {
        if (closed)
            throw new BackendFailureException("Channel has already been closed.");
        try {
            commandStream.write((command + "\n").getBytes(StandardCharsets.UTF_8));
            commandStream.flush();
        } catch (final IOException exception) {
            throw new BackendFailureException("Unable to send command '" + command + "'", exception);
        }
        return readResponse();
    }

    private String readResponse() {
        final var response = new ByteArrayOutputStream();
        try {
            int read;
            while ((read = responseStream.read()) != 0) {
                if (read == -1)
                    throw new BackendFailureException("Backend terminated with exit code " + process.waitFor());
                response.write(read);
            }
        } catch (final IOException exception) {
            throw new BackendFailureException("Unable to read backend response", exception);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new BackendFailureException("Interrupted while waiting for the backend", exception);
        }
        return response.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            commandStream.write("q\n".getBytes(StandardCharsets.UTF_8));
            commandStream.close();
            if (!process.waitFor(EXIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.log(Level.WARNING, "Backend did not exit in time, destroying it.");
                process.destroyForcibly();
            }
        } catch (final IOException exception) {
            LOGGER.log(Level.DEBUG, "Backend already gone while closing: {0}", exception.getMessage());
            process.destroyForcibly();
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
