package dev.blanke.apkinfo.backend;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link AnalysisBackend} implemented on top of Rizin's JSON-producing commands.
 */
public final class RizinBackend implements AnalysisBackend {

    private static final Logger LOGGER = System.getLogger(RizinBackend.class.getName());

    /**
     * The Rizin commands used by this backend. Address-based commands take the address as format argument.
     */
    enum Command {
        ANALYZE_ALL          ("aa"),
        LIST_SYMBOLS         ("isj"),
        LIST_CLASSES         ("icj"),
        LIST_STRINGS         ("izzj"),
        XREFS_TO             ("axtj @ %d"),
        DISASSEMBLE_FUNCTION ("pdfj @ %d"),
        SYMBOLS_AT           ("is.j @ %d");

        private final String format;

        Command(final String format) {
            this.format = format;
        }

        String format(final Object... arguments) {
            return String.format(format, arguments);
        }
    }

    private static final Type SYMBOL_LIST = new TypeToken<List<SymbolRecord>>() {}.getType();

    private static final Type CLASS_LIST = new TypeToken<List<ClassRecord>>() {}.getType();

    private static final Type XREF_LIST = new TypeToken<List<XrefRecord>>() {}.getType();

    private static final Type STRING_LIST = new TypeToken<List<StringEntry>>() {}.getType();

    private record StringEntry(String string) {}

    private record FunctionDisassembly(@Nullable List<DisassembledOp> ops) {}

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private final BackendChannel channel;

    public RizinBackend(final BackendChannel channel) {
        this.channel = Objects.requireNonNull(channel);
    }

    /**
     * Returns a factory spawning a new {@code rizin} process for every opened sub-image.
     *
     * @param executable The path to the {@code rizin} executable.
     */
    public static @NotNull Factory factory(final Path executable) {
        return path -> new RizinBackend(RizinPipeChannel.open(executable, path));
    }

    @Override
    public void analyze() {
        channel.execute(Command.ANALYZE_ALL.format());
    }

    @Override
    public List<SymbolRecord> listSymbols() {
        return queryList(Command.LIST_SYMBOLS.format(), SYMBOL_LIST);
    }

    @Override
    public List<ClassRecord> listClasses() {
        return queryList(Command.LIST_CLASSES.format(), CLASS_LIST);
    }

    @Override
    public List<String> listStrings() {
        return this.<StringEntry>queryList(Command.LIST_STRINGS.format(), STRING_LIST).stream()
            .map(StringEntry::string)
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public List<XrefRecord> xrefsTo(final long address) {
        return queryList(Command.XREFS_TO.format(address), XREF_LIST);
    }

    @Override
    public List<DisassembledOp> disassembleFunction(final long address) {
        final FunctionDisassembly function =
            query(Command.DISASSEMBLE_FUNCTION.format(address), FunctionDisassembly.class);
        return (function == null || function.ops() == null) ? List.of() : function.ops();
    }

    @Override
    public List<SymbolRecord> symbolsAt(final long address) {
        return queryList(Command.SYMBOLS_AT.format(address), SYMBOL_LIST);
    }

    @Override
    public void close() {
        channel.close();
    }

    private <T> List<T> queryList(final String command, final Type listType) {
        final List<T> result = query(command, listType);
        return (result == null) ? List.of() : result;
    }

    /**
     * Executes the {@code command} and decodes its JSON response.
     *
     * @return The decoded response, or {@code null} if the backend answered with an empty response.
     *
     * @throws BackendFailureException If the response is not valid JSON of the expected shape.
     */
    private <T> @Nullable T query(final String command, final Type type) {
        final var response = channel.execute(command);
        if (response == null || response.isBlank()) {
            LOGGER.log(Level.DEBUG, "Empty response to {0}", command);
            return null;
        }
        try {
            return gson.fromJson(response, type);
        } catch (final JsonParseException exception) {
            throw new BackendFailureException("Malformed response to '" + command + "'", exception);
        }
    }
}
