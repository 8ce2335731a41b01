package dev.blanke.apkinfo.disassembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

import dev.blanke.apkinfo.model.BytecodeInstruction;

/**
 * Turns a single line of smali-like disassembly into a {@link BytecodeInstruction}.
 * <p>
 * Supported operand forms are plain registers ({@code move v0, v1}), braced register lists
 * ({@code invoke-virtual {v1, v2}, Ljava/lang/String;->concat(Ljava/lang/String;)Ljava/lang/String;}), and register
 * ranges ({@code invoke-static/range {v0..v5}, ...} or {@code {v0:v5}}), each optionally followed by one parameter.
 */
public final class DisassemblyLineParser {

    private static final Pattern OPERAND_SEPARATORS = Pattern.compile("[{},]+");

    private static final Pattern RANGE_SEPARATORS = Pattern.compile("(\\.\\.|:)");

    private static final String REGISTER_PREFIX = "v";

    private static final String COMMENT_MARKER = " ;";

    private DisassemblyLineParser() {
    }

    /**
     * Parses the provided line of disassembly.
     *
     * @param line A single instruction, e.g. {@code const-string v0, "hello"}.
     *
     * @return The instruction with its mnemonic, registers in operand order, and trailing parameter, if any. Method
     *         references of {@code invoke*} instructions always use {@code ->} as the class/method separator.
     *
     * @throws InstructionParseException If the {@code line} is empty or one of its register operands is not of the
     *                                   form {@code v<index>}.
     */
    public static @NotNull BytecodeInstruction parse(final String line) throws InstructionParseException {
        final var trimmed = line.strip();
        if (trimmed.isEmpty())
            throw new InstructionParseException("Cannot parse an empty instruction.");

        final var parts = trimmed.split("\\s+", 2);
        final var mnemonic = parts[0];
        if (parts.length == 1)
            return new BytecodeInstruction(mnemonic, List.of(), null);

        var operands = parts[1];
        String parameter = null;

        // String literals may contain separators themselves and are therefore split off first.
        final int quote = operands.indexOf('"');
        if (quote >= 0) {
            parameter = operands.substring(quote);
            operands  = operands.substring(0, quote);
        }

        final var tokens = new ArrayList<>(Arrays.stream(OPERAND_SEPARATORS.split(operands))
            .map(String::strip)
            .filter(token -> !token.isEmpty())
            .toList());

        if (parameter == null && !tokens.isEmpty() && !tokens.get(tokens.size() - 1).startsWith(REGISTER_PREFIX)) {
            parameter = tokens.remove(tokens.size() - 1);
            if (mnemonic.startsWith("invoke") && !parameter.contains("->")) {
                parameter = parameter.replaceFirst("\\.", "->");
            }
        }

        final List<String> registers;
        if (tokens.size() == 1 && RANGE_SEPARATORS.matcher(tokens.get(0)).find()) {
            registers = expandRange(tokens.get(0), trimmed);
        } else {
            registers = new ArrayList<>(tokens.size());
            for (final var token : tokens) {
                registers.add(REGISTER_PREFIX + parseRegisterIndex(token, trimmed));
            }
        }
        return new BytecodeInstruction(mnemonic, registers, parameter);
    }

    /**
     * Removes the trailing comment the backend appends to some instructions, e.g. the target address in
     * {@code invoke-virtual {v0}, La/B.c()V ; 0x1f4}. Comment markers inside a string literal are kept.
     */
    public static @NotNull String stripComment(final String line) {
        final int marker = line.lastIndexOf(COMMENT_MARKER);
        if (marker < 0 || marker < line.lastIndexOf('"'))
            return line;
        return line.substring(0, marker);
    }

    /**
     * Expands a register range such as {@code v0..v3} into {@code [v0, v1, v2, v3]}.
     */
    private static List<String> expandRange(final String range, final String line) throws InstructionParseException {
        final var bounds = Arrays.stream(RANGE_SEPARATORS.split(range))
            .map(String::strip)
            .filter(bound -> !bound.isEmpty())
            .toList();
        if (bounds.size() != 2)
            throw new InstructionParseException("Cannot parse register range of instruction: " + line);

        final int first = parseRegisterIndex(bounds.get(0), line);
        final int last  = parseRegisterIndex(bounds.get(1), line);
        if (last < first)
            throw new InstructionParseException("Descending register range in instruction: " + line);

        final var registers = new ArrayList<String>(last - first + 1);
        for (int index = first; index <= last; ++index) {
            registers.add(REGISTER_PREFIX + index);
        }
        return registers;
    }

    private static int parseRegisterIndex(final String register, final String line) throws InstructionParseException {
        if (!register.startsWith(REGISTER_PREFIX))
            throw new InstructionParseException("Unknown register '" + register + "' in instruction: " + line);
        try {
            return Integer.parseInt(register.substring(REGISTER_PREFIX.length()));
        } catch (final NumberFormatException exception) {
            throw new InstructionParseException("Unknown register '" + register + "' in instruction: " + line,
                exception);
        }
    }
}
