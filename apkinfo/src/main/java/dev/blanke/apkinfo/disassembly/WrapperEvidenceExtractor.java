package dev.blanke.apkinfo.disassembly;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.backend.AnalysisSession;
import dev.blanke.apkinfo.backend.DisassembledOp;
import dev.blanke.apkinfo.model.BytecodeInstruction;
import dev.blanke.apkinfo.model.MethodSignature;
import dev.blanke.apkinfo.model.WrapperEvidence;

/**
 * Locates the invocation instructions by which a parent method calls two given target methods.
 */
public final class WrapperEvidenceExtractor {

    private static final Logger LOGGER = System.getLogger(WrapperEvidenceExtractor.class.getName());

    private static final Pattern HEX_PAIR = Pattern.compile("\\w{2}");

    private final IntFunction<AnalysisSession> sessions;

    public WrapperEvidenceExtractor(final IntFunction<AnalysisSession> sessions) {
        this.sessions = Objects.requireNonNull(sessions);
    }

    /**
     * Scans the code of the {@code parent} for invocations of {@code first} and {@code second}.
     * <p>
     * When a target is invoked more than once, the last invocation is reported.
     *
     * @return The matching instructions with their encoded bytes, or {@link WrapperEvidence#EMPTY} if the
     *         {@code parent} is imported and therefore has no code.
     *
     * @throws IllegalArgumentException If the {@code parent} has no backend handle.
     */
    public @NotNull WrapperEvidence extract(final MethodSignature parent, final MethodSignature first,
                                            final MethodSignature second) {
        final var handle = parent.handle();
        if (handle == null)
            throw new IllegalArgumentException("Method has not been produced by a backend: " + parent);
        if (handle.imported())
            return WrapperEvidence.EMPTY;

        final var firstReference  = normalize(first.reference());
        final var secondReference = normalize(second.reference());

        BytecodeInstruction firstInstruction  = null, secondInstruction = null;
        String              firstHex          = null, secondHex         = null;

        for (final DisassembledOp op : sessions.apply(handle.subImageIndex()).disassembleFunction(handle.address())) {
            if (op.disassembly() == null || !op.disassembly().startsWith("invoke"))
                continue;

            final BytecodeInstruction instruction;
            try {
                instruction = DisassemblyLineParser.parse(DisassemblyLineParser.stripComment(op.disassembly()));
            } catch (final InstructionParseException exception) {
                LOGGER.log(Level.WARNING, "Skipping instruction at {0} of {1}: {2}", op.offset(), parent,
                    exception.getMessage());
                continue;
            }
            if (instruction.parameter() == null)
                continue;

            final var target = normalize(instruction.parameter());
            if (target.contains(firstReference)) {
                firstInstruction = instruction;
                firstHex         = toHexPairs(op.bytes());
            }
            if (target.contains(secondReference)) {
                secondInstruction = instruction;
                secondHex         = toHexPairs(op.bytes());
            }
        }
        return new WrapperEvidence(firstInstruction, firstHex, secondInstruction, secondHex);
    }

    /**
     * The backend separates class and method of a reference by {@code .}, which the parser turns into {@code ->}
     * while dropping the class descriptor's terminating {@code ;}.
     */
    private static String normalize(final String reference) {
        return reference.replace(";->", "->");
    }

    /**
     * Formats encoded instruction bytes such as {@code 6e201200} as {@code 6e 20 12 00}.
     */
    static @Nullable String toHexPairs(final @Nullable String bytes) {
        if (bytes == null)
            return null;
        return HEX_PAIR.matcher(bytes).results()
            .map(MatchResult::group)
            .collect(Collectors.joining(" "));
    }
}
