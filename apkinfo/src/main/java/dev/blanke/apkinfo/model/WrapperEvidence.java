package dev.blanke.apkinfo.model;

import org.jetbrains.annotations.Nullable;

/**
 * The invocation instructions inside a parent method which prove that it calls two target methods.
 * <p>
 * Each component is {@code null} if no matching invocation was found.
 *
 * @param first The instruction invoking the first target method.
 *
 * @param firstHex The encoded bytes of {@link #first()} as space-separated hex pairs, e.g. {@code 6e 20 12 00}.
 *
 * @param second The instruction invoking the second target method.
 *
 * @param secondHex The encoded bytes of {@link #second()}.
 */
public record WrapperEvidence(@Nullable BytecodeInstruction first, @Nullable String firstHex,
                              @Nullable BytecodeInstruction second, @Nullable String secondHex) {

    public static final WrapperEvidence EMPTY = new WrapperEvidence(null, null, null, null);

    public boolean isEmpty() {
        return (first == null) && (second == null);
    }
}
