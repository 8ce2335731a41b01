package dev.blanke.apkinfo.signature;

import org.jetbrains.annotations.NotNull;

import org.objectweb.asm.Type;

/**
 * Utilities for method descriptors reported by the disassembly backend.
 */
public final class Descriptors {

    private Descriptors() {
    }

    /**
     * Validates the provided method {@code descriptor} and returns it in canonical JVM form.
     * <p>
     * Backends may separate argument types with spaces, e.g. {@code (Landroid/os/Handler; I)V}. These separators are
     * dropped, so that equal methods always produce equal descriptors regardless of their origin.
     *
     * @param descriptor The method descriptor to normalize.
     *
     * @return The descriptor without separators, e.g. {@code (Landroid/os/Handler;I)V}.
     *
     * @throws MalformedDescriptorException If the {@code descriptor} lacks a balanced pair of parentheses or cannot
     *                                      be decomposed into argument and return types.
     */
    public static @NotNull String normalize(final String descriptor) {
        final int open  = descriptor.indexOf('(');
        final int close = descriptor.indexOf(')');
        if (open != 0 || close < open || descriptor.indexOf('(', 1) >= 0 || descriptor.indexOf(')', close + 1) >= 0)
            throw new MalformedDescriptorException(descriptor);

        final var compact = descriptor.replace(" ", "");
        final String canonical;
        try {
            canonical = Type.getMethodDescriptor(Type.getReturnType(compact), Type.getArgumentTypes(compact));
        } catch (final RuntimeException exception) {
            throw new MalformedDescriptorException(descriptor, exception);
        }
        // ASM is lenient about unterminated class types, which then fail to round-trip.
        if (!canonical.equals(compact))
            throw new MalformedDescriptorException(descriptor);
        return canonical;
    }
}
