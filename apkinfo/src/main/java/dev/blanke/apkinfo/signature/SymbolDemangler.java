package dev.blanke.apkinfo.signature;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.backend.SymbolRecord;
import dev.blanke.apkinfo.model.BackendHandle;
import dev.blanke.apkinfo.model.MethodSignature;

/**
 * Recovers the {@link MethodSignature} of a method from a symbol record of the disassembly backend.
 * <p>
 * The backend encodes the declaring class only inside the flag name, e.g.
 * {@code sym.android.support.v4.app.Foo_Bar_getCapabilities}, where both package separators and nested class
 * separators have been mangled and the name may have been truncated. Demangling is therefore best-effort: records
 * which cannot be interpreted are logged and rejected by returning {@code null}.
 */
public final class SymbolDemangler {

    private static final Logger LOGGER = System.getLogger(SymbolDemangler.class.getName());

    private static final List<String> METHOD_SYMBOL_TYPES = List.of("FUNC", "METH");

    /**
     * Characters which the backend replaces with {@code _} inside flag names.
     */
    private static final char[] ESCAPED_CHARACTERS = { '<', '>', '$' };

    /**
     * Flag name of the imported {@link Object#clone()} which has no owning class.
     */
    private static final String CLONE_FLAG_NAME = "sym.imp.clone";

    private static final List<String> FLAG_NAME_PREFIXES = List.of("sym.", "imp.");

    private static final Pattern ARGUMENTS_PATTERN = Pattern.compile("\\(.*\\).*");

    private static final Pattern RETURN_TYPE_PATTERN = Pattern.compile("[A-Za-zL][A-Za-z0-9L/;\\[\\]$.]+ ");

    private static final Pattern METHOD_NAME_PATTERN = Pattern.compile("_+[A-Za-z]+");

    private SymbolDemangler() {
    }

    /**
     * Parses the provided symbol {@code record} into a {@link MethodSignature}.
     *
     * @param record The symbol record as listed by the backend.
     *
     * @param subImageIndex The index of the sub-image the record was listed for. Stored in the returned signature's
     *                      {@link BackendHandle}.
     *
     * @return The signature of the method described by the {@code record}, or {@code null} if the record does not
     *         describe a method or is too damaged to be interpreted.
     */
    public static @Nullable MethodSignature parse(final SymbolRecord record, final int subImageIndex) {
        if (!METHOD_SYMBOL_TYPES.contains(record.type()) || record.name() == null || record.flagName() == null)
            return null;

        final var descriptor = parseDescriptor(record.name());
        if (descriptor == null)
            return null;

        final var handle = new BackendHandle(subImageIndex, record.address(), record.imported());
        final var flagName = record.flagName();
        if (flagName.equals(CLONE_FLAG_NAME))
            return new MethodSignature("", "clone", "()Ljava/lang/Object;", null, handle);

        final var methodName = (record.realName() != null) ? record.realName() : "";
        var escapedMethodName = escape(methodName);
        if (escapedMethodName.endsWith("_")) {
            escapedMethodName = escapedMethodName.substring(0, escapedMethodName.length() - 1);
        }
        if (!flagName.contains(escapedMethodName)) {
            LOGGER.log(Level.WARNING, "The class name may be truncated: {0}", flagName);
        }

        final var classDescriptor = parseClassDescriptor(flagName);
        if (classDescriptor == null) {
            LOGGER.log(Level.WARNING, "Skipping damaged flag: {0}", flagName);
            return null;
        }
        return new MethodSignature(classDescriptor, methodName, descriptor, null, handle);
    }

    /**
     * Extracts the method descriptor from a display name, converting it from source syntax if necessary.
     *
     * @return The normalized descriptor, or {@code null} if none could be recovered.
     */
    private static @Nullable String parseDescriptor(final String displayName) {
        final Matcher argumentsMatcher = ARGUMENTS_PATTERN.matcher(displayName);
        if (!argumentsMatcher.find())
            return null;

        var descriptor = argumentsMatcher.group();
        // Source syntax, e.g. "void Request(android.os.Handler, String, String)"
        if (descriptor.endsWith(")")) {
            final var arguments =
                Arrays.stream(descriptor.substring(1, descriptor.length() - 1).split(", "))
                    .map(TypeSignatures::convert)
                    .collect(Collectors.joining());

            final Matcher returnTypeMatcher = RETURN_TYPE_PATTERN.matcher(displayName);
            if (!returnTypeMatcher.find()) {
                LOGGER.log(Level.WARNING, "Unresolved method signature: {0}", displayName);
                return null;
            }
            descriptor = "(" + arguments + ")" + TypeSignatures.convert(returnTypeMatcher.group().strip());
        }

        try {
            return Descriptors.normalize(descriptor);
        } catch (final MalformedDescriptorException exception) {
            LOGGER.log(Level.WARNING, "Skipping method with invalid descriptor: {0}", displayName);
            return null;
        }
    }

    /**
     * Drops the trailing method name and the {@code sym.}/{@code imp.} prefixes from a flag name and converts the
     * remainder into a class descriptor.
     *
     * @return The class descriptor, or {@code null} if the flag name does not contain a method name.
     */
    private static @Nullable String parseClassDescriptor(final String flagName) {
        final Matcher methodNameMatcher = METHOD_NAME_PATTERN.matcher(flagName);
        String lastMethodName = null;
        while (methodNameMatcher.find()) {
            lastMethodName = methodNameMatcher.group();
        }
        if (lastMethodName == null)
            return null;

        var className = flagName.substring(0, flagName.lastIndexOf(lastMethodName));
        boolean prefixStripped;
        do {
            prefixStripped = false;
            for (final var prefix : FLAG_NAME_PREFIXES) {
                if (className.startsWith(prefix)) {
                    className = className.substring(prefix.length());
                    prefixStripped = true;
                }
            }
        } while (prefixStripped);

        return TypeSignatures.convert(className);
    }

    /**
     * Replaces the characters which have a special meaning for the backend with {@code _}, the way the backend does
     * when deriving flag names.
     */
    static String escape(final String name) {
        var escaped = name;
        for (final char character : ESCAPED_CHARACTERS) {
            escaped = escaped.replace(character, '_');
        }
        return escaped;
    }
}
