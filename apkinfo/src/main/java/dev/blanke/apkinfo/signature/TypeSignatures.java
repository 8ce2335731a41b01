package dev.blanke.apkinfo.signature;

import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Converts type names in Java source syntax into JVM type descriptors.
 * <p>
 * For example, {@code int} becomes {@code I}, {@code String...} becomes {@code [Ljava/lang/String;}, and
 * {@code android.os.Handler} becomes {@code Landroid/os/Handler;}. Nested classes are expected to use {@code _} as
 * separator, the way the disassembly backend mangles them.
 */
public final class TypeSignatures {

    private static final Map<String, String> PRIMITIVE_DESCRIPTORS = Map.of(
        "void",    "V",
        "boolean", "Z",
        "byte",    "B",
        "char",    "C",
        "short",   "S",
        "int",     "I",
        "long",    "J",
        "float",   "F",
        "double",  "D");

    private TypeSignatures() {
    }

    /**
     * Converts the {@code rawType} into a JVM type descriptor.
     *
     * @param rawType A type name in source syntax. Array types may be written either as {@code T[]}, {@code [T},
     *                or, for variadic parameters, {@code T...}.
     *
     * @return The JVM type descriptor, or {@code rawType} itself if it is {@code null} or empty.
     */
    @Contract("null -> null; !null -> !null")
    public static @Nullable String convert(final @Nullable String rawType) {
        if (rawType == null || rawType.isEmpty())
            return rawType;

        if (rawType.endsWith("[]"))
            return "[" + convert(rawType.substring(0, rawType.length() - 2));
        if (rawType.startsWith("["))
            return "[" + convert(rawType.substring(1));

        final int ellipsis = rawType.indexOf("...");
        if (ellipsis >= 0)
            return "[" + convert(rawType.substring(0, ellipsis));

        final var primitive = PRIMITIVE_DESCRIPTORS.get(rawType);
        if (primitive != null)
            return primitive;

        if (rawType.contains(".") || rawType.contains("_"))
            return "L" + rawType.replace('.', '/').replace('_', '$') + ";";

        // Unqualified names such as String or Object.
        return "Ljava/lang/" + rawType + ";";
    }
}
