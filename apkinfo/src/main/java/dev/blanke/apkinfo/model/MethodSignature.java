package dev.blanke.apkinfo.model;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Denotes a 3-tuple which uniquely identifies a method across all sub-images of an application package.
 * <p>
 * Only {@link #classDescriptor()}, {@link #name()} and {@link #descriptor()} take part in {@link #equals(Object)} and
 * {@link #hashCode()}. Two signatures produced from different sub-images, or by different backends, are therefore the
 * same logical method whenever their triples are equal.
 *
 * @param classDescriptor The type descriptor of the declaring class, e.g. {@code Ljava/lang/String;}. Empty for
 *                        methods without an owning class such as the imported {@code clone}.
 *
 * @param name The name of the method itself, e.g. {@code <init>} or {@code concat}.
 *
 * @param descriptor A descriptor specifying the parameter and return types of the method, e.g.
 *                   {@code (Ljava/lang/String;)Ljava/lang/String;}.
 *
 * @param accessFlags The access flags of the method as reported by the backend, if any.
 *
 * @param handle Information required to query the backend about this method again. Not part of the identity.
 */
public record MethodSignature(String classDescriptor, String name, String descriptor,
                              @Nullable String accessFlags, @Nullable BackendHandle handle) {

    /**
     * Class descriptor prefixes of packages shipped with the Android platform.
     *
     * @see <a href="https://developer.android.com/reference/packages">Android package index</a>
     */
    private static final List<String> ANDROID_API_PREFIXES = List.of(
        "Landroid/",
        "Lcom/google/android/",
        "Ldalvik/",
        "Ljava/",
        "Ljavax/",
        "Ljunit/",
        "Lorg/apache/",
        "Lorg/json/",
        "Lorg/w3c/",
        "Lorg/xml/",
        "Lorg/xmlpull/");

    public MethodSignature {
        Objects.requireNonNull(classDescriptor);
        Objects.requireNonNull(name);
        Objects.requireNonNull(descriptor);
    }

    public MethodSignature(final String classDescriptor, final String name, final String descriptor) {
        this(classDescriptor, name, descriptor, null, null);
    }

    /**
     * Parses a method reference of the form {@code Lpkg/Class;->name(descriptor)} as printed in smali code.
     *
     * @param reference The method reference to parse.
     *
     * @return A {@code MethodSignature} without access flags and backend handle.
     *
     * @throws IllegalArgumentException If the {@code reference} lacks the {@code ->} separator or a descriptor.
     */
    public static @NotNull MethodSignature fromReference(final String reference) {
        final int separator  = reference.indexOf("->");
        final int parenthesis = reference.indexOf('(', Math.max(separator, 0));
        if (separator < 0 || parenthesis < 0)
            throw new IllegalArgumentException("Not a method reference: " + reference);
        return new MethodSignature(reference.substring(0, separator),
            reference.substring(separator + 2, parenthesis), reference.substring(parenthesis));
    }

    public boolean isAndroidApi() {
        return ANDROID_API_PREFIXES.stream().anyMatch(classDescriptor::startsWith);
    }

    public boolean isImported() {
        return (handle != null) && handle.imported();
    }

    /**
     * Returns the smali form of this signature, {@code Lpkg/Class;->name(descriptor)}, which is how invocation
     * instructions refer to methods.
     */
    public @NotNull String reference() {
        return classDescriptor + "->" + name + descriptor;
    }

    @Override
    public boolean equals(final Object object) {
        if (!(object instanceof MethodSignature other))
            return false;
        return Objects.equals(classDescriptor(), other.classDescriptor())
            && Objects.equals(name(),            other.name())
            && Objects.equals(descriptor(),      other.descriptor());
    }

    @Override
    public int hashCode() {
        return Objects.hash(classDescriptor(), name(), descriptor());
    }

    @Override
    public String toString() {
        return classDescriptor + " " + name + " " + descriptor;
    }
}
