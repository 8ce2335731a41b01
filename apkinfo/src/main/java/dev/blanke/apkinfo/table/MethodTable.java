package dev.blanke.apkinfo.table;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.model.MethodSignature;

/**
 * The methods of a single sub-image, grouped by the descriptor of their declaring class.
 * <p>
 * Each class bucket contains every {@link MethodSignature} at most once; signatures listed more than once by the
 * backend are collapsed into the first occurrence.
 */
public final class MethodTable {

    private final int subImageIndex;

    private final Map<String, Set<MethodSignature>> methodsByClass;

    /**
     * Canonical instances of all signatures in this table, used to look up the instance carrying the backend handle.
     */
    private final Map<MethodSignature, MethodSignature> canonicalMethods;

    private MethodTable(final int subImageIndex, final Map<String, Set<MethodSignature>> methodsByClass) {
        this.subImageIndex  = subImageIndex;
        this.methodsByClass = methodsByClass;

        final var canonical = new HashMap<MethodSignature, MethodSignature>();
        methodsByClass.values().forEach(methods -> methods.forEach(method -> canonical.putIfAbsent(method, method)));
        this.canonicalMethods = canonical;
    }

    public int getSubImageIndex() {
        return subImageIndex;
    }

    public @NotNull Set<String> classes() {
        return methodsByClass.keySet();
    }

    /**
     * Returns the methods declared by the class with the provided {@code classDescriptor}.
     *
     * @return The methods of the class, or an empty set if the class is unknown.
     */
    public @NotNull Set<MethodSignature> methods(final String classDescriptor) {
        return methodsByClass.getOrDefault(classDescriptor, Set.of());
    }

    public @NotNull Stream<MethodSignature> allMethods() {
        return methodsByClass.values().stream().flatMap(Set::stream);
    }

    /**
     * Returns the instance stored in this table which is equal to the provided {@code method}.
     *
     * @return The stored signature including its backend handle, or {@code null} if the method is not part of this
     *         table.
     */
    public @Nullable MethodSignature canonical(final MethodSignature method) {
        return canonicalMethods.get(method);
    }

    public int size() {
        return canonicalMethods.size();
    }

    @Override
    public boolean equals(final Object object) {
        return (this == object) || (object instanceof MethodTable other)
            && (subImageIndex == other.subImageIndex)
            && methodsByClass.equals(other.methodsByClass);
    }

    @Override
    public int hashCode() {
        return 31 * subImageIndex + methodsByClass.hashCode();
    }

    static Builder builder(final int subImageIndex) {
        return new Builder(subImageIndex);
    }

    static final class Builder {

        private final int subImageIndex;

        private final Map<String, Set<MethodSignature>> methodsByClass = new LinkedHashMap<>();

        private Builder(final int subImageIndex) {
            this.subImageIndex = subImageIndex;
        }

        Builder add(final MethodSignature method) {
            methodsByClass.computeIfAbsent(method.classDescriptor(), key -> new LinkedHashSet<>()).add(method);
            return this;
        }

        MethodTable build() {
            final var frozen = new LinkedHashMap<String, Set<MethodSignature>>();
            methodsByClass.forEach((className, methods) ->
                frozen.put(className, Collections.unmodifiableSet(new LinkedHashSet<>(methods))));
            return new MethodTable(subImageIndex, Collections.unmodifiableMap(frozen));
        }
    }
}
