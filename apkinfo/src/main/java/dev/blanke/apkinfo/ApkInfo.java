package dev.blanke.apkinfo;

import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import dev.blanke.apkinfo.model.BytecodeInstruction;
import dev.blanke.apkinfo.model.MethodCall;
import dev.blanke.apkinfo.model.MethodSignature;
import dev.blanke.apkinfo.model.WrapperEvidence;

/**
 * Backend-independent view of the methods, strings, and call relationships of an application package, aggregated
 * across all of its sub-images.
 * <p>
 * Aggregating queries skip sub-images which cannot be analyzed, so results from the remaining sub-images stay
 * usable. Queries concerning a single method only involve the sub-image which produced the method and propagate its
 * failures.
 */
public interface ApkInfo extends AutoCloseable {

    /**
     * Returns the permissions requested by the package's manifest, or an empty set if the input has no manifest.
     */
    @NotNull Set<String> permissions();

    /**
     * Returns the imported methods belonging to the Android platform, e.g. {@code Landroid/telephony/SmsManager;}.
     */
    @NotNull Set<MethodSignature> androidApis();

    /**
     * Returns the methods implemented inside the package.
     */
    @NotNull Set<MethodSignature> customMethods();

    @NotNull Set<MethodSignature> allMethods();

    /**
     * Returns a method matching all provided components. A {@code null} component matches any value.
     *
     * @param classDescriptor The declaring class, e.g. {@code Landroid/telephony/SmsManager;}.
     *
     * @param name The method name, e.g. {@code sendTextMessage}.
     *
     * @param descriptor The method descriptor, e.g. {@code (Ljava/lang/String;)V}.
     *
     * @return The first matching method, or {@code null} if there is none.
     */
    @Nullable MethodSignature findMethod(@Nullable String classDescriptor, @Nullable String name,
                                         @Nullable String descriptor);

    /**
     * Returns the methods calling the provided {@code method}.
     */
    @NotNull Set<MethodSignature> upperfunc(MethodSignature method);

    /**
     * Returns the methods called by the provided {@code method}, one entry per call site.
     */
    @NotNull List<MethodCall> lowerfunc(MethodSignature method);

    /**
     * Returns the instructions of the provided {@code method}.
     * <p>
     * The instructions are only retrieved once iteration starts, and every new iteration retrieves them again.
     * Imported methods have no instructions.
     */
    @NotNull Iterable<BytecodeInstruction> getMethodBytecode(MethodSignature method);

    @NotNull Set<String> getStrings();

    /**
     * Returns the instructions by which {@code parent} invokes {@code first} and {@code second}.
     */
    @NotNull WrapperEvidence getWrapperEvidence(MethodSignature parent, MethodSignature first,
                                                MethodSignature second);

    /**
     * Returns the direct superclasses recorded for the class with the provided {@code className}.
     */
    @NotNull Set<String> superclassOf(String className);

    /**
     * Returns the direct subclasses of the class with the provided {@code className}.
     */
    @NotNull Set<String> subclassesOf(String className);

    @Override
    void close();
}
