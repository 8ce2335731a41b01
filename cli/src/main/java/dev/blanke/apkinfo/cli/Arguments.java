package dev.blanke.apkinfo.cli;

import java.nio.file.Path;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import dev.blanke.apkinfo.model.MethodSignature;

/**
 * Encapsulates the command-line arguments that can be passed to the extraction tool.
 */
public final class Arguments {

    //region Input
    @Parameters(
        arity       = "1..*",
        description = """
            The APK or the DEX files making up the application.
            DEX files are given in sub-image order (classes.dex, classes2.dex, ...).""",
        paramLabel  = "<input>")
    private List<Path> inputs;

    public @NotNull List<Path> getInputs() {
        return (inputs != null) ? inputs : List.of();
    }

    @Option(
        names       = { "-r", "--rizin" },
        description = """
            The rizin executable used to analyze the sub-images.
            Defaults to ${DEFAULT-VALUE}, which is looked up on the PATH.""",
        defaultValue = "rizin",
        paramLabel   = "<executable>")
    private Path rizinExecutable = Path.of("rizin");

    public @NotNull Path getRizinExecutable() {
        return rizinExecutable;
    }
    //endregion

    //region Queries
    @Option(
        names       = { "-m", "--methods" },
        description = "List all methods. Implied if no other query is given.")
    private boolean listMethods;

    /**
     * @return {@code true} if methods should be listed, either because it was requested explicitly or because no other
     *         query was given.
     */
    public boolean getListMethods() {
        return listMethods || (!listStrings && (method == null) && (superclassOf == null));
    }

    @Option(
        names       = { "-s", "--strings" },
        description = "List all string constants.")
    private boolean listStrings;

    public boolean getListStrings() {
        return listStrings;
    }

    @Option(
        names       = "--method",
        description = """
            Print the callers and callees of a method given as smali reference.
            E.g. 'Landroid/telephony/SmsManager;->sendTextMessage(Ljava/lang/String;)V'.""",
        converter   = MethodReferenceConverter.class,
        paramLabel  = "<reference>")
    private MethodSignature method;

    public @Nullable MethodSignature getMethod() {
        return method;
    }

    @Option(
        names       = "--superclass",
        description = "Print the superclasses recorded for a class.",
        paramLabel  = "<class>")
    private String superclassOf;

    public @Nullable String getSuperclassOf() {
        return superclassOf;
    }
    //endregion

    static final class MethodReferenceConverter implements ITypeConverter<MethodSignature> {

        @Override
        public MethodSignature convert(final String value) {
            return MethodSignature.fromReference(value);
        }
    }
}
