package dev.blanke.apkinfo.backend;

import java.util.List;

import com.google.gson.annotations.SerializedName;

import org.jetbrains.annotations.Nullable;

/**
 * One instruction of a disassembled function.
 *
 * @param offset The address of the instruction.
 *
 * @param disassembly The textual disassembly, e.g. {@code invoke-direct {v1}, Ljava/lang/Object.<init>()V}.
 *
 * @param bytes The encoded instruction as a hex string, e.g. {@code 70100000}.
 *
 * @param xrefsFrom The references leaving this instruction, if any.
 */
public record DisassembledOp(@SerializedName("offset")     long   offset,
                             @SerializedName("disasm")     String disassembly,
                             @SerializedName("bytes")      String bytes,
                             @SerializedName("xrefs_from") @Nullable List<Target> xrefsFrom) {

    /**
     * The destination of a reference leaving an instruction.
     *
     * @param address The referenced address.
     *
     * @param type The kind of reference, e.g. {@code CALL}.
     */
    public record Target(@SerializedName("addr") long address, @SerializedName("type") String type) {

        public boolean isCall() {
            return "CALL".equals(type);
        }
    }

    public List<Target> outgoingReferences() {
        return (xrefsFrom != null) ? xrefsFrom : List.of();
    }
}
