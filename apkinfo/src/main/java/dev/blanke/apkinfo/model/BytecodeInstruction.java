package dev.blanke.apkinfo.model;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A single disassembled Dalvik instruction.
 *
 * @param mnemonic The opcode name, e.g. {@code invoke-virtual} or {@code const-string}.
 *
 * @param registers The registers used by the instruction in operand order, e.g. {@code [v1, v2]}.
 *
 * @param parameter The trailing non-register operand, i.e. a literal, a type, a string, or a method reference of
 *                  the form {@code Lpkg/Class;->name(descriptor)}. {@code null} if the instruction has none.
 */
public record BytecodeInstruction(String mnemonic, List<String> registers, @Nullable String parameter) {

    public BytecodeInstruction {
        Objects.requireNonNull(mnemonic);
        registers = List.copyOf(registers);
    }

    public boolean isInvocation() {
        return mnemonic.startsWith("invoke");
    }
}
