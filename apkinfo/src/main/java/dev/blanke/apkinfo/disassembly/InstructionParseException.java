package dev.blanke.apkinfo.disassembly;

/**
 * An {@code InstructionParseException} is thrown if a line of disassembly does not follow the format
 * {@code <mnemonic> [<register>, ...][, <parameter>]}.
 */
public final class InstructionParseException extends Exception {

    public InstructionParseException(final String message) {
        super(message);
    }

    public InstructionParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
