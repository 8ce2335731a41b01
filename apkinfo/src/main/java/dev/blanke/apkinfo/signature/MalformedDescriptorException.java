package dev.blanke.apkinfo.signature;

/**
 * A {@code MalformedDescriptorException} is thrown if a method descriptor lacks a balanced pair of parentheses or
 * contains characters which do not form valid type descriptors.
 */
public final class MalformedDescriptorException extends IllegalArgumentException {

    public MalformedDescriptorException(final String descriptor) {
        super("Invalid descriptor: " + descriptor);
    }

    public MalformedDescriptorException(final String descriptor, final Throwable cause) {
        super("Invalid descriptor: " + descriptor, cause);
    }
}
