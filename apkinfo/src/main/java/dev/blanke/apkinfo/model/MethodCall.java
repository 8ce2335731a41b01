package dev.blanke.apkinfo.model;

/**
 * A call from one method to {@link #callee()}, located {@link #offset()} bytes after the start of the calling method.
 *
 * @param callee The invoked method.
 *
 * @param offset Distance in bytes between the start of the calling method and the invocation instruction.
 */
public record MethodCall(MethodSignature callee, long offset) {}
