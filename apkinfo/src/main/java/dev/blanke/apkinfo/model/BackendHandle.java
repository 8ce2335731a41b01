package dev.blanke.apkinfo.model;

/**
 * Opaque information carried by a {@link MethodSignature} so that the backend which produced it can be queried about
 * the method again.
 *
 * @param subImageIndex Index of the sub-image whose analysis session produced the method.
 *
 * @param address The code address of the method inside that sub-image.
 *
 * @param imported Whether the method is only referenced, not defined, by the sub-image.
 */
public record BackendHandle(int subImageIndex, long address, boolean imported) {}
