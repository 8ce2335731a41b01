package dev.blanke.apkinfo.backend;

import com.google.gson.annotations.SerializedName;

import org.jetbrains.annotations.Nullable;

/**
 * A cross-reference pointing at a queried address.
 *
 * @param from The address the reference originates from. Absent for some reference kinds.
 *
 * @param type The kind of reference, e.g. {@code CALL}, {@code CODE}, or {@code DATA}.
 */
public record XrefRecord(@SerializedName("from") @Nullable Long from,
                         @SerializedName("type")           String type) {

    public boolean isCall() {
        return "CALL".equals(type);
    }
}
