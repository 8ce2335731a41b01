package dev.blanke.apkinfo.backend;

import com.google.gson.annotations.SerializedName;

/**
 * One entry of the backend's symbol listing.
 *
 * @param type The kind of symbol, e.g. {@code FUNC}, {@code METH}, or {@code FIELD}.
 *
 * @param name The display name. Depending on the symbol it either uses source syntax
 *             ({@code int getCapabilities(android.accessibilityservice.AccessibilityServiceInfo)}) or carries a JVM
 *             descriptor ({@code imp.get()Ljava/lang/Object;}).
 *
 * @param realName The unqualified method name, e.g. {@code getCapabilities}.
 *
 * @param flagName The mangled flag name, e.g. {@code sym.imp.java.util.concurrent.FutureTask_get}.
 *                 May be truncated by the backend.
 *
 * @param imported Whether the symbol is imported from outside the sub-image.
 *
 * @param address The virtual address of the symbol.
 */
public record SymbolRecord(@SerializedName("type")        String  type,
                           @SerializedName("name")        String  name,
                           @SerializedName("realname")    String  realName,
                           @SerializedName("flagname")    String  flagName,
                           @SerializedName("is_imported") boolean imported,
                           @SerializedName("vaddr")       long    address) {}
