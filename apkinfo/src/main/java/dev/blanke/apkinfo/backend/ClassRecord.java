package dev.blanke.apkinfo.backend;

import com.google.gson.annotations.SerializedName;

/**
 * One entry of the backend's class listing.
 *
 * @param className The name of the class.
 *
 * @param superClass The name of its direct superclass.
 */
public record ClassRecord(@SerializedName("classname") String className,
                          @SerializedName("super")     String superClass) {}
