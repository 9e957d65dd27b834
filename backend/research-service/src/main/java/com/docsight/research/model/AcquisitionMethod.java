package com.docsight.research.model;

/**
 * How page text was obtained: plain markup parsing or a rendered browser session.
 */
public enum AcquisitionMethod {
    STATIC("static"),
    DYNAMIC("dynamic");

    private final String code;

    AcquisitionMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
