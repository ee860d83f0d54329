package com.example.filematcher.model;

import java.util.Locale;

public enum HashAlgorithm {
    MD5("MD5"),
    SHA256("SHA-256");

    private final String jcaName;

    HashAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    public String jcaName() {
        return jcaName;
    }

    public static HashAlgorithm parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
        try {
            return HashAlgorithm.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported hash algorithm '" + value + "' (expected md5 or sha256).", ex);
        }
    }
}
