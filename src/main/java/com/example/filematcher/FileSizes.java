package com.example.filematcher;

import java.util.Locale;

final class FileSizes {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileSizes() {
    }

    static String format(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024.0 && unit < UNITS.length - 1) {
            value /= 1024.0;
            unit++;
        }
        if (unit == 0) {
            return bytes + " B";
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }
}
