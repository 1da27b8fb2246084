package com.valkyrlabs.model;

/**
 * The two kinds of node in the drive hierarchy.
 */
public enum NodeKind {
    FILE,
    FOLDER;

    public String toValue() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse used by expression-based permission checks ("file", "FOLDER",
     * or a simple/fully-qualified record class name such as "DriveFile").
     *
     * @return the kind, or null when the value names neither kind
     */
    public static NodeKind fromString(String value) {
        if (value == null) {
            return null;
        }
        String s = value.trim();
        int dot = s.lastIndexOf('.');
        if (dot >= 0) {
            s = s.substring(dot + 1);
        }
        s = s.toUpperCase();
        if (s.startsWith("DRIVE")) {
            s = s.substring("DRIVE".length());
        }
        if ("FILE".equals(s)) {
            return FILE;
        }
        if ("FOLDER".equals(s)) {
            return FOLDER;
        }
        return null;
    }
}
