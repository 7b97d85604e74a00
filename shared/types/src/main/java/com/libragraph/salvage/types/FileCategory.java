package com.libragraph.salvage.types;

/**
 * Signature family of a carved file. Classification is by signature only;
 * no content validation beyond structural sanity is implied.
 */
public enum FileCategory {
    VIDEO(0, "video"),
    TEXTURE(1, "texture"),
    AUDIO(2, "audio"),
    MODEL(3, "model"),
    SCRIPT(4, "script"),
    INTERFACE(5, "interface"),
    IMAGE(6, "image");

    private final int id;
    private final String label;

    FileCategory(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static FileCategory fromId(int id) {
        for (FileCategory c : values()) {
            if (c.id == id) return c;
        }
        throw new IllegalArgumentException("Unknown FileCategory id: " + id);
    }

    public static FileCategory fromLabel(String label) {
        for (FileCategory c : values()) {
            if (c.label.equalsIgnoreCase(label)) return c;
        }
        throw new IllegalArgumentException("Unknown FileCategory label: " + label);
    }
}
