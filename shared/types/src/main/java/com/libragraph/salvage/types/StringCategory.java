package com.libragraph.salvage.types;

public enum StringCategory {
    FILE_PATH(0, "file-path"),
    EDITOR_ID(1, "editor-id"),
    DIALOGUE_LINE(2, "dialogue"),
    GAME_SETTING(3, "game-setting"),
    OTHER(4, "other");

    private final int id;
    private final String label;

    StringCategory(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static StringCategory fromId(int id) {
        for (StringCategory c : values()) {
            if (c.id == id) return c;
        }
        throw new IllegalArgumentException("Unknown StringCategory id: " + id);
    }
}
