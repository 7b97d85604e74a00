package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.types.StringCategory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic string categorization. Rules are tried in order: file path, game setting,
 * editor ID, dialogue line; anything else is {@link StringCategory#OTHER}.
 */
public final class StringClassifier {

    static final List<String> FILE_EXTENSIONS = List.of(
            ".nif", ".dds", ".ddx", ".kf", ".wav", ".lip", ".psc", ".txt", ".esm", ".esp",
            ".bsa", ".xml", ".ini", ".fuz", ".xwm", ".bik", ".mp3", ".ogg", ".xur", ".xui", ".scda");

    static final Set<String> PATH_PREFIXES = Set.of(
            "meshes", "textures", "sound", "interface", "menus", "scripts", "shaders", "music",
            "video", "strings", "grass", "trees", "landscape", "actors", "characters", "creatures",
            "effects", "clutter", "architecture", "weapons", "armor", "lodsettings", "data",
            "bsa", "esm", "esp");

    private static final List<String> TECHNICAL_MARKERS = List.of(
            "LOD", "MULTIBOUND", "0x", "NULL", "WARNING", "ERROR", "ASSERT", "DEBUG");

    private StringClassifier() {
    }

    public static StringCategory classify(String s) {
        if (isFilePath(s)) return StringCategory.FILE_PATH;
        if (isGameSetting(s)) return StringCategory.GAME_SETTING;
        if (isEditorId(s)) return StringCategory.EDITOR_ID;
        if (isDialogueLine(s)) return StringCategory.DIALOGUE_LINE;
        return StringCategory.OTHER;
    }

    static boolean isFilePath(String s) {
        if (s.length() < 6) return false;
        char first = s.charAt(0);
        if (!Character.isLetterOrDigit(first) && first != '_') return false;

        String lower = s.toLowerCase(Locale.ROOT);
        for (String ext : FILE_EXTENSIONS) {
            if (lower.endsWith(ext)) return true;
        }

        int separators = 0;
        int firstSeparator = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '/') {
                separators++;
                if (firstSeparator < 0) firstSeparator = i;
            }
        }
        if (separators == 0) return false;
        if (separators >= 2 && s.length() >= 10) return true;
        return firstSeparator >= 3 && PATH_PREFIXES.contains(lower.substring(0, firstSeparator));
    }

    /**
     * Hungarian-prefixed setting names such as {@code fCombatDistance} or {@code iMaxPlayers}.
     */
    static boolean isGameSetting(String s) {
        if (s.length() < 8) return false;
        char prefix = s.charAt(0);
        if (prefix != 'f' && prefix != 'i' && prefix != 'b' && prefix != 'u') return false;
        if (!Character.isUpperCase(s.charAt(1)) || !Character.isLowerCase(s.charAt(2))) return false;
        int upper = 0;
        int lower = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c)) return false;
            if (Character.isUpperCase(c)) upper++;
            else if (Character.isLowerCase(c)) lower++;
        }
        return upper >= 2 && lower >= 4;
    }

    static boolean isEditorId(String s) {
        if (s.length() < 6 || !Character.isUpperCase(s.charAt(0))) return false;
        int upper = 0;
        int lower = 0;
        Set<Character> distinct = new HashSet<>();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') return false;
            if (Character.isUpperCase(c)) upper++;
            else if (Character.isLowerCase(c)) lower++;
            distinct.add(c);
        }
        return lower >= 2 && upper >= 1 && distinct.size() >= Math.max(4, s.length() / 5);
    }

    static boolean isDialogueLine(String s) {
        if (s.length() < 25 || s.indexOf(' ') < 0 || !Character.isLetter(s.charAt(0))) return false;
        int upper = 0;
        int lower = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c)) upper++;
            else if (Character.isLowerCase(c)) lower++;
        }
        return lower > 2 * upper && !isTechnical(s);
    }

    private static boolean isTechnical(String s) {
        if (s.contains("Level ") && s.contains("Cells")) return true;
        for (String marker : TECHNICAL_MARKERS) {
            if (s.contains(marker)) return true;
        }
        return false;
    }
}
