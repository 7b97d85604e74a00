package com.libragraph.salvage.core.esm;

public final class FormIds {

    private FormIds() {
    }

    public static String hex(int formId) {
        return String.format("0x%08X", formId);
    }

    /**
     * True when all four bytes are printable ASCII, which in practice means a tag
     * or a string fragment was misread as a FormID.
     */
    public static boolean looksLikeText(int formId) {
        for (int shift = 24; shift >= 0; shift -= 8) {
            int b = (formId >>> shift) & 0xFF;
            if (b < 0x20 || b > 0x7E) return false;
        }
        return true;
    }
}
