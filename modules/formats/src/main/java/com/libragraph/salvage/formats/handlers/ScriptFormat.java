package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Plain-text game script source ({@code scn Name} / {@code ScriptName Name}).
 * Scanned to the first non-text byte or the line before the next script header.
 */
@ApplicationScoped
public class ScriptFormat implements SignatureFormat {

    private static final List<byte[]> SCRIPT_HEADERS = List.of(
            ascii("scn "), ascii("Scn "), ascii("SCN "),
            ascii("ScriptName "), ascii("scriptname "), ascii("SCRIPTNAME "));
    private static final int MAX_SCAN = 100_000;

    private static final DetectionCriteria CRITERIA =
            new DetectionCriteria(SCRIPT_HEADERS, 0, 10, MAX_SCAN, 50);

    @Override
    public String id() {
        return "script";
    }

    @Override
    public FileCategory category() {
        return FileCategory.SCRIPT;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Optional<Extent> measure(BinaryData data, long offset) {
        byte[] text = data.read(offset, MAX_SCAN);
        if (text.length < 10) {
            return Optional.empty();
        }

        int firstLineEnd = indexOf(text, (byte) '\n', 0);
        if (firstLineEnd < 0) {
            return Optional.empty();
        }
        String firstLine = new String(text, 0, firstLineEnd, StandardCharsets.US_ASCII).trim();
        String lower = firstLine.toLowerCase(Locale.ROOT);
        String name;
        if (lower.startsWith("scn ")) {
            name = firstLine.substring(4).trim();
        } else if (lower.startsWith("scriptname ")) {
            name = firstLine.substring(11).trim();
        } else {
            return Optional.empty();
        }
        name = cutAtAny(name, ";\r\t ");
        if (name.isEmpty() || !name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
            return Optional.empty();
        }

        int end = findEnd(text, firstLineEnd);
        if (end < CRITERIA.minSize()) {
            return Optional.empty();
        }
        return Optional.of(new Extent(end, name));
    }

    private static int findEnd(byte[] text, int firstLineEnd) {
        int end = text.length;
        int searchStart = firstLineEnd + 1;

        for (byte[] header : SCRIPT_HEADERS) {
            int next = indexOf(text, header, searchStart);
            if (next >= 0) {
                int boundary = lastIndexOf(text, (byte) '\n', next - 1);
                end = Math.min(end, boundary >= 0 ? boundary : next);
            }
        }

        for (int i = 0; i < end; i++) {
            int b = text[i] & 0xFF;
            if (b == 0 || (b < 32 && b != '\t' && b != '\n' && b != '\r') || b > 126) {
                end = i;
                break;
            }
        }

        while (end > 0 && isWhitespace(text[end - 1])) {
            end--;
        }
        return end;
    }

    private static boolean isWhitespace(byte b) {
        return b == '\t' || b == '\n' || b == '\r' || b == ' ';
    }

    private static String cutAtAny(String s, String stops) {
        for (int i = 0; i < s.length(); i++) {
            if (stops.indexOf(s.charAt(i)) >= 0) {
                return s.substring(0, i);
            }
        }
        return s;
    }

    private static int indexOf(byte[] data, byte value, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == value) return i;
        }
        return -1;
    }

    private static int lastIndexOf(byte[] data, byte value, int from) {
        for (int i = from; i >= 0; i--) {
            if (data[i] == value) return i;
        }
        return -1;
    }

    private static int indexOf(byte[] data, byte[] pattern, int from) {
        outer:
        for (int i = from; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
