package com.libragraph.salvage.core.esm;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Record and subrecord tags the scanner and lifters know about.
 *
 * <p>Only tags in {@link #RECORD_TYPES} start a record candidate. Tags are matched in
 * stored order and byte-reversed, since console memory holds them both ways.
 */
public final class RecordTypes {

    public static final String GROUP = "GRUP";
    public static final String FILE_HEADER = "TES4";

    public static final List<String> RECORD_TYPES = List.of(
            "TES4",
            "REFR", "ACHR", "ACRE", "PMIS", "PGRE",
            "NPC_", "CREA",
            "WEAP", "ARMO", "AMMO", "ALCH", "MISC", "NOTE", "KEYM", "BOOK",
            "CONT", "DOOR", "LIGH", "STAT", "TERM", "FURN",
            "CELL", "WRLD", "LAND", "NAVM", "NAVI", "PGRD",
            "QUST", "DIAL", "INFO", "PACK", "SCPT",
            "MGEF", "ENCH", "SPEL", "SOUN", "MUSC",
            "FACT", "RACE", "CLAS",
            "LVLI", "LVLN", "LVLC",
            "GMST", "GLOB",
            "WTHR", "CLMT", "REGN", "IMAD", "IMGS", "IMOD",
            "RCPE", "CHAL", "REPU", "PROJ", "EXPL", "MESG", "PERK");

    /** Null-terminated text subrecords. */
    public static final Set<String> TEXT_SUBRECORDS = Set.of("EDID", "FULL", "DESC", "NAM1", "CNAM");

    /** Subrecords whose first four bytes are a FormID in every record type that uses them. */
    public static final Set<String> REFERENCE_SUBRECORDS = Set.of(
            "SCRI", "ENAM", "SNAM", "QNAM", "QSTI", "NAME", "RNAM", "CNTO", "SCRO", "PNAM");

    public static final Set<String> PATH_SUBRECORDS = Set.of("MODL", "ICON");

    private static final Set<String> KNOWN = Set.copyOf(RECORD_TYPES);
    private static final Map<Integer, String> FORWARD = new HashMap<>();
    private static final Map<Integer, String> REVERSED = new HashMap<>();

    static {
        for (String tag : RECORD_TYPES) {
            register(tag);
        }
        register(GROUP);
    }

    private RecordTypes() {
    }

    public static boolean isKnown(String tag) {
        return KNOWN.contains(tag);
    }

    /**
     * Matches the four bytes read as a big-endian int against known tags.
     *
     * @return the tag, or null when the bytes are not a known tag either way round
     */
    static TagMatch match(int key) {
        String tag = FORWARD.get(key);
        if (tag != null) return new TagMatch(tag, false);
        tag = REVERSED.get(key);
        return tag != null ? new TagMatch(tag, true) : null;
    }

    private static void register(String tag) {
        byte[] b = tag.getBytes(StandardCharsets.US_ASCII);
        FORWARD.put(key(b[0], b[1], b[2], b[3]), tag);
        REVERSED.put(key(b[3], b[2], b[1], b[0]), tag);
    }

    private static int key(byte a, byte b, byte c, byte d) {
        return ((a & 0xFF) << 24) | ((b & 0xFF) << 16) | ((c & 0xFF) << 8) | (d & 0xFF);
    }

    record TagMatch(String tag, boolean reversed) {
    }
}
