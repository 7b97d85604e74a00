package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.util.BigEndian;

import java.util.ArrayList;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Record payload decoding: zlib inflation and subrecord splitting.
 */
final class RecordPayloads {

    static final int SUBRECORD_HEADER = 6;
    static final String EXTENDED_SIZE = "XXXX";

    private RecordPayloads() {
    }

    /**
     * Inflates a compressed payload: u32 decompressed size followed by a zlib stream.
     */
    static byte[] inflate(byte[] payload, long maxSize) throws MalformedRecordException {
        if (payload.length < 5) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_DECOMPRESSION_FAILED,
                    "compressed payload too short");
        }
        long declared = BigEndian.u32(payload, 0);
        if (declared == 0 || declared > maxSize) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_DECOMPRESSION_FAILED,
                    "implausible decompressed size " + declared);
        }
        byte[] out = new byte[(int) declared];
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(payload, 4, payload.length - 4);
            int produced = 0;
            while (produced < out.length && !inflater.finished()) {
                int n = inflater.inflate(out, produced, out.length - produced);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) break;
                produced += n;
            }
            if (produced != out.length) {
                throw new MalformedRecordException(DiagnosticKind.RECORD_DECOMPRESSION_FAILED,
                        "inflated " + produced + " of " + declared + " bytes");
            }
            return out;
        } catch (DataFormatException e) {
            throw new MalformedRecordException(DiagnosticKind.RECORD_DECOMPRESSION_FAILED,
                    "zlib: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    /**
     * Splits a payload into subrecords. The subrecords must tile the payload exactly.
     * An {@code XXXX} subrecord supplies a 32-bit length for the one after it.
     */
    static List<Subrecord> split(byte[] payload, boolean reversed) throws MalformedRecordException {
        List<Subrecord> out = new ArrayList<>();
        int pos = 0;
        long extended = -1;
        while (pos < payload.length) {
            if (payload.length - pos < SUBRECORD_HEADER) {
                throw new MalformedRecordException(DiagnosticKind.SUBRECORD_OVERRUN,
                        "truncated subrecord header at +" + pos);
            }
            String tag = reversed ? BigEndian.reversedTag(payload, pos) : BigEndian.tag(payload, pos);
            if (!plausibleTag(tag)) {
                throw new MalformedRecordException(DiagnosticKind.RECORD_INVALID,
                        "implausible subrecord tag at +" + pos);
            }
            long length = extended >= 0 ? extended : BigEndian.u16(payload, pos + 4);
            extended = -1;
            int dataStart = pos + SUBRECORD_HEADER;
            if (length > payload.length - dataStart) {
                throw new MalformedRecordException(DiagnosticKind.SUBRECORD_OVERRUN,
                        String.format("%s length %d runs past record end at +%d", tag, length, pos));
            }
            byte[] data = new byte[(int) length];
            System.arraycopy(payload, dataStart, data, 0, data.length);
            if (EXTENDED_SIZE.equals(tag) && data.length == 4) {
                extended = BigEndian.u32(data, 0);
            } else {
                out.add(new Subrecord(tag, pos, data));
            }
            pos = dataStart + data.length;
        }
        if (extended >= 0) {
            throw new MalformedRecordException(DiagnosticKind.SUBRECORD_OVERRUN,
                    "XXXX without following subrecord");
        }
        return out;
    }

    private static boolean plausibleTag(String tag) {
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            boolean ok = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            if (!ok) return false;
        }
        return true;
    }
}
