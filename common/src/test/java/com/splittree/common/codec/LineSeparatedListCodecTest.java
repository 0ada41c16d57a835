package com.splittree.common.codec;

import com.splittree.common.errorsor.ErrorsOr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LineSeparatedListCodecTest {

    /** Item codec that encodes ints as strings, but returns an error for negatives. */
    static class IntItemCodecWithErrors implements Codec<Integer, String> {
        @Override public ErrorsOr<String> encode(Integer from) {
            if (from < 0) return ErrorsOr.error("negatives not allowed: " + from);
            return ErrorsOr.lift(String.valueOf(from));
        }
        @Override public ErrorsOr<Integer> decode(String to) {
            try {
                int v = Integer.parseInt(to.trim());
                if (v < 0) return ErrorsOr.error("negatives not allowed: " + v);
                return ErrorsOr.lift(v);
            } catch (NumberFormatException nfe) {
                return ErrorsOr.error("not a number: " + to);
            }
        }
    }

    /** Item codec that throws to exercise the outer try/catch branch. */
    static class ThrowingItemCodec implements Codec<Integer, String> {
        @Override public ErrorsOr<String> encode(Integer from) {
            throw new RuntimeException("kaboom-encode");
        }
        @Override public ErrorsOr<Integer> decode(String to) {
            throw new RuntimeException("kaboom-decode");
        }
    }

    private final LineSeparatedListCodec<Integer> lines = new LineSeparatedListCodec<>(new IntItemCodecWithErrors());

    @Test
    void decode_skips_blank_lines_and_comments() {
        String wire = "# header\n10\n\n   \n  # indented comment\n20\n";
        assertEquals(List.of(10, 20), lines.decode(wire).valueOrThrow());
    }

    @Test
    void decode_accepts_crlf_line_endings() {
        assertEquals(List.of(1, 2), lines.decode("1\r\n2\r\n").valueOrThrow());
    }

    @Test
    void decode_aggregates_errors_with_line_numbers() {
        String wire = "10\nfoo\n# skipped\n-5\n20";
        var errs = lines.decode(wire).errorsOrThrow();
        assertEquals(List.of("line 2: not a number: foo", "line 4: negatives not allowed: -5"), errs);
    }

    @Test
    void encode_aggregates_errors_from_item_codec() {
        var errs = lines.encode(List.of(-1, 1, -2)).errorsOrThrow();
        assertEquals(2, errs.size());
        assertTrue(errs.get(0).contains("negatives not allowed: -1"));
        assertTrue(errs.get(1).contains("negatives not allowed: -2"));
    }

    @Test
    void encode_joins_items_with_newlines() {
        assertEquals("1\n2\n3", lines.encode(List.of(1, 2, 3)).valueOrThrow());
    }

    @Test
    void unexpected_exceptions_are_wrapped() {
        LineSeparatedListCodec<Integer> throwing = new LineSeparatedListCodec<>(new ThrowingItemCodec());
        assertTrue(throwing.encode(List.of(1, 2)).errorsOrThrow().get(0).startsWith("Failed to encode list: kaboom-encode"));
        assertTrue(throwing.decode("1\n2").errorsOrThrow().get(0).startsWith("Failed to decode list: kaboom-decode"));
    }

    @Test
    void null_and_empty_inputs_are_handled() {
        assertEquals("", lines.encode(null).valueOrThrow());
        assertTrue(lines.decode(null).valueOrThrow().isEmpty());
        assertTrue(lines.decode("").valueOrThrow().isEmpty());
    }

    @Test
    void constructor_rejects_null_item_codec() {
        assertThrows(NullPointerException.class, () -> new LineSeparatedListCodec<>(null));
    }
}
