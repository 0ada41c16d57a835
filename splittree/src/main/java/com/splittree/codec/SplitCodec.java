package com.splittree.codec;

import com.splittree.common.codec.Codec;
import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.tree.LabelSet;
import com.splittree.tree.SplitErrorKind;
import com.splittree.tree.SplitRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Text form of a split: two label groups around a delimiter, e.g. {@code b/acde}.
 * <p>
 * Decoding trims the line and requires exactly one delimiter, two non-empty sides, no blank labels,
 * and no label named twice. Every error message starts with {@code MalformedSplit: }.
 */
public final class SplitCodec implements Codec<SplitRecord, String> {
    public static final char DEFAULT_DELIMITER = '/';

    private final char delimiter;
    private final LabelStyle labelStyle;

    public SplitCodec() {
        this(DEFAULT_DELIMITER, LabelStyle.CHARACTER);
    }

    public SplitCodec(char delimiter, LabelStyle labelStyle) {
        this.labelStyle = Objects.requireNonNull(labelStyle, "labelStyle");
        if (Character.isWhitespace(delimiter) || (labelStyle == LabelStyle.DELIMITED && delimiter == LabelStyle.LABEL_SEPARATOR)) {
            throw new IllegalArgumentException("Unusable split delimiter '" + delimiter + "' for " + labelStyle);
        }
        this.delimiter = delimiter;
    }

    /** Codec for a whole file: one split per line, blank lines and '#' comments ignored. */
    public Codec<List<SplitRecord>, String> lines() {
        return Codec.lines(this);
    }

    @Override
    public ErrorsOr<String> encode(SplitRecord record) {
        if (record == null) return malformed("null split");
        return encodeSide(record.sideA()).flatMap(a -> encodeSide(record.sideB()).map(b -> a + delimiter + b));
    }

    @Override
    public ErrorsOr<SplitRecord> decode(String text) {
        if (text == null) return malformed("null split");
        String line = text.trim();
        int at = line.indexOf(delimiter);
        if (at < 0) return malformed("no '" + delimiter + "' in '" + line + "'");
        if (line.indexOf(delimiter, at + 1) >= 0) return malformed("more than one '" + delimiter + "' in '" + line + "'");

        List<String> errors = new ArrayList<>();
        List<String> a = labels(line.substring(0, at), "left", line, errors);
        List<String> b = labels(line.substring(at + 1), "right", line, errors);
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);

        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String label : a) if (!seen.add(label)) duplicates.add(label);
        for (String label : b) if (!seen.add(label)) duplicates.add(label);
        if (!duplicates.isEmpty()) return malformed("label(s) " + duplicates + " named more than once in '" + line + "'");

        return ErrorsOr.lift(new SplitRecord(LabelSet.copyOf(a), LabelSet.copyOf(b), line));
    }

    private List<String> labels(String side, String which, String line, List<String> errors) {
        if (side.isBlank()) {
            errors.add(SplitErrorKind.MALFORMED_SPLIT.format(which + " side is empty in '" + line + "'"));
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (labelStyle == LabelStyle.CHARACTER) {
            String trimmed = side.trim();
            for (int i = 0; i < trimmed.length(); i++) {
                char ch = trimmed.charAt(i);
                if (Character.isWhitespace(ch)) {
                    errors.add(SplitErrorKind.MALFORMED_SPLIT.format("blank label in " + which + " side of '" + line + "'"));
                    return List.of();
                }
                out.add(String.valueOf(ch));
            }
        } else {
            for (String raw : side.split(String.valueOf(LabelStyle.LABEL_SEPARATOR), -1)) {
                String label = raw.trim();
                if (label.isEmpty()) {
                    errors.add(SplitErrorKind.MALFORMED_SPLIT.format("empty label in " + which + " side of '" + line + "'"));
                    return List.of();
                }
                out.add(label);
            }
        }
        return out;
    }

    private ErrorsOr<String> encodeSide(LabelSet side) {
        StringBuilder sb = new StringBuilder();
        for (String label : side) {
            boolean fits = labelStyle == LabelStyle.CHARACTER
                    ? label.length() == 1 && label.charAt(0) != delimiter && !Character.isWhitespace(label.charAt(0))
                    : !label.isBlank() && label.indexOf(delimiter) < 0 && label.indexOf(LabelStyle.LABEL_SEPARATOR) < 0;
            if (!fits) return malformed("label '" + label + "' cannot be written as " + labelStyle);
            if (labelStyle == LabelStyle.DELIMITED && sb.length() > 0) sb.append(LabelStyle.LABEL_SEPARATOR);
            sb.append(label);
        }
        return ErrorsOr.lift(sb.toString());
    }

    private static <T> ErrorsOr<T> malformed(String message) {
        return ErrorsOr.error(SplitErrorKind.MALFORMED_SPLIT.format(message));
    }
}
