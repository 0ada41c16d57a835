package com.splittree.common.codec;

import com.splittree.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Text with one item per line.
 * <p>
 * Decoding tolerates {@code \r\n} line endings, skips blank lines and lines starting with {@code #},
 * and prefixes every item error with its 1-based line number. Errors of all lines are aggregated.
 */
public final class LineSeparatedListCodec<T> implements Codec<List<T>, String> {
    public static final String COMMENT_PREFIX = "#";

    private final Codec<T, String> item;

    public LineSeparatedListCodec(Codec<T, String> item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public ErrorsOr<String> encode(List<T> from) {
        try {
            if (from == null || from.isEmpty()) return ErrorsOr.lift("");
            StringBuilder sb = new StringBuilder();
            var errors = new ArrayList<String>();
            for (int i = 0; i < from.size(); i++) {
                if (i > 0) sb.append('\n');
                ErrorsOr<String> encode = item.encode(from.get(i));
                if (encode.isError()) errors.addAll(encode.errorsOrThrow());
                else sb.append(encode.valueOrThrow());
            }
            if (errors.isEmpty()) {
                return ErrorsOr.lift(sb.toString());
            } else {
                return ErrorsOr.errors(errors);
            }
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode list: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<List<T>> decode(String to) {
        try {
            if (to == null || to.isEmpty()) return ErrorsOr.lift(List.of());
            String[] lines = to.split("\n", -1);

            List<T> out = new ArrayList<>(lines.length);
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < lines.length; i++) {
                String line = stripCarriageReturn(lines[i]);
                if (isSkippable(line)) continue;
                ErrorsOr<T> decode = item.decode(line).addPrefixIfError("line " + (i + 1) + ": ");
                if (decode.isError())
                    errors.addAll(decode.errorsOrThrow());
                else
                    out.add(decode.valueOrThrow());
            }
            if (errors.isEmpty()) {
                return ErrorsOr.lift(out);
            } else {
                return ErrorsOr.errors(errors);
            }
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode list: " + e.getMessage());
        }
    }

    static boolean isSkippable(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
