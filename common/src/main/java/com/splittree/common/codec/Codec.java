package com.splittree.common.codec;

import com.splittree.common.errorsor.ErrorsOr;

import java.util.List;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    default Codec<To, From> invert() {
        return new Codec<To, From>() {
            @Override
            public ErrorsOr<From> encode(To p) {
                return Codec.this.decode(p);
            }

            @Override
            public ErrorsOr<To> decode(From from) {
                return Codec.this.encode(from);
            }
        };
    }

    /** One item per line; blank lines and '#' comments are skipped when decoding. */
    static <T> Codec<List<T>, String> lines(Codec<T, String> itemCodec) {
        return new LineSeparatedListCodec<>(itemCodec);
    }

    static Codec<Object, String> json() {
        return new JacksonJsonCodec(false);
    }

    static Codec<Object, String> prettyJson() {
        return new JacksonJsonCodec(true);
    }
}
