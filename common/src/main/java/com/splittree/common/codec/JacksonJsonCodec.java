package com.splittree.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.splittree.common.errorsor.ErrorsOr;

public final class JacksonJsonCodec implements Codec<Object, String> {
    private final ObjectMapper mapper;

    public JacksonJsonCodec(boolean pretty) {
        this.mapper = new ObjectMapper();
        this.mapper.findAndRegisterModules();
        if (pretty) this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ErrorsOr<String> encode(Object value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to write json: {0}: {1}", e);
        }
    }

    @Override
    public ErrorsOr<Object> decode(String json) {
        try {
            return ErrorsOr.lift(mapper.readValue(json, Object.class));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read json: {0}: {1}", e);
        }
    }
}
