package com.newtype.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the {@link ObjectMapper} that reads and writes Newtype ASTs.
 *
 * <p>AST records are bound through their canonical constructors, which needs the
 * {@code -parameters} compiler flag and {@link ParameterNamesModule}. Absent type
 * parameters are written as {@code "params": null}.</p>
 */
public final class NewtypeJackson {

    private NewtypeJackson() {
        // Utility class
    }

    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new ParameterNamesModule())
            .addModule(new AstModule())
            // ExportStatement has no components and is written as its type alone
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
