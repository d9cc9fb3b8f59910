package com.jsrefactor.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMappers that read and write the AST as ESTree JSON.
 *
 * <pre>
 * ObjectMapper mapper = SleightJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse(code));
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class SleightJackson {

    private SleightJackson() {
    }

    /**
     * Nulls are dropped except for the ESTree fields that are always present
     * ({@code alternate}, {@code argument}, {@code test}, {@code init}, {@code cooked}).
     * Unknown properties are ignored when reading, so JSON from other ESTree
     * parsers loads as long as its node types are known.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
