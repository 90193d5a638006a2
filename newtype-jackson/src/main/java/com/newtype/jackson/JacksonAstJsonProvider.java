package com.newtype.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.newtype.ast.Expression;
import com.newtype.ast.Program;
import com.newtype.ast.Statement;
import com.newtype.json.AstJsonDeserializer;
import com.newtype.json.AstJsonException;
import com.newtype.json.AstJsonProvider;
import com.newtype.json.AstJsonSerializer;

/**
 * The Jackson binding, registered in {@code META-INF/services}. One instance serves
 * as provider, serializer and deserializer.
 *
 * <p>Statements and expressions are written through a writer for their family
 * rather than their runtime class, so the {@code "type"} discriminator is always
 * present, even at the top level.</p>
 */
public class JacksonAstJsonProvider implements AstJsonProvider, AstJsonSerializer, AstJsonDeserializer {

    private final ObjectMapper mapper;
    private final ObjectWriter statementWriter;
    private final ObjectWriter expressionWriter;

    public JacksonAstJsonProvider() {
        this(NewtypeJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.statementWriter = mapper.writerFor(Statement.class);
        this.expressionWriter = mapper.writerFor(Expression.class);
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return this;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return this;
    }

    // ==================== Writing ====================

    @Override
    public String serialize(Program program) {
        return write(mapper.writer(), program, Program.class);
    }

    @Override
    public String serialize(Statement statement) {
        return write(statementWriter, statement, Statement.class);
    }

    @Override
    public String serialize(Expression expression) {
        return write(expressionWriter, expression, Expression.class);
    }

    @Override
    public String serializePretty(Program program) {
        return write(mapper.writerWithDefaultPrettyPrinter(), program, Program.class);
    }

    private static String write(ObjectWriter writer, Object node, Class<?> family) {
        try {
            return writer.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Cannot write AST as JSON", family, e);
        }
    }

    // ==================== Reading ====================

    @Override
    public Program deserializeProgram(String json) {
        return read(json, Program.class);
    }

    @Override
    public Statement deserializeStatement(String json) {
        return read(json, Statement.class);
    }

    @Override
    public Expression deserializeExpression(String json) {
        return read(json, Expression.class);
    }

    private <T> T read(String json, Class<T> family) {
        try {
            return mapper.readValue(json, family);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Cannot read AST from JSON", family, e);
        }
    }
}
