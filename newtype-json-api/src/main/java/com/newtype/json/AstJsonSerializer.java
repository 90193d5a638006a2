package com.newtype.json;

import com.newtype.ast.Expression;
import com.newtype.ast.Program;
import com.newtype.ast.Statement;

/**
 * Writes Newtype trees as JSON. Every statement and expression object carries a
 * {@code "type"} property naming its variant.
 */
public interface AstJsonSerializer {

    String serialize(Program program) throws AstJsonException;

    String serialize(Statement statement) throws AstJsonException;

    String serialize(Expression expression) throws AstJsonException;

    /** Indented output, as printed by {@code newtype --json}. */
    String serializePretty(Program program) throws AstJsonException;
}
