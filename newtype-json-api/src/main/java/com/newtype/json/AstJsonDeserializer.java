package com.newtype.json;

import com.newtype.ast.Expression;
import com.newtype.ast.Program;
import com.newtype.ast.Statement;

/**
 * Rebuilds Newtype trees from the JSON written by {@link AstJsonSerializer}.
 * Reading what was written yields an equal tree.
 */
public interface AstJsonDeserializer {

    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * @throws AstJsonException if the JSON is malformed or its {@code "type"} is not a statement
     */
    Statement deserializeStatement(String json) throws AstJsonException;

    /**
     * @throws AstJsonException if the JSON is malformed or its {@code "type"} is not an expression
     */
    Expression deserializeExpression(String json) throws AstJsonException;
}
