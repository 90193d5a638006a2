package com.newtype.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newtype.Desugarer;
import com.newtype.Parser;
import com.newtype.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTest {

    private static final ObjectMapper mapper = NewtypeJackson.createObjectMapper();

    private static final String EVERY_NODE = String.join("\n",
        "import \"lib\" D, (a, b as c)",
        "import \"ns\" * as NS",
        "export type T P Q = case P of",
        "  0 -> { readonly a?: \"s\", -readonly b-?: 1.5 }",
        "  [true, ?X] -> if not Q == 123456789012345678901234567890 then P | Q & R else Q",
        "  _ -> F false",
        "interface I T extends Base T where",
        "  x : if A :> B then C",
        "  y : if A != B then C",
        "type L = let X = 1, Y = X | 2 in if X <: Y or not Y <: X then X");

    @Test
    void testSerializeTypeDefinition() throws Exception {
        String json = mapper.writeValueAsString(Parser.parse("type A = 1"));
        System.out.println("Serialized AST:\n" + json);

        JsonNode statement = mapper.readTree(json).get("statements").get(0);
        assertEquals("TypeDefinition", statement.get("type").asText());
        assertEquals("A", statement.get("name").asText());
        assertTrue(statement.has("params"), "params should be written even when absent");
        assertTrue(statement.get("params").isNull());
        assertEquals("IntegerLiteral", statement.get("body").get("type").asText());
        assertEquals(1, statement.get("body").get("value").asInt());
    }

    @Test
    void testLargeIntegersStayNumeric() throws Exception {
        String json = mapper.writeValueAsString(Parser.parseExpression("123456789012345678901234567890"));
        assertEquals("{\"type\":\"IntegerLiteral\",\"value\":123456789012345678901234567890}", json);
    }

    @Test
    void testExportStatement() throws Exception {
        assertEquals("{\"type\":\"ExportStatement\"}", mapper.writeValueAsString(new ExportStatement()));
        assertEquals(new ExportStatement(), mapper.readValue("{\"type\":\"ExportStatement\"}", Statement.class));
    }

    @Test
    void testDeserializeHandWrittenJson() throws Exception {
        String json = """
            {
              "statements": [
                {
                  "type": "TypeDefinition",
                  "name": "A",
                  "params": null,
                  "body": {
                    "type": "Union",
                    "left": { "type": "Identifier", "name": "B" },
                    "right": { "type": "StringLiteral", "value": "c" }
                  }
                }
              ],
              "comment": "unknown properties are ignored"
            }
            """;

        Program program = mapper.readValue(json, Program.class);
        assertEquals(Parser.parse("type A = B | \"c\""), program);
    }

    @Test
    void testRoundTripEveryNode() throws Exception {
        Program program = Parser.parse(EVERY_NODE);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(program);

        assertEquals(program, mapper.readValue(json, Program.class));
    }

    @Test
    void testRoundTripDesugared() throws Exception {
        Program program = Desugarer.simplify(Parser.parse(EVERY_NODE));
        String json = mapper.writeValueAsString(program);

        assertFalse(json.contains("CaseStatement"), "desugared tree has no case expressions");
        assertFalse(json.contains("LetExpression"), "desugared tree has no let expressions");
        assertFalse(json.contains("CompoundConditional"), "desugared tree has no compound conditionals");
        assertEquals(program, mapper.readValue(json, Program.class));
    }

    @Test
    void testImportClauseNames() throws Exception {
        ImportDeclaration decl = (ImportDeclaration) Parser.parseStatement("import \"lib\" D, (a, b as c)");
        JsonNode clause = mapper.readTree(mapper.writeValueAsString(decl)).get("importClause");

        assertEquals("ImportDefaultAndNamed", clause.get("type").asText());
        assertEquals("ImportedBinding", clause.get("specifiers").get(0).get("type").asText());
        assertEquals("ImportedAlias", clause.get("specifiers").get(1).get("type").asText());
    }

    @Test
    void testModifiersAndOperatorsByName() throws Exception {
        KeyValue prop = new KeyValue(Modifier.PRESENT, Modifier.ABSENT, "a", Identifier.never());
        JsonNode node = mapper.readTree(mapper.writeValueAsString(prop));
        assertEquals("PRESENT", node.get("readonly").asText());
        assertEquals("ABSENT", node.get("optional").asText());

        Expression expr = Parser.parseExpression("if A :> B then C");
        assertEquals("EXTENDS_RIGHT", mapper.readTree(mapper.writeValueAsString(expr)).get("op").asText());
    }

    @Test
    void testDeserializeExpressionByType() throws Exception {
        Expression expr = mapper.readValue("{\"type\":\"Tuple\",\"elements\":[{\"type\":\"BooleanLiteral\",\"value\":true}]}",
            Expression.class);
        assertEquals(Tuple.of(new BooleanLiteral(true)), expr);
        assertEquals(List.of(new BooleanLiteral(true)), ((Tuple) expr).elements());
    }
}
