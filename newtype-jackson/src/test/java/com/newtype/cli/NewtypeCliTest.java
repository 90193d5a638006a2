package com.newtype.cli;

import com.newtype.Desugarer;
import com.newtype.Parser;
import com.newtype.ast.Program;
import com.newtype.json.AstJsonProvider;
import com.newtype.printer.LayoutOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class NewtypeCliTest {

    private static final String SOURCE = "type A = case B of\n  C -> 1\n  _ -> 2\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return NewtypeCli.run(args, in,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testCompileFile() throws Exception {
        Path file = write("a.nt", SOURCE);

        assertEquals(NewtypeCli.EXIT_OK, run("", file.toString()), err());
        assertEquals("type A = B extends C ? 1 : 2\n", out());
        assertEquals("", err());
    }

    @Test
    void testCompileStdin() {
        assertEquals(NewtypeCli.EXIT_OK, run("type A = 1\ntype B = 2", "-"));
        assertEquals("type A = 1\ntype B = 2\n", out());
    }

    @Test
    void testEmptyProgramPrintsNothing() {
        assertEquals(NewtypeCli.EXIT_OK, run("\n\n", "-"));
        assertEquals("", out());
    }

    @Test
    void testWidth() {
        assertEquals(NewtypeCli.EXIT_OK, run("type A = [1, 2]", "--width=12", "-"));
        assertEquals("type A =\n  [1, 2]\n", out());
    }

    @Test
    void testParseErrorIsReportedWithLocation() throws Exception {
        Path file = write("bad.nt", "type A =\n1\n");

        assertEquals(NewtypeCli.EXIT_PARSE_ERROR, run("", file.toString()));
        assertEquals(file + ":2:1: incorrect indentation (got 1, should be greater than 1)", err().strip());
        assertEquals("", out());
    }

    @Test
    void testParseErrorOnStdin() {
        assertEquals(NewtypeCli.EXIT_PARSE_ERROR, run("type A = ]", "-"));
        assertEquals("<stdin>:1:10: unexpected ']', expecting expression", err().strip());
    }

    @Test
    void testJson() {
        assertEquals(NewtypeCli.EXIT_OK, run(SOURCE, "--json", "-"));

        Program program = AstJsonProvider.getProvider().getDeserializer().deserializeProgram(out());
        assertEquals(Parser.parse(SOURCE), program);
        assertTrue(out().contains("CaseStatement"));
    }

    @Test
    void testJsonDesugared() {
        assertEquals(NewtypeCli.EXIT_OK, run(SOURCE, "--json", "--desugar", "-"));

        Program program = AstJsonProvider.getProvider().getDeserializer().deserializeProgram(out());
        assertEquals(Desugarer.simplify(Parser.parse(SOURCE)), program);
        assertFalse(out().contains("CaseStatement"));
    }

    @Test
    void testOutputFile() throws Exception {
        Path input = write("in.nt", "type A = 1");
        Path output = tempDir.resolve("out.ts");

        assertEquals(NewtypeCli.EXIT_OK, run("", "--output=" + output, input.toString()));
        assertEquals("type A = 1\n", Files.readString(output, StandardCharsets.UTF_8));
        assertEquals("", out());
    }

    @Test
    void testHelp() {
        assertEquals(NewtypeCli.EXIT_OK, run("", "--help"));
        assertTrue(out().startsWith("Usage: newtype"));
    }

    @Test
    void testUsageErrors() {
        assertEquals(NewtypeCli.EXIT_USAGE, run(""));
        assertTrue(err().contains("No input file given"), err());

        assertEquals(NewtypeCli.EXIT_USAGE, run("", "--fast", "-"));
        assertTrue(err().contains("Unknown option: --fast"), err());

        assertEquals(NewtypeCli.EXIT_USAGE, run("", "--width=wide", "-"));
        assertTrue(err().contains("Invalid width: wide"), err());

        assertEquals(NewtypeCli.EXIT_USAGE, run("", "--width=0", "-"));
        assertEquals(NewtypeCli.EXIT_USAGE, run("", "a.nt", "b.nt"));
    }

    @Test
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.nt");

        assertEquals(NewtypeCli.EXIT_IO_ERROR, run("", missing.toString()));
        assertTrue(err().startsWith("Error reading " + missing), err());
    }

    @Test
    void testConfigParse() {
        NewtypeCli.Config config = NewtypeCli.Config.parse(new String[] {"--json", "--width=40", "x.nt"});
        assertTrue(config.json());
        assertFalse(config.desugar());
        assertEquals(40, config.layoutOptions().pageWidth());
        assertEquals("x.nt", config.input());
        assertTrue(NewtypeCli.Config.parse(new String[] {"-"}).layoutOptions().isUnbounded());
    }

    @Test
    void testConfigIsAValue() {
        NewtypeCli.Config expected = new NewtypeCli.Config(false, true, false, LayoutOptions.UNBOUNDED, Path.of("out.ts"), "-");
        assertEquals(expected, NewtypeCli.Config.parse(new String[] {"--desugar", "--output=out.ts", "-"}));

        NewtypeCli.Config help = NewtypeCli.Config.parse(new String[] {"--json", "--help", "--bogus"});
        assertTrue(help.help());
        assertNull(help.input(), "options after --help are not read");
    }

    @Test
    void testLetAndCompoundConditionsCompile() throws Exception {
        Path file = write("let.nt", "type A = let X = B in if X <: D and not X <: E then X");

        assertEquals(NewtypeCli.EXIT_OK, run("", file.toString()), err());
        assertEquals("type A = B extends D ? B extends E ? never : B : never\n", out());
    }
}
