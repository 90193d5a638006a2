package com.newtype;

import com.newtype.ast.Program;
import com.newtype.printer.LayoutOptions;
import com.newtype.printer.Printer;

/**
 * The whole pipeline: parse, desugar, render.
 *
 * <pre>{@code
 * String ts = Newtype.compile("type A = case B of\n  C -> 1\n  _ -> 2");
 * // type A = B extends C ? 1 : 2
 * }</pre>
 */
public final class Newtype {

    private Newtype() {
        // Utility class
    }

    /**
     * @throws ParseException on the first syntax or indentation error
     */
    public static String compile(String source) {
        return compile(source, LayoutOptions.unbounded());
    }

    public static String compile(String source, LayoutOptions options) {
        Program program = Desugarer.simplify(Parser.parse(source));
        return new Printer(options).print(program);
    }

    /**
     * Like {@link #compile(String, LayoutOptions)}, but reports errors as a result.
     */
    public static ParseResult<String> tryCompile(String source, LayoutOptions options) {
        ParseResult<Program> parsed = Parser.parseProgram(source);
        if (!parsed.isSuccess()) {
            return ParseResult.failure(parsed.errors());
        }
        return ParseResult.success(new Printer(options).print(Desugarer.simplify(parsed.get())));
    }
}
