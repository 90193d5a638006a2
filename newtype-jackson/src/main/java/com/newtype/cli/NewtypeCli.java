package com.newtype.cli;

import com.newtype.Desugarer;
import com.newtype.ParseError;
import com.newtype.ParseResult;
import com.newtype.Parser;
import com.newtype.ast.Program;
import com.newtype.json.AstJsonException;
import com.newtype.json.AstJsonProvider;
import com.newtype.printer.LayoutOptions;
import com.newtype.printer.Printer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line driver: compiles one Newtype source file to TypeScript, or dumps its AST as JSON.
 *
 * Usage:
 *   java -cp ... com.newtype.cli.NewtypeCli [options] <file | ->
 *
 * Options:
 *   --json          Print the AST as JSON instead of TypeScript
 *   --desugar       With --json, desugar case, let and compound if first
 *   --width=N       Page width for line breaking (default: unbounded)
 *   --output=PATH   Write the result to PATH instead of stdout
 *
 * Exit codes: 0 success, 1 parse error, 2 usage error, 3 I/O error.
 */
public class NewtypeCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARSE_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO_ERROR = 3;

    private static final String STDIN = "-";

    private final Config config;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the driver against the given streams and returns the process exit code.
     */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Config config;
        try {
            config = Config.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (config.help()) {
            printUsage(out);
            return EXIT_OK;
        }
        return new NewtypeCli(config, in, out, err).run();
    }

    NewtypeCli(Config config, InputStream in, PrintStream out, PrintStream err) {
        this.config = config;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    int run() {
        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            err.println("Error reading " + config.displayName() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        ParseResult<Program> parsed = Parser.parseProgram(source);
        if (!parsed.isSuccess()) {
            for (ParseError error : parsed.errors()) {
                err.println(config.displayName() + ":" + error);
            }
            return EXIT_PARSE_ERROR;
        }

        String result;
        if (config.json()) {
            Program program = config.desugar() ? Desugarer.simplify(parsed.get()) : parsed.get();
            try {
                result = AstJsonProvider.getProvider().getSerializer().serializePretty(program);
            } catch (AstJsonException e) {
                err.println("Failed to write JSON: " + e.getMessage());
                return EXIT_IO_ERROR;
            }
        } else {
            // Rendering desugars on its own
            result = new Printer(config.layoutOptions()).print(parsed.get());
        }

        try {
            writeResult(result);
        } catch (IOException e) {
            err.println("Error writing " + config.output() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        return EXIT_OK;
    }

    private String readSource() throws IOException {
        if (config.input().equals(STDIN)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(config.input()), StandardCharsets.UTF_8);
    }

    private void writeResult(String result) throws IOException {
        String text = result.isEmpty() ? result : result + "\n";
        if (config.output() == null) {
            out.print(text);
            out.flush();
        } else {
            Files.writeString(config.output(), text, StandardCharsets.UTF_8);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: newtype [options] <file | ->");
        stream.println();
        stream.println("Options:");
        stream.println("  --json          Print the AST as JSON instead of TypeScript");
        stream.println("  --desugar       With --json, desugar case, let and compound if first");
        stream.println("  --width=N       Page width for line breaking (default: unbounded)");
        stream.println("  --output=PATH   Write the result to PATH instead of stdout");
        stream.println("  --help          Show this help");
        stream.println();
        stream.println("Examples:");
        stream.println("  newtype types.nt");
        stream.println("  newtype --json --desugar - < types.nt");
    }

    // ========== Inner classes ==========

    /**
     * Parsed command line. {@code input} is null only when {@code help} is set.
     */
    public record Config(boolean json, boolean desugar, boolean help, int width, Path output, String input) {

        /**
         * @throws IllegalArgumentException on an unknown option, a bad value, or a missing input
         */
        public static Config parse(String[] args) {
            boolean json = false;
            boolean desugar = false;
            int width = LayoutOptions.UNBOUNDED;
            Path output = null;
            String input = null;

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return new Config(json, desugar, true, width, output, input);
                } else if (arg.equals("--json")) {
                    json = true;
                } else if (arg.equals("--desugar")) {
                    desugar = true;
                } else if (arg.startsWith("--width=")) {
                    width = parseWidth(arg.substring(8));
                } else if (arg.startsWith("--output=")) {
                    String path = arg.substring(9);
                    if (path.isEmpty()) {
                        throw new IllegalArgumentException("--output needs a path");
                    }
                    output = Path.of(path);
                } else if (arg.equals(STDIN) || !arg.startsWith("-")) {
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input file may be given");
                    }
                    input = arg;
                } else {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }

            if (input == null) {
                throw new IllegalArgumentException("No input file given");
            }
            return new Config(json, desugar, false, width, output, input);
        }

        private static int parseWidth(String value) {
            int width;
            try {
                width = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid width: " + value, e);
            }
            if (width <= 0) {
                throw new IllegalArgumentException("Width must be positive: " + value);
            }
            return width;
        }

        LayoutOptions layoutOptions() {
            return width == LayoutOptions.UNBOUNDED ? LayoutOptions.unbounded() : LayoutOptions.width(width);
        }

        String displayName() {
            return input.equals(STDIN) ? "<stdin>" : input;
        }
    }
}
