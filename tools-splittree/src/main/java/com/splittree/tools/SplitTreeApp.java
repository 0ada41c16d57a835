package com.splittree.tools;

import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.config.SplitTreeConfig;
import com.splittree.render.TreeRenderer;
import com.splittree.tree.ReconstructionResult;
import com.splittree.tree.SplitDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads split files (one split per line) and prints the reconstructed tree.
 * <pre>
 *   splittree [--demo | FILE...]
 * </pre>
 * With no arguments the splits are read from stdin. Exit code 0 for a complete tree, 1 when some
 * splits had to be skipped, 2 when nothing could be built.
 */
public class SplitTreeApp {
    private static final Logger log = LoggerFactory.getLogger(SplitTreeApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARTIAL = 1;
    public static final int EXIT_ERROR = 2;

    public static final String DEMO_FLAG = "--demo";

    static final List<List<String>> DEMOS = List.of(
            List.of("b/acde", "ba/cde", "bace/d", "bacd/e"),
            List.of("ABD/CEFG", "BD/ACEFG", "D/ABCEFG", "G/ABCDEF", "E/ABCDFG", "EF/ABCDG"));

    private final SplitTreeConfig config;
    private final TreeRenderer renderer;

    public SplitTreeApp(SplitTreeConfig config) {
        this(config, config.renderFormat().renderer());
    }

    SplitTreeApp(SplitTreeConfig config, TreeRenderer renderer) {
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public static void main(String[] args) {
        int code = new SplitTreeApp(SplitTreeConfig.load()).run(args, System.in, System.out, System.err);
        System.exit(code);
    }

    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        if (args.length == 1 && DEMO_FLAG.equals(args[0])) return runDemos(out, err);
        if (args.length == 0) {
            ErrorsOr<String> text = ErrorsOr.trying(() -> new String(in.readAllBytes(), StandardCharsets.UTF_8),
                    e -> "Cannot read stdin: " + e.getMessage());
            return process("stdin", text, out, err);
        }
        int worst = EXIT_OK;
        for (String file : args) {
            if (args.length > 1) out.println("# " + file);
            ErrorsOr<String> text = ErrorsOr.trying(() -> Files.readString(Path.of(file), StandardCharsets.UTF_8),
                    e -> "Cannot read " + file + ": " + e.getMessage());
            worst = Math.max(worst, process(file, text, out, err));
        }
        return worst;
    }

    int runDemos(PrintStream out, PrintStream err) {
        int worst = EXIT_OK;
        for (int i = 0; i < DEMOS.size(); i++) {
            List<String> splits = DEMOS.get(i);
            out.println("Running test case " + (i + 1) + ":");
            out.println();
            splits.forEach(out::println);
            out.println();
            worst = Math.max(worst, process("demo " + (i + 1), ErrorsOr.lift(String.join("\n", splits)), out, err));
            out.println();
        }
        return worst;
    }

    int process(String name, ErrorsOr<String> text, PrintStream out, PrintStream err) {
        ErrorsOr<ReconstructionResult> built = text
                .flatMap(t -> config.splitCodec().lines().decode(t))
                .flatMap(records -> {
                    log.info("Read {} splits from {}", records.size(), name);
                    return config.treeBuilder().buildFromRecords(records);
                })
                .addPrefixIfError(name + ": ");
        if (built.isError()) {
            built.getErrors().forEach(err::println);
            log.error("No tree built from {} ({} errors)", name, built.getErrors().size());
            return EXIT_ERROR;
        }

        ReconstructionResult result = built.valueOrThrow();
        ErrorsOr<String> rendered = renderer.render(result);
        if (rendered.isError()) {
            rendered.getErrors().forEach(err::println);
            return EXIT_ERROR;
        }
        out.print(rendered.valueOrThrow());
        for (SplitDiagnostic diagnostic : result.diagnostics()) err.println(name + ": " + diagnostic.describe());
        log.info("{}: {} leaves resolved, {} splits skipped", name, result.leafCount(), result.diagnostics().size());
        return result.isPartial() ? EXIT_PARTIAL : EXIT_OK;
    }
}
