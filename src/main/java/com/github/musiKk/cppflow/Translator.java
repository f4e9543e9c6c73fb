package com.github.musiKk.cppflow;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.github.musiKk.cppflow.flowchart.Flowchart;
import com.github.musiKk.cppflow.flowchart.FlowchartGenerator;
import com.github.musiKk.cppflow.optimizer.AstOptimizer;
import com.github.musiKk.cppflow.parser.AstPrinter;
import com.github.musiKk.cppflow.parser.CompilationUnit;
import com.github.musiKk.cppflow.parser.Parser;
import com.github.musiKk.cppflow.parser.Scopes;
import com.github.musiKk.cppflow.parser.TopLevelMode;

import lombok.Setter;

/**
 * Runs the whole pipeline: tokenize, parse, optimize and generate the flowchart.
 */
public class Translator implements ConfigReader.ConfigTarget {

    private static final Logger LOG = Logger.getLogger(Translator.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: cppflow [--config file] [--ast] [--scopes] [--no-optimize] <input.cpp> [output.mmd]";

    @Setter
    private TopLevelMode topLevelMode = TopLevelMode.STRICT_MAIN;
    @Setter
    private boolean optimize = true;
    @Setter
    private Set<String> ioIdentifiers = FlowchartGenerator.DEFAULT_IO_IDENTIFIERS;
    @Setter
    private String startLabel = "start";
    @Setter
    private String endLabel = "end";
    @Setter
    private String yesLabel = "yes";
    @Setter
    private String noLabel = "no";

    public record Translation(
            List<Diagnostic> lexicalDiagnostics,
            List<Diagnostic> diagnostics,
            Optional<CompilationUnit> ast,
            Optional<CompilationUnit> optimizedAst,
            Scopes scopes,
            Optional<Flowchart> flowchart) {

        public boolean isFatal() {
            return ast.isEmpty();
        }

        /** Lexical diagnostics first, then the parser's, each in source order of discovery. */
        public List<Diagnostic> allDiagnostics() {
            var all = new ArrayList<Diagnostic>(lexicalDiagnostics.size() + diagnostics.size());
            all.addAll(lexicalDiagnostics);
            all.addAll(diagnostics);
            return all;
        }

        public boolean hasErrors() {
            return allDiagnostics().stream().anyMatch(d -> Severity.of(d) == Severity.ERROR);
        }
    }

    public Translation translate(String source) {
        var tokens = new Tokenizer().tokenize(source);
        var parseResult = new Parser(topLevelMode).parseProgram(tokens);

        var ast = parseResult.compilationUnit();
        var optimized = optimize ? ast.map(new AstOptimizer()::optimize) : ast;
        var generator = new FlowchartGenerator(ioIdentifiers, startLabel, endLabel, yesLabel, noLabel);
        var flowchart = optimized.map(generator::generate);
        LOG.fine(() -> "translated " + tokens.tokens().size() + " tokens, "
                + (tokens.diagnostics().size() + parseResult.diagnostics().size()) + " diagnostics");

        return new Translation(
                List.copyOf(tokens.diagnostics()),
                parseResult.diagnostics(),
                ast,
                optimized,
                parseResult.scopes(),
                flowchart);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Optional<Path> configFile = Optional.empty();
        boolean dumpAst = false;
        boolean dumpScopes = false;
        boolean noOptimize = false;
        var positional = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        err.println("missing file after --config");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    configFile = Optional.of(Path.of(args[++i]));
                }
                case "--ast" -> dumpAst = true;
                case "--scopes" -> dumpScopes = true;
                case "--no-optimize" -> noOptimize = true;
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("unknown option " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        var translator = new Translator();
        String source;
        try {
            var config = configFile.isPresent()
                    ? ConfigReader.readConfig(configFile.get())
                    : ConfigReader.readConfig();
            config.applyConfig(translator);
            source = Files.readString(Path.of(positional.get(0)), StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "setup failed", e);
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        if (noOptimize) {
            translator.setOptimize(false);
        }

        var translation = translator.translate(source);
        for (var diagnostic : translation.allDiagnostics()) {
            err.println(Severity.of(diagnostic).label() + " " + diagnostic.format());
        }
        if (dumpAst) {
            translation.optimizedAst().ifPresent(cu -> err.print(AstPrinter.render(cu)));
        }
        if (dumpScopes) {
            err.print(translation.scopes().render());
        }
        if (translation.flowchart().isEmpty()) {
            return EXIT_FATAL;
        }

        var mermaid = translation.flowchart().get().toMermaid();
        if (positional.size() == 2) {
            try {
                Files.writeString(Path.of(positional.get(1)), mermaid, StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "cannot write " + positional.get(1), e);
                err.println("cannot write " + positional.get(1) + ": " + e.getMessage());
                return EXIT_FATAL;
            }
        } else {
            out.print(mermaid);
        }
        return EXIT_OK;
    }

}
