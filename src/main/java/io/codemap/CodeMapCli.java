package io.codemap;

import io.codemap.graph.ArityMatching;
import io.codemap.graph.Graph;
import io.codemap.graph.TraversalException;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.output.BlockOutput;
import io.codemap.output.GraphPresenter;
import io.codemap.ast.RawNode;
import io.codemap.source.JsonTreeSourceProvider;
import io.codemap.source.QuotedJsonWriter;
import io.codemap.store.BlockNotFoundException;
import io.codemap.store.ScanSummary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry point for codemap.
 */
@Command(
        name = "codemap",
        mixinStandardHelpOptions = true,
        version = "codemap 1.0.0",
        description = "Normalizes Elixir modules into call blocks and builds call graphs from them.",
        subcommands = {
                CodeMapCli.ModulesCommand.class,
                CodeMapCli.BlockCommand.class,
                CodeMapCli.AstCommand.class,
                CodeMapCli.GraphCommand.class
        },
        footer = {
                "",
                "Source roots hold quoted module trees exported as JSON (*.json).",
                "",
                "Examples:",
                "  codemap modules build/quoted",
                "  codemap block Test.Support.Math -r build/quoted",
                "  codemap ast Test.Support.Math -r build/quoted --indent 4",
                "  codemap graph MyApp.Orders place 2 -r build/quoted --format mermaid",
                "  codemap graph MyApp.Orders place 2 -c codemap.yaml --max-nodes 200"
        }
)
public class CodeMapCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_FOUND = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return EXIT_OK;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeMapCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Options shared by every subcommand that reads sources.
     */
    static class SourceOptions {

        @Option(
                names = {"-c", "--config"},
                description = "Path to configuration YAML file (default: ./" + CodeMapConfig.DEFAULT_FILE_NAME + " if present)"
        )
        Path configFile;

        @Option(
                names = {"-r", "--root"},
                description = "Source root holding quoted-tree JSON files. Repeatable; overrides sourceRoots from the config.",
                split = ","
        )
        List<Path> roots;

        @Option(
                names = {"-v", "--verbose"},
                description = "Print scan statistics"
        )
        boolean verbose;

        CodeMapConfig loadConfig() throws IOException {
            Path path = configFile;
            if (path == null && Files.exists(Path.of(CodeMapConfig.DEFAULT_FILE_NAME))) {
                path = Path.of(CodeMapConfig.DEFAULT_FILE_NAME);
            }
            if (path != null && !Files.exists(path)) {
                throw new IOException("Config file does not exist: " + path);
            }
            CodeMapConfig config = path != null ? CodeMapConfig.load(path) : CodeMapConfig.defaults();
            return config.override(roots, null, null, null);
        }

        /**
         * Scan the configured roots into a fresh CodeMap.
         */
        CodeMap open(CodeMapConfig config) {
            CodeMap codeMap = CodeMap.create(new JsonTreeSourceProvider(config.getSourceRoots()),
                    config.toTraversalOptions());
            ScanSummary summary = codeMap.rescan().join();
            if (verbose) {
                System.err.println("Scanned " + summary.discovered() + " modules in "
                        + summary.duration().toMillis() + " ms (" + summary.failed().size() + " failed)");
            }
            return codeMap;
        }
    }

    @Command(name = "modules", mixinStandardHelpOptions = true,
            description = "List the modules found in the source roots.")
    static class ModulesCommand implements Callable<Integer> {

        @Mixin
        SourceOptions source;

        @Parameters(arity = "0..*", paramLabel = "ROOT", description = "Additional source roots")
        List<Path> extraRoots;

        @Override
        public Integer call() {
            CodeMapConfig config;
            try {
                config = source.loadConfig();
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }
            if (extraRoots != null && !extraRoots.isEmpty()) {
                List<Path> roots = new ArrayList<>(config.getSourceRoots());
                roots.addAll(extraRoots);
                config = config.override(roots, null, null, null);
            }
            if (config.getSourceRoots().isEmpty()) {
                System.err.println("Error: No source roots given. Use --root or sourceRoots in the config.");
                return EXIT_ERROR;
            }

            try (CodeMap codeMap = source.open(config)) {
                codeMap.listModules().stream()
                        .sorted()
                        .forEach(System.out::println);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "block", mixinStandardHelpOptions = true,
            description = "Print the normalized block of one module.")
    static class BlockCommand implements Callable<Integer> {

        @Mixin
        SourceOptions source;

        @Parameters(index = "0", paramLabel = "MODULE", description = "Module name, e.g. Test.Support.Math")
        String module;

        @Option(names = "--json", description = "Print the block as JSON")
        boolean json;

        @Override
        public Integer call() {
            ModuleIdentifier id;
            CodeMapConfig config;
            try {
                id = ModuleIdentifier.of(module);
                config = source.loadConfig();
            } catch (IllegalArgumentException | IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }

            try (CodeMap codeMap = source.open(config)) {
                ModuleBlock block = codeMap.requireBlock(id);
                BlockOutput output = new BlockOutput();
                System.out.print(json ? output.renderJson(block) + System.lineSeparator() : output.renderText(block));
                return EXIT_OK;
            } catch (BlockNotFoundException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_NOT_FOUND;
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }

    @Command(name = "ast", mixinStandardHelpOptions = true,
            description = "Print the raw quoted tree of one module as JSON.")
    static class AstCommand implements Callable<Integer> {

        @Mixin
        SourceOptions source;

        @Parameters(index = "0", paramLabel = "MODULE", description = "Module name, e.g. Test.Support.Math")
        String module;

        @Option(names = {"-i", "--indent"}, defaultValue = "2", description = "Spaces per nesting level (default: 2)")
        int indent;

        @Override
        public Integer call() {
            if (indent < 0) {
                System.err.println("Error: --indent must not be negative");
                return EXIT_ERROR;
            }

            ModuleIdentifier id;
            CodeMapConfig config;
            try {
                id = ModuleIdentifier.of(module);
                config = source.loadConfig();
            } catch (IllegalArgumentException | IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }

            try {
                JsonTreeSourceProvider provider = new JsonTreeSourceProvider(config.getSourceRoots());
                List<ModuleIdentifier> modules = provider.enumerateModules();
                if (source.verbose) {
                    System.err.println("Indexed " + modules.size() + " modules");
                }
                Optional<RawNode> tree = provider.resolve(id);
                if (tree.isEmpty()) {
                    System.err.println("Error: Module not found: " + id);
                    return EXIT_NOT_FOUND;
                }
                System.out.println(new QuotedJsonWriter().write(tree.get(), indent));
                return EXIT_OK;
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }

    @Command(name = "graph", mixinStandardHelpOptions = true,
            description = "Build the call graph reachable from one function.")
    static class GraphCommand implements Callable<Integer> {

        enum Format {
            text,
            mermaid
        }

        @Mixin
        SourceOptions source;

        @Parameters(index = "0", paramLabel = "MODULE", description = "Module of the start function")
        String module;

        @Parameters(index = "1", paramLabel = "FUNCTION", description = "Name of the start function")
        String function;

        @Parameters(index = "2", paramLabel = "ARITY", description = "Arity of the start function")
        int arity;

        @Option(names = {"-f", "--format"}, defaultValue = "text",
                description = "Output format: text (default), mermaid")
        Format format;

        @Option(names = "--max-nodes", description = "Stop expanding after this many nodes (0 = unlimited)")
        Integer maxNodes;

        @Option(names = "--max-edges", description = "Stop expanding after this many edges (0 = unlimited)")
        Integer maxEdges;

        @Option(names = "--strict-arity",
                description = "Do not match clauses that carry no arity information")
        boolean strictArity;

        @Option(names = "--no-color", description = "Disable ANSI colors in text output")
        boolean noColor;

        @Override
        public Integer call() {
            if ((maxNodes != null && maxNodes < 0) || (maxEdges != null && maxEdges < 0)) {
                System.err.println("Error: --max-nodes and --max-edges must not be negative");
                return EXIT_ERROR;
            }

            CodeMapConfig config;
            try {
                config = source.loadConfig()
                        .override(null, strictArity ? ArityMatching.STRICT : null, maxNodes, maxEdges);
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }

            try (CodeMap codeMap = source.open(config)) {
                Graph graph = codeMap.buildCallGraph(module, function, arity);
                if (graph.nodeCount() == 1 && codeMap.getBlock(graph.start().module()).isEmpty()) {
                    System.err.println("Warning: module " + graph.start().module() + " was not found in the source roots");
                }
                String rendered = switch (format) {
                    case text -> new GraphPresenter(!noColor).renderText(graph);
                    case mermaid -> codeMap.renderDiagram(graph);
                };
                System.out.print(rendered);
                return EXIT_OK;
            } catch (TraversalException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }
}
