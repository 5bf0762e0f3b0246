package im.arun.printtree.cli;

import im.arun.printtree.config.ConfigLoader;
import im.arun.printtree.config.PrintTreeConfig;
import im.arun.printtree.io.DirectoryTreeBuilder;
import im.arun.printtree.io.JsonTreeReader;
import im.arun.printtree.model.Tree;
import im.arun.printtree.style.StyleRegistry;
import im.arun.printtree.style.TreeStyle;
import im.arun.printtree.util.TreeUtils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line interface for PrintTree using Picocli.
 */
@Command(
    name = "printtree",
    description = "Print a directory, a JSON document or a list of paths as a tree or an outline",
    mixinStandardHelpOptions = true,
    version = "PrintTree 1.0"
)
public class PrintTreeCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Directory to print")
    private String directory;

    @Option(names = {"--json"}, description = "Read the tree from a JSON file")
    private String jsonPath;

    @Option(names = {"--paths"}, description = "Read delimited paths, one per line, from a file (- for stdin)")
    private String pathsFile;

    @Option(names = {"--style", "-s"}, description = "Style name or id (see --list-styles)")
    private String style;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--sort"}, description = "Sort branches by label: none, shallow or deep")
    private String sort;

    @Option(names = {"--sizes"}, description = "Show file sizes when printing a directory")
    private Boolean showSizes;

    @Option(names = {"--all", "-a"}, description = "Include hidden files when printing a directory")
    private Boolean showHidden;

    @Option(names = {"--separator"}, description = "Path separator for --paths input")
    private String separator;

    @Option(names = {"--list-styles"}, description = "List the available styles and exit")
    private boolean listStyles;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ConfigLoader configLoader = new ConfigLoader(configPath);
        PrintTreeConfig config = configLoader.load(userOptions());

        StyleRegistry registry = new StyleRegistry();
        try {
            configLoader.registerStyles(config, registry);
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid style in configuration: " + e.getMessage());
            return 1;
        }

        if (listStyles) {
            printStyles(out, registry);
            return 0;
        }

        Optional<TreeStyle> treeStyle = registry.resolve(config.getStyle());
        if (treeStyle.isEmpty()) {
            err.println("Error: unknown style: " + config.getStyle());
            return 1;
        }

        Tree tree;
        try {
            tree = readTree(config);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (tree == null) {
            err.println("Error: give a directory, --json FILE or --paths FILE");
            return 1;
        }

        switch (config.getSort()) {
            case SHALLOW:
                tree.sort();
                break;
            case DEEP:
                tree.deepSort();
                break;
            default:
                break;
        }

        out.print(tree.print(treeStyle.get(), registry));
        out.flush();
        return 0;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        if (style != null) options.put("style", style);
        if (sort != null) options.put("sort", sort);
        if (showSizes != null) options.put("showSizes", showSizes);
        if (showHidden != null) options.put("showHidden", showHidden);
        if (separator != null) options.put("pathSeparator", separator);
        return options;
    }

    private Tree readTree(PrintTreeConfig config) throws IOException {
        if (jsonPath != null) {
            return new JsonTreeReader().read(existing(jsonPath));
        }
        if (pathsFile != null) {
            return TreeUtils.fromPaths(readLines(pathsFile), config.getPathSeparator());
        }
        if (directory != null) {
            return new DirectoryTreeBuilder(config.isShowHidden(), config.isShowSizes())
                .build(Paths.get(directory));
        }
        return null;
    }

    private List<String> readLines(String file) throws IOException {
        if ("-".equals(file)) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return reader.lines().collect(Collectors.toList());
        }
        return Files.readAllLines(existing(file), StandardCharsets.UTF_8);
    }

    private Path existing(String file) throws IOException {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + file);
        }
        return path;
    }

    private void printStyles(PrintWriter out, StyleRegistry registry) {
        Tree sample = Tree.newTree();
        Tree top = sample.addBranch("root");
        top.addBranch("branch").addBranches("leaf", "leaf");
        top.addBranch("last");

        registry.names().forEach((id, name) -> {
            out.printf("%2d  %s%n", id, name);
            for (String line : sample.print(TreeStyle.of(id), registry).split("\n")) {
                out.println("      " + line);
            }
        });
        out.flush();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PrintTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
