package io.codemap;

import io.codemap.graph.ArityMatching;
import io.codemap.graph.TraversalOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration loaded from a YAML file ({@code codemap.yaml}).
 * <p>
 * Example:
 * <pre>
 * sourceRoots:
 *   - build/quoted
 * arityMatching: strict
 * maxNodes: 500
 * maxEdges: 2000
 * excludeModules:
 *   - Kernel
 *   - Ecto.
 * </pre>
 * Relative source roots are resolved against the directory holding the file.
 */
public class CodeMapConfig {

    public static final String DEFAULT_FILE_NAME = "codemap.yaml";

    private final List<Path> sourceRoots;
    private final ArityMatching arityMatching;
    private final int maxNodes;
    private final int maxEdges;
    private final List<String> excludeModules;

    public CodeMapConfig(List<Path> sourceRoots,
                         ArityMatching arityMatching,
                         int maxNodes,
                         int maxEdges,
                         List<String> excludeModules) {
        this.sourceRoots = List.copyOf(sourceRoots);
        this.arityMatching = arityMatching != null ? arityMatching : ArityMatching.LENIENT;
        this.maxNodes = maxNodes;
        this.maxEdges = maxEdges;
        this.excludeModules = List.copyOf(excludeModules);
    }

    /**
     * Configuration used when no file is given: no roots, lenient matching, no budgets.
     */
    public static CodeMapConfig defaults() {
        return new CodeMapConfig(List.of(), ArityMatching.LENIENT, 0, 0, List.of());
    }

    /**
     * Load configuration from a YAML file.
     */
    @SuppressWarnings("unchecked")
    public static CodeMapConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded = yaml.load(in);
            if (!(loaded instanceof Map<?, ?>)) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }
            Map<String, Object> data = (Map<String, Object>) loaded;
            Path baseDir = configPath.toAbsolutePath().getParent();

            List<Path> roots = new ArrayList<>();
            for (String root : toList(data.get("sourceRoots"), "sourceRoots")) {
                Path path = Path.of(root);
                roots.add(path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize());
            }

            ArityMatching matching = parseArityMatching(data.get("arityMatching"));
            int maxNodes = toBudget(data.get("maxNodes"), "maxNodes");
            int maxEdges = toBudget(data.get("maxEdges"), "maxEdges");
            List<String> excludeModules = toList(data.get("excludeModules"), "excludeModules");

            return new CodeMapConfig(roots, matching, maxNodes, maxEdges, excludeModules);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse {@code lenient} or {@code strict}, case-insensitively. Null means lenient.
     */
    public static ArityMatching parseArityMatching(Object value) {
        if (value == null) {
            return ArityMatching.LENIENT;
        }
        try {
            return ArityMatching.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("arityMatching must be lenient or strict, got: " + value);
        }
    }

    private static int toBudget(Object value, String key) {
        if (value == null) {
            return 0;
        }
        if (!(value instanceof Number number) || number.intValue() < 0) {
            throw new IllegalArgumentException(key + " must be a non-negative integer, got: " + value);
        }
        return number.intValue();
    }

    private static List<String> toList(Object value, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        return list.stream()
            .filter(s -> s != null && !s.toString().trim().isEmpty())
            .map(s -> s.toString().trim())
            .toList();
    }

    /**
     * Copy with the given values replacing configured ones where not null.
     */
    public CodeMapConfig override(List<Path> roots, ArityMatching matching, Integer nodes, Integer edges) {
        return new CodeMapConfig(
            roots != null && !roots.isEmpty() ? roots : sourceRoots,
            matching != null ? matching : arityMatching,
            nodes != null ? nodes : maxNodes,
            edges != null ? edges : maxEdges,
            excludeModules);
    }

    public TraversalOptions toTraversalOptions() {
        return new TraversalOptions(arityMatching, maxNodes, maxEdges, excludeModules, null);
    }

    public List<Path> getSourceRoots() {
        return sourceRoots;
    }

    public ArityMatching getArityMatching() {
        return arityMatching;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public int getMaxEdges() {
        return maxEdges;
    }

    public List<String> getExcludeModules() {
        return excludeModules;
    }
}
