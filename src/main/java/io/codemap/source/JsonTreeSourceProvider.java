package io.codemap.source;

import io.codemap.ast.RawNode;
import io.codemap.model.ModuleIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Serves modules from {@code *.json} quoted-tree files under one or more source roots.
 * <p>
 * Every call to {@link #enumerateModules()} walks the roots again and rebuilds the index,
 * so a rescan sees edited, added and removed files. A file that cannot be read is logged
 * and skipped.
 */
public class JsonTreeSourceProvider implements SourceProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeSourceProvider.class);

    private final List<Path> roots;
    private final QuotedJsonReader reader;
    private volatile Map<ModuleIdentifier, RawNode> index = Map.of();
    private volatile Map<ModuleIdentifier, Path> origins = Map.of();

    public JsonTreeSourceProvider(List<Path> roots) {
        this(roots, new QuotedJsonReader());
    }

    public JsonTreeSourceProvider(List<Path> roots, QuotedJsonReader reader) {
        this.roots = List.copyOf(roots);
        this.reader = reader;
    }

    @Override
    public Optional<RawNode> resolve(ModuleIdentifier module) {
        return Optional.ofNullable(index.get(module));
    }

    /**
     * File the module was last read from.
     */
    public Optional<Path> origin(ModuleIdentifier module) {
        return Optional.ofNullable(origins.get(module));
    }

    @Override
    public List<ModuleIdentifier> enumerateModules() throws IOException {
        Map<ModuleIdentifier, RawNode> modules = new LinkedHashMap<>();
        Map<ModuleIdentifier, Path> files = new LinkedHashMap<>();

        for (Path root : roots) {
            if (!Files.exists(root)) {
                log.warn("Source root does not exist: {}", root);
                continue;
            }
            for (Path file : jsonFiles(root)) {
                RawNode tree;
                try {
                    tree = reader.read(file);
                } catch (IOException e) {
                    log.warn("Skipping {}: {}", file, e.getMessage());
                    continue;
                }
                for (Map.Entry<ModuleIdentifier, RawNode> entry : ModuleLocator.index(tree).entrySet()) {
                    Path previous = files.put(entry.getKey(), file);
                    if (previous != null && !previous.equals(file)) {
                        log.warn("Module {} defined in both {} and {}, using the latter",
                            entry.getKey(), previous, file);
                    }
                    modules.put(entry.getKey(), entry.getValue());
                }
            }
        }

        index = Map.copyOf(modules);
        origins = Map.copyOf(files);
        log.debug("Indexed {} modules from {} roots", modules.size(), roots.size());
        return new ArrayList<>(modules.keySet());
    }

    private static List<Path> jsonFiles(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList();
        }
    }
}
