package io.codemap.store;

import io.codemap.ast.AstNormalizer;
import io.codemap.ast.NormalizationException;
import io.codemap.ast.RawNode;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.source.SourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * In-memory cache of normalized modules.
 * <p>
 * Rescans run on a single writer thread owned by the store and replace entries one key at a time,
 * so readers see either the previous block or the new one, never a partial one. Lookups never block.
 */
public class BlockStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockStore.class);

    private final ConcurrentMap<ModuleIdentifier, ModuleBlock> blocks = new ConcurrentHashMap<>();
    private final SourceProvider provider;
    private final AstNormalizer normalizer;
    private final ExecutorService writer;

    public BlockStore(SourceProvider provider) {
        this(provider, new AstNormalizer());
    }

    public BlockStore(SourceProvider provider, AstNormalizer normalizer) {
        this.provider = provider;
        this.normalizer = normalizer;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "codemap-block-store");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Cached block for a module.
     */
    public Optional<ModuleBlock> lookup(ModuleIdentifier module) {
        return Optional.ofNullable(blocks.get(module));
    }

    /**
     * Identifiers of every cached module.
     */
    public Set<ModuleIdentifier> list() {
        return Set.copyOf(blocks.keySet());
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Store a block directly, replacing any previous block for the same module.
     */
    public void put(ModuleBlock block) {
        blocks.put(block.name(), block);
    }

    /**
     * Queue a rescan on the writer thread.
     * Scans triggered while one is running execute after it, in order.
     * After {@link #close()} the returned future fails with {@link IllegalStateException}.
     */
    public CompletableFuture<ScanSummary> rescan() {
        try {
            return CompletableFuture.supplyAsync(this::rescanNow, writer);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Block store is closed", e));
        }
    }

    /**
     * Enumerate, resolve and normalize every module on the calling thread.
     * A module that fails is logged and skipped; the rest of the scan continues.
     */
    public ScanSummary rescanNow() {
        Instant start = Instant.now();
        log.info("Scanning modules...");

        List<ModuleIdentifier> modules;
        try {
            modules = provider.enumerateModules();
        } catch (IOException e) {
            log.warn("Could not enumerate modules: {}", e.getMessage());
            return new ScanSummary(0, 0, List.of(), Duration.between(start, Instant.now()));
        }
        log.info("Found {} modules", modules.size());

        int normalized = 0;
        List<ModuleIdentifier> failed = new ArrayList<>();
        for (ModuleIdentifier module : modules) {
            if (refresh(module)) {
                normalized++;
            } else {
                failed.add(module);
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        log.info("Scan complete: {} modules cached, {} failed ({} ms)",
            blocks.size(), failed.size(), duration.toMillis());
        return new ScanSummary(modules.size(), normalized, failed, duration);
    }

    /**
     * Re-normalize one module and swap in the result.
     *
     * @return true if the module was stored
     */
    public boolean refresh(ModuleIdentifier module) {
        try {
            Optional<RawNode> tree = provider.resolve(module);
            if (tree.isEmpty()) {
                log.warn("Failed to parse module {}: source not found", module);
                return false;
            }
            ModuleBlock block = normalizer.normalize(tree.get());
            blocks.put(module, block);
            log.debug("Parsed module {}", module);
            return true;
        } catch (NormalizationException e) {
            log.warn("Failed to parse module {}: {}", module, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to parse module {}", module, e);
            return false;
        }
    }

    /**
     * Stop the writer thread. Queued scans that have not started are dropped.
     */
    @Override
    public void close() {
        writer.shutdownNow();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Block store writer did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
