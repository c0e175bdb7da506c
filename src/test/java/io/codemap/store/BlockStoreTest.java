package io.codemap.store;

import io.codemap.ast.RawNode;
import io.codemap.model.Call;
import io.codemap.model.FunctionBlock;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.source.InMemorySourceProvider;
import io.codemap.source.SourceProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static io.codemap.ast.Quoted.*;
import static org.assertj.core.api.Assertions.assertThat;

class BlockStoreTest {

    private static final ModuleIdentifier GOOD = ModuleIdentifier.of("App.Good");
    private static final ModuleIdentifier BROKEN = ModuleIdentifier.of("App.Broken");

    private final InMemorySourceProvider provider = new InMemorySourceProvider();
    private final BlockStore store = new BlockStore(provider);

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static RawNode module(String name, String callee) {
        return defmodule(name, def("run", params(), call(callee)));
    }

    @Test
    void rescanNow_isolatesFailingModules() {
        provider.add(module("App.Good", "helper"))
                .put(BROKEN, call("not_a_module"));

        ScanSummary summary = store.rescanNow();

        assertThat(summary.discovered()).isEqualTo(2);
        assertThat(summary.normalized()).isEqualTo(1);
        assertThat(summary.failed()).containsExactly(BROKEN);
        assertThat(summary.hasFailures()).isTrue();
        assertThat(store.lookup(GOOD)).isPresent();
        assertThat(store.lookup(BROKEN)).isEmpty();
        assertThat(store.list()).containsExactly(GOOD);
    }

    @Test
    void rescan_runsAsynchronously() throws Exception {
        provider.add(module("App.Good", "helper"));

        ScanSummary summary = store.rescan().get(5, TimeUnit.SECONDS);

        assertThat(summary.normalized()).isEqualTo(1);
        assertThat(summary.hasFailures()).isFalse();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void rescan_afterCloseFailsTheFuture() {
        provider.add(module("App.Good", "helper"));
        store.close();

        assertThat(store.rescan())
                .failsWithin(5, TimeUnit.SECONDS)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(IllegalStateException.class)
                .withMessageContaining("closed");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void rescan_replacesChangedModules() throws Exception {
        provider.add(module("App.Good", "before"));
        store.rescan().get(5, TimeUnit.SECONDS);

        provider.add(module("App.Good", "after"));
        store.rescan().get(5, TimeUnit.SECONDS);

        assertThat(store.lookup(GOOD).orElseThrow().children().get(0).calls())
                .containsExactly(Call.local("after", 0));
    }

    @Test
    void rescan_keepsPreviousBlockWhenModuleBreaks() {
        provider.add(module("App.Good", "helper"));
        store.rescanNow();

        provider.put(GOOD, call("garbage"));
        ScanSummary summary = store.rescanNow();

        assertThat(summary.failed()).containsExactly(GOOD);
        assertThat(store.lookup(GOOD).orElseThrow().children().get(0).calls())
                .containsExactly(Call.local("helper", 0));
    }

    @Test
    void rescanNow_survivesEnumerationFailure() {
        SourceProvider failing = new SourceProvider() {
            @Override
            public Optional<RawNode> resolve(ModuleIdentifier module) {
                return Optional.empty();
            }

            @Override
            public List<ModuleIdentifier> enumerateModules() throws IOException {
                throw new IOException("disk gone");
            }
        };

        try (BlockStore failingStore = new BlockStore(failing)) {
            ScanSummary summary = failingStore.rescanNow();

            assertThat(summary.discovered()).isZero();
            assertThat(failingStore.size()).isZero();
        }
    }

    @Test
    void refresh_reportsMissingSource() {
        assertThat(store.refresh(ModuleIdentifier.of("Nowhere"))).isFalse();
    }

    @Test
    void put_andListReturnsSnapshot() {
        ModuleBlock block = ModuleBlock.of(GOOD, List.of(FunctionBlock.of("run", 0, List.of())));
        store.put(block);

        var snapshot = store.list();
        store.put(ModuleBlock.of(BROKEN, List.of()));

        assertThat(snapshot).containsExactly(GOOD);
        assertThat(store.list()).containsExactlyInAnyOrder(GOOD, BROKEN);
        assertThat(store.lookup(GOOD)).hasValue(block);
    }

    @Test
    void lookup_neverBlocksDuringRescan() throws Exception {
        for (int i = 0; i < 200; i++) {
            provider.add(module("App.M" + i, "helper"));
        }
        store.put(ModuleBlock.of(GOOD, List.of()));

        var pending = store.rescan();
        for (int i = 0; i < 1000; i++) {
            assertThat(store.lookup(GOOD)).isPresent();
        }

        assertThat(pending.get(5, TimeUnit.SECONDS).normalized()).isEqualTo(200);
        assertThat(store.size()).isEqualTo(201);
    }
}
