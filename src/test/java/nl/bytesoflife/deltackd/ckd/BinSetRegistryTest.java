package nl.bytesoflife.deltackd.ckd;

import nl.bytesoflife.deltackd.ckd.data.ClasspathDatasetStore;
import nl.bytesoflife.deltackd.ckd.data.DatasetException;
import nl.bytesoflife.deltackd.ckd.data.DatasetNotFoundException;
import nl.bytesoflife.deltackd.ckd.data.InMemoryDatasetStore;
import nl.bytesoflife.deltackd.ckd.data.SimpleLabeledDataset;
import nl.bytesoflife.deltackd.ckd.model.Bin;
import nl.bytesoflife.deltackd.ckd.model.BinSet;
import nl.bytesoflife.deltackd.ckd.model.Bindex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BinSetRegistryTest {

    private final List<SimpleLabeledDataset> opened = new ArrayList<>();
    private final AtomicInteger loads = new AtomicInteger();

    private SimpleLabeledDataset binSetDataset(String name) {
        loads.incrementAndGet();
        SimpleLabeledDataset ds = SimpleLabeledDataset.builder(name)
                .attribute("quadrature_type", "gauss_legendre")
                .attribute("quadrature_n", 2)
                .binIds(List.of("b", "a"))
                .column("wmin", new double[]{500, 400}, "nm")
                .column("wmax", new double[]{600, 500}, "nm")
                .build();
        synchronized (opened) {
            opened.add(ds);
        }
        return ds;
    }

    private SimpleLabeledDataset aliasDataset(String name, String target) {
        SimpleLabeledDataset ds = SimpleLabeledDataset.builder(name).attribute("bin_set", target).build();
        synchronized (opened) {
            opened.add(ds);
        }
        return ds;
    }

    private InMemoryDatasetStore store() {
        return new InMemoryDatasetStore()
                .register("ckd/bin_sets/a", () -> binSetDataset("a"))
                .register("ckd/bin_sets/b", () -> binSetDataset("b"))
                .register("ckd/bin_sets/alias", () -> aliasDataset("alias", "a"));
    }

    @Test
    void pathTemplate() {
        assertEquals("ckd/bin_sets/10nm", BinSetRegistry.pathOf("10nm"));
    }

    @Test
    void repeatedLookupsReturnTheSameInstance() {
        BinSetRegistry registry = new BinSetRegistry(store());
        BinSet first = registry.fromDb("a");
        BinSet second = registry.fromDb("a");

        assertSame(first, second);
        assertEquals(1, loads.get());
        assertTrue(registry.isCached("a"));
        assertEquals(List.of("a", "b"), first.getBinIds());
    }

    @Test
    void bindexesFromSeparateLookupsShareTheQuadratureRule() {
        BinSetRegistry registry = new BinSetRegistry(store());
        Bindex first = registry.fromDb("a").getBins().get(0).getBindexes().get(0);
        Bindex second = registry.fromDb("a").getBins().get(1).getBindexes().get(1);
        assertSame(first.bin().getQuad(), second.bin().getQuad());
    }

    @Test
    void datasetsAreClosedAfterLoading() {
        BinSetRegistry registry = new BinSetRegistry(store());
        registry.fromDb("a");
        registry.fromDb("alias");
        assertEquals(2, opened.size());
        for (SimpleLabeledDataset ds : opened) {
            assertTrue(ds.isClosed(), ds.getName());
        }
    }

    @Test
    void aliasResolvesToTargetInstance() {
        BinSetRegistry registry = new BinSetRegistry(store());
        BinSet alias = registry.fromDb("alias");

        assertSame(registry.fromDb("a"), alias);
        assertEquals("a", alias.getId());
        assertTrue(registry.isCached("alias"));
        assertEquals(1, loads.get());
    }

    @Test
    void aliasCycleIsConfigurationError() {
        BinSetRegistry registry = new BinSetRegistry(new ClasspathDatasetStore("testdata"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.fromDb("loop_a"));
        assertTrue(e.getMessage().contains("loop_a -> loop_b -> loop_a"), e.getMessage());
        assertEquals(0, registry.size());

        InMemoryDatasetStore selfStore = new InMemoryDatasetStore()
                .register("ckd/bin_sets/self", () -> aliasDataset("self", "self"));
        assertThrows(ConfigurationException.class, () -> new BinSetRegistry(selfStore).fromDb("self"));
    }

    @Test
    void missingBinSetIsNotCached() {
        BinSetRegistry registry = new BinSetRegistry(store());
        DatasetNotFoundException e = assertThrows(DatasetNotFoundException.class, () -> registry.fromDb("nope"));
        assertEquals("ckd/bin_sets/nope", e.getPath());
        assertFalse(registry.isCached("nope"));
        assertEquals(0, registry.size());

        assertThrows(DatasetNotFoundException.class, () -> registry.fromDb("nope"));
    }

    @Test
    void invalidDefinitionsPropagate() {
        BinSetRegistry registry = new BinSetRegistry(new ClasspathDatasetStore("testdata"));
        assertThrows(DatasetException.class, () -> registry.fromDb("no_units"));
        assertThrows(ConfigurationException.class, () -> registry.fromDb("malformed"));
        assertEquals(0, registry.size());

        InMemoryDatasetStore badStore = new InMemoryDatasetStore().register("ckd/bin_sets/bad",
                SimpleLabeledDataset.builder("bad")
                        .attribute("quadrature_type", "gauss_legendre")
                        .attribute("quadrature_n", 2)
                        .binIds(List.of("a"))
                        .column("wmin", new double[]{500}, "nm")
                        .column("wmax", new double[]{400}, "nm"));
        assertThrows(ValidationException.class, () -> new BinSetRegistry(badStore).fromDb("bad"));
    }

    @Test
    void definitionsFromClasspath() {
        BinSetRegistry registry = new BinSetRegistry(new ClasspathDatasetStore("testdata"));
        BinSet binSet = registry.fromDb("visible");
        assertEquals(List.of("450", "550", "650"), binSet.getBinIds());
        assertEquals(3, binSet.getQuad().size());
        assertArrayEquals(new double[]{500, 600, 700}, binSet.getBinWmaxs(), 1e-9);
        assertSame(binSet, registry.fromDb("visible_alias"));
    }

    @Test
    void leastRecentlyUsedEntryIsEvicted() {
        BinSetRegistry registry = new BinSetRegistry(store(), 1);
        BinSet a = registry.fromDb("a");
        registry.fromDb("b");

        assertFalse(registry.isCached("a"));
        assertTrue(registry.isCached("b"));
        assertEquals(1, registry.size());
        assertNotSame(a, registry.fromDb("a"));
        assertEquals(3, loads.get());
    }

    @Test
    void aliasFollowsItsTargetThroughEviction() {
        BinSetRegistry registry = new BinSetRegistry(store(), 1);
        BinSet viaAlias = registry.fromDb("alias");
        assertSame(viaAlias, registry.fromDb("a"));

        registry.fromDb("b");
        assertFalse(registry.isCached("a"));
        assertFalse(registry.isCached("alias"));

        BinSet reloaded = registry.fromDb("alias");
        assertNotSame(viaAlias, reloaded);
        assertSame(reloaded, registry.fromDb("a"));
        assertSame(reloaded.getQuad(), registry.fromDb("alias").getBins().get(0).getQuad());
        assertEquals(1, registry.size());
        assertEquals(3, loads.get());
    }

    @Test
    void aliasesAreNotCountedAsBinSets() {
        BinSetRegistry registry = new BinSetRegistry(store());
        registry.fromDb("alias");
        assertEquals(1, registry.size());
        assertTrue(registry.isCached("a"));
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThrows(ConfigurationException.class, () -> new BinSetRegistry(store(), -1));
    }

    @Test
    void clearDropsCachedEntries() {
        BinSetRegistry registry = new BinSetRegistry(store());
        BinSet a = registry.fromDb("a");
        registry.clear();
        assertEquals(0, registry.size());
        assertNotSame(a, registry.fromDb("a"));
    }

    @Test
    void concurrentCallersShareOneLoad() throws Exception {
        BinSetRegistry registry = new BinSetRegistry(store());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<BinSet>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String id = i % 2 == 0 ? "a" : "alias";
                tasks.add(() -> registry.fromDb(id));
            }
            List<Future<BinSet>> futures = executor.invokeAll(tasks);
            BinSet expected = registry.fromDb("a");
            for (Future<BinSet> future : futures) {
                assertSame(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void convertAndNodeDatasets() {
        BinSetRegistry registry = new BinSetRegistry(store());
        BinSet a = registry.fromDb("a");

        assertSame(a, registry.convert("a"));
        assertSame(a, registry.convert(a));
        assertThrows(ConfigurationException.class, () -> registry.convert(42));

        SimpleLabeledDataset absorption = SimpleLabeledDataset.builder("absorption")
                .attribute("bin_set", "alias")
                .build();
        assertSame(a, registry.fromNodeDataset(absorption));
    }

    @Test
    void binsOfLoadedSetReferenceItsRule() {
        BinSet binSet = new BinSetRegistry(store()).fromDb("b");
        for (Bin bin : binSet.getBins()) {
            assertSame(binSet.getQuad(), bin.getQuad());
        }
    }
}
