package nl.bytesoflife.deltackd.ckd.data;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDatasetStoreTest {

    @Test
    void openReturnsFreshHandles() {
        InMemoryDatasetStore store = new InMemoryDatasetStore()
                .register("ckd/bin_sets/a", SimpleLabeledDataset.builder("a").attribute("version", 1));

        LabeledDataset first = store.open("ckd/bin_sets/a");
        first.close();
        LabeledDataset second = store.open("ckd/bin_sets/a");

        assertNotSame(first, second);
        assertTrue(((SimpleLabeledDataset) first).isClosed());
        assertFalse(((SimpleLabeledDataset) second).isClosed());
        assertEquals(1, second.getIntAttribute("version"));
    }

    @Test
    void missingPath() {
        InMemoryDatasetStore store = new InMemoryDatasetStore();
        DatasetNotFoundException e = assertThrows(DatasetNotFoundException.class, () -> store.open("ckd/bin_sets/x"));
        assertEquals("ckd/bin_sets/x", e.getPath());
    }

    @Test
    void registerAndUnregister() {
        InMemoryDatasetStore store = new InMemoryDatasetStore()
                .register("a", SimpleLabeledDataset.builder("a"))
                .register("b", () -> SimpleLabeledDataset.builder("b").build());
        assertEquals(Set.of("a", "b"), store.getPaths());

        store.unregister("a");
        assertEquals(Set.of("b"), store.getPaths());
        assertThrows(DatasetNotFoundException.class, () -> store.open("a"));
    }

    @Test
    void columnsAreCopied() {
        double[] values = {1, 2};
        SimpleLabeledDataset ds = SimpleLabeledDataset.builder("a").column("wmin", values, "nm").build();
        values[0] = 42;
        assertEquals(1.0, ds.getColumn("wmin").get(0));
        ds.getColumn("wmin").values()[1] = 42;
        assertEquals(2.0, ds.getColumn("wmin").get(1));
    }
}
