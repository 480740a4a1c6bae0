package nl.bytesoflife.deltackd.ckd.data;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link DatasetStore} over datasets registered in memory. Each {@link #open} call gets a
 * fresh handle from the registered factory.
 */
public class InMemoryDatasetStore implements DatasetStore {

    private final Map<String, Supplier<? extends LabeledDataset>> datasets = new ConcurrentHashMap<>();

    public InMemoryDatasetStore register(String logicalPath, Supplier<? extends LabeledDataset> factory) {
        datasets.put(logicalPath, factory);
        return this;
    }

    public InMemoryDatasetStore register(String logicalPath, SimpleLabeledDataset.Builder builder) {
        return register(logicalPath, builder::build);
    }

    public void unregister(String logicalPath) {
        datasets.remove(logicalPath);
    }

    public Set<String> getPaths() {
        return Set.copyOf(datasets.keySet());
    }

    @Override
    public LabeledDataset open(String logicalPath) {
        Supplier<? extends LabeledDataset> factory = datasets.get(logicalPath);
        if (factory == null) {
            throw new DatasetNotFoundException(logicalPath);
        }
        return factory.get();
    }
}
