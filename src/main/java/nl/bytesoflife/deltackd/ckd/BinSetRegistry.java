package nl.bytesoflife.deltackd.ckd;

import nl.bytesoflife.deltackd.ckd.data.DatasetStore;
import nl.bytesoflife.deltackd.ckd.data.LabeledDataset;
import nl.bytesoflife.deltackd.ckd.model.BinSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memoized source of bin sets, keyed by bin set identifier.
 * <p>
 * A given identifier always yields the same {@link BinSet} instance for as long as it stays
 * in the table, so every bin and bindex produced for it shares one quadrature rule object.
 * The table is unbounded unless a capacity is given, in which case the least recently used
 * entry is evicted. Only bin sets are held in the table; an alias is remembered as the
 * identifier it points to, so an alias and its target always resolve to the same instance.
 * Lookup and population run under a single lock.
 */
public class BinSetRegistry {

    private static final Logger log = LoggerFactory.getLogger(BinSetRegistry.class);

    public static final String PATH_TEMPLATE = "ckd/bin_sets/%s";

    /** Attribute naming the registered bin set a dataset refers to. */
    public static final String ATTR_BIN_SET = "bin_set";

    private final DatasetStore store;
    private final Map<String, BinSet> cache;
    private final Map<String, String> aliases = new HashMap<>();
    private final Deque<String> resolving = new ArrayDeque<>();
    private final Object lock = new Object();

    public BinSetRegistry(DatasetStore store) {
        this(store, 0);
    }

    /**
     * @param capacity maximum number of cached bin sets, or 0 for no limit
     */
    public BinSetRegistry(DatasetStore store, int capacity) {
        if (capacity < 0) {
            throw new ConfigurationException("capacity must be >= 0, got " + capacity);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.cache = capacity == 0 ? new LinkedHashMap<>() : new LruMap(capacity);
    }

    public static String pathOf(String id) {
        return String.format(PATH_TEMPLATE, id);
    }

    /**
     * Bin set registered under {@code id}, loaded from the dataset store on first use.
     * A definition holding only a {@code bin_set} attribute is an alias for that bin set.
     *
     * @throws nl.bytesoflife.deltackd.ckd.data.DatasetNotFoundException if the store has no such bin set
     * @throws ConfigurationException if aliases form a cycle
     */
    public BinSet fromDb(String id) {
        Objects.requireNonNull(id, "id");
        synchronized (lock) {
            String target = aliases.get(id);
            if (target != null) {
                return fromDb(target);
            }
            BinSet cached = cache.get(id);
            if (cached != null) {
                log.debug("Bin set '{}' served from cache", id);
                return cached;
            }
            if (resolving.contains(id)) {
                throw new ConfigurationException("bin set alias cycle: " + String.join(" -> ", resolving) + " -> " + id);
            }

            resolving.addLast(id);
            try {
                return load(id);
            } finally {
                resolving.removeLast();
            }
        }
    }

    private BinSet load(String id) {
        String path = pathOf(id);
        String alias = null;
        BinSet binSet = null;

        try (LabeledDataset ds = store.open(path)) {
            if (ds.hasAttribute(ATTR_BIN_SET) && ds.getBinIds().isEmpty()) {
                alias = ds.getStringAttribute(ATTR_BIN_SET);
            } else {
                binSet = BinSet.fromDataset(id, ds);
            }
        }

        if (alias != null) {
            log.debug("Bin set '{}' refers to '{}'", id, alias);
            BinSet target = fromDb(alias);
            aliases.put(id, alias);
            return target;
        }
        cache.put(id, binSet);
        log.info("Loaded bin set '{}' from {}: {} bins, {}", id, path, binSet.size(), binSet.getQuad().summary());
        return binSet;
    }

    /**
     * Bin set referenced by the {@code bin_set} attribute of a dataset, e.g. absorption data
     * tabulated on a registered bin set.
     */
    public BinSet fromNodeDataset(LabeledDataset ds) {
        return fromDb(ds.getStringAttribute(ATTR_BIN_SET));
    }

    /**
     * A {@code String} is looked up with {@link #fromDb(String)}; a {@code BinSet} is returned unchanged.
     */
    public BinSet convert(Object value) {
        if (value instanceof BinSet binSet) {
            return binSet;
        }
        if (value instanceof String id) {
            return fromDb(id);
        }
        throw new ConfigurationException("cannot convert " + value + " to a bin set");
    }

    /**
     * Whether {@code id}, or the bin set it is an alias of, is currently held.
     */
    public boolean isCached(String id) {
        synchronized (lock) {
            String target = id;
            while (aliases.containsKey(target)) {
                target = aliases.get(target);
            }
            return cache.containsKey(target);
        }
    }

    /**
     * Number of bin sets held, aliases not counted.
     */
    public int size() {
        synchronized (lock) {
            return cache.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            cache.clear();
            aliases.clear();
        }
    }

    private static final class LruMap extends LinkedHashMap<String, BinSet> {

        private final int capacity;

        LruMap(int capacity) {
            super(16, 0.75f, true);
            this.capacity = capacity;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, BinSet> eldest) {
            return size() > capacity;
        }
    }
}
