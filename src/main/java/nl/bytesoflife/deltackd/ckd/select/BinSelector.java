package nl.bytesoflife.deltackd.ckd.select;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.model.Bin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One bin selection spec. The accepted shapes form a closed set: a bin identifier, an
 * arbitrary predicate, or a filter type with its keyword arguments.
 */
public sealed interface BinSelector permits BinSelector.ById, BinSelector.ByPredicate, BinSelector.ByType {

    String TYPE_KEY = "type";
    String KWARGS_KEY = "filter_kwargs";

    Predicate<Bin> toFilter();

    record ById(String id) implements BinSelector {
        public ById {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public Predicate<Bin> toFilter() {
            return BinFilters.ids(List.of(id));
        }
    }

    record ByPredicate(Predicate<Bin> predicate) implements BinSelector {
        public ByPredicate {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public Predicate<Bin> toFilter() {
            return predicate;
        }
    }

    /**
     * A filter type with its keyword arguments. The filter is built on construction, so an
     * unknown keyword or a reversed interval fails here rather than at first use.
     */
    final class ByType implements BinSelector {

        private final String type;
        private final Map<String, Object> filterKwargs;
        private final Predicate<Bin> filter;

        public ByType(String type, Map<String, Object> filterKwargs) {
            if (type == null || !BinFilters.TYPES.contains(type)) {
                throw new ConfigurationException("unknown bin filter type " + type);
            }
            this.type = type;
            this.filterKwargs = filterKwargs == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(filterKwargs));
            this.filter = BinFilters.create(type, this.filterKwargs);
        }

        public String type() {
            return type;
        }

        public Map<String, Object> filterKwargs() {
            return filterKwargs;
        }

        @Override
        public Predicate<Bin> toFilter() {
            return filter;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ByType other)) return false;
            return type.equals(other.type) && filterKwargs.equals(other.filterKwargs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, filterKwargs);
        }

        @Override
        public String toString() {
            return "ByType[type=" + type + ", filterKwargs=" + filterKwargs + "]";
        }
    }

    static BinSelector id(String id) {
        return new ById(id);
    }

    static BinSelector predicate(Predicate<Bin> predicate) {
        return new ByPredicate(predicate);
    }

    static BinSelector type(String type, Map<String, Object> filterKwargs) {
        return new ByType(type, filterKwargs);
    }

    /**
     * Dispatches a selection spec given as plain data:
     * <ul>
     *   <li>a {@code String} selects the bin with that identifier;</li>
     *   <li>a {@code Predicate} is used as is;</li>
     *   <li>a 2-element {@code List} is read as {@code (type, filter_kwargs)};</li>
     *   <li>a {@code Map} with a {@code type} key and an optional {@code filter_kwargs} key.</li>
     * </ul>
     * Any other shape is rejected; nothing is coerced.
     *
     * @throws ConfigurationException for an unrecognized spec
     */
    @SuppressWarnings("unchecked")
    static BinSelector of(Object spec) {
        if (spec instanceof BinSelector selector) {
            return selector;
        }
        if (spec instanceof String id) {
            return new ById(id);
        }
        if (spec instanceof Predicate<?> predicate) {
            return new ByPredicate((Predicate<Bin>) predicate);
        }
        if (spec instanceof List<?> list) {
            if (list.size() == 2 && list.get(0) instanceof String type && isKwargs(list.get(1))) {
                return new ByType(type, (Map<String, Object>) list.get(1));
            }
            throw new ConfigurationException("unhandled CKD bin selector " + spec);
        }
        if (spec instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!TYPE_KEY.equals(key) && !KWARGS_KEY.equals(key)) {
                    throw new ConfigurationException("unhandled CKD bin selector " + spec
                            + ": unexpected key '" + key + "'");
                }
            }
            Object type = map.get(TYPE_KEY);
            Object kwargs = map.get(KWARGS_KEY);
            if (!(type instanceof String typeName) || (kwargs != null && !isKwargs(kwargs))) {
                throw new ConfigurationException("unhandled CKD bin selector " + spec);
            }
            return new ByType(typeName, (Map<String, Object>) kwargs);
        }
        throw new ConfigurationException("unhandled CKD bin selector " + spec);
    }

    private static boolean isKwargs(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return false;
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }
}
