package nl.bytesoflife.deltackd.ckd.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link LabeledDataset}. Built once with {@link Builder}, then read-only.
 */
public class SimpleLabeledDataset implements LabeledDataset {

    private final String name;
    private final Map<String, Object> attributes;
    private final List<String> binIds;
    private final Map<String, DatasetColumn> columns;
    private volatile boolean closed;

    private SimpleLabeledDataset(Builder builder) {
        this.name = builder.name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.binIds = List.copyOf(builder.binIds);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columns));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    @Override
    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public List<String> getBinIds() {
        return binIds;
    }

    @Override
    public DatasetColumn getColumn(String name) {
        DatasetColumn column = columns.get(name);
        if (column == null) {
            throw new DatasetException("Dataset '" + this.name + "' has no column '" + name + "'");
        }
        return column;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return "SimpleLabeledDataset{name='" + name + "', attributes=" + attributes.keySet()
                + ", bins=" + binIds.size() + "}";
    }

    public static class Builder {

        private final String name;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<String> binIds = new ArrayList<>();
        private final Map<String, DatasetColumn> columns = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder binIds(List<String> ids) {
            binIds.clear();
            binIds.addAll(ids);
            return this;
        }

        public Builder column(String columnName, double[] values, String units) {
            columns.put(columnName, new DatasetColumn(columnName, values, units));
            return this;
        }

        public SimpleLabeledDataset build() {
            return new SimpleLabeledDataset(this);
        }
    }
}
