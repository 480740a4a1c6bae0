package nl.bytesoflife.deltackd.ckd.data;

import java.util.List;

/**
 * A labeled dataset as handed over by a {@link DatasetStore}: global attributes, a column of
 * bin identifiers and named numeric columns carrying a unit tag.
 * <p>
 * Datasets are opened for the duration of a read and closed right after, typically with
 * try-with-resources.
 */
public interface LabeledDataset extends AutoCloseable {

    String getName();

    boolean hasAttribute(String name);

    /**
     * Raw attribute value, or null if the attribute is absent.
     */
    Object getAttribute(String name);

    List<String> getBinIds();

    /**
     * @throws DatasetException if the dataset has no such column
     */
    DatasetColumn getColumn(String name);

    default String getStringAttribute(String name) {
        Object value = getAttribute(name);
        if (value == null) {
            throw new DatasetException("Dataset '" + getName() + "' has no attribute '" + name + "'");
        }
        return value.toString();
    }

    default int getIntAttribute(String name) {
        Object value = getAttribute(name);
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new DatasetException("Dataset '" + getName() + "': attribute '" + name
                        + "' is not an integer: " + value);
            }
            return n.intValue();
        }
        String text = getStringAttribute(name);
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new DatasetException("Dataset '" + getName() + "': attribute '" + name
                    + "' is not an integer: " + text, e);
        }
    }

    @Override
    void close();
}
