package nl.bytesoflife.deltackd.ckd.data;

import java.util.Objects;

/**
 * A numeric dataset variable with its {@code units} attribute.
 *
 * @param name   variable name, e.g. {@code wmin}
 * @param values one value per record
 * @param units  unit string as stored in the dataset, or null if the variable has none
 */
public record DatasetColumn(String name, double[] values, String units) {

    public DatasetColumn {
        Objects.requireNonNull(name, "name");
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }
}
