package nl.bytesoflife.deltackd.ckd.model;

import nl.bytesoflife.deltackd.ckd.ValidationException;
import nl.bytesoflife.deltackd.ckd.data.DatasetColumn;
import nl.bytesoflife.deltackd.ckd.data.DatasetException;
import nl.bytesoflife.deltackd.ckd.data.LabeledDataset;
import nl.bytesoflife.deltackd.ckd.index.SpectralIndex;
import nl.bytesoflife.deltackd.ckd.quad.QuadratureRule;
import nl.bytesoflife.deltackd.ckd.select.BinSelector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A CKD spectral bin set: bins sharing one quadrature rule, always held in canonical
 * order (lower bound, upper bound, identifier) whatever order they were given in.
 * <p>
 * Every bin must reference the very {@link QuadratureRule} instance of its bin set;
 * a rule with equal nodes and weights is not accepted.
 */
public final class BinSet {

    public static final String ATTR_QUADRATURE_TYPE = "quadrature_type";
    public static final String ATTR_QUADRATURE_N = "quadrature_n";
    public static final String COLUMN_WMIN = "wmin";
    public static final String COLUMN_WMAX = "wmax";

    private final String id;
    private final QuadratureRule quad;
    private final List<Bin> bins;
    private final Map<String, Bin> binsById;
    private final SpectralIndex index;

    public BinSet(String id, QuadratureRule quad, Collection<Bin> bins) {
        this.id = Objects.requireNonNull(id, "id");
        this.quad = Objects.requireNonNull(quad, "quad");
        this.bins = canonicalize(bins);

        for (Bin bin : this.bins) {
            if (bin.getQuad() != quad) {
                throw new ValidationException("while validating bins: all defined bins must share the same "
                        + "quadrature as their parent bin set (offending bin '" + bin.getId() + "')");
            }
        }

        Map<String, Bin> byId = new LinkedHashMap<>();
        for (Bin bin : this.bins) {
            if (byId.put(bin.getId(), bin) != null) {
                throw new ValidationException("while validating bins: duplicate bin id '" + bin.getId() + "'");
            }
        }
        this.binsById = Collections.unmodifiableMap(byId);
        this.index = new SpectralIndex(this.bins);
    }

    private static List<Bin> canonicalize(Collection<Bin> bins) {
        Objects.requireNonNull(bins, "bins");
        Set<Bin> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Bin> unique = new ArrayList<>(bins.size());
        for (Bin bin : bins) {
            Objects.requireNonNull(bin, "bins must not contain null");
            if (seen.add(bin)) {
                unique.add(bin);
            }
        }
        unique.sort(Bin.CANONICAL_ORDER);
        return Collections.unmodifiableList(unique);
    }

    /**
     * Reads a bin set definition: the {@code quadrature_type} and {@code quadrature_n}
     * attributes, the bin identifiers and the {@code wmin} / {@code wmax} columns.
     * All bins share the one rule built from the attributes.
     */
    public static BinSet fromDataset(String id, LabeledDataset ds) {
        QuadratureRule quad = QuadratureRule.create(
                ds.getStringAttribute(ATTR_QUADRATURE_TYPE),
                ds.getIntAttribute(ATTR_QUADRATURE_N));

        List<String> binIds = ds.getBinIds();
        DatasetColumn wmins = ds.getColumn(COLUMN_WMIN);
        DatasetColumn wmaxs = ds.getColumn(COLUMN_WMAX);
        if (wmins.size() != binIds.size() || wmaxs.size() != binIds.size()) {
            throw new DatasetException("Dataset '" + ds.getName() + "': expected " + binIds.size()
                    + " bin bounds, got wmin[" + wmins.size() + "] and wmax[" + wmaxs.size() + "]");
        }
        WavelengthUnit wminUnit = unitOf(ds, wmins);
        WavelengthUnit wmaxUnit = unitOf(ds, wmaxs);

        List<Bin> bins = new ArrayList<>(binIds.size());
        for (int i = 0; i < binIds.size(); i++) {
            bins.add(new Bin(binIds.get(i),
                    Wavelength.of(wmins.get(i), wminUnit),
                    Wavelength.of(wmaxs.get(i), wmaxUnit),
                    quad));
        }
        return new BinSet(id, quad, bins);
    }

    private static WavelengthUnit unitOf(LabeledDataset ds, DatasetColumn column) {
        if (column.units() == null) {
            throw new DatasetException("Dataset '" + ds.getName() + "': column '" + column.name() + "' has no units");
        }
        return WavelengthUnit.fromSymbol(column.units());
    }

    public String getId() {
        return id;
    }

    public QuadratureRule getQuad() {
        return quad;
    }

    public List<Bin> getBins() {
        return bins;
    }

    public int size() {
        return bins.size();
    }

    /**
     * Bin with the given identifier, or null.
     */
    public Bin getBin(String binId) {
        return binsById.get(binId);
    }

    public List<String> getBinIds() {
        return List.copyOf(binsById.keySet());
    }

    public double[] getBinWmins() {
        return getBinWmins(Wavelength.DEFAULT_UNIT);
    }

    public double[] getBinWmins(WavelengthUnit unit) {
        double[] values = new double[bins.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = bins.get(i).getWmin().magnitudeIn(unit);
        }
        return values;
    }

    public double[] getBinWmaxs() {
        return getBinWmaxs(Wavelength.DEFAULT_UNIT);
    }

    public double[] getBinWmaxs(WavelengthUnit unit) {
        double[] values = new double[bins.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = bins.get(i).getWmax().magnitudeIn(unit);
        }
        return values;
    }

    /**
     * Copy of this bin set holding other bins, sorted and validated like a new one.
     */
    public BinSet withBins(Collection<Bin> newBins) {
        return new BinSet(id, quad, newBins);
    }

    /**
     * Bins accepted by at least one of the filters, in canonical order.
     */
    @SafeVarargs
    public final List<Bin> filterBins(Predicate<Bin>... filters) {
        return filterBins(Arrays.asList(filters));
    }

    public List<Bin> filterBins(List<? extends Predicate<Bin>> filters) {
        List<Bin> selected = new ArrayList<>();
        for (Bin bin : bins) {
            for (Predicate<Bin> filter : filters) {
                if (filter.test(bin)) {
                    selected.add(bin);
                    break;
                }
            }
        }
        selected.sort(Bin.CANONICAL_ORDER);
        return Collections.unmodifiableList(selected);
    }

    /**
     * Selects bins from specs given as plain data; see {@link BinSelector#of(Object)} for the
     * accepted shapes. All specs are dispatched before any bin is tested.
     */
    public List<Bin> selectBins(Object... specs) {
        return selectBinsFrom(Arrays.asList(specs));
    }

    /**
     * Same as {@link #selectBins(Object...)} with the specs held in a list. Note that a single
     * list passed to the varargs form is one {@code (type, filter_kwargs)} spec.
     */
    public List<Bin> selectBinsFrom(List<?> specs) {
        List<Predicate<Bin>> filters = new ArrayList<>(specs.size());
        for (Object spec : specs) {
            filters.add(BinSelector.of(spec).toFilter());
        }
        return filterBins(filters);
    }

    /**
     * Bins with {@code wmin <= w < wmax}; usually zero or one for a contiguous bin set.
     */
    public List<Bin> findBins(Wavelength w) {
        return index.containing(w);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder("BinSet{id='").append(id)
                .append("', quad=").append(quad.summary())
                .append(", bins=");
        if (bins.size() >= 5) {
            sb.append("list<").append(bins.size()).append(">(")
                    .append(bins.get(0).getId()).append(", ")
                    .append(bins.get(1).getId()).append(", ..., ")
                    .append(bins.get(bins.size() - 2).getId()).append(", ")
                    .append(bins.get(bins.size() - 1).getId()).append(')');
        } else {
            sb.append(getBinIds());
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return summary();
    }
}
