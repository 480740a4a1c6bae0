package nl.bytesoflife.deltackd.ckd.spectral;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.select.BinFilters;
import nl.bytesoflife.deltackd.ckd.select.BinSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CKD spectral configuration of a run: which bin set, and which of its bins.
 */
public class SpectralConfig {

    public static final String KEY_BIN_SET = "bin_set";
    public static final String KEY_BINS = "bins";

    private final String binSetId;
    private final List<BinSelector> bins;

    /**
     * Selects every bin of the bin set.
     */
    public SpectralConfig(String binSetId) {
        this(binSetId, List.of(BinSelector.type(BinFilters.ALL, Map.of())));
    }

    public SpectralConfig(String binSetId, List<BinSelector> bins) {
        this.binSetId = Objects.requireNonNull(binSetId, "binSetId");
        this.bins = List.copyOf(bins);
    }

    /**
     * Reads a configuration given as plain data, e.g.
     * {@code {"bin_set": "10nm", "bins": ["550", "560"]}}. {@code bins} may be a single spec
     * or a list of specs; each spec goes through {@link BinSelector#of(Object)}.
     */
    public static SpectralConfig fromMap(Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (!KEY_BIN_SET.equals(key) && !KEY_BINS.equals(key)) {
                throw new ConfigurationException("unknown spectral configuration key '" + key + "'");
            }
        }

        Object binSet = values.get(KEY_BIN_SET);
        if (!(binSet instanceof String binSetId)) {
            throw new ConfigurationException("spectral configuration requires a string 'bin_set', got " + binSet);
        }

        Object bins = values.get(KEY_BINS);
        if (bins == null) {
            return new SpectralConfig(binSetId);
        }

        List<BinSelector> selectors = new ArrayList<>();
        if (bins instanceof List<?> specs) {
            for (Object spec : specs) {
                selectors.add(BinSelector.of(spec));
            }
        } else {
            selectors.add(BinSelector.of(bins));
        }
        return new SpectralConfig(binSetId, selectors);
    }

    public String getBinSetId() {
        return binSetId;
    }

    public List<BinSelector> getBins() {
        return bins;
    }

    @Override
    public String toString() {
        return "SpectralConfig{binSet='" + binSetId + "', bins=" + bins.size() + " selector(s)}";
    }
}
