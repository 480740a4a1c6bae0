package nl.bytesoflife.deltackd.ckd.spectral;

import nl.bytesoflife.deltackd.ckd.BinSetRegistry;
import nl.bytesoflife.deltackd.ckd.model.Bin;
import nl.bytesoflife.deltackd.ckd.model.BinSet;
import nl.bytesoflife.deltackd.ckd.model.Bindex;
import nl.bytesoflife.deltackd.ckd.select.BinSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Drives evaluation over the spectral points of a CKD run: the bins selected by a
 * {@link SpectralConfig}, in ascending wavelength order, each expanded to its bindexes.
 */
public class CkdSpectralLoop {

    private static final Logger log = LoggerFactory.getLogger(CkdSpectralLoop.class);

    private final BinSet binSet;
    private final List<Bin> bins;

    public CkdSpectralLoop(BinSetRegistry registry, SpectralConfig config) {
        this.binSet = registry.fromDb(config.getBinSetId());
        List<Predicate<Bin>> filters = new ArrayList<>();
        for (BinSelector selector : config.getBins()) {
            filters.add(selector.toFilter());
        }
        this.bins = binSet.filterBins(filters);
        log.debug("Selected {} of {} bins from bin set '{}'", bins.size(), binSet.size(), binSet.getId());
    }

    public BinSet getBinSet() {
        return binSet;
    }

    public List<Bin> getBins() {
        return bins;
    }

    /**
     * All spectral points of the run: bins in canonical order, quadrature points in node order.
     */
    public List<Bindex> getBindexes() {
        List<Bindex> bindexes = new ArrayList<>();
        for (Bin bin : bins) {
            bindexes.addAll(bin.getBindexes());
        }
        return Collections.unmodifiableList(bindexes);
    }

    /**
     * Evaluates {@code evaluator} at every bindex and integrates each bin's values over g.
     * Evaluator errors are not caught.
     */
    public List<BinResult> run(RadiativePropertyEvaluator evaluator) {
        List<BinResult> results = new ArrayList<>(bins.size());
        for (Bin bin : bins) {
            List<Bindex> bindexes = bin.getBindexes();
            double[] values = new double[bindexes.size()];
            for (Bindex bindex : bindexes) {
                values[bindex.index()] = evaluator.evalCkd(bindex, binSet.getId());
                log.trace("Evaluated {} -> {}", bindex, values[bindex.index()]);
            }
            double value = bin.getQuad().integrate(values, 0.0, 1.0);
            log.debug("Bin '{}': g-integrated value {}", bin.getId(), value);
            results.add(new BinResult(bin, values, value));
        }
        return Collections.unmodifiableList(results);
    }
}
