package nl.bytesoflife.deltackd.ckd.index;

import nl.bytesoflife.deltackd.ckd.model.Bin;
import nl.bytesoflife.deltackd.ckd.model.Wavelength;
import org.locationtech.jts.index.bintree.Bintree;
import org.locationtech.jts.index.bintree.Interval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Interval index over bin bounds, keyed in nanometres.
 * Queries return exact matches in canonical bin order.
 */
public class SpectralIndex {

    private final Bintree tree = new Bintree();
    private final int size;

    public SpectralIndex(Collection<Bin> bins) {
        for (Bin bin : bins) {
            tree.insert(new Interval(bin.getWmin().nanometers(), bin.getWmax().nanometers()), bin);
        }
        this.size = bins.size();
    }

    public int size() {
        return size;
    }

    /**
     * Bins with {@code wmin <= w < wmax}.
     */
    public List<Bin> containing(Wavelength w) {
        List<Bin> result = new ArrayList<>();
        for (Bin bin : candidates(new Interval(w.nanometers(), w.nanometers()))) {
            if (bin.getWmin().compareTo(w) <= 0 && w.isBefore(bin.getWmax())) {
                result.add(bin);
            }
        }
        result.sort(Bin.CANONICAL_ORDER);
        return result;
    }

    /**
     * Bins sharing more than an edge with {@code [wmin, wmax]}.
     */
    public List<Bin> overlapping(Wavelength wmin, Wavelength wmax) {
        List<Bin> result = new ArrayList<>();
        for (Bin bin : candidates(new Interval(wmin.nanometers(), wmax.nanometers()))) {
            if (bin.getWmin().isBefore(wmax) && wmin.isBefore(bin.getWmax())) {
                result.add(bin);
            }
        }
        result.sort(Bin.CANONICAL_ORDER);
        return result;
    }

    @SuppressWarnings("unchecked")
    private List<Bin> candidates(Interval interval) {
        return (List<Bin>) tree.query(interval);
    }
}
