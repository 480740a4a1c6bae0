package nl.bytesoflife.deltackd.ckd.select;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.model.Bin;
import nl.bytesoflife.deltackd.ckd.model.Wavelength;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Factories for the bin filters understood by bin selection: {@code all}, {@code ids}
 * and {@code interval}.
 */
public final class BinFilters {

    public static final String ALL = "all";
    public static final String IDS = "ids";
    public static final String INTERVAL = "interval";

    public static final Set<String> TYPES = Set.of(ALL, IDS, INTERVAL);

    private static final Set<String> IDS_KWARGS = Set.of("ids");
    private static final Set<String> INTERVAL_KWARGS = Set.of("wmin", "wmax", "endpoints");

    private BinFilters() {
    }

    public static Predicate<Bin> all() {
        return bin -> true;
    }

    public static Predicate<Bin> ids(String... ids) {
        return ids(Arrays.asList(ids));
    }

    /**
     * Lets through bins whose identifier is one of {@code ids}.
     */
    public static Predicate<Bin> ids(Collection<String> ids) {
        Set<String> accepted = Set.copyOf(ids);
        return bin -> accepted.contains(bin.getId());
    }

    public static Predicate<Bin> interval(Wavelength wmin, Wavelength wmax) {
        return interval(wmin, wmax, true);
    }

    /**
     * Lets through bins lying in {@code [wmin, wmax]}.
     * <p>
     * With {@code endpoints} set, a bin also passes when either bound of the interval falls
     * strictly inside it. Without it, the bin must be fully contained. A degenerate interval
     * {@code wmin == wmax} only matches bins that strictly contain the point, never bins
     * having it as an edge.
     *
     * @throws ConfigurationException if {@code wmin > wmax}
     */
    public static Predicate<Bin> interval(Wavelength wmin, Wavelength wmax, boolean endpoints) {
        int order = wmin.compareTo(wmax);
        if (order > 0) {
            throw new ConfigurationException("wmin must be lower or equal to wmax, got wmin = "
                    + wmin + " and wmax = " + wmax);
        }

        if (order == 0) {
            return bin -> strictlyInside(wmin, bin);
        }

        if (endpoints) {
            return bin -> contained(bin, wmin, wmax)
                    || strictlyInside(wmin, bin)
                    || strictlyInside(wmax, bin);
        }
        return bin -> contained(bin, wmin, wmax);
    }

    private static boolean contained(Bin bin, Wavelength wmin, Wavelength wmax) {
        return wmin.compareTo(bin.getWmin()) <= 0 && bin.getWmax().compareTo(wmax) <= 0;
    }

    private static boolean strictlyInside(Wavelength w, Bin bin) {
        return bin.getWmin().isBefore(w) && w.isBefore(bin.getWmax());
    }

    /**
     * Builds a filter from its type name and keyword arguments, as found in
     * selection specs authored as plain data.
     *
     * @throws ConfigurationException for an unknown type, an unknown or missing keyword,
     *                                or a keyword value of the wrong kind
     */
    public static Predicate<Bin> create(String type, Map<String, ?> kwargs) {
        Map<String, ?> args = kwargs == null ? Map.of() : kwargs;

        if (INTERVAL.equals(type)) {
            checkKeywords(type, args, INTERVAL_KWARGS);
            Wavelength wmin = Wavelength.convert(require(type, args, "wmin"));
            Wavelength wmax = Wavelength.convert(require(type, args, "wmax"));
            Object endpoints = args.containsKey("endpoints") ? args.get("endpoints") : Boolean.TRUE;
            if (!(endpoints instanceof Boolean flag)) {
                throw new ConfigurationException("interval filter: 'endpoints' must be a boolean, got " + endpoints);
            }
            return interval(wmin, wmax, flag);
        }

        if (IDS.equals(type)) {
            checkKeywords(type, args, IDS_KWARGS);
            Object ids = require(type, args, "ids");
            if (!(ids instanceof Collection<?> collection)) {
                throw new ConfigurationException("ids filter: 'ids' must be a collection, got " + ids);
            }
            Set<String> values = new LinkedHashSet<>();
            for (Object id : collection) {
                values.add(String.valueOf(id));
            }
            return ids(values);
        }

        if (ALL.equals(type)) {
            checkKeywords(type, args, Set.of());
            return all();
        }

        throw new ConfigurationException("unknown bin filter type " + type);
    }

    private static void checkKeywords(String type, Map<String, ?> args, Set<String> allowed) {
        for (String key : args.keySet()) {
            if (!allowed.contains(key)) {
                throw new ConfigurationException(type + " filter: unexpected keyword '" + key + "'");
            }
        }
    }

    private static Object require(String type, Map<String, ?> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            throw new ConfigurationException(type + " filter: missing keyword '" + key + "'");
        }
        return value;
    }
}
