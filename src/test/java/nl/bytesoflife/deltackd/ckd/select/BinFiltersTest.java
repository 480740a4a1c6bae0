package nl.bytesoflife.deltackd.ckd.select;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.model.Bin;
import nl.bytesoflife.deltackd.ckd.model.Wavelength;
import nl.bytesoflife.deltackd.ckd.model.WavelengthUnit;
import nl.bytesoflife.deltackd.ckd.quad.QuadratureRule;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class BinFiltersTest {

    private final QuadratureRule quad = QuadratureRule.gaussLegendre(2);
    private final Bin lower = bin("lower", 400, 500);
    private final Bin upper = bin("upper", 500, 600);
    private final Bin wide = bin("wide", 450, 550);

    private Bin bin(String id, double wmin, double wmax) {
        return new Bin(id, Wavelength.nm(wmin), Wavelength.nm(wmax), quad);
    }

    @Test
    void allAcceptsEverything() {
        assertTrue(BinFilters.all().test(lower));
        assertTrue(BinFilters.all().test(upper));
    }

    @Test
    void idsMatchExactly() {
        Predicate<Bin> filter = BinFilters.ids("lower", "other");
        assertTrue(filter.test(lower));
        assertFalse(filter.test(upper));
    }

    @Test
    void pointIntervalSkipsBinsHavingThePointAsEdge() {
        Predicate<Bin> filter = BinFilters.interval(Wavelength.nm(500), Wavelength.nm(500));
        assertFalse(filter.test(lower));
        assertFalse(filter.test(upper));
        assertTrue(filter.test(wide));
    }

    @Test
    void pointIntervalIgnoresEndpointsFlag() {
        Predicate<Bin> filter = BinFilters.interval(Wavelength.nm(475), Wavelength.nm(475), false);
        assertTrue(filter.test(lower));
        assertTrue(filter.test(wide));
        assertFalse(filter.test(upper));
    }

    @Test
    void overlapModeAcceptsBinsCrossingABound() {
        Predicate<Bin> filter = BinFilters.interval(Wavelength.nm(420), Wavelength.nm(580), true);
        assertTrue(filter.test(lower));
        assertTrue(filter.test(upper));
        assertTrue(filter.test(wide));
    }

    @Test
    void strictModeRequiresContainment() {
        Predicate<Bin> filter = BinFilters.interval(Wavelength.nm(420), Wavelength.nm(580), false);
        assertFalse(filter.test(lower));
        assertFalse(filter.test(upper));
        assertTrue(filter.test(wide));
    }

    @Test
    void containedOrStraddlingBin() {
        Bin bin = bin("x", 400, 600);
        assertTrue(BinFilters.interval(Wavelength.nm(450), Wavelength.nm(550), true).test(bin));
        assertFalse(BinFilters.interval(Wavelength.nm(550), Wavelength.nm(650), false).test(bin));
        assertTrue(BinFilters.interval(Wavelength.nm(550), Wavelength.nm(650), true).test(bin));
    }

    @Test
    void sharedEdgesDoNotCountAsOverlap() {
        Predicate<Bin> filter = BinFilters.interval(Wavelength.nm(300), Wavelength.nm(400), true);
        assertFalse(filter.test(lower));

        filter = BinFilters.interval(Wavelength.nm(400), Wavelength.nm(500), false);
        assertTrue(filter.test(lower));
        assertFalse(filter.test(upper));
    }

    @Test
    void boundsInOtherUnits() {
        Predicate<Bin> filter = BinFilters.interval(
                Wavelength.of(0.4, WavelengthUnit.MICROMETER),
                Wavelength.of(0.6, WavelengthUnit.MICROMETER), false);
        assertTrue(filter.test(lower));
        assertTrue(filter.test(upper));
    }

    @Test
    void reversedIntervalIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> BinFilters.interval(Wavelength.nm(600), Wavelength.nm(500)));
    }

    @Test
    void createIntervalFromKeywords() {
        Predicate<Bin> filter = BinFilters.create("interval", Map.of("wmin", "420nm", "wmax", 580, "endpoints", false));
        assertFalse(filter.test(lower));
        assertTrue(filter.test(wide));

        filter = BinFilters.create("interval", Map.of("wmin", 420, "wmax", 580));
        assertTrue(filter.test(lower));
    }

    @Test
    void createIdsAndAll() {
        assertTrue(BinFilters.create("ids", Map.of("ids", List.of("upper"))).test(upper));
        assertFalse(BinFilters.create("ids", Map.of("ids", List.of("upper"))).test(lower));
        assertTrue(BinFilters.create("all", null).test(lower));
        assertTrue(BinFilters.create("all", Map.of()).test(lower));
    }

    @Test
    void createRejectsBadKeywords() {
        assertThrows(ConfigurationException.class, () -> BinFilters.create("interval", Map.of("wmin", 400)));
        assertThrows(ConfigurationException.class,
                () -> BinFilters.create("interval", Map.of("wmin", 400, "wmax", 500, "closed", true)));
        assertThrows(ConfigurationException.class,
                () -> BinFilters.create("interval", Map.of("wmin", 400, "wmax", 500, "endpoints", "yes")));
        assertThrows(ConfigurationException.class, () -> BinFilters.create("ids", Map.of("ids", "upper")));
        assertThrows(ConfigurationException.class, () -> BinFilters.create("all", Map.of("ids", List.of())));

        Map<String, Object> nullBound = new HashMap<>();
        nullBound.put("wmin", null);
        nullBound.put("wmax", 500);
        assertThrows(ConfigurationException.class, () -> BinFilters.create("interval", nullBound));
    }

    @Test
    void createRejectsUnknownType() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> BinFilters.create("spectral_range", Map.of()));
        assertTrue(e.getMessage().contains("unknown bin filter type"));
    }
}
