package nl.bytesoflife.deltackd.ckd.model;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;

import java.util.Map;

public enum WavelengthUnit {
    NANOMETER("nm", 1.0),
    MICROMETER("um", 1.0e3),
    MILLIMETER("mm", 1.0e6),
    CENTIMETER("cm", 1.0e7),
    METER("m", 1.0e9),
    ANGSTROM("angstrom", 0.1);

    private static final Map<String, WavelengthUnit> SYMBOLS = Map.ofEntries(
            Map.entry("nm", NANOMETER),
            Map.entry("nanometer", NANOMETER),
            Map.entry("nanometers", NANOMETER),
            Map.entry("um", MICROMETER),
            Map.entry("µm", MICROMETER),
            Map.entry("micron", MICROMETER),
            Map.entry("micrometer", MICROMETER),
            Map.entry("micrometers", MICROMETER),
            Map.entry("mm", MILLIMETER),
            Map.entry("millimeter", MILLIMETER),
            Map.entry("cm", CENTIMETER),
            Map.entry("centimeter", CENTIMETER),
            Map.entry("m", METER),
            Map.entry("meter", METER),
            Map.entry("meters", METER),
            Map.entry("angstrom", ANGSTROM),
            Map.entry("å", ANGSTROM)
    );

    private final String symbol;
    private final double nanometers;

    WavelengthUnit(String symbol, double nanometers) {
        this.symbol = symbol;
        this.nanometers = nanometers;
    }

    public String getSymbol() {
        return symbol;
    }

    public double toNanometers(double value) {
        return value * nanometers;
    }

    public double fromNanometers(double value) {
        return value / nanometers;
    }

    /**
     * Resolves a unit string as found in dataset metadata ({@code "nm"}, {@code "micron"}, ...).
     */
    public static WavelengthUnit fromSymbol(String symbol) {
        WavelengthUnit unit = symbol == null ? null : SYMBOLS.get(symbol.trim().toLowerCase());
        if (unit == null) {
            throw new ConfigurationException("unknown wavelength unit '" + symbol + "'");
        }
        return unit;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
