package nl.bytesoflife.deltackd.ckd.model;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;

import java.util.Objects;

/**
 * A spectral coordinate: a magnitude tagged with a wavelength unit.
 * <p>
 * Ordering ({@link #compareTo}) is unit-aware. Record equality is not: {@code 500 nm}
 * and {@code 0.5 um} compare as equal but are not {@code equals}.
 */
public record Wavelength(double magnitude, WavelengthUnit unit) implements Comparable<Wavelength> {

    /** Unit used when a bare number is given where a wavelength is expected. */
    public static final WavelengthUnit DEFAULT_UNIT = WavelengthUnit.NANOMETER;

    public Wavelength {
        Objects.requireNonNull(unit, "unit");
        if (Double.isNaN(magnitude)) {
            throw new ConfigurationException("wavelength magnitude must not be NaN");
        }
    }

    public static Wavelength of(double magnitude, WavelengthUnit unit) {
        return new Wavelength(magnitude, unit);
    }

    public static Wavelength of(double magnitude, String unit) {
        return new Wavelength(magnitude, WavelengthUnit.fromSymbol(unit));
    }

    public static Wavelength nm(double magnitude) {
        return new Wavelength(magnitude, WavelengthUnit.NANOMETER);
    }

    /**
     * Parses {@code "550nm"}, {@code "0.55 um"} or a bare number (taken in nanometres).
     */
    public static Wavelength parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("cannot parse wavelength from empty string");
        }
        String value = text.trim();
        int split = value.length();
        while (split > 0 && !isNumberChar(value.charAt(split - 1))) {
            split--;
        }
        String number = value.substring(0, split).trim();
        String unit = value.substring(split).trim();
        try {
            double magnitude = Double.parseDouble(number);
            return unit.isEmpty() ? new Wavelength(magnitude, DEFAULT_UNIT) : of(magnitude, unit);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("cannot parse wavelength from '" + text + "'", e);
        }
    }

    private static boolean isNumberChar(char c) {
        return Character.isDigit(c) || c == '.';
    }

    /**
     * Loose conversion used where wavelengths arrive as plain data: a {@code Wavelength}
     * passes through, a {@link Number} is taken in nanometres, a {@link String} is parsed.
     */
    public static Wavelength convert(Object value) {
        if (value instanceof Wavelength w) {
            return w;
        }
        if (value instanceof Number n) {
            return new Wavelength(n.doubleValue(), DEFAULT_UNIT);
        }
        if (value instanceof String s) {
            return parse(s);
        }
        throw new ConfigurationException("cannot interpret " + value + " as a wavelength");
    }

    public double nanometers() {
        return unit.toNanometers(magnitude);
    }

    public double magnitudeIn(WavelengthUnit target) {
        if (target == unit) {
            return magnitude;
        }
        return target.fromNanometers(nanometers());
    }

    public Wavelength to(WavelengthUnit target) {
        return target == unit ? this : new Wavelength(magnitudeIn(target), target);
    }

    /** Sum, expressed in this wavelength's unit. */
    public Wavelength plus(Wavelength other) {
        return new Wavelength(magnitude + other.magnitudeIn(unit), unit);
    }

    /** Difference, expressed in this wavelength's unit. */
    public Wavelength minus(Wavelength other) {
        return new Wavelength(magnitude - other.magnitudeIn(unit), unit);
    }

    public Wavelength times(double factor) {
        return new Wavelength(magnitude * factor, unit);
    }

    @Override
    public int compareTo(Wavelength other) {
        if (unit == other.unit) {
            return Double.compare(magnitude, other.magnitude);
        }
        return Double.compare(nanometers(), other.nanometers());
    }

    public boolean isBefore(Wavelength other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Wavelength other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return magnitude + " " + unit.getSymbol();
    }
}
