package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Map;

/**
 * User override for one named fit parameter. Every component is optional (null = keep the initializer's choice).
 *
 * @param value Seed value.
 * @param min   Lower bound.
 * @param max   Upper bound.
 * @param vary  False pins the parameter at its value; pinned parameters do not count as variables.
 */
public record CustomParameter(Double value, Double min, Double max, Boolean vary) {

    public static CustomParameter seed(double value) {
        return new CustomParameter(value, null, null, null);
    }

    public static CustomParameter fixed(double value) {
        return new CustomParameter(value, null, null, Boolean.FALSE);
    }

    public static CustomParameter bounded(double value, double min, double max) {
        return new CustomParameter(value, min, max, null);
    }

    /**
     * Parses the compact text form used on the command line: {@code value}, {@code value:min:max}
     * or {@code value:fixed}. Empty fields are allowed, e.g. {@code :0.1:0.4} only sets bounds.
     */
    public static CustomParameter parse(String text) throws InvalidOptionsException {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidOptionsException("Custom parameter specification must not be empty.");
        }
        String[] parts = text.trim().split(":", -1);
        try {
            Double value = parseOptional(parts[0]);
            if (parts.length == 1) {
                return new CustomParameter(value, null, null, null);
            }
            if (parts.length == 2 && parts[1].trim().equalsIgnoreCase("fixed")) {
                if (value == null) throw new InvalidOptionsException("A fixed parameter needs a value: '" + text + "'.");
                return new CustomParameter(value, null, null, Boolean.FALSE);
            }
            if (parts.length == 3) {
                return new CustomParameter(value, parseOptional(parts[1]), parseOptional(parts[2]), null);
            }
        } catch (NumberFormatException e) {
            throw new InvalidOptionsException("Cannot parse custom parameter '" + text + "': " + e.getMessage());
        }
        throw new InvalidOptionsException("Custom parameter must be 'value', 'value:min:max' or 'value:fixed', got '" + text + "'.");
    }

    /**
     * Builds a parameter from a JSON-like map with keys {@code value}, {@code min}, {@code max}, {@code vary}.
     */
    public static CustomParameter fromMap(String name, Map<?, ?> map) throws InvalidOptionsException {
        for (Object key : map.keySet()) {
            String k = String.valueOf(key);
            if (!k.equals("value") && !k.equals("min") && !k.equals("max") && !k.equals("vary")) {
                throw new InvalidOptionsException("Unknown attribute '" + k + "' for custom parameter '" + name + "'.");
            }
        }
        Object vary = map.get("vary");
        if (vary != null && !(vary instanceof Boolean)) {
            throw new InvalidOptionsException("'vary' of custom parameter '" + name + "' must be a boolean.");
        }
        return new CustomParameter(toDouble(name, map.get("value")), toDouble(name, map.get("min")),
            toDouble(name, map.get("max")), (Boolean) vary);
    }

    private static Double toDouble(String name, Object raw) throws InvalidOptionsException {
        if (raw == null) return null;
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        try {
            return Double.parseDouble(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new InvalidOptionsException("Custom parameter '" + name + "' has a non-numeric entry: " + raw);
        }
    }

    private static Double parseOptional(String s) {
        return s == null || s.trim().isEmpty() ? null : Double.parseDouble(s.trim());
    }
}
