package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Lineshape kernel used for every line of every site.
 * Each constant carries the tag used in request options and a display name for reports.
 */
public enum ModelType {
    LORENTZIAN("lorentzian", "Lorentzian"),
    VOIGT("voigt", "Voigt"),
    PSEUDO_VOIGT("pseudo_voigt", "Pseudo-Voigt");

    private final String tag;
    private final String displayName;

    ModelType(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    /** @return The option tag, e.g. "pseudo_voigt". */
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a ModelType by its option tag (case-insensitive). Display names and enum names are accepted too.
     *
     * @param tag The tag to look up.
     * @return The matching ModelType.
     * @throws InvalidOptionsException If no model type matches.
     */
    public static ModelType fromTag(String tag) throws InvalidOptionsException {
        if (tag == null || tag.trim().isEmpty()) {
            throw new InvalidOptionsException("model_type must not be empty.");
        }
        String wanted = tag.trim();
        for (ModelType type : values()) {
            if (type.tag.equalsIgnoreCase(wanted) || type.displayName.equalsIgnoreCase(wanted) || type.name().equalsIgnoreCase(wanted)) {
                return type;
            }
        }
        throw new InvalidOptionsException("Unknown model_type '" + tag + "'. Expected one of: lorentzian, voigt, pseudo_voigt.");
    }
}
