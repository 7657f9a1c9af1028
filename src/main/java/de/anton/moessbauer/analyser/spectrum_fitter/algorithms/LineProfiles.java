package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.VoigtMethod;

/**
 * Maps a {@link ModelType} to its line profile.
 */
public final class LineProfiles {

    private LineProfiles() { throw new IllegalStateException("Utility class"); }

    public static LineProfile forModel(ModelType modelType, VoigtMethod voigtMethod) {
        switch (modelType) {
            case VOIGT:
                return new VoigtProfile(voigtMethod);
            case PSEUDO_VOIGT:
                return PseudoVoigtProfile.INSTANCE;
            case LORENTZIAN:
            default:
                return LorentzianProfile.INSTANCE;
        }
    }
}
