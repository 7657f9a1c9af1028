package de.anton.moessbauer.analyser.spectrum_fitter.service;

import java.io.IOException;
import java.util.Map;

/**
 * External text-generation service that turns fit parameters into a written interpretation.
 * The returned text is stored verbatim.
 */
public interface InterpretationService {

    /**
     * @param fitParameters Output of {@code FitResult.narrativeParameters()}.
     * @return Free text.
     * @throws IOException If the service cannot be reached or answers with an error.
     */
    String interpret(Map<String, Object> fitParameters) throws IOException;
}
