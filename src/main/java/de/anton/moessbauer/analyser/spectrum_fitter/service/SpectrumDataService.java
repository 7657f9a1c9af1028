package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SpectrumFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * Service responsible for loading spectra from files.
 */
public class SpectrumDataService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumDataService.class);
    private final SpectrumFileReader reader;

    public SpectrumDataService() {
        this.reader = new SpectrumFileReader();
    }

    /**
     * Loads (velocity, signal[, uncertainty]) samples from the file.
     *
     * @throws IOException          If the file cannot be read or parsed.
     * @throws NullPointerException If the file is null.
     */
    public RawSpectrum loadSpectrum(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        logger.info("Data Service: Attempting to load spectrum file: {}", file.getAbsolutePath());
        try {
            RawSpectrum spectrum = reader.read(file);
            logger.info("Data Service: {} samples loaded from {}", spectrum.size(), file.getName());
            return spectrum;
        } catch (IOException | RuntimeException e) {
            logger.error("Data Service: Failed to load spectrum file: {}", file.getAbsolutePath(), e);
            throw new IOException("Error reading spectrum file: " + e.getMessage(), e);
        }
    }
}
