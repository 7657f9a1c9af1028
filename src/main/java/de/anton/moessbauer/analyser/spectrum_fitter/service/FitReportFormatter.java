package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitResult;

import java.util.Locale;

/**
 * Renders the plain-text fit report shown below the plots and stored with the payload.
 * Numbers use {@link Locale#ROOT} so the text is identical on every host.
 */
public class FitReportFormatter {

    static final String METHOD = "leastsq (Levenberg-Marquardt)";

    public String format(FitResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("[[Model]]\n");
        sb.append("    ").append(result.getModelType()).append(", ").append(result.getSiteCount())
            .append(result.getSiteCount() == 1 ? " site" : " sites")
            .append(result.isSiteCountEstimated() ? " (estimated)" : "").append('\n');

        sb.append("[[Fit Statistics]]\n");
        line(sb, "fitting method", METHOD);
        line(sb, "# function evals", String.valueOf(result.getEvaluations()));
        line(sb, "# iterations", String.valueOf(result.getIterations()));
        line(sb, "# data points", String.valueOf(result.getDataPointCount()));
        line(sb, "# variables", String.valueOf(result.getVariableCount()));
        line(sb, "chi-square", number(result.getChiSquared()));
        line(sb, "reduced chi-square", result.getReducedChiSquared().isPresent()
            ? number(result.getReducedChiSquared().getAsDouble()) : "undefined (no degrees of freedom)");
        line(sb, "converged", result.isConverged() ? "yes" : "no (best-effort result)");

        sb.append("[[Variables]]\n");
        int width = result.getParameters().stream().mapToInt(p -> p.name().length()).max().orElse(10);
        for (FitParameter p : result.getParameters()) {
            sb.append("    ").append(String.format(Locale.ROOT, "%-" + (width + 1) + "s", p.name() + ":")).append(' ');
            sb.append(String.format(Locale.ROOT, "%12.6f", p.value()));
            if (!p.vary()) {
                sb.append(" (fixed)");
            } else {
                if (p.hasStdError()) {
                    sb.append(String.format(Locale.ROOT, " +/- %.6f", p.stdError()));
                    if (p.value() != 0) {
                        sb.append(String.format(Locale.ROOT, " (%.2f%%)", Math.abs(100.0 * p.stdError() / p.value())));
                    }
                } else {
                    sb.append(" +/- n/a");
                }
                sb.append(String.format(Locale.ROOT, " (init = %.6f)", p.initialValue()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "    %-20s = %s\n", label, value));
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.6g", value);
    }
}
