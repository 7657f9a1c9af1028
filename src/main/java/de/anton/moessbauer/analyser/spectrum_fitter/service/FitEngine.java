package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.FitStatistics;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SpectrumModel;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SingularJacobianException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded weighted least squares on the composite model with Levenberg-Marquardt.
 *
 * Only parameters with {@code vary=true} enter the optimizer; bounds are enforced by clamping
 * every trial point. Residuals are weighted by 1/sigma. The Jacobian is taken by central
 * differences, one-sided where a bound is closer than the step. Standard errors come from
 * (JᵀJ)⁻¹ scaled by the reduced chi-squared; parameters at a bound or without influence on the
 * model get NaN. A non-finite chi-squared is never reported as a fit.
 */
public class FitEngine {

    private static final Logger logger = LoggerFactory.getLogger(FitEngine.class);
    private static final double BOUND_TOLERANCE = 1e-12;
    private static final double[][] ALTERNATIVE_STARTS = {{0.75, 1.0}, {1.25, 1.0}, {1.0, 1.5}}; // {QS factor, LW factor}

    private final FitterSettings settings;

    public FitEngine(FitterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Optimizer state of one start. */
    private static final class Attempt {
        double[] values;
        double chiSquared = Double.POSITIVE_INFINITY;
        boolean converged;
        int iterations;
        int evaluations;
    }

    /**
     * Fits the model described by {@code setup} to the spectrum.
     *
     * @return Fitted parameters, chi-squared and convergence state; an exhausted budget is reported
     *         as {@code converged=false} at the best point seen, never as an exception.
     * @throws SingularJacobianException If sites collapsed onto each other, the free parameters
     *                                   are linearly dependent at the solution or the model is not
     *                                   finite there.
     * @throws InterruptedException      If the thread is interrupted between starts.
     */
    public EngineResult fit(Spectrum spectrum, FitSetup setup) throws SingularJacobianException, InterruptedException {
        return fit(spectrum, setup, null);
    }

    /**
     * Fits like {@link #fit(Spectrum, FitSetup)} and additionally starts from {@code smaller}, the
     * result of the same model without its trailing sites, with those sites switched off
     * (amplitude 0). The lowest chi-squared over all starts wins, so adding sites never ends above
     * the smaller model's chi-squared.
     *
     * @param smaller Result of the model with fewer sites, or null.
     */
    public EngineResult fit(Spectrum spectrum, FitSetup setup, EngineResult smaller) throws SingularJacobianException, InterruptedException {
        SpectrumModel model = setup.model(settings.voigtMethod());
        List<FitParameter> parameters = setup.parameters();
        int[] free = freeIndices(parameters);
        double[] v = spectrum.getVelocities();
        double[] y = spectrum.getAbsorption();
        double[] sigma = spectrum.getUncertainties();

        Attempt best;
        if (free.length == 0) {
            best = new Attempt();
            best.values = setup.initialValues();
            best.chiSquared = FitStatistics.chiSquared(y, model.evaluate(v, best.values), sigma);
            best.converged = true;
            best.evaluations = 1;
            logger.debug("No free parameters; evaluated the model once (chi2={})", best.chiSquared);
        } else {
            best = optimize(model, parameters, free, v, y, sigma);
            if (settings.multiStart()) {
                for (double[] factors : ALTERNATIVE_STARTS) {
                    if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Fit cancelled between starts.");
                    FitSetup alternative = setup.withSeeds(perturbedSeeds(model, parameters, factors[0], factors[1]));
                    Attempt attempt = optimize(model, alternative.parameters(), free, v, y, sigma);
                    logger.debug("Alternative start QSx{} LWx{}: chi2={} (best {})", factors[0], factors[1], attempt.chiSquared, best.chiSquared);
                    if (attempt.chiSquared < best.chiSquared) {
                        best = attempt;
                    }
                }
            }
            if (smaller != null) {
                if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Fit cancelled between starts.");
                FitSetup nested = setup.withSeeds(nestedSeeds(model, parameters, smaller));
                Attempt attempt = optimize(model, nested.parameters(), free, v, y, sigma);
                logger.debug("Start nested on {} site(s): chi2={} (best {})", smaller.model().siteCount(), attempt.chiSquared, best.chiSquared);
                if (attempt.chiSquared < best.chiSquared) {
                    best = attempt;
                }
            }
        }
        if (!Double.isFinite(best.chiSquared)) {
            throw new SingularJacobianException("The model is not finite at the solution (chi-squared " + best.chiSquared
                + "); check the parameter bounds.");
        }

        checkCollapse(model, best.values);
        double[] errors = free.length == 0 ? nanArray(parameters.size())
            : standardErrors(model, parameters, free, best.values, v, sigma, best.chiSquared);

        List<FitParameter> fitted = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            fitted.add(parameters.get(i).withResult(best.values[i], errors[i]));
        }
        logger.debug("Fit finished: chi2={}, converged={}, iterations={}, evaluations={}",
            best.chiSquared, best.converged, best.iterations, best.evaluations);
        return new EngineResult(model, fitted, best.chiSquared, best.converged, best.iterations, best.evaluations);
    }

    private Attempt optimize(SpectrumModel model, List<FitParameter> parameters, int[] free,
                             double[] v, double[] y, double[] sigma) {
        double[] base = parameters.stream().mapToDouble(FitParameter::value).toArray();
        double[] lower = new double[free.length];
        double[] upper = new double[free.length];
        double[] start = new double[free.length];
        for (int j = 0; j < free.length; j++) {
            FitParameter p = parameters.get(free[j]);
            lower[j] = p.min();
            upper[j] = p.max();
            start[j] = p.value();
        }

        Attempt attempt = new Attempt();
        attempt.values = base.clone();

        MultivariateJacobianFunction function = point -> {
            double[] full = expand(base, free, point.toArray());
            double[] f = model.evaluate(v, full);
            attempt.evaluations++;
            double chi2 = FitStatistics.chiSquared(y, f, sigma);
            if (chi2 < attempt.chiSquared) {
                attempt.chiSquared = chi2;
                attempt.values = full;
            }
            double[] weighted = new double[v.length];
            for (int i = 0; i < v.length; i++) {
                weighted[i] = f[i] / sigma[i];
            }
            RealMatrix jacobian = new Array2DRowRealMatrix(jacobian(model, full, f, free, lower, upper, v, sigma), false);
            return new Pair<>(new ArrayRealVector(weighted, false), jacobian);
        };

        ParameterValidator clamp = point -> {
            for (int j = 0; j < point.getDimension(); j++) {
                point.setEntry(j, Math.max(lower[j], Math.min(upper[j], point.getEntry(j))));
            }
            return point;
        };

        ConvergenceChecker<LeastSquaresProblem.Evaluation> iterationRecorder = (iteration, previous, current) -> {
            attempt.iterations = iteration;
            return false;
        };

        double[] target = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            target[i] = y[i] / sigma[i];
        }

        LeastSquaresProblem problem = new LeastSquaresBuilder().
            start(start).
            model(function).
            target(target).
            parameterValidator(clamp).
            checker(iterationRecorder).
            lazyEvaluation(false).
            maxIterations(settings.maxIterations()).
            maxEvaluations(settings.maxEvaluations()).
            build();

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
            withCostRelativeTolerance(settings.costRelativeTolerance()).
            withParameterRelativeTolerance(settings.parameterRelativeTolerance());

        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            double[] values = expand(base, free, optimum.getPoint().toArray());
            double chi2 = FitStatistics.chiSquared(y, model.evaluate(v, values), sigma);
            if (chi2 <= attempt.chiSquared) {
                attempt.values = values;
                attempt.chiSquared = chi2;
            }
            attempt.iterations = optimum.getIterations();
            attempt.converged = Double.isFinite(attempt.chiSquared);
        } catch (TooManyIterationsException | TooManyEvaluationsException e) {
            logger.debug("Optimizer budget exhausted ({}); keeping best point with chi2={}", e.getMessage(), attempt.chiSquared);
            attempt.converged = false;
        } catch (ConvergenceException e) {
            // Tolerances below machine precision: the best point is as good as it gets.
            logger.debug("Optimizer stopped at machine precision: {}", e.getMessage());
            attempt.converged = Double.isFinite(attempt.chiSquared);
        }
        return attempt;
    }

    /** Weighted Jacobian of the model with respect to the free parameters. */
    private double[][] jacobian(SpectrumModel model, double[] full, double[] f, int[] free,
                                double[] lower, double[] upper, double[] v, double[] sigma) {
        double[][] jac = new double[v.length][free.length];
        for (int j = 0; j < free.length; j++) {
            int index = free[j];
            double x = full[index];
            double h = settings.jacobianRelativeStep() * Math.max(Math.abs(x), 1.0);
            double[] shifted = full.clone();
            double[] column = new double[v.length];
            if (x + h <= upper[j] && x - h >= lower[j]) {
                shifted[index] = x + h;
                double[] plus = model.evaluate(v, shifted);
                shifted[index] = x - h;
                double[] minus = model.evaluate(v, shifted);
                for (int i = 0; i < v.length; i++) column[i] = (plus[i] - minus[i]) / (2 * h);
            } else {
                double room = x + h <= upper[j] ? h : (x - h >= lower[j] ? -h : (upper[j] - x >= x - lower[j] ? upper[j] - x : lower[j] - x));
                if (room != 0) {
                    shifted[index] = x + room;
                    double[] moved = model.evaluate(v, shifted);
                    for (int i = 0; i < v.length; i++) column[i] = (moved[i] - f[i]) / room;
                }
            }
            for (int i = 0; i < v.length; i++) {
                jac[i][j] = column[i] / sigma[i];
            }
        }
        return jac;
    }

    /**
     * Standard errors from the weighted Jacobian at the solution. Columns are scaled to unit norm
     * before the QR decomposition so that parameters of different magnitude compare fairly.
     */
    private double[] standardErrors(SpectrumModel model, List<FitParameter> parameters, int[] free, double[] values,
                                    double[] v, double[] sigma, double chiSquared) throws SingularJacobianException {
        double[] errors = nanArray(parameters.size());
        int dof = v.length - free.length;
        if (dof <= 0) {
            return errors;
        }
        double[] lower = new double[free.length];
        double[] upper = new double[free.length];
        for (int j = 0; j < free.length; j++) {
            lower[j] = parameters.get(free[j]).min();
            upper[j] = parameters.get(free[j]).max();
        }
        double[][] jac = jacobian(model, values, model.evaluate(v, values), free, lower, upper, v, sigma);

        double[] norms = new double[free.length];
        double maxNorm = 0.0;
        for (int j = 0; j < free.length; j++) {
            double s = 0.0;
            for (double[] row : jac) s += row[j] * row[j];
            norms[j] = Math.sqrt(s);
            maxNorm = Math.max(maxNorm, norms[j]);
        }

        List<Integer> kept = new ArrayList<>();
        for (int j = 0; j < free.length; j++) {
            double x = values[free[j]];
            boolean atBound = nearBound(x, lower[j]) || nearBound(x, upper[j]);
            boolean inert = norms[j] <= settings.singularityThreshold() * maxNorm;
            if (atBound || inert) {
                logger.debug("No standard error for {} (atBound={}, inert={})", parameters.get(free[j]).name(), atBound, inert);
            } else {
                kept.add(j);
            }
        }
        if (kept.isEmpty()) {
            return errors;
        }

        double[][] scaled = new double[v.length][kept.size()];
        for (int i = 0; i < v.length; i++) {
            for (int c = 0; c < kept.size(); c++) {
                int j = kept.get(c);
                scaled[i][c] = jac[i][j] / norms[j];
            }
        }
        QRDecomposition qr = new QRDecomposition(MatrixUtils.createRealMatrix(scaled), settings.singularityThreshold());
        if (!qr.getSolver().isNonSingular()) {
            throw new SingularJacobianException("Jacobian is singular at the solution; the free parameters are not independent.");
        }
        int m = kept.size();
        RealMatrix r = qr.getR().getSubMatrix(0, m - 1, 0, m - 1);
        RealMatrix rInverse = MatrixUtils.inverse(r);
        RealMatrix covariance = rInverse.multiply(rInverse.transpose());
        double reducedChiSquared = chiSquared / dof;
        for (int c = 0; c < m; c++) {
            int j = kept.get(c);
            double variance = reducedChiSquared * covariance.getEntry(c, c);
            errors[free[j]] = variance >= 0 ? Math.sqrt(variance) / norms[j] : Double.NaN;
        }
        return errors;
    }

    /** Two sites of the same kind on the same lines make the model degenerate. */
    private void checkCollapse(SpectrumModel model, double[] values) throws SingularJacobianException {
        double tol = settings.collapseTolerance();
        List<SiteKind> kinds = model.getKinds();
        for (int a = 0; a < kinds.size(); a++) {
            for (int b = a + 1; b < kinds.size(); b++) {
                if (kinds.get(a) != kinds.get(b)) continue;
                boolean same = Math.abs(values[model.index(a, SpectrumModel.ISOMER_SHIFT)] - values[model.index(b, SpectrumModel.ISOMER_SHIFT)]) < tol
                    && Math.abs(values[model.index(a, SpectrumModel.LINE_WIDTH)] - values[model.index(b, SpectrumModel.LINE_WIDTH)]) < tol
                    && (kinds.get(a) == SiteKind.SINGLET
                        || Math.abs(values[model.index(a, SpectrumModel.QUADRUPOLE_SPLITTING)] - values[model.index(b, SpectrumModel.QUADRUPOLE_SPLITTING)]) < tol);
                if (same) {
                    throw new SingularJacobianException("Sites " + (a + 1) + " and " + (b + 1) + " collapsed onto the same lines.");
                }
            }
        }
    }

    private double[] perturbedSeeds(SpectrumModel model, List<FitParameter> parameters, double qsFactor, double lwFactor) {
        double[] seeds = parameters.stream().mapToDouble(FitParameter::value).toArray();
        for (int k = 0; k < model.siteCount(); k++) {
            int qs = model.index(k, SpectrumModel.QUADRUPOLE_SPLITTING);
            int lw = model.index(k, SpectrumModel.LINE_WIDTH);
            if (parameters.get(qs).vary()) seeds[qs] *= qsFactor;
            if (parameters.get(lw).vary()) seeds[lw] *= lwFactor;
        }
        return seeds;
    }

    /** Smaller-model values by parameter name; sites the smaller model lacks start at zero amplitude. */
    private static double[] nestedSeeds(SpectrumModel model, List<FitParameter> parameters, EngineResult smaller) {
        Map<String, Double> previous = new HashMap<>();
        for (FitParameter p : smaller.parameters()) {
            previous.put(p.name(), p.value());
        }
        double[] seeds = new double[parameters.size()];
        for (int i = 0; i < parameters.size(); i++) {
            seeds[i] = previous.getOrDefault(parameters.get(i).name(), parameters.get(i).value());
        }
        for (int k = smaller.model().siteCount(); k < model.siteCount(); k++) {
            int amplitude = model.index(k, SpectrumModel.AMPLITUDE);
            if (parameters.get(amplitude).vary()) seeds[amplitude] = 0.0;
        }
        return seeds;
    }

    private static boolean nearBound(double x, double bound) {
        return Double.isFinite(bound) && Math.abs(x - bound) <= BOUND_TOLERANCE * Math.max(1.0, Math.abs(bound));
    }

    private static int[] freeIndices(List<FitParameter> parameters) {
        int[] out = new int[parameters.size()];
        int n = 0;
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).vary()) out[n++] = i;
        }
        return Arrays.copyOf(out, n);
    }

    private static double[] expand(double[] base, int[] free, double[] point) {
        double[] full = base.clone();
        for (int j = 0; j < free.length; j++) {
            full[free[j]] = point[j];
        }
        return full;
    }

    private static double[] nanArray(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
