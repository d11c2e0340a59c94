/*
 * This file is licensed under the GNU General Public License v3.0.
 *
 * You may obtain a copy of the License at
 * https://www.gnu.org/licenses/gpl-3.0.html
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 */
package io.github.dkaukov.optfilter.fit;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.Pair;

import io.github.dkaukov.optfilter.dsp.SpectralTransform;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded weighted least squares of a frequency-domain model against a trace spectrum.
 *
 * <p>The data is {@code dft(trace)/sqrt(fs nbins)} and the residual vector interleaves the real
 * and imaginary parts of {@code (data - model)/error}. The optimizer works on parameters divided
 * by the magnitude of the initial guess, a validator clamps them into the bounds, and the
 * Jacobian is a central finite difference.</p>
 */
@Slf4j
abstract class FrequencyDomainFit {
  /** Cube root of the double epsilon. */
  private static final double STEP = 6.055454452393343e-6;

  @Getter protected final int nbins;
  @Getter protected final double sampleRate;
  @Getter protected final double df;
  protected final SpectralTransform transform;
  /** Angular frequency per bin. */
  protected final double[] omega;
  @Getter private final int maxEvaluations;

  protected FrequencyDomainFit(int nbins, double sampleRate, int maxEvaluations) {
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException("maxEvaluations must be >= 1");
    }
    this.nbins = nbins;
    this.sampleRate = sampleRate;
    this.transform = new SpectralTransform(nbins, sampleRate);
    this.df = transform.getDf();
    this.maxEvaluations = maxEvaluations;
    double[] f = transform.frequencies();
    this.omega = new double[nbins];
    for (int k = 0; k < nbins; k++) {
      omega[k] = 2 * Math.PI * f[k];
    }
  }

  /** Model spectrum, {@code sqrt(df)} included. */
  protected interface SpectrumModel {
    Complex[] spectrum(double[] params);
  }

  protected Complex[] data(double[] trace) {
    if (trace.length != nbins) {
      throw new IllegalArgumentException("trace length " + trace.length + " != " + nbins);
    }
    Complex[] d = transform.dft(trace);
    double norm = Math.sqrt(sampleRate * nbins);
    for (int k = 0; k < nbins; k++) {
      d[k] = d[k].divide(norm);
    }
    return d;
  }

  protected static double[] errors(double[] psd, double errScale) {
    if (!(errScale > 0)) {
      throw new IllegalArgumentException("errScale must be > 0, got " + errScale);
    }
    double[] e = new double[psd.length];
    for (int k = 0; k < psd.length; k++) {
      e[k] = Math.sqrt(psd[k] / errScale);
    }
    return e;
  }

  /** {@code sum |data - model|^2 / error^2}. */
  protected static double chi2(Complex[] data, Complex[] model, double[] error) {
    double acc = 0;
    for (int k = 0; k < data.length; k++) {
      Complex d = data[k].subtract(model[k]);
      double e2 = error[k] * error[k];
      acc += (d.getReal() * d.getReal() + d.getImaginary() * d.getImaginary()) / e2;
    }
    return acc;
  }

  /**
   * Run the fit.
   *
   * @param guess initial parameters
   * @param lower lower bounds
   * @param upper upper bounds
   * @return parameters, errors and covariance; {@code chi2} is the raw sum, callers normalise it
   */
  protected PulseFitResult solve(Complex[] data, double[] error, SpectrumModel model,
                                 double[] guess, double[] lower, double[] upper) {
    int np = guess.length;
    double[] scale = new double[np];
    double[] lo = new double[np];
    double[] hi = new double[np];
    double[] start = new double[np];
    for (int i = 0; i < np; i++) {
      scale[i] = guess[i] == 0 ? 1.0 : Math.abs(guess[i]);
      lo[i] = lower[i] / scale[i];
      hi[i] = upper[i] / scale[i];
      start[i] = guess[i] / scale[i];
      if (!(lo[i] <= start[i] && start[i] <= hi[i])) {
        throw new IllegalArgumentException("guess " + guess[i] + " outside bounds ["
          + lower[i] + ", " + upper[i] + "] for parameter " + i);
      }
    }

    BestPoint best = new BestPoint();
    MultivariateJacobianFunction function = point -> {
      double[] u = clamp(point.toArray(), lo, hi);
      double[] r = residuals(data, error, model, unscale(u, scale));
      best.offer(u, r);
      RealMatrix jac = new Array2DRowRealMatrix(r.length, np);
      for (int i = 0; i < np; i++) {
        double h = STEP * Math.max(1.0, Math.abs(u[i]));
        double[] up = u.clone();
        double[] down = u.clone();
        up[i] += h;
        down[i] -= h;
        double[] rUp = residuals(data, error, model, unscale(up, scale));
        double[] rDown = residuals(data, error, model, unscale(down, scale));
        for (int k = 0; k < r.length; k++) {
          jac.setEntry(k, i, (rUp[k] - rDown[k]) / (2 * h));
        }
      }
      return new Pair<>(new ArrayRealVector(r, false), jac);
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder()
      .start(start)
      .target(new double[2 * nbins])
      .model(function)
      .parameterValidator(p -> new ArrayRealVector(clamp(p.toArray(), lo, hi), false))
      .lazyEvaluation(false)
      .maxEvaluations(maxEvaluations)
      .maxIterations(maxEvaluations)
      .build();
    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
      .withCostRelativeTolerance(1e-12)
      .withParameterRelativeTolerance(1e-12);

    boolean converged = true;
    int evaluations;
    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
      evaluations = optimum.getEvaluations();
      double[] u = clamp(optimum.getPoint().toArray(), lo, hi);
      best.offer(u, residuals(data, error, model, unscale(u, scale)));
    } catch (TooManyEvaluationsException | TooManyIterationsException e) {
      converged = false;
      evaluations = maxEvaluations;
      log.warn("Fit did not converge in {} evaluations, keeping best point (cost {})", maxEvaluations, best.cost);
    } catch (ConvergenceException e) {
      // tolerance below machine precision
      converged = false;
      evaluations = best.offers;
      log.warn("Fit stopped early ({}), keeping best point (cost {})", e.getMessage(), best.cost);
    }

    double[] params = unscale(best.point, scale);
    // Jacobian in unscaled parameters
    double[] r = residuals(data, error, model, params);
    RealMatrix jac = new Array2DRowRealMatrix(r.length, np);
    for (int i = 0; i < np; i++) {
      double h = STEP * Math.max(1.0, Math.abs(best.point[i])) * scale[i];
      double[] up = params.clone();
      double[] down = params.clone();
      up[i] += h;
      down[i] -= h;
      double[] rUp = residuals(data, error, model, up);
      double[] rDown = residuals(data, error, model, down);
      for (int k = 0; k < r.length; k++) {
        jac.setEntry(k, i, (rUp[k] - rDown[k]) / (2 * h));
      }
    }
    RealMatrix cov = new SingularValueDecomposition(jac.transpose().multiply(jac)).getSolver().getInverse();
    double[] err = new double[np];
    for (int i = 0; i < np; i++) {
      err[i] = Math.sqrt(cov.getEntry(i, i));
    }
    double chi2 = chi2(data, model.spectrum(params), error);
    if (log.isDebugEnabled()) {
      log.debug("Fit finished after {} evaluations, chi2={}, converged={}", evaluations, chi2, converged);
    }
    return new PulseFitResult(params, err, cov.getData(), chi2, evaluations, converged);
  }

  private double[] residuals(Complex[] data, double[] error, SpectrumModel model, double[] params) {
    Complex[] m = model.spectrum(params);
    double[] r = new double[2 * nbins];
    for (int k = 0; k < nbins; k++) {
      Complex d = data[k].subtract(m[k]);
      r[2 * k] = d.getReal() / error[k];
      r[2 * k + 1] = d.getImaginary() / error[k];
    }
    return r;
  }

  private static double[] clamp(double[] u, double[] lo, double[] hi) {
    double[] out = new double[u.length];
    for (int i = 0; i < u.length; i++) {
      out[i] = Math.max(lo[i], Math.min(hi[i], u[i]));
    }
    return out;
  }

  private static double[] unscale(double[] u, double[] scale) {
    double[] p = new double[u.length];
    for (int i = 0; i < u.length; i++) {
      p[i] = u[i] * scale[i];
    }
    return p;
  }

  /** Lowest-cost point seen during the search. */
  private static final class BestPoint {
    double[] point;
    double cost = Double.POSITIVE_INFINITY;
    int offers;

    void offer(double[] u, double[] r) {
      offers++;
      double c = 0;
      for (double x : r) {
        c += x * x;
      }
      if (point == null || c < cost) {
        cost = c;
        point = u.clone();
      }
    }
  }
}
