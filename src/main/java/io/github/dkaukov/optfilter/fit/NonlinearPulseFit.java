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

import java.util.Arrays;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.apache.commons.math3.complex.Complex;

import lombok.extern.slf4j.Slf4j;

/**
 * Nonlinear optimum filter: fits a 1 to 4 pole pulse shape (amplitudes, rise and fall times,
 * time offset) to a trace in the frequency domain, weighted by the noise PSD.
 *
 * <p>The DC bin is excluded by overriding {@code psd[0]} with {@value #DC_PSD}.</p>
 */
@Slf4j
public class NonlinearPulseFit extends FrequencyDomainFit {
  static final double DC_PSD = 1e40;
  static final double RISE_TIME_GUESS = 20e-6;
  /** Fall-time guesses for the multi-pole models. */
  static final double[] FALL_TIME_GUESSES = {100e-6, 300e-6, 500e-6};
  /** Search span after the peak for the 1/e point. */
  static final double FALL_SEARCH = 300e-6;
  /** Allowed {@code t0} excursion around the guess, in samples. */
  static final int T0_SPAN_BINS = 30;

  private final double[] psd;
  private final double[] template;

  /**
   * @param psd        two-sided noise PSD
   * @param sampleRate Hz
   * @param template   optional pulse template used to shape the initial guess
   * @param maxEvaluations optimizer evaluation budget
   */
  public NonlinearPulseFit(@Nonnull double[] psd, double sampleRate, @Nullable double[] template, int maxEvaluations) {
    super(psd.length, sampleRate, maxEvaluations);
    if (template != null && template.length != psd.length) {
      throw new IllegalArgumentException("template length " + template.length + " != PSD length " + psd.length);
    }
    for (int k = 1; k < psd.length; k++) {
      if (!(psd[k] > 0)) {
        throw new IllegalArgumentException("psd[" + k + "] must be > 0, got " + psd[k]);
      }
    }
    this.psd = psd.clone();
    this.psd[0] = DC_PSD;
    this.template = template == null ? null : template.clone();
  }

  public NonlinearPulseFit(@Nonnull double[] psd, double sampleRate, @Nullable double[] template) {
    this(psd, sampleRate, template, 10_000);
  }

  public NonlinearPulseFit(@Nonnull double[] psd, double sampleRate) {
    this(psd, sampleRate, null);
  }

  /**
   * Fit {@code trace}.
   *
   * @param trace    waveform
   * @param model    pole model
   * @param errScale PSD divisor, e.g. the number of traces averaged into {@code trace}
   * @param guess    initial parameters in {@link PoleModel} order, or {@code null} for the heuristic
   * @param tauRise  fixed rise time, required by {@link PoleModel#ONE_POLE}
   * @return fit with reduced chi2
   */
  public PulseFitResult fit(@Nonnull double[] trace, @Nonnull PoleModel model, double errScale,
                            @Nullable double[] guess, @Nullable Double tauRise) {
    if (model.needsFixedRiseTime() && tauRise == null) {
      throw new IllegalArgumentException("tauRise must be given for the one-pole fit");
    }
    if (guess != null && guess.length != model.parameterCount()) {
      throw new IllegalArgumentException("guess for " + model + " must have " + model.parameterCount()
        + " values, got " + guess.length);
    }
    Complex[] data = data(trace);
    double rise = tauRise == null ? 0.0 : tauRise;
    double[] p0 = guess != null ? guess.clone() : guess(trace, model);
    double[] lower = new double[p0.length];
    double[] upper = new double[p0.length];
    bounds(model, p0, lower, upper);
    if (log.isDebugEnabled()) {
      log.debug("{} fit, guess={}", model, Arrays.toString(p0));
    }
    double[] error = errors(psd, errScale);
    PulseFitResult raw = solve(data, error, p -> spectrum(model, p, rise), p0, lower, upper);
    double reduced = raw.getChi2() / (nbins - model.parameterCount());
    return new PulseFitResult(raw.getParameters(), raw.getErrors(), raw.getCovariance(), reduced,
      raw.getEvaluations(), raw.isConverged());
  }

  /** Fit with the heuristic guess and {@code errScale = 1}. */
  public PulseFitResult fit(@Nonnull double[] trace, @Nonnull PoleModel model, @Nullable Double tauRise) {
    return fit(trace, model, 1.0, null, tauRise);
  }

  /** Model spectrum as fitted, {@code sqrt(df)} included. */
  public Complex[] spectrum(@Nonnull PoleModel model, @Nonnull double[] params, double tauRise) {
    Complex[] out = new Complex[nbins];
    double s = Math.sqrt(df);
    for (int k = 0; k < nbins; k++) {
      out[k] = model.evaluate(omega[k], params, tauRise).multiply(s);
    }
    return out;
  }

  /** Model in the time domain, for comparing a fit with its trace. */
  public double[] timeDomain(@Nonnull PoleModel model, @Nonnull double[] params, double tauRise) {
    return model.timeDomain(params, tauRise, nbins, sampleRate);
  }

  /**
   * Initial parameters from the pulse peak. With a template, its shape is scaled by the trace's
   * peak-to-peak; the fall-time search always runs on the trace.
   */
  double[] guess(double[] trace, PoleModel model) {
    double ampScale = 1.0;
    double[] source = trace;
    if (template != null) {
      ampScale = max(trace) - min(trace);
      source = template;
    }
    int maxInd = argmax(source);
    double amp = 0;
    int from = Math.max(0, maxInd - 7);
    int to = Math.min(nbins, maxInd + 7);
    for (int i = from; i < to; i++) {
      amp += source[i];
    }
    amp = amp / (to - from) * ampScale;
    double t0 = maxInd / sampleRate;

    switch (model) {
      case FOUR_POLE:
        return new double[] {amp, amp / 3, amp / 3, RISE_TIME_GUESS,
          FALL_TIME_GUESSES[0], FALL_TIME_GUESSES[1], FALL_TIME_GUESSES[2], t0};
      case THREE_POLE:
        return new double[] {amp, amp / 3, RISE_TIME_GUESS, FALL_TIME_GUESSES[0], FALL_TIME_GUESSES[1], t0};
      default:
        double fall = fallTimeGuess(trace, maxInd, 0.37 * amp);
        return model == PoleModel.TWO_POLE
          ? new double[] {amp, RISE_TIME_GUESS, fall, t0}
          : new double[] {amp, fall, t0};
    }
  }

  /** Time from the peak to the sample closest to {@code level} within the search span. */
  private double fallTimeGuess(double[] trace, int maxInd, double level) {
    int from = maxInd + 1;
    int to = Math.min(nbins, from + (int) (FALL_SEARCH * sampleRate));
    if (from >= to) {
      return FALL_TIME_GUESSES[0];
    }
    int best = from;
    for (int i = from; i < to; i++) {
      if (Math.abs(trace[i] - level) < Math.abs(trace[best] - level)) {
        best = i;
      }
    }
    return (best - maxInd) / sampleRate;
  }

  /** Amplitudes {@code /100 .. x100}, time constants {@code /10 .. x10}, {@code t0 +- 30} samples. */
  private void bounds(PoleModel model, double[] p0, double[] lower, double[] upper) {
    int last = p0.length - 1;
    for (int i = 0; i < last; i++) {
      double f = i < model.amplitudeCount() ? 100 : 10;
      double a = p0[i] / f;
      double b = p0[i] * f;
      lower[i] = Math.min(a, b);
      upper[i] = Math.max(a, b);
    }
    lower[last] = p0[last] - T0_SPAN_BINS / sampleRate;
    upper[last] = p0[last] + T0_SPAN_BINS / sampleRate;
  }

  private static int argmax(double[] x) {
    int best = 0;
    for (int i = 1; i < x.length; i++) {
      if (x[i] > x[best]) {
        best = i;
      }
    }
    return best;
  }

  private static double max(double[] x) {
    return x[argmax(x)];
  }

  private static double min(double[] x) {
    double m = x[0];
    for (double v : x) {
      m = Math.min(m, v);
    }
    return m;
  }
}
