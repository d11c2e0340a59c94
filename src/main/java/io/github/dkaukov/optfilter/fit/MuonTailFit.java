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

import javax.annotation.Nonnull;

import org.apache.commons.math3.complex.Complex;

/**
 * Fit of a thermal muon tail, {@code A tau / (1 + i w tau)}, to a trace.
 * The PSD is used as given, DC bin included.
 */
public class MuonTailFit extends FrequencyDomainFit {

  private final double[] psd;

  public MuonTailFit(@Nonnull double[] psd, double sampleRate, int maxEvaluations) {
    super(psd.length, sampleRate, maxEvaluations);
    for (int k = 0; k < psd.length; k++) {
      if (!(psd[k] > 0)) {
        throw new IllegalArgumentException("psd[" + k + "] must be > 0 (or infinite), got " + psd[k]);
      }
    }
    this.psd = psd.clone();
  }

  public MuonTailFit(@Nonnull double[] psd, double sampleRate) {
    this(psd, sampleRate, 10_000);
  }

  /**
   * @param trace    waveform
   * @param errScale PSD divisor for averaged traces
   * @return {@code (A, tau)} with a plain, not reduced, chi2
   */
  public PulseFitResult fit(@Nonnull double[] trace, double errScale) {
    Complex[] data = data(trace);
    double amp = max(trace) - min(trace);
    int tauInd = 0;
    double level = amp / Math.E;
    for (int i = 1; i < trace.length; i++) {
      if (Math.abs(trace[i] - level) < Math.abs(trace[tauInd] - level)) {
        tauInd = i;
      }
    }
    double tau = tauInd / sampleRate;
    double[] guess = {amp, tau};
    double[] lower = {0, 0};
    double[] upper = {amp * 100, tau * 100};
    return solve(data, errors(psd, errScale), this::spectrum, guess, lower, upper);
  }

  public PulseFitResult fit(@Nonnull double[] trace) {
    return fit(trace, 1.0);
  }

  /** {@code A tau / (1 + i w tau) sqrt(df)} for {@code params = (A, tau)}. */
  public Complex[] spectrum(@Nonnull double[] params) {
    if (params.length != 2) {
      throw new IllegalArgumentException("muon tail takes (A, tau), got " + params.length + " values");
    }
    double s = Math.sqrt(df);
    Complex[] out = new Complex[nbins];
    for (int k = 0; k < nbins; k++) {
      out[k] = new Complex(params[0] * params[1] * s, 0).divide(new Complex(1, omega[k] * params[1]));
    }
    return out;
  }

  private static double max(double[] x) {
    double m = x[0];
    for (double v : x) {
      m = Math.max(m, v);
    }
    return m;
  }

  private static double min(double[] x) {
    double m = x[0];
    for (double v : x) {
      m = Math.min(m, v);
    }
    return m;
  }
}
