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
package io.github.dkaukov.optfilter.atoms;

import javax.annotation.Nonnull;

import org.apache.commons.math3.complex.Complex;

import io.github.dkaukov.optfilter.dsp.NoiseModel;
import io.github.dkaukov.optfilter.dsp.SpectralTransform;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-template optimum filter.
 *
 * The template-dependent quantities (template spectrum {@code s}, filter
 * {@code phi = conj(s)/psd}, normalization {@code norm}) are computed once in the constructor.
 * {@link #setSignal(double[])} loads a new trace and drops every cached curve of the previous one,
 * so one instance can be run over many traces. A new template or PSD needs a new instance.
 *
 * <p>Not thread-safe.</p>
 */
@Slf4j
public class OptimumFilter {

  @Getter private final int nbins;
  @Getter private final double sampleRate;
  @Getter private final double df;
  /** {@code df * sum |s|^2 / psd}. */
  @Getter private final double norm;

  private final SpectralTransform transform;
  private final NoiseModel noise;
  private final Complex[] s;
  private final Complex[] phi;
  private final double[] freqs;
  private double[] templateFiltTd;

  // ---- per-signal state ----
  private Complex[] v;
  private Complex[] signalFilt;
  private double chi0;
  private double[] signalFiltTd;
  private double[] ampsWithDelay;
  private double[] chiWithDelay;

  /**
   * @param template     pulse template, peak normalised to 1 (or any shape when {@code integralNorm})
   * @param noise        noise model with the same number of bins
   * @param sampleRate   Hz
   * @param integralNorm divide the template spectrum by its DC value so amplitudes become integrals
   */
  public OptimumFilter(@Nonnull double[] template, @Nonnull NoiseModel noise, double sampleRate, boolean integralNorm) {
    if (template.length != noise.length()) {
      throw new IllegalArgumentException("PSD length " + noise.length()
        + " incompatible with template length " + template.length);
    }
    this.nbins = template.length;
    this.sampleRate = sampleRate;
    this.transform = new SpectralTransform(nbins, sampleRate);
    this.df = transform.getDf();
    this.noise = noise;
    this.freqs = transform.frequencies();

    this.s = transform.forward(template);
    if (integralNorm) {
      Complex s0 = s[0];
      if (s0.abs() == 0) {
        throw new IllegalArgumentException("template integral is zero, cannot integral-normalise");
      }
      for (int k = 0; k < nbins; k++) {
        s[k] = s[k].divide(s0);
      }
    }
    this.phi = new Complex[nbins];
    double acc = 0;
    for (int k = 0; k < nbins; k++) {
      double w = noise.weight(k);
      phi[k] = s[k].conjugate().multiply(w);
      acc += sq(s[k]) * w;
    }
    this.norm = acc * df;
    if (!(norm > 0)) {
      throw new IllegalArgumentException("template has no power in the weighted bins");
    }
    log.debug("OptimumFilter nbins={}, fs={}, coupling={}, norm={}", nbins, sampleRate, noise.coupling(), norm);
  }

  public OptimumFilter(@Nonnull double[] template, @Nonnull NoiseModel noise, double sampleRate) {
    this(template, noise, sampleRate, false);
  }

  /**
   * Load a new trace. Replaces the signal spectrum and the filtered spectrum and invalidates all
   * cached chi2 and amplitude curves.
   */
  public OptimumFilter setSignal(@Nonnull double[] signal) {
    if (signal.length != nbins) {
      throw new IllegalArgumentException("signal length " + signal.length + " != " + nbins);
    }
    Complex[] nv = transform.forward(signal);
    Complex[] nf = new Complex[nbins];
    double c = 0;
    for (int k = 0; k < nbins; k++) {
      nf[k] = phi[k].multiply(nv[k]).divide(norm);
      c += sq(nv[k]) * noise.weight(k);
    }
    this.v = nv;
    this.signalFilt = nf;
    this.chi0 = c * df;
    this.signalFiltTd = null;
    this.ampsWithDelay = null;
    this.chiWithDelay = null;
    return this;
  }

  // ---------- figures of merit ----------

  /** Expected amplitude resolution, {@code 1/sqrt(norm)}. */
  public double energyResolution() {
    return 1.0 / Math.sqrt(norm);
  }

  /** Expected time resolution (s) of a pulse with amplitude {@code amp}. */
  public double timeResolution(double amp) {
    double acc = 0;
    for (int k = 0; k < nbins; k++) {
      double omega = 2 * Math.PI * freqs[k];
      acc += omega * omega * sq(s[k]) * noise.weight(k);
    }
    return 1.0 / Math.sqrt(amp * amp * acc * df);
  }

  /** Chi2 of the hypothesis that the trace holds no pulse. */
  public double chi2NoPulse() {
    requireSignal();
    return chi0;
  }

  /**
   * Chi2 of a given fit restricted to {@code |f| <= cutoff}.
   *
   * @param amp    fitted amplitude
   * @param t0     fitted time offset (s)
   * @param cutoff Hz
   */
  public double chi2LowFrequency(double amp, double t0, double cutoff) {
    requireSignal();
    double acc = 0;
    for (int k = 0; k < nbins; k++) {
      if (Math.abs(freqs[k]) > cutoff) {
        continue;
      }
      Complex model = s[k].multiply(shift(freqs[k], t0)).multiply(amp);
      acc += sq(v[k].subtract(model)) * noise.weight(k);
    }
    return acc * df;
  }

  /** {@link #chi2LowFrequency(double, double, double)} with a 10 kHz cutoff. */
  public double chi2LowFrequency(double amp, double t0) {
    return chi2LowFrequency(amp, t0, 10_000);
  }

  // ---------- fits ----------

  /** Amplitude of a pulse at zero delay; no search. */
  public FitResult amplitudeNoDelay() {
    requireSignal();
    double acc = 0;
    for (Complex c : signalFilt) {
      acc += c.getReal();
    }
    double amp = acc * df;
    return new FitResult(amp, 0.0, chi0 - amp * amp * norm);
  }

  /**
   * Amplitude and time offset minimizing chi2 over candidate delays.
   *
   * @param window    search window width in bins centred on zero delay, {@code null} for none
   * @param outside   search outside the window instead
   * @param direction required sign of the amplitude
   * @return best fit, or {@code (0, 0, chi2NoPulse)} when no candidate is left
   */
  public FitResult amplitudeWithDelay(Integer window, boolean outside, @Nonnull PulseDirection direction) {
    requireSignal();
    if (chiWithDelay == null) {
      double[] td = signalFiltTd();
      double[] chi = new double[nbins];
      for (int k = 0; k < nbins; k++) {
        chi[k] = chi0 - td[k] * td[k] * norm;
      }
      chiWithDelay = DelaySearch.roll(chi, nbins / 2);
      ampsWithDelay = DelaySearch.roll(td, nbins / 2);
    }
    int best = DelaySearch.argmin(chiWithDelay, window, outside, direction.mask(ampsWithDelay));
    if (best == DelaySearch.NONE) {
      log.debug("No candidate delay left (window={}, outside={}, direction={})", window, outside, direction);
      return new FitResult(0.0, 0.0, chi0);
    }
    return new FitResult(ampsWithDelay[best], toTime(best), chiWithDelay[best]);
  }

  /** Unconstrained delay search. */
  public FitResult amplitudeWithDelay() {
    return amplitudeWithDelay(null, false, PulseDirection.ANY);
  }

  /**
   * Second pulse of a pileup given an already fitted first pulse.
   *
   * @param a1        amplitude of the first pulse
   * @param t1        time offset of the first pulse (s)
   * @param window    window width for the second pulse, {@code null} for none
   * @param outside   search outside the window
   * @param direction required sign of the second amplitude
   * @return second pulse amplitude, time offset and the two-pulse chi2
   */
  public FitResult pileupGivenFirstPulse(double a1, double t1, Integer window, boolean outside,
                                         @Nonnull PulseDirection direction) {
    requireSignal();
    double[] td = signalFiltTd();
    Complex[] x = new Complex[nbins];
    for (int k = 0; k < nbins; k++) {
      x[k] = phi[k].multiply(s[k]).multiply(shift(freqs[k], t1));
    }
    double[] templTd = transform.inverseReal(x);
    int t1ind = Math.floorMod(Math.round(t1 * sampleRate), nbins);

    double chit = a1 * a1 * norm - 2 * a1 * td[t1ind] * norm;
    double[] a2s = new double[nbins];
    double[] chi = new double[nbins];
    for (int k = 0; k < nbins; k++) {
      double a2 = td[k] - a1 * templTd[k] / norm;
      a2s[k] = a2;
      chi[k] = chi0 + chit + a2 * a2 * norm + 2 * a1 * a2 * templTd[k] - 2 * a2 * td[k] * norm;
    }
    a2s = DelaySearch.roll(a2s, nbins / 2);
    chi = DelaySearch.roll(chi, nbins / 2);
    int best = DelaySearch.argmin(chi, window, outside, direction.mask(a2s));
    if (best == DelaySearch.NONE) {
      log.debug("No candidate delay left for pileup pulse");
      return new FitResult(0.0, 0.0, chi0 + chit);
    }
    return new FitResult(a2s[best], toTime(best), chi[best]);
  }

  /** Unconstrained pileup search. */
  public FitResult pileupGivenFirstPulse(double a1, double t1) {
    return pileupGivenFirstPulse(a1, t1, null, true, PulseDirection.ANY);
  }

  /**
   * Joint fit of a pulse fixed at zero delay and a second pulse at every candidate delay.
   * Where both pulses coincide the 2x2 system is singular and the amplitude is split evenly.
   */
  public PileupResult pileupStationary(Integer window, boolean outside) {
    requireSignal();
    double[] td = signalFiltTd();
    double[] t = templateFiltTd();
    double n2 = norm * norm;
    double[] a1s = new double[nbins];
    double[] a2s = new double[nbins];
    double[] chi = new double[nbins];
    // projection[0] / (2 norm)
    a1s[0] = td[0] / 2;
    a2s[0] = td[0] / 2;
    for (int k = 1; k < nbins; k++) {
      double denom = n2 - t[k] * t[k];
      a1s[k] = (td[0] * n2 - td[k] * norm * t[k]) / denom;
      a2s[k] = (td[k] * n2 - td[0] * norm * t[k]) / denom;
    }
    for (int k = 0; k < nbins; k++) {
      double a1 = a1s[k];
      double a2 = a2s[k];
      double chit = (a1 * a1 + a2 * a2) * norm + 2 * a1 * a2 * t[k];
      double chil = 2 * a1 * td[0] * norm + 2 * a2 * td[k] * norm;
      chi[k] = chi0 + chit - chil;
    }
    a1s = DelaySearch.roll(a1s, nbins / 2);
    a2s = DelaySearch.roll(a2s, nbins / 2);
    chi = DelaySearch.roll(chi, nbins / 2);
    int best = DelaySearch.argmin(chi, window, outside, null);
    if (best == DelaySearch.NONE) {
      log.debug("No candidate delay left for stationary pileup");
      return new PileupResult(0.0, 0.0, 0.0, 0.0, chi0);
    }
    return new PileupResult(a1s[best], 0.0, a2s[best], toTime(best), chi[best]);
  }

  /** Unconstrained stationary pileup search. */
  public PileupResult pileupStationary() {
    return pileupStationary(null, true);
  }

  /**
   * Amplitude fit with a floating constant baseline.
   *
   * <p>Amplitude and baseline are first solved jointly at every delay; the baseline at the
   * global chi2 minimum is then held fixed and only the amplitude is refitted, so that
   * amplitudes far from the true pulse do not drift with a per-delay baseline. Under AC coupling
   * the DC bin is put back with the caller's {@code psd[0]} for this fit.</p>
   *
   * @return best fit, or {@code (0, 0, chi2 of the fixed baseline alone)} when no candidate is left
   */
  public FitResult baseline(Integer window, boolean outside, @Nonnull PulseDirection direction) {
    requireSignal();
    double psd0 = noise.dcValue();
    if (!(psd0 > 0)) {
      throw new IllegalStateException("baseline fit needs a positive psd[0], got " + psd0);
    }
    boolean ac = noise.isAcCoupled();
    Complex[] phiB = phi;
    double normB = norm;
    if (ac) {
      phiB = phi.clone();
      phiB[0] = s[0].conjugate().divide(psd0);
      double acc = 0;
      for (int k = 0; k < nbins; k++) {
        acc += phiB[k].multiply(s[k]).getReal();
      }
      normB = acc * df;
    }
    Complex[] pv = new Complex[nbins];
    for (int k = 0; k < nbins; k++) {
      pv[k] = phiB[k].multiply(v[k]);
    }
    double[] b1 = transform.inverseReal(pv);
    double b2 = phiB[0].getReal();
    double c1 = v[0].getReal() / psd0;
    double c2 = 1.0 / (df * psd0);

    double chiBase = chi0;
    if (ac) {
      chiBase += sq(v[0]) / psd0 * df;
    }

    int best = 0;
    double bestChi = Double.POSITIVE_INFINITY;
    double[] baselines = new double[nbins];
    double det = normB * c2 - b2 * b2;
    for (int k = 0; k < nbins; k++) {
      double amp = (b1[k] * c2 - b2 * c1) / det;
      double base = (c1 - amp * b2) / c2;
      baselines[k] = base;
      double chi = chiBase - 2 * (amp * b1[k] + base * c1) + amp * amp * normB
        + 2 * amp * base * b2 + base * base * c2;
      if (chi < bestChi) {
        bestChi = chi;
        best = k;
      }
    }
    double bs = baselines[best];
    double chi0b = chiBase - 2 * bs * c1 + bs * bs * c2;
    double[] amps = new double[nbins];
    double[] chi2 = new double[nbins];
    for (int k = 0; k < nbins; k++) {
      double a = (b1[k] - bs * b2) / normB;
      amps[k] = a;
      chi2[k] = chi0b - 2 * a * b1[k] + a * a * normB + 2 * a * bs * b2;
    }
    amps = DelaySearch.roll(amps, nbins / 2);
    chi2 = DelaySearch.roll(chi2, nbins / 2);
    int idx = DelaySearch.argmin(chi2, window, outside, direction.mask(amps));
    if (idx == DelaySearch.NONE) {
      log.debug("No candidate delay left for baseline fit (baseline={})", bs);
      return new FitResult(0.0, 0.0, chi0b);
    }
    return new FitResult(amps[idx], toTime(idx), chi2[idx]);
  }

  /** Unconstrained floating-baseline fit. */
  public FitResult baseline() {
    return baseline(null, false, PulseDirection.ANY);
  }

  // ---------- helpers ----------

  private double[] signalFiltTd() {
    if (signalFiltTd == null) {
      signalFiltTd = transform.inverseReal(signalFilt);
    }
    return signalFiltTd;
  }

  private double[] templateFiltTd() {
    if (templateFiltTd == null) {
      Complex[] x = new Complex[nbins];
      for (int k = 0; k < nbins; k++) {
        x[k] = phi[k].multiply(s[k]);
      }
      templateFiltTd = transform.inverseReal(x);
    }
    return templateFiltTd;
  }

  private double toTime(int rolledIndex) {
    return (rolledIndex - nbins / 2) / sampleRate;
  }

  private void requireSignal() {
    if (v == null) {
      throw new IllegalStateException("setSignal() must be called first");
    }
  }

  /** {@code exp(-2 pi i f t)}. */
  private static Complex shift(double f, double t) {
    double a = -2 * Math.PI * f * t;
    return new Complex(Math.cos(a), Math.sin(a));
  }

  private static double sq(Complex c) {
    return c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
  }
}
