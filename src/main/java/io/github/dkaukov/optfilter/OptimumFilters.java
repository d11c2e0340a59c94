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
package io.github.dkaukov.optfilter;

import javax.annotation.Nonnull;

import io.github.dkaukov.optfilter.atoms.FitResult;
import io.github.dkaukov.optfilter.atoms.OptimumFilter;
import io.github.dkaukov.optfilter.atoms.PileupResult;
import io.github.dkaukov.optfilter.atoms.PulseDirection;
import io.github.dkaukov.optfilter.dsp.Coupling;
import io.github.dkaukov.optfilter.dsp.NoiseModel;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot optimum filter functions. Each call builds an {@link OptimumFilter} for the given
 * template and PSD; reuse an {@link OptimumFilter} directly when processing many traces.
 */
@Slf4j
public final class OptimumFilters {

  private OptimumFilters() {}

  /** Fit together with the expected amplitude resolution of the filter that produced it. */
  @Value
  public static class ResolvedFit {
    FitResult fit;
    /** {@code 1/sqrt(norm)}, see {@link OptimumFilter#energyResolution()}. */
    double energyResolution;
  }

  /**
   * Optimum filter amplitude of {@code signal}.
   *
   * @param withDelay search the time offset; otherwise fit at zero delay
   * @param window    search window in bins, {@code null} for none
   * @param outside   search outside the window
   * @param direction required amplitude sign
   */
  public static FitResult ofAmp(@Nonnull double[] signal, @Nonnull double[] template, @Nonnull double[] psd,
                                double fs, boolean withDelay, @Nonnull Coupling coupling, boolean integralNorm,
                                Integer window, boolean outside, @Nonnull PulseDirection direction) {
    return ofAmpWithResolution(signal, template, psd, fs, withDelay, coupling, integralNorm, window, outside, direction)
      .getFit();
  }

  /**
   * {@link #ofAmp(double[], double[], double[], double, boolean, Coupling, boolean, Integer, boolean, PulseDirection)}
   * plus the energy resolution of the filter.
   */
  public static ResolvedFit ofAmpWithResolution(@Nonnull double[] signal, @Nonnull double[] template,
                                                @Nonnull double[] psd, double fs, boolean withDelay,
                                                @Nonnull Coupling coupling, boolean integralNorm, Integer window,
                                                boolean outside, @Nonnull PulseDirection direction) {
    OptimumFilter of = new OptimumFilter(template, new NoiseModel(psd, coupling), fs, integralNorm).setSignal(signal);
    FitResult fit = withDelay ? of.amplitudeWithDelay(window, outside, direction) : of.amplitudeNoDelay();
    return new ResolvedFit(fit, of.energyResolution());
  }

  /** AC coupled, peak normalised, unconstrained, with the energy resolution. */
  public static ResolvedFit ofAmpWithResolution(@Nonnull double[] signal, @Nonnull double[] template,
                                                @Nonnull double[] psd, double fs, boolean withDelay) {
    return ofAmpWithResolution(signal, template, psd, fs, withDelay, Coupling.AC, false, null, false,
      PulseDirection.ANY);
  }

  /** AC coupled, peak normalised, unconstrained. */
  public static FitResult ofAmp(@Nonnull double[] signal, @Nonnull double[] template, @Nonnull double[] psd,
                                double fs, boolean withDelay) {
    return ofAmp(signal, template, psd, fs, withDelay, Coupling.AC, false, null, false, PulseDirection.ANY);
  }

  /**
   * Fit a pileup pulse. When {@code a1} or {@code t1} is missing the first pulse is found with
   * a delay search inside {@code window1}.
   *
   * @param window1 window for the first pulse, {@code null} for none
   * @param window2 window for the pileup pulse, {@code null} for none
   * @param outside search for the pileup pulse outside {@code window2}
   */
  public static PileupResult ofAmpPileup(@Nonnull double[] signal, @Nonnull double[] template, @Nonnull double[] psd,
                                         double fs, Double a1, Double t1, @Nonnull Coupling coupling,
                                         Integer window1, Integer window2, boolean outside) {
    OptimumFilter of = new OptimumFilter(template, new NoiseModel(psd, coupling), fs).setSignal(signal);
    double amp1;
    double time1;
    if (a1 == null || t1 == null) {
      FitResult first = of.amplitudeWithDelay(window1, false, PulseDirection.ANY);
      amp1 = first.getAmplitude();
      time1 = first.getTime();
      log.debug("First pulse found at t={} with amplitude {}", time1, amp1);
    } else {
      amp1 = a1;
      time1 = t1;
    }
    FitResult second = of.pileupGivenFirstPulse(amp1, time1, window2, outside, PulseDirection.ANY);
    return new PileupResult(amp1, time1, second.getAmplitude(), second.getTime(), second.getChi2());
  }

  /** AC coupled, first pulse searched everywhere, pileup pulse unconstrained. */
  public static PileupResult ofAmpPileup(@Nonnull double[] signal, @Nonnull double[] template, @Nonnull double[] psd,
                                         double fs) {
    return ofAmpPileup(signal, template, psd, fs, null, null, Coupling.AC, null, null, true);
  }

  /** Pileup fit with the first pulse pinned at zero delay. */
  public static PileupResult ofAmpPileupStationary(@Nonnull double[] signal, @Nonnull double[] template,
                                                   @Nonnull double[] psd, double fs, @Nonnull Coupling coupling,
                                                   Integer window, boolean outside) {
    return new OptimumFilter(template, new NoiseModel(psd, coupling), fs).setSignal(signal)
      .pileupStationary(window, outside);
  }

  /**
   * Chi2 of a fit restricted to {@code |f| <= cutoff}.
   */
  public static double chi2LowFrequency(@Nonnull double[] signal, @Nonnull double[] template, double amp, double t0,
                                        @Nonnull double[] psd, double fs, double cutoff, @Nonnull Coupling coupling) {
    return new OptimumFilter(template, new NoiseModel(psd, coupling), fs).setSignal(signal)
      .chi2LowFrequency(amp, t0, cutoff);
  }

  /**
   * Chi2 of the no-pulse hypothesis, {@code df sum |V|^2 / psd}.
   */
  public static double chi2NoPulse(@Nonnull double[] signal, @Nonnull double[] psd, double fs,
                                    @Nonnull Coupling coupling) {
    NoiseModel noise = new NoiseModel(psd, coupling);
    // the template only enters norm; a unit impulse has power in every bin
    double[] impulse = new double[signal.length];
    impulse[0] = 1.0;
    return new OptimumFilter(impulse, noise, fs).setSignal(signal).chi2NoPulse();
  }
}
