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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.github.dkaukov.optfilter.TestSignals;
import io.github.dkaukov.optfilter.dsp.Coupling;
import io.github.dkaukov.optfilter.dsp.NoiseModel;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@DisplayName("Single-template optimum filter")
public class OptimumFilterTest {

  private static final int NBINS = 1024;
  private static final double PSD_LEVEL = 1e-6;

  private final double[] template = TestSignals.centeredPulse(NBINS);
  private final NoiseModel noise = new NoiseModel(TestSignals.whitePsd(NBINS, PSD_LEVEL));

  private OptimumFilter filter(double[] signal) {
    return new OptimumFilter(template, noise, TestSignals.FS).setSignal(signal);
  }

  @Test
  @DisplayName("Template as signal: amplitude 1, delay 0, chi2 ~ 0")
  public void testPureTemplate() {
    OptimumFilter of = filter(template);
    FitResult r = of.amplitudeWithDelay();
    assertEquals(1.0, r.getAmplitude(), 1e-9);
    assertEquals(0.0, r.getTime(), 0.0);
    assertEquals(0.0, r.getChi2(), 1e-9 * of.chi2NoPulse());

    FitResult nd = of.amplitudeNoDelay();
    assertEquals(1.0, nd.getAmplitude(), 1e-9);
    assertEquals(0.0, nd.getChi2(), 1e-9 * of.chi2NoPulse());
  }

  @ParameterizedTest(name = "shift = {0} bins")
  @ValueSource(ints = {-300, -17, -1, 1, 42, 250})
  @DisplayName("Shifted template: delay recovered to the sample")
  public void testShiftRecovery(int shift) {
    FitResult r = filter(TestSignals.scaledShift(template, 2.5, shift)).amplitudeWithDelay();
    assertEquals(shift / TestSignals.FS, r.getTime(), 1e-12);
    assertEquals(2.5, r.getAmplitude(), 1e-9);
  }

  @ParameterizedTest(name = "seed = {0}")
  @ValueSource(longs = {1, 2, 3, 4})
  @DisplayName("No-delay chi2 is never below the delay-search chi2")
  public void testNoDelayChi2Bound(long seed) {
    double[] signal = TestSignals.add(TestSignals.scaledShift(template, 0.01, (int) seed * 5),
      TestSignals.gaussianNoise(NBINS, 0.003, seed));
    OptimumFilter of = filter(signal);
    assertTrue(of.amplitudeNoDelay().getChi2() >= of.amplitudeWithDelay().getChi2());
  }

  @Test
  @DisplayName("Lower noise gives better energy resolution")
  public void testResolutionMonotonic() {
    double previous = Double.POSITIVE_INFINITY;
    for (double level : new double[] {1e-4, 1e-5, 1e-6, 1e-7}) {
      double res = new OptimumFilter(template, new NoiseModel(TestSignals.whitePsd(NBINS, level)), TestSignals.FS)
        .energyResolution();
      assertTrue(res < previous, "resolution should tighten at PSD " + level);
      previous = res;
    }
    OptimumFilter of = filter(template);
    assertTrue(of.timeResolution(2.0) < of.timeResolution(1.0));
  }

  @Test
  @DisplayName("Stationary pileup recovers two separated pulses")
  public void testPileupStationary() {
    double[] signal = TestSignals.add(template, TestSignals.scaledShift(template, 0.5, 150));
    OptimumFilter of = filter(signal);
    PileupResult r = of.pileupStationary();
    log.info("pileup: {}", r);
    assertEquals(1.0, r.getFirstAmplitude(), 1e-6);
    assertEquals(0.5, r.getSecondAmplitude(), 1e-6);
    assertEquals(150 / TestSignals.FS, r.getSecondTime(), 1e-12);
    assertEquals(0.0, r.getChi2(), 1e-9 * of.chi2NoPulse());
  }

  @Test
  @DisplayName("Stationary pileup without a second pulse reduces to the single-pulse fit")
  public void testPileupStationaryNoSecondPulse() {
    OptimumFilter of = filter(template);
    double single = of.amplitudeWithDelay().getChi2();

    PileupResult coincident = of.pileupStationary(1, false);
    assertEquals(0.0, coincident.getSecondTime(), 0.0);
    assertEquals(0.5, coincident.getFirstAmplitude(), 1e-9);
    assertEquals(0.5, coincident.getSecondAmplitude(), 1e-9);
    assertEquals(single, coincident.getChi2(), 1e-6 * of.chi2NoPulse());

    PileupResult apart = of.pileupStationary(1, true);
    assertTrue(apart.getSecondTime() != 0.0);
    assertEquals(1.0, apart.getFirstAmplitude(), 1e-6);
    assertEquals(0.0, apart.getSecondAmplitude(), 1e-6);
    assertEquals(single, apart.getChi2(), 1e-6 * of.chi2NoPulse());
  }

  @Test
  @DisplayName("Pileup with a known first pulse finds the second")
  public void testPileupGivenFirstPulse() {
    double[] signal = TestSignals.add(TestSignals.scaledShift(template, 1.0, 10),
      TestSignals.scaledShift(template, 0.3, -200));
    OptimumFilter of = filter(signal);
    FitResult first = of.amplitudeWithDelay(50, false, PulseDirection.ANY);
    assertEquals(10 / TestSignals.FS, first.getTime(), 1e-12);
    FitResult second = of.pileupGivenFirstPulse(first.getAmplitude(), first.getTime(), 50, true, PulseDirection.POSITIVE);
    assertEquals(-200 / TestSignals.FS, second.getTime(), 1e-12);
    assertEquals(0.3, second.getAmplitude(), 1e-2);
  }

  @Test
  @DisplayName("Pileup with a zero first pulse is the plain delay search")
  public void testPileupZeroFirstPulse() {
    double[] signal = TestSignals.add(TestSignals.scaledShift(template, 0.7, 33), TestSignals.gaussianNoise(NBINS, 0.01, 9));
    OptimumFilter of = filter(signal);
    FitResult single = of.amplitudeWithDelay();
    FitResult pileup = of.pileupGivenFirstPulse(0.0, 0.0);
    assertEquals(single.getAmplitude(), pileup.getAmplitude(), 1e-9);
    assertEquals(single.getTime(), pileup.getTime(), 0.0);
    assertEquals(single.getChi2(), pileup.getChi2(), 1e-9 * of.chi2NoPulse());
  }

  @Test
  @DisplayName("An empty constrained search returns the no-pulse fallback")
  public void testFallback() {
    OptimumFilter of = filter(template);
    FitResult r = of.amplitudeWithDelay(1, false, PulseDirection.NEGATIVE);
    assertEquals(0.0, r.getAmplitude());
    assertEquals(0.0, r.getTime());
    assertEquals(of.chi2NoPulse(), r.getChi2());
  }

  @Test
  @DisplayName("Floating baseline fit absorbs a DC offset")
  public void testBaseline() {
    double[] signal = TestSignals.add(TestSignals.scaledShift(template, 1.5, 20), TestSignals.constant(NBINS, 3.0));
    OptimumFilter of = filter(signal);
    FitResult r = of.baseline();
    assertEquals(1.5, r.getAmplitude(), 1e-6);
    assertEquals(20 / TestSignals.FS, r.getTime(), 1e-12);
    assertTrue(Math.abs(r.getChi2()) < 1e-6 * of.chi2NoPulse());
  }

  @Test
  @DisplayName("Full-band low-frequency chi2 equals the fit chi2")
  public void testChi2LowFrequency() {
    double[] signal = TestSignals.add(TestSignals.scaledShift(template, 0.9, -12), TestSignals.gaussianNoise(NBINS, 0.01, 5));
    OptimumFilter of = filter(signal);
    FitResult r = of.amplitudeWithDelay();
    assertEquals(r.getChi2(), of.chi2LowFrequency(r.getAmplitude(), r.getTime(), Double.MAX_VALUE), 1e-9 * r.getChi2());
    assertTrue(of.chi2LowFrequency(r.getAmplitude(), r.getTime()) <= r.getChi2());
  }

  @Test
  @DisplayName("Integral normalisation turns amplitudes into integrals")
  public void testIntegralNorm() {
    OptimumFilter of = new OptimumFilter(template, new NoiseModel(TestSignals.whitePsd(NBINS, PSD_LEVEL), Coupling.DC),
      TestSignals.FS, true).setSignal(template);
    double integral = 0;
    for (double v : template) {
      integral += v;
    }
    assertEquals(integral / TestSignals.FS, of.amplitudeNoDelay().getAmplitude(), 1e-9 * integral / TestSignals.FS);
  }

  @Test
  @DisplayName("Misuse is reported")
  public void testErrors() {
    assertThrows(IllegalArgumentException.class,
      () -> new OptimumFilter(new double[NBINS / 2], noise, TestSignals.FS));
    OptimumFilter of = new OptimumFilter(template, noise, TestSignals.FS);
    assertThrows(IllegalStateException.class, of::amplitudeNoDelay);
    assertThrows(IllegalArgumentException.class, () -> of.setSignal(new double[3]));
    double[] psd = TestSignals.whitePsd(NBINS, PSD_LEVEL);
    psd[0] = 0.0;
    OptimumFilter ac = new OptimumFilter(template, new NoiseModel(psd, Coupling.AC), TestSignals.FS).setSignal(template);
    assertThrows(IllegalStateException.class, ac::baseline);
  }
}
