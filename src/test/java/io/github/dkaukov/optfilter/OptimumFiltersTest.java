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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.logging.LogManager;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.bridge.SLF4JBridgeHandler;

import io.github.dkaukov.optfilter.atoms.FitResult;
import io.github.dkaukov.optfilter.atoms.OptimumFilter;
import io.github.dkaukov.optfilter.atoms.PileupResult;
import io.github.dkaukov.optfilter.dsp.Coupling;
import io.github.dkaukov.optfilter.dsp.NoiseModel;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class OptimumFiltersTest {

  private static final int NBINS = 800;
  private static final double[] TEMPLATE = TestSignals.centeredPulse(NBINS);
  private static final double[] PSD = TestSignals.whitePsd(NBINS, 1e-6);

  @BeforeAll
  static void redirectJulToStdout() {
    // Remove existing JUL handlers
    LogManager.getLogManager().reset();
    // Install bridge handler
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  private static double[] noisyPulse(double amp, int shift, long seed) {
    return TestSignals.add(TestSignals.scaledShift(TEMPLATE, amp, shift), TestSignals.gaussianNoise(NBINS, 0.005, seed));
  }

  @Test
  @DisplayName("ofAmp matches the filter object")
  void testOfAmp() {
    double[] signal = noisyPulse(1.3, -9, 1);
    OptimumFilter of = new OptimumFilter(TEMPLATE, new NoiseModel(PSD), TestSignals.FS).setSignal(signal);
    FitResult withDelay = OptimumFilters.ofAmp(signal, TEMPLATE, PSD, TestSignals.FS, true);
    assertEquals(of.amplitudeWithDelay(), withDelay);
    assertEquals(-9 / TestSignals.FS, withDelay.getTime(), 1e-12);
    assertEquals(of.amplitudeNoDelay(), OptimumFilters.ofAmp(signal, TEMPLATE, PSD, TestSignals.FS, false));
  }

  @Test
  @DisplayName("ofAmpWithResolution adds the energy resolution to the fit")
  void testOfAmpWithResolution() {
    double[] signal = noisyPulse(0.9, 4, 3);
    OptimumFilters.ResolvedFit r = OptimumFilters.ofAmpWithResolution(signal, TEMPLATE, PSD, TestSignals.FS, true);
    assertEquals(OptimumFilters.ofAmp(signal, TEMPLATE, PSD, TestSignals.FS, true), r.getFit());
    double sigma = new OptimumFilter(TEMPLATE, new NoiseModel(PSD), TestSignals.FS).energyResolution();
    assertEquals(sigma, r.getEnergyResolution(), 0.0);
    assertEquals(4 / TestSignals.FS, r.getFit().getTime(), 1e-12);
  }

  @Test
  @DisplayName("ofAmpPileup finds the first pulse on its own")
  void testOfAmpPileup() {
    double[] signal = TestSignals.add(TEMPLATE, TestSignals.scaledShift(TEMPLATE, 0.4, 180));
    PileupResult r = OptimumFilters.ofAmpPileup(signal, TEMPLATE, PSD, TestSignals.FS);
    log.info("pileup: {}", r);
    assertEquals(0.0, r.getFirstTime(), 0.0);
    assertEquals(1.0, r.getFirstAmplitude(), 0.05);
    assertEquals(180 / TestSignals.FS, r.getSecondTime(), 1e-12);
    assertEquals(0.4, r.getSecondAmplitude(), 0.02);

    PileupResult given = OptimumFilters.ofAmpPileup(signal, TEMPLATE, PSD, TestSignals.FS, r.getFirstAmplitude(),
      r.getFirstTime(), Coupling.AC, null, null, true);
    assertEquals(r, given);
  }

  @Test
  @DisplayName("Stationary pileup and chi2 helpers match the filter object")
  void testHelpers() {
    double[] signal = noisyPulse(0.6, 0, 2);
    OptimumFilter of = new OptimumFilter(TEMPLATE, new NoiseModel(PSD, Coupling.DC), TestSignals.FS).setSignal(signal);
    assertEquals(of.pileupStationary(40, true),
      OptimumFilters.ofAmpPileupStationary(signal, TEMPLATE, PSD, TestSignals.FS, Coupling.DC, 40, true));
    assertEquals(of.chi2NoPulse(), OptimumFilters.chi2NoPulse(signal, PSD, TestSignals.FS, Coupling.DC),
      1e-12 * of.chi2NoPulse());
    assertEquals(of.chi2LowFrequency(0.6, 0.0, 5e4),
      OptimumFilters.chi2LowFrequency(signal, TEMPLATE, 0.6, 0.0, PSD, TestSignals.FS, 5e4, Coupling.DC), 0.0);
  }
}
