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

import java.util.Arrays;
import java.util.Random;

import io.github.dkaukov.optfilter.atoms.DelaySearch;

/**
 * Synthetic pulses and noise for the tests.
 */
public final class TestSignals {
  public static final double FS = 625e3;

  private TestSignals() {}

  /**
   * Peak-normalised two-pole pulse starting at {@code start}.
   */
  public static double[] pulse(int nbins, int start, double tauRise, double tauFall) {
    double[] x = new double[nbins];
    double max = 0;
    for (int i = start; i < nbins; i++) {
      double t = (i - start) / FS;
      x[i] = Math.exp(-t / tauFall) - Math.exp(-t / tauRise);
      max = Math.max(max, x[i]);
    }
    for (int i = 0; i < nbins; i++) {
      x[i] /= max;
    }
    return x;
  }

  /** Pulse starting at the trace midpoint, 20 us rise, 100 us fall. */
  public static double[] centeredPulse(int nbins) {
    return pulse(nbins, nbins / 2, 20e-6, 100e-6);
  }

  public static double[] whitePsd(int nbins, double level) {
    return constant(nbins, level);
  }

  public static double[] constant(int nbins, double value) {
    double[] x = new double[nbins];
    Arrays.fill(x, value);
    return x;
  }

  public static double[] gaussianNoise(int nbins, double sigma, long seed) {
    Random rnd = new Random(seed);
    double[] x = new double[nbins];
    for (int i = 0; i < nbins; i++) {
      x[i] = sigma * rnd.nextGaussian();
    }
    return x;
  }

  /** {@code a * x}, rotated by {@code shift} bins. */
  public static double[] scaledShift(double[] x, double a, int shift) {
    double[] r = DelaySearch.roll(x, shift);
    for (int i = 0; i < r.length; i++) {
      r[i] *= a;
    }
    return r;
  }

  public static double[] add(double[]... xs) {
    double[] out = new double[xs[0].length];
    for (double[] x : xs) {
      for (int i = 0; i < out.length; i++) {
        out[i] += x[i];
      }
    }
    return out;
  }
}
