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

/**
 * Arg-min over chi2 curves with a centred window and an optional sign mask.
 *
 * <p>Curves are in "rolled" order: index {@code nbins/2} is zero delay. A window of width
 * {@code w} covers {@code [nbins/2 - w/2, nbins/2 + w/2 + w%2)}; the outside window is the
 * complement. Ties go to the lowest index.</p>
 */
public final class DelaySearch {
  /** Returned when no candidate survives the constraints. */
  public static final int NONE = -1;

  private DelaySearch() {}

  /**
   * @param chi2    curve to minimize
   * @param window  width in bins, {@code null} for unconstrained; clamped to the curve length
   * @param outside search outside the window instead of inside
   * @param mask    extra candidate filter, {@code null} for none
   * @return best index or {@link #NONE}
   */
  public static int argmin(double[] chi2, Integer window, boolean outside, boolean[] mask) {
    int nbins = chi2.length;
    int lo = 0;
    int hi = nbins;
    if (window != null) {
      int w = clamp(window, nbins);
      lo = nbins / 2 - w / 2;
      hi = nbins / 2 + w / 2 + w % 2;
    } else {
      outside = false;
    }
    int best = NONE;
    double bestValue = Double.POSITIVE_INFINITY;
    for (int i = 0; i < nbins; i++) {
      boolean inWindow = i >= lo && i < hi;
      if (inWindow == outside) {
        continue;
      }
      if (mask != null && !mask[i]) {
        continue;
      }
      if (best == NONE || chi2[i] < bestValue) {
        best = i;
        bestValue = chi2[i];
      }
    }
    return best;
  }

  /**
   * Signed delay bins of a window of width {@code w} centred on zero delay, ascending.
   * Matches the inside window of {@link #argmin} once shifted by {@code nbins/2}.
   */
  public static int[] centeredDelays(int window, int nbins) {
    int w = clamp(window, nbins);
    int first = -(w / 2);
    int[] out = new int[w];
    for (int i = 0; i < w; i++) {
      out[i] = first + i;
    }
    return out;
  }

  /** Every delay bin, {@code 0..nbins-1}. */
  public static int[] allDelays(int nbins) {
    int[] out = new int[nbins];
    for (int i = 0; i < nbins; i++) {
      out[i] = i;
    }
    return out;
  }

  /** Circular shift by {@code shift} bins: {@code out[i] = x[(i - shift) mod n]}. */
  public static double[] roll(double[] x, int shift) {
    int n = x.length;
    double[] out = new double[n];
    int s = Math.floorMod(shift, n);
    for (int i = 0; i < n; i++) {
      out[(i + s) % n] = x[i];
    }
    return out;
  }

  private static int clamp(int window, int nbins) {
    if (window <= 0) {
      throw new IllegalArgumentException("window must be a positive number of bins, got " + window);
    }
    return Math.min(window, nbins);
  }
}
