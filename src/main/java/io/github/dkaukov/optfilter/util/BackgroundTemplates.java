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
package io.github.dkaukov.optfilter.util;

/**
 * Background templates for the filter bank.
 */
public final class BackgroundTemplates {
  private BackgroundTemplates() {}

  /**
   * Slope and DC templates, in that order: {@code [i/nbins]} and {@code [1]}.
   * Useful to soak up baseline drifts such as muon tails. Place them after any other backgrounds:
   * {@link io.github.dkaukov.optfilter.atoms.FilterBank} exempts the last two from the sign rule.
   */
  public static double[][] slopeAndDc(int nbins) {
    if (nbins < 1) {
      throw new IllegalArgumentException("nbins must be >= 1");
    }
    double[][] t = new double[2][nbins];
    for (int i = 0; i < nbins; i++) {
      t[0][i] = (double) i / nbins;
      t[1][i] = 1.0;
    }
    return t;
  }

  /** Append {@code extra} templates after {@code first}. */
  public static double[][] concat(double[][] first, double[][] extra) {
    double[][] out = new double[first.length + extra.length][];
    System.arraycopy(first, 0, out, 0, first.length);
    System.arraycopy(extra, 0, out, first.length, extra.length);
    return out;
  }
}
