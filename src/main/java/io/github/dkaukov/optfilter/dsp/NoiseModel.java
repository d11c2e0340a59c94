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
package io.github.dkaukov.optfilter.dsp;

import javax.annotation.Nonnull;

/**
 * Two-sided noise power spectral density (signal^2/Hz), one value per transform bin.
 *
 * <p>Under {@link Coupling#AC} a working copy has its zero-frequency bin set to
 * {@code +Infinity}, which gives that bin zero weight while keeping every array the same
 * size. The caller's DC value is still available through {@link #dcValue()}.</p>
 */
public final class NoiseModel {

  private final double[] psd;
  private final double[] weights;
  private final double dcValue;
  private final Coupling coupling;

  public NoiseModel(@Nonnull double[] psd, @Nonnull Coupling coupling) {
    if (psd == null || psd.length == 0) {
      throw new IllegalArgumentException("psd must be non-empty");
    }
    for (int k = 1; k < psd.length; k++) {
      if (!(psd[k] > 0)) {
        throw new IllegalArgumentException("psd[" + k + "] must be positive, got " + psd[k]);
      }
    }
    if (Double.isNaN(psd[0]) || psd[0] < 0) {
      throw new IllegalArgumentException("psd[0] must be non-negative, got " + psd[0]);
    }
    if (coupling == Coupling.DC && !(psd[0] > 0)) {
      throw new IllegalArgumentException("DC coupling needs a positive psd[0]");
    }
    this.coupling = coupling;
    this.dcValue = psd[0];
    this.psd = psd.clone();
    if (coupling == Coupling.AC) {
      this.psd[0] = Double.POSITIVE_INFINITY;
    }
    this.weights = new double[psd.length];
    for (int k = 0; k < psd.length; k++) {
      weights[k] = Double.isInfinite(this.psd[k]) ? 0.0 : 1.0 / this.psd[k];
    }
  }

  /** AC-coupled model, the usual choice for detector traces. */
  public NoiseModel(@Nonnull double[] psd) {
    this(psd, Coupling.AC);
  }

  /**
   * DC-coupled copy whose zero-frequency bin takes the value of bin 1. A single-bin model is
   * returned unchanged.
   */
  public NoiseModel withDcFromFirstBin() {
    if (psd.length < 2) {
      return this;
    }
    double[] copy = psd.clone();
    copy[0] = psd[1];
    return new NoiseModel(copy, Coupling.DC);
  }

  public int length() {
    return psd.length;
  }

  /** Working PSD value of bin {@code k} (infinite for the DC bin under AC coupling). */
  public double get(int k) {
    return psd[k];
  }

  /** Inverse-PSD weight of bin {@code k}; exactly zero for an infinite bin. */
  public double weight(int k) {
    return weights[k];
  }

  /** PSD value of the zero-frequency bin as supplied by the caller. */
  public double dcValue() {
    return dcValue;
  }

  public Coupling coupling() {
    return coupling;
  }

  public boolean isAcCoupled() {
    return coupling == Coupling.AC;
  }

  /** Copy of the working PSD. */
  public double[] toArray() {
    return psd.clone();
  }
}
