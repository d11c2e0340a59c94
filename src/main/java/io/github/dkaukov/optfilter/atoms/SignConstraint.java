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

import java.util.Set;

import javax.annotation.Nonnull;

import io.github.dkaukov.optfilter.util.ComponentMask;
import lombok.Getter;

/**
 * Polarity rule for the filter bank amplitude vector {@code [signals..., backgrounds...]}.
 *
 * <p>Signal amplitudes are never constrained. A background amplitude must satisfy
 * {@link PulseDirection#admits(double)} unless its index (counted from the first background)
 * is listed as free. Masks are derived on demand from the sign pattern of a solution.</p>
 */
public final class SignConstraint {

  @Getter private final int signals;
  @Getter private final int backgrounds;
  @Getter private final PulseDirection polarity;
  private final Set<Integer> free;

  public SignConstraint(int signals, int backgrounds, @Nonnull PulseDirection polarity, @Nonnull Set<Integer> free) {
    if (signals < 0 || backgrounds < 0) {
      throw new IllegalArgumentException("component counts must be >= 0");
    }
    for (Integer i : free) {
      if (i == null || i < 0 || i >= backgrounds) {
        throw new IllegalArgumentException("free background index " + i + " out of [0," + backgrounds + ")");
      }
    }
    this.signals = signals;
    this.backgrounds = backgrounds;
    this.polarity = polarity;
    this.free = Set.copyOf(free);
  }

  public int size() {
    return signals + backgrounds;
  }

  /** True if component {@code i} is subject to the polarity rule. */
  public boolean isConstrained(int i) {
    return polarity != PulseDirection.ANY && i >= signals && !free.contains(i - signals);
  }

  /**
   * Drop the active components whose amplitude violates the rule.
   *
   * @param amplitudes full-length amplitude vector
   * @param active     components currently in the fit
   * @return a new mask, equal to {@code active} when nothing violates
   */
  public ComponentMask refine(@Nonnull double[] amplitudes, @Nonnull ComponentMask active) {
    ComponentMask out = active.copy();
    for (int i : active.activeIndices()) {
      if (isConstrained(i) && !polarity.admits(amplitudes[i])) {
        out.set(i, false);
      }
    }
    return out;
  }

  /** Mask of the components {@code amplitudes} keeps, starting from all active. */
  public ComponentMask maskFor(@Nonnull double[] amplitudes) {
    return refine(amplitudes, ComponentMask.all(size()));
  }
}
