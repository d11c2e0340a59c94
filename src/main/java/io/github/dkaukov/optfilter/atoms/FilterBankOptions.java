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

import java.util.Collections;
import java.util.Set;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import io.github.dkaukov.optfilter.linalg.LinearSolver;
import io.github.dkaukov.optfilter.linalg.PseudoInverseSolver;
import lombok.Builder;
import lombok.Value;

/**
 * Tunables of {@link FilterBank}.
 */
@Value
@Builder(toBuilder = true)
public class FilterBankOptions {
  /** Required sign of constrained background amplitudes; {@link PulseDirection#ANY} disables the constraint. */
  @Builder.Default PulseDirection polarity = PulseDirection.POSITIVE;
  /**
   * Background indices (0 = first background) exempt from the sign rule. {@code null} exempts the
   * last two backgrounds, the slots of {@link io.github.dkaukov.optfilter.util.BackgroundTemplates#slopeAndDc}.
   */
  @Nullable Set<Integer> freeBackgrounds;
  /** Masked re-solves per delay before the current solution is accepted. */
  @Builder.Default int maxConstraintPasses = 2;
  @Builder.Default LinearSolver linearSolver = new PseudoInverseSolver();
  /** Bins with {@code min(k, nbins - k) < lowFrequencyBins} enter the low-frequency chi2. */
  @Builder.Default int lowFrequencyBins = 500;

  public static FilterBankOptions defaults() {
    return builder().build();
  }

  /** Exempt indices for a bank with {@code backgrounds} background templates. */
  @Nonnull
  public Set<Integer> freeBackgroundsFor(int backgrounds) {
    if (freeBackgrounds != null) {
      return freeBackgrounds;
    }
    return backgrounds >= 2 ? Set.of(backgrounds - 2, backgrounds - 1) : Collections.emptySet();
  }
}
