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

import lombok.Value;

/**
 * One optimum filter evaluation.
 */
@Value
public class FitResult {
  /** Fitted amplitude, in signal units (or integral units for integral-normalised templates). */
  double amplitude;
  /** Time offset in seconds; 0 is the unshifted template. */
  double time;
  double chi2;
}
