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
 * Two-pulse fit: a first pulse and a second, pileup pulse.
 */
@Value
public class PileupResult {
  double firstAmplitude;
  /** Time offset of the first pulse (s); 0 for the stationary fit. */
  double firstTime;
  double secondAmplitude;
  /** Time offset of the second pulse (s). */
  double secondTime;
  double chi2;
}
