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

/** Noise coupling mode of a {@link NoiseModel}. */
public enum Coupling {
  /** Zero-frequency bin excluded: its PSD is treated as infinite. */
  AC,
  /** PSD used as given, DC bin included. */
  DC
}
