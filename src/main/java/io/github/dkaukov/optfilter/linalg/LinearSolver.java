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
package io.github.dkaukov.optfilter.linalg;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Strategy used by the filter bank for every weighting-matrix solve.
 * Implementations must never fail on singular input.
 */
public interface LinearSolver {

  /**
   * Factor a real symmetric matrix once. The returned solver is reused for every
   * right-hand side at the same delay.
   */
  DecompositionSolver factor(RealMatrix matrix);
}
