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
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * SVD pseudo-inverse. A direct inverse shows enough jitter near degenerate weighting
 * matrices to drive chi2(t) negative at some delays; the pseudo-inverse does not.
 */
public final class PseudoInverseSolver implements LinearSolver {

  @Override
  public DecompositionSolver factor(RealMatrix matrix) {
    return new SingularValueDecomposition(matrix).getSolver();
  }
}
