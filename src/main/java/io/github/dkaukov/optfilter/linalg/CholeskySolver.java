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

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Direct Cholesky solve with pseudo-inverse fallback.
 *
 * <p>Falls back when the matrix is not symmetric positive definite, or when the squared ratio
 * of the smallest to largest Cholesky pivot drops below {@code minReciprocalCondition}.</p>
 */
@Slf4j
public final class CholeskySolver implements LinearSolver {

  @Getter private final double minReciprocalCondition;
  private final LinearSolver fallback = new PseudoInverseSolver();

  /**
   * @param minReciprocalCondition estimated 1/cond below which the SVD path is used (e.g. 1e-12)
   */
  public CholeskySolver(double minReciprocalCondition) {
    if (!(minReciprocalCondition >= 0) || minReciprocalCondition >= 1) {
      throw new IllegalArgumentException("minReciprocalCondition must be in [0, 1)");
    }
    this.minReciprocalCondition = minReciprocalCondition;
  }

  public CholeskySolver() {
    this(1e-12);
  }

  @Override
  public DecompositionSolver factor(RealMatrix matrix) {
    CholeskyDecomposition chol;
    try {
      chol = new CholeskyDecomposition(matrix,
        CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD,
        CholeskyDecomposition.DEFAULT_ABSOLUTE_POSITIVITY_THRESHOLD);
    } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException | NonSquareMatrixException e) {
      if (log.isTraceEnabled()) {
        log.trace("Cholesky rejected {}x{} matrix ({}), using pseudo-inverse",
          matrix.getRowDimension(), matrix.getColumnDimension(), e.getMessage());
      }
      return fallback.factor(matrix);
    }
    RealMatrix l = chol.getL();
    double min = Double.POSITIVE_INFINITY;
    double max = 0;
    for (int i = 0; i < l.getRowDimension(); i++) {
      double d = Math.abs(l.getEntry(i, i));
      min = Math.min(min, d);
      max = Math.max(max, d);
    }
    double rcond = max == 0 ? 0 : (min / max) * (min / max);
    if (rcond < minReciprocalCondition) {
      if (log.isTraceEnabled()) {
        log.trace("Cholesky rcond~{} below {}, using pseudo-inverse", rcond, minReciprocalCondition);
      }
      return fallback.factor(matrix);
    }
    return chol.getSolver();
  }
}
