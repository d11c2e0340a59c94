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
package io.github.dkaukov.optfilter.fit;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;

/**
 * Best-fit parameters of a nonlinear fit with their uncertainties.
 */
@Value
@SuppressFBWarnings({"EI_EXPOSE_REP", "EI_EXPOSE_REP2"})
public class PulseFitResult {
  double[] parameters;
  /** {@code sqrt(diag(covariance))}. */
  double[] errors;
  /** {@code pinv(J^T J)} at the solution. */
  double[][] covariance;
  /** Reduced for {@link NonlinearPulseFit}, plain for {@link MuonTailFit}. */
  double chi2;
  /** Model evaluations spent by the optimizer. */
  int evaluations;
  /** False when the evaluation budget ran out and the best point seen was kept. */
  boolean converged;
}
