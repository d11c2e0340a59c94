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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.github.dkaukov.optfilter.util.ComponentMask;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one {@link FilterBank#evaluate} call. Amplitude vectors are ordered
 * {@code [signals..., backgrounds...]}; background-only vectors hold backgrounds only.
 */
@Value
@Builder
@SuppressFBWarnings({"EI_EXPOSE_REP", "EI_EXPOSE_REP2"})
public class FilterBankResult {
  // sign-constrained joint fit
  double[] amplitudes;
  int delayBins;
  double delay;
  double chi2;
  double chi2LowFrequency;
  ComponentMask activeMask;
  /** Constrained chi2 per searched delay, in search order. */
  double[] chi2ByDelay;

  // unconstrained joint fit
  double[] unconstrainedAmplitudes;
  int unconstrainedDelayBins;
  double unconstrainedDelay;
  double unconstrainedChi2;

  // joint fit at zero delay, unconstrained
  double[] zeroDelayAmplitudes;
  double zeroDelayChi2;

  // backgrounds only
  double[] backgroundAmplitudes;
  double backgroundChi2;
  double backgroundChi2LowFrequency;
  double[] constrainedBackgroundAmplitudes;
  double constrainedBackgroundChi2;
  double constrainedBackgroundChi2LowFrequency;

  /** Trace minus the background part of the constrained joint fit. */
  double[] backgroundSubtracted;
  /** Trace minus the whole constrained joint model. */
  double[] residual;
}
