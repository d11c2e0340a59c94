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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import io.github.dkaukov.optfilter.dsp.NoiseModel;
import io.github.dkaukov.optfilter.dsp.SpectralTransform;
import io.github.dkaukov.optfilter.linalg.LinearSolver;
import io.github.dkaukov.optfilter.util.ComponentMask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Joint fit of {@code n} time-shiftable signal templates and {@code m} fixed background
 * templates (nS+mB).
 *
 * <p>All signal templates share one delay. The weighting matrix {@code W(t)} depends on the
 * delay only through its signal-background block; it is built and inverted for every delay at
 * construction. {@link #evaluate} then solves the unconstrained system at every searched delay
 * and repeats the solve on reduced index sets while background amplitudes have the wrong sign
 * (see {@link SignConstraint}).</p>
 *
 * <p>Unless told otherwise the last two backgrounds are taken to be slope and DC and are never
 * sign-constrained. With backgrounds present, an AC-coupled noise model is replaced by a copy
 * whose DC bin takes the value of bin 1, so a constant background can still be fitted.</p>
 *
 * <p>Construction cost is {@code nbins} factorizations of an {@code (n+m)} square matrix.
 * Instances are immutable after construction and may be shared, but each call allocates its
 * own working arrays.</p>
 */
@Slf4j
public class FilterBank {

  @Getter private final int nbins;
  @Getter private final double sampleRate;
  @Getter private final int signals;
  @Getter private final int backgrounds;
  @Getter private final FilterBankOptions options;

  private final double df;
  private final SpectralTransform transform;
  private final NoiseModel noise;
  private final SignConstraint constraint;
  private final SignConstraint backgroundConstraint;
  private final LinearSolver solver;

  private final double[][] templates;
  private final Complex[][] spectra;
  private final Complex[][] phi;
  /** Delay invariant part, {@code df Re sum conj(S_i) S_j w}. */
  private final double[][] wsum;
  /** Signal-background cross weights per delay, {@code [signal][background][t]}. */
  private final double[][][] wt;
  private final RealMatrix[] wInverse;
  private final RealMatrix bbInverse;

  /**
   * @param signalTemplates     {@code n >= 1} signal templates
   * @param backgroundTemplates {@code m >= 0} background templates, may be empty
   * @param noise               noise model, same length as the templates
   * @param sampleRate          Hz
   * @param options             tunables
   */
  public FilterBank(@Nonnull double[][] signalTemplates, @Nonnull double[][] backgroundTemplates,
                    @Nonnull NoiseModel noise, double sampleRate, @Nonnull FilterBankOptions options) {
    if (signalTemplates.length < 1) {
      throw new IllegalArgumentException("at least one signal template is required");
    }
    if (options.getMaxConstraintPasses() < 0) {
      throw new IllegalArgumentException("maxConstraintPasses must be >= 0");
    }
    if (options.getLowFrequencyBins() < 0) {
      throw new IllegalArgumentException("lowFrequencyBins must be >= 0");
    }
    this.nbins = noise.length();
    this.signals = signalTemplates.length;
    this.backgrounds = backgroundTemplates.length;
    this.sampleRate = sampleRate;
    this.options = options;
    if (backgrounds > 0 && noise.isAcCoupled()) {
      // a constant background needs weight at DC
      this.noise = noise.withDcFromFirstBin();
      log.debug("AC-coupled noise model: DC bin set to psd[1]={} for the background fit", this.noise.get(0));
    } else {
      this.noise = noise;
    }
    this.solver = options.getLinearSolver();
    this.transform = new SpectralTransform(nbins, sampleRate);
    this.df = transform.getDf();
    Set<Integer> free = options.freeBackgroundsFor(backgrounds);
    this.constraint = new SignConstraint(signals, backgrounds, options.getPolarity(), free);
    this.backgroundConstraint = new SignConstraint(0, backgrounds, options.getPolarity(), free);

    int p = signals + backgrounds;
    this.templates = new double[p][];
    for (int i = 0; i < p; i++) {
      double[] t = i < signals ? signalTemplates[i] : backgroundTemplates[i - signals];
      if (t.length != nbins) {
        throw new IllegalArgumentException("template " + i + " has length " + t.length + ", expected " + nbins);
      }
      templates[i] = t.clone();
    }

    this.spectra = new Complex[p][];
    this.phi = new Complex[p][];
    for (int i = 0; i < p; i++) {
      spectra[i] = transform.forward(templates[i]);
      phi[i] = new Complex[nbins];
      for (int k = 0; k < nbins; k++) {
        phi[i][k] = spectra[i][k].conjugate().multiply(this.noise.weight(k));
      }
    }

    this.wsum = new double[p][p];
    for (int i = 0; i < p; i++) {
      for (int j = i; j < p; j++) {
        double acc = 0;
        for (int k = 0; k < nbins; k++) {
          acc += phi[i][k].multiply(spectra[j][k]).getReal();
        }
        wsum[i][j] = acc * df;
        wsum[j][i] = wsum[i][j];
      }
    }

    this.wt = new double[signals][backgrounds][];
    for (int i = 0; i < signals; i++) {
      for (int j = 0; j < backgrounds; j++) {
        Complex[] x = new Complex[nbins];
        for (int k = 0; k < nbins; k++) {
          x[k] = phi[i][k].multiply(spectra[signals + j][k]);
        }
        wt[i][j] = transform.inverseReal(x);
      }
    }

    this.wInverse = new RealMatrix[nbins];
    for (int t = 0; t < nbins; t++) {
      wInverse[t] = solver.factor(weightingMatrix(t)).getInverse();
    }
    if (backgrounds > 0) {
      RealMatrix bb = new Array2DRowRealMatrix(wsum, false).getSubMatrix(signals, p - 1, signals, p - 1);
      this.bbInverse = solver.factor(bb).getInverse();
    } else {
      this.bbInverse = null;
    }
    log.debug("FilterBank {}S+{}B, nbins={}, fs={}, polarity={}, free={}", signals, backgrounds, nbins,
      sampleRate, options.getPolarity(), free);
  }

  /** Filter bank with {@link FilterBankOptions#defaults()}. */
  public FilterBank(@Nonnull double[][] signalTemplates, @Nonnull double[][] backgroundTemplates,
                    @Nonnull NoiseModel noise, double sampleRate) {
    this(signalTemplates, backgroundTemplates, noise, sampleRate, FilterBankOptions.defaults());
  }

  /** Search every delay, from {@code -nbins/2} upwards. */
  public FilterBankResult evaluate(@Nonnull double[] trace) {
    return evaluate(trace, DelaySearch.centeredDelays(nbins, nbins));
  }

  /** Search a window of {@code window} bins centred on zero delay. */
  public FilterBankResult evaluate(@Nonnull double[] trace, int window) {
    return evaluate(trace, DelaySearch.centeredDelays(window, nbins));
  }

  /**
   * Fit one trace.
   *
   * @param trace       waveform, {@code nbins} samples
   * @param delayWindow signed delay bins to search; values are wrapped into {@code [0, nbins)}.
   *                    Ties go to the earliest entry.
   */
  public FilterBankResult evaluate(@Nonnull double[] trace, @Nonnull int[] delayWindow) {
    if (trace.length != nbins) {
      throw new IllegalArgumentException("trace length " + trace.length + " != " + nbins);
    }
    if (delayWindow.length == 0) {
      throw new IllegalArgumentException("delay window is empty");
    }
    int p = signals + backgrounds;
    Complex[] v = transform.forward(trace);
    double chi0 = 0;
    for (int k = 0; k < nbins; k++) {
      chi0 += sq(v[k]) * noise.weight(k);
    }
    chi0 *= df;

    // projections
    double[][] sigProj = new double[signals][];
    for (int i = 0; i < signals; i++) {
      Complex[] x = new Complex[nbins];
      for (int k = 0; k < nbins; k++) {
        x[k] = phi[i][k].multiply(v[k]);
      }
      sigProj[i] = transform.inverseReal(x);
    }
    double[] bgProj = new double[backgrounds];
    for (int j = 0; j < backgrounds; j++) {
      double acc = 0;
      for (int k = 0; k < nbins; k++) {
        acc += phi[signals + j][k].multiply(v[k]).getReal();
      }
      bgProj[j] = acc * df;
    }

    // backgrounds only
    double[] bgAmps = new double[backgrounds];
    double[] bgAmpsConstrained = new double[backgrounds];
    if (backgrounds > 0) {
      bgAmps = bbInverse.operate(bgProj);
      ComponentMask bgMask = backgroundConstraint.maskFor(bgAmps);
      if (bgMask.isFull()) {
        bgAmpsConstrained = bgAmps.clone();
      } else if (bgMask.cardinality() > 0) {
        int[] idx = bgMask.activeIndices();
        RealMatrix bb = new Array2DRowRealMatrix(wsum, false).getSubMatrix(signals, p - 1, signals, p - 1);
        double[] sub = solveActive(bb, bgProj, idx);
        for (int a = 0; a < idx.length; a++) {
          bgAmpsConstrained[idx[a]] = sub[a];
        }
      }
    }
    double[] zeros = new double[signals];
    Complex[] bgResidual = residualSpectrum(v, concat(zeros, bgAmps), 0);
    Complex[] bgResidualConstrained = residualSpectrum(v, concat(zeros, bgAmpsConstrained), 0);

    // joint fits per delay
    double[] chi2ByDelay = new double[delayWindow.length];
    int bestPos = -1;
    double[] bestAmps = null;
    ComponentMask bestMask = null;
    int bestUnconstrainedPos = -1;
    double bestUnconstrainedChi2 = Double.POSITIVE_INFINITY;
    double[] bestUnconstrainedAmps = null;
    int constrainedDelays = 0;

    for (int pos = 0; pos < delayWindow.length; pos++) {
      int t = Math.floorMod(delayWindow[pos], nbins);
      double[] proj = projection(sigProj, bgProj, t);
      double[] amps = wInverse[t].operate(proj);
      double chiU = chi0 - dot(amps, proj);
      if (bestUnconstrainedPos < 0 || chiU < bestUnconstrainedChi2) {
        bestUnconstrainedPos = pos;
        bestUnconstrainedChi2 = chiU;
        bestUnconstrainedAmps = amps;
      }

      ComponentMask mask = ComponentMask.all(p);
      RealMatrix base = null;
      for (int pass = 0; pass < options.getMaxConstraintPasses(); pass++) {
        ComponentMask next = constraint.refine(amps, mask);
        if (next.equals(mask)) {
          break;
        }
        mask = next;
        if (base == null) {
          base = weightingMatrix(t);
        }
        int[] idx = mask.activeIndices();
        double[] sub = solveActive(base, proj, idx);
        amps = new double[p];
        for (int a = 0; a < idx.length; a++) {
          amps[idx[a]] = sub[a];
        }
      }
      if (base != null) {
        constrainedDelays++;
        if (log.isTraceEnabled()) {
          log.trace("delay {}: active mask {}", t, mask);
        }
      }
      double chiC = mask.isFull() ? chiU : chi0 - dot(amps, proj);
      chi2ByDelay[pos] = chiC;
      if (bestPos < 0 || chiC < chi2ByDelay[bestPos]) {
        bestPos = pos;
        bestAmps = amps;
        bestMask = mask;
      }
    }
    log.debug("Searched {} delays, {} needed a sign-constrained solve", delayWindow.length, constrainedDelays);

    int bestT = Math.floorMod(delayWindow[bestPos], nbins);
    int bestShift = signedDelay(bestT);
    double[] proj0 = projection(sigProj, bgProj, 0);
    double[] amps0 = wInverse[0].operate(proj0);

    Complex[] jointResidual = residualSpectrum(v, bestAmps, bestShift);
    double[] bgSubtracted = trace.clone();
    for (int j = 0; j < backgrounds; j++) {
      double b = bestAmps[signals + j];
      for (int k = 0; k < nbins; k++) {
        bgSubtracted[k] -= b * templates[signals + j][k];
      }
    }
    double[] residual = bgSubtracted.clone();
    for (int i = 0; i < signals; i++) {
      double[] shifted = DelaySearch.roll(templates[i], bestShift);
      for (int k = 0; k < nbins; k++) {
        residual[k] -= bestAmps[i] * shifted[k];
      }
    }

    int bestUT = Math.floorMod(delayWindow[bestUnconstrainedPos], nbins);
    return FilterBankResult.builder()
      .amplitudes(bestAmps)
      .delayBins(bestShift)
      .delay(bestShift / sampleRate)
      .chi2(chi2ByDelay[bestPos])
      .chi2LowFrequency(lowFrequencyChi2(jointResidual))
      .activeMask(bestMask)
      .chi2ByDelay(chi2ByDelay)
      .unconstrainedAmplitudes(bestUnconstrainedAmps)
      .unconstrainedDelayBins(signedDelay(bestUT))
      .unconstrainedDelay(signedDelay(bestUT) / sampleRate)
      .unconstrainedChi2(bestUnconstrainedChi2)
      .zeroDelayAmplitudes(amps0)
      .zeroDelayChi2(chi0 - dot(amps0, proj0))
      .backgroundAmplitudes(bgAmps)
      .backgroundChi2(spectrumChi2(bgResidual, false))
      .backgroundChi2LowFrequency(lowFrequencyChi2(bgResidual))
      .constrainedBackgroundAmplitudes(bgAmpsConstrained)
      .constrainedBackgroundChi2(spectrumChi2(bgResidualConstrained, false))
      .constrainedBackgroundChi2LowFrequency(lowFrequencyChi2(bgResidualConstrained))
      .backgroundSubtracted(bgSubtracted)
      .residual(residual)
      .build();
  }

  /** Delay bin {@code t} in {@code [0, nbins)} as a signed shift, matching {@link OptimumFilter}. */
  int signedDelay(int t) {
    return t < nbins - nbins / 2 ? t : t - nbins;
  }

  /** {@code W(t)}, components ordered {@code [signals..., backgrounds...]}. */
  RealMatrix weightingMatrix(int t) {
    int p = signals + backgrounds;
    double[][] w = new double[p][p];
    for (int i = 0; i < p; i++) {
      System.arraycopy(wsum[i], 0, w[i], 0, p);
    }
    for (int i = 0; i < signals; i++) {
      for (int j = 0; j < backgrounds; j++) {
        w[i][signals + j] = wt[i][j][t];
        w[signals + j][i] = wt[i][j][t];
      }
    }
    return new Array2DRowRealMatrix(w, false);
  }

  private double[] projection(double[][] sigProj, double[] bgProj, int t) {
    double[] proj = new double[signals + backgrounds];
    for (int i = 0; i < signals; i++) {
      proj[i] = sigProj[i][t];
    }
    System.arraycopy(bgProj, 0, proj, signals, backgrounds);
    return proj;
  }

  private double[] solveActive(RealMatrix base, double[] proj, int[] idx) {
    RealMatrix sub = base.getSubMatrix(idx, idx);
    RealVector rhs = new ArrayRealVector(idx.length);
    for (int a = 0; a < idx.length; a++) {
      rhs.setEntry(a, proj[idx[a]]);
    }
    return solver.factor(sub).solve(rhs).toArray();
  }

  /** {@code V - sum a_i S_i exp(-i w shift/fs)}; backgrounds are never shifted. */
  private Complex[] residualSpectrum(Complex[] v, double[] amps, int shift) {
    Complex[] r = v.clone();
    double[] freqs = transform.frequencies();
    for (int c = 0; c < amps.length; c++) {
      if (amps[c] == 0) {
        continue;
      }
      boolean shifted = c < signals && shift != 0;
      for (int k = 0; k < nbins; k++) {
        Complex s = spectra[c][k].multiply(amps[c]);
        if (shifted) {
          double ang = -2 * Math.PI * freqs[k] * shift / sampleRate;
          s = s.multiply(new Complex(Math.cos(ang), Math.sin(ang)));
        }
        r[k] = r[k].subtract(s);
      }
    }
    return r;
  }

  private double lowFrequencyChi2(Complex[] residual) {
    return spectrumChi2(residual, true);
  }

  private double spectrumChi2(Complex[] residual, boolean lowOnly) {
    double acc = 0;
    for (int k = 0; k < nbins; k++) {
      if (lowOnly && Math.min(k, nbins - k) >= options.getLowFrequencyBins()) {
        continue;
      }
      acc += sq(residual[k]) * noise.weight(k);
    }
    return acc * df;
  }

  private static double[] concat(double[] a, double[] b) {
    double[] out = new double[a.length + b.length];
    System.arraycopy(a, 0, out, 0, a.length);
    System.arraycopy(b, 0, out, a.length, b.length);
    return out;
  }

  private static double dot(double[] a, double[] b) {
    double acc = 0;
    for (int i = 0; i < a.length; i++) {
      acc += a[i] * b[i];
    }
    return acc;
  }

  private static double sq(Complex c) {
    return c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
  }
}
