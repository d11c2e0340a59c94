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

import org.apache.commons.math3.complex.Complex;

import io.github.dkaukov.optfilter.atoms.DelaySearch;

/**
 * Closed-form pulse shapes for {@link NonlinearPulseFit}.
 *
 * <p>Parameter vectors end with the time offset {@code t0}. Frequency forms include the delay
 * phase {@code exp(-i w t0)} but not the {@code sqrt(df)} factor. Multi-pole amplitudes belong to
 * the fall times; the rise term carries minus their sum so the pulse starts at zero.</p>
 */
public enum PoleModel {
  /** {@code (A, tauFall, t0)}, two-pole shape with a fixed rise time. */
  ONE_POLE(1, 3, 1) {
    @Override
    Complex shape(double omega, double[] p, double tauRise) {
      return twoPole(omega, p[0], tauRise, p[1]);
    }

    @Override
    double shapeAt(double t, double[] p, double tauRise) {
      return twoPoleAt(t, p[0], tauRise, p[1]);
    }
  },
  /** {@code (A, tauRise, tauFall, t0)}, peak normalised to {@code A}. */
  TWO_POLE(2, 4, 1) {
    @Override
    Complex shape(double omega, double[] p, double tauRise) {
      return twoPole(omega, p[0], p[1], p[2]);
    }

    @Override
    double shapeAt(double t, double[] p, double tauRise) {
      return twoPoleAt(t, p[0], p[1], p[2]);
    }
  },
  /** {@code (A, B, tauRise, tauFall1, tauFall2, t0)}. */
  THREE_POLE(3, 6, 2) {
    @Override
    Complex shape(double omega, double[] p, double tauRise) {
      return pole(omega, p[0], p[3]).add(pole(omega, p[1], p[4])).subtract(pole(omega, p[0] + p[1], p[2]));
    }

    @Override
    double shapeAt(double t, double[] p, double tauRise) {
      return p[0] * Math.exp(-t / p[3]) + p[1] * Math.exp(-t / p[4]) - (p[0] + p[1]) * Math.exp(-t / p[2]);
    }
  },
  /** {@code (A, B, C, tauRise, tauFall1, tauFall2, tauFall3, t0)}. */
  FOUR_POLE(4, 8, 3) {
    @Override
    Complex shape(double omega, double[] p, double tauRise) {
      return pole(omega, p[0], p[4]).add(pole(omega, p[1], p[5])).add(pole(omega, p[2], p[6]))
        .subtract(pole(omega, p[0] + p[1] + p[2], p[3]));
    }

    @Override
    double shapeAt(double t, double[] p, double tauRise) {
      return p[0] * Math.exp(-t / p[4]) + p[1] * Math.exp(-t / p[5]) + p[2] * Math.exp(-t / p[6])
        - (p[0] + p[1] + p[2]) * Math.exp(-t / p[3]);
    }
  };

  private final int poles;
  private final int parameterCount;
  private final int amplitudeCount;

  PoleModel(int poles, int parameterCount, int amplitudeCount) {
    this.poles = poles;
    this.parameterCount = parameterCount;
    this.amplitudeCount = amplitudeCount;
  }

  public int poles() {
    return poles;
  }

  public int parameterCount() {
    return parameterCount;
  }

  /** Leading parameters that are amplitudes; the rest up to {@code t0} are time constants. */
  public int amplitudeCount() {
    return amplitudeCount;
  }

  public boolean needsFixedRiseTime() {
    return this == ONE_POLE;
  }

  abstract Complex shape(double omega, double[] p, double tauRise);

  abstract double shapeAt(double t, double[] p, double tauRise);

  /**
   * Frequency-domain model at angular frequency {@code omega}, delayed by {@code t0}.
   *
   * @param tauRise fixed rise time, only read by {@link #ONE_POLE}
   */
  public Complex evaluate(double omega, double[] params, double tauRise) {
    checkParams(params);
    double t0 = params[parameterCount - 1];
    return shape(omega, params, tauRise).multiply(new Complex(Math.cos(omega * t0), -Math.sin(omega * t0)));
  }

  /**
   * Time-domain model sampled at {@code i/fs} and rotated by {@code (int) (t0 fs)} bins.
   */
  public double[] timeDomain(double[] params, double tauRise, int nbins, double fs) {
    checkParams(params);
    double[] out = new double[nbins];
    for (int i = 0; i < nbins; i++) {
      out[i] = shapeAt(i / fs, params, tauRise);
    }
    return DelaySearch.roll(out, (int) (params[parameterCount - 1] * fs));
  }

  /** Model with {@code poles} poles, 1 to 4. */
  public static PoleModel ofPoles(int poles) {
    for (PoleModel m : values()) {
      if (m.poles == poles) {
        return m;
      }
    }
    throw new IllegalArgumentException("pole count must be 1, 2, 3 or 4, got " + poles);
  }

  private void checkParams(double[] params) {
    if (params.length != parameterCount) {
      throw new IllegalArgumentException(name() + " takes " + parameterCount + " parameters, got " + params.length);
    }
  }

  private static Complex pole(double omega, double amp, double tau) {
    return new Complex(amp * tau, 0).divide(new Complex(1, omega * tau));
  }

  private static double peakScale(double tauRise, double tauFall) {
    double delta = tauRise - tauFall;
    double rat = tauRise / tauFall;
    return 1.0 / (Math.pow(rat, -tauRise / delta) - Math.pow(rat, -tauFall / delta));
  }

  private static Complex twoPole(double omega, double amp, double tauRise, double tauFall) {
    double a = amp * peakScale(tauRise, tauFall) * Math.abs(tauRise - tauFall);
    return new Complex(a, 0).divide(new Complex(1, omega * tauFall).multiply(new Complex(1, omega * tauRise)));
  }

  private static double twoPoleAt(double t, double amp, double tauRise, double tauFall) {
    return amp * peakScale(tauRise, tauFall) * (Math.exp(-t / tauFall) - Math.exp(-t / tauRise));
  }
}
