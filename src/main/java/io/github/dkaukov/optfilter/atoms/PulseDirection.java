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

import lombok.Getter;

/**
 * Sign a fitted amplitude is required to have.
 */
public enum PulseDirection {
  ANY(0),
  POSITIVE(1),
  NEGATIVE(-1);

  @Getter private final int code;

  PulseDirection(int code) {
    this.code = code;
  }

  /** True if {@code amplitude} is allowed. Zero only passes {@link #ANY}. */
  public boolean admits(double amplitude) {
    switch (this) {
      case POSITIVE:
        return amplitude > 0;
      case NEGATIVE:
        return amplitude < 0;
      default:
        return true;
    }
  }

  /** Mask of admitted entries, or {@code null} when unconstrained. */
  public boolean[] mask(double[] amplitudes) {
    if (this == ANY) {
      return null;
    }
    boolean[] m = new boolean[amplitudes.length];
    for (int i = 0; i < amplitudes.length; i++) {
      m[i] = admits(amplitudes[i]);
    }
    return m;
  }

  /** Map the numeric code 0, 1, -1. */
  public static PulseDirection fromCode(int code) {
    for (PulseDirection d : values()) {
      if (d.code == code) {
        return d;
      }
    }
    throw new IllegalArgumentException("pulse direction code should be 0, 1, or -1, got " + code);
  }
}
