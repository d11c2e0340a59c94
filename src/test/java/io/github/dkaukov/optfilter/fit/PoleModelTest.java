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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.github.dkaukov.optfilter.TestSignals;

public class PoleModelTest {

  @Test
  @DisplayName("Pole counts map to models")
  public void testOfPoles() {
    assertEquals(PoleModel.ONE_POLE, PoleModel.ofPoles(1));
    assertEquals(PoleModel.FOUR_POLE, PoleModel.ofPoles(4));
    assertEquals(8, PoleModel.FOUR_POLE.parameterCount());
    assertThrows(IllegalArgumentException.class, () -> PoleModel.ofPoles(5));
  }

  @Test
  @DisplayName("Two-pole time form peaks at the amplitude")
  public void testTwoPolePeak() {
    double[] p = {3.0, 20e-6, 100e-6, 0.0};
    double[] x = PoleModel.TWO_POLE.timeDomain(p, 0, 4096, 10e6);
    double max = Double.NEGATIVE_INFINITY;
    for (double v : x) {
      max = Math.max(max, v);
    }
    assertEquals(3.0, max, 1e-4);
  }

  @Test
  @DisplayName("Multi-pole shapes start at zero and one-pole uses the fixed rise time")
  public void testShapes() {
    double[] three = {1.0, 0.5, 20e-6, 100e-6, 300e-6, 0.0};
    assertEquals(0.0, PoleModel.THREE_POLE.timeDomain(three, 0, 8, TestSignals.FS)[0], 1e-15);
    double[] four = {1.0, 0.3, 0.2, 20e-6, 100e-6, 300e-6, 500e-6, 0.0};
    assertEquals(0.0, PoleModel.FOUR_POLE.timeDomain(four, 0, 8, TestSignals.FS)[0], 1e-15);

    Complex one = PoleModel.ONE_POLE.evaluate(1234.0, new double[] {2.0, 100e-6, 1e-5}, 20e-6);
    Complex two = PoleModel.TWO_POLE.evaluate(1234.0, new double[] {2.0, 20e-6, 100e-6, 1e-5}, 0);
    assertEquals(two.getReal(), one.getReal(), 1e-18);
    assertEquals(two.getImaginary(), one.getImaginary(), 1e-18);
  }

  @Test
  @DisplayName("Time offset rotates the time form")
  public void testShift() {
    double fs = 1024.0;
    double[] p0 = {1.0, 2 / fs, 10 / fs, 0.0};
    double[] p5 = {1.0, 2 / fs, 10 / fs, 5 / fs};
    double[] a = PoleModel.TWO_POLE.timeDomain(p0, 0, 64, fs);
    double[] b = PoleModel.TWO_POLE.timeDomain(p5, 0, 64, fs);
    assertEquals(a[10], b[15], 0.0);
    assertThrows(IllegalArgumentException.class, () -> PoleModel.TWO_POLE.timeDomain(new double[3], 0, 64, 1.0));
  }
}
