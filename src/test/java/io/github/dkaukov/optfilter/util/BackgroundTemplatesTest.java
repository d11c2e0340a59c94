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
package io.github.dkaukov.optfilter.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class BackgroundTemplatesTest {

  @Test
  @DisplayName("Slope then DC")
  public void testSlopeAndDc() {
    double[][] t = BackgroundTemplates.slopeAndDc(4);
    assertArrayEquals(new double[] {0, 0.25, 0.5, 0.75}, t[0], 1e-15);
    assertArrayEquals(new double[] {1, 1, 1, 1}, t[1], 0.0);
    assertThrows(IllegalArgumentException.class, () -> BackgroundTemplates.slopeAndDc(0));
  }

  @Test
  @DisplayName("Concatenation keeps order")
  public void testConcat() {
    double[] a = {1};
    double[] b = {2};
    double[][] out = BackgroundTemplates.concat(new double[][] {a}, new double[][] {b});
    assertEquals(2, out.length);
    assertSame(a, out[0]);
    assertSame(b, out[1]);
  }
}
