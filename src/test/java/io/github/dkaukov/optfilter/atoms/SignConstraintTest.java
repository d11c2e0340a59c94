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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.github.dkaukov.optfilter.util.ComponentMask;

public class SignConstraintTest {

  @Test
  @DisplayName("Signals are never constrained, free backgrounds neither")
  public void testConstrainedSlots() {
    SignConstraint c = new SignConstraint(2, 3, PulseDirection.POSITIVE, Set.of(1));
    assertFalse(c.isConstrained(0));
    assertFalse(c.isConstrained(1));
    assertTrue(c.isConstrained(2));
    assertFalse(c.isConstrained(3));
    assertTrue(c.isConstrained(4));
  }

  @Test
  @DisplayName("Wrong-sign backgrounds leave the mask")
  public void testRefine() {
    SignConstraint c = new SignConstraint(1, 3, PulseDirection.POSITIVE, Collections.emptySet());
    ComponentMask m = c.maskFor(new double[] {-5, 1, -1, 0});
    assertEquals("1100", m.toString());
    // inactive components are not looked at again
    ComponentMask again = c.refine(new double[] {-5, -1, 0, 0}, m);
    assertEquals("1000", again.toString());
    assertEquals("1100", m.toString());
  }

  @Test
  @DisplayName("Negative polarity and ANY")
  public void testPolarities() {
    double[] amps = {1, 2, -3};
    assertEquals("101", new SignConstraint(1, 2, PulseDirection.NEGATIVE, Collections.emptySet()).maskFor(amps).toString());
    assertEquals("111", new SignConstraint(1, 2, PulseDirection.ANY, Collections.emptySet()).maskFor(amps).toString());
  }

  @Test
  @DisplayName("Free indices must name a background")
  public void testInvalidFree() {
    assertThrows(IllegalArgumentException.class,
      () -> new SignConstraint(1, 2, PulseDirection.POSITIVE, Set.of(2)));
  }
}
