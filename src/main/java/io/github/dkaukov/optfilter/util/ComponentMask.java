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

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Fixed-size packed bit set over the components of a joint fit, backed by {@code long[]} words.
 *
 * <p>A set bit means the component is active (free to take a non-zero amplitude); a clear bit
 * means the component is forced to zero.</p>
 * <ul>
 *   <li>LSB-first bit ordering (component 0 is the least significant bit of the first word).</li>
 *   <li>No boxing when listing the active components.</li>
 * </ul>
 *
 * <p>Not thread-safe.</p>
 */
public final class ComponentMask {

  private final long[] words;
  private final int size;

  /**
   * @param size number of components; all start inactive
   */
  public ComponentMask(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0");
    }
    this.size = size;
    this.words = new long[Math.max(1, (size + 63) >>> 6)];
  }

  /** Mask with every component active. */
  public static ComponentMask all(int size) {
    ComponentMask m = new ComponentMask(size);
    for (int i = 0; i < size; i++) {
      m.set(i, true);
    }
    return m;
  }

  /** Number of components covered. */
  public int size() { return size; }

  /** Read one component flag. */
  public boolean get(int i) {
    checkIndex(i);
    return ((words[i >>> 6] >>> (i & 63)) & 1L) != 0;
  }

  /** Overwrite one component flag. */
  public void set(int i, boolean active) {
    checkIndex(i);
    long mask = 1L << (i & 63);
    if (active) {
      words[i >>> 6] |= mask;
    } else {
      words[i >>> 6] &= ~mask;
    }
  }

  /** Number of active components. */
  public int cardinality() {
    int c = 0;
    for (long w : words) {
      c += Long.bitCount(w);
    }
    return c;
  }

  public boolean isFull() {
    return cardinality() == size;
  }

  /** Indices of the active components, ascending. */
  public int[] activeIndices() {
    int[] out = new int[cardinality()];
    int j = 0;
    for (int wi = 0; wi < words.length; wi++) {
      long w = words[wi];
      while (w != 0) {
        int bit = Long.numberOfTrailingZeros(w);
        out[j++] = (wi << 6) + bit;
        w &= w - 1;
      }
    }
    return out;
  }

  /** Stream of active indices. */
  public IntStream stream() {
    return IntStream.of(activeIndices());
  }

  public ComponentMask copy() {
    ComponentMask m = new ComponentMask(size);
    System.arraycopy(words, 0, m.words, 0, words.length);
    return m;
  }

  private void checkIndex(int i) {
    if (i < 0 || i >= size) {
      throw new IndexOutOfBoundsException("component " + i + " out of [0," + size + ")");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ComponentMask)) {
      return false;
    }
    ComponentMask other = (ComponentMask) o;
    return size == other.size && Arrays.equals(words, other.words);
  }

  @Override
  public int hashCode() {
    return 31 * size + Arrays.hashCode(words);
  }

  /** Component 0 first, e.g. {@code 1101}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(size);
    for (int i = 0; i < size; i++) {
      sb.append(get(i) ? '1' : '0');
    }
    return sb.toString();
  }
}
