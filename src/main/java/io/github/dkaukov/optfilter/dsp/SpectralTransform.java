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
package io.github.dkaukov.optfilter.dsp;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import lombok.Getter;

/**
 * Discrete Fourier transform with the continuous-noise-power normalization used by the
 * optimum filters.
 *
 * <pre>
 * forward(x)[k] = DFT(x)[k] / (nbins * df)
 * inverse(X)[n] = df * sum_k X[k] exp(+2 pi i k n / nbins)
 * </pre>
 *
 * With this convention {@code df * sum |forward(x)|^2 / psd} is the noise-weighted sum of
 * squares for a two-sided PSD in signal^2/Hz.
 *
 * <p>Power-of-two lengths use the radix-2 transformer directly; any other length goes through
 * Bluestein's chirp-z algorithm on a padded power-of-two grid. Not thread-safe.</p>
 */
public final class SpectralTransform {

  private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

  @Getter private final int nbins;
  @Getter private final double sampleRate;
  @Getter private final double df;

  // Bluestein state, null for power-of-two lengths
  private final Complex[] chirp;
  private final Complex[] chirpSpectrum;
  private final int paddedLength;

  public SpectralTransform(int nbins, double sampleRate) {
    if (nbins < 1) {
      throw new IllegalArgumentException("nbins must be >= 1");
    }
    if (!(sampleRate > 0) || Double.isInfinite(sampleRate)) {
      throw new IllegalArgumentException("sample rate must be positive and finite");
    }
    this.nbins = nbins;
    this.sampleRate = sampleRate;
    this.df = sampleRate / nbins;
    if (ArithmeticUtils.isPowerOfTwo(nbins)) {
      chirp = null;
      chirpSpectrum = null;
      paddedLength = nbins;
    } else {
      int m = 1;
      while (m < 2 * nbins - 1) {
        m <<= 1;
      }
      paddedLength = m;
      chirp = new Complex[nbins];
      long twoN = 2L * nbins;
      for (int n = 0; n < nbins; n++) {
        // n^2 mod 2N keeps the phase argument small for long traces
        long sq = ((long) n * n) % twoN;
        double angle = -Math.PI * sq / nbins;
        chirp[n] = new Complex(Math.cos(angle), Math.sin(angle));
      }
      Complex[] b = new Complex[m];
      for (int i = 0; i < m; i++) {
        b[i] = Complex.ZERO;
      }
      b[0] = chirp[0].conjugate();
      for (int n = 1; n < nbins; n++) {
        b[n] = chirp[n].conjugate();
        b[m - n] = chirp[n].conjugate();
      }
      chirpSpectrum = FFT.transform(b, TransformType.FORWARD);
    }
  }

  /** Forward transform scaled by {@code 1/(nbins*df)}. */
  public Complex[] forward(double[] x) {
    checkLength(x.length);
    Complex[] out = dft(x);
    double scale = 1.0 / (nbins * df);
    for (int k = 0; k < nbins; k++) {
      out[k] = out[k].multiply(scale);
    }
    return out;
  }

  /** Inverse transform, {@code df * sum_k X[k] exp(+i 2 pi k n / nbins)}. */
  public Complex[] inverse(Complex[] spectrum) {
    checkLength(spectrum.length);
    Complex[] out = unnormalizedInverse(spectrum);
    for (int n = 0; n < nbins; n++) {
      out[n] = out[n].multiply(df);
    }
    return out;
  }

  /** Real part of {@link #inverse(Complex[])}. */
  public double[] inverseReal(Complex[] spectrum) {
    checkLength(spectrum.length);
    Complex[] c = unnormalizedInverse(spectrum);
    double[] out = new double[nbins];
    for (int n = 0; n < nbins; n++) {
      out[n] = c[n].getReal() * df;
    }
    return out;
  }

  /** Plain unnormalized DFT, {@code sum_n x[n] exp(-i 2 pi k n / nbins)}. */
  public Complex[] dft(double[] x) {
    checkLength(x.length);
    Complex[] c = new Complex[nbins];
    for (int n = 0; n < nbins; n++) {
      c[n] = new Complex(x[n], 0.0);
    }
    return forwardKernel(c);
  }

  /** Plain inverse DFT including the {@code 1/nbins} factor. */
  public Complex[] idft(Complex[] spectrum) {
    checkLength(spectrum.length);
    Complex[] out = unnormalizedInverse(spectrum);
    double scale = 1.0 / nbins;
    for (int n = 0; n < nbins; n++) {
      out[n] = out[n].multiply(scale);
    }
    return out;
  }

  /** Frequencies of each bin in {@code fftfreq} order (Hz). */
  public double[] frequencies() {
    double[] f = new double[nbins];
    int half = (nbins - 1) / 2;
    for (int k = 0; k < nbins; k++) {
      f[k] = (k <= half ? k : k - nbins) * df;
    }
    return f;
  }

  // ---------- kernels ----------

  private Complex[] unnormalizedInverse(Complex[] spectrum) {
    // ifft(X) * N == conj(fft(conj(X)))
    Complex[] c = new Complex[nbins];
    for (int k = 0; k < nbins; k++) {
      c[k] = spectrum[k].conjugate();
    }
    Complex[] out = forwardKernel(c);
    for (int n = 0; n < nbins; n++) {
      out[n] = out[n].conjugate();
    }
    return out;
  }

  private Complex[] forwardKernel(Complex[] x) {
    if (chirp == null) {
      return FFT.transform(x, TransformType.FORWARD);
    }
    Complex[] a = new Complex[paddedLength];
    for (int n = 0; n < nbins; n++) {
      a[n] = x[n].multiply(chirp[n]);
    }
    for (int n = nbins; n < paddedLength; n++) {
      a[n] = Complex.ZERO;
    }
    Complex[] fa = FFT.transform(a, TransformType.FORWARD);
    for (int i = 0; i < paddedLength; i++) {
      fa[i] = fa[i].multiply(chirpSpectrum[i]);
    }
    Complex[] conv = FFT.transform(fa, TransformType.INVERSE);
    Complex[] out = new Complex[nbins];
    for (int k = 0; k < nbins; k++) {
      out[k] = conv[k].multiply(chirp[k]);
    }
    return out;
  }

  private void checkLength(int length) {
    if (length != nbins) {
      throw new IllegalArgumentException("Expected " + nbins + " bins, got " + length);
    }
  }
}
