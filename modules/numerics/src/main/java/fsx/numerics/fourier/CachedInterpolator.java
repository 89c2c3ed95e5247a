// ******************************************************************************
//
// Title:       FSX.
// Description: FSX - Fourier Series Interpolation of Bandlimited Functions.
// Copyright:   Copyright (c) FSX developers 2024.
//
// This file is part of FSX.
//
// FSX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// FSX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// FSX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package fsx.numerics.fourier;

import static java.lang.String.format;

import fsx.numerics.fft.ChirpKernel;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Repeated evaluation of bandlimited periodic functions that share a period, a bandwidth and a
 * sampling grid. The {@link ChirpKernel} for the configuration is built once and reused, so each
 * call to {@link #evaluate(double[])} only repeats the forward and inverse FFT of the new
 * coefficients.
 *
 * <p>Results are identical, bit for bit, to those of a new {@link ComplexInterpolator} or {@link
 * RealInterpolator} with the same parameters.
 *
 * <p>The configuration only changes through {@link #reconfigure(double, int, SamplingGrid)}. A
 * spectrum whose length disagrees with the configured bandwidth is rejected rather than triggering
 * a rebuild. The interpolator and its kernel are published together through one volatile
 * reference: concurrent evaluations see either the old or the new configuration, never a mix.
 *
 * @author FSX developers
 * @since 1.0
 */
public class CachedInterpolator {

  private static final Logger logger = Logger.getLogger(CachedInterpolator.class.getName());

  /**
   * An interpolator and the kernel that belongs to it.
   */
  private static final class Configuration {

    private final FourierInterpolator interpolator;
    @Nullable
    private final ChirpKernel kernel;

    private Configuration(FourierInterpolator interpolator, @Nullable ChirpKernel kernel) {
      this.interpolator = interpolator;
      this.kernel = kernel;
    }
  }

  /** True to evaluate real-valued functions. */
  private final boolean real;
  /** The current configuration. */
  private volatile Configuration configuration;

  /**
   * Private constructor; use {@link #complex} or {@link #real}.
   *
   * @param interpolator the uncached interpolator for the initial configuration.
   */
  private CachedInterpolator(FourierInterpolator interpolator) {
    this.real = interpolator instanceof RealInterpolator;
    this.configuration = new Configuration(interpolator, interpolator.createKernel());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Cached%s", interpolator));
    }
  }

  /**
   * Create a CachedInterpolator for complex-valued functions.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   * @return a CachedInterpolator that wraps a {@link ComplexInterpolator}.
   */
  public static CachedInterpolator complex(double period, int bandwidth, SamplingGrid grid) {
    return new CachedInterpolator(new ComplexInterpolator(period, bandwidth, grid));
  }

  /**
   * Create a CachedInterpolator for real-valued functions.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   * @return a CachedInterpolator that wraps a {@link RealInterpolator}.
   */
  public static CachedInterpolator real(double period, int bandwidth, SamplingGrid grid) {
    return new CachedInterpolator(new RealInterpolator(period, bandwidth, grid));
  }

  /**
   * Check whether this interpolator evaluates real-valued functions.
   *
   * @return true for the real-valued variant.
   */
  public boolean isReal() {
    return real;
  }

  /**
   * Evaluate a function on the grid with the cached kernel.
   *
   * @param spectrum interleaved coefficients [x_{-N}, ..., x_N].
   * @return 2M interleaved complex samples, or M real samples for the real-valued variant.
   */
  public double[] evaluate(double[] spectrum) {
    Configuration c = configuration;
    return c.interpolator.interpolate(spectrum, c.kernel);
  }

  /**
   * Evaluate a real-valued function on the grid with the cached kernel.
   *
   * @param dc the real coefficient x_0.
   * @param positive interleaved coefficients [x_1, ..., x_N].
   * @return M real samples.
   * @throws IllegalStateException if this is the complex-valued variant.
   */
  public double[] evaluate(double dc, double[] positive) {
    if (!real) {
      throw new IllegalStateException(" Positive frequency coefficients require a real-valued interpolator.");
    }
    Configuration c = configuration;
    return ((RealInterpolator) c.interpolator).interpolate(dc, positive, c.kernel);
  }

  /**
   * Evaluate many functions on the grid with the cached kernel.
   *
   * @param spectra the interleaved coefficients of each function.
   * @return the samples of each function, in the same order.
   */
  public double[][] evaluateAll(double[][] spectra) {
    Objects.requireNonNull(spectra, " The spectra are required.");
    // All functions are evaluated with the same configuration.
    Configuration c = configuration;
    double[][] ret = new double[spectra.length][];
    for (int i = 0; i < spectra.length; i++) {
      ret[i] = c.interpolator.interpolate(spectra[i], c.kernel);
    }
    return ret;
  }

  /**
   * Change the period, bandwidth or grid. The cached kernel is kept if the new configuration maps
   * onto the same (N, M, A, W) key, rebuilt otherwise, and discarded when the new configuration
   * needs no CZT.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   * @return true if the cached kernel was replaced or discarded.
   */
  public synchronized boolean reconfigure(double period, int bandwidth, SamplingGrid grid) {
    FourierInterpolator interpolator = real
        ? new RealInterpolator(period, bandwidth, grid)
        : new ComplexInterpolator(period, bandwidth, grid);
    ChirpKernel current = configuration.kernel;
    if (current == null && !interpolator.usesTransform()) {
      configuration = new Configuration(interpolator, null);
      return false;
    }
    if (interpolator.accepts(current)) {
      configuration = new Configuration(interpolator, current);
      logger.fine(" Chirp kernel reused after reconfiguration.");
      return false;
    }
    configuration = new Configuration(interpolator, interpolator.createKernel());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Reconfigured%s", interpolator));
    }
    return true;
  }

  /**
   * The cached kernel.
   *
   * @return the kernel, or null when no CZT is needed (M = 1, or N_FS = 1 for the real variant).
   */
  @Nullable
  public ChirpKernel getKernel() {
    return configuration.kernel;
  }

  /**
   * Getter for the period.
   *
   * @return the period T.
   */
  public double getPeriod() {
    return configuration.interpolator.getPeriod();
  }

  /**
   * Getter for the bandwidth.
   *
   * @return N_FS.
   */
  public int getBandwidth() {
    return configuration.interpolator.getBandwidth();
  }

  /**
   * Getter for the grid.
   *
   * @return the sampling grid.
   */
  public SamplingGrid getGrid() {
    return configuration.interpolator.getGrid();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return " Cached" + configuration.interpolator;
  }
}
