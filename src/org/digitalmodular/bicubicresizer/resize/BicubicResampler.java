/*
 * This file is part of BicubicResizer.
 *
 * Copyleft 2016 Mark Jeronimus. All Rights Reversed.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BicubicResizer. If not, see <http://www.gnu.org/licenses/>.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package org.digitalmodular.bicubicresizer.resize;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.bicubicresizer.ProgressEvent;
import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.image.PixelFormat;
import org.digitalmodular.bicubicresizer.util.PerformanceTimer;
import org.digitalmodular.bicubicresizer.util.SizeInt;
import static org.digitalmodular.bicubicresizer.resize.KernelMath.KERNEL_SIZE;
import static org.digitalmodular.bicubicresizer.resize.SamplingDataCalculator.SamplingData;
import static org.digitalmodular.bicubicresizer.resize.SamplingDataCalculator.createSubSampling;

/**
 * Resizes images with a separable 4x4 cubic kernel, by default the Mitchell-Netravali filter with
 * {@code B = C = 1/3}.
 * <p>
 * Features:<ul>
 * <li>Compatible images: any {@link PixelBuffer} ({@link PixelFormat#GRAY8}, {@link PixelFormat#GRAY16},
 * {@link PixelFormat#RGBA8}, {@link PixelFormat#RGBA16}), and {@link java.awt.image.BufferedImage} through
 * conversion,</li>
 * <li>Scale factors: {@code 1/16} to {@code 16} along each axis independently,</li>
 * <li>Placement: destination pixel {@code x} samples source position {@code (x + 0.5) * srcWidth / dstWidth},</li>
 * <li>Edges: clamped, pixels beyond the edge replicate the edge pixel,</li>
 * <li>Channels: interpolated independently, including alpha (no premultiplication),</li>
 * <li>Output: rounded and clamped to the channel depth; non-finite intermediate values abort the resize,</li>
 * <li>Parallel processing: destination rows are split in independent strips. The result is identical for any
 * number of threads.</li>
 * </ul>
 * <p>
 * Unlike filters that widen when shrinking, the kernel always spans 4 source pixels, so strong reduction skips
 * source pixels instead of averaging them.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public class BicubicResampler extends AbstractImageResampler {
	private final PerformanceTimer timer = new PerformanceTimer();

	private final AtomicLong numPixelsDone = new AtomicLong();

	private SamplingData horizontalSamplingData = null;
	private SamplingData verticalSamplingData   = null;

	/**
	 * Convenience method that sets the output size and resizes.
	 *
	 * @see #resize(PixelBuffer)
	 */
	public synchronized PixelBuffer resize(PixelBuffer image, int width, int height) throws InterruptedException {
		setOutputSize(new SizeInt(width, height));
		return resize(image);
	}

	@Override
	public synchronized PixelBuffer resize(PixelBuffer image) throws InterruptedException {
		requireNonNull(image, "image");

		timer.reset();
		timer.start();

		// Everything is validated before the first allocation.
		ResizeRequest request = calculateDstSize(image);
		PixelFormat   format  = image.getFormat();

		if (Logger.getGlobal().isLoggable(Level.FINEST))
			Logger.getGlobal().finest("Resizing " + format + ' ' + request + " with " + filter);

		fireProgressUpdated(new ProgressEvent(0, -1));

		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();

		horizontalSamplingData = createSubSampling(filter, srcWidth, dstWidth);
		verticalSamplingData = createSubSampling(filter, srcHeight, dstHeight);

		timer.record("Prepare");

		PixelBuffer out = format.createBuffer(dstWidth, dstHeight);

		timer.record("Allocate");

		numPixelsDone.set(0);
		fireProgressUpdated(new ProgressEvent(0, (long)dstWidth * dstHeight));

		try {
			runWorkers(makeWorkers(image, out));
		} finally {
			// GC this:
			horizontalSamplingData = null;
			verticalSamplingData = null;
		}

		if (out.getWidth() != dstWidth || out.getHeight() != dstHeight)
			throw new AssertionError("Output is " + new SizeInt(out) + ", expected " + request.getDstSize());

		timer.record("Resize");
		timer.logResults((double)dstWidth * dstHeight);
		fireProgressCompleted(new ProgressEvent((long)dstWidth * dstHeight, (long)dstWidth * dstHeight));

		return out;
	}

	private List<Callable<Void>> makeWorkers(PixelBuffer src, PixelBuffer dst) {
		int numStrips = Math.min(getEffectiveNumThreads(), dstHeight);

		List<Callable<Void>> workers = new ArrayList<>(numStrips);

		// Divide the rows of the image in approximately equal pieces
		for (int i = 0; i < numStrips; i++) {
			int begin = i * dstHeight / numStrips;
			int end   = (i + 1) * dstHeight / numStrips;

			workers.add(new ResampleWorker(src, dst, begin, end));
		}

		return workers;
	}

	/**
	 * Computes every pixel of a range of destination rows. Reads only from the source, and writes only to its own
	 * rows of the destination.
	 */
	private final class ResampleWorker implements Callable<Void> {
		private final PixelBuffer  src;
		private final PixelBuffer  dst;
		private final int          begin;
		private final int          end;
		private final SamplingData horizontal;
		private final SamplingData vertical;

		private ResampleWorker(PixelBuffer src, PixelBuffer dst, int begin, int end) {
			this.src = src;
			this.dst = dst;
			this.begin = begin;
			this.end = end;
			horizontal = horizontalSamplingData;
			vertical = verticalSamplingData;
		}

		@Override
		public Void call() throws InterruptedException {
			if (Logger.getGlobal().isLoggable(Level.FINEST))
				Logger.getGlobal().finest(begin + ".." + end);

			int numChannels = dst.getNumChannels();
			int maxValue    = dst.getFormat().getDepth().getMaxValue();
			int width       = dst.getWidth();

			double[][] window = new double[KERNEL_SIZE][KERNEL_SIZE];

			for (int y = begin; y < end; y++) {
				if (Thread.currentThread().isInterrupted())
					throw new InterruptedException();

				int[]    rows     = vertical.getIndices()[y];
				double[] weightsY = vertical.getWeights()[y];

				for (int x = 0; x < width; x++) {
					int[]    columns  = horizontal.getIndices()[x];
					double[] weightsX = horizontal.getWeights()[x];

					for (int c = 0; c < numChannels; c++) {
						for (int j = 0; j < KERNEL_SIZE; j++)
							for (int i = 0; i < KERNEL_SIZE; i++)
								window[j][i] = src.getSample(columns[i], rows[j], c);

						double value;
						try {
							value = KernelMath.interpolate(window, weightsX, weightsY);
						} catch (InvalidChannelValueException ex) {
							throw new InvalidChannelValueException(
									"Sampling failed at (" + x + ", " + y + ") channel " + c, ex);
						}

						dst.setSample(x, y, c, KernelMath.clampQuantize(value, maxValue));
					}
				}
			}

			long done = numPixelsDone.addAndGet((long)(end - begin) * width);
			fireProgressUpdated(new ProgressEvent(done, (long)width * dst.getHeight()));

			return null;
		}
	}
}
