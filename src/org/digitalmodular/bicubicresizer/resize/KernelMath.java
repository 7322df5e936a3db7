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

import static java.lang.Double.isInfinite;
import static java.lang.Double.isNaN;

import org.digitalmodular.bicubicresizer.resize.filter.MitchellNetravaliResamplingCurve;
import org.digitalmodular.bicubicresizer.resize.filter.ResamplingCurve;

/**
 * Numeric building blocks of the 4x4 bicubic kernel.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public enum KernelMath {
	;

	/** Number of source samples along each axis for one destination sample. */
	public static final int KERNEL_SIZE = 4;

	/**
	 * The interval {@code [start, end)} of source indices supporting one sample. Always {@link #KERNEL_SIZE} wide.
	 */
	public static final class KernelBounds {
		private final int start;

		private KernelBounds(int start) {
			this.start = start;
		}

		public int getStart() { return start; }

		public int getEnd()   { return start + KERNEL_SIZE; }

		@Override
		public String toString() {
			return "[" + start + ", " + getEnd() + ')';
		}
	}

	/**
	 * Returns the weight of the Mitchell-Netravali curve with {@code B = C = 1/3} at distance {@code x}.
	 */
	public static double cubicWeight(double x) {
		return MitchellNetravaliResamplingCurve.INSTANCE.apply(x);
	}

	/**
	 * Rounds {@code value} to the nearest integer and clamps it to {@code [0, maxChannelValue]}. Infinities clamp
	 * like any other out-of-range value.
	 *
	 * @throws InvalidChannelValueException when {@code value} is {@code NaN}
	 */
	public static int clampQuantize(double value, int maxChannelValue) {
		if (isNaN(value))
			throw new InvalidChannelValueException("Channel value is NaN");

		if (value < 0)
			return 0;
		if (value > maxChannelValue)
			return maxChannelValue;

		return (int)(value + 0.5);
	}

	/**
	 * Clamps {@code index} to {@code [0, size - 1]}, so samples beyond the edge replicate the edge pixel.
	 */
	public static int safeIndex(int index, int size) {
		if (index < 0)
			return 0;
		if (index >= size)
			return size - 1;

		return index;
	}

	/**
	 * Returns the four consecutive source indices {@code [floor(center) - 1, floor(center) + 3)} around a sample
	 * position. Indices outside {@code [0, size)} are not filtered; pass them through {@link #safeIndex(int, int)}.
	 *
	 * @throws InvalidCoordinateException when {@code center} is not in {@code [0, size)}
	 */
	public static KernelBounds kernelBounds(double center, int size) {
		if (!(center >= 0) || center >= size)
			throw new InvalidCoordinateException("Sample position " + center + " outside [0, " + size + ')');

		return new KernelBounds((int)Math.floor(center) - (KERNEL_SIZE / 2 - 1));
	}

	/**
	 * Calculates the weights of the four taps of one axis. Tap {@code i} sits at offset {@code i - 1} from the
	 * integer part of the sample position.
	 */
	public static void calculateWeights(ResamplingCurve curve, double fraction, double[] weights) {
		for (int i = 0; i < KERNEL_SIZE; i++)
			weights[i] = curve.apply(i - 1 - fraction);
	}

	/**
	 * Interpolates a 4x4 window of samples at fractional offset {@code (dx, dy)} from the second row and column,
	 * using {@link #cubicWeight(double)}.
	 *
	 * @param window {@code window[row][column]}
	 * @throws InvalidCoordinateException   when {@code dx} or {@code dy} is not in {@code [0, 1]}
	 * @throws InvalidChannelValueException when the result is not finite
	 */
	public static double interpolate(double[][] window, double dx, double dy) {
		if (!(dx >= 0 && dx <= 1 && dy >= 0 && dy <= 1))
			throw new InvalidCoordinateException("Fractional offset outside [0, 1]: (" + dx + ", " + dy + ')');

		double[] weightsX = new double[KERNEL_SIZE];
		double[] weightsY = new double[KERNEL_SIZE];
		calculateWeights(MitchellNetravaliResamplingCurve.INSTANCE, dx, weightsX);
		calculateWeights(MitchellNetravaliResamplingCurve.INSTANCE, dy, weightsY);

		return interpolate(window, weightsX, weightsY);
	}

	/**
	 * Applies separable weights to a 4x4 window: each row is reduced with {@code weightsX}, then the row sums are
	 * reduced with {@code weightsY}.
	 *
	 * @param window {@code window[row][column]}
	 * @throws InvalidChannelValueException when the result is not finite
	 */
	public static double interpolate(double[][] window, double[] weightsX, double[] weightsY) {
		double result = 0;

		for (int j = 0; j < KERNEL_SIZE; j++) {
			double[] row    = window[j];
			double   rowSum = 0;

			for (int i = 0; i < KERNEL_SIZE; i++)
				rowSum += row[i] * weightsX[i];

			result += rowSum * weightsY[j];
		}

		if (isNaN(result) || isInfinite(result))
			throw new InvalidChannelValueException("Interpolated channel value is not finite: " + result);

		return result;
	}
}
