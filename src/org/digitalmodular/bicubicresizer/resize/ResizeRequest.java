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

import org.digitalmodular.bicubicresizer.util.SizeInt;

/**
 * An immutable, validated pair of source and target dimensions.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public final class ResizeRequest {
	public static final int    MIN_DIMENSION    = 1;
	public static final int    MAX_DIMENSION    = 65535;
	public static final long   MAX_AREA         = (long)MAX_DIMENSION * MAX_DIMENSION;
	public static final double MIN_SCALE_FACTOR = 1 / 16.0;
	public static final double MAX_SCALE_FACTOR = 16;

	private final int srcWidth;
	private final int srcHeight;
	private final int dstWidth;
	private final int dstHeight;

	/**
	 * @throws InvalidDimensionException  when any dimension is out of range
	 * @throws InvalidScaleRatioException when the scale factor along either axis is out of range
	 */
	public ResizeRequest(int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
		validateDimensions(srcWidth, srcHeight, "Source");
		validateDimensions(dstWidth, dstHeight, "Target");
		validateScaleFactor(dstWidth / (double)srcWidth, "Width");
		validateScaleFactor(dstHeight / (double)srcHeight, "Height");

		this.srcWidth = srcWidth;
		this.srcHeight = srcHeight;
		this.dstWidth = dstWidth;
		this.dstHeight = dstHeight;
	}

	public ResizeRequest(SizeInt srcSize, SizeInt dstSize) {
		this(srcSize.getWidth(), srcSize.getHeight(), dstSize.getWidth(), dstSize.getHeight());
	}

	/**
	 * Checks one pair of image dimensions.
	 *
	 * @param what prefix for the exception message, such as {@code "Source"}
	 * @throws InvalidDimensionException when either dimension is out of range
	 */
	public static void validateDimensions(int width, int height, String what) {
		if (width < MIN_DIMENSION || height < MIN_DIMENSION)
			throw new InvalidDimensionException(
					what + " dimensions must be at least " + MIN_DIMENSION + ": " + width + 'x' + height);
		if (width > MAX_DIMENSION || height > MAX_DIMENSION)
			throw new InvalidDimensionException(
					what + " dimensions must be at most " + MAX_DIMENSION + ": " + width + 'x' + height);
		if ((long)width * height > MAX_AREA)
			throw new InvalidDimensionException(what + " pixel count exceeds " + MAX_AREA + ": " + width + 'x' + height);
	}

	private static void validateScaleFactor(double scaleFactor, String axis) {
		if (scaleFactor < MIN_SCALE_FACTOR || scaleFactor > MAX_SCALE_FACTOR)
			throw new InvalidScaleRatioException(
					axis + " scale factor " + scaleFactor + " is outside [" + MIN_SCALE_FACTOR + ", " +
					MAX_SCALE_FACTOR + ']');
	}

	public int getSrcWidth()  { return srcWidth; }

	public int getSrcHeight() { return srcHeight; }

	public int getDstWidth()  { return dstWidth; }

	public int getDstHeight() { return dstHeight; }

	public SizeInt getSrcSize() { return new SizeInt(srcWidth, srcHeight); }

	public SizeInt getDstSize() { return new SizeInt(dstWidth, dstHeight); }

	/** Target width divided by source width. */
	public double getWidthScaleFactor()  { return dstWidth / (double)srcWidth; }

	/** Target height divided by source height. */
	public double getHeightScaleFactor() { return dstHeight / (double)srcHeight; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ResizeRequest)) return false;

		ResizeRequest other = (ResizeRequest)o;

		return srcWidth == other.srcWidth &&
		       srcHeight == other.srcHeight &&
		       dstWidth == other.dstWidth &&
		       dstHeight == other.dstHeight;
	}

	@Override
	public int hashCode() {
		int hash = 0x4C1DF00D;
		hash *= 0x01000193;
		hash ^= srcWidth;
		hash *= 0x01000193;
		hash ^= srcHeight;
		hash *= 0x01000193;
		hash ^= dstWidth;
		hash *= 0x01000193;
		hash ^= dstHeight;
		return hash;
	}

	@Override
	public String toString() {
		return srcWidth + "x" + srcHeight + " -> " + dstWidth + 'x' + dstHeight;
	}
}
