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
package org.digitalmodular.bicubicresizer.image;

import static java.util.Objects.requireNonNull;

import org.digitalmodular.bicubicresizer.resize.ResizeRequest;

/**
 * Pixel buffer with interleaved channels, stored as one array per row. A row holds at most {@code 65535 * 4}
 * elements, so only the heap limits the size of a buffer.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
// Changed 2026-10-19 One array per row instead of one for the whole image
public abstract class AbstractPixelBuffer implements PixelBuffer {
	protected final PixelFormat format;
	protected final int         width;
	protected final int         height;
	protected final int         numChannels;
	protected final int         scanlineStride;

	protected AbstractPixelBuffer(PixelFormat format, int width, int height) {
		this.format = requireNonNull(format, "format");
		ResizeRequest.validateDimensions(width, height, "Buffer");

		this.width = width;
		this.height = height;
		numChannels = format.getNumChannels();
		scanlineStride = width * numChannels;
	}

	@Override
	public int getWidth()          { return width; }

	@Override
	public int getHeight()         { return height; }

	@Override
	public PixelFormat getFormat() { return format; }

	@Override
	public int getNumChannels()    { return numChannels; }

	/** Number of array elements in one row. */
	public int getScanlineStride() { return scanlineStride; }

	/** Index of a sample within its row. */
	protected final int indexOf(int x, int channel) {
		return x * numChannels + channel;
	}

	protected final void checkLength(int actualLength) {
		long expected = (long)width * height * numChannels;
		if (actualLength != expected)
			throw new IllegalArgumentException(
					"Data length " + actualLength + " doesn't match " + width + "x" + height + " " + format +
					" (" + expected + ')');
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + '[' + width + 'x' + height + ' ' + format + ']';
	}
}
