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

/**
 * The pixel representations the resampler operates on. Color is always RGBA (non-premultiplied) and gray has no
 * alpha.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public enum PixelFormat {
	GRAY8(1, ChannelDepth.EIGHT_BIT),
	GRAY16(1, ChannelDepth.SIXTEEN_BIT),
	RGBA8(4, ChannelDepth.EIGHT_BIT),
	RGBA16(4, ChannelDepth.SIXTEEN_BIT);

	private final int          numChannels;
	private final ChannelDepth depth;

	PixelFormat(int numChannels, ChannelDepth depth) {
		this.numChannels = numChannels;
		this.depth = depth;
	}

	public int getNumChannels()    { return numChannels; }

	public ChannelDepth getDepth() { return depth; }

	public boolean hasAlpha()      { return numChannels == 4; }

	/**
	 * Allocates a new, zero-filled buffer of this format.
	 *
	 * @throws org.digitalmodular.bicubicresizer.resize.InvalidDimensionException when either dimension is out of
	 *                                                                          range
	 */
	public PixelBuffer createBuffer(int width, int height) {
		switch (depth) {
			case EIGHT_BIT:
				return new BytePixelBuffer(this, width, height);
			case SIXTEEN_BIT:
				return new ShortPixelBuffer(this, width, height);
			default:
				throw new AssertionError(depth);
		}
	}

	public static PixelFormat of(int numChannels, ChannelDepth depth) {
		for (PixelFormat format : values())
			if (format.numChannels == numChannels && format.depth == depth)
				return format;

		throw new IllegalArgumentException("No pixel format with " + numChannels + " channels of " + depth);
	}
}
