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
 * Pixel buffer for {@link PixelFormat#GRAY8} and {@link PixelFormat#RGBA8}, backed by one {@code byte[]} per row
 * holding unsigned channel values.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
// Changed 2026-10-19 One array per row
public class BytePixelBuffer extends AbstractPixelBuffer {
	private final byte[][] rows;

	public BytePixelBuffer(PixelFormat format, int width, int height) {
		super(checkDepth(format), width, height);
		rows = new byte[height][scanlineStride];
	}

	/**
	 * Copies existing data, interleaved and stored row after row.
	 */
	public BytePixelBuffer(PixelFormat format, int width, int height, byte[] data) {
		this(format, width, height);
		checkLength(data.length);

		for (int y = 0; y < height; y++)
			System.arraycopy(data, y * scanlineStride, rows[y], 0, scanlineStride);
	}

	private static PixelFormat checkDepth(PixelFormat format) {
		if (format.getDepth() != ChannelDepth.EIGHT_BIT)
			throw new IllegalArgumentException("Not a 8-bit format: " + format);

		return format;
	}

	/** The backing array of row {@code y}, not a copy. */
	public byte[] getRow(int y) { return rows[y]; }

	@Override
	public double getSample(int x, int y, int channel) {
		return rows[y][indexOf(x, channel)] & 0xFF;
	}

	@Override
	public void setSample(int x, int y, int channel, int value) {
		rows[y][indexOf(x, channel)] = (byte)value;
	}
}
