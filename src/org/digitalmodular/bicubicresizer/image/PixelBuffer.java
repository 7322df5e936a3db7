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
 * A rectangular grid of pixels with a fixed {@link PixelFormat}. Samples are addressed per channel and exchanged as
 * their integer level (e.g. {@code 0..255} for 8-bit channels), independent of the backing storage.
 * <p>
 * Implementations are not thread-safe, but concurrent reads, and concurrent writes to distinct pixels, are allowed.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public interface PixelBuffer {
	int getWidth();

	int getHeight();

	PixelFormat getFormat();

	int getNumChannels();

	/**
	 * Returns the level of one channel of the pixel at {@code (x, y)} as a floating point number.
	 * <p>
	 * Coordinates are not range-checked beyond what the backing array does.
	 */
	double getSample(int x, int y, int channel);

	/**
	 * Stores the level of one channel of the pixel at {@code (x, y)}. The value must already be within
	 * {@code [0, getFormat().getDepth().getMaxValue()]}; excess bits are discarded.
	 */
	void setSample(int x, int y, int channel, int value);
}
