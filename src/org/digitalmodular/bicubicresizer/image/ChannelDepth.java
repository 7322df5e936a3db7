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
 * Bit depth of one channel of a pixel. Channel values are unsigned integers in the range {@code [0, maxValue]}.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
public enum ChannelDepth {
	EIGHT_BIT(8),
	SIXTEEN_BIT(16);

	private final int bits;
	private final int maxValue;

	ChannelDepth(int bits) {
		this.bits = bits;
		maxValue = (1 << bits) - 1;
	}

	public int getBits()     { return bits; }

	/** The highest value a channel can hold, {@code 255} or {@code 65535}. */
	public int getMaxValue() { return maxValue; }
}
