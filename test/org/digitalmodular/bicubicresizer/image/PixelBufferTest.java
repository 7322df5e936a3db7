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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import org.junit.jupiter.api.Test;

import org.digitalmodular.bicubicresizer.resize.InvalidDimensionException;

public class PixelBufferTest {
	@Test
	void createsBufferOfEachFormat() {
		for (PixelFormat format : PixelFormat.values()) {
			PixelBuffer buffer = format.createBuffer(3, 2);

			assertThat(buffer.getFormat()).isEqualTo(format);
			assertThat(buffer.getWidth()).isEqualTo(3);
			assertThat(buffer.getHeight()).isEqualTo(2);
			assertThat(buffer.getNumChannels()).isEqualTo(format.getNumChannels());
			assertThat(buffer.getSample(2, 1, format.getNumChannels() - 1)).isEqualTo(0.0);
		}

		assertThat(PixelFormat.GRAY16.createBuffer(1, 1)).isInstanceOf(ShortPixelBuffer.class);
		assertThat(PixelFormat.RGBA8.createBuffer(1, 1)).isInstanceOf(BytePixelBuffer.class);
	}

	@Test
	void formatProperties() {
		assertThat(PixelFormat.GRAY8.hasAlpha()).isFalse();
		assertThat(PixelFormat.RGBA16.hasAlpha()).isTrue();
		assertThat(PixelFormat.GRAY16.getDepth().getMaxValue()).isEqualTo(65535);
		assertThat(PixelFormat.GRAY16.getDepth().getBits()).isEqualTo(16);
		assertThat(PixelFormat.RGBA8.getDepth().getBits()).isEqualTo(8);
		assertThat(PixelFormat.RGBA8.getDepth().getMaxValue()).isEqualTo(255);
		assertThat(PixelFormat.of(4, ChannelDepth.SIXTEEN_BIT)).isEqualTo(PixelFormat.RGBA16);

		assertThatThrownBy(() -> PixelFormat.of(3, ChannelDepth.EIGHT_BIT))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void samplesAreUnsigned() {
		PixelBuffer bytes = PixelFormat.RGBA8.createBuffer(2, 2);
		bytes.setSample(1, 1, 2, 200);
		assertThat(bytes.getSample(1, 1, 2)).isEqualTo(200.0);
		assertThat(bytes.getSample(1, 1, 1)).isEqualTo(0.0);

		PixelBuffer shorts = PixelFormat.GRAY16.createBuffer(2, 2);
		shorts.setSample(0, 1, 0, 60000);
		assertThat(shorts.getSample(0, 1, 0)).isEqualTo(60000.0);
	}

	@Test
	void storesChannelsInterleavedPerRow() {
		BytePixelBuffer buffer = new BytePixelBuffer(PixelFormat.RGBA8, 2, 2);
		buffer.setSample(1, 0, 3, 7);
		buffer.setSample(0, 1, 0, 9);

		assertThat(buffer.getScanlineStride()).isEqualTo(8);
		assertThat(buffer.getRow(0)).hasSize(8);
		assertThat(buffer.getRow(0)[7]).isEqualTo((byte)7);
		assertThat(buffer.getRow(1)[0]).isEqualTo((byte)9);
	}

	@Test
	void copiesExistingData() {
		short[]          data   = {1, 2, 3, (short)65535};
		ShortPixelBuffer buffer = new ShortPixelBuffer(PixelFormat.GRAY16, 2, 2, data);

		data[3] = 0;

		assertThat(buffer.getSample(1, 1, 0)).isEqualTo(65535.0);
		assertThat(buffer.getSample(0, 1, 0)).isEqualTo(3.0);
		assertThat(buffer.getRow(1)).containsExactly((short)3, (short)65535);
	}

	@Test
	void allocatesMoreSamplesThanOneArrayHolds() {
		// 65535 * 32769 bytes is just above Integer.MAX_VALUE
		assumeTrue(Runtime.getRuntime().maxMemory() > 3L * 1024 * 1024 * 1024, "needs a heap over 3 GiB");

		PixelBuffer buffer = PixelFormat.GRAY8.createBuffer(65535, 32769);
		buffer.setSample(65534, 32768, 0, 201);

		assertThat(buffer.getSample(65534, 32768, 0)).isEqualTo(201.0);
		assertThat((long)buffer.getWidth() * buffer.getHeight()).isGreaterThan(Integer.MAX_VALUE);
	}

	@Test
	void rejectsInvalidDimensions() {
		assertThatThrownBy(() -> PixelFormat.GRAY8.createBuffer(0, 5))
				.isInstanceOf(InvalidDimensionException.class);
		assertThatThrownBy(() -> PixelFormat.RGBA16.createBuffer(5, 65536))
				.isInstanceOf(InvalidDimensionException.class);
	}

	@Test
	void rejectsMismatchedData() {
		assertThatThrownBy(() -> new BytePixelBuffer(PixelFormat.RGBA8, 2, 2, new byte[15]))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("16");
		assertThatThrownBy(() -> new BytePixelBuffer(PixelFormat.GRAY16, 2, 2))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ShortPixelBuffer(PixelFormat.GRAY8, 2, 2, new short[4]))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
