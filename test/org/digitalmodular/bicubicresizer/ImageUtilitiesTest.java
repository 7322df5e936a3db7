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
package org.digitalmodular.bicubicresizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

import org.junit.jupiter.api.Test;

import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.image.PixelFormat;
import org.digitalmodular.bicubicresizer.resize.BicubicResampler;
import org.digitalmodular.bicubicresizer.util.SizeInt;

public class ImageUtilitiesTest {
	@Test
	void recognizesCompatibleTypes() {
		assertThat(ImageUtilities.getPixelFormat(new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY)))
				.isEqualTo(PixelFormat.GRAY8);
		assertThat(ImageUtilities.getPixelFormat(new BufferedImage(1, 1, BufferedImage.TYPE_USHORT_GRAY)))
				.isEqualTo(PixelFormat.GRAY16);
		assertThat(ImageUtilities.getPixelFormat(new BufferedImage(1, 1, BufferedImage.TYPE_4BYTE_ABGR)))
				.isEqualTo(PixelFormat.RGBA8);
		assertThat(ImageUtilities.getPixelFormat(ImageUtilities.createImage(1, 1, PixelFormat.RGBA16)))
				.isEqualTo(PixelFormat.RGBA16);

		assertThat(ImageUtilities.getPixelFormat(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB))).isNull();
		assertThat(ImageUtilities.getPixelFormat(new BufferedImage(1, 1, BufferedImage.TYPE_4BYTE_ABGR_PRE))).isNull();
	}

	@Test
	void grayRoundTrip() {
		BufferedImage  image  = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
		WritableRaster raster = image.getRaster();
		raster.setSample(0, 0, 0, 17);
		raster.setSample(2, 1, 0, 255);

		PixelBuffer buffer = ImageUtilities.toPixelBuffer(image);
		assertThat(buffer.getFormat()).isEqualTo(PixelFormat.GRAY8);
		assertThat(buffer.getSample(0, 0, 0)).isEqualTo(17.0);
		assertThat(buffer.getSample(2, 1, 0)).isEqualTo(255.0);

		BufferedImage back = ImageUtilities.toBufferedImage(buffer);
		assertThat(back.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
		assertThat(back.getRaster().getSample(0, 0, 0)).isEqualTo(17);
		assertThat(back.getRaster().getSample(2, 1, 0)).isEqualTo(255);
	}

	@Test
	void abgrImageGivesRgbaChannelOrder() {
		BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_4BYTE_ABGR);
		image.getRaster().setPixel(0, 0, new int[]{10, 20, 30, 40});

		PixelBuffer buffer = ImageUtilities.toPixelBuffer(image);

		assertThat(buffer.getSample(0, 0, 0)).isEqualTo(10.0);
		assertThat(buffer.getSample(0, 0, 1)).isEqualTo(20.0);
		assertThat(buffer.getSample(0, 0, 2)).isEqualTo(30.0);
		assertThat(buffer.getSample(0, 0, 3)).isEqualTo(40.0);
	}

	@Test
	void sixteenBitColorRoundTrip() {
		PixelBuffer buffer = PixelFormat.RGBA16.createBuffer(2, 1);
		buffer.setSample(1, 0, 0, 65535);
		buffer.setSample(1, 0, 3, 40000);

		BufferedImage image = ImageUtilities.toBufferedImage(buffer);
		PixelBuffer   back  = ImageUtilities.toPixelBuffer(image);

		assertThat(back.getFormat()).isEqualTo(PixelFormat.RGBA16);
		assertThat(back.getSample(1, 0, 0)).isEqualTo(65535.0);
		assertThat(back.getSample(1, 0, 3)).isEqualTo(40000.0);
	}

	@Test
	void rejectsIncompatibleImage() {
		assertThatThrownBy(() -> ImageUtilities.toPixelBuffer(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("TYPE_INT_RGB");
	}

	@Test
	void convertsOtherTypesToOpaqueRgba() {
		BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
		image.setRGB(0, 0, 0x123456);

		BufferedImage converted = new BicubicResampler().makeImageCompatible(image);
		PixelBuffer   buffer    = ImageUtilities.toPixelBuffer(converted);

		assertThat(buffer.getFormat()).isEqualTo(PixelFormat.RGBA8);
		assertThat(buffer.getSample(0, 0, 0)).isEqualTo(0x12);
		assertThat(buffer.getSample(0, 0, 1)).isEqualTo(0x34);
		assertThat(buffer.getSample(0, 0, 2)).isEqualTo(0x56);
		assertThat(buffer.getSample(0, 0, 3)).isEqualTo(255.0);
	}

	@Test
	void resizesBufferedImages() throws InterruptedException {
		BicubicResampler resampler = new BicubicResampler();

		resampler.setOutputSize(new SizeInt(7, 5));
		BufferedImage gray = resampler.resize(new BufferedImage(3, 3, BufferedImage.TYPE_USHORT_GRAY));
		assertThat(gray.getType()).isEqualTo(BufferedImage.TYPE_USHORT_GRAY);
		assertThat(gray.getWidth()).isEqualTo(7);
		assertThat(gray.getHeight()).isEqualTo(5);

		BufferedImage rgb = resampler.resize(new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB));
		assertThat(rgb.getType()).isEqualTo(BufferedImage.TYPE_4BYTE_ABGR);
		assertThat(rgb.getWidth()).isEqualTo(7);
	}
}
