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

import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.image.PixelFormat;

/**
 * Conversions between {@link BufferedImage} and {@link PixelBuffer}, and image diagnostics for logging.
 *
 * @author Mark Jeronimus
 */
// Created 2009-04-28
// Changed 2015-08-15 added functions for AbstractImageResizer
// Changed 2026-10-12 added conversions to and from PixelBuffer
public enum ImageUtilities {
	;

	public static String analyzeImage(BufferedImage image) {
		int     srcDataType             = image.getRaster().getDataBuffer().getDataType();
		int     numComponents           = image.getColorModel().getColorSpace().getNumComponents();
		boolean hasAlpha                = image.getColorModel().hasAlpha();
		boolean srcIsAlphaPremultiplied = image.getColorModel().isAlphaPremultiplied();
		boolean srcIsSRGB               = image.getColorModel().getColorSpace().isCS_sRGB();

		return imageTypeName(image.getType())
		       + " / " + dataTypeName(srcDataType)
		       + " / " + numComponents + "ch"
		       + " / " + (hasAlpha ? "alpha" : "opaque")
		       + (srcIsAlphaPremultiplied ? " premultiplied" : "")
		       + (srcIsSRGB ? " / sRGB" : "");
	}

	public static String dataTypeName(int type) {
		switch (type) {
			case DataBuffer.TYPE_BYTE:
				return "TYPE_BYTE";
			case DataBuffer.TYPE_USHORT:
				return "TYPE_USHORT";
			case DataBuffer.TYPE_SHORT:
				return "TYPE_SHORT";
			case DataBuffer.TYPE_INT:
				return "TYPE_INT";
			case DataBuffer.TYPE_FLOAT:
				return "TYPE_FLOAT";
			case DataBuffer.TYPE_DOUBLE:
				return "TYPE_DOUBLE";
			default:
				return Integer.toString(type);
		}
	}

	public static String imageTypeName(int type) {
		switch (type) {
			case BufferedImage.TYPE_3BYTE_BGR:
				return "TYPE_3BYTE_BGR";
			case BufferedImage.TYPE_4BYTE_ABGR:
				return "TYPE_4BYTE_ABGR";
			case BufferedImage.TYPE_4BYTE_ABGR_PRE:
				return "TYPE_4BYTE_ABGR_PRE";
			case BufferedImage.TYPE_BYTE_BINARY:
				return "TYPE_BYTE_BINARY";
			case BufferedImage.TYPE_BYTE_GRAY:
				return "TYPE_BYTE_GRAY";
			case BufferedImage.TYPE_BYTE_INDEXED:
				return "TYPE_BYTE_INDEXED";
			case BufferedImage.TYPE_CUSTOM:
				return "TYPE_CUSTOM";
			case BufferedImage.TYPE_INT_ARGB:
				return "TYPE_INT_ARGB";
			case BufferedImage.TYPE_INT_ARGB_PRE:
				return "TYPE_INT_ARGB_PRE";
			case BufferedImage.TYPE_INT_BGR:
				return "TYPE_INT_BGR";
			case BufferedImage.TYPE_INT_RGB:
				return "TYPE_INT_RGB";
			case BufferedImage.TYPE_USHORT_555_RGB:
				return "TYPE_USHORT_555_RGB";
			case BufferedImage.TYPE_USHORT_565_RGB:
				return "TYPE_USHORT_565_RGB";
			case BufferedImage.TYPE_USHORT_GRAY:
				return "TYPE_USHORT_GRAY";
			default:
				return Integer.toString(type);
		}
	}

	/**
	 * Returns the pixel format whose layout the image has, or {@code null} if it has none of them and needs to be
	 * converted first.
	 * <p>
	 * Recognized are {@link BufferedImage#TYPE_BYTE_GRAY}, {@link BufferedImage#TYPE_USHORT_GRAY},
	 * {@link BufferedImage#TYPE_4BYTE_ABGR}, and custom sRGB images with a non-premultiplied alpha channel and
	 * 8- or 16-bit components.
	 */
	public static PixelFormat getPixelFormat(BufferedImage image) {
		switch (image.getType()) {
			case BufferedImage.TYPE_BYTE_GRAY:
				return PixelFormat.GRAY8;
			case BufferedImage.TYPE_USHORT_GRAY:
				return PixelFormat.GRAY16;
			case BufferedImage.TYPE_4BYTE_ABGR:
				return PixelFormat.RGBA8;
			case BufferedImage.TYPE_CUSTOM:
				break;
			default:
				return null;
		}

		ColorModel colorModel = image.getColorModel();
		if (!(colorModel instanceof ComponentColorModel)
		    || !colorModel.getColorSpace().isCS_sRGB()
		    || !colorModel.hasAlpha()
		    || colorModel.isAlphaPremultiplied()
		    || image.getRaster().getNumBands() != 4)
			return null;

		switch (image.getRaster().getDataBuffer().getDataType()) {
			case DataBuffer.TYPE_BYTE:
				return PixelFormat.RGBA8;
			case DataBuffer.TYPE_USHORT:
				return PixelFormat.RGBA16;
			default:
				return null;
		}
	}

	/**
	 * Draws the image onto a new {@link BufferedImage#TYPE_4BYTE_ABGR} image. This is lossy for images with more than 8
	 * bits per channel.
	 */
	public static BufferedImage convertToABGR(BufferedImage image) {
		BufferedImage img = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_4BYTE_ABGR);
		Graphics2D    g   = img.createGraphics();
		try {
			g.drawImage(image, 0, 0, null);
		} finally {
			g.dispose();
		}
		return img;
	}

	/**
	 * Copies the samples of a compatible image into a new pixel buffer.
	 *
	 * @throws IllegalArgumentException when {@link #getPixelFormat(BufferedImage)} doesn't recognize the image
	 */
	public static PixelBuffer toPixelBuffer(BufferedImage image) {
		PixelFormat format = getPixelFormat(image);
		if (format == null)
			throw new IllegalArgumentException("Incompatible image: " + analyzeImage(image));

		int         width       = image.getWidth();
		int         height      = image.getHeight();
		int         numChannels = format.getNumChannels();
		PixelBuffer buffer      = format.createBuffer(width, height);
		Raster      raster      = image.getRaster();

		// Raster returns the bands in color model order, which is R, G, B, A for all recognized images
		int[] row = new int[width * numChannels];
		for (int y = 0; y < height; y++) {
			raster.getPixels(0, y, width, 1, row);

			int i = 0;
			for (int x = 0; x < width; x++)
				for (int c = 0; c < numChannels; c++)
					buffer.setSample(x, y, c, row[i++]);
		}

		return buffer;
	}

	/**
	 * Copies a pixel buffer into a new image of the matching type.
	 *
	 * @see #createImage(int, int, PixelFormat)
	 */
	public static BufferedImage toBufferedImage(PixelBuffer buffer) {
		int           width       = buffer.getWidth();
		int           height      = buffer.getHeight();
		int           numChannels = buffer.getNumChannels();
		BufferedImage image       = createImage(width, height, buffer.getFormat());
		WritableRaster raster     = image.getRaster();

		int[] row = new int[width * numChannels];
		for (int y = 0; y < height; y++) {
			int i = 0;
			for (int x = 0; x < width; x++)
				for (int c = 0; c < numChannels; c++)
					row[i++] = (int)buffer.getSample(x, y, c);

			raster.setPixels(0, y, width, 1, row);
		}

		return image;
	}

	/**
	 * Creates an image that {@link #getPixelFormat(BufferedImage)} maps back to {@code format}.
	 */
	public static BufferedImage createImage(int width, int height, PixelFormat format) {
		switch (format) {
			case GRAY8:
				return new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
			case GRAY16:
				return new BufferedImage(width, height, BufferedImage.TYPE_USHORT_GRAY);
			case RGBA8:
				return new BufferedImage(width, height, BufferedImage.TYPE_4BYTE_ABGR);
			case RGBA16:
				return createComponentImage(width, height, DataBuffer.TYPE_USHORT);
			default:
				throw new AssertionError(format);
		}
	}

	private static BufferedImage createComponentImage(int width, int height, int dataType) {
		ColorModel outModel = new ComponentColorModel(
				ColorSpace.getInstance(ColorSpace.CS_sRGB),
				true, false,
				Transparency.TRANSLUCENT,
				dataType);

		WritableRaster outRaster = outModel.createCompatibleWritableRaster(width, height);

		return new BufferedImage(outModel, outRaster, false, null);
	}
}
