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

import java.awt.image.BufferedImage;

import org.digitalmodular.bicubicresizer.ProgressListener;
import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.util.SizeInt;

/**
 * @author Mark Jeronimus
 */
// Created 2016-05-06
public interface ImageResizer {
	SizeInt getOutputSize();

	/**
	 * Set the dimensions of the resized image. Required before resizing.
	 *
	 * @throws InvalidDimensionException when either dimension is outside {@code [1, 65535]}
	 */
	void setOutputSize(SizeInt outputSize);

	int getQuality();

	/**
	 * Set the quality hint in the range {@code [0, 100]}. Values out of range are replaced with {@code 100}.
	 * Default is {@code 100}.
	 * <p>
	 * The hint is carried along for encoders and does not affect resampling.
	 */
	void setQuality(int quality);

	void addProgressListener(ProgressListener progressListener);

	void removeProgressListener(ProgressListener progressListener);

	/**
	 * Resizes the image to the dimensions previously set by {@link #setOutputSize(SizeInt) setOutputSize()}.
	 * The result is always a new buffer with the same {@link PixelBuffer#getFormat() format} as the input. The input
	 * is not modified.
	 * <p>
	 * The cancellation policy is to interrupt this thread. This will interrupt all workers and return as soon
	 * as possible by throwing an {@link InterruptedException}.
	 *
	 * @throws IllegalStateException        when no output size has been set
	 * @throws InvalidDimensionException    when the image dimensions are out of range
	 * @throws InvalidScaleRatioException   when the output size is too far from the image size
	 * @throws InvalidChannelValueException when the image contains non-finite samples
	 * @throws InterruptedException         when the thread has been interrupted
	 */
	PixelBuffer resize(PixelBuffer image) throws InterruptedException;

	/**
	 * Resizes a {@link BufferedImage}. Gray, 16-bit gray, and non-premultiplied RGBA images (8 or 16 bits per
	 * channel) keep their representation. Any other image is converted to {@link BufferedImage#TYPE_4BYTE_ABGR}
	 * first.
	 *
	 * @see #resize(PixelBuffer)
	 */
	BufferedImage resize(BufferedImage image) throws InterruptedException;
}
