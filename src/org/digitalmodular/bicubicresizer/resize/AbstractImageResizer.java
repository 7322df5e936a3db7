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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.bicubicresizer.ProgressEvent;
import org.digitalmodular.bicubicresizer.ProgressListener;
import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.util.SizeInt;

/**
 * Superclass for all algorithms that can resize an image.
 *
 * @author Mark Jeronimus
 */
// Created 2015-08-15
// Changed 2026-10-12 Validation moved to ResizeRequest
@SuppressWarnings("ProtectedField")
public abstract class AbstractImageResizer implements ImageResizer {
	public static final int MIN_QUALITY     = 0;
	public static final int MAX_QUALITY     = 100;
	public static final int DEFAULT_QUALITY = MAX_QUALITY;

	// User data
	protected SizeInt outputSize = null;
	protected int     quality    = DEFAULT_QUALITY;

	protected final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

	// Working data
	protected int srcWidth  = 0;
	protected int srcHeight = 0;
	protected int dstWidth  = 0;
	protected int dstHeight = 0;

	@Override
	public SizeInt getOutputSize() { return outputSize; }

	@Override
	public void setOutputSize(SizeInt outputSize) {
		if (outputSize != null)
			ResizeRequest.validateDimensions(outputSize.getWidth(), outputSize.getHeight(), "Output");

		this.outputSize = outputSize;
	}

	@Override
	public int getQuality() { return quality; }

	@Override
	public void setQuality(int quality) {
		if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
			if (Logger.getGlobal().isLoggable(Level.FINE))
				Logger.getGlobal().fine("Quality " + quality + " out of range, using " + DEFAULT_QUALITY);

			quality = DEFAULT_QUALITY;
		}

		this.quality = quality;
	}

	/**
	 * Validates the image against the output size and fills in the working data.
	 *
	 * @throws IllegalStateException      when no output size has been set
	 * @throws InvalidDimensionException  when a dimension is out of range
	 * @throws InvalidScaleRatioException when a scale factor is out of range
	 */
	protected ResizeRequest calculateDstSize(PixelBuffer image) {
		if (outputSize == null)
			throw new IllegalStateException("outputSize needs to be set first.");

		ResizeRequest request = new ResizeRequest(new SizeInt(image), outputSize);

		srcWidth = request.getSrcWidth();
		srcHeight = request.getSrcHeight();
		dstWidth = request.getDstWidth();
		dstHeight = request.getDstHeight();

		return request;
	}

	@Override
	public final void addProgressListener(ProgressListener progressListener) {
		listeners.add(requireNonNull(progressListener, "progressListener"));
	}

	@Override
	public final void removeProgressListener(ProgressListener progressListener) {
		listeners.remove(progressListener);
	}

	protected void fireProgressUpdated(ProgressEvent e) {
		for (ProgressListener progressListener : listeners)
			progressListener.progressUpdated(e);
	}

	protected void fireProgressCompleted(ProgressEvent e) {
		for (ProgressListener progressListener : listeners)
			progressListener.progressCompleted(e);
	}
}
