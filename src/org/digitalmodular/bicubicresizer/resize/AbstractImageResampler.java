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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.digitalmodular.bicubicresizer.ImageUtilities;
import org.digitalmodular.bicubicresizer.image.PixelBuffer;
import org.digitalmodular.bicubicresizer.resize.filter.MitchellNetravaliResamplingCurve;
import org.digitalmodular.bicubicresizer.resize.filter.ResamplingCurve;

/**
 * Superclass for all algorithms that can resize an image using resampling filters and parallel processing.
 *
 * @author Mark Jeronimus
 */
// Created 2015-08-22
// Changed 2026-10-12 Workers are independent row strips, no dependency queue needed
// Changed 2026-10-19 runWorkers returns only after every worker has stopped
abstract class AbstractImageResampler extends AbstractImageResizer implements ImageResampler {
	protected static final int AVAILABLE_PROCESSORS = Runtime.getRuntime().availableProcessors();

	private final BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<>();
	private final ThreadPoolExecutor      executor  = new ThreadPoolExecutor(
			AVAILABLE_PROCESSORS, AVAILABLE_PROCESSORS, 60L, TimeUnit.MILLISECONDS, workQueue);

	protected ResamplingCurve filter     = MitchellNetravaliResamplingCurve.INSTANCE;
	protected int             numThreads = 0;

	protected AbstractImageResampler() {
		executor.allowCoreThreadTimeOut(true);
	}

	@Override
	public ResamplingCurve getFilter() { return filter; }

	@Override
	public void setFilter(ResamplingCurve filter) {
		requireNonNull(filter, "filter");
		if (filter.getRadius() > KernelMath.KERNEL_SIZE / 2)
			throw new IllegalArgumentException(
					"Filter radius " + filter.getRadius() + " exceeds the kernel: " + filter.getName());

		this.filter = filter;
	}

	@Override
	public int getNumThreads() { return numThreads; }

	@Override
	public void setNumThreads(int numThreads) {
		if (numThreads < 0)
			throw new IllegalArgumentException("numThreads can't be negative: " + numThreads);
		this.numThreads = numThreads;
	}

	protected int getEffectiveNumThreads() {
		return numThreads == 0 ? AVAILABLE_PROCESSORS : numThreads;
	}

	/**
	 * Returns true if the image can be resampled without conversion.
	 *
	 * @see ImageUtilities#getPixelFormat(BufferedImage)
	 */
	public boolean imageIsCompatible(BufferedImage image) {
		return ImageUtilities.getPixelFormat(image) != null;
	}

	/**
	 * Returns an image that is compatible with this resizing algorithm (for a description, see
	 * {@link #imageIsCompatible(BufferedImage) imageIsCompatible()}).
	 * <p>
	 * If the image is already compatible, then it's returned unchanged.
	 */
	public BufferedImage makeImageCompatible(BufferedImage image) {
		if (imageIsCompatible(image))
			return image;

		BufferedImage img = ImageUtilities.convertToABGR(image);

		if (Logger.getGlobal().isLoggable(Level.FINEST))
			Logger.getGlobal().finest("pre-converted img: " + ImageUtilities.analyzeImage(img));

		return img;
	}

	@Override
	public BufferedImage resize(BufferedImage image) throws InterruptedException {
		requireNonNull(image, "image");

		if (Logger.getGlobal().isLoggable(Level.FINEST))
			Logger.getGlobal().finest("input img: " + ImageUtilities.analyzeImage(image));

		PixelBuffer src = ImageUtilities.toPixelBuffer(makeImageCompatible(image));
		PixelBuffer dst = resize(src);
		return ImageUtilities.toBufferedImage(dst);
	}

	/**
	 * Runs independent workers on the thread pool and waits for all of them. When one fails, the others are
	 * cancelled and the failure is rethrown. Either way, this returns only after no worker is running anymore.
	 */
	protected void runWorkers(List<Callable<Void>> workers) throws InterruptedException {
		CompletionService<Void> service  = new ExecutorCompletionService<>(executor);
		CountDownLatch          finished = new CountDownLatch(workers.size());

		List<TrackedWorker> trackedWorkers = new ArrayList<>(workers.size());
		for (Callable<Void> worker : workers)
			trackedWorkers.add(new TrackedWorker(worker, finished));

		// Keep track of which workers there are in the service
		Set<Future<Void>> runningWorkers = new HashSet<>(workers.size());
		try {
			for (TrackedWorker worker : trackedWorkers)
				runningWorkers.add(service.submit(worker));

			while (!runningWorkers.isEmpty()) {
				// Wait for next completed worker
				Future<Void> future = service.take(); // Blocks
				try {
					future.get(); // Doesn't block anymore, but required to obtain the exceptions.
				} finally {
					runningWorkers.remove(future);
				}
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw ex;
		} catch (ExecutionException ex) {
			Throwable th = ex.getCause();
			// Check if it is one of the unchecked throwables
			if (th instanceof RuntimeException) {
				throw (RuntimeException)th;
			} else if (th instanceof Error) {
				//noinspection ProhibitedExceptionThrown
				throw (Error)th;
			} else if (th instanceof InterruptedException) {
				throw (InterruptedException)th;
			} else {
				throw new AssertionError("Unhandled checked exception", th);
			}
		} finally {
			runningWorkers.forEach(future -> future.cancel(true));
			trackedWorkers.forEach(TrackedWorker::abandon);
			awaitUninterruptibly(finished);
		}
	}

	private static void awaitUninterruptibly(CountDownLatch latch) {
		boolean interrupted = false;
		while (true) {
			try {
				latch.await();
				break;
			} catch (InterruptedException ignored) {
				interrupted = true;
			}
		}

		if (interrupted)
			Thread.currentThread().interrupt();
	}

	/**
	 * Counts down the latch when the worker stops. A worker that hasn't started when it gets abandoned never starts,
	 * and is counted down immediately.
	 */
	private static final class TrackedWorker implements Callable<Void> {
		private final Callable<Void> worker;
		private final CountDownLatch finished;
		private final AtomicBoolean  claimed = new AtomicBoolean();

		private TrackedWorker(Callable<Void> worker, CountDownLatch finished) {
			this.worker = worker;
			this.finished = finished;
		}

		@Override
		public Void call() throws Exception {
			if (!claimed.compareAndSet(false, true))
				return null;

			try {
				return worker.call();
			} finally {
				finished.countDown();
			}
		}

		void abandon() {
			if (claimed.compareAndSet(false, true))
				finished.countDown();
		}
	}
}
