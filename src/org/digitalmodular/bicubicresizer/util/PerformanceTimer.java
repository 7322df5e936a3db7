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
package org.digitalmodular.bicubicresizer.util;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the duration of consecutive phases of some work and logs them to the global logger at {@link Level#FINE}.
 *
 * @author Mark Jeronimus
 */
// Created 2015-09-08
// Changed 2026-10-12 Logs through java.util.logging instead of printing to stdout
public class PerformanceTimer {
	private static final String FORMAT = "%7.2f";

	private final List<Long>   durations    = new ArrayList<>();
	private final List<String> descriptions = new ArrayList<>();

	private long startTime;
	private long lastTime;
	private int  longestDescription;

	public void reset() {
		durations.clear();
		descriptions.clear();
	}

	public void start() {
		startTime = System.nanoTime();
		lastTime = startTime;
		longestDescription = 0;
	}

	public void record(String description) {
		long time = System.nanoTime();
		durations.add(time - lastTime);
		descriptions.add(description);
		longestDescription = Math.max(longestDescription, description.length());
		lastTime = time;
	}

	public int getNumRecords() { return durations.size(); }

	/** Total duration from {@link #start()} to the last {@link #record(String)}, in nanoseconds. */
	public long getTotalNanos() { return lastTime - startTime; }

	/**
	 * Logs the durations of each record and the amount of work performed per millisecond in each step, followed by
	 * the total.
	 */
	public void logResults(double workload) {
		Logger logger = Logger.getGlobal();
		if (!logger.isLoggable(Level.FINE))
			return;

		String formatString = "%-" + longestDescription + "s " + FORMAT + " ms (%,9.2f/ms)";
		for (int i = 0; i < durations.size(); i++) {
			long   duration    = durations.get(i);
			String description = descriptions.get(i);
			logger.fine(String.format(formatString, description, duration / 1e6, workload * 1e6 / duration));
		}

		logger.fine(String.format("%-" + longestDescription + "s " + FORMAT + " ms",
		                          "Total", getTotalNanos() / 1e6));
	}
}
