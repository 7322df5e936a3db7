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
package org.digitalmodular.bicubicresizer.resize.filter;

/**
 * @author Mark Jeronimus
 */
// Created 2015-08-14
public interface ResamplingCurve {
	/**
	 * Returns a short, friendly name of the curve, such as one that you would use in a ComboBox.
	 *
	 * @return the name, such as <tt>"Mitchell"</tt>
	 */
	String getName();

	/**
	 * Returns the maximum number of fractional pixels in each direction that are needed to calculate the weight
	 * values for the resampled pixel.
	 * <p>
	 * The curve is defined within the closed range [-radius, radius] and zero outside. A cubic curve needs up to two
	 * whole pixels ahead and two pixels behind, so {@code radius = 2.0}.
	 *
	 * @return the radius in fractional pixels
	 */
	double getRadius();

	/**
	 * Calculates and returns the value of the curve at the specified fractional pixel position.
	 * <p>
	 * Any real value is accepted. The weights of all integer positions offset by the same fraction should sum to
	 * {@code 1.0} to prevent brightening or darkening the image.
	 *
	 * @param x the fractional pixel position
	 * @return the value of the curve at position {@code x}
	 */
	double apply(double x);
}
