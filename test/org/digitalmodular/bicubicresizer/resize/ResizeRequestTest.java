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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import org.digitalmodular.bicubicresizer.util.SizeInt;

public class ResizeRequestTest {
	@Test
	void acceptsValidRequest() {
		ResizeRequest request = new ResizeRequest(640, 480, 1920, 1080);

		assertThat(request.getSrcSize()).isEqualTo(new SizeInt(640, 480));
		assertThat(request.getDstSize()).isEqualTo(new SizeInt(1920, 1080));
		assertThat(request.getWidthScaleFactor()).isEqualTo(3.0);
		assertThat(request.getHeightScaleFactor()).isEqualTo(2.25);
	}

	@Test
	void acceptsScaleFactorLimits() {
		assertThat(new ResizeRequest(10, 10, 160, 160).getWidthScaleFactor()).isEqualTo(16.0);
		assertThat(new ResizeRequest(160, 160, 10, 10).getHeightScaleFactor()).isEqualTo(1 / 16.0);
		// Axes are independent
		new ResizeRequest(10, 160, 160, 10);
	}

	@Test
	void rejectsZeroDimension() {
		assertThatThrownBy(() -> new ResizeRequest(100, 100, 0, 100))
				.isInstanceOf(InvalidDimensionException.class)
				.hasMessageContaining("Target");
		assertThatThrownBy(() -> new ResizeRequest(0, 100, 10, 100))
				.isInstanceOf(InvalidDimensionException.class)
				.hasMessageContaining("Source");
	}

	@Test
	void rejectsNegativeAndOversizedDimensions() {
		assertThatThrownBy(() -> new ResizeRequest(100, 100, 100, -5))
				.isInstanceOf(InvalidDimensionException.class);
		assertThatThrownBy(() -> new ResizeRequest(65536, 100, 65535, 100))
				.isInstanceOf(InvalidDimensionException.class);
		assertThatThrownBy(() -> ResizeRequest.validateDimensions(1, 65536, "Test"))
				.isInstanceOf(InvalidDimensionException.class);

		ResizeRequest.validateDimensions(65535, 65535, "Test");
	}

	@Test
	void rejectsExcessiveEnlargement() {
		assertThatThrownBy(() -> new ResizeRequest(10, 10, 170, 170))
				.isInstanceOf(InvalidScaleRatioException.class)
				.hasMessageContaining("Width");
		assertThatThrownBy(() -> new ResizeRequest(10, 10, 10, 161))
				.isInstanceOf(InvalidScaleRatioException.class)
				.hasMessageContaining("Height");
	}

	@Test
	void rejectsExcessiveReduction() {
		assertThatThrownBy(() -> new ResizeRequest(170, 10, 10, 10))
				.isInstanceOf(InvalidScaleRatioException.class);
	}

	@Test
	void dimensionErrorsAreIllegalArguments() {
		assertThatThrownBy(() -> new ResizeRequest(1, 1, 0, 0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ResizeRequest(1, 1, 17, 1))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void valueSemantics() {
		assertThat(new ResizeRequest(4, 4, 8, 8))
				.isEqualTo(new ResizeRequest(new SizeInt(4, 4), new SizeInt(8, 8)))
				.hasSameHashCodeAs(new ResizeRequest(4, 4, 8, 8))
				.isNotEqualTo(new ResizeRequest(4, 4, 8, 7));
		assertThat(new ResizeRequest(4, 4, 8, 8)).hasToString("4x4 -> 8x8");
	}
}
