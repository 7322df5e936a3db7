package org.digitalmodular.bicubicresizer.resize;

import org.digitalmodular.bicubicresizer.resize.filter.ResamplingCurve;
import static org.digitalmodular.bicubicresizer.resize.KernelMath.KERNEL_SIZE;
import static org.digitalmodular.bicubicresizer.resize.KernelMath.KernelBounds;

/**
 * @author Mark Jeronimus
 */
// Created 2017-07-18 Extracted from AbstractImageResampler
// Changed 2026-10-12 Fixed 4-tap kernel with pixel-center mapping
public enum SamplingDataCalculator {
	;

	/**
	 * Source indices and weights of every destination sample along one axis. Because the kernel is separable, the
	 * same table serves every row (or column) of the destination.
	 */
	public static final class SamplingData {
		private final int[][]    indices;
		private final double[][] weights;

		private SamplingData(int[][] indices, double[][] weights) {
			this.indices = indices;
			this.weights = weights;
		}

		public int getDstSize() { return indices.length; }

		/**
		 * The input sample indices, already clamped to the image. {@link KernelMath#KERNEL_SIZE} indices for each
		 * output sample.
		 */
		public int[][] getIndices() { return indices; }

		/**
		 * The input sample weights. {@link KernelMath#KERNEL_SIZE} weights for each output sample. Not normalized.
		 */
		public double[][] getWeights() { return weights; }
	}

	/**
	 * Pre-calculates the sampling of one axis. Destination sample {@code i} is centered on source position
	 * {@code (i + 0.5) * srcSize / dstSize}.
	 *
	 * @throws InvalidCoordinateException when a sample center falls outside the source, which valid sizes never cause
	 */
	public static SamplingData createSubSampling(ResamplingCurve filter, int srcSize, int dstSize) {
		int[][]    indices = new int[dstSize][KERNEL_SIZE];
		double[][] weights = new double[dstSize][KERNEL_SIZE];

		double ratio = srcSize / (double)dstSize;

		for (int i = 0; i < dstSize; i++) {
			double       center   = (i + 0.5) * ratio;
			KernelBounds bounds   = KernelMath.kernelBounds(center, srcSize);
			double       fraction = center - Math.floor(center);

			for (int j = bounds.getStart(); j < bounds.getEnd(); j++)
				indices[i][j - bounds.getStart()] = KernelMath.safeIndex(j, srcSize);

			KernelMath.calculateWeights(filter, fraction, weights[i]);
		}

		return new SamplingData(indices, weights);
	}
}
