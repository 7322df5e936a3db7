/*
 * This file has no licence. Replace this class with your own,
 * with a library class (e.g. Size2D from javafx), or keep
 * using it as-is.
 */
package org.digitalmodular.bicubicresizer.util;

import java.awt.image.BufferedImage;

import org.digitalmodular.bicubicresizer.image.PixelBuffer;

public class SizeInt {
	private final int width;
	private final int height;

	public SizeInt(int width, int height) {
		this.width = width;
		this.height = height;
	}

	public SizeInt(BufferedImage img) {
		width = img.getWidth();
		height = img.getHeight();
	}

	public SizeInt(PixelBuffer buffer) {
		width = buffer.getWidth();
		height = buffer.getHeight();
	}

	public int getWidth()  { return width; }

	public int getHeight() { return height; }

	/** Width times height, without overflow. */
	public long getArea()  { return (long)width * height; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SizeInt)) return false;

		SizeInt other = (SizeInt)o;

		return width == other.width &&
		       height == other.height;
	}

	@Override
	public int hashCode() {
		int hash = 0x4C1DF00D;
		hash *= 0x01000193;
		hash ^= width;
		hash *= 0x01000193;
		hash ^= height;
		return hash;
	}

	@Override
	public String toString() {
		return width + "x" + height;
	}
}
