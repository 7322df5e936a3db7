/*
 * This file has no licence. Replace this class with your own,
 * with a library class, or keep using it as-is.
 */
package org.digitalmodular.bicubicresizer;

/**
 * Progress of a resize, counted in destination pixels. A total of {@code -1} means the amount of work is not known
 * yet.
 */
public class ProgressEvent {
	private final long progress;
	private final long total;

	public ProgressEvent(long progress, long total) {
		this.progress = progress;
		this.total = total;
	}

	public long getProgress() { return progress; }

	public long getTotal()    { return total; }

	public boolean isIndeterminate() { return total < 0; }

	@Override
	public String toString() {
		return getClass().getSimpleName() + '[' + progress + '/' + total + ']';
	}
}
