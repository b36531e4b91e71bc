package org.janelia.saalfeldlab.moco.volume;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, read-only collection of the frames of one dynamic acquisition.
 * Frame indices are contiguous from 0 and all frames share one voxel grid.
 */
public class VolumeSet implements Iterable<Frame> {

	private final List<Frame> frames;

	public VolumeSet(final List<Frame> frames) throws DimensionMismatchException {

		if (frames.size() < 2)
			throw new IllegalArgumentException("A dynamic series needs at least two frames, got " + frames.size());

		final long[] dimensions = frames.get(0).dimensions();
		for (int i = 0; i < frames.size(); ++i) {
			final Frame frame = frames.get(i);
			if (frame.getIndex() != i)
				throw new IllegalArgumentException("Frame at position " + i + " has index " + frame.getIndex());
			if (!Arrays.equals(dimensions, frame.dimensions()))
				throw new DimensionMismatchException(frame.toString(), dimensions, frame.dimensions());
		}

		this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
	}

	public int size() {

		return frames.size();
	}

	public Frame get(final int index) {

		return frames.get(index);
	}

	public int lastIndex() {

		return frames.size() - 1;
	}

	public long[] dimensions() {

		return frames.get(0).dimensions();
	}

	public List<Frame> getFrames() {

		return frames;
	}

	@Override
	public Iterator<Frame> iterator() {

		return frames.iterator();
	}
}
