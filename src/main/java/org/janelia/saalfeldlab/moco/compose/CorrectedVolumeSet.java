package org.janelia.saalfeldlab.moco.compose;

import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.moco.volume.Frame;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Motion corrected frames on the reference grid and their 4D stack.
 * Frames that failed to register are excluded and listed in the manifest.
 */
public class CorrectedVolumeSet {

	private final Frame[] frames;
	private final RandomAccessibleInterval<FloatType> volume;
	private final VolumeManifest manifest;

	/**
	 * @param frames corrected frames by input index, null for excluded frames
	 * @param volume 4D stack of the corrected frames in index order
	 * @param manifest
	 */
	public CorrectedVolumeSet(
			final Frame[] frames,
			final RandomAccessibleInterval<FloatType> volume,
			final VolumeManifest manifest) {

		this.frames = frames.clone();
		this.volume = volume;
		this.manifest = manifest;
	}

	public int size() {

		return frames.length;
	}

	public boolean isIncluded(final int index) {

		return frames[index] != null;
	}

	/**
	 * @return the corrected frame, null if excluded
	 */
	public Frame getFrame(final int index) {

		return frames[index];
	}

	/**
	 * @return included frames in index order, i.e. the time points of
	 *     {@link #getVolume()}
	 */
	public List<Frame> getIncludedFrames() {

		final List<Frame> included = new ArrayList<>();
		for (final Frame frame : frames)
			if (frame != null)
				included.add(frame);
		return included;
	}

	public int[] getExcludedIndices() {

		final List<Integer> excluded = new ArrayList<>();
		for (int i = 0; i < frames.length; ++i)
			if (frames[i] == null)
				excluded.add(i);
		return excluded.stream().mapToInt(Integer::intValue).toArray();
	}

	public RandomAccessibleInterval<FloatType> getVolume() {

		return volume;
	}

	public VolumeManifest getManifest() {

		return manifest;
	}
}
