package org.janelia.saalfeldlab.moco.volume;

import java.nio.file.Path;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * One 3D volume of a dynamic series.
 */
public class Frame {

	private final int index;
	private final RandomAccessibleInterval<FloatType> voxels;
	private final VoxelGeometry geometry;
	private final Path source;

	public Frame(
			final int index,
			final RandomAccessibleInterval<FloatType> voxels,
			final VoxelGeometry geometry,
			final Path source) {

		if (index < 0)
			throw new IllegalArgumentException("Frame index must not be negative: " + index);
		if (voxels.numDimensions() != 3)
			throw new IllegalArgumentException("Frame " + index + " is not 3D but " + voxels.numDimensions() + "D");

		this.index = index;
		this.voxels = voxels;
		this.geometry = geometry;
		this.source = source;
	}

	public int getIndex() {

		return index;
	}

	public RandomAccessibleInterval<FloatType> getVoxels() {

		return voxels;
	}

	public VoxelGeometry getGeometry() {

		return geometry;
	}

	public Path getSource() {

		return source;
	}

	public long[] dimensions() {

		return voxels.dimensionsAsLongArray();
	}

	/**
	 * @return the source file name without MetaImage extension, or a name
	 * derived from the index for in-memory frames
	 */
	public String getName() {

		if (source == null)
			return String.format("vol%04d", index);

		final String fileName = source.getFileName().toString();
		final int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	@Override
	public String toString() {

		return "frame " + index + " (" + getName() + ")";
	}
}
