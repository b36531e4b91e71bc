package org.janelia.saalfeldlab.moco.volume;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Discovers the frames of a dynamic acquisition.
 */
public interface VolumeSetLoader {

	/**
	 * @param input a directory of 3D volumes or a single 4D volume
	 * @return the frames in acquisition order
	 */
	public VolumeSet load(final Path input) throws IOException, DimensionMismatchException;
}
