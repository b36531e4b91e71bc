package org.janelia.saalfeldlab.moco.compose;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.util.Util;

/**
 * Directory layout of one run:
 *
 * <pre>
 * &lt;root&gt;/split/            3D frames of a 4D input
 * &lt;root&gt;/transform-store/  persisted transforms
 * &lt;root&gt;/transforms/       per frame matrices and warp fields
 * &lt;root&gt;/moco/             corrected frames, 4D volume, manifest, summary
 * </pre>
 */
public class RunLayout {

	public static final String PREFIX = "moco_";
	public static final String VOLUME_4D = PREFIX + "4D";

	private final Path root;

	public RunLayout(final Path root) {

		this.root = root;
	}

	public RunLayout create() throws IOException {

		Files.createDirectories(getSplitDirectory());
		Files.createDirectories(getTransformStoreDirectory());
		Files.createDirectories(getTransformsDirectory());
		Files.createDirectories(getMocoDirectory());
		return this;
	}

	public Path getRoot() {

		return root;
	}

	public Path getSplitDirectory() {

		return root.resolve("split");
	}

	public Path getTransformStoreDirectory() {

		return root.resolve("transform-store");
	}

	public Path getTransformsDirectory() {

		return root.resolve("transforms");
	}

	public Path getMocoDirectory() {

		return root.resolve("moco");
	}

	public Path getCorrectedFrame(final String name) {

		return getMocoDirectory().resolve(PREFIX + name + MetaImage.HEADER_EXTENSION);
	}

	public Path getCorrectedVolume() {

		return getMocoDirectory().resolve(VOLUME_4D + MetaImage.HEADER_EXTENSION);
	}

	public Path getManifest() {

		return getMocoDirectory().resolve(VOLUME_4D + ".json");
	}

	public Path getRunSummary() {

		return getMocoDirectory().resolve("run_summary.json");
	}

	/**
	 * @return e.g. <code>transforms/frame-0003-to-0004_affine.mat</code>
	 */
	public Path getTransformArtifact(final int movingIndex, final int fixedIndex, final String suffix) {

		return getTransformsDirectory().resolve(
				Util.frameLabel(movingIndex) + "-to-" + String.format("%04d", fixedIndex) + suffix);
	}
}
