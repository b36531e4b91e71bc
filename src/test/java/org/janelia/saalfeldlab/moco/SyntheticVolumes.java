package org.janelia.saalfeldlab.moco;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.saalfeldlab.moco.volume.DimensionMismatchException;
import org.janelia.saalfeldlab.moco.volume.Frame;
import org.janelia.saalfeldlab.moco.volume.VolumeSet;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Small synthetic frames for tests.
 */
public class SyntheticVolumes {

	private SyntheticVolumes() {}

	public static ArrayImg<FloatType, FloatArray> noise(final long seed, final long... dimensions) {

		final Random rnd = new Random(seed);
		final ArrayImg<FloatType, FloatArray> img = ArrayImgs.floats(dimensions);
		for (final FloatType t : img)
			t.set(rnd.nextFloat() * 100);
		return img;
	}

	/**
	 * Gaussian blob of amplitude 100 centered at <code>center</code> voxel
	 * coordinates.
	 */
	public static ArrayImg<FloatType, FloatArray> blob(final double[] center, final double sigma, final long... dimensions) {

		final ArrayImg<FloatType, FloatArray> img = ArrayImgs.floats(dimensions);
		final Cursor<FloatType> c = img.localizingCursor();
		while (c.hasNext()) {
			c.fwd();
			double r2 = 0;
			for (int d = 0; d < 3; ++d) {
				final double x = c.getDoublePosition(d) - center[d];
				r2 += x * x;
			}
			c.get().setReal(100 * Math.exp(-r2 / (2 * sigma * sigma)));
		}
		return img;
	}

	public static VolumeSet noiseSeries(final int numFrames, final long... dimensions) throws DimensionMismatchException {

		final List<Frame> frames = new ArrayList<>();
		for (int i = 0; i < numFrames; ++i)
			frames.add(new Frame(i, noise(i, dimensions), VoxelGeometry.unit(), null));
		return new VolumeSet(frames);
	}
}
