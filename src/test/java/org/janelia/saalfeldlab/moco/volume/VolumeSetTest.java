package org.janelia.saalfeldlab.moco.volume;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.janelia.saalfeldlab.moco.SyntheticVolumes;
import org.janelia.saalfeldlab.moco.transform.Affine3D;
import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;

/**
 *
 */
public class VolumeSetTest {

	@Test
	public void testDimensionMismatch() {

		final Frame a = new Frame(0, ArrayImgs.floats(4, 4, 4), VoxelGeometry.unit(), null);
		final Frame b = new Frame(1, ArrayImgs.floats(4, 4, 3), VoxelGeometry.unit(), null);
		try {
			new VolumeSet(Arrays.asList(a, b));
			fail("Mismatching frames accepted");
		} catch (final DimensionMismatchException e) {
			assertArrayEquals(new long[]{4, 4, 4}, e.getExpected());
			assertArrayEquals(new long[]{4, 4, 3}, e.getActual());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSingleFrame() throws DimensionMismatchException {

		new VolumeSet(Collections.singletonList(new Frame(0, ArrayImgs.floats(2, 2, 2), VoxelGeometry.unit(), null)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonContiguousIndices() throws DimensionMismatchException {

		new VolumeSet(Arrays.asList(
				new Frame(0, ArrayImgs.floats(2, 2, 2), VoxelGeometry.unit(), null),
				new Frame(2, ArrayImgs.floats(2, 2, 2), VoxelGeometry.unit(), null)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void test2DFrame() {

		new Frame(0, ArrayImgs.floats(2, 2), VoxelGeometry.unit(), null);
	}

	@Test
	public void testIteration() throws DimensionMismatchException {

		final VolumeSet volumes = SyntheticVolumes.noiseSeries(4, 3, 3, 3);
		int i = 0;
		for (final Frame frame : volumes)
			assertEquals(i++, frame.getIndex());
		assertEquals(4, i);
		assertEquals("vol0002", volumes.get(2).getName());
	}

	@Test
	public void testVoxelToPhysical() {

		final VoxelGeometry geometry = new VoxelGeometry(
				new double[]{2, 3, 4},
				new double[]{10, 20, 30},
				new double[]{
						0, 1, 0,
						-1, 0, 0,
						0, 0, 1});
		final Affine3D v2p = geometry.voxelToPhysical();

		final double[] physical = new double[3];
		v2p.apply(new double[]{1, 1, 1}, physical);
		assertArrayEquals(new double[]{13, 18, 34}, physical, 1e-12);

		final double[] voxel = new double[3];
		geometry.physicalToVoxel().apply(physical, voxel);
		assertArrayEquals(new double[]{1, 1, 1}, voxel, 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveSpacing() {

		new VoxelGeometry(new double[]{1, 0, 1}, new double[3]);
	}
}
