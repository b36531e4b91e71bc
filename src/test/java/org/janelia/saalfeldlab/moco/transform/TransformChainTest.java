package org.janelia.saalfeldlab.moco.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;
import org.junit.Test;

/**
 *
 */
public class TransformChainTest {

	private final Affine3D t3 = new Affine3D();
	private final Affine3D t2 = new Affine3D();
	private final Affine3D t1 = new Affine3D();

	{
		t3.rotate(0, 0.05);
		t3.translate(1, 0, 0);
		t2.scale(1.02);
		t2.translate(0, -2, 0.5);
		t1.rotate(2, -0.1);
	}

	private static FrameTransform link(final int moving, final int fixed, final Affine3D affine) {

		return FrameTransform.affine(moving, fixed, RegistrationMode.AFFINE, affine, IterationSchedule.CRUISE);
	}

	private TransformChain rolling() {

		final TransformChain chain = new TransformChain(5, 4);
		chain.link(link(3, 4, t3));
		chain.link(link(2, 3, t2));
		chain.link(link(1, 2, t1));
		return chain;
	}

	@Test
	public void testPath() {

		final TransformChain chain = rolling();
		assertArrayEquals(new int[]{1, 2, 3, 4}, chain.path(1));
		assertArrayEquals(new int[]{4}, chain.path(4));
		assertTrue(chain.isLinked(2));
		assertFalse(chain.isLinked(0));
		assertEquals(5, chain.size());
	}

	@Test
	public void testComposition() {

		final TransformChain chain = rolling();
		final double[] x = new double[]{12, -7, 3};

		/* reference into frame 1: t1(t2(t3(x))) */
		final double[] y = new double[3];
		t3.apply(x, y);
		t2.apply(y, y);
		t1.apply(y, y);

		final double[] z = new double[3];
		chain.affine(1).apply(x, z);
		assertArrayEquals(y, z, 1e-9);

		chain.forward(1).apply(x, z);
		assertArrayEquals(y, z, 1e-9);

		/* the reference maps onto itself */
		chain.affine(4).apply(x, z);
		assertArrayEquals(x, z, 0);
	}

	@Test
	public void testDeformableLink() {

		final VoxelGeometry geometry = new VoxelGeometry(new double[]{4, 4, 4}, new double[]{-12, -12, -12});
		final FrameTransform deformable = new FrameTransform(
				3,
				4,
				RegistrationMode.DEFORMABLE,
				t3,
				FrameTransformTest.constantField(geometry, 0.5, 0, -1),
				FrameTransformTest.constantField(geometry, -0.5, 0, 1),
				IterationSchedule.CRUISE);

		final TransformChain chain = new TransformChain(5, 4);
		chain.link(deformable);
		chain.link(link(2, 3, t2));

		assertFalse(chain.isAffine(2));
		assertTrue(chain.forward(2) instanceof TransformSequence);

		final double[] x = new double[]{1, 2, 3};
		final double[] y = new double[3];
		deformable.forward().apply(x, y);
		t2.apply(y, y);

		final double[] z = new double[3];
		chain.forward(2).apply(x, z);
		assertArrayEquals(y, z, 1e-9);
	}

	@Test(expected = IllegalStateException.class)
	public void testDeformableHasNoAffine() {

		final VoxelGeometry geometry = VoxelGeometry.unit();
		final TransformChain chain = new TransformChain(3, 2);
		chain.link(new FrameTransform(
				1,
				2,
				RegistrationMode.DEFORMABLE,
				t1,
				FrameTransformTest.constantField(geometry, 0, 0, 0),
				FrameTransformTest.constantField(geometry, 0, 0, 0),
				IterationSchedule.CRUISE));
		chain.affine(1);
	}

	@Test(expected = IllegalStateException.class)
	public void testUnlinked() {

		rolling().path(0);
	}

	@Test(expected = IllegalStateException.class)
	public void testCycle() {

		final TransformChain chain = new TransformChain(3, 2);
		chain.link(link(0, 1, t1));
		chain.link(link(1, 0, t2));
		chain.path(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testReferenceCannotBeLinked() {

		new TransformChain(3, 2).link(link(2, 1, t1));
	}
}
