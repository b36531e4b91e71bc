package org.janelia.saalfeldlab.moco.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.Test;

import net.imglib2.RealPoint;

/**
 *
 */
public class Affine3DTest {

	@Test
	public void testRotationScaleTranslation() {

		final Affine3D affine = new Affine3D();
		affine.rotate(2, Math.PI / 2);
		affine.scale(2);
		affine.translate(1, 0, -1);

		/* x axis onto y axis, then doubled, then shifted */
		final double[] y = new double[3];
		affine.apply(new double[]{1, 0, 0}, y);
		assertArrayEquals(new double[]{1, 2, -1}, y, 1e-12);

		affine.apply(new double[]{0, 0, 1}, y);
		assertArrayEquals(new double[]{1, 0, 1}, y, 1e-12);
	}

	@Test
	public void testRotationAxes() {

		final double[] y = new double[3];

		new Affine3D().rotate(0, Math.PI / 2).apply(new double[]{0, 1, 0}, y);
		assertArrayEquals(new double[]{0, 0, 1}, y, 1e-12);

		new Affine3D().rotate(1, Math.PI / 2).apply(new double[]{0, 0, 1}, y);
		assertArrayEquals(new double[]{1, 0, 0}, y, 1e-12);
	}

	@Test
	public void testConcatenation() {

		final Affine3D a = Affine3D.rowPacked(1, 0, 0, 1, 0, 2, 0, 0, 0, 0, 1, 0);
		final Affine3D b = new Affine3D().rotate(1, 0.3);

		final double[] x = new double[]{3, -1, 2};
		final double[] expected = new double[3];
		a.apply(x, expected);
		b.apply(expected, expected);

		final double[] y = new double[3];
		a.copy().preConcatenate(b).apply(x, y);
		assertArrayEquals(expected, y, 1e-12);

		b.copy().concatenate(a).apply(x, y);
		assertArrayEquals(expected, y, 1e-12);
	}

	@Test
	public void testInverse() {

		final Affine3D affine = Affine3D.rowPacked(1.1, 0.2, 0, 4, -0.1, 0.9, 0.05, -2, 0, 0.3, 1.2, 7);
		final double[] x = new double[]{5, 6, -7};
		final double[] y = new double[3];
		final double[] z = new double[3];
		affine.apply(x, y);
		affine.inverse().apply(y, z);
		assertArrayEquals(x, z, 1e-9);

		assertTrue(affine.copy().preConcatenate(affine.inverse()).isIdentity(1e-9));
		assertFalse(affine.isIdentity(1e-12));
	}

	@Test(expected = SingularMatrixException.class)
	public void testSingular() {

		Affine3D.rowPacked(1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1, 0).inverse();
	}

	@Test
	public void testAccessors() {

		final double[] rowPacked = new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
		final Affine3D affine = Affine3D.rowPacked(rowPacked);
		assertArrayEquals(rowPacked, affine.getRowPackedCopy(), 0);
		assertEquals(7, affine.get(1, 2), 0);
		assertArrayEquals(new double[]{4, 8, 12}, affine.getTranslation(), 0);

		affine.setTranslation(0, 0, 0);
		affine.set(-1, 0, 0);
		assertArrayEquals(new double[]{-1, 2, 3, 0, 5, 6, 7, 0, 9, 10, 11, 0}, affine.getRowPackedCopy(), 0);

		final Affine3D copy = affine.copy();
		affine.set(100, 2, 2);
		assertEquals(11, copy.get(2, 2), 0);
		assertEquals(1, copy.get(3, 3), 0);
	}

	@Test
	public void testRealPoint() {

		final Affine3D affine = new Affine3D().translate(1, 2, 3);
		final RealPoint point = new RealPoint(3);
		affine.apply(new RealPoint(1, 1, 1), point);
		assertArrayEquals(new double[]{2, 3, 4}, point.positionAsDoubleArray(), 0);
	}

	@Test
	public void testSequence() {

		final Affine3D a = new Affine3D().translate(1, 0, 0);
		final Affine3D b = new Affine3D().scale(3);
		final double[] y = new double[3];

		new TransformSequence().add(a).add(b).apply(new double[]{1, 1, 1}, y);
		assertArrayEquals(new double[]{6, 3, 3}, y, 1e-12);

		new TransformSequence().apply(new double[]{1, 1, 1}, y);
		assertArrayEquals(new double[]{1, 1, 1}, y, 0);
	}
}
