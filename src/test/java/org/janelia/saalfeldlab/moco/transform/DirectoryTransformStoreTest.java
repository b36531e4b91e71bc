package org.janelia.saalfeldlab.moco.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.Cursor;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 *
 */
public class DirectoryTransformStoreTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private DirectoryTransformStore store;

	private final Affine3D affine = new Affine3D();

	{
		affine.set(1.01, 0.02, -0.03, 4.5, -0.01, 0.99, 0.04, -3.25, 0.02, -0.02, 1.03, 7);
	}

	@Before
	public void setUp() {

		store = new DirectoryTransformStore(folder.getRoot().toPath().resolve("transform-store"));
	}

	@Test
	public void testAffineRoundTrip() throws Exception {

		assertFalse(store.has(3, RegistrationMode.AFFINE));
		store.put(3, RegistrationMode.AFFINE, FrameTransform.affine(3, 7, RegistrationMode.AFFINE, affine, IterationSchedule.DASH));
		assertTrue(store.has(3, RegistrationMode.AFFINE));
		assertFalse(store.has(3, RegistrationMode.RIGID));

		final FrameTransform read = store.get(3, RegistrationMode.AFFINE);
		assertEquals(3, read.getMovingIndex());
		assertEquals(7, read.getFixedIndex());
		assertEquals(RegistrationMode.AFFINE, read.getMode());
		assertEquals(IterationSchedule.DASH, read.getSchedule());
		assertFalse(read.isDeformable());
		assertArrayEquals(affine.getRowPackedCopy(), read.getAffine().getRowPackedCopy(), 0);

		assertEquals(
				folder.getRoot().toPath().resolve("transform-store").resolve("affine").resolve("frame-0003"),
				store.entryPath(3, RegistrationMode.AFFINE));
	}

	@Test
	public void testDeformableRoundTrip() throws Exception {

		final VoxelGeometry geometry = new VoxelGeometry(
				new double[]{2, 2, 3.27},
				new double[]{-10, 4, 0},
				new double[]{1, 0, 0, 0, -1, 0, 0, 0, 1});
		final DisplacementField forward = FrameTransformTest.constantField(geometry, 0.5, -1, 2);
		final DisplacementField inverse = FrameTransformTest.constantField(geometry, -0.5, 1, -2);
		final Cursor<DoubleType> c = Views.flatIterable(forward.getField()).localizingCursor();
		while (c.hasNext()) {
			c.fwd();
			c.get().set(c.getDoublePosition(0) * 0.1 + c.getDoublePosition(3));
		}

		store.put(1, RegistrationMode.DEFORMABLE, new FrameTransform(1, 2, RegistrationMode.DEFORMABLE, affine, forward, inverse, IterationSchedule.CRUISE));

		final FrameTransform read = store.get(1, RegistrationMode.DEFORMABLE);
		assertTrue(read.isDeformable());
		assertTrue(geometry.equals(read.getForwardField().getGeometry(), 1e-12));
		assertTrue(geometry.equals(read.getInverseField().getGeometry(), 1e-12));
		assertArrayEquals(forward.getField().dimensionsAsLongArray(), read.getForwardField().getField().dimensionsAsLongArray());

		final Cursor<DoubleType> expected = Views.flatIterable(forward.getField()).cursor();
		final Cursor<DoubleType> actual = Views.flatIterable(read.getForwardField().getField()).cursor();
		while (expected.hasNext())
			assertEquals(expected.next().get(), actual.next().get(), 1e-6);

		final double[] x = new double[]{1, 2, 3};
		final double[] y1 = new double[3];
		final double[] y2 = new double[3];
		new FrameTransform(1, 2, RegistrationMode.DEFORMABLE, affine, forward, inverse, IterationSchedule.CRUISE).forward().apply(x, y1);
		read.forward().apply(x, y2);
		assertArrayEquals(y1, y2, 1e-5);
	}

	@Test
	public void testExistsWithoutForce() throws Exception {

		store.put(2, RegistrationMode.RIGID, FrameTransform.affine(2, 4, RegistrationMode.RIGID, affine, IterationSchedule.CRUISE));
		try {
			store.put(2, RegistrationMode.RIGID, FrameTransform.identity(2, RegistrationMode.RIGID, IterationSchedule.CRUISE));
			fail("Existing transform overwritten");
		} catch (final TransformExistsException e) {
			assertEquals(2, e.getFrameIndex());
			assertEquals(RegistrationMode.RIGID, e.getMode());
		}

		/* the stored transform is unchanged */
		assertArrayEquals(affine.getRowPackedCopy(), store.get(2, RegistrationMode.RIGID).getAffine().getRowPackedCopy(), 0);
	}

	@Test
	public void testForceReplaces() throws Exception {

		store.put(2, RegistrationMode.RIGID, FrameTransform.affine(2, 4, RegistrationMode.RIGID, affine, IterationSchedule.CRUISE));
		store.put(2, RegistrationMode.RIGID, FrameTransform.identity(2, RegistrationMode.RIGID, IterationSchedule.DASH), true);

		final FrameTransform read = store.get(2, RegistrationMode.RIGID);
		assertEquals(2, read.getFixedIndex());
		assertEquals(IterationSchedule.DASH, read.getSchedule());
		assertArrayEquals(new Affine3D().getRowPackedCopy(), read.getAffine().getRowPackedCopy(), 0);

		/* no temporary entries are left behind */
		final File[] entries = store.getRoot().resolve("rigid").toFile().listFiles();
		assertEquals(1, entries.length);
		assertEquals("frame-0002", entries[0].getName());
	}

	@Test(expected = TransformNotFoundException.class)
	public void testNotFound() throws Exception {

		store.get(9, RegistrationMode.AFFINE);
	}

	@Test
	public void testRemove() throws Exception {

		store.put(0, RegistrationMode.AFFINE, FrameTransform.affine(0, 4, RegistrationMode.AFFINE, affine, IterationSchedule.CRUISE));
		assertTrue(store.remove(0, RegistrationMode.AFFINE));
		assertFalse(store.has(0, RegistrationMode.AFFINE));
		assertFalse(store.remove(0, RegistrationMode.AFFINE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongKey() throws Exception {

		store.put(1, RegistrationMode.AFFINE, FrameTransform.affine(2, 4, RegistrationMode.AFFINE, affine, IterationSchedule.CRUISE));
	}

	@Test(expected = TransformNotFoundException.class)
	public void testEmptyEntry() throws Exception {

		final Path entry = store.entryPath(5, RegistrationMode.AFFINE);
		Files.createDirectories(entry);
		assertFalse(store.has(5, RegistrationMode.AFFINE));
		store.get(5, RegistrationMode.AFFINE);
	}

	@Test(expected = IOException.class)
	public void testIncompleteAttributes() throws Exception {

		final Path entry = store.entryPath(5, RegistrationMode.AFFINE);
		Files.createDirectories(entry);
		Files.write(
				entry.resolve(DirectoryTransformStore.ATTRIBUTES_FILE),
				"{\"movingIndex\": 5, \"fixedIndex\": 4}".getBytes(StandardCharsets.UTF_8));
		store.get(5, RegistrationMode.AFFINE);
	}

	@Test(expected = IOException.class)
	public void testCorruptAttributes() throws Exception {

		final Path entry = store.entryPath(5, RegistrationMode.AFFINE);
		Files.createDirectories(entry);
		Files.write(entry.resolve(DirectoryTransformStore.ATTRIBUTES_FILE), "{\"movingIndex\": [".getBytes(StandardCharsets.UTF_8));
		store.get(5, RegistrationMode.AFFINE);
	}
}
