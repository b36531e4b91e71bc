package org.janelia.saalfeldlab.moco.volume;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.saalfeldlab.moco.SyntheticVolumes;
import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 *
 */
public class MetaImageVolumeSetLoaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path input;
	private Path split;

	@Before
	public void setUp() throws IOException {

		input = folder.newFolder("pet").toPath();
		split = folder.getRoot().toPath().resolve("split");
	}

	private void writeConstant(final String name, final float value, final long... dimensions) throws IOException {

		final ArrayImg<FloatType, FloatArray> img = ArrayImgs.floats(dimensions);
		for (final FloatType t : img)
			t.set(value);
		MetaImage.write(input.resolve(name), MetaImage.create(img, VoxelGeometry.unit()));
	}

	@Test
	public void testNaturalOrder() throws IOException, DimensionMismatchException {

		writeConstant("frame10.mhd", 10, 4, 4, 4);
		writeConstant("frame2.mhd", 2, 4, 4, 4);
		writeConstant("frame1.mhd", 1, 4, 4, 4);

		final VolumeSet volumes = new MetaImageVolumeSetLoader(split).load(input);

		assertEquals(3, volumes.size());
		assertEquals("frame1", volumes.get(0).getName());
		assertEquals("frame2", volumes.get(1).getName());
		assertEquals("frame10", volumes.get(2).getName());
		assertEquals(10, Views.flatIterable(volumes.get(2).getVoxels()).firstElement().get(), 0);
		assertEquals(2, volumes.lastIndex());
	}

	@Test
	public void testCompareNatural() {

		assertTrue(MetaImageVolumeSetLoader.compareNatural("vol2", "vol10") < 0);
		assertTrue(MetaImageVolumeSetLoader.compareNatural("vol010", "vol9") > 0);
		assertTrue(MetaImageVolumeSetLoader.compareNatural("a.mhd", "b.mhd") < 0);
		assertEquals(0, MetaImageVolumeSetLoader.compareNatural("vol_0003.mhd", "vol_0003.mhd"));
	}

	@Test(expected = IOException.class)
	public void testMixedFormats() throws IOException, DimensionMismatchException {

		writeConstant("frame1.mhd", 1, 4, 4, 4);
		writeConstant("frame2.mha", 2, 4, 4, 4);

		new MetaImageVolumeSetLoader(split).load(input);
	}

	@Test(expected = DimensionMismatchException.class)
	public void testDimensionMismatch() throws IOException, DimensionMismatchException {

		writeConstant("frame1.mhd", 1, 4, 4, 4);
		writeConstant("frame2.mhd", 2, 4, 4, 5);

		new MetaImageVolumeSetLoader(split).load(input);
	}

	@Test(expected = IOException.class)
	public void testSingle3DVolume() throws IOException, DimensionMismatchException {

		writeConstant("frame1.mhd", 1, 4, 4, 4);

		new MetaImageVolumeSetLoader(split).load(input.resolve("frame1.mhd"));
	}

	@Test(expected = IOException.class)
	public void testEmptyDirectory() throws IOException, DimensionMismatchException {

		new MetaImageVolumeSetLoader(split).load(input);
	}

	@Test
	public void testSplit4D() throws IOException, DimensionMismatchException {

		final ArrayImg<FloatType, FloatArray> img = SyntheticVolumes.noise(3, 4, 3, 2, 5);
		final VoxelGeometry geometry = new VoxelGeometry(new double[]{2, 2, 3}, new double[]{1, 2, 3});
		final Path series = input.resolve("series.mha");
		MetaImage.write(series, MetaImage.create(img, geometry));

		final VolumeSet volumes = new MetaImageVolumeSetLoader(split).load(series);

		assertEquals(5, volumes.size());
		assertArrayEquals(new long[]{4, 3, 2}, volumes.dimensions());
		for (int t = 0; t < 5; ++t) {
			final Path file = split.resolve(String.format("vol_%04d.mhd", t));
			assertTrue(Files.exists(file));
			assertEquals(file, volumes.get(t).getSource());
			assertTrue(geometry.equals(volumes.get(t).getGeometry(), 1e-9));
		}

		final RandomAccess<FloatType> expected = img.randomAccess();
		expected.setPosition(new int[]{3, 1, 1, 4});
		final RandomAccess<FloatType> actual = volumes.get(4).getVoxels().randomAccess();
		actual.setPosition(new int[]{3, 1, 1});
		assertEquals(expected.get().get(), actual.get().get(), 0);

		/* split frames are a valid directory input */
		final VolumeSet reloaded = new MetaImageVolumeSetLoader(split).load(split);
		assertEquals(5, reloaded.size());
		assertEquals("vol_0004", reloaded.get(4).getName());
	}
}
