package org.janelia.saalfeldlab.moco.registration;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.saalfeldlab.moco.SyntheticVolumes;
import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.transform.Affine3D;
import org.janelia.saalfeldlab.moco.transform.FrameTransform;
import org.janelia.saalfeldlab.moco.volume.Frame;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 *
 */
public class GreedyRegistrationEngineTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path temporaryRoot;
	private Frame moving;
	private Frame fixed;

	/**
	 * Stands in for greedy, writes what the command asks for.
	 */
	private static class FakeGreedy implements CommandRunner {

		final List<List<String>> commands = new ArrayList<>();
		String matrix = "1 0 0 2\n0 1 0 0\n0 0 1 0\n0 0 0 1\n";
		int exitCode = 0;
		boolean writeOutputs = true;

		@Override
		public CommandResult run(final List<String> command, final Path workingDirectory) throws IOException {

			commands.add(command);
			assertTrue(Files.exists(workingDirectory.resolve(GreedyRegistrationEngine.FIXED_FILE)));
			assertTrue(Files.exists(workingDirectory.resolve(GreedyRegistrationEngine.MOVING_FILE)));

			if (exitCode != 0)
				return new CommandResult(exitCode, "", "greedy: out of memory");

			if (writeOutputs) {
				if (command.contains("-a")) {
					Files.write(Paths.get(argument(command, "-o")), matrix.getBytes());
				} else {
					final MetaImage fixed = MetaImage.read(Paths.get(argument(command, "-i")));
					writeField(Paths.get(argument(command, "-o")), fixed, 1.5);
					writeField(Paths.get(argument(command, "-oinv")), fixed, -1.5);
				}
			}
			return new CommandResult(0, "done", "");
		}

		private static String argument(final List<String> command, final String flag) {

			return command.get(command.indexOf(flag) + 1);
		}

		private static void writeField(final Path path, final MetaImage grid, final double value) throws IOException {

			final long[] d = grid.getDimensions();
			final ArrayImg<DoubleType, DoubleArray> field = ArrayImgs.doubles(d[0], d[1], d[2], 3);
			for (final DoubleType t : field)
				t.set(value);
			MetaImage.write(path, MetaImage.createVectorField(field, grid.getGeometry()));
		}
	}

	@Before
	public void setUp() {

		temporaryRoot = folder.getRoot().toPath().resolve("tmp");
		final VoxelGeometry geometry = new VoxelGeometry(new double[]{2, 2, 2}, new double[]{-10, -10, 0});
		moving = new Frame(1, SyntheticVolumes.noise(1, 6, 5, 4), geometry, null);
		fixed = new Frame(3, SyntheticVolumes.noise(3, 6, 5, 4), geometry, null);
	}

	private GreedyRegistrationEngine engine(final CommandRunner runner, final int threads) {

		return new GreedyRegistrationEngine("/opt/greedy/bin/greedy", GreedyRegistrationEngine.DEFAULT_METRIC, threads, temporaryRoot, runner);
	}

	private void assertTemporaryRootEmpty() {

		final File[] left = temporaryRoot.toFile().listFiles();
		assertTrue(left == null || left.length == 0);
	}

	@Test
	public void testAffineCommand() {

		final List<String> command = engine(new FakeGreedy(), 4).affineCommand(
				Paths.get("f.mhd"),
				Paths.get("m.mhd"),
				RegistrationMode.RIGID,
				IterationSchedule.CRUISE,
				Paths.get("a.mat"));

		assertEquals(
				Arrays.asList(
						"/opt/greedy/bin/greedy", "-d", "3", "-a",
						"-i", "f.mhd", "m.mhd",
						"-ia-image-centers",
						"-dof", "6",
						"-o", "a.mat",
						"-n", "100x25x10",
						"-m", "NCC", "2x2x2",
						"-threads", "4"),
				command);

		final List<String> affine = engine(new FakeGreedy(), 0).affineCommand(
				Paths.get("f.mhd"),
				Paths.get("m.mhd"),
				RegistrationMode.AFFINE,
				IterationSchedule.DASH,
				Paths.get("a.mat"));
		assertEquals("12", affine.get(affine.indexOf("-dof") + 1));
		assertEquals("100x25x10x0", affine.get(affine.indexOf("-n") + 1));
		assertFalse(affine.contains("-threads"));
	}

	@Test
	public void testDeformableCommand() {

		final List<String> command = engine(new FakeGreedy(), 0).deformableCommand(
				Paths.get("f.mhd"),
				Paths.get("m.mhd"),
				IterationSchedule.CRUISE,
				Paths.get("a.mat"),
				Paths.get("w.mhd"),
				Paths.get("iw.mhd"));

		assertEquals(
				Arrays.asList(
						"/opt/greedy/bin/greedy", "-d", "3",
						"-m", "NCC", "2x2x2",
						"-i", "f.mhd", "m.mhd",
						"-it", "a.mat",
						"-o", "w.mhd",
						"-oinv", "iw.mhd",
						"-sv",
						"-n", "100x25x10"),
				command);
	}

	@Test
	public void testRegisterAffine() throws Exception {

		final FakeGreedy greedy = new FakeGreedy();
		final FrameTransform transform = engine(greedy, 0).register(moving, fixed, RegistrationMode.AFFINE, IterationSchedule.CRUISE);

		assertEquals(1, greedy.commands.size());
		assertEquals(1, transform.getMovingIndex());
		assertEquals(3, transform.getFixedIndex());
		assertEquals(RegistrationMode.AFFINE, transform.getMode());
		assertEquals(IterationSchedule.CRUISE, transform.getSchedule());
		assertFalse(transform.isDeformable());

		/* RAS x translation of 2 is LPS -2 */
		final Affine3D expected = new Affine3D();
		expected.setTranslation(-2, 0, 0);
		assertArrayEquals(expected.getRowPackedCopy(), transform.getAffine().getRowPackedCopy(), 0);

		assertTemporaryRootEmpty();
	}

	@Test
	public void testRegisterDeformable() throws Exception {

		final FakeGreedy greedy = new FakeGreedy();
		final FrameTransform transform = engine(greedy, 2).register(moving, fixed, RegistrationMode.DEFORMABLE, IterationSchedule.DASH);

		assertEquals(2, greedy.commands.size());
		assertTrue(greedy.commands.get(0).contains("-a"));
		assertTrue(greedy.commands.get(1).contains("-sv"));
		assertTrue(transform.isDeformable());
		assertArrayEquals(new long[]{6, 5, 4}, transform.getForwardField().gridDimensions());
		assertTrue(fixed.getGeometry().equals(transform.getForwardField().getGeometry(), 1e-9));

		/* x -> A(x + u) with u = 1.5 and A a translation of -2 along x */
		final double[] target = new double[3];
		transform.forward().apply(new double[]{0, 0, 0}, target);
		assertArrayEquals(new double[]{-0.5, 1.5, 1.5}, target, 1e-6);

		assertTemporaryRootEmpty();
	}

	@Test
	public void testNonZeroExit() throws Exception {

		final FakeGreedy greedy = new FakeGreedy();
		greedy.exitCode = 137;
		try {
			engine(greedy, 0).register(moving, fixed, RegistrationMode.RIGID, IterationSchedule.CRUISE);
			fail("Failed greedy run accepted");
		} catch (final EngineFailureException e) {
			assertEquals(137, e.getExitCode());
			assertEquals("greedy: out of memory", e.getStderr());
		}
		assertTemporaryRootEmpty();
	}

	@Test(expected = EngineOutputCorruptException.class)
	public void testMissingMatrix() throws Exception {

		final FakeGreedy greedy = new FakeGreedy();
		greedy.writeOutputs = false;
		engine(greedy, 0).register(moving, fixed, RegistrationMode.AFFINE, IterationSchedule.CRUISE);
	}

	@Test
	public void testCorruptMatrix() throws Exception {

		final FakeGreedy greedy = new FakeGreedy();
		greedy.matrix = "1 0 0\n0 1 0\n";
		try {
			engine(greedy, 0).register(moving, fixed, RegistrationMode.AFFINE, IterationSchedule.CRUISE);
			fail("Corrupt matrix accepted");
		} catch (final EngineOutputCorruptException e) {
			assertTemporaryRootEmpty();
		}
	}

	@Test
	public void testProcessCommandRunner() throws Exception {

		Assume.assumeTrue(new File("/bin/sh").canExecute());

		final Path work = folder.newFolder("work").toPath();
		final CommandResult result = new ProcessCommandRunner().run(
				Arrays.asList("/bin/sh", "-c", "echo registered; echo failed 1>&2; exit 3"),
				work);

		assertEquals(3, result.getExitCode());
		assertEquals("registered", result.getStdout().trim());
		assertEquals("failed", result.getStderr().trim());
	}
}
