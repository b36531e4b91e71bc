package org.janelia.saalfeldlab.moco;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;

import org.janelia.saalfeldlab.moco.compose.FailurePolicy;
import org.janelia.saalfeldlab.moco.compose.FrameRegistrationFailedException;
import org.janelia.saalfeldlab.moco.compose.RunLayout;
import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.schedule.ReferenceStrategy;
import org.janelia.saalfeldlab.moco.schedule.RegistrationChainException;
import org.janelia.saalfeldlab.moco.transform.Affine3D;
import org.janelia.saalfeldlab.moco.transform.DirectoryTransformStore;
import org.janelia.saalfeldlab.moco.volume.MetaImageVolumeSetLoader;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.Gson;

import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

/**
 *
 */
public class MotionCorrectionPipelineTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static final long SIZE = 20;

	private Path input;
	private Path output;

	/**
	 * Frame i shows a blob moved by 4 - i voxels along x, the last frame is
	 * in place.
	 */
	@Before
	public void setUp() throws IOException {

		input = folder.newFolder("pet").toPath();
		output = folder.getRoot().toPath().resolve("pet-moco");
		for (int i = 0; i < 5; ++i) {
			final ArrayImg<FloatType, FloatArray> img = SyntheticVolumes.blob(new double[]{8 + 4 - i, 9, 10}, 2.5, SIZE, SIZE, SIZE);
			MetaImage.write(input.resolve("frame" + (i + 1) + ".mhd"), MetaImage.create(img, VoxelGeometry.unit()));
		}
	}

	private ScriptedRegistrationEngine engine() {

		final ScriptedRegistrationEngine engine = new ScriptedRegistrationEngine();
		for (int i = 0; i < 4; ++i) {
			final Affine3D shift = new Affine3D();
			shift.setTranslation(4 - i, 0, 0);
			engine.answer(i, shift);
		}
		return engine;
	}

	private MotionCorrectionParameters.Builder parameters() {

		return MotionCorrectionParameters.builder(input).output(output).startFrame(0).maxJobs(2);
	}

	private static MotionCorrectionPipeline pipeline(final MotionCorrectionParameters parameters, final ScriptedRegistrationEngine engine) {

		return new MotionCorrectionPipeline(
				parameters,
				new MetaImageVolumeSetLoader(new RunLayout(parameters.getOutput()).getSplitDirectory()),
				engine);
	}

	private RunSummary readSummary() throws IOException {

		try (final Reader reader = Files.newBufferedReader(new RunLayout(output).getRunSummary(), StandardCharsets.UTF_8)) {
			return new Gson().fromJson(reader, RunSummary.class);
		}
	}

	private static float valueAt(final ArrayImg<FloatType, FloatArray> img, final int... position) {

		final RandomAccess<FloatType> access = img.randomAccess();
		access.setPosition(position);
		return access.get().get();
	}

	@Test
	public void testMotionCorrection() throws Exception {

		final ScriptedRegistrationEngine engine = engine().delay(20);
		final MotionCorrectionPipeline pipeline = pipeline(parameters().build(), engine);
		final RunSummary summary = pipeline.run();

		assertEquals(5, summary.frames);
		assertEquals(4, summary.referenceIndex);
		assertEquals(4, summary.succeeded);
		assertEquals(1, summary.skipped);
		assertEquals(0, summary.failed);
		assertEquals(4, summary.engineInvocations);
		assertTrue(summary.complete);

		final RunLayout layout = pipeline.getLayout();
		for (int i = 1; i <= 5; ++i)
			assertTrue(Files.exists(layout.getCorrectedFrame("frame" + i)));

		/* every time point has the blob where the reference has it */
		final MetaImage volume = MetaImage.read(layout.getCorrectedVolume());
		assertArrayEquals(new long[]{SIZE, SIZE, SIZE, 5}, volume.getDimensions());
		final ArrayImg<FloatType, FloatArray> img = volume.toImg();
		for (int t = 0; t < 5; ++t) {
			assertEquals(100, valueAt(img, 8, 9, 10, t), 1e-3);
			assertEquals(valueAt(img, 6, 9, 10, 4), valueAt(img, 6, 9, 10, t), 1e-3);
		}

		assertEquals(summary.succeeded, readSummary().succeeded);
	}

	@Test
	public void testResume() throws Exception {

		pipeline(parameters().build(), engine()).run();

		final ScriptedRegistrationEngine engine = engine();
		final RunSummary summary = pipeline(parameters().build(), engine).run();
		assertEquals(0, summary.engineInvocations);
		assertEquals(4, summary.succeeded);
		assertTrue(engine.getCalls().isEmpty());
	}

	@Test
	public void testExcludeFailedFrame() throws Exception {

		final RunSummary summary = pipeline(parameters().build(), engine().fail(1)).run();

		assertEquals(3, summary.succeeded);
		assertEquals(1, summary.failed);
		assertEquals(1, summary.failures.get(0).index);
		assertTrue(summary.complete);

		final RunLayout layout = new RunLayout(output);
		assertFalse(Files.exists(layout.getCorrectedFrame("frame2")));
		assertArrayEquals(new long[]{SIZE, SIZE, SIZE, 4}, MetaImage.read(layout.getCorrectedVolume()).getDimensions());
	}

	@Test
	public void testAbortOnFailedFrame() throws Exception {

		try {
			pipeline(parameters().failurePolicy(FailurePolicy.ABORT).build(), engine().fail(1)).run();
			fail("Failed frame did not abort");
		} catch (final FrameRegistrationFailedException e) {
			assertArrayEquals(new int[]{1}, e.getFailedIndices());
		}

		final RunSummary summary = readSummary();
		assertFalse(summary.complete);
		assertEquals(1, summary.failed);
		assertFalse(Files.exists(new RunLayout(output).getCorrectedVolume()));
	}

	@Test
	public void testRollingChainFailure() throws Exception {

		final ScriptedRegistrationEngine engine = engine().fail(2);
		try {
			pipeline(parameters().strategy(ReferenceStrategy.ROLLING).build(), engine).run();
			fail("Broken chain did not abort");
		} catch (final RegistrationChainException e) {
			assertEquals(2, e.getFrameIndex());
		}

		final RunSummary summary = readSummary();
		assertFalse(summary.complete);
		assertEquals(1, summary.succeeded);
		assertEquals(1, summary.failed);
		assertEquals(3, summary.skipped);
		assertEquals(2, summary.engineInvocations);
	}

	@Test
	public void testInferredStartFrame() throws Exception {

		/* the first frame is unrelated to the rest */
		MetaImage.write(input.resolve("frame1.mhd"), MetaImage.create(SyntheticVolumes.noise(7, SIZE, SIZE, SIZE), VoxelGeometry.unit()));

		final ScriptedRegistrationEngine engine = engine();
		final MotionCorrectionParameters parameters = MotionCorrectionParameters.builder(input)
				.output(output)
				.mode(RegistrationMode.RIGID)
				.threshold(0.5)
				.lookahead(2)
				.build();
		final RunSummary summary = pipeline(parameters, engine).run();

		assertEquals(1, summary.startIndex);
		assertEquals(2, summary.skipped);
		assertEquals(3, summary.succeeded);
		assertFalse(engine.getMovingIndices().contains(0));
		assertTrue(Files.exists(new RunLayout(output).getTransformStoreDirectory().resolve("rigid").resolve("frame-0001").resolve(DirectoryTransformStore.ATTRIBUTES_FILE)));
	}

	@Test(expected = CancellationException.class)
	public void testCancelled() throws Exception {

		final MotionCorrectionPipeline pipeline = pipeline(parameters().build(), engine());
		pipeline.cancel();
		pipeline.run();
	}
}
