package org.janelia.saalfeldlab.moco.compose;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.registration.GreedyMatrixFormat;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.schedule.RegistrationLedger;
import org.janelia.saalfeldlab.moco.schedule.RegistrationOutcome;
import org.janelia.saalfeldlab.moco.schedule.RegistrationState;
import org.janelia.saalfeldlab.moco.transform.Affine3D;
import org.janelia.saalfeldlab.moco.transform.FrameTransform;
import org.janelia.saalfeldlab.moco.transform.SpatialTransform;
import org.janelia.saalfeldlab.moco.transform.TransformChain;
import org.janelia.saalfeldlab.moco.transform.TransformNotFoundException;
import org.janelia.saalfeldlab.moco.transform.TransformStore;
import org.janelia.saalfeldlab.moco.util.Transform;
import org.janelia.saalfeldlab.moco.volume.Frame;
import org.janelia.saalfeldlab.moco.volume.VolumeSet;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Resamples registered frames into the reference grid and stacks all
 * frames into one 4D volume.
 *
 * Registered frames are resampled with the transform composed from the
 * store, skipped frames are copied unchanged.  Failed frames abort
 * composition or are excluded from the 4D volume, depending on the
 * {@link FailurePolicy}.
 */
public class MotionCompositor {

	private final TransformStore store;
	private final RegistrationMode mode;
	private final FailurePolicy failurePolicy;
	private final int numThreads;

	public MotionCompositor(
			final TransformStore store,
			final RegistrationMode mode,
			final FailurePolicy failurePolicy,
			final int numThreads) {

		this.store = store;
		this.mode = mode;
		this.failurePolicy = failurePolicy;
		this.numThreads = numThreads;
	}

	/**
	 * Link every registered frame with its stored transform.
	 *
	 * @throws TransformNotFoundException if a registered frame has no
	 *     stored transform
	 */
	public TransformChain loadChain(final RegistrationLedger ledger, final int referenceIndex)
			throws IOException, TransformNotFoundException {

		final TransformChain chain = new TransformChain(ledger.size(), referenceIndex);
		for (final int i : ledger.indices(RegistrationState.SUCCEEDED))
			chain.link(store.get(i, mode));
		return chain;
	}

	public CorrectedVolumeSet compose(
			final VolumeSet volumes,
			final RegistrationLedger ledger,
			final int referenceIndex,
			final RunLayout layout)
			throws FrameRegistrationFailedException, TransformNotFoundException, IOException, InterruptedException {

		checkFailures(ledger);
		return compose(volumes, ledger, loadChain(ledger, referenceIndex), layout);
	}

	public CorrectedVolumeSet compose(
			final VolumeSet volumes,
			final RegistrationLedger ledger,
			final TransformChain chain,
			final RunLayout layout)
			throws FrameRegistrationFailedException, TransformNotFoundException, IOException, InterruptedException {

		checkFailures(ledger);
		if (!ledger.isComplete())
			throw new IllegalStateException("Cannot compose an incomplete registration: " + ledger);
		if (ledger.size() != volumes.size() || chain.size() != volumes.size())
			throw new IllegalArgumentException("Ledger, chain and volumes differ in size");
		for (final int i : ledger.indices(RegistrationState.SUCCEEDED))
			if (!chain.isLinked(i))
				throw new TransformNotFoundException(i, mode);

		final Frame reference = volumes.get(chain.getReferenceIndex());
		final VoxelGeometry referenceGeometry = reference.getGeometry();

		final VolumeManifest manifest = new VolumeManifest();
		manifest.referenceIndex = chain.getReferenceIndex();
		manifest.mode = mode.getName();
		manifest.volume = layout.getCorrectedVolume().getFileName().toString();

		final Frame[] corrected = new Frame[volumes.size()];
		final List<RandomAccessibleInterval<FloatType>> timePoints = new ArrayList<>();

		Files.createDirectories(layout.getMocoDirectory());
		Files.createDirectories(layout.getTransformsDirectory());

		final ExecutorService exec = Executors.newFixedThreadPool(numThreads);
		try {
			for (final Frame frame : volumes) {
				final int i = frame.getIndex();
				final RegistrationOutcome outcome = ledger.getOutcome(i);

				final VolumeManifest.Entry entry = new VolumeManifest.Entry();
				entry.index = i;
				entry.state = outcome.getState().name();
				entry.source = frame.getSource() == null ? null : frame.getSource().toString();
				entry.reason = outcome.getReason();
				manifest.frames.add(entry);

				final RandomAccessibleInterval<FloatType> voxels;
				final VoxelGeometry geometry;
				switch (outcome.getState()) {
				case SUCCEEDED:
					System.out.println("Resampling " + frame + " into reference " + reference);
					voxels = resample(frame, reference, chain, exec);
					geometry = referenceGeometry;
					exportTransform(chain.getLink(i), layout);
					break;
				case SKIPPED:
					voxels = Views.zeroMin(frame.getVoxels());
					geometry = frame.getGeometry();
					break;
				default:
					System.out.println("Excluding " + frame + " from the corrected volume: " + outcome.getReason());
					continue;
				}

				final Path output = layout.getCorrectedFrame(frame.getName());
				MetaImage.write(output, MetaImage.create(voxels, geometry));

				corrected[i] = new Frame(i, voxels, geometry, output);
				entry.output = output.getFileName().toString();
				entry.timePoint = timePoints.size();
				timePoints.add(voxels);
			}
		} finally {
			exec.shutdownNow();
		}

		MetaImage.writeTimeSeries(layout.getCorrectedVolume(), timePoints, referenceGeometry);
		final RandomAccessibleInterval<FloatType> volume = Views.stack(timePoints);

		final Gson gson = new GsonBuilder().setPrettyPrinting().create();
		Files.write(layout.getManifest(), gson.toJson(manifest).getBytes(StandardCharsets.UTF_8));

		System.out.println(
				"Wrote " + timePoints.size() + " of " + volumes.size() + " frames to " + layout.getCorrectedVolume());

		return new CorrectedVolumeSet(corrected, volume, manifest);
	}

	private void checkFailures(final RegistrationLedger ledger) throws FrameRegistrationFailedException {

		final int[] failed = ledger.indices(RegistrationState.FAILED);
		if (failed.length > 0 && failurePolicy == FailurePolicy.ABORT)
			throw new FrameRegistrationFailedException(failed);
	}

	/**
	 * Resample a frame into the reference grid.
	 */
	public static ArrayImg<FloatType, FloatArray> resample(
			final Frame frame,
			final Frame reference,
			final TransformChain chain,
			final ExecutorService exec) throws InterruptedException {

		final ArrayImg<FloatType, FloatArray> target = ArrayImgs.floats(reference.dimensions());
		final int i = frame.getIndex();

		final SpatialTransform referenceToFrame;
		if (chain.isAffine(i)) {
			final Affine3D voxelTransform = reference.getGeometry().voxelToPhysical();
			voxelTransform.preConcatenate(chain.affine(i));
			voxelTransform.preConcatenate(frame.getGeometry().physicalToVoxel());
			referenceToFrame = voxelTransform;
		} else {
			referenceToFrame = Transform.sequence(
					reference.getGeometry().voxelToPhysical(),
					chain.forward(i),
					frame.getGeometry().physicalToVoxel());
		}

		try {
			Transform.resample(frame.getVoxels(), target, referenceToFrame, new FloatType(0), exec);
		} catch (final ExecutionException e) {
			throw new IllegalStateException("Resampling " + frame + " failed", e.getCause());
		}
		return target;
	}

	private static void exportTransform(final FrameTransform transform, final RunLayout layout) throws IOException {

		final int moving = transform.getMovingIndex();
		final int fixed = transform.getFixedIndex();
		GreedyMatrixFormat.write(layout.getTransformArtifact(moving, fixed, "_affine.mat"), transform.getAffine());
		if (transform.isDeformable()) {
			MetaImage.write(
					layout.getTransformArtifact(moving, fixed, "_warp" + MetaImage.HEADER_EXTENSION),
					transform.getForwardField().toMetaImage());
			MetaImage.write(
					layout.getTransformArtifact(moving, fixed, "_inverse_warp" + MetaImage.HEADER_EXTENSION),
					transform.getInverseField().toMetaImage());
		}
	}
}
