/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.saalfeldlab.moco;

import java.io.IOException;
import java.util.concurrent.CancellationException;

import org.janelia.saalfeldlab.moco.compose.CorrectedVolumeSet;
import org.janelia.saalfeldlab.moco.compose.FrameRegistrationFailedException;
import org.janelia.saalfeldlab.moco.compose.MotionCompositor;
import org.janelia.saalfeldlab.moco.compose.RunLayout;
import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.registration.GreedyRegistrationEngine;
import org.janelia.saalfeldlab.moco.registration.ProcessCommandRunner;
import org.janelia.saalfeldlab.moco.registration.RegistrationEngine;
import org.janelia.saalfeldlab.moco.schedule.RegistrationChainException;
import org.janelia.saalfeldlab.moco.schedule.RegistrationLedger;
import org.janelia.saalfeldlab.moco.schedule.RegistrationPlan;
import org.janelia.saalfeldlab.moco.schedule.RegistrationScheduler;
import org.janelia.saalfeldlab.moco.schedule.ResourceBudget;
import org.janelia.saalfeldlab.moco.similarity.CandidateFrameSelector;
import org.janelia.saalfeldlab.moco.similarity.NormalizedCrossCorrelation;
import org.janelia.saalfeldlab.moco.transform.DirectoryTransformStore;
import org.janelia.saalfeldlab.moco.volume.MetaImageVolumeSetLoader;
import org.janelia.saalfeldlab.moco.volume.VolumeSet;
import org.janelia.saalfeldlab.moco.volume.VolumeSetLoader;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Motion corrects a dynamic series: load the frames, pick reference and
 * start frame, register, and compose the corrected frames and 4D volume.
 */
public class MotionCorrectionPipeline {

	private final MotionCorrectionParameters parameters;
	private final VolumeSetLoader loader;
	private final RunLayout layout;
	private final RegistrationScheduler scheduler;
	private final MotionCompositor compositor;

	private volatile boolean cancelled = false;

	public MotionCorrectionPipeline(
			final MotionCorrectionParameters parameters,
			final VolumeSetLoader loader,
			final RegistrationEngine engine) {

		this.parameters = parameters;
		this.loader = loader;

		layout = new RunLayout(parameters.getOutput());
		final DirectoryTransformStore store = new DirectoryTransformStore(layout.getTransformStoreDirectory());
		scheduler = new RegistrationScheduler(
				engine,
				store,
				ResourceBudget.numJobs(parameters.getMode(), parameters.getThreadsPerJob(), parameters.getMaxJobs()));
		compositor = new MotionCompositor(
				store,
				parameters.getMode(),
				parameters.getFailurePolicy(),
				Runtime.getRuntime().availableProcessors());
	}

	/**
	 * Run with MetaImage input and greedy.
	 */
	public MotionCorrectionPipeline(final MotionCorrectionParameters parameters) {

		this(
				parameters,
				new MetaImageVolumeSetLoader(new RunLayout(parameters.getOutput()).getSplitDirectory()),
				new GreedyRegistrationEngine(
						parameters.getGreedyExecutable(),
						parameters.getMetric(),
						parameters.getThreadsPerJob() > 0 ? parameters.getThreadsPerJob() : parameters.getMode().getThreadsPerJob(),
						null,
						new ProcessCommandRunner()));
	}

	public RunLayout getLayout() {

		return layout;
	}

	public RegistrationScheduler getScheduler() {

		return scheduler;
	}

	/**
	 * Stop a running pipeline.  Running registration jobs are killed and
	 * their results discarded, {@link #run()} throws a
	 * {@link CancellationException}.
	 */
	public void cancel() {

		cancelled = true;
		scheduler.cancel();
	}

	public RunSummary run() throws MotionCorrectionException, IOException, InterruptedException {

		System.out.println(parameters);
		layout.create();

		System.out.println();
		System.out.println("== Loading volumes");
		final VolumeSet volumes = loader.load(parameters.getInput());
		final int reference = parameters.resolveReferenceIndex(volumes.size());
		System.out.println(volumes.size() + " frames, reference frame " + reference);

		checkCancelled();
		System.out.println();
		System.out.println("== Selecting start frame");
		final CandidateFrameSelector selector = new CandidateFrameSelector(
				createScorer(),
				parameters.getSelectionPolicy(),
				parameters.getThreshold(),
				parameters.getLookahead(),
				parameters.getReferenceRatio(),
				Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
		final int start = selector.selectStart(volumes, reference, parameters.getStartFrame());

		checkCancelled();
		System.out.println();
		System.out.println("== Registering");
		final RegistrationPlan plan = new RegistrationPlan(
				volumes.size(),
				reference,
				start,
				parameters.getStrategy(),
				parameters.getMode(),
				parameters.getSchedule(),
				parameters.isPassThroughBeforeStart(),
				parameters.isForce());

		final RegistrationLedger ledger;
		try {
			ledger = scheduler.run(volumes, plan);
		} catch (final RegistrationChainException e) {
			finish(RunSummary.create(e.getLedger(), reference, start, scheduler.getEngineInvocations(), false));
			throw e;
		}

		checkCancelled();
		System.out.println();
		System.out.println("== Composing");
		final CorrectedVolumeSet corrected;
		try {
			corrected = compositor.compose(volumes, ledger, reference, layout);
		} catch (final FrameRegistrationFailedException e) {
			finish(RunSummary.create(ledger, reference, start, scheduler.getEngineInvocations(), false));
			throw e;
		}

		System.out.println(corrected.getIncludedFrames().size() + " corrected frames in " + layout.getCorrectedVolume());
		return finish(RunSummary.create(ledger, reference, start, scheduler.getEngineInvocations(), true));
	}

	private RunSummary finish(final RunSummary summary) throws IOException {

		System.out.println();
		System.out.println("== Summary");
		System.out.println(summary);
		summary.write(layout.getRunSummary());
		return summary;
	}

	private NormalizedCrossCorrelation createScorer() throws IOException {

		if (parameters.getMask() == null)
			return new NormalizedCrossCorrelation(null, parameters.getShrink());

		final MetaImage mask = MetaImage.read(parameters.getMask());
		if (mask.numDimensions() != 3 || mask.getNumChannels() != 1)
			throw new IOException("Mask " + parameters.getMask() + " is not a scalar 3D volume");

		final ArrayImg<FloatType, FloatArray> img = mask.toImg();
		return new NormalizedCrossCorrelation(img, parameters.getShrink());
	}

	private void checkCancelled() {

		if (cancelled)
			throw new CancellationException("Motion correction was cancelled");
	}
}
