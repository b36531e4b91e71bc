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
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.janelia.saalfeldlab.moco.compose.FailurePolicy;
import org.janelia.saalfeldlab.moco.registration.GreedyRegistrationEngine;
import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.schedule.ReferenceStrategy;
import org.janelia.saalfeldlab.moco.similarity.CandidateFrameSelector;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Motion correction of dynamic PET series.
 */
@Command(name = "pet-moco", mixinStandardHelpOptions = true, description = "Motion correction of dynamic PET series")
public class MotionCorrection implements Callable<Void> {

	@Option(names = {"-d", "--directory"}, required = true, description = "Directory of 3D MetaImage volumes or a 4D MetaImage, e.g. /data/subject01/pet")
	private String input = null;

	@Option(names = {"-o", "--output"}, required = false, description = "Run directory (default: <input>-moco next to the input)")
	private String output = null;

	@Option(names = {"-r", "--registration"}, required = false, description = "Registration type: ${COMPLETION-CANDIDATES} (default: affine)")
	private RegistrationMode mode = RegistrationMode.AFFINE;

	@Option(names = {"-a", "--strategy"}, required = false, description = "Reference strategy: ${COMPLETION-CANDIDATES} (default: fixed)")
	private ReferenceStrategy strategy = ReferenceStrategy.FIXED;

	@Option(names = {"-rf", "--reference-frame"}, required = false, description = "Reference frame index, negative values count from the end (default: -1, the last frame)")
	private int referenceFrame = MotionCorrectionParameters.LAST_FRAME;

	@Option(names = {"-sf", "--start-frame"}, required = false, description = "Start frame index, inferred from frame similarity if not given")
	private Integer startFrame = null;

	@Option(names = {"-i", "--iterations"}, required = false, description = "Iterations per resolution level, e.g. 100x50x25, overrides --mode")
	private String iterations = null;

	@Option(names = {"-m", "--mode"}, required = false, description = "Iteration preset, cruise (100x25x10) or dash (100x25x10x0) (default: cruise)")
	private String preset = "cruise";

	@Option(names = "--threshold", required = false, description = "Similarity threshold for the start frame (default: 0.7)")
	private double threshold = CandidateFrameSelector.DEFAULT_THRESHOLD;

	@Option(names = "--lookahead", required = false, description = "Consecutive frame pairs that must exceed the threshold (default: 3)")
	private int lookahead = CandidateFrameSelector.DEFAULT_LOOKAHEAD;

	@Option(names = "--selection", required = false, description = "Start frame selection: ${COMPLETION-CANDIDATES} (default: consecutive)")
	private CandidateFrameSelector.Policy selection = CandidateFrameSelector.Policy.CONSECUTIVE;

	@Option(names = "--reference-ratio", required = false, description = "Fraction of the best similarity to the reference a start frame must exceed (default: 0.5)")
	private double referenceRatio = CandidateFrameSelector.DEFAULT_REFERENCE_RATIO;

	@Option(names = "--shrink", required = false, description = "Subsampling factor for similarity scoring (default: 1)")
	private int shrink = 1;

	@Option(names = "--mask", required = false, description = "3D MetaImage mask, similarity is scored where the mask is non-zero")
	private String mask = null;

	@Option(names = "--register-before-start", required = false, description = "Register frames before the start frame instead of passing them through")
	private boolean registerBeforeStart = false;

	@Option(names = "--failure-policy", required = false, description = "Failed frames: ${COMPLETION-CANDIDATES} (default: exclude)")
	private FailurePolicy failurePolicy = FailurePolicy.EXCLUDE;

	@Option(names = "--force", required = false, description = "Recompute stored transforms")
	private boolean force = false;

	@Option(names = "--jobs", required = false, description = "Maximum number of concurrent registrations (default: as resources allow)")
	private int jobs = 0;

	@Option(names = "--threads-per-job", required = false, description = "Threads per registration (default: by registration type)")
	private int threadsPerJob = 0;

	@Option(names = "--greedy", required = false, description = "greedy executable (default: greedy)")
	private String greedy = GreedyRegistrationEngine.DEFAULT_EXECUTABLE;

	@Option(names = "--metric", required = false, description = "greedy metric (default: \"NCC 2x2x2\")")
	private String metric = GreedyRegistrationEngine.DEFAULT_METRIC;

	public static final void main(final String... args) {

		System.exit(new CommandLine(new MotionCorrection()).setCaseInsensitiveEnumValuesAllowed(true).execute(args));
	}

	MotionCorrectionParameters createParameters() {

		final MotionCorrectionParameters.Builder builder = MotionCorrectionParameters.builder(Paths.get(input))
				.mode(mode)
				.strategy(strategy)
				.referenceFrame(referenceFrame)
				.schedule(iterations == null ? IterationSchedule.preset(preset) : IterationSchedule.parse(iterations))
				.selectionPolicy(selection)
				.threshold(threshold)
				.lookahead(lookahead)
				.referenceRatio(referenceRatio)
				.shrink(shrink)
				.passThroughBeforeStart(!registerBeforeStart)
				.failurePolicy(failurePolicy)
				.force(force)
				.maxJobs(jobs)
				.threadsPerJob(threadsPerJob)
				.greedyExecutable(greedy)
				.metric(metric);

		if (output != null)
			builder.output(Paths.get(output));
		if (startFrame != null)
			builder.startFrame(startFrame);
		if (mask != null)
			builder.mask(Paths.get(mask));

		return builder.build();
	}

	@Override
	public Void call() throws IOException, InterruptedException, MotionCorrectionException {

		final MotionCorrectionParameters parameters = createParameters();
		final MotionCorrectionPipeline pipeline = new MotionCorrectionPipeline(parameters);

		final Thread main = Thread.currentThread();
		final Thread shutdownHook = new Thread(() -> {
			System.err.println("Cancelling motion correction");
			pipeline.cancel();
			try {
				main.join(10000);
			} catch (final InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			final RunSummary summary = pipeline.run();
			final Path volume = pipeline.getLayout().getCorrectedVolume();
			System.out.println("Done, " + summary.succeeded + " frames registered, corrected series in " + volume);
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (final IllegalStateException e) {
				System.err.println("Shutting down: " + e.getMessage());
			}
		}

		return null;
	}
}
