package org.janelia.saalfeldlab.moco;

import java.nio.file.Path;
import java.util.OptionalInt;

import org.janelia.saalfeldlab.moco.compose.FailurePolicy;
import org.janelia.saalfeldlab.moco.registration.GreedyRegistrationEngine;
import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.schedule.ReferenceStrategy;
import org.janelia.saalfeldlab.moco.similarity.CandidateFrameSelector;

/**
 * Immutable configuration of one motion correction run.  Build with
 * {@link #builder(Path)}, invalid combinations fail on {@link Builder#build()}.
 */
public class MotionCorrectionParameters {

	/** the last frame */
	public static final int LAST_FRAME = -1;

	private final Path input;
	private final Path output;
	private final RegistrationMode mode;
	private final IterationSchedule schedule;
	private final ReferenceStrategy strategy;
	private final int referenceFrame;
	private final OptionalInt startFrame;
	private final CandidateFrameSelector.Policy selectionPolicy;
	private final double threshold;
	private final int lookahead;
	private final double referenceRatio;
	private final int shrink;
	private final Path mask;
	private final boolean passThroughBeforeStart;
	private final FailurePolicy failurePolicy;
	private final boolean force;
	private final int maxJobs;
	private final int threadsPerJob;
	private final String greedyExecutable;
	private final String metric;

	private MotionCorrectionParameters(final Builder builder) {

		input = builder.input;
		output = builder.output == null ? defaultOutput(builder.input) : builder.output;
		mode = builder.mode;
		schedule = builder.schedule;
		strategy = builder.strategy;
		referenceFrame = builder.referenceFrame;
		startFrame = builder.startFrame;
		selectionPolicy = builder.selectionPolicy;
		threshold = builder.threshold;
		lookahead = builder.lookahead;
		referenceRatio = builder.referenceRatio;
		shrink = builder.shrink;
		mask = builder.mask;
		passThroughBeforeStart = builder.passThroughBeforeStart;
		failurePolicy = builder.failurePolicy;
		force = builder.force;
		maxJobs = builder.maxJobs;
		threadsPerJob = builder.threadsPerJob;
		greedyExecutable = builder.greedyExecutable;
		metric = builder.metric;
	}

	/**
	 * @return <code>&lt;parent&gt;/&lt;name&gt;-moco</code> next to the input
	 */
	public static Path defaultOutput(final Path input) {

		final Path absolute = input.toAbsolutePath().normalize();
		String name = absolute.getFileName() == null ? "input" : absolute.getFileName().toString();
		if (name.contains(".") && !absolute.toFile().isDirectory())
			name = name.substring(0, name.lastIndexOf('.'));
		final Path parent = absolute.getParent() == null ? absolute : absolute.getParent();
		return parent.resolve(name + "-moco");
	}

	public static Builder builder(final Path input) {

		return new Builder(input);
	}

	/**
	 * @param numFrames
	 * @return the reference frame index, negative values count from the end
	 */
	public int resolveReferenceIndex(final int numFrames) {

		final int index = referenceFrame < 0 ? numFrames + referenceFrame : referenceFrame;
		if (index < 0 || index >= numFrames)
			throw new IllegalArgumentException(
					"Reference frame " + referenceFrame + " does not exist in a series of " + numFrames + " frames");
		return index;
	}

	public Path getInput() {

		return input;
	}

	public Path getOutput() {

		return output;
	}

	public RegistrationMode getMode() {

		return mode;
	}

	public IterationSchedule getSchedule() {

		return schedule;
	}

	public ReferenceStrategy getStrategy() {

		return strategy;
	}

	public int getReferenceFrame() {

		return referenceFrame;
	}

	public OptionalInt getStartFrame() {

		return startFrame;
	}

	public CandidateFrameSelector.Policy getSelectionPolicy() {

		return selectionPolicy;
	}

	public double getThreshold() {

		return threshold;
	}

	public int getLookahead() {

		return lookahead;
	}

	public double getReferenceRatio() {

		return referenceRatio;
	}

	public int getShrink() {

		return shrink;
	}

	public Path getMask() {

		return mask;
	}

	public boolean isPassThroughBeforeStart() {

		return passThroughBeforeStart;
	}

	public FailurePolicy getFailurePolicy() {

		return failurePolicy;
	}

	public boolean isForce() {

		return force;
	}

	public int getMaxJobs() {

		return maxJobs;
	}

	public int getThreadsPerJob() {

		return threadsPerJob;
	}

	public String getGreedyExecutable() {

		return greedyExecutable;
	}

	public String getMetric() {

		return metric;
	}

	@Override
	public String toString() {

		return "input: " + input + "\n" +
				"output: " + output + "\n" +
				"registration: " + mode.getName() + "\n" +
				"strategy: " + strategy + "\n" +
				"reference frame: " + (referenceFrame == LAST_FRAME ? "last" : Integer.toString(referenceFrame)) + "\n" +
				"start frame: " + (startFrame.isPresent() ? Integer.toString(startFrame.getAsInt()) : "inferred (" + selectionPolicy + ")") + "\n" +
				"iterations: " + schedule + "\n" +
				"metric: " + metric;
	}

	public static class Builder {

		private final Path input;
		private Path output = null;
		private RegistrationMode mode = RegistrationMode.AFFINE;
		private IterationSchedule schedule = IterationSchedule.CRUISE;
		private ReferenceStrategy strategy = ReferenceStrategy.FIXED;
		private int referenceFrame = LAST_FRAME;
		private OptionalInt startFrame = OptionalInt.empty();
		private CandidateFrameSelector.Policy selectionPolicy = CandidateFrameSelector.Policy.CONSECUTIVE;
		private double threshold = CandidateFrameSelector.DEFAULT_THRESHOLD;
		private int lookahead = CandidateFrameSelector.DEFAULT_LOOKAHEAD;
		private double referenceRatio = CandidateFrameSelector.DEFAULT_REFERENCE_RATIO;
		private int shrink = 1;
		private Path mask = null;
		private boolean passThroughBeforeStart = true;
		private FailurePolicy failurePolicy = FailurePolicy.EXCLUDE;
		private boolean force = false;
		private int maxJobs = 0;
		private int threadsPerJob = 0;
		private String greedyExecutable = GreedyRegistrationEngine.DEFAULT_EXECUTABLE;
		private String metric = GreedyRegistrationEngine.DEFAULT_METRIC;

		private Builder(final Path input) {

			this.input = input;
		}

		public Builder output(final Path output) {

			this.output = output;
			return this;
		}

		public Builder mode(final RegistrationMode mode) {

			this.mode = mode;
			return this;
		}

		public Builder schedule(final IterationSchedule schedule) {

			this.schedule = schedule;
			return this;
		}

		public Builder strategy(final ReferenceStrategy strategy) {

			this.strategy = strategy;
			return this;
		}

		/**
		 * @param referenceFrame index, negative counts from the end
		 */
		public Builder referenceFrame(final int referenceFrame) {

			this.referenceFrame = referenceFrame;
			return this;
		}

		public Builder startFrame(final int startFrame) {

			this.startFrame = OptionalInt.of(startFrame);
			return this;
		}

		public Builder selectionPolicy(final CandidateFrameSelector.Policy selectionPolicy) {

			this.selectionPolicy = selectionPolicy;
			return this;
		}

		public Builder threshold(final double threshold) {

			this.threshold = threshold;
			return this;
		}

		public Builder lookahead(final int lookahead) {

			this.lookahead = lookahead;
			return this;
		}

		public Builder referenceRatio(final double referenceRatio) {

			this.referenceRatio = referenceRatio;
			return this;
		}

		public Builder shrink(final int shrink) {

			this.shrink = shrink;
			return this;
		}

		public Builder mask(final Path mask) {

			this.mask = mask;
			return this;
		}

		public Builder passThroughBeforeStart(final boolean passThroughBeforeStart) {

			this.passThroughBeforeStart = passThroughBeforeStart;
			return this;
		}

		public Builder failurePolicy(final FailurePolicy failurePolicy) {

			this.failurePolicy = failurePolicy;
			return this;
		}

		public Builder force(final boolean force) {

			this.force = force;
			return this;
		}

		public Builder maxJobs(final int maxJobs) {

			this.maxJobs = maxJobs;
			return this;
		}

		public Builder threadsPerJob(final int threadsPerJob) {

			this.threadsPerJob = threadsPerJob;
			return this;
		}

		public Builder greedyExecutable(final String greedyExecutable) {

			this.greedyExecutable = greedyExecutable;
			return this;
		}

		public Builder metric(final String metric) {

			this.metric = metric;
			return this;
		}

		public MotionCorrectionParameters build() {

			if (input == null)
				throw new IllegalArgumentException("No input given");
			if (mode == null || schedule == null || strategy == null || selectionPolicy == null || failurePolicy == null)
				throw new IllegalArgumentException("Mode, schedule, strategy, selection and failure policy are required");
			if (startFrame.isPresent() && startFrame.getAsInt() < 0)
				throw new IllegalArgumentException("Start frame must not be negative: " + startFrame.getAsInt());
			if (!(threshold > -1 && threshold < 1))
				throw new IllegalArgumentException("Threshold must be in (-1, 1): " + threshold);
			if (lookahead < 1)
				throw new IllegalArgumentException("Lookahead must be at least 1: " + lookahead);
			if (!(referenceRatio > 0 && referenceRatio <= 1))
				throw new IllegalArgumentException("Reference ratio must be in (0, 1]: " + referenceRatio);
			if (shrink < 1)
				throw new IllegalArgumentException("Shrink factor must be at least 1: " + shrink);
			if (maxJobs < 0 || threadsPerJob < 0)
				throw new IllegalArgumentException("Jobs and threads per job must not be negative");
			if (greedyExecutable == null || greedyExecutable.trim().isEmpty())
				throw new IllegalArgumentException("No greedy executable given");
			if (metric == null || metric.trim().isEmpty())
				throw new IllegalArgumentException("No metric given");

			return new MotionCorrectionParameters(this);
		}
	}
}
