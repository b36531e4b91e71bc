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
package org.janelia.saalfeldlab.moco.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.saalfeldlab.moco.volume.DimensionMismatchException;
import org.janelia.saalfeldlab.moco.volume.Frame;
import org.janelia.saalfeldlab.moco.volume.VolumeSet;

/**
 * Picks the earliest frame from which on registration is numerically
 * stable.  Early frames of a dynamic acquisition carry little tracer
 * signal and are dominated by noise.
 *
 * <p>The {@link Policy#CONSECUTIVE} policy scores neighbouring frames
 * (i, i+1) and returns the smallest i for which this score and those of the
 * following pairs within the lookahead window all exceed the threshold.
 * The {@link Policy#REFERENCE_RELATIVE} policy scores every frame against
 * the reference and returns the first frame that exceeds a fraction of the
 * best scores observed.</p>
 */
public class CandidateFrameSelector {

	public static enum Policy {
		CONSECUTIVE,
		REFERENCE_RELATIVE
	}

	public static final double DEFAULT_THRESHOLD = 0.7;
	public static final int DEFAULT_LOOKAHEAD = 3;
	public static final double DEFAULT_REFERENCE_RATIO = 0.5;

	/* the mean of that many best scores is the maximum observed */
	private static final int NUM_TOP_SCORES = 3;

	private final SimilarityScorer scorer;
	private final Policy policy;
	private final double threshold;
	private final int lookahead;
	private final double referenceRatio;
	private final int numThreads;

	public CandidateFrameSelector(
			final SimilarityScorer scorer,
			final Policy policy,
			final double threshold,
			final int lookahead,
			final double referenceRatio,
			final int numThreads) {

		if (lookahead < 1)
			throw new IllegalArgumentException("Lookahead must be at least 1: " + lookahead);
		if (numThreads < 1)
			throw new IllegalArgumentException("Number of threads must be at least 1: " + numThreads);

		this.scorer = scorer;
		this.policy = policy;
		this.threshold = threshold;
		this.lookahead = lookahead;
		this.referenceRatio = referenceRatio;
		this.numThreads = numThreads;
	}

	public CandidateFrameSelector(final SimilarityScorer scorer) {

		this(
				scorer,
				Policy.CONSECUTIVE,
				DEFAULT_THRESHOLD,
				DEFAULT_LOOKAHEAD,
				DEFAULT_REFERENCE_RATIO,
				Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
	}

	/**
	 * Resolve the start frame.  An explicit start frame is returned as is
	 * without scoring any frames.
	 *
	 * @param volumes
	 * @param referenceIndex
	 * @param explicitStart
	 * @return the start frame index
	 */
	public int selectStart(
			final VolumeSet volumes,
			final int referenceIndex,
			final OptionalInt explicitStart)
			throws NoStableStartFrameException, DimensionMismatchException, InterruptedException {

		if (explicitStart.isPresent()) {
			final int start = explicitStart.getAsInt();
			if (start < 0 || start >= volumes.size())
				throw new IllegalArgumentException(
						"Start frame " + start + " is outside of [0, " + volumes.lastIndex() + "]");
			System.out.println("Using explicit start frame " + start);
			return start;
		}

		return select(volumes, referenceIndex);
	}

	/**
	 * Infer the start frame from frame similarities.
	 */
	public int select(final VolumeSet volumes, final int referenceIndex)
			throws NoStableStartFrameException, DimensionMismatchException, InterruptedException {

		if (policy == Policy.REFERENCE_RELATIVE) {
			final double[] scores = scoreAgainstReference(volumes, referenceIndex);
			final int start = firstAboveRatio(scores, referenceIndex, referenceRatio);
			System.out.println("Scores against reference frame " + referenceIndex + ": " + Arrays.toString(scores));
			System.out.println("Candidate start frame " + start);
			return start;
		}

		final double[] scores = scoreConsecutive(volumes);
		System.out.println("Consecutive frame scores: " + Arrays.toString(scores));
		final int start = firstStableIndex(scores, threshold, lookahead);
		System.out.println("Candidate start frame " + start);
		return start;
	}

	/**
	 * @return the scores of pairs (i, i+1) at position i
	 */
	public double[] scoreConsecutive(final VolumeSet volumes) throws DimensionMismatchException, InterruptedException {

		final List<Callable<SimilarityScore>> tasks = new ArrayList<>();
		for (int i = 0; i < volumes.lastIndex(); ++i) {
			final Frame a = volumes.get(i);
			final Frame b = volumes.get(i + 1);
			tasks.add(() -> scorer.score(a, b));
		}

		final List<SimilarityScore> results = scoreAll(tasks);
		final double[] scores = new double[results.size()];
		for (int i = 0; i < scores.length; ++i)
			scores[i] = results.get(i).getValue();
		return scores;
	}

	/**
	 * @return the scores of every frame against the reference, NaN at the
	 *     reference index
	 */
	public double[] scoreAgainstReference(final VolumeSet volumes, final int referenceIndex)
			throws DimensionMismatchException, InterruptedException {

		final Frame reference = volumes.get(referenceIndex);
		final List<Callable<SimilarityScore>> tasks = new ArrayList<>();
		for (final Frame frame : volumes)
			if (frame.getIndex() != referenceIndex)
				tasks.add(() -> scorer.score(frame, reference));

		final double[] scores = new double[volumes.size()];
		scores[referenceIndex] = Double.NaN;
		for (final SimilarityScore score : scoreAll(tasks))
			scores[score.getFirstIndex()] = score.getValue();
		return scores;
	}

	private List<SimilarityScore> scoreAll(final List<Callable<SimilarityScore>> tasks)
			throws DimensionMismatchException, InterruptedException {

		final ExecutorService exec = Executors.newFixedThreadPool(Math.min(numThreads, Math.max(1, tasks.size())));
		try {
			final List<Future<SimilarityScore>> futures = new ArrayList<>();
			for (final Callable<SimilarityScore> task : tasks)
				futures.add(exec.submit(task));

			final List<SimilarityScore> scores = new ArrayList<>();
			for (final Future<SimilarityScore> future : futures) {
				try {
					scores.add(future.get());
				} catch (final ExecutionException e) {
					if (e.getCause() instanceof DimensionMismatchException)
						throw (DimensionMismatchException)e.getCause();
					if (e.getCause() instanceof RuntimeException)
						throw (RuntimeException)e.getCause();
					throw new IllegalStateException(e.getCause());
				}
			}
			return scores;
		} finally {
			exec.shutdownNow();
		}
	}

	/**
	 * Find the smallest index i such that scores i .. i + lookahead - 1 all
	 * exceed the threshold.  The whole window must lie within the scores,
	 * a shorter run at the end of the series does not qualify.
	 *
	 * @param scores consecutive pair scores
	 * @param threshold
	 * @param lookahead
	 * @return
	 * @throws NoStableStartFrameException if no index qualifies
	 */
	public static int firstStableIndex(
			final double[] scores,
			final double threshold,
			final int lookahead) throws NoStableStartFrameException {

		for (int i = 0; i + lookahead <= scores.length; ++i) {
			boolean stable = true;
			for (int k = i; k < i + lookahead && stable; ++k)
				stable = scores[k] > threshold;
			if (stable)
				return i;
		}

		throw new NoStableStartFrameException(
				"score > " + threshold + " for " + lookahead + " consecutive pairs",
				scores);
	}

	/**
	 * Find the first frame whose score exceeds <code>ratio</code> times the
	 * mean of the best three scores.
	 *
	 * @param scores scores against the reference, the reference entry is ignored
	 * @param referenceIndex
	 * @param ratio
	 * @return
	 * @throws NoStableStartFrameException if no frame qualifies
	 */
	public static int firstAboveRatio(
			final double[] scores,
			final int referenceIndex,
			final double ratio) throws NoStableStartFrameException {

		final double[] sorted = new double[scores.length - 1];
		for (int i = 0, j = 0; i < scores.length; ++i)
			if (i != referenceIndex)
				sorted[j++] = scores[i];
		Arrays.sort(sorted);

		final int numTop = Math.min(NUM_TOP_SCORES, sorted.length);
		double maxObserved = 0;
		for (int i = sorted.length - numTop; i < sorted.length; ++i)
			maxObserved += sorted[i];
		maxObserved /= numTop;

		if (maxObserved > 0) {
			final double cutoff = ratio * maxObserved;
			for (int i = 0; i < scores.length; ++i)
				if (i != referenceIndex && scores[i] > cutoff)
					return i;
		}

		throw new NoStableStartFrameException(
				"score > " + ratio + " * " + maxObserved + " against the reference",
				scores);
	}
}
