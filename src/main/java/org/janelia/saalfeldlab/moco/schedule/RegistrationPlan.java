package org.janelia.saalfeldlab.moco.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;

/**
 * Which frame registers to which, and in what order.
 */
public class RegistrationPlan {

	private final int numFrames;
	private final int referenceIndex;
	private final int startIndex;
	private final ReferenceStrategy strategy;
	private final RegistrationMode mode;
	private final IterationSchedule schedule;
	private final boolean passThroughBeforeStart;
	private final boolean force;

	/**
	 * @param numFrames
	 * @param referenceIndex
	 * @param startIndex first frame considered stable
	 * @param strategy
	 * @param mode
	 * @param schedule
	 * @param passThroughBeforeStart skip frames before <code>startIndex</code>
	 *     and pass them through unchanged
	 * @param force recompute stored transforms
	 */
	public RegistrationPlan(
			final int numFrames,
			final int referenceIndex,
			final int startIndex,
			final ReferenceStrategy strategy,
			final RegistrationMode mode,
			final IterationSchedule schedule,
			final boolean passThroughBeforeStart,
			final boolean force) {

		if (referenceIndex < 0 || referenceIndex >= numFrames)
			throw new IllegalArgumentException("Reference frame " + referenceIndex + " is outside of [0, " + (numFrames - 1) + "]");
		if (startIndex < 0 || startIndex >= numFrames)
			throw new IllegalArgumentException("Start frame " + startIndex + " is outside of [0, " + (numFrames - 1) + "]");

		this.numFrames = numFrames;
		this.referenceIndex = referenceIndex;
		this.startIndex = startIndex;
		this.strategy = strategy;
		this.mode = mode;
		this.schedule = schedule;
		this.passThroughBeforeStart = passThroughBeforeStart;
		this.force = force;
	}

	public int getNumFrames() {

		return numFrames;
	}

	public int getReferenceIndex() {

		return referenceIndex;
	}

	public int getStartIndex() {

		return startIndex;
	}

	public ReferenceStrategy getStrategy() {

		return strategy;
	}

	public RegistrationMode getMode() {

		return mode;
	}

	public IterationSchedule getSchedule() {

		return schedule;
	}

	public boolean isPassThroughBeforeStart() {

		return passThroughBeforeStart;
	}

	public boolean isForce() {

		return force;
	}

	/**
	 * @return true if the frame is copied unchanged because it precedes the
	 *     start frame
	 */
	public boolean isPassThrough(final int index) {

		return passThroughBeforeStart && index < startIndex && index != referenceIndex;
	}

	public boolean isScheduled(final int index) {

		return index != referenceIndex && !isPassThrough(index);
	}

	/**
	 * @return the frame that <code>index</code> registers to, the reference
	 *     for {@link ReferenceStrategy#FIXED}, the nearest scheduled
	 *     neighbour towards the reference for {@link ReferenceStrategy#ROLLING}
	 */
	public int fixedIndexOf(final int index) {

		if (strategy == ReferenceStrategy.FIXED)
			return referenceIndex;

		final int step = index < referenceIndex ? 1 : -1;
		int fixed = index + step;
		while (fixed != referenceIndex && !isScheduled(fixed))
			fixed += step;
		return fixed;
	}

	/**
	 * @return scheduled frames by increasing distance from the reference,
	 *     ties broken by index
	 */
	public List<Integer> registrationOrder() {

		final List<Integer> order = new ArrayList<>();
		for (int i = 0; i < numFrames; ++i)
			if (isScheduled(i))
				order.add(i);

		order.sort(Comparator.<Integer>comparingInt(i -> Math.abs(i - referenceIndex)).thenComparingInt(i -> i));
		return order;
	}

	@Override
	public String toString() {

		return strategy + " " + mode.getName() + " registration of " + numFrames + " frames to reference " + referenceIndex +
				", start frame " + startIndex + ", schedule " + schedule;
	}
}
