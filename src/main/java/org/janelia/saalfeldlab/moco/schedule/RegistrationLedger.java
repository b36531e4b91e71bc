package org.janelia.saalfeldlab.moco.schedule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.saalfeldlab.moco.transform.FrameTransform;

/**
 * Authoritative per frame record of a registration run.  Frames move
 * <code>PENDING &#x2192; REGISTERING &#x2192; {SUCCEEDED | FAILED}</code>
 * or <code>PENDING &#x2192; SKIPPED</code>, terminal states never change.
 * All methods are thread safe.
 */
public class RegistrationLedger {

	private final RegistrationState[] states;
	private final RegistrationOutcome[] outcomes;

	public RegistrationLedger(final int numFrames) {

		states = new RegistrationState[numFrames];
		Arrays.fill(states, RegistrationState.PENDING);
		outcomes = new RegistrationOutcome[numFrames];
	}

	public int size() {

		return states.length;
	}

	public synchronized RegistrationState getState(final int index) {

		return states[index];
	}

	/**
	 * @return the outcome of a frame in terminal state, null otherwise
	 */
	public synchronized RegistrationOutcome getOutcome(final int index) {

		return outcomes[index];
	}

	public synchronized void start(final int index) {

		transition(index, RegistrationState.PENDING, RegistrationState.REGISTERING, null);
	}

	public synchronized void succeed(final int index, final FrameTransform transform) {

		transition(index, RegistrationState.REGISTERING, RegistrationState.SUCCEEDED, RegistrationOutcome.succeeded(transform));
	}

	public synchronized void fail(final int index, final Exception error) {

		transition(index, RegistrationState.REGISTERING, RegistrationState.FAILED, RegistrationOutcome.failed(error));
	}

	public synchronized void skip(final int index, final String reason, final FrameTransform transform) {

		transition(index, RegistrationState.PENDING, RegistrationState.SKIPPED, RegistrationOutcome.skipped(reason, transform));
	}

	/**
	 * Fail a frame that may not have started, e.g. when a run is cancelled.
	 * Frames in terminal state are left alone.
	 *
	 * @return true if the frame was failed
	 */
	public synchronized boolean abort(final int index, final Exception error) {

		if (states[index].isTerminal())
			return false;

		if (states[index] == RegistrationState.PENDING)
			start(index);
		fail(index, error);
		return true;
	}

	private void transition(
			final int index,
			final RegistrationState from,
			final RegistrationState to,
			final RegistrationOutcome outcome) {

		if (states[index] != from)
			throw new IllegalStateException(
					"Frame " + index + " cannot change from " + states[index] + " to " + to + ", expected " + from);

		states[index] = to;
		outcomes[index] = outcome;
		System.out.println(
				"frame " + index + ": " + from + " -> " + (outcome == null ? to.toString() : outcome.toString()));
	}

	public synchronized int count(final RegistrationState state) {

		int n = 0;
		for (final RegistrationState s : states)
			if (s == state)
				++n;
		return n;
	}

	/**
	 * @return indices of frames in <code>state</code>, increasing
	 */
	public synchronized int[] indices(final RegistrationState state) {

		final List<Integer> list = new ArrayList<>();
		for (int i = 0; i < states.length; ++i)
			if (states[i] == state)
				list.add(i);
		return list.stream().mapToInt(Integer::intValue).toArray();
	}

	/**
	 * @return true if every frame is in a terminal state
	 */
	public synchronized boolean isComplete() {

		for (final RegistrationState s : states)
			if (!s.isTerminal())
				return false;
		return true;
	}

	@Override
	public synchronized String toString() {

		return String.format(
				"%d succeeded, %d failed, %d skipped, %d unfinished",
				count(RegistrationState.SUCCEEDED),
				count(RegistrationState.FAILED),
				count(RegistrationState.SKIPPED),
				count(RegistrationState.PENDING) + count(RegistrationState.REGISTERING));
	}
}
