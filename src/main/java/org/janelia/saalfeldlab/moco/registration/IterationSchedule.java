package org.janelia.saalfeldlab.moco.registration;

import java.util.Arrays;
import java.util.Locale;

/**
 * Iterations per multi-resolution level, coarsest first, formatted as
 * integers joined by 'x', e.g. <code>100x50x25</code>.
 */
public class IterationSchedule {

	public static final IterationSchedule CRUISE = new IterationSchedule(100, 25, 10);
	public static final IterationSchedule DASH = new IterationSchedule(100, 25, 10, 0);

	private final int[] iterations;

	public IterationSchedule(final int... iterations) {

		if (iterations.length == 0)
			throw new IllegalArgumentException("An iteration schedule needs at least one level");
		for (final int i : iterations)
			if (i < 0)
				throw new IllegalArgumentException("Negative iteration count in " + Arrays.toString(iterations));

		this.iterations = iterations.clone();
	}

	public static IterationSchedule parse(final String schedule) {

		if (schedule == null || schedule.trim().isEmpty())
			throw new IllegalArgumentException("Empty iteration schedule");

		final String[] levels = schedule.trim().split("x", -1);
		final int[] iterations = new int[levels.length];
		for (int i = 0; i < levels.length; ++i) {
			if (!levels[i].matches("\\d+"))
				throw new IllegalArgumentException(
						"Iteration schedule '" + schedule + "' is not a list of non-negative integers separated by 'x'");
			try {
				iterations[i] = Integer.parseInt(levels[i]);
			} catch (final NumberFormatException e) {
				throw new IllegalArgumentException("Iteration count '" + levels[i] + "' is too large", e);
			}
		}
		return new IterationSchedule(iterations);
	}

	/**
	 * @param name cruise or dash
	 */
	public static IterationSchedule preset(final String name) {

		switch (name.toLowerCase(Locale.ROOT)) {
		case "cruise":
			return CRUISE;
		case "dash":
			return DASH;
		default:
			throw new IllegalArgumentException("Unknown schedule preset '" + name + "', use cruise or dash");
		}
	}

	public int numLevels() {

		return iterations.length;
	}

	public int[] getIterations() {

		return iterations.clone();
	}

	@Override
	public boolean equals(final Object other) {

		return other instanceof IterationSchedule && Arrays.equals(iterations, ((IterationSchedule)other).iterations);
	}

	@Override
	public int hashCode() {

		return Arrays.hashCode(iterations);
	}

	@Override
	public String toString() {

		final StringBuilder builder = new StringBuilder();
		for (int i = 0; i < iterations.length; ++i) {
			if (i > 0)
				builder.append('x');
			builder.append(iterations[i]);
		}
		return builder.toString();
	}
}
