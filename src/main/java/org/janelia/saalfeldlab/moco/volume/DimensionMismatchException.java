package org.janelia.saalfeldlab.moco.volume;

import java.util.Arrays;

import org.janelia.saalfeldlab.moco.MotionCorrectionException;

/**
 * Two volumes that must share a voxel grid do not.
 */
public class DimensionMismatchException extends MotionCorrectionException {

	private static final long serialVersionUID = 2731548120913865524L;

	private final long[] expected;
	private final long[] actual;

	public DimensionMismatchException(final String what, final long[] expected, final long[] actual) {

		super(what + " has dimensions " + Arrays.toString(actual) + ", expected " + Arrays.toString(expected));
		this.expected = expected.clone();
		this.actual = actual.clone();
	}

	public long[] getExpected() {

		return expected.clone();
	}

	public long[] getActual() {

		return actual.clone();
	}
}
