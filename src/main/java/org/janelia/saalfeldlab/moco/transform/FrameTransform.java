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
package org.janelia.saalfeldlab.moco.transform;

import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;

/**
 * Result of registering a moving frame to a fixed frame.  All coordinates
 * are physical (LPS).  The forward mapping takes fixed into moving
 * coordinates, x &#x21a6; A(x + u(x)), and is what resampling the moving
 * frame onto the fixed grid needs.  The inverse mapping is
 * y &#x21a6; p + v(p) with p = A<sup>-1</sup>y.
 */
public class FrameTransform {

	private final int movingIndex;
	private final int fixedIndex;
	private final RegistrationMode mode;
	private final Affine3D affine;
	private final DisplacementField forwardField;
	private final DisplacementField inverseField;
	private final IterationSchedule schedule;

	public FrameTransform(
			final int movingIndex,
			final int fixedIndex,
			final RegistrationMode mode,
			final Affine3D affine,
			final DisplacementField forwardField,
			final DisplacementField inverseField,
			final IterationSchedule schedule) {

		if ((forwardField == null) != (inverseField == null))
			throw new IllegalArgumentException("Forward and inverse displacement fields come in pairs");
		if (forwardField != null && mode != RegistrationMode.DEFORMABLE)
			throw new IllegalArgumentException("Displacement fields require deformable mode, not " + mode);

		this.movingIndex = movingIndex;
		this.fixedIndex = fixedIndex;
		this.mode = mode;
		this.affine = affine.copy();
		this.forwardField = forwardField;
		this.inverseField = inverseField;
		this.schedule = schedule;
	}

	public static FrameTransform affine(
			final int movingIndex,
			final int fixedIndex,
			final RegistrationMode mode,
			final Affine3D affine,
			final IterationSchedule schedule) {

		return new FrameTransform(movingIndex, fixedIndex, mode, affine, null, null, schedule);
	}

	/**
	 * The transform of a frame onto itself, e.g. the reference.
	 */
	public static FrameTransform identity(
			final int index,
			final RegistrationMode mode,
			final IterationSchedule schedule) {

		return affine(index, index, mode, new Affine3D(), schedule);
	}

	public int getMovingIndex() {

		return movingIndex;
	}

	public int getFixedIndex() {

		return fixedIndex;
	}

	public RegistrationMode getMode() {

		return mode;
	}

	public IterationSchedule getSchedule() {

		return schedule;
	}

	public Affine3D getAffine() {

		return affine.copy();
	}

	public boolean isDeformable() {

		return forwardField != null;
	}

	public DisplacementField getForwardField() {

		return forwardField;
	}

	public DisplacementField getInverseField() {

		return inverseField;
	}

	/**
	 * @return fixed into moving physical coordinates
	 */
	public SpatialTransform forward() {

		if (!isDeformable())
			return affine.copy();

		return new TransformSequence().add(forwardField.transform()).add(affine.copy());
	}

	/**
	 * @return moving into fixed physical coordinates
	 */
	public SpatialTransform inverse() {

		if (!isDeformable())
			return affine.inverse();

		return new TransformSequence().add(affine.inverse()).add(inverseField.transform());
	}

	/**
	 * @return true if this transform was computed for the same pair and
	 *     iteration schedule
	 */
	public boolean hasProvenance(final int fixedIndex, final RegistrationMode mode, final IterationSchedule schedule) {

		return this.fixedIndex == fixedIndex && this.mode == mode && this.schedule.equals(schedule);
	}

	@Override
	public String toString() {

		return mode.getName() + " " + movingIndex + " -> " + fixedIndex + " (" + schedule + ")";
	}
}
