package org.janelia.saalfeldlab.moco.volume;

import java.util.Arrays;

import org.janelia.saalfeldlab.moco.transform.Affine3D;

/**
 * Voxel spacing, origin and direction cosines of a 3D grid in ITK (LPS)
 * physical space.  The direction matrix is stored row-major, column
 * <em>c</em> is the physical direction of voxel axis <em>c</em>.
 */
public class VoxelGeometry {

	private final double[] spacing;
	private final double[] origin;
	private final double[] direction;

	public VoxelGeometry(
			final double[] spacing,
			final double[] origin,
			final double[] direction) {

		if (spacing.length != 3 || origin.length != 3 || direction.length != 9)
			throw new IllegalArgumentException(
					"Expected 3 spacings, 3 origin coordinates and 9 direction cosines, got " +
							spacing.length + ", " + origin.length + ", " + direction.length);

		for (final double s : spacing)
			if (!(s > 0))
				throw new IllegalArgumentException("Voxel spacing must be positive: " + Arrays.toString(spacing));

		this.spacing = spacing.clone();
		this.origin = origin.clone();
		this.direction = direction.clone();
	}

	public VoxelGeometry(final double[] spacing, final double[] origin) {

		this(spacing, origin, identityDirection());
	}

	public static VoxelGeometry unit() {

		return new VoxelGeometry(new double[]{1, 1, 1}, new double[]{0, 0, 0});
	}

	public static double[] identityDirection() {

		return new double[]{
				1, 0, 0,
				0, 1, 0,
				0, 0, 1};
	}

	public double[] getSpacing() {

		return spacing.clone();
	}

	public double[] getOrigin() {

		return origin.clone();
	}

	public double[] getDirection() {

		return direction.clone();
	}

	/**
	 * @return the transform from voxel coordinates into physical coordinates
	 */
	public Affine3D voxelToPhysical() {

		final Affine3D affine = new Affine3D();
		for (int r = 0; r < 3; ++r) {
			for (int c = 0; c < 3; ++c)
				affine.set(direction[r * 3 + c] * spacing[c], r, c);
			affine.set(origin[r], r, 3);
		}
		return affine;
	}

	/**
	 * @return the transform from physical coordinates into voxel coordinates
	 */
	public Affine3D physicalToVoxel() {

		return voxelToPhysical().inverse();
	}

	public boolean equals(final VoxelGeometry other, final double epsilon) {

		for (int d = 0; d < 3; ++d) {
			if (Math.abs(spacing[d] - other.spacing[d]) > epsilon)
				return false;
			if (Math.abs(origin[d] - other.origin[d]) > epsilon)
				return false;
		}
		for (int i = 0; i < 9; ++i)
			if (Math.abs(direction[i] - other.direction[i]) > epsilon)
				return false;
		return true;
	}

	@Override
	public String toString() {

		return "spacing " + Arrays.toString(spacing) + ", origin " + Arrays.toString(origin);
	}
}
