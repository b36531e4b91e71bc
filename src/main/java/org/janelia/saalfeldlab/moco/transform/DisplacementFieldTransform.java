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

import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.type.numeric.RealType;

/**
 * Continuous lookup of physical displacements x &#x21a6; x + u(x).  The
 * displacement field is sampled on a voxel grid whose last dimension
 * enumerates the displacement components, physical coordinates are
 * mapped into that grid first.
 */
public class DisplacementFieldTransform<T extends RealType<T>> implements SpatialTransform {

	private final RealRandomAccessible<T> displacement;

	private final RealRandomAccess<T> displacementAccess;

	private final Affine3D physicalToVoxel;

	private final double[] voxel = new double[N];

	public DisplacementFieldTransform(
			final RealRandomAccessible<T> displacement,
			final Affine3D physicalToVoxel) {

		if (displacement.numDimensions() != N + 1)
			throw new IllegalArgumentException(
					"Expected a " + (N + 1) + "D displacement field, got " + displacement.numDimensions() + "D");

		this.displacement = displacement;
		this.physicalToVoxel = physicalToVoxel;
		displacementAccess = displacement.realRandomAccess();
	}

	@Override
	public void apply(final double[] source, final double[] target) {

		physicalToVoxel.apply(source, voxel);
		for (int d = 0; d < N; d++)
			displacementAccess.setPosition(voxel[d], d);

		final double x = source[0];
		final double y = source[1];
		final double z = source[2];

		displacementAccess.setPosition(0, N);
		target[0] = x + displacementAccess.get().getRealDouble();
		displacementAccess.setPosition(1, N);
		target[1] = y + displacementAccess.get().getRealDouble();
		displacementAccess.setPosition(2, N);
		target[2] = z + displacementAccess.get().getRealDouble();
	}

	@Override
	public DisplacementFieldTransform<T> copy() {

		return new DisplacementFieldTransform<>(displacement, physicalToVoxel.copy());
	}
}
