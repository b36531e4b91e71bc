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

import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Dense physical (LPS) displacements sampled on a voxel grid, stored as
 * <code>[x, y, z, 3]</code>.
 */
public class DisplacementField {

	private final RandomAccessibleInterval<DoubleType> field;
	private final VoxelGeometry geometry;

	public DisplacementField(final RandomAccessibleInterval<DoubleType> field, final VoxelGeometry geometry) {

		if (field.numDimensions() != 4 || field.dimension(3) != 3)
			throw new IllegalArgumentException("Expected a [x, y, z, 3] displacement field");

		this.field = field;
		this.geometry = geometry;
	}

	public RandomAccessibleInterval<DoubleType> getField() {

		return field;
	}

	public VoxelGeometry getGeometry() {

		return geometry;
	}

	public long[] gridDimensions() {

		return new long[]{field.dimension(0), field.dimension(1), field.dimension(2)};
	}

	/**
	 * @return x &#x21a6; x + u(x), n-linearly interpolated, border extended
	 */
	public SpatialTransform transform() {

		return new DisplacementFieldTransform<>(
				Views.interpolate(
						Views.extendBorder(Views.zeroMin(field)),
						new NLinearInterpolatorFactory<>()),
				geometry.physicalToVoxel());
	}

	/**
	 * Read a 3D vector image with three interleaved components.
	 */
	public static DisplacementField fromMetaImage(final MetaImage image) {

		if (image.numDimensions() != 3 || image.getNumChannels() != 3)
			throw new IllegalArgumentException(
					"Expected a 3D image with 3 components, got " + image.numDimensions() + "D with " +
							image.getNumChannels() + " components");

		final long[] dimensions = image.getDimensions();
		final int nx = (int)dimensions[0];
		final int ny = (int)dimensions[1];
		final int nz = (int)dimensions[2];
		final int numVoxels = nx * ny * nz;
		final float[] interleaved = image.getData();
		final double[] planar = new double[numVoxels * 3];
		for (int i = 0; i < numVoxels; ++i)
			for (int k = 0; k < 3; ++k)
				planar[k * numVoxels + i] = interleaved[i * 3 + k];

		return new DisplacementField(ArrayImgs.doubles(planar, nx, ny, nz, 3), image.getGeometry());
	}

	public MetaImage toMetaImage() {

		return MetaImage.createVectorField(field, geometry);
	}
}
