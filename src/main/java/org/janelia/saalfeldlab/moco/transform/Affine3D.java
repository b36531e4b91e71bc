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

import java.util.Arrays;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A 3D affine transform stored as a homogeneous 4x4 matrix.  Mutators
 * that take another transform or a rotation, scale or translation apply
 * it after this transform, i.e. <code>this = a &#x2218; this</code>.
 */
public class Affine3D implements SpatialTransform {

	private Array2DRowRealMatrix matrix;

	public Affine3D() {

		this(new Array2DRowRealMatrix(4, 4));
		for (int d = 0; d < 4; ++d)
			matrix.setEntry(d, d, 1);
	}

	private Affine3D(final Array2DRowRealMatrix matrix) {

		this.matrix = matrix;
	}

	/**
	 * @param rowPacked the upper 3 rows of the matrix, row by row
	 */
	public static Affine3D rowPacked(final double... rowPacked) {

		final Affine3D affine = new Affine3D();
		affine.set(rowPacked);
		return affine;
	}

	public double get(final int row, final int column) {

		return matrix.getEntry(row, column);
	}

	public void set(final double value, final int row, final int column) {

		if (row > 2)
			throw new IndexOutOfBoundsException("Row " + row + " of an affine transform is fixed");

		matrix.setEntry(row, column, value);
	}

	public void set(final double... rowPacked) {

		if (rowPacked.length != 12)
			throw new IllegalArgumentException("Expected 12 row packed values, got " + rowPacked.length);

		for (int r = 0; r < 3; ++r)
			for (int c = 0; c < 4; ++c)
				matrix.setEntry(r, c, rowPacked[r * 4 + c]);
	}

	public void set(final Affine3D affine) {

		matrix = (Array2DRowRealMatrix)affine.matrix.copy();
	}

	public double[] getRowPackedCopy() {

		final double[] rowPacked = new double[12];
		for (int r = 0; r < 3; ++r)
			for (int c = 0; c < 4; ++c)
				rowPacked[r * 4 + c] = matrix.getEntry(r, c);
		return rowPacked;
	}

	public void setTranslation(final double... t) {

		for (int d = 0; d < N; ++d)
			matrix.setEntry(d, 3, t[d]);
	}

	public double[] getTranslation() {

		return new double[]{matrix.getEntry(0, 3), matrix.getEntry(1, 3), matrix.getEntry(2, 3)};
	}

	public Affine3D preConcatenate(final Affine3D affine) {

		matrix = affine.matrix.multiply(matrix);
		return this;
	}

	public Affine3D concatenate(final Affine3D affine) {

		matrix = matrix.multiply(affine.matrix);
		return this;
	}

	public Affine3D translate(final double... t) {

		final Affine3D translation = new Affine3D();
		translation.setTranslation(t);
		return preConcatenate(translation);
	}

	public Affine3D scale(final double s) {

		final Affine3D scale = new Affine3D();
		for (int d = 0; d < N; ++d)
			scale.matrix.setEntry(d, d, s);
		return preConcatenate(scale);
	}

	/**
	 * Rotate by <code>angle</code> radians about the given axis.
	 */
	public Affine3D rotate(final int axis, final double angle) {

		final int a = (axis + 1) % N;
		final int b = (axis + 2) % N;
		final double cos = Math.cos(angle);
		final double sin = Math.sin(angle);

		final Affine3D rotation = new Affine3D();
		rotation.matrix.setEntry(a, a, cos);
		rotation.matrix.setEntry(a, b, -sin);
		rotation.matrix.setEntry(b, a, sin);
		rotation.matrix.setEntry(b, b, cos);
		return preConcatenate(rotation);
	}

	/**
	 * @throws org.apache.commons.math3.linear.SingularMatrixException
	 *     if the linear part is singular
	 */
	public Affine3D inverse() {

		final RealMatrix inverse = MatrixUtils.inverse(matrix);
		return new Affine3D(new Array2DRowRealMatrix(inverse.getData(), false));
	}

	public boolean isIdentity(final double epsilon) {

		for (int r = 0; r < 3; ++r)
			for (int c = 0; c < 4; ++c)
				if (Math.abs(matrix.getEntry(r, c) - (r == c ? 1 : 0)) > epsilon)
					return false;
		return true;
	}

	@Override
	public void apply(final double[] source, final double[] target) {

		final double[][] m = matrix.getDataRef();
		final double x = source[0];
		final double y = source[1];
		final double z = source[2];
		for (int r = 0; r < N; ++r)
			target[r] = m[r][0] * x + m[r][1] * y + m[r][2] * z + m[r][3];
	}

	@Override
	public Affine3D copy() {

		return new Affine3D((Array2DRowRealMatrix)matrix.copy());
	}

	@Override
	public String toString() {

		return "3d-affine: " + Arrays.toString(getRowPackedCopy());
	}
}
