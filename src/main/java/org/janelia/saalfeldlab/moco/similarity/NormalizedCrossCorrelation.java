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

import java.util.Arrays;

import org.janelia.saalfeldlab.moco.volume.DimensionMismatchException;
import org.janelia.saalfeldlab.moco.volume.Frame;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Global normalized cross-correlation (Pearson correlation coefficient) of
 * two frames, accumulated in double precision.
 *
 * An optional mask restricts the correlation to voxels where the mask is
 * non-zero, an optional shrink factor subsamples all inputs first.
 * Regions without variance cannot be correlated and score 0.
 */
public class NormalizedCrossCorrelation implements SimilarityScorer {

	private final RandomAccessibleInterval<? extends RealType<?>> mask;
	private final int shrink;

	/**
	 * @param mask voxels where the mask is non-zero are compared, null for all
	 * @param shrink subsampling step, 1 for full resolution
	 */
	public NormalizedCrossCorrelation(final RandomAccessibleInterval<? extends RealType<?>> mask, final int shrink) {

		if (shrink < 1)
			throw new IllegalArgumentException("Shrink factor must be at least 1: " + shrink);

		this.mask = mask;
		this.shrink = shrink;
	}

	public NormalizedCrossCorrelation() {

		this(null, 1);
	}

	@Override
	public SimilarityScore score(final Frame a, final Frame b) throws DimensionMismatchException {

		return new SimilarityScore(a.getIndex(), b.getIndex(), correlate(a.getVoxels(), b.getVoxels()));
	}

	public double correlate(
			final RandomAccessibleInterval<? extends RealType<?>> a,
			final RandomAccessibleInterval<? extends RealType<?>> b) throws DimensionMismatchException {

		if (!Arrays.equals(a.dimensionsAsLongArray(), b.dimensionsAsLongArray()))
			throw new DimensionMismatchException("Second volume", a.dimensionsAsLongArray(), b.dimensionsAsLongArray());
		if (mask != null && !Arrays.equals(a.dimensionsAsLongArray(), mask.dimensionsAsLongArray()))
			throw new DimensionMismatchException("Mask", a.dimensionsAsLongArray(), mask.dimensionsAsLongArray());

		final RandomAccessibleInterval<? extends RealType<?>> sa = shrink(a);
		final RandomAccessibleInterval<? extends RealType<?>> sb = shrink(b);
		final RandomAccessibleInterval<? extends RealType<?>> sm = mask == null ? null : shrink(mask);

		/* means */
		double sumA = 0, sumB = 0;
		long n = 0;
		{
			final Cursor<? extends RealType<?>> ca = Views.flatIterable(sa).cursor();
			final Cursor<? extends RealType<?>> cb = Views.flatIterable(sb).cursor();
			final Cursor<? extends RealType<?>> cm = sm == null ? null : Views.flatIterable(sm).cursor();
			while (ca.hasNext()) {
				final double va = ca.next().getRealDouble();
				final double vb = cb.next().getRealDouble();
				if (cm != null && cm.next().getRealDouble() == 0)
					continue;
				sumA += va;
				sumB += vb;
				++n;
			}
		}

		if (n == 0)
			return 0;

		final double meanA = sumA / n;
		final double meanB = sumB / n;

		/* covariance and variances */
		double sumAB = 0, sumAA = 0, sumBB = 0;
		{
			final Cursor<? extends RealType<?>> ca = Views.flatIterable(sa).cursor();
			final Cursor<? extends RealType<?>> cb = Views.flatIterable(sb).cursor();
			final Cursor<? extends RealType<?>> cm = sm == null ? null : Views.flatIterable(sm).cursor();
			while (ca.hasNext()) {
				final double da = ca.next().getRealDouble() - meanA;
				final double db = cb.next().getRealDouble() - meanB;
				if (cm != null && cm.next().getRealDouble() == 0)
					continue;
				sumAB += da * db;
				sumAA += da * da;
				sumBB += db * db;
			}
		}

		if (!(sumAA > 0 && sumBB > 0))
			return 0;

		return Math.max(-1, Math.min(1, sumAB / Math.sqrt(sumAA * sumBB)));
	}

	private RandomAccessibleInterval<? extends RealType<?>> shrink(final RandomAccessibleInterval<? extends RealType<?>> img) {

		if (shrink == 1)
			return img;
		return Views.subsample(img, shrink);
	}
}
