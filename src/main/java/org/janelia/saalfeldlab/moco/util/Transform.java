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
package org.janelia.saalfeldlab.moco.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import org.janelia.saalfeldlab.moco.transform.SpatialTransform;
import org.janelia.saalfeldlab.moco.transform.TransformSequence;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.interpolation.randomaccess.ClampingNLinearInterpolatorFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Pair;
import net.imglib2.view.Views;

public class Transform {

	private Transform() {}

	/**
	 * Resample a 3D source into a 3D target grid.  For every target voxel
	 * the transform yields the source voxel coordinates that are sampled
	 * n-linearly, positions outside of the source take the background
	 * value.  Portions of the target are filled in parallel, every portion
	 * with its own copy of the transform.
	 *
	 * @param source
	 * @param target
	 * @param targetToSource voxel coordinates of the target into voxel
	 *     coordinates of the source
	 * @param background
	 * @param service
	 * @throws InterruptedException if interrupted while waiting, pending
	 *     portions are cancelled
	 * @throws ExecutionException if a portion failed
	 */
	public static <S extends RealType<S>, T extends RealType<T>> void resample(
			final RandomAccessibleInterval<S> source,
			final RandomAccessibleInterval<T> target,
			final SpatialTransform targetToSource,
			final S background,
			final ExecutorService service) throws InterruptedException, ExecutionException {

		if (source.numDimensions() != SpatialTransform.N || target.numDimensions() != SpatialTransform.N)
			throw new IllegalArgumentException("Can only resample 3D volumes");

		final RealRandomAccessible<S> interpolated = Views.interpolate(
				Views.extendValue(Views.zeroMin(source), background),
				new ClampingNLinearInterpolatorFactory<>());
		final IterableInterval<T> targetIterable = Views.flatIterable(target);

		final List<Callable<Void>> tasks = new ArrayList<>();
		for (final Pair<Long, Long> portion : Util.divideIntoPortions(targetIterable.size())) {
			tasks.add(() -> {
				final SpatialTransform transform = targetToSource.copy();
				final RealRandomAccess<S> access = interpolated.realRandomAccess();
				final Cursor<T> cursor = targetIterable.localizingCursor();
				final double[] voxel = new double[SpatialTransform.N];
				final double[] sourceVoxel = new double[SpatialTransform.N];

				cursor.jumpFwd(portion.getA());
				for (long l = 0; l < portion.getB(); ++l) {
					final T t = cursor.next();
					for (int d = 0; d < SpatialTransform.N; ++d)
						voxel[d] = cursor.getLongPosition(d) - target.min(d);
					transform.apply(voxel, sourceVoxel);
					access.setPosition(sourceVoxel);
					t.setReal(access.get().getRealDouble());
				}
				return null;
			});
		}

		Util.invokeAll(tasks, service);
	}

	/**
	 * Concatenate transforms, the first is applied first.
	 *
	 * @param transforms
	 * @return
	 */
	public static TransformSequence sequence(final SpatialTransform... transforms) {

		final TransformSequence sequence = new TransformSequence();
		for (final SpatialTransform transform : transforms)
			sequence.add(transform);
		return sequence;
	}
}
