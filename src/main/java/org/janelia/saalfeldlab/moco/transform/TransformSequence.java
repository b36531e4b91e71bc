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

import java.util.ArrayList;
import java.util.List;

/**
 * Applies transforms one after the other, the first added is applied first.
 */
public class TransformSequence implements SpatialTransform {

	private final List<SpatialTransform> transforms = new ArrayList<>();

	private final double[] tmp = new double[N];

	public TransformSequence add(final SpatialTransform transform) {

		transforms.add(transform);
		return this;
	}

	public int size() {

		return transforms.size();
	}

	@Override
	public void apply(final double[] source, final double[] target) {

		System.arraycopy(source, 0, tmp, 0, N);
		for (final SpatialTransform transform : transforms) {
			transform.apply(tmp, target);
			System.arraycopy(target, 0, tmp, 0, N);
		}
		System.arraycopy(tmp, 0, target, 0, N);
	}

	@Override
	public TransformSequence copy() {

		final TransformSequence copy = new TransformSequence();
		for (final SpatialTransform transform : transforms)
			copy.add(transform.copy());
		return copy;
	}
}
