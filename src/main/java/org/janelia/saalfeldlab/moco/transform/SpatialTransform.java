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

import net.imglib2.RealLocalizable;
import net.imglib2.RealPositionable;

/**
 * A mapping of 3D coordinates.  Implementations may keep scratch state, use
 * {@link #copy()} for every thread.
 */
public interface SpatialTransform {

	public static final int N = 3;

	public void apply(final double[] source, final double[] target);

	public default void apply(final RealLocalizable source, final RealPositionable target) {

		final double[] s = new double[N];
		final double[] t = new double[N];
		source.localize(s);
		apply(s, t);
		target.setPosition(t);
	}

	public SpatialTransform copy();
}
