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

import java.io.IOException;

import org.janelia.saalfeldlab.moco.registration.RegistrationMode;

/**
 * Persistent transforms keyed by moving frame index and mode.  Different
 * keys may be written concurrently, readers never observe a partially
 * written entry.
 */
public interface TransformStore {

	/**
	 * Store a transform.
	 *
	 * @param frameIndex the moving frame index of <code>transform</code>
	 * @param mode
	 * @param transform
	 * @param force replace an existing entry
	 * @throws TransformExistsException if an entry exists and force is not set
	 */
	public void put(
			final int frameIndex,
			final RegistrationMode mode,
			final FrameTransform transform,
			final boolean force) throws IOException, TransformExistsException;

	public default void put(
			final int frameIndex,
			final RegistrationMode mode,
			final FrameTransform transform) throws IOException, TransformExistsException {

		put(frameIndex, mode, transform, false);
	}

	/**
	 * @throws TransformNotFoundException if nothing is stored for this key
	 */
	public FrameTransform get(final int frameIndex, final RegistrationMode mode)
			throws IOException, TransformNotFoundException;

	public boolean has(final int frameIndex, final RegistrationMode mode) throws IOException;

	/**
	 * @return true if an entry was removed
	 */
	public boolean remove(final int frameIndex, final RegistrationMode mode) throws IOException;
}
