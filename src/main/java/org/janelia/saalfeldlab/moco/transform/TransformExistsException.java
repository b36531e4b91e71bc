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

import org.janelia.saalfeldlab.moco.MotionCorrectionException;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;

/**
 * A transform is already stored for a frame and overwriting was not
 * requested.
 */
public class TransformExistsException extends MotionCorrectionException {

	private static final long serialVersionUID = 8856208465305011938L;

	private final int frameIndex;
	private final RegistrationMode mode;

	public TransformExistsException(final int frameIndex, final RegistrationMode mode, final String detail) {

		super("A " + mode.getName() + " transform for frame " + frameIndex + " exists" +
				(detail == null ? "" : " (" + detail + ")") + ", force recompute to replace it");
		this.frameIndex = frameIndex;
		this.mode = mode;
	}

	public int getFrameIndex() {

		return frameIndex;
	}

	public RegistrationMode getMode() {

		return mode;
	}
}
