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
 * No transform is stored for a frame.
 */
public class TransformNotFoundException extends MotionCorrectionException {

	private static final long serialVersionUID = -7296830118004453327L;

	private final int frameIndex;
	private final RegistrationMode mode;

	public TransformNotFoundException(final int frameIndex, final RegistrationMode mode) {

		super("No " + mode.getName() + " transform stored for frame " + frameIndex);
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
