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
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.registration.IterationSchedule;
import org.janelia.saalfeldlab.moco.registration.RegistrationMode;
import org.janelia.saalfeldlab.moco.util.Util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Stores every transform in its own directory
 * <code>&lt;root&gt;/&lt;mode&gt;/frame-NNNN</code>.  Indices, mode,
 * iteration schedule and the row packed affine go to
 * <code>attributes.json</code>, displacement fields to the compressed
 * vector images <code>forward.mha</code> and <code>inverse.mha</code> that
 * carry their grid geometry.
 *
 * Entries are written into a hidden sibling first and then renamed into
 * place.
 */
public class DirectoryTransformStore implements TransformStore {

	public static final String ATTRIBUTES_FILE = "attributes.json";
	public static final String FORWARD_FIELD = "forward" + MetaImage.LOCAL_EXTENSION;
	public static final String INVERSE_FIELD = "inverse" + MetaImage.LOCAL_EXTENSION;

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private static class Attributes {

		Integer movingIndex;
		Integer fixedIndex;
		String mode;
		String schedule;
		double[] affine;
	}

	private final Path root;

	public DirectoryTransformStore(final Path root) {

		this.root = root;
	}

	public Path getRoot() {

		return root;
	}

	public Path entryPath(final int frameIndex, final RegistrationMode mode) {

		return root.resolve(mode.getName()).resolve(Util.frameLabel(frameIndex));
	}

	@Override
	public boolean has(final int frameIndex, final RegistrationMode mode) {

		return Files.isRegularFile(entryPath(frameIndex, mode).resolve(ATTRIBUTES_FILE));
	}

	@Override
	public void put(
			final int frameIndex,
			final RegistrationMode mode,
			final FrameTransform transform,
			final boolean force) throws IOException, TransformExistsException {

		if (transform.getMovingIndex() != frameIndex || transform.getMode() != mode)
			throw new IllegalArgumentException("Transform " + transform + " cannot be stored as " + mode.getName() + " frame " + frameIndex);

		final Path entry = entryPath(frameIndex, mode);
		if (!force && Files.exists(entry))
			throw new TransformExistsException(frameIndex, mode, null);

		final Path parent = Files.createDirectories(entry.getParent());
		final Path temporary = parent.resolve("." + entry.getFileName() + "." + UUID.randomUUID() + ".tmp");
		final Path replaced = parent.resolve("." + entry.getFileName() + "." + UUID.randomUUID() + ".old");
		try {
			write(temporary, transform);

			if (force && Files.exists(entry))
				Files.move(entry, replaced, StandardCopyOption.ATOMIC_MOVE);

			try {
				Files.move(temporary, entry, StandardCopyOption.ATOMIC_MOVE);
			} catch (final FileAlreadyExistsException | DirectoryNotEmptyException e) {
				throw new TransformExistsException(frameIndex, mode, "written concurrently");
			}
		} finally {
			Util.deleteRecursively(temporary);
			Util.deleteRecursively(replaced);
		}
	}

	@Override
	public FrameTransform get(final int frameIndex, final RegistrationMode mode)
			throws IOException, TransformNotFoundException {

		final Path entry = entryPath(frameIndex, mode);
		final Path attributesFile = entry.resolve(ATTRIBUTES_FILE);
		if (!Files.isRegularFile(attributesFile))
			throw new TransformNotFoundException(frameIndex, mode);

		final Attributes attributes;
		try (final Reader reader = Files.newBufferedReader(attributesFile, StandardCharsets.UTF_8)) {
			attributes = GSON.fromJson(reader, Attributes.class);
		} catch (final JsonParseException e) {
			throw new IOException("Cannot parse " + attributesFile, e);
		}

		if (attributes == null ||
				attributes.movingIndex == null ||
				attributes.fixedIndex == null ||
				attributes.mode == null ||
				attributes.schedule == null ||
				attributes.affine == null ||
				attributes.affine.length != 12)
			throw new IOException("Transform entry " + entry + " is incomplete");

		final Path forwardFile = entry.resolve(FORWARD_FIELD);
		final Path inverseFile = entry.resolve(INVERSE_FIELD);
		final DisplacementField forward = Files.exists(forwardFile) ? readField(forwardFile) : null;
		final DisplacementField inverse = Files.exists(inverseFile) ? readField(inverseFile) : null;

		try {
			return new FrameTransform(
					attributes.movingIndex,
					attributes.fixedIndex,
					RegistrationMode.valueOf(attributes.mode),
					Affine3D.rowPacked(attributes.affine),
					forward,
					inverse,
					IterationSchedule.parse(attributes.schedule));
		} catch (final IllegalArgumentException e) {
			throw new IOException("Transform entry " + entry + " is invalid", e);
		}
	}

	@Override
	public boolean remove(final int frameIndex, final RegistrationMode mode) throws IOException {

		final Path entry = entryPath(frameIndex, mode);
		if (!Files.exists(entry))
			return false;

		Util.deleteRecursively(entry);
		return true;
	}

	private static void write(final Path entry, final FrameTransform transform) throws IOException {

		Files.createDirectories(entry);

		final Attributes attributes = new Attributes();
		attributes.movingIndex = transform.getMovingIndex();
		attributes.fixedIndex = transform.getFixedIndex();
		attributes.mode = transform.getMode().name();
		attributes.schedule = transform.getSchedule().toString();
		attributes.affine = transform.getAffine().getRowPackedCopy();

		try (final Writer writer = Files.newBufferedWriter(entry.resolve(ATTRIBUTES_FILE), StandardCharsets.UTF_8)) {
			GSON.toJson(attributes, writer);
		}

		if (transform.isDeformable()) {
			MetaImage.write(entry.resolve(FORWARD_FIELD), transform.getForwardField().toMetaImage(), true);
			MetaImage.write(entry.resolve(INVERSE_FIELD), transform.getInverseField().toMetaImage(), true);
		}
	}

	private static DisplacementField readField(final Path file) throws IOException {

		try {
			return DisplacementField.fromMetaImage(MetaImage.read(file));
		} catch (final IllegalArgumentException e) {
			throw new IOException("Displacement field " + file + " is invalid", e);
		}
	}
}
