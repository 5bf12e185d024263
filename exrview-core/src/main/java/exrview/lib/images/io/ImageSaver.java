/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2024 ExrView developers
 * %%
 * ExrView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * ExrView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ExrView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package exrview.lib.images.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

import exrview.lib.images.Image;

/**
 * Encoder for one image file format.
 * <p>
 * Implementations are discovered with a {@link ServiceLoader}, in the same way as {@link ImageLoader}.
 */
public interface ImageSaver {

	/**
	 * Get a short, human-readable name for the format, e.g. "OpenEXR".
	 * @return
	 */
	String getName();

	/**
	 * Returns true if the values passed to the saver should have their color channels multiplied by alpha.
	 * @return
	 */
	boolean hasPremultipliedAlpha();

	/**
	 * Check whether this saver writes files with the given extension.
	 * @param extension the extension, with or without a leading dot; case is ignored
	 * @return
	 */
	boolean canSaveFile(String extension);

	/**
	 * Check whether this saver writes files with the extension of the given path.
	 * @param path
	 * @return
	 */
	default boolean canSaveFile(Path path) {
		var fileName = path.getFileName();
		if (fileName == null)
			return false;
		String name = fileName.toString();
		int ind = name.lastIndexOf('.');
		return ind >= 0 && canSaveFile(name.substring(ind + 1).toLowerCase(Locale.ROOT));
	}

	/**
	 * Write interleaved pixel values.
	 *
	 * @param stream the stream to write to; it is not closed
	 * @param path the file path, for diagnostics
	 * @param data values of all channels for each pixel in turn, row by row
	 * @param width
	 * @param height
	 * @param nChannels number of values per pixel
	 * @throws IOException if the image could not be written
	 */
	void save(OutputStream stream, Path path, float[] data, int width, int height, int nChannels) throws IOException;

	/**
	 * Write some channels of a loaded image.
	 *
	 * @param stream the stream to write to; it is not closed
	 * @param image the image
	 * @param channelNames the channels to write, which must all exist in the image
	 * @throws IOException if the image could not be written
	 */
	void save(OutputStream stream, Image image, List<String> channelNames) throws IOException;

	/**
	 * Get all savers available via the {@link ServiceLoader}.
	 * @return
	 */
	static List<ImageSaver> getSavers() {
		var savers = new ArrayList<ImageSaver>();
		for (var saver : ServiceLoader.load(ImageSaver.class))
			savers.add(saver);
		return savers;
	}

}
