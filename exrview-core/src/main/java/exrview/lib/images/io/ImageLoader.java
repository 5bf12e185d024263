/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
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
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.ImageData;

/**
 * Decoder for one image file format.
 * <p>
 * Implementations are discovered with a {@link java.util.ServiceLoader} and tried in registration order by
 * {@link ImageLoaderProvider}. They should be stateless, since a single instance may be used for many
 * concurrent loads.
 */
public interface ImageLoader {

	/**
	 * Get a short, human-readable name for the format, e.g. "OpenEXR".
	 * @return
	 */
	String getName();

	/**
	 * Check whether the stream looks like something this loader can decode, usually by reading a few magic bytes.
	 * <p>
	 * The stream supports {@link InputStream#mark(int)}; implementations must leave it at the position it had
	 * on entry.
	 *
	 * @param stream
	 * @return true if the loader should be used for this stream
	 * @throws IOException if the stream could not be read
	 */
	boolean canLoadFile(InputStream stream) throws IOException;

	/**
	 * Decode an image.
	 * <p>
	 * Work that can run in parallel should be scheduled on the pool at the given priority. The returned
	 * data does not need to be validated; this happens afterwards.
	 *
	 * @param stream the stream, positioned at the start of the file
	 * @param path the file path, for diagnostics
	 * @param selector channel selector; loaders may use it to skip channels that are not needed
	 * @param pool the pool to use for decoding
	 * @param priority the priority for pool work
	 * @return a task producing one {@link ImageData} per decoded part
	 * @throws IOException if decoding fails before any asynchronous work starts
	 */
	Task<List<ImageData>> load(InputStream stream, Path path, ChannelSelector selector, ThreadPool pool, int priority) throws IOException;

}
