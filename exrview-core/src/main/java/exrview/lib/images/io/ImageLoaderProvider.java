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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.Image;
import exrview.lib.images.ImageData;
import exrview.lib.images.ImageLoadException;
import exrview.lib.images.ImageLoadException.ErrorType;
import exrview.lib.images.ImagePriorities;

/**
 * Service provider for loading {@link Image Images} from a file path or stream.
 * <p>
 * This class is responsible for hunting through the available {@link ImageLoader ImageLoaders} to find
 * the first that claims the file. Loaders are tried in the order in which they are registered, and the
 * last one is used as a fallback if no other loader claims the file.
 * <p>
 * This is also the boundary at which load failures are handled: any exception is logged and turned into
 * an empty result, so that one broken file never affects other loads. Errors are not caught.
 */
public class ImageLoaderProvider {

	private static final Logger logger = LoggerFactory.getLogger(ImageLoaderProvider.class);

	private static final int MARK_LIMIT = 64;

	private final List<ImageLoader> loaders;

	/**
	 * Create a provider using all {@link ImageLoader ImageLoaders} registered with the {@link ServiceLoader}.
	 */
	public ImageLoaderProvider() {
		this(getInstalledLoaders());
	}

	/**
	 * Create a provider using a specific list of loaders.
	 * @param loaders the loaders, in the order they should be tried; the last is the fallback
	 */
	public ImageLoaderProvider(List<? extends ImageLoader> loaders) {
		if (loaders.isEmpty())
			throw new IllegalArgumentException("At least one image loader is required");
		this.loaders = Collections.unmodifiableList(new ArrayList<>(loaders));
	}

	/**
	 * Request all {@link ImageLoader ImageLoaders} registered with the {@link ServiceLoader}, in registration order.
	 * @return
	 */
	public static List<ImageLoader> getInstalledLoaders() {
		List<ImageLoader> list = new ArrayList<>();
		for (ImageLoader loader : ServiceLoader.load(ImageLoader.class)) {
			logger.debug("Found image loader: {}", loader.getName());
			list.add(loader);
		}
		return list;
	}

	/**
	 * Get the loaders used by this provider.
	 * @return an unmodifiable list
	 */
	public List<ImageLoader> getLoaders() {
		return loaders;
	}

	/**
	 * Load all images from a file at foreground priority, ahead of any background loading.
	 * <p>
	 * This is intended for an image that is needed for display right away.
	 * @param pool pool used for decoding
	 * @param path the file to read
	 * @param selector channel selector
	 * @return a task producing the loaded images; the list is empty if loading failed
	 */
	public Task<List<Image>> tryLoadImage(ThreadPool pool, Path path, ChannelSelector selector) {
		return tryLoadImage(pool, ImagePriorities.foreground(Image.drawId()), path, selector);
	}

	/**
	 * Load all images from a file.
	 * @param pool pool used for decoding
	 * @param priority priority of the decoding work
	 * @param path the file to read
	 * @param selector channel selector
	 * @return a task producing the loaded images; the list is empty if loading failed
	 * @see #tryLoadImage(ThreadPool, int, Path, InputStream, ChannelSelector)
	 */
	public Task<List<Image>> tryLoadImage(ThreadPool pool, int priority, Path path, ChannelSelector selector) {
		InputStream stream;
		try {
			stream = new BufferedInputStream(Files.newInputStream(path));
		} catch (IOException e) {
			logFailure(path, selector, new ImageLoadException(ErrorType.STREAM_ERROR, "Could not open file: " + e.getMessage(), e));
			return Task.completed(Collections.emptyList());
		}
		return tryLoadImage(pool, priority, path, stream, selector).whenComplete((images, t) -> {
			try {
				stream.close();
			} catch (IOException e) {
				logger.warn("Could not close {}: {}", path, e.getMessage());
			}
		});
	}

	/**
	 * Load all images from a stream.
	 * <p>
	 * Every {@link ImageData} produced by the loader is validated in turn and wrapped in an {@link Image}.
	 * If the data came from a named part of a multi-part file, the part name is added to the
	 * selector text used to name the image.
	 *
	 * @param pool pool used for decoding
	 * @param priority priority of the decoding work
	 * @param path the path of the file, used for naming and diagnostics
	 * @param stream the file content; the caller remains responsible for closing it
	 * @param selector channel selector
	 * @return a task producing the loaded images; the list is empty if loading failed
	 */
	public Task<List<Image>> tryLoadImage(ThreadPool pool, int priority, Path path, InputStream stream, ChannelSelector selector) {
		var channelSelector = selector == null ? ChannelSelector.NONE : selector;
		long startTime = System.nanoTime();
		Task<List<Image>> task;
		try {
			var markedStream = stream.markSupported() ? stream : new BufferedInputStream(stream);
			var loader = chooseLoader(markedStream);
			logger.debug("Loading {} with {}", path, loader.getName());
			task = loader.load(markedStream, path, channelSelector, pool, priority)
					.thenCompose(dataList -> createImages(dataList, path, channelSelector, pool, priority))
					.then(images -> {
						double seconds = (System.nanoTime() - startTime) / 1e9;
						logger.info(String.format("Loaded '%s' via %s after %.3f seconds.", path, loader.getName(), seconds));
						return images;
					});
		} catch (IOException | RuntimeException e) {
			task = Task.failed(e);
		}
		return task.handle((images, t) -> {
			if (t == null)
				return images;
			if (t instanceof Error)
				throw (Error)t;
			logFailure(path, channelSelector, t);
			return Collections.emptyList();
		});
	}

	private ImageLoader chooseLoader(InputStream stream) throws IOException {
		int last = loaders.size() - 1;
		for (int i = 0; i < last; i++) {
			var loader = loaders.get(i);
			stream.mark(MARK_LIMIT);
			boolean canLoad;
			try {
				canLoad = loader.canLoadFile(stream);
			} finally {
				stream.reset();
			}
			if (canLoad)
				return loader;
		}
		return loaders.get(last);
	}

	private static Task<List<Image>> createImages(List<ImageData> dataList, Path path, ChannelSelector selector, ThreadPool pool, int priority) {
		List<Image> images = new ArrayList<>();
		Task<Void> chain = Task.completed(null);
		for (var data : dataList) {
			chain = chain
					.thenCompose(v -> data.ensureValid(selector, pool, priority))
					.then(v -> {
						images.add(new Image(path, data, selector.withPartName(data.getPartName())));
						return null;
					});
		}
		return chain.then(v -> images);
	}

	private static void logFailure(Path path, ChannelSelector selector, Throwable t) {
		if (selector == null || selector.isEmpty())
			logger.error(String.format("Could not load '%s'. %s", path, t.getMessage()), t);
		else
			logger.error(String.format("Could not load '%s:%s'. %s", path, selector, t.getMessage()), t);
	}

}
