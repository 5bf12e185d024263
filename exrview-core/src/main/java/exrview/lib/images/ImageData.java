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

package exrview.lib.images;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.BiFunction;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;
import exrview.lib.images.ImageLoadException.ErrorType;

/**
 * The decoded content of an image: its channels, layers, data and display windows, and whether
 * color channels have been premultiplied by alpha.
 * <p>
 * An {@link exrview.lib.images.io.ImageLoader ImageLoader} creates and fills an instance, and
 * {@link #ensureValid(ChannelSelector, ThreadPool, int)} normalizes it before it is handed to an {@link Image}.
 * The order of channels is significant and is preserved unless a channel selector reorders them.
 */
public class ImageData {

	private List<Channel> channels = new ArrayList<>();
	private List<String> layers = new ArrayList<>();

	private ImageWindow dataWindow = ImageWindow.EMPTY;
	private ImageWindow displayWindow = ImageWindow.EMPTY;

	private boolean hasPremultipliedAlpha = false;

	private String partName = "";

	/**
	 * Get an unmodifiable view of the channels, in order.
	 * @return
	 */
	public List<Channel> getChannels() {
		return Collections.unmodifiableList(channels);
	}

	/**
	 * Append a channel.
	 * @param channel
	 */
	public void addChannel(Channel channel) {
		channels.add(Objects.requireNonNull(channel));
	}

	/**
	 * Get the channel with the specified name.
	 * @param name
	 * @return the channel, or null if there is no channel with this name
	 */
	public Channel getChannel(String name) {
		for (var c : channels) {
			if (c.getName().equals(name))
				return c;
		}
		return null;
	}

	/**
	 * Returns true if there is a channel with the specified name.
	 * @param name
	 * @return
	 */
	public boolean hasChannel(String name) {
		return getChannel(name) != null;
	}

	/**
	 * Get the names of all channels directly within a layer, i.e. not within nested layers.
	 * @param layerName the layer, or an empty string for the root layer
	 * @return
	 */
	public List<String> channelsInLayer(String layerName) {
		List<String> result = new ArrayList<>();
		if (layerName.isEmpty()) {
			for (var c : channels) {
				if (Channel.isTopmost(c.getName()))
					result.add(c.getName());
			}
		} else {
			String prefix = layerName + ".";
			for (var c : channels) {
				String name = c.getName();
				if (name.startsWith(prefix) && name.length() > prefix.length() && name.indexOf('.', prefix.length()) < 0)
					result.add(name);
			}
		}
		return result;
	}

	/**
	 * Get an unmodifiable view of the layer names.
	 * @return
	 */
	public List<String> getLayers() {
		return Collections.unmodifiableList(layers);
	}

	/**
	 * Append a layer name.
	 * @param layer
	 */
	public void addLayer(String layer) {
		layers.add(Objects.requireNonNull(layer));
	}

	public ImageWindow getDataWindow() {
		return dataWindow;
	}

	public void setDataWindow(ImageWindow dataWindow) {
		this.dataWindow = Objects.requireNonNull(dataWindow);
	}

	public ImageWindow getDisplayWindow() {
		return displayWindow;
	}

	public void setDisplayWindow(ImageWindow displayWindow) {
		this.displayWindow = Objects.requireNonNull(displayWindow);
	}

	/**
	 * Get the image width, taken from the data window.
	 * @return
	 */
	public int getWidth() {
		return dataWindow.getWidth();
	}

	/**
	 * Get the image height, taken from the data window.
	 * @return
	 */
	public int getHeight() {
		return dataWindow.getHeight();
	}

	public boolean hasPremultipliedAlpha() {
		return hasPremultipliedAlpha;
	}

	public void setHasPremultipliedAlpha(boolean hasPremultipliedAlpha) {
		this.hasPremultipliedAlpha = hasPremultipliedAlpha;
	}

	/**
	 * Get the name of the part of a multi-part file from which this data was read.
	 * @return the part name, or an empty string
	 */
	public String getPartName() {
		return partName;
	}

	public void setPartName(String partName) {
		this.partName = partName == null ? "" : partName;
	}

	private List<Task<Void>> alphaOperation(BiFunction<Channel, Channel, Task<Void>> fun) {
		List<Task<Void>> tasks = new ArrayList<>();
		for (String layer : layers) {
			String alphaChannelName = layer.isEmpty() ? "A" : layer + ".A";
			Channel alpha = getChannel(alphaChannelName);
			if (alpha == null)
				continue;
			for (String channelName : channelsInLayer(layer)) {
				if (!channelName.equals(alphaChannelName))
					tasks.add(fun.apply(getChannel(channelName), alpha));
			}
		}
		return tasks;
	}

	/**
	 * Multiply every channel by the alpha channel of its layer, if there is one.
	 * @param pool
	 * @param priority
	 * @return a task that fails with {@link ErrorType#DOUBLE_MULTIPLY} if alpha is already premultiplied
	 */
	public Task<Void> multiplyAlpha(ThreadPool pool, int priority) {
		if (hasPremultipliedAlpha)
			return Task.failed(new ImageLoadException(ErrorType.DOUBLE_MULTIPLY, "Can't multiply with alpha twice."));
		var tasks = alphaOperation((target, alpha) -> target.multiplyWith(alpha, pool, priority));
		return Task.allOf(tasks).then(v -> {
			hasPremultipliedAlpha = true;
			return null;
		});
	}

	/**
	 * Divide every channel by the alpha channel of its layer, if there is one.
	 * Values where alpha is 0 become 0.
	 * @param pool
	 * @param priority
	 * @return a task that fails with {@link ErrorType#DOUBLE_DIVIDE} if alpha is not premultiplied
	 */
	public Task<Void> unmultiplyAlpha(ThreadPool pool, int priority) {
		if (!hasPremultipliedAlpha)
			return Task.failed(new ImageLoadException(ErrorType.DOUBLE_DIVIDE, "Can't divide by alpha twice."));
		var tasks = alphaOperation((target, alpha) -> target.divideBy(alpha, pool, priority));
		return Task.allOf(tasks).then(v -> {
			hasPremultipliedAlpha = false;
			return null;
		});
	}

	/**
	 * Check and normalize freshly decoded data.
	 * <p>
	 * This fills in missing windows, checks channel sizes, applies the channel selector (which both
	 * filters and reorders channels, dropping layers left without channels), derives layers if none
	 * were given, and premultiplies alpha.
	 *
	 * @param selector channel selector; may be empty
	 * @param pool pool used for the alpha multiplication
	 * @param priority priority for the alpha multiplication
	 * @return a task that completes once the data is valid, or fails with an {@link ImageLoadException}
	 */
	public Task<Void> ensureValid(ChannelSelector selector, ThreadPool pool, int priority) {
		if (channels.isEmpty())
			return Task.failed(new ImageLoadException(ErrorType.EMPTY_IMAGE, "Images must have at least one channel."));

		var first = channels.get(0);
		if (!dataWindow.isValid())
			dataWindow = first.getSize();
		if (!displayWindow.isValid())
			displayWindow = first.getSize();

		for (var c : channels) {
			if (!c.getSize().sameSize(dataWindow)) {
				return Task.failed(new ImageLoadException(ErrorType.SIZE_MISMATCH, String.format(
						"All channels must have the same size as the data window. (%s:%dx%d != %dx%d)",
						c.getName(), c.getWidth(), c.getHeight(), getWidth(), getHeight())));
			}
		}

		if (selector != null && !selector.isEmpty()) {
			applySelector(selector);
			if (channels.isEmpty())
				return Task.failed(new ImageLoadException(ErrorType.NO_MATCHING_CHANNELS, "No channels match '" + selector + "'."));
		}

		if (layers.isEmpty()) {
			var layerNames = new TreeSet<String>();
			for (var c : channels)
				layerNames.add(Channel.head(c.getName()));
			layers.addAll(layerNames);
		}

		Task<Void> premultiply = hasPremultipliedAlpha ? Task.completed(null) : multiplyAlpha(pool, priority);
		return premultiply.then(v -> {
			if (!hasPremultipliedAlpha)
				throw new AssertionError("Image data must use a premultiplied-alpha representation after validation.");
			return null;
		});
	}

	private void applySelector(ChannelSelector selector) {
		List<int[]> matches = new ArrayList<>();
		for (int i = 0; i < channels.size(); i++) {
			int rank = selector.matchRank(channels.get(i).getName());
			if (rank >= 0)
				matches.add(new int[] {rank, i});
		}
		matches.sort(Comparator.<int[]>comparingInt(m -> m[0]).thenComparingInt(m -> m[1]));
		List<Channel> selected = new ArrayList<>(matches.size());
		for (var m : matches)
			selected.add(channels.get(m[1]));
		channels = selected;
		layers.removeIf(layer -> channelsInLayer(layer).isEmpty());
	}

	@Override
	public String toString() {
		return "ImageData: " + getWidth() + " x " + getHeight() + ", " + channels.size() + " channels, layers=" + layers
				+ (partName.isEmpty() ? "" : ", part=" + partName);
	}

}
