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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A loaded image, ready for display.
 * <p>
 * Each image owns its validated {@link ImageData} and the {@link ChannelGroup ChannelGroups} derived from
 * it when the image is created. Images are identified by a draw id, which increases with every image
 * created in this process; the draw id also serves as a scheduling priority, so that more recently
 * requested images are preferred.
 * <p>
 * The pixel data should not be modified after construction, except through
 * {@link #updateChannel(String, int, int, int, int, float[])}.
 */
public class Image {

	private static final Logger logger = LoggerFactory.getLogger(Image.class);

	private static final AtomicInteger drawIdCounter = new AtomicInteger(0);

	private static final String[][] CANONICAL_GROUPS = {
			{"R", "G", "B"},
			{"r", "g", "b"},
			{"X", "Y", "Z"},
			{"x", "y", "z"},
			{"U", "V"},
			{"u", "v"},
			{"Z"},
			{"z"},
	};

	private final Path path;
	private final String channelSelector;
	private final String name;
	private final ImageData data;
	private final int id;
	private final List<ChannelGroup> channelGroups;

	/**
	 * Create an image from validated data.
	 * @param path the file from which the image was read
	 * @param data the validated data; the image takes ownership of it
	 * @param channelSelector the selector used when loading, for display purposes; may be empty
	 */
	public Image(Path path, ImageData data, String channelSelector) {
		this.path = Objects.requireNonNull(path);
		this.data = Objects.requireNonNull(data);
		this.channelSelector = channelSelector == null ? "" : channelSelector;
		this.id = drawId();
		this.name = this.channelSelector.isEmpty() ? path.toString() : path + ":" + this.channelSelector;

		List<ChannelGroup> groups = new ArrayList<>();
		for (String layer : data.getLayers())
			groups.addAll(getGroupedChannels(layer));
		this.channelGroups = Collections.unmodifiableList(groups);
	}

	/**
	 * Get the next draw id, incrementing the process-wide counter.
	 * @return
	 */
	public static int drawId() {
		return drawIdCounter.getAndIncrement();
	}

	/**
	 * Get the unique draw id assigned when this image was created.
	 * @return
	 */
	public int getId() {
		return id;
	}

	public Path getPath() {
		return path;
	}

	public String getChannelSelector() {
		return channelSelector;
	}

	/**
	 * Get the full name of the image, which is the path followed by the channel selector (if any).
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the file name of the image, without directories or channel selector.
	 * @return
	 */
	public String getShortName() {
		var fileName = path.getFileName();
		return fileName == null ? path.toString() : fileName.toString();
	}

	public int getWidth() {
		return data.getWidth();
	}

	public int getHeight() {
		return data.getHeight();
	}

	public ImageWindow getDataWindow() {
		return data.getDataWindow();
	}

	public ImageWindow getDisplayWindow() {
		return data.getDisplayWindow();
	}

	public List<String> getLayers() {
		return data.getLayers();
	}

	/**
	 * Get a channel by name.
	 * @param channelName
	 * @return the channel, or null if there is no channel with this name
	 */
	public Channel getChannel(String channelName) {
		return data.getChannel(channelName);
	}

	/**
	 * Get the names of all channels, in order.
	 * @return
	 */
	public List<String> getChannelNames() {
		return data.getChannels().stream().map(Channel::getName).collect(Collectors.toList());
	}

	/**
	 * Get all channel groups, for all layers in order.
	 * @return an unmodifiable list
	 */
	public List<ChannelGroup> getChannelGroups() {
		return channelGroups;
	}

	/**
	 * Get the channels belonging to a named group.
	 * @param groupName
	 * @return the channel names, or an empty list if there is no group with this name
	 */
	public List<String> channelsInGroup(String groupName) {
		for (var group : channelGroups) {
			if (group.getName().equals(groupName))
				return group.getChannels();
		}
		return Collections.emptyList();
	}

	/**
	 * Arrange the channels of a layer into groups for display.
	 * <p>
	 * Well-known channel combinations (RGB, XYZ, UV, Z, in upper or lower case) are grouped first.
	 * Every remaining channel is shown as a gray group of its own. Groups with a single channel repeat it three
	 * times, and the alpha channel of the layer, if there is one, is appended to every group.
	 *
	 * @param layerName the layer, or an empty string for the root layer
	 * @return the groups; never empty for a layer of this image
	 */
	public List<ChannelGroup> getGroupedChannels(String layerName) {
		String layerPrefix = layerName.isEmpty() ? "" : layerName + ".";
		String alphaChannelName = layerPrefix + "A";

		List<String> allChannels = data.channelsInLayer(layerName);
		boolean hasAlpha = allChannels.remove(alphaChannelName);

		List<ChannelGroup> result = new ArrayList<>();
		for (String[] group : CANONICAL_GROUPS) {
			List<String> groupChannels = new ArrayList<>();
			for (String channel : group) {
				String name = layerPrefix + channel;
				if (allChannels.remove(name))
					groupChannels.add(name);
			}
			if (groupChannels.isEmpty())
				continue;

			if (groupChannels.size() == 1) {
				groupChannels.add(groupChannels.get(0));
				groupChannels.add(groupChannels.get(0));
			}
			if (hasAlpha)
				groupChannels.add(alphaChannelName);
			result.add(createChannelGroup(layerName, groupChannels));
		}

		for (String name : allChannels) {
			if (hasAlpha)
				result.add(createChannelGroup(layerName, List.of(name, name, name, alphaChannelName)));
			else
				result.add(createChannelGroup(layerName, List.of(name, name, name)));
		}

		if (hasAlpha && result.isEmpty())
			result.add(createChannelGroup(layerName, List.of(alphaChannelName, alphaChannelName, alphaChannelName)));

		if (result.isEmpty())
			throw new AssertionError("Layer '" + layerName + "' of " + name + " has no channels to display.");

		return result;
	}

	private static ChannelGroup createChannelGroup(String layerName, List<String> channels) {
		var tails = new LinkedHashSet<String>();
		for (String channel : channels)
			tails.add(Channel.tail(channel));
		String channelsString = String.join(",", tails);

		String groupName;
		if (layerName.isEmpty())
			groupName = channelsString;
		else if (tails.size() == 1)
			groupName = layerName + "." + channelsString;
		else
			groupName = layerName + ".(" + channelsString + ")";
		return new ChannelGroup(groupName, channels);
	}

	/**
	 * Get the channels of a layer in display order, listing the alpha channel only once.
	 * @param layerName
	 * @return
	 */
	public List<String> getSortedChannels(String layerName) {
		String alphaChannelName = layerName.isEmpty() ? "A" : layerName + ".A";
		boolean includesAlphaChannel = false;
		List<String> result = new ArrayList<>();
		for (var group : getGroupedChannels(layerName)) {
			for (String channel : group.getChannels()) {
				if (channel.equals(alphaChannelName)) {
					if (includesAlphaChannel)
						continue;
					includesAlphaChannel = true;
				}
				result.add(channel);
			}
		}
		return result;
	}

	/**
	 * Overwrite a rectangular region of a channel with new values.
	 * <p>
	 * Coordinates are not validated; they must lie within the image.
	 *
	 * @param channelName
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @param values row-major values, at least {@code width * height}
	 */
	public void updateChannel(String channelName, int x, int y, int width, int height, float[] values) {
		var channel = data.getChannel(channelName);
		if (channel == null) {
			logger.warn("Channel {} could not be updated, because it does not exist.", channelName);
			return;
		}
		channel.updateTile(x, y, width, height, values);
	}

	@Override
	public String toString() {
		var sb = new StringBuilder();
		sb.append("Path: ").append(name).append("\n\n");
		sb.append("Resolution: (").append(getWidth()).append(", ").append(getHeight()).append(")\n");
		var displayWindow = getDisplayWindow();
		var dataWindow = getDataWindow();
		if (!displayWindow.equals(dataWindow) || displayWindow.getMinX() != 0 || displayWindow.getMinY() != 0) {
			sb.append("Display window: ").append(displayWindow).append("\n");
			sb.append("Data window: ").append(dataWindow).append("\n");
		}
		sb.append("\nChannels:\n");
		List<String> lines = new ArrayList<>();
		for (String layer : data.getLayers()) {
			String tails = data.channelsInLayer(layer).stream().map(Channel::tail).collect(Collectors.joining(","));
			lines.add((layer.isEmpty() ? "<root>" : layer) + ": " + tails);
		}
		sb.append(String.join("\n", lines));
		return sb.toString();
	}

}
