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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named set of up to four channels, displayed together as red, green, blue and alpha.
 * The same channel may appear more than once, e.g. a gray channel shown as RGB.
 */
public final class ChannelGroup {

	private final String name;
	private final List<String> channels;

	/**
	 * Constructor.
	 * @param name display name of the group
	 * @param channels full names of the member channels, in display order
	 */
	public ChannelGroup(String name, List<String> channels) {
		this.name = Objects.requireNonNull(name);
		if (channels.isEmpty() || channels.size() > 4)
			throw new IllegalArgumentException("A channel group needs 1-4 channels, but " + channels.size() + " were given");
		this.channels = List.copyOf(channels);
	}

	public String getName() {
		return name;
	}

	/**
	 * Get the full names of the member channels.
	 * @return an unmodifiable list
	 */
	public List<String> getChannels() {
		return Collections.unmodifiableList(channels);
	}

	@Override
	public String toString() {
		return name + " " + channels;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, channels);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ChannelGroup))
			return false;
		ChannelGroup other = (ChannelGroup)obj;
		return name.equals(other.name) && channels.equals(other.channels);
	}

}
