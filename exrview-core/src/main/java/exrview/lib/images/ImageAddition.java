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

/**
 * The outcome of one load request, as published by a {@link BackgroundImagesLoader}.
 */
public final class ImageAddition {

	private final int sequence;
	private final boolean selectOnArrival;
	private final List<Image> images;

	ImageAddition(int sequence, boolean selectOnArrival, List<Image> images) {
		this.sequence = sequence;
		this.selectOnArrival = selectOnArrival;
		this.images = Collections.unmodifiableList(images);
	}

	/**
	 * Get the sequence number returned when the load was requested.
	 * @return
	 */
	public int getSequence() {
		return sequence;
	}

	/**
	 * Returns true if the first image should be selected for display once it has been added.
	 * @return
	 */
	public boolean isSelectOnArrival() {
		return selectOnArrival;
	}

	/**
	 * Get the images that were loaded; empty if the load failed.
	 * @return
	 */
	public List<Image> getImages() {
		return images;
	}

	@Override
	public String toString() {
		return "ImageAddition[sequence=" + sequence + ", images=" + images.size() + "]";
	}

}
