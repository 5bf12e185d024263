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

/**
 * Scheduling priorities for image work.
 * <p>
 * Work for an image the user is looking at (foreground) always runs before background loading.
 * Within each class, images with a higher draw id, i.e. those requested more recently, come first.
 */
public final class ImagePriorities {

	private ImagePriorities() {
		throw new AssertionError();
	}

	/**
	 * Priority for work on an image that is currently displayed.
	 * @param drawId
	 * @return
	 */
	public static int foreground(int drawId) {
		return drawId;
	}

	/**
	 * Priority for loading an image in the background.
	 * @param drawId
	 * @return a priority below that of any foreground work
	 */
	public static int background(int drawId) {
		return Integer.MIN_VALUE + drawId;
	}

}
