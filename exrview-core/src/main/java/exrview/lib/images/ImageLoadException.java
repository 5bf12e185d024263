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

import java.io.IOException;
import java.util.Objects;

/**
 * Exception thrown when an image cannot be decoded or validated.
 */
public class ImageLoadException extends IOException {

	private static final long serialVersionUID = 1L;

	/**
	 * Kinds of failure that can occur while loading an image.
	 */
	public static enum ErrorType {
		/**
		 * The image does not contain any channels.
		 */
		EMPTY_IMAGE,
		/**
		 * A channel does not have the same size as the data window.
		 */
		SIZE_MISMATCH,
		/**
		 * The data or display window of the file is invalid.
		 */
		INVALID_WINDOW,
		/**
		 * No channel matches the requested channel selector.
		 */
		NO_MATCHING_CHANNELS,
		/**
		 * Alpha was multiplied into the color channels twice.
		 */
		DOUBLE_MULTIPLY,
		/**
		 * Color channels were divided by alpha twice.
		 */
		DOUBLE_DIVIDE,
		/**
		 * The file content could not be decoded.
		 */
		DECODE_ERROR,
		/**
		 * The file could not be opened or read.
		 */
		STREAM_ERROR
	}

	private final ErrorType type;

	/**
	 * Constructor.
	 * @param type
	 * @param message
	 */
	public ImageLoadException(ErrorType type, String message) {
		super(message);
		this.type = Objects.requireNonNull(type);
	}

	/**
	 * Constructor with a cause, typically the failure of an underlying codec or stream.
	 * @param type
	 * @param message
	 * @param cause
	 */
	public ImageLoadException(ErrorType type, String message, Throwable cause) {
		super(message, cause);
		this.type = Objects.requireNonNull(type);
	}

	/**
	 * Get the kind of failure.
	 * @return
	 */
	public ErrorType getType() {
		return type;
	}

}
