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

package exrview.lib.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core ExrView preferences. These are not persistent.
 * <p>
 * The initial thread count may be given with the system property {@code exrview.threads}.
 */
public class Prefs {

	private static final Logger logger = LoggerFactory.getLogger(Prefs.class);

	/**
	 * System property used to initialize {@link #getNumThreads()}.
	 */
	public static final String PROP_THREADS = "exrview.threads";

	private static int nThreads = readDefaultThreads();

	private static int readDefaultThreads() {
		int n = Runtime.getRuntime().availableProcessors() - 1;
		String prop = System.getProperty(PROP_THREADS);
		if (prop != null && !prop.isBlank()) {
			try {
				n = Integer.parseInt(prop.strip());
			} catch (NumberFormatException e) {
				logger.warn("Invalid value for {}: '{}' - using {} threads", PROP_THREADS, prop, n);
			}
		}
		return Math.max(1, n);
	}

	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}

}
