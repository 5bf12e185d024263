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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import exrview.lib.common.ThreadPool;
import exrview.lib.images.io.ImageLoaderProvider;

/**
 * Loads images in the background and publishes them in the order in which they were requested.
 * <p>
 * Each request is loaded on the {@link ThreadPool} at background priority, with newer requests preferred.
 * Loads may finish in any order, but they are handed to the consumer strictly by request: a finished load
 * is held back until all earlier requests have finished too. Requests that fail are skipped.
 * <p>
 * The consumer (e.g. a UI thread) calls {@link #poll()} to collect what has been published; it may register
 * a listener to be told when there is something new.
 */
public class BackgroundImagesLoader {

	private static final Logger logger = LoggerFactory.getLogger(BackgroundImagesLoader.class);

	private final ThreadPool pool;
	private final ImageLoaderProvider provider;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition publishedOrIdle = lock.newCondition();

	private final PriorityQueue<ImageAddition> pendingAdditions = new PriorityQueue<>(Comparator.comparingInt(ImageAddition::getSequence));
	private final Deque<ImageAddition> publishedAdditions = new ArrayDeque<>();
	private int nextSequence = 0;
	private int nextExpected = 0;

	private Error fatalError;
	private Runnable publishListener;

	/**
	 * Create a loader using all installed image loaders.
	 * @param pool
	 */
	public BackgroundImagesLoader(ThreadPool pool) {
		this(pool, new ImageLoaderProvider());
	}

	/**
	 * Create a loader using a specific provider.
	 * @param pool
	 * @param provider
	 */
	public BackgroundImagesLoader(ThreadPool pool, ImageLoaderProvider provider) {
		this.pool = pool;
		this.provider = provider;
	}

	/**
	 * Set a listener to be notified whenever new additions have been published.
	 * <p>
	 * The listener is called on a pool thread, without any lock held. It should return quickly,
	 * typically by scheduling a call to {@link #poll()} on the consumer thread.
	 *
	 * @param listener the listener, or null to remove it
	 */
	public void setPublishListener(Runnable listener) {
		lock.lock();
		try {
			this.publishListener = listener;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Request that an image file is loaded.
	 * @param path the file to load
	 * @param selector channel selector
	 * @param selectOnArrival whether the consumer should select the image once it has been added
	 * @return the sequence number of the request
	 * @throws RejectedExecutionException if the pool has been shut down
	 */
	public int enqueue(Path path, ChannelSelector selector, boolean selectOnArrival) {
		int sequence;
		lock.lock();
		try {
			sequence = nextSequence++;
		} finally {
			lock.unlock();
		}

		int priority = ImagePriorities.background(Image.drawId());
		try {
			pool.enqueueCoroutine(priority)
				.thenCompose(v -> provider.tryLoadImage(pool, priority, path, selector))
				.whenComplete((images, t) -> {
					if (t instanceof Error) {
						logger.error("Fatal error loading " + path, t);
						setFatalError((Error)t);
					} else if (t != null) {
						logger.error("Unexpected failure loading " + path, t);
					}
					List<Image> result = t == null && images != null ? images : Collections.emptyList();
					publish(new ImageAddition(sequence, selectOnArrival, result));
				});
		} catch (RejectedExecutionException e) {
			publish(new ImageAddition(sequence, selectOnArrival, Collections.emptyList()));
			throw e;
		}
		logger.debug("Enqueued {} as request {}", path, sequence);
		return sequence;
	}

	private void setFatalError(Error error) {
		lock.lock();
		try {
			if (fatalError == null)
				fatalError = error;
		} finally {
			lock.unlock();
		}
	}

	private void publish(ImageAddition addition) {
		boolean anyPublished = false;
		Runnable listener;
		lock.lock();
		try {
			pendingAdditions.add(addition);
			while (!pendingAdditions.isEmpty() && pendingAdditions.peek().getSequence() == nextExpected) {
				var next = pendingAdditions.poll();
				nextExpected++;
				if (!next.getImages().isEmpty()) {
					publishedAdditions.add(next);
					anyPublished = true;
				}
			}
			listener = publishListener;
			publishedOrIdle.signalAll();
		} finally {
			lock.unlock();
		}
		if (anyPublished && listener != null)
			listener.run();
	}

	/**
	 * Remove and return all published additions, in request order.
	 * @return the additions published since the last call; may be empty
	 * @throws Error if a load failed with an unrecoverable error
	 */
	public List<ImageAddition> poll() {
		lock.lock();
		try {
			if (fatalError != null) {
				var error = fatalError;
				fatalError = null;
				throw error;
			}
			List<ImageAddition> list = new ArrayList<>(publishedAdditions);
			publishedAdditions.clear();
			return list;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Returns true if any requested load has not yet reached the point of being published.
	 * @return
	 */
	public boolean hasPendingLoads() {
		lock.lock();
		try {
			return nextExpected < nextSequence;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Block until something is ready to be polled, or there are no pending loads.
	 * @param timeout
	 * @param unit
	 * @return true if something can be polled or nothing is pending, false if the timeout expired
	 * @throws InterruptedException
	 */
	public boolean awaitPublished(long timeout, TimeUnit unit) throws InterruptedException {
		long nanos = unit.toNanos(timeout);
		lock.lock();
		try {
			while (publishedAdditions.isEmpty() && fatalError == null && nextExpected < nextSequence) {
				if (nanos <= 0)
					return false;
				nanos = publishedOrIdle.awaitNanos(nanos);
			}
			return true;
		} finally {
			lock.unlock();
		}
	}

}
