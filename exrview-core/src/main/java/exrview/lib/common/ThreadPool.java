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

package exrview.lib.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of worker threads that run work units in order of priority.
 * <p>
 * Work with a higher priority is started before work with a lower priority; work with equal priority
 * is started in the order it was enqueued. There is no cancellation: once enqueued, a unit of work
 * always runs.
 * <p>
 * A pool is created explicitly, passed to the components that need it, and shut down explicitly with
 * {@link #shutdown()}. Shutting down drains all queued work before joining the workers.
 */
public class ThreadPool implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

	private static final AtomicInteger poolCounter = new AtomicInteger();

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition workAvailable = lock.newCondition();
	private final Condition idle = lock.newCondition();

	private final PriorityQueue<WorkUnit> queue = new PriorityQueue<>();
	private final List<Thread> workers;

	private long enqueueCounter = 0L;
	private int nBusy = 0;
	private int nAlive = 0;
	private boolean shutdownRequested = false;

	/**
	 * Create a pool using the default number of threads, from {@link ThreadTools#getParallelism()}.
	 */
	public ThreadPool() {
		this(ThreadTools.getParallelism());
	}

	/**
	 * Create a pool with a fixed number of worker threads.
	 * @param nThreads number of workers; must be at least 1
	 */
	public ThreadPool(int nThreads) {
		if (nThreads < 1)
			throw new IllegalArgumentException("Number of threads must be >= 1, but was " + nThreads);
		ThreadFactory factory = ThreadTools.createThreadFactory("exrview-pool-" + poolCounter.incrementAndGet() + "-", true);
		List<Thread> list = new ArrayList<>();
		for (int i = 0; i < nThreads; i++)
			list.add(factory.newThread(this::runWorker));
		workers = Collections.unmodifiableList(list);
		nAlive = nThreads;
		for (var t : workers)
			t.start();
		logger.debug("Started thread pool with {} workers", nThreads);
	}

	/**
	 * Get the number of worker threads.
	 * @return
	 */
	public int getNumThreads() {
		return workers.size();
	}

	/**
	 * Get the number of units of work currently waiting to be started.
	 * @return
	 */
	public int getQueueSize() {
		lock.lock();
		try {
			return queue.size();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Schedule a single unit of work.
	 * <p>
	 * Any exception or error thrown by the work is logged and otherwise ignored; the worker carries on. Callers that need the outcome
	 * should use {@link #enqueueCoroutine(int)} and compose a {@link Task} instead.
	 *
	 * @param work the work to run
	 * @param priority priority of the work; higher values are started sooner
	 * @throws RejectedExecutionException if the pool has terminated
	 */
	public void enqueue(Runnable work, int priority) {
		lock.lock();
		try {
			if (shutdownRequested && nAlive == 0)
				throw new RejectedExecutionException("Thread pool has been shut down");
			queue.add(new WorkUnit(work, priority, enqueueCounter++));
			workAvailable.signal();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Get a task that is completed by one of the workers at the specified priority.
	 * <p>
	 * Anything chained onto the returned task runs on that worker, which makes this the point at which
	 * a pipeline moves off the calling thread.
	 *
	 * @param priority
	 * @return
	 */
	public Task<Void> enqueueCoroutine(int priority) {
		var future = new CompletableFuture<Void>();
		enqueue(() -> future.complete(null), priority);
		return new Task<>(future);
	}

	/**
	 * Apply a function to every index in the half-open range {@code [begin, end)}.
	 * <p>
	 * The range is split into at most {@link #getNumThreads()} contiguous chunks, each scheduled at the
	 * given priority. The body must be safe to call concurrently for distinct indices.
	 * <p>
	 * An exception stops only the chunk in which it was thrown; the other chunks always run to the end,
	 * so that their writes are never left half-done. The first exception is used to fail the returned task.
	 *
	 * @param begin first index (inclusive)
	 * @param end last index (exclusive)
	 * @param body function to call for each index
	 * @param priority
	 * @return a task that completes once all chunks have finished
	 */
	public Task<Void> parallelFor(int begin, int end, IntConsumer body, int priority) {
		int range = end - begin;
		if (range <= 0)
			return Task.completed(null);

		int nTasks = Math.min(workers.size(), range);
		var future = new CompletableFuture<Void>();
		var firstFailure = new AtomicReference<Throwable>();
		var remaining = new AtomicInteger(nTasks);
		for (int i = 0; i < nTasks; i++) {
			int taskStart = begin + (int)((long)range * i / nTasks);
			int taskEnd = begin + (int)((long)range * (i + 1) / nTasks);
			enqueue(() -> {
				try {
					for (int j = taskStart; j < taskEnd; j++)
						body.accept(j);
				} catch (Throwable t) {
					firstFailure.compareAndSet(null, t);
				} finally {
					if (remaining.decrementAndGet() == 0) {
						var failure = firstFailure.get();
						if (failure == null)
							future.complete(null);
						else
							future.completeExceptionally(failure);
					}
				}
			}, priority);
		}
		return new Task<>(future);
	}

	/**
	 * Block until no work is queued or running.
	 * @throws InterruptedException
	 */
	public void waitUntilIdle() throws InterruptedException {
		lock.lock();
		try {
			while (nBusy > 0 || (!queue.isEmpty() && nAlive > 0))
				idle.await();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Query whether {@link #shutdown()} has been called.
	 * @return
	 */
	public boolean isShutdown() {
		lock.lock();
		try {
			return shutdownRequested;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Run all remaining work, then stop and join the worker threads.
	 * <p>
	 * Work enqueued by running work while draining is still executed.
	 */
	public void shutdown() {
		lock.lock();
		try {
			if (shutdownRequested && nAlive == 0)
				return;
			shutdownRequested = true;
			workAvailable.signalAll();
		} finally {
			lock.unlock();
		}
		for (var t : workers) {
			if (t == Thread.currentThread())
				continue;
			try {
				t.join();
			} catch (InterruptedException e) {
				logger.warn("Interrupted while waiting for {} to finish", t.getName());
				Thread.currentThread().interrupt();
				return;
			}
		}
		logger.debug("Thread pool shut down");
	}

	@Override
	public void close() {
		shutdown();
	}

	private void runWorker() {
		boolean exited = false;
		try {
			while (true) {
				WorkUnit unit;
				lock.lock();
				try {
					while (queue.isEmpty() && !shutdownRequested)
						workAvailable.await();
					unit = queue.poll();
					if (unit == null) {
						// nAlive only counts workers that will poll the queue again
						nAlive--;
						exited = true;
						idle.signalAll();
						return;
					}
					nBusy++;
				} finally {
					lock.unlock();
				}
				try {
					unit.work.run();
				} catch (Throwable t) {
					logger.error("Uncaught exception in thread pool: {}", t.getMessage(), t);
				} finally {
					lock.lock();
					try {
						nBusy--;
						if (nBusy == 0 && queue.isEmpty())
							idle.signalAll();
					} finally {
						lock.unlock();
					}
				}
			}
		} catch (InterruptedException e) {
			logger.warn("{} interrupted - stopping", Thread.currentThread().getName());
		} finally {
			if (!exited) {
				lock.lock();
				try {
					nAlive--;
					idle.signalAll();
				} finally {
					lock.unlock();
				}
			}
		}
	}


	private static class WorkUnit implements Comparable<WorkUnit> {

		private final Runnable work;
		private final int priority;
		private final long order;

		WorkUnit(Runnable work, int priority, long order) {
			this.work = work;
			this.priority = priority;
			this.order = order;
		}

		@Override
		public int compareTo(WorkUnit o) {
			int cmp = Integer.compare(o.priority, priority);
			if (cmp != 0)
				return cmp;
			return Long.compare(order, o.order);
		}

	}

}
