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
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;

/**
 * A deferred computation producing a single value or a single failure.
 * <p>
 * Tasks are created by a {@link ThreadPool} (or by the static factory methods here) and composed with
 * {@link #then(TaskFunction)}, {@link #thenCompose(TaskFunction)} and {@link #handle(TaskHandler)}.
 * Continuations run on whichever thread completes the preceding task, so a chain started from
 * {@link ThreadPool#enqueueCoroutine(int)} stays on pool workers without ever blocking them.
 * <p>
 * The outcome is computed once; calling {@link #await()} again returns the same value (or rethrows the
 * same exception) without repeating any work.
 *
 * @param <T> the type of the value
 */
public final class Task<T> {

	/**
	 * Function applied to the value of a completed task. May throw checked exceptions, which then
	 * become the failure of the resulting task.
	 *
	 * @param <T>
	 * @param <R>
	 */
	@FunctionalInterface
	public static interface TaskFunction<T, R> {

		/**
		 * Apply the function.
		 * @param value the value of the preceding task
		 * @return
		 * @throws Exception
		 */
		R apply(T value) throws Exception;

	}

	/**
	 * Handler receiving either the value or the failure of a completed task.
	 *
	 * @param <T>
	 * @param <R>
	 */
	@FunctionalInterface
	public static interface TaskHandler<T, R> {

		/**
		 * Handle the outcome of a task.
		 * @param value the value, or null if the task failed
		 * @param failure the (unwrapped) failure, or null if the task succeeded
		 * @return
		 * @throws Exception
		 */
		R handle(T value, Throwable failure) throws Exception;

	}

	private final CompletableFuture<T> future;

	Task(CompletableFuture<T> future) {
		this.future = Objects.requireNonNull(future);
	}

	/**
	 * Create a task that has already completed with the given value.
	 * @param <T>
	 * @param value
	 * @return
	 */
	public static <T> Task<T> completed(T value) {
		return new Task<>(CompletableFuture.completedFuture(value));
	}

	/**
	 * Create a task that has already failed with the given exception.
	 * @param <T>
	 * @param failure
	 * @return
	 */
	public static <T> Task<T> failed(Throwable failure) {
		var future = new CompletableFuture<T>();
		future.completeExceptionally(Objects.requireNonNull(failure));
		return new Task<>(future);
	}

	/**
	 * Create a task that completes when all the given tasks have completed.
	 * <p>
	 * If any of the tasks failed, the returned task fails with the failure of the first failed task
	 * in iteration order of the collection.
	 *
	 * @param tasks
	 * @return
	 */
	public static Task<Void> allOf(Collection<? extends Task<?>> tasks) {
		if (tasks.isEmpty())
			return completed(null);
		List<CompletableFuture<?>> futures = new ArrayList<>(tasks.size());
		for (var task : tasks)
			futures.add(task.future);
		var all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
		return new Task<>(all.handle((v, t) -> {
			for (var f : futures) {
				Throwable failure = failureOf(f);
				if (failure != null)
					throw wrap(failure);
			}
			return null;
		}));
	}

	/**
	 * Apply a function to the value of this task once it is available.
	 * @param <U>
	 * @param fun
	 * @return a new task for the result of the function
	 */
	public <U> Task<U> then(TaskFunction<? super T, ? extends U> fun) {
		return new Task<>(future.thenApply(v -> call(fun, v)));
	}

	/**
	 * Chain another task, created from the value of this one.
	 * @param <U>
	 * @param fun function creating the next task
	 * @return a task that completes with the chained task
	 */
	public <U> Task<U> thenCompose(TaskFunction<? super T, ? extends Task<U>> fun) {
		return new Task<>(future.thenCompose(v -> {
			Task<U> next = call(fun, v);
			return next == null ? CompletableFuture.completedFuture(null) : next.future;
		}));
	}

	/**
	 * Handle the value or failure of this task.
	 * @param <U>
	 * @param handler
	 * @return a task for the result of the handler
	 */
	public <U> Task<U> handle(TaskHandler<? super T, ? extends U> handler) {
		return new Task<>(future.handle((v, t) -> {
			try {
				return handler.handle(v, unwrap(t));
			} catch (Exception e) {
				throw wrap(e);
			}
		}));
	}

	/**
	 * Perform an action when this task completes.
	 * @param action consumer of the value and the (unwrapped) failure, one of which will be null
	 * @return a task completing with the same outcome as this one, after the action has run
	 */
	public Task<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
		return new Task<>(future.whenComplete((v, t) -> action.accept(v, unwrap(t))));
	}

	/**
	 * Query whether the task has completed, either normally or by failing.
	 * @return
	 */
	public boolean isDone() {
		return future.isDone();
	}

	/**
	 * Block until this task has completed, then return its value.
	 * <p>
	 * This should only be called at explicit fan-in points by threads that are willing to block,
	 * and never from a {@link ThreadPool} worker.
	 *
	 * @return the value of the task
	 * @throws Exception the original exception that caused the task to fail
	 */
	public T await() throws Exception {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = unwrap(e);
			if (cause instanceof Exception)
				throw (Exception)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw e;
		}
	}

	@Override
	public String toString() {
		if (!future.isDone())
			return "Task[pending]";
		return future.isCompletedExceptionally() ? "Task[failed]" : "Task[completed]";
	}

	private static <T, R> R call(TaskFunction<T, R> fun, T value) {
		try {
			return fun.apply(value);
		} catch (Exception e) {
			throw wrap(e);
		}
	}

	private static Throwable failureOf(CompletableFuture<?> future) {
		if (!future.isCompletedExceptionally())
			return null;
		try {
			future.join();
			return null;
		} catch (CompletionException | CancellationException e) {
			return unwrap(e);
		}
	}

	private static RuntimeException wrap(Throwable t) {
		if (t instanceof CompletionException)
			return (CompletionException)t;
		return new CompletionException(t);
	}

	static Throwable unwrap(Throwable t) {
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null)
			t = t.getCause();
		return t;
	}

}
