package dev.secondbrain.retrieval;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a model invocation (embedding, cross-encoder scoring) on a dedicated worker pool and waits
 * for it with a bounded timeout.
 *
 * <p>Failures and timeouts are translated into the caller's {@link RetrievalException} subtype so
 * the pipeline can skip the signal. An interrupt of the waiting thread cancels the model call and
 * surfaces as {@link CancellationException}; the interrupt flag is restored.
 */
public final class BoundedModelCall {

  private BoundedModelCall() {}

  /**
   * Executes {@code call} on {@code executor} and waits at most {@code timeout}.
   *
   * @param executor the model worker pool
   * @param timeout maximum time to wait for the result
   * @param call the model invocation
   * @param onFailure maps the failure cause (or the timeout) to a retrieval exception
   * @param <T> the result type
   * @return the model result
   * @throws CancellationException if the waiting thread is interrupted
   */
  public static <T> T call(
      ExecutorService executor,
      Duration timeout,
      Callable<T> call,
      Function<Throwable, ? extends RetrievalException> onFailure) {
    Future<T> future;
    try {
      future = executor.submit(call);
    } catch (RejectedExecutionException e) {
      throw onFailure.apply(e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      CancellationException cancelled =
          new CancellationException("Query cancelled while waiting for a model call");
      cancelled.initCause(e);
      throw cancelled;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw onFailure.apply(e);
    } catch (ExecutionException e) {
      throw onFailure.apply(e.getCause() != null ? e.getCause() : e);
    }
  }
}
