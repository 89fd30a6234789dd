package com.gentoro.responder.response;

import com.gentoro.responder.exception.ContentGenerationException;
import com.gentoro.responder.exception.EmptyLlmResponseException;
import com.gentoro.responder.exception.GenerationCancelledException;
import com.gentoro.responder.exception.InvalidJsonResponseException;
import com.gentoro.responder.exception.MalformedJsonException;
import com.gentoro.responder.exception.ResponderException;
import com.gentoro.responder.model.InvocationContext;
import com.gentoro.responder.model.ModelClient;
import com.gentoro.responder.model.ModelClient.GenerationOptions;
import com.gentoro.responder.model.ModelClient.Message;
import com.gentoro.responder.model.ModelClient.ModelResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one generation: invoke the model, take the first choice, strip fences and validate the
 * result into a {@link GeneratedResponse}.
 *
 * <p>The backend call runs on this processor's executor while the calling thread waits for it, for
 * cancellation of the {@link InvocationContext}, or for the context deadline. Exactly one attempt
 * is made per call; retries belong to the caller. A single instance may be shared by any number of
 * threads.
 */
public class ResponseProcessor implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(ResponseProcessor.class);

  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final ResponseValidator validator;

  public ResponseProcessor() {
    this(Executors.newCachedThreadPool(new InvocationThreadFactory()), true);
  }

  /** Uses a caller-managed executor; {@link #close()} leaves it running. */
  public ResponseProcessor(ExecutorService executor) {
    this(executor, false);
  }

  private ResponseProcessor(ExecutorService executor, boolean ownsExecutor) {
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.validator = new ResponseValidator();
  }

  public GeneratedResponse generate(
      ModelClient client, double temperature, List<Message> messages) {
    return generate(client, temperature, messages, InvocationContext.none());
  }

  /**
   * @throws ContentGenerationException when the backend call fails
   * @throws GenerationCancelledException when {@code context} is cancelled or expires first
   * @throws EmptyLlmResponseException when the backend returned nothing usable
   * @throws MalformedJsonException when the cleaned output is not JSON
   * @throws InvalidJsonResponseException when the JSON misses required fields
   */
  public GeneratedResponse generate(
      ModelClient client, double temperature, List<Message> messages, InvocationContext context) {
    ModelResponse response = invoke(client, GenerationOptions.json(temperature), messages, context);
    String content = extractContent(response);
    String cleaned = ResponseCleaner.clean(content);
    log.trace("Cleaned model output: {}", cleaned);
    return validator.validate(cleaned);
  }

  private ModelResponse invoke(
      ModelClient client,
      GenerationOptions options,
      List<Message> messages,
      InvocationContext context) {
    if (context.isCancelled()) {
      throw new GenerationCancelledException(false);
    }
    if (context.isExpired()) {
      throw new GenerationCancelledException(true);
    }

    Future<ModelResponse> task =
        executor.submit(() -> client.generateContent(messages, options, context));
    InvocationContext.Registration registration = context.onCancel(() -> task.cancel(true));
    try {
      Optional<Duration> remaining = context.remaining();
      if (remaining.isPresent()) {
        return task.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
      }
      return task.get();
    } catch (TimeoutException e) {
      task.cancel(true);
      throw new GenerationCancelledException(true);
    } catch (CancellationException e) {
      throw new GenerationCancelledException(false);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      throw new GenerationCancelledException(false);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof ResponderException responderException) {
        throw responderException;
      }
      throw new ContentGenerationException(String.valueOf(cause.getMessage()), cause);
    } finally {
      registration.close();
    }
  }

  private static String extractContent(ModelResponse response) {
    if (response == null) {
      throw new EmptyLlmResponseException(EmptyLlmResponseException.Reason.NIL_RESPONSE);
    }
    if (response.choices().isEmpty()) {
      throw new EmptyLlmResponseException(EmptyLlmResponseException.Reason.NO_CHOICES);
    }
    String content = response.choices().get(0).content();
    if (content.isEmpty()) {
      throw new EmptyLlmResponseException(EmptyLlmResponseException.Reason.EMPTY_CONTENT);
    }
    return content;
  }

  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }

  private static final class InvocationThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "llm-invocation-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
