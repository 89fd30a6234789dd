package com.gentoro.responder.response;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.responder.exception.ContentGenerationException;
import com.gentoro.responder.exception.EmptyLlmResponseException;
import com.gentoro.responder.exception.GenerationCancelledException;
import com.gentoro.responder.exception.InvalidJsonResponseException;
import com.gentoro.responder.exception.MalformedJsonException;
import com.gentoro.responder.exception.ResponderErrorCode;
import com.gentoro.responder.model.InvocationContext;
import com.gentoro.responder.model.ModelClient;
import com.gentoro.responder.model.ModelClient.Choice;
import com.gentoro.responder.model.ModelClient.GenerationOptions;
import com.gentoro.responder.model.ModelClient.Message;
import com.gentoro.responder.model.ModelClient.ModelResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResponseProcessorTest {

  private static final List<Message> MESSAGES =
      List.of(Message.system("You are a web server."), Message.human("GET / HTTP/1.1"));

  private final ResponseProcessor processor = new ResponseProcessor();

  @AfterEach
  void tearDown() {
    processor.close();
  }

  private static ModelClient answering(String... contents) {
    List<Choice> choices = new ArrayList<>();
    for (String content : contents) {
      choices.add(new Choice(content));
    }
    return (messages, options) -> new ModelResponse(choices);
  }

  /** Client that blocks until interrupted, counting the interruptions it observes. */
  private static ModelClient blocking(CountDownLatch started, CountDownLatch interrupted) {
    return (messages, options) -> {
      started.countDown();
      try {
        new CountDownLatch(1).await();
      } catch (InterruptedException e) {
        interrupted.countDown();
        Thread.currentThread().interrupt();
      }
      return null;
    };
  }

  @Test
  @DisplayName("fenced JSON output becomes a response")
  void fencedOutputIsAccepted() {
    GeneratedResponse response =
        processor.generate(
            answering("```json\n{\"headers\":{\"a\":\"b\"},\"body\":\"x\"}\n```"), 1.0, MESSAGES);

    assertEquals(new GeneratedResponse(Map.of("a", "b"), "x"), response);
  }

  @Test
  void passesMessagesAndJsonModeToClient() {
    AtomicReference<List<Message>> seenMessages = new AtomicReference<>();
    AtomicReference<GenerationOptions> seenOptions = new AtomicReference<>();
    ModelClient client =
        (messages, options) -> {
          seenMessages.set(messages);
          seenOptions.set(options);
          return new ModelResponse(List.of(new Choice("{\"headers\":{\"a\":\"b\"},\"body\":\"\"}")));
        };

    processor.generate(client, 0.3, MESSAGES);

    assertEquals(MESSAGES, seenMessages.get());
    assertEquals(new GenerationOptions(0.3, true), seenOptions.get());
  }

  @Test
  void onlyTheFirstChoiceIsUsed() {
    GeneratedResponse response =
        processor.generate(
            answering(
                "{\"headers\":{\"a\":\"first\"},\"body\":\"1\"}",
                "{\"headers\":{\"a\":\"second\"},\"body\":\"2\"}"),
            1.0,
            MESSAGES);
    assertEquals("1", response.body());
  }

  @Test
  void proseIsMalformed() {
    MalformedJsonException ex =
        assertThrows(
            MalformedJsonException.class,
            () -> processor.generate(answering("not json"), 1.0, MESSAGES));
    assertEquals("not json", ex.getCleanedResponse());
  }

  @Test
  void missingBodyIsInvalidAndKeepsCleanedText() {
    InvalidJsonResponseException ex =
        assertThrows(
            InvalidJsonResponseException.class,
            () -> processor.generate(answering("```json\n{\"headers\":{}}\n```"), 1.0, MESSAGES));
    assertEquals("{\"headers\":{}}", ex.getCleanedResponse());
  }

  @Test
  void nilResponse() {
    EmptyLlmResponseException ex =
        assertThrows(
            EmptyLlmResponseException.class,
            () -> processor.generate((m, o) -> null, 1.0, MESSAGES));
    assertEquals(EmptyLlmResponseException.Reason.NIL_RESPONSE, ex.getReason());
    assertEquals("emptyLLMResponse: response is nil", ex.getMessage());
  }

  @Test
  void noChoices() {
    EmptyLlmResponseException ex =
        assertThrows(
            EmptyLlmResponseException.class, () -> processor.generate(answering(), 1.0, MESSAGES));
    assertEquals(EmptyLlmResponseException.Reason.NO_CHOICES, ex.getReason());
  }

  @Test
  void emptyFirstChoice() {
    EmptyLlmResponseException ex =
        assertThrows(
            EmptyLlmResponseException.class,
            () -> processor.generate(answering("", "{}"), 1.0, MESSAGES));
    assertEquals(EmptyLlmResponseException.Reason.EMPTY_CONTENT, ex.getReason());
    assertEquals(ResponderErrorCode.EMPTY_RESPONSE, ex.getCode());
  }

  @Test
  void whitespaceOnlyContentFailsAsMalformed() {
    assertThrows(
        MalformedJsonException.class, () -> processor.generate(answering(" \n"), 1.0, MESSAGES));
  }

  @Test
  void backendFailureIsContentGenerationError() {
    ModelClient failing =
        (m, o) -> {
          throw new IllegalStateException("503 Service Unavailable");
        };

    ContentGenerationException ex =
        assertThrows(
            ContentGenerationException.class, () -> processor.generate(failing, 1.0, MESSAGES));
    assertTrue(ex.getMessage().startsWith("contentGenerationError: "));
    assertTrue(ex.getMessage().contains("503 Service Unavailable"));
    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }

  @Test
  void responderExceptionsFromClientPassThrough() {
    ContentGenerationException original =
        new ContentGenerationException("quota exceeded", new RuntimeException());
    ModelClient failing =
        (m, o) -> {
          throw original;
        };

    assertSame(
        original,
        assertThrows(
            ContentGenerationException.class, () -> processor.generate(failing, 1.0, MESSAGES)));
  }

  @Test
  void cancelledContextNeverReachesBackend() {
    AtomicInteger calls = new AtomicInteger();
    InvocationContext context = InvocationContext.none();
    context.cancel();

    GenerationCancelledException ex =
        assertThrows(
            GenerationCancelledException.class,
            () ->
                processor.generate(
                    (m, o) -> {
                      calls.incrementAndGet();
                      return null;
                    },
                    1.0,
                    MESSAGES,
                    context));

    assertFalse(ex.isDeadlineExceeded());
    assertEquals(0, calls.get());
  }

  @Test
  void cancellationStopsBlockedCall() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    InvocationContext context = InvocationContext.none();

    Thread canceller =
        new Thread(
            () -> {
              try {
                if (started.await(5, TimeUnit.SECONDS)) {
                  context.cancel();
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    canceller.start();

    GenerationCancelledException ex =
        assertTimeoutPreemptively(
            Duration.ofSeconds(5),
            () ->
                assertThrows(
                    GenerationCancelledException.class,
                    () ->
                        processor.generate(
                            blocking(started, interrupted), 1.0, MESSAGES, context)));

    assertFalse(ex.isDeadlineExceeded());
    assertEquals(ResponderErrorCode.CANCELLED, ex.getCode());
    assertTrue(interrupted.await(5, TimeUnit.SECONDS), "backend call was not interrupted");
    canceller.join();
  }

  @Test
  void contextIsHandedToTheClient() {
    InvocationContext context = InvocationContext.withTimeout(Duration.ofSeconds(30));
    AtomicReference<InvocationContext> seen = new AtomicReference<>();
    ModelClient client =
        new ModelClient() {
          @Override
          public ModelResponse generateContent(List<Message> messages, GenerationOptions options) {
            throw new AssertionError("context-free overload used");
          }

          @Override
          public ModelResponse generateContent(
              List<Message> messages, GenerationOptions options, InvocationContext ctx) {
            seen.set(ctx);
            return new ModelResponse(
                List.of(new Choice("{\"headers\":{\"a\":\"b\"},\"body\":\"\"}")));
          }
        };

    processor.generate(client, 1.0, MESSAGES, context);

    assertSame(context, seen.get());
  }

  @Test
  void sharedContextKeepsNoCancelActionsAfterCalls() {
    InvocationContext context = InvocationContext.none();
    ModelClient client = answering("{\"headers\":{\"a\":\"b\"},\"body\":\"\"}");

    for (int i = 0; i < 200; i++) {
      processor.generate(client, 1.0, MESSAGES, context);
    }
    assertThrows(
        MalformedJsonException.class,
        () -> processor.generate(answering("nope"), 1.0, MESSAGES, context));

    assertEquals(0, context.pendingActions());
  }

  @Test
  void deadlineStopsBlockedCall() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    InvocationContext context = InvocationContext.withTimeout(Duration.ofMillis(200));

    GenerationCancelledException ex =
        assertTimeoutPreemptively(
            Duration.ofSeconds(5),
            () ->
                assertThrows(
                    GenerationCancelledException.class,
                    () ->
                        processor.generate(
                            blocking(started, interrupted), 1.0, MESSAGES, context)));

    assertTrue(ex.isDeadlineExceeded());
    assertTrue(interrupted.await(5, TimeUnit.SECONDS));
  }

  @Test
  void sharedProcessorServesConcurrentCalls() throws Exception {
    ModelClient client =
        (messages, options) ->
            new ModelResponse(
                List.of(
                    new Choice(
                        "{\"headers\":{\"X-Req\":\"" + messages.get(1).text() + "\"},\"body\":\"\"}")));
    List<Thread> threads = new ArrayList<>();
    List<String> failures = Collections.synchronizedList(new ArrayList<>());
    for (int i = 0; i < 8; i++) {
      String id = "req-" + i;
      Thread t =
          new Thread(
              () -> {
                GeneratedResponse response =
                    processor.generate(
                        client, 1.0, List.of(Message.system("s"), Message.human(id)));
                if (!id.equals(response.headers().get("X-Req"))) {
                  failures.add(id);
                }
              });
      threads.add(t);
      t.start();
    }
    for (Thread t : threads) {
      t.join(5000);
    }
    assertTrue(failures.isEmpty(), failures.toString());
  }
}
