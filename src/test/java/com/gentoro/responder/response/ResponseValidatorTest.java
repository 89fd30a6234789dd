package com.gentoro.responder.response;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.responder.exception.InvalidJsonResponseException;
import com.gentoro.responder.exception.MalformedJsonException;
import com.gentoro.responder.exception.ResponderErrorCode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseValidatorTest {

  private final ResponseValidator validator = new ResponseValidator();

  @Test
  void acceptsHeadersAndBody() {
    GeneratedResponse response =
        validator.validate(
            "{\"headers\":{\"Server\":\"Apache/2.4.41\",\"Content-Type\":\"text/html\"},"
                + "\"body\":\"<h1>It works!</h1>\"}");

    assertEquals(
        Map.of("Server", "Apache/2.4.41", "Content-Type", "text/html"), response.headers());
    assertEquals(List.of("Server", "Content-Type"), List.copyOf(response.headers().keySet()));
    assertEquals("<h1>It works!</h1>", response.body());
  }

  @Test
  void emptyBodyIsAllowed() {
    assertEquals("", validator.validate("{\"headers\":{\"a\":\"b\"},\"body\":\"\"}").body());
  }

  @Test
  void unknownFieldsAreIgnored() {
    GeneratedResponse response =
        validator.validate("{\"status\":404,\"headers\":{\"a\":\"b\"},\"body\":\"nope\"}");
    assertEquals("nope", response.body());
  }

  @Test
  void numericBodyIsInvalid() {
    String json = "{\"headers\":{\"a\":\"b\"},\"body\":123}";
    InvalidJsonResponseException ex =
        assertThrows(InvalidJsonResponseException.class, () -> validator.validate(json));
    assertEquals(json, ex.getCleanedResponse());
  }

  @Test
  void booleanHeaderValueIsInvalid() {
    assertThrows(
        InvalidJsonResponseException.class,
        () -> validator.validate("{\"headers\":{\"X-Cache\":true},\"body\":\"\"}"));
  }

  @Test
  void numericHeaderValueIsInvalid() {
    assertThrows(
        InvalidJsonResponseException.class,
        () -> validator.validate("{\"headers\":{\"X-N\":4.2},\"body\":\"\"}"));
  }

  @Test
  void notJsonIsMalformed() {
    MalformedJsonException ex =
        assertThrows(MalformedJsonException.class, () -> validator.validate("not json"));
    assertEquals(ResponderErrorCode.MALFORMED_JSON, ex.getCode());
    assertEquals("not json", ex.getCleanedResponse());
    assertEquals("invalidJSONResponse: input is not valid JSON", ex.getMessage());
  }

  @Test
  void emptyInputIsMalformed() {
    assertThrows(MalformedJsonException.class, () -> validator.validate(""));
  }

  @Test
  void trailingContentIsMalformed() {
    assertThrows(
        MalformedJsonException.class,
        () -> validator.validate("{\"headers\":{\"a\":\"b\"},\"body\":\"\"} trailing"));
  }

  @Test
  void missingBodyIsInvalid() {
    InvalidJsonResponseException ex =
        assertThrows(
            InvalidJsonResponseException.class,
            () -> validator.validate("{\"headers\":{\"a\":\"b\"}}"));
    assertEquals(List.of("body: must not be null"), ex.getViolations());
    assertEquals("{\"headers\":{\"a\":\"b\"}}", ex.getCleanedResponse());
    assertTrue(ex.getMessage().startsWith("invalidJSONResponse: validation error: "));
  }

  @Test
  void emptyHeadersAreInvalid() {
    InvalidJsonResponseException ex =
        assertThrows(
            InvalidJsonResponseException.class,
            () -> validator.validate("{\"headers\":{},\"body\":\"x\"}"));
    assertEquals(List.of("headers: must not be empty"), ex.getViolations());
  }

  @Test
  void missingEverythingReportsAllViolations() {
    InvalidJsonResponseException ex =
        assertThrows(InvalidJsonResponseException.class, () -> validator.validate("{}"));
    assertEquals(List.of("body: must not be null", "headers: must not be empty"), ex.getViolations());
  }

  @Test
  void nullHeaderValueIsInvalid() {
    assertThrows(
        InvalidJsonResponseException.class,
        () -> validator.validate("{\"headers\":{\"a\":null},\"body\":\"x\"}"));
  }

  @Test
  void wrongShapesAreInvalidRatherThanMalformed() {
    for (String json :
        List.of(
            "[1, 2]",
            "null",
            "{\"headers\":[\"a\"],\"body\":\"x\"}",
            "{\"headers\":{\"a\":\"b\"},\"body\":{\"nested\":true}}")) {
      InvalidJsonResponseException ex =
          assertThrows(InvalidJsonResponseException.class, () -> validator.validate(json), json);
      assertEquals(json, ex.getCleanedResponse());
      assertEquals(ResponderErrorCode.INVALID_JSON_RESPONSE, ex.getCode());
    }
  }
}
