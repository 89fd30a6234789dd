package com.gentoro.responder.exception;

/**
 * Canonical error codes for the responder. Codes are stable and suitable for downstream services
 * and logs; the embedding system uses them to decide whether to retry, fall back to a canned
 * response or fail the HTTP exchange.
 */
public enum ResponderErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  CANCELLED,
  DEADLINE_EXCEEDED,

  // Configuration and provider setup
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  UNSUPPORTED_PROVIDER,
  PROVIDER_INITIALIZATION,

  // Generation pipeline
  CONTENT_GENERATION,
  EMPTY_RESPONSE,
  MALFORMED_JSON,
  INVALID_JSON_RESPONSE,
}
