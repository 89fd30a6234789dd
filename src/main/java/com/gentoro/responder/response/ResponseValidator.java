package com.gentoro.responder.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.responder.exception.InvalidJsonResponseException;
import com.gentoro.responder.exception.MalformedJsonException;
import com.gentoro.responder.utility.JacksonUtility;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.List;
import java.util.Set;
import org.hibernate.validator.HibernateValidator;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * Parses cleaned model output and checks it against the constraints declared on {@link
 * GeneratedResponse}.
 */
public final class ResponseValidator {
  private static final ValidatorFactory VALIDATOR_FACTORY =
      Validation.byProvider(HibernateValidator.class)
          .configure()
          .messageInterpolator(new ParameterMessageInterpolator())
          .buildValidatorFactory();

  private final ObjectMapper mapper;
  private final Validator validator;

  public ResponseValidator() {
    this(JacksonUtility.getStrictJsonMapper(), VALIDATOR_FACTORY.getValidator());
  }

  ResponseValidator(ObjectMapper mapper, Validator validator) {
    this.mapper = mapper;
    this.validator = validator;
  }

  /**
   * @throws MalformedJsonException when {@code cleaned} is not a single JSON document
   * @throws InvalidJsonResponseException when the document does not satisfy the response shape
   */
  public GeneratedResponse validate(String cleaned) {
    JsonNode tree;
    try {
      tree = mapper.readTree(cleaned);
    } catch (JsonProcessingException e) {
      throw new MalformedJsonException(cleaned, e);
    }
    if (tree == null || tree.isMissingNode()) {
      throw new MalformedJsonException(cleaned, null);
    }

    GeneratedResponse response;
    try {
      response = mapper.treeToValue(tree, GeneratedResponse.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new InvalidJsonResponseException(cleaned, e);
    }
    if (response == null) {
      throw new InvalidJsonResponseException(cleaned, List.of("response: must not be null"));
    }

    Set<ConstraintViolation<GeneratedResponse>> violations = validator.validate(response);
    if (!violations.isEmpty()) {
      throw new InvalidJsonResponseException(
          cleaned,
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .distinct()
              .sorted()
              .toList());
    }
    return response;
  }
}
