package com.gentoro.responder.response;

import java.util.regex.Pattern;

/**
 * Removes markdown code-fence artifacts from model output.
 *
 * <p>One pass: a fence at the very start (optionally tagged {@code json}) and every other {@code
 * ```} marker are deleted, then surrounding whitespace is stripped. Nested or repeated fences get
 * no special treatment.
 */
public final class ResponseCleaner {
  private static final Pattern FENCE = Pattern.compile("^```(?:json)?|```");

  private ResponseCleaner() {}

  public static String clean(String input) {
    return FENCE.matcher(input).replaceAll("").strip();
  }
}
