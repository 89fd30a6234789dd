package com.gentoro.responder.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames first.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /** Returns {@code t} itself when it already is a responder exception, otherwise wraps it. */
  public static ResponderException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ResponderException> supplier) {
    if (t instanceof ResponderException) {
      return (ResponderException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
