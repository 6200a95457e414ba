package com.tofes.analyzer.api;

/**
 * Thrown when an analyze request cannot be turned into a logbook table or a column mapping,
 * e.g. no header row or an unreadable column locator. Answered with HTTP 400.
 */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
