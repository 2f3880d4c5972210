package com.onthegomap.wdosm.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Turns failures caught on worker threads into unchecked exceptions for the thread that waits on them.
 */
public final class Exceptions {

  private Exceptions() {}

  /**
   * Returns {@code failure} as an unchecked exception to throw from pipeline stage {@code stage}.
   * <p>
   * Runtime exceptions come back unchanged and errors are thrown directly. I/O failures become
   * {@link UncheckedIOException}, and anything else becomes a {@link StageFailedException}. An interrupt re-asserts the
   * interrupt flag of the current thread.
   */
  public static RuntimeException unchecked(String stage, Throwable failure) {
    if (failure instanceof Error error) {
      throw error;
    }
    if (failure instanceof RuntimeException runtime) {
      return runtime;
    }
    if (failure instanceof IOException io) {
      return new UncheckedIOException("I/O failure during " + stage, io);
    }
    if (failure instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    return new StageFailedException(stage, failure);
  }

  /** A checked failure that aborted a stage of a parse run. */
  public static class StageFailedException extends RuntimeException {

    private final String stage;

    public StageFailedException(String stage, Throwable cause) {
      super("Stage " + stage + " failed: " + cause, cause);
      this.stage = stage;
    }

    public String stage() {
      return stage;
    }
  }
}
