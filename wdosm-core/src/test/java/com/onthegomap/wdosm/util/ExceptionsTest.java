package com.onthegomap.wdosm.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ExceptionsTest {

  @Test
  void testRuntimeExceptionUnchanged() {
    IllegalStateException cause = new IllegalStateException();
    assertSame(cause, Exceptions.unchecked("parse", cause));
  }

  @Test
  void testErrorThrown() {
    AssertionError error = new AssertionError("bad");
    assertSame(error, assertThrows(AssertionError.class, () -> Exceptions.unchecked("parse", error)));
  }

  @Test
  void testIOExceptionWrapped() {
    IOException cause = new IOException();
    var wrapped = Exceptions.unchecked("export", cause);
    assertTrue(wrapped instanceof UncheckedIOException);
    assertSame(cause, wrapped.getCause());
  }

  @Test
  void testCheckedExceptionNamesStage() {
    Exception cause = new Exception("boom");
    var wrapped = (Exceptions.StageFailedException) Exceptions.unchecked("graph", cause);
    assertEquals("graph", wrapped.stage());
    assertSame(cause, wrapped.getCause());
  }

  @Test
  void testInterruptRestored() {
    var wrapped = Exceptions.unchecked("resolve", new InterruptedException());
    assertTrue(wrapped instanceof Exceptions.StageFailedException);
    assertTrue(Thread.interrupted());
  }
}
