package com.onthegomap.wdosm.parse;

import com.google.common.base.Splitter;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Splits an element's raw annotation string into {@link Token Tokens}.
 * <p>
 * Tokens are separated by one or more of space, comma, semicolon, colon or dash. A reserved marker standing alone
 * ({@code Q} or {@code c}) takes the next piece as its payload, so {@code "c:u0qgbz9dns1"} and {@code "cu0qgbz9dns1"}
 * both read as a centroid. A marker never takes a piece that is an integer token of its own, such as {@code n10} in
 * {@code "c n10"}; the marker then stays bare. Parsing never fails: text that does not look like an integer token
 * becomes free text.
 */
public class TokenParser {

  private static final Splitter SPLITTER = Splitter.on(Pattern.compile("[\\s,;:\\-]+")).omitEmptyStrings();

  private TokenParser() {}

  /**
   * Returns a lazy view of the tokens in {@code raw}. Every call to {@link Iterable#iterator()} parses again from the
   * start.
   */
  public static Iterable<Token> tokenize(String raw) {
    String text = raw == null ? "" : raw;
    return () -> new TokenIterator(SPLITTER.split(text).iterator());
  }

  /** Returns every token in {@code raw}, in order. */
  public static List<Token> parse(String raw) {
    List<Token> result = new ArrayList<>();
    tokenize(raw).forEach(result::add);
    return result;
  }

  private static class TokenIterator implements Iterator<Token> {

    private final PeekingIterator<String> pieces;

    TokenIterator(Iterator<String> pieces) {
      this.pieces = Iterators.peekingIterator(pieces);
    }

    @Override
    public boolean hasNext() {
      return pieces.hasNext();
    }

    @Override
    public Token next() {
      if (!pieces.hasNext()) {
        throw new NoSuchElementException();
      }
      Token token = Token.of(pieces.next());
      if (token.isBareMarker() && pieces.hasNext() && !Token.of(pieces.peek()).isInteger()) {
        token = Token.of(token.kind(), pieces.next());
      }
      return token;
    }
  }
}
