package com.onthegomap.wdosm.store;

import com.onthegomap.wdosm.element.ElementKey;
import com.onthegomap.wdosm.parse.ElementRecord;
import com.onthegomap.wdosm.resolve.ClosureResult;
import java.util.Optional;

/**
 * The stored outcome of a parse run for one element.
 *
 * @param record  what the element's own annotation said
 * @param members candidate identifiers from related elements, empty when there is no data
 */
public record ElementRow(ElementRecord record, Optional<ClosureResult> members) {

  /** Returns the row for {@code record}, storing an empty {@code result} as no data. */
  public static ElementRow of(ElementRecord record, ClosureResult result) {
    return new ElementRow(record, result == null || result.isEmpty() ? Optional.empty() : Optional.of(result));
  }

  public ElementKey key() {
    return record.key();
  }

  /** True when the element has a Wikidata identifier of its own. */
  public boolean resolved() {
    return record.hasWdId();
  }

  public boolean hasMembers() {
    return members.isPresent();
  }

  /** Returns the largest count among the candidate identifiers, 0 without candidates. */
  public int maxMemberCount() {
    return members.map(ClosureResult::maxCount).orElse(0);
  }

  /** An element with candidate identifiers but none of its own. */
  public boolean suspect() {
    return !resolved() && hasMembers();
  }
}
