package com.onthegomap.wdosm.reader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of a raw dump: an element and its unparsed annotation string.
 *
 * @param osmType  element type, only the first character counts
 * @param osmId    element id
 * @param otherIds annotation string, see {@link com.onthegomap.wdosm.parse.TokenParser}
 */
@JsonPropertyOrder({"osm_type", "osm_id", "other_ids"})
public record RawRow(
  @JsonProperty("osm_type") String osmType,
  @JsonProperty("osm_id") Long osmId,
  @JsonProperty("other_ids") String otherIds
) {}
