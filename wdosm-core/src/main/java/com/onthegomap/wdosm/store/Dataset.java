package com.onthegomap.wdosm.store;

import java.time.LocalDate;

/**
 * A registered batch of elements, usually one country.
 *
 * @param id      serial id, starting at 1
 * @param abbrev  unique short name, an ISO 3166-1 alpha-2 code for countries
 * @param name    region or curator project name
 * @param curator the group responsible for checks and endorsements
 * @param created registration date
 */
public record Dataset(int id, String abbrev, String name, String curator, LocalDate created) {}
