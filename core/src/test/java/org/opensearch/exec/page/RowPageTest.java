/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.page;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowPageTest {

  @Test
  void should_read_values_by_position_and_channel() {
    Page page = RowPage.of(2, List.of(new Object[] {1L, "orders"}, new Object[] {2L, null}));

    assertEquals(2, page.getPositionCount());
    assertEquals(1L, page.getValue(0, 0));
    assertEquals("orders", page.getValue(0, 1));
    assertNull(page.getValue(1, 1));
    assertEquals(32, page.getRetainedSizeBytes());
  }

  @Test
  void should_hand_out_copies_of_rows() {
    Page page = RowPage.of(2, List.<Object[]>of(new Object[] {1L, 2L}));

    page.getRow(0)[0] = 99L;

    assertArrayEquals(new Object[] {1L, 2L}, page.getRow(0));
  }

  @Test
  void should_expose_region_of_consecutive_positions() {
    Page page =
        RowPage.of(
            1,
            List.of(new Object[] {1L}, new Object[] {2L}, new Object[] {3L}, new Object[] {4L}));

    Page region = page.getRegion(1, 2);

    assertEquals(2, region.getPositionCount());
    assertEquals(2L, region.getValue(0, 0));
    assertEquals(3L, region.getValue(1, 0));
    assertEquals(0, page.getRegion(4, 0).getPositionCount());
  }

  @Test
  void should_create_empty_page_with_channels() {
    Page empty = RowPage.empty(4);

    assertEquals(0, empty.getPositionCount());
    assertEquals(4, empty.getChannelCount());
    assertEquals(0, empty.getRetainedSizeBytes());
  }

  @Test
  void should_reject_row_of_other_width() {
    assertThrows(
        IllegalArgumentException.class, () -> RowPage.of(2, List.<Object[]>of(new Object[] {1L})));
  }

  @Test
  void should_check_position_channel_and_region_bounds() {
    Page page = RowPage.of(2, List.<Object[]>of(new Object[] {1L, 2L}));

    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRow(-1));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(0, 2));
  }
}
