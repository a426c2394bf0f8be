/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.testing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rel.type.RelDataTypeSystem;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.opensearch.exec.page.Page;
import org.opensearch.exec.page.RowPage;
import org.opensearch.exec.plan.TableScanNode;
import org.opensearch.exec.plan.ValuesNode;

/** Row types, pages and leaf nodes shared by the tests. */
@UtilityClass
public class TestingPlans {

  public static final RelDataTypeFactory TYPE_FACTORY =
      new SqlTypeFactoryImpl(RelDataTypeSystem.DEFAULT);

  /** Returns a row type of {@code columns} BIGINT columns named c0, c1 and so on. */
  public static RelDataType bigintRow(int columns) {
    RelDataTypeFactory.FieldInfoBuilder builder = TYPE_FACTORY.builder();
    for (int i = 0; i < columns; i++) {
      builder.add("c" + i, SqlTypeName.BIGINT);
    }
    return builder.build();
  }

  public static Object[] row(Object... values) {
    return values;
  }

  public static Page page(Object[]... rows) {
    return RowPage.of(rows[0].length, Arrays.asList(rows));
  }

  /** Returns the rows of a list of pages, in order. */
  public static List<List<Object>> rows(List<Page> pages) {
    List<List<Object>> rows = new ArrayList<>();
    for (Page page : pages) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        rows.add(Arrays.asList(page.getRow(position)));
      }
    }
    return rows;
  }

  public static ValuesNode values(String id, int columns, Page... pages) {
    return new ValuesNode(id, bigintRow(columns), Arrays.asList(pages));
  }

  public static TableScanNode scan(String id, int columns, Page... pages) {
    return new TableScanNode(id, bigintRow(columns), new InMemoryTable(id, pages));
  }
}
