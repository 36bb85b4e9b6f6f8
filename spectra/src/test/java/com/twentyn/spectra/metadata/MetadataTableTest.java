/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.metadata;

import com.twentyn.spectra.IndexOutOfRangeException;
import com.twentyn.spectra.LengthMismatchException;
import com.twentyn.spectra.TypeMismatchException;
import com.twentyn.spectra.UnsupportedSpectraOperationException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class MetadataTableTest {

  private MetadataTable table;

  @Before
  public void setup() throws Exception {
    table = new MetadataTable(3);
    table.setColumn("msLevel", Arrays.asList(1, 2, 2));
    table.setColumn("rtime", Arrays.asList(1.0, 2.0, null));
  }

  @Test
  public void testCoreFieldsAreAlwaysReadable() throws Exception {
    assertTrue(table.hasField("precursorMz"));
    assertEquals(Arrays.asList(null, null, null), table.get(CoreField.PRECURSOR_MZ));
    assertEquals(17, table.fieldNames().size());
    assertEquals(2, table.storedFieldNames().size());
    assertFalse(table.hasField("instrument"));
  }

  @Test
  public void testCoreValuesAreCoerced() throws Exception {
    table.setColumn("polarity", Arrays.asList("1", 0.0, null));
    assertEquals(Arrays.asList(1, 0, null), table.get("polarity"));
  }

  @Test(expected = TypeMismatchException.class)
  public void testBadCoreValueIsRejected() throws Exception {
    table.setColumn("msLevel", Arrays.asList(1, "MS2", 2));
  }

  @Test(expected = LengthMismatchException.class)
  public void testLengthMismatch() throws Exception {
    table.setColumn("instrument", Arrays.asList("a", "b"));
  }

  @Test(expected = UnsupportedSpectraOperationException.class)
  public void testPeakFieldsCannotBeStored() throws Exception {
    table.setColumn("mz", Arrays.asList(1, 2, 3));
  }

  @Test
  public void testExtraFieldsKeepTheirValues() throws Exception {
    table.setColumn("instrument", "orbitrap");
    assertEquals(Collections.nCopies(3, "orbitrap"), table.get("instrument"));
    assertEquals(Collections.singleton("instrument"), table.extraFieldNames());
    assertTrue(table.removeColumn("instrument"));
    assertFalse(table.removeColumn("instrument"));
  }

  @Test
  public void testProjectKeepsOrderAndDuplicates() throws Exception {
    MetadataTable projected = table.project(new int[]{2, 0, 0});
    assertEquals(3, projected.size());
    assertEquals(Arrays.asList(2, 1, 1), projected.get("msLevel"));
    assertEquals(Arrays.asList(null, 1.0, 1.0), projected.get("rtime"));
  }

  @Test(expected = IndexOutOfRangeException.class)
  public void testProjectOutOfRange() throws Exception {
    table.project(new int[]{0, 3});
  }

  @Test
  public void testSetValuesOnlyTouchesGivenRows() throws Exception {
    table.setValues("rtime", new int[]{2}, Collections.singletonList("3.5"));
    assertEquals(Arrays.asList(1.0, 2.0, 3.5), table.get("rtime"));
    table.setValues("instrument", new int[]{1}, Collections.singletonList("qtof"));
    assertEquals(Arrays.asList(null, "qtof", null), table.get("instrument"));
  }

  @Test
  public void testCopyIsIndependent() throws Exception {
    MetadataTable copy = table.copy();
    copy.setColumn("msLevel", Arrays.asList(3, 3, 3));
    assertEquals(Arrays.asList(1, 2, 2), table.get("msLevel"));
    assertEquals(table, table.copy());
  }

  @Test
  public void testConcatFillsMissingFields() throws Exception {
    MetadataTable other = new MetadataTable(1);
    other.setColumn("instrument", "qtof");
    MetadataTable merged = MetadataTable.concat(Arrays.asList(table, other));

    assertEquals(4, merged.size());
    assertEquals(Arrays.asList(null, null, null, "qtof"), merged.get("instrument"));
    assertEquals(Arrays.asList(1, 2, 2, null), merged.get("msLevel"));
  }

  @Test
  public void testFromRowsAndRow() throws Exception {
    List<Map<String, Object>> rows = new ArrayList<>();
    Map<String, Object> first = new HashMap<>();
    first.put("msLevel", 1);
    Map<String, Object> second = new HashMap<>();
    second.put("instrument", "qtof");
    rows.add(first);
    rows.add(second);

    MetadataTable fromRows = MetadataTable.fromRows(rows);
    assertEquals(2, fromRows.size());
    assertEquals(1, fromRows.getValue(0, "msLevel"));
    assertNull(fromRows.getValue(0, "instrument"));
    assertEquals("qtof", fromRows.row(1).get("instrument"));
    assertTrue(fromRows.row(1).containsKey("rtime"));
  }

  @Test
  public void testSelectFillsUnknownFields() throws Exception {
    MetadataTable selected = table.select(Arrays.asList("msLevel", "instrument", "mz"));
    assertEquals(2, selected.storedFieldNames().size());
    assertEquals(Arrays.asList(null, null, null), selected.get("instrument"));
  }
}
