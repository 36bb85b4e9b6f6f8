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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The metadata fields every collection can answer regardless of its backend.  A core field that a backend does not
 * store reads as the missing sentinel (null) for every spectrum.
 *
 * Polarity follows the mzML convention used by most R/Bioconductor tooling: 1 is positive, 0 is negative.
 */
public enum CoreField {
  ACQUISITION_NUM("acquisitionNum", FieldType.INTEGER),
  CENTROIDED("centroided", FieldType.BOOLEAN),
  COLLISION_ENERGY("collisionEnergy", FieldType.DOUBLE),
  DATA_ORIGIN("dataOrigin", FieldType.STRING),
  DATA_STORAGE("dataStorage", FieldType.STRING),
  ISOLATION_WINDOW_LOWER_MZ("isolationWindowLowerMz", FieldType.DOUBLE),
  ISOLATION_WINDOW_TARGET_MZ("isolationWindowTargetMz", FieldType.DOUBLE),
  ISOLATION_WINDOW_UPPER_MZ("isolationWindowUpperMz", FieldType.DOUBLE),
  MS_LEVEL("msLevel", FieldType.INTEGER),
  POLARITY("polarity", FieldType.INTEGER),
  PREC_SCAN_NUM("precScanNum", FieldType.INTEGER),
  PRECURSOR_CHARGE("precursorCharge", FieldType.INTEGER),
  PRECURSOR_INTENSITY("precursorIntensity", FieldType.DOUBLE),
  PRECURSOR_MZ("precursorMz", FieldType.DOUBLE),
  RTIME("rtime", FieldType.DOUBLE),
  SCAN_INDEX("scanIndex", FieldType.INTEGER),
  SMOOTHED("smoothed", FieldType.BOOLEAN),
  ;

  public static final int POLARITY_NEGATIVE = 0;
  public static final int POLARITY_POSITIVE = 1;

  // Peak-bearing fields: never part of the metadata table, only reachable through the backend.
  public static final String PEAK_FIELD_MZ = "mz";
  public static final String PEAK_FIELD_INTENSITY = "intensity";

  private static final Map<String, CoreField> reverseNameMap =
      new HashMap<String, CoreField>() {{
        for (CoreField field : CoreField.values()) {
          put(field.getName(), field);
        }
      }};

  private static final Set<String> ALL_NAMES =
      Collections.unmodifiableSet(new LinkedHashSet<String>() {{
        for (CoreField field : CoreField.values()) {
          add(field.getName());
        }
      }});

  private String name;
  private FieldType type;

  CoreField(String name, FieldType type) {
    this.name = name;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public FieldType getType() {
    return type;
  }

  public Object coerce(Object value) {
    return type.coerce(name, value);
  }

  /**
   * @param name A field name.
   * @return The core field with that name, or null if the name is not a core field.
   */
  public static CoreField fromName(String name) {
    return reverseNameMap.get(name);
  }

  public static boolean isCoreField(String name) {
    return reverseNameMap.containsKey(name);
  }

  public static boolean isPeakField(String name) {
    return PEAK_FIELD_MZ.equals(name) || PEAK_FIELD_INTENSITY.equals(name);
  }

  /**
   * @return The names of all core fields in declaration order.
   */
  public static Set<String> names() {
    return ALL_NAMES;
  }
}
