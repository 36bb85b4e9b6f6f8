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

import com.twentyn.spectra.TypeMismatchException;
import org.apache.commons.lang3.StringUtils;

/**
 * Semantic types of the core metadata fields.  Every assignment to a core field is coerced through
 * {@link #coerce(String, Object)}; null (and an empty string or NaN) is the missing-value sentinel and is always
 * accepted.
 */
public enum FieldType {
  INTEGER {
    @Override
    Object coerceNonNull(String field, Object value) {
      if (value instanceof Integer) {
        return value;
      }
      if (value instanceof Long || value instanceof Short || value instanceof Byte) {
        long l = ((Number) value).longValue();
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
          throw new TypeMismatchException(field, name(), value);
        }
        return (int) l;
      }
      if (value instanceof Double || value instanceof Float) {
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d)) {
          return null;
        }
        if (d != Math.rint(d) || Double.isInfinite(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
          throw new TypeMismatchException(field, name(), value);
        }
        return (int) d;
      }
      if (value instanceof CharSequence) {
        String s = value.toString().trim();
        try {
          return Integer.parseInt(s);
        } catch (NumberFormatException e) {
          // Integral doubles like "2.0" are fine, anything else is not.
          try {
            return coerceNonNull(field, Double.parseDouble(s));
          } catch (NumberFormatException e2) {
            throw new TypeMismatchException(field, name(), value);
          }
        }
      }
      throw new TypeMismatchException(field, name(), value);
    }
  },
  DOUBLE {
    @Override
    Object coerceNonNull(String field, Object value) {
      if (value instanceof Double) {
        return Double.isNaN((Double) value) ? null : value;
      }
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        return Double.isNaN(d) ? null : d;
      }
      if (value instanceof CharSequence) {
        try {
          double d = Double.parseDouble(value.toString().trim());
          return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
          throw new TypeMismatchException(field, name(), value);
        }
      }
      throw new TypeMismatchException(field, name(), value);
    }
  },
  BOOLEAN {
    @Override
    Object coerceNonNull(String field, Object value) {
      if (value instanceof Boolean) {
        return value;
      }
      if (value instanceof CharSequence) {
        String s = value.toString().trim();
        if ("true".equalsIgnoreCase(s)) {
          return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(s)) {
          return Boolean.FALSE;
        }
      }
      throw new TypeMismatchException(field, name(), value);
    }
  },
  STRING {
    @Override
    Object coerceNonNull(String field, Object value) {
      if (value instanceof CharSequence || value instanceof Number ||
          value instanceof Boolean || value instanceof Character) {
        return value.toString();
      }
      throw new TypeMismatchException(field, name(), value);
    }
  },
  ;

  abstract Object coerceNonNull(String field, Object value);

  /**
   * Coerces a value to this type.
   * @param field The field being assigned, used for error reporting.
   * @param value The value to coerce; may be null.
   * @return The coerced value, or null if the value represents a missing entry.
   * @throws TypeMismatchException If the value cannot be represented as this type.
   */
  public Object coerce(String field, Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof CharSequence && StringUtils.isBlank((CharSequence) value) && this != STRING) {
      return null;
    }
    return coerceNonNull(field, value);
  }
}
