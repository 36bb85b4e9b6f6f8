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

package com.twentyn.spectra.processing;

import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable (function, bound parameters) pair, queued for lazy application to peak data.
 */
public final class ProcessingStep {
  private final String name;
  private final PeakFunction function;
  private final Map<String, Object> params;

  public ProcessingStep(String name, PeakFunction function, Map<String, ?> params) {
    if (function == null) {
      throw new IllegalArgumentException("A processing step needs a function");
    }
    this.name = name;
    this.function = function;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public ProcessingStep(PeakFunction function, Map<String, ?> params) {
    this("custom", function, params);
  }

  public String getName() {
    return name;
  }

  public PeakFunction getFunction() {
    return function;
  }

  public Map<String, Object> getParams() {
    return params;
  }

  public PeakMatrix apply(PeakMatrix peaks) {
    PeakMatrix result = function.apply(peaks, params);
    if (result == null) {
      throw new IllegalStateException(String.format("Processing step %s returned no peak matrix", name));
    }
    return result;
  }

  @Override
  public String toString() {
    List<String> bound = new ArrayList<>(params.size());
    for (Map.Entry<String, Object> entry : params.entrySet()) {
      Object value = entry.getValue();
      String rendered = value instanceof double[] ? Arrays.toString((double[]) value) : String.valueOf(value);
      bound.add(entry.getKey() + "=" + rendered);
    }
    return String.format("%s(%s)", name, StringUtils.join(bound, ", "));
  }
}
