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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, immutable list of processing steps.  {@link #apply(PeakMatrix)} runs the steps in insertion order and
 * feeds each step the output of the previous one; steps are never reordered or fused.
 */
public final class ProcessingQueue {
  public static final ProcessingQueue EMPTY = new ProcessingQueue(Collections.emptyList());

  private final List<ProcessingStep> steps;

  private ProcessingQueue(List<ProcessingStep> steps) {
    this.steps = steps;
  }

  public ProcessingQueue append(ProcessingStep step) {
    List<ProcessingStep> extended = new ArrayList<>(steps.size() + 1);
    extended.addAll(steps);
    extended.add(step);
    return new ProcessingQueue(Collections.unmodifiableList(extended));
  }

  public PeakMatrix apply(PeakMatrix peaks) {
    PeakMatrix current = peaks;
    for (ProcessingStep step : steps) {
      current = step.apply(current);
    }
    return current;
  }

  public List<PeakMatrix> apply(List<PeakMatrix> peaks) {
    if (steps.isEmpty()) {
      return peaks;
    }
    List<PeakMatrix> results = new ArrayList<>(peaks.size());
    for (PeakMatrix matrix : peaks) {
      results.add(apply(matrix));
    }
    return results;
  }

  public List<ProcessingStep> getSteps() {
    return steps;
  }

  public int size() {
    return steps.size();
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("ProcessingQueue(%s)", steps);
  }
}
