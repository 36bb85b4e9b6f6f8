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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ProcessingQueueTest {
  private static final PeakMatrix PEAKS = new PeakMatrix(new double[]{1.0, 2.0, 3.0}, new double[]{1.0, 5.0, 10.0});

  @Test
  public void testStepsRunInInsertionOrder() throws Exception {
    List<String> calls = new ArrayList<>();
    ProcessingQueue queue = ProcessingQueue.EMPTY
        .append(new ProcessingStep("first", (p, params) -> {
          calls.add("first");
          return p;
        }, Collections.emptyMap()))
        .append(new ProcessingStep("second", (p, params) -> {
          calls.add("second");
          return p;
        }, Collections.emptyMap()));

    queue.apply(PEAKS);
    assertEquals(2, queue.size());
    assertEquals("first", calls.get(0));
    assertEquals("second", calls.get(1));
  }

  @Test
  public void testOrderMattersForNonCommutingSteps() throws Exception {
    // Raising low intensities first lets them pass the filter.
    ProcessingQueue replaceThenFilter = ProcessingQueue.EMPTY
        .append(PeakFunctions.replaceIntensitiesBelow(6.0, 7.0))
        .append(PeakFunctions.filterIntensity(6.5, Double.POSITIVE_INFINITY));
    ProcessingQueue filterThenReplace = ProcessingQueue.EMPTY
        .append(PeakFunctions.filterIntensity(6.5, Double.POSITIVE_INFINITY))
        .append(PeakFunctions.replaceIntensitiesBelow(6.0, 7.0));

    assertEquals(3, replaceThenFilter.apply(PEAKS).size());
    assertEquals(1, filterThenReplace.apply(PEAKS).size());
  }

  @Test
  public void testAppendDoesNotModifyTheOriginal() throws Exception {
    ProcessingQueue base = ProcessingQueue.EMPTY.append(PeakFunctions.scaleIntensities(1.0));
    ProcessingQueue extended = base.append(PeakFunctions.smooth(1));
    assertEquals(1, base.size());
    assertEquals(2, extended.size());
    assertTrue(ProcessingQueue.EMPTY.isEmpty());
  }

  @Test
  public void testEmptyQueueReturnsInputs() throws Exception {
    List<PeakMatrix> input = Collections.singletonList(PEAKS);
    assertSame(input, ProcessingQueue.EMPTY.apply(input));
  }

  @Test(expected = IllegalStateException.class)
  public void testNullResultIsRejected() throws Exception {
    ProcessingQueue.EMPTY.append(new ProcessingStep((p, params) -> null, Collections.emptyMap())).apply(PEAKS);
  }

  @Test
  public void testStepDescription() throws Exception {
    ProcessingStep step = PeakFunctions.filterMzValues(new double[]{100.0, 200.0}, 0.01, 5.0, true);
    assertEquals("filterMzValues(mz=[100.0, 200.0], tolerance=0.01, ppm=5.0, keep=true)", step.toString());
  }
}
