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

package com.twentyn.spectra;

import com.twentyn.spectra.backend.BackendFactory;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.ExportFormat;
import com.twentyn.spectra.backend.InMemoryBackend;
import com.twentyn.spectra.backend.SpectraBackend;
import com.twentyn.spectra.backend.SpectraUpdate;
import com.twentyn.spectra.backend.SpectraView;
import com.twentyn.spectra.dispatch.Dispatcher;
import com.twentyn.spectra.dispatch.Partition;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import com.twentyn.spectra.processing.PeakFunction;
import com.twentyn.spectra.processing.PeakFunctions;
import com.twentyn.spectra.processing.ProcessingQueue;
import com.twentyn.spectra.processing.ProcessingStep;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.io.Closeable;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An ordered collection of mass spectra, independent of where the spectra are stored.
 *
 * A collection owns a {@link MetadataTable} (row i describes spectrum i) and one or more segments, each a backend
 * plus the {@link ProcessingQueue} that is applied to every peak read from it.  Collections built from a single
 * backend have one segment; {@link #combine(Spectra...)} is the only operation that produces several.
 *
 * Everything except {@link #setField(String, List)} and {@link #dropField(String)} returns a new collection and leaves
 * this one as it was.  Collections derived from one another may share backends; none of the operations here changes
 * what another collection reads.  Mutating operations are not safe to run concurrently with anything else on the same
 * instance; concurrent reads are.
 */
public class Spectra implements SpectraView, Closeable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Spectra.class);

  private static final DateTimeFormatter LOG_TIMESTAMP_FORMAT = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSS");

  private static class Segment {
    private final SpectraBackend backend;
    private final ProcessingQueue queue;

    Segment(SpectraBackend backend, ProcessingQueue queue) {
      this.backend = backend;
      this.queue = queue;
    }
  }

  private final List<Segment> segments;
  // For each row: the segment it is read from and its index in that segment's backend.
  private final int[] rowSegment;
  private final int[] rowLocal;
  private final MetadataTable metadata;
  private final List<String> processingLog;
  private final Dispatcher dispatcher;

  private Spectra(List<Segment> segments, int[] rowSegment, int[] rowLocal, MetadataTable metadata,
                  List<String> processingLog, Dispatcher dispatcher) {
    this.segments = segments;
    this.rowSegment = rowSegment;
    this.rowLocal = rowLocal;
    this.metadata = metadata;
    this.processingLog = processingLog;
    this.dispatcher = dispatcher;
  }

  /* ----------------------------------------
   * Construction
   */

  /**
   * Wraps a backend.  The collection's metadata is read from the backend once, here.
   * @param backend The backend holding the spectra.
   * @return A collection with one segment and an empty processing queue.
   */
  public static Spectra of(SpectraBackend backend) {
    int n = backend.spectrumCount();
    MetadataTable metadata = backend.metadata(backend.fieldNames());
    if (metadata.size() != n) {
      throw new SpectraException(String.format("Backend %s reported %d spectra but returned %d metadata rows",
          backend.getName(), n, metadata.size()));
    }
    int[] rowLocal = new int[n];
    for (int i = 0; i < n; i++) {
      rowLocal[i] = i;
    }
    List<Segment> segments = new ArrayList<>(1);
    segments.add(new Segment(backend, ProcessingQueue.EMPTY));
    Spectra spectra = new Spectra(segments, new int[n], rowLocal, metadata, Collections.emptyList(),
        Dispatcher.getDefault());
    return spectra.log(String.format("Bound %d spectra to %s", n, backend.getName()));
  }

  /**
   * Builds an in-memory collection from metadata rows and peaks.
   */
  public static Spectra fromData(MetadataTable metadata, List<PeakMatrix> peaks) {
    return of(new InMemoryBackend.Factory().fromData(metadata, peaks, BackendOptions.defaults()));
  }

  /**
   * Initializes one backend per distinct source and combines them in argument order.
   * @param factory The kind of backend to bind.
   * @param options Options passed to every initialize call.
   * @param sources Storage locations; repeated sources are read once.
   * @throws SourceUnavailableException If any source cannot be opened.
   */
  public static Spectra fromSources(BackendFactory factory, BackendOptions options, String... sources) {
    if (sources.length == 0) {
      throw new IllegalArgumentException("At least one source is required");
    }
    List<Spectra> parts = new ArrayList<>(sources.length);
    try {
      for (String source : new LinkedHashSet<>(Arrays.asList(sources))) {
        parts.add(of(factory.initialize(source, options)));
      }
    } catch (SpectraException e) {
      // Release whatever was opened before the failure.
      for (Spectra part : parts) {
        part.close();
      }
      throw e;
    }
    return parts.size() == 1 ? parts.get(0) : combine(parts.toArray(new Spectra[parts.size()]));
  }

  /**
   * Concatenates collections in argument order.  The field set of the result is the union of the inputs' field sets;
   * rows read as missing for fields their input did not have.  Each input's backends keep their own queues.
   */
  public static Spectra combine(Spectra... inputs) {
    if (inputs.length == 0) {
      throw new IllegalArgumentException("Nothing to combine");
    }
    List<Segment> segments = new ArrayList<>();
    List<MetadataTable> tables = new ArrayList<>(inputs.length);
    int total = 0;
    for (Spectra input : inputs) {
      total += input.size();
    }

    int[] rowSegment = new int[total];
    int[] rowLocal = new int[total];
    int row = 0;
    for (Spectra input : inputs) {
      int segmentOffset = segments.size();
      segments.addAll(input.segments);
      tables.add(input.metadata);
      for (int i = 0; i < input.size(); i++) {
        rowSegment[row] = input.rowSegment[i] + segmentOffset;
        rowLocal[row] = input.rowLocal[i];
        row++;
      }
    }

    List<String> log = new ArrayList<>(inputs[0].processingLog);
    Spectra combined = new Spectra(segments, rowSegment, rowLocal, MetadataTable.concat(tables), log,
        inputs[0].dispatcher);
    return combined.log(String.format("Combined %d collections into %d spectra", inputs.length, total));
  }

  public Spectra withDispatcher(Dispatcher dispatcher) {
    return new Spectra(segments, rowSegment, rowLocal, metadata.copy(), processingLog, dispatcher);
  }

  /* ----------------------------------------
   * Metadata
   */

  @Override
  public int size() {
    return metadata.size();
  }

  public Set<String> fieldNames() {
    return metadata.fieldNames();
  }

  @Override
  public MetadataTable getMetadata() {
    return metadata.copy();
  }

  /**
   * Reads any field.  Metadata fields never go through the processing queue; {@code mz} and {@code intensity} read
   * the processed peaks.
   * @param field The field name.
   * @return One value per spectrum; missing values are null.
   */
  public List<Object> get(String field) {
    if (CoreField.PEAK_FIELD_MZ.equals(field)) {
      return new ArrayList<>(mz());
    }
    if (CoreField.PEAK_FIELD_INTENSITY.equals(field)) {
      return new ArrayList<>(intensity());
    }
    return metadata.get(field);
  }

  @SuppressWarnings("unchecked")
  private <T> List<T> typed(CoreField field) {
    return (List<T>) (List<?>) metadata.get(field);
  }

  public List<Integer> acquisitionNum() {
    return typed(CoreField.ACQUISITION_NUM);
  }

  public List<Boolean> centroided() {
    return typed(CoreField.CENTROIDED);
  }

  public List<Double> collisionEnergy() {
    return typed(CoreField.COLLISION_ENERGY);
  }

  public List<String> dataOrigin() {
    return typed(CoreField.DATA_ORIGIN);
  }

  public List<String> dataStorage() {
    return typed(CoreField.DATA_STORAGE);
  }

  public List<Double> isolationWindowLowerMz() {
    return typed(CoreField.ISOLATION_WINDOW_LOWER_MZ);
  }

  public List<Double> isolationWindowTargetMz() {
    return typed(CoreField.ISOLATION_WINDOW_TARGET_MZ);
  }

  public List<Double> isolationWindowUpperMz() {
    return typed(CoreField.ISOLATION_WINDOW_UPPER_MZ);
  }

  public List<Integer> msLevel() {
    return typed(CoreField.MS_LEVEL);
  }

  public List<Integer> polarity() {
    return typed(CoreField.POLARITY);
  }

  public List<Integer> precScanNum() {
    return typed(CoreField.PREC_SCAN_NUM);
  }

  public List<Integer> precursorCharge() {
    return typed(CoreField.PRECURSOR_CHARGE);
  }

  public List<Double> precursorIntensity() {
    return typed(CoreField.PRECURSOR_INTENSITY);
  }

  public List<Double> precursorMz() {
    return typed(CoreField.PRECURSOR_MZ);
  }

  public List<Double> rtime() {
    return typed(CoreField.RTIME);
  }

  public List<Integer> scanIndex() {
    return typed(CoreField.SCAN_INDEX);
  }

  public List<Boolean> smoothed() {
    return typed(CoreField.SMOOTHED);
  }

  /**
   * Assigns a field of this collection.  Only this collection's metadata changes; backends are not written.
   * @param field The field to set; {@code mz} and {@code intensity} are rejected.
   * @param values One value per spectrum.
   * @throws LengthMismatchException If values.size() != size().
   * @throws TypeMismatchException If a core field value cannot be coerced to the field's type.
   * @throws UnsupportedSpectraOperationException If the field holds peaks.
   */
  public void setField(String field, List<?> values) {
    metadata.setColumn(field, values);
  }

  /**
   * Assigns the same value to every spectrum.
   */
  public void setField(String field, Object scalar) {
    metadata.setColumn(field, scalar);
  }

  /**
   * Removes an extra field from this collection.
   * @return True if the field was present.
   * @throws UnsupportedSpectraOperationException For core fields, which always exist.
   */
  public boolean dropField(String field) {
    if (CoreField.isCoreField(field) || CoreField.isPeakField(field)) {
      throw new UnsupportedSpectraOperationException(String.format("Field '%s' cannot be dropped", field));
    }
    return metadata.removeColumn(field);
  }

  /* ----------------------------------------
   * Peaks
   */

  /**
   * Reads every spectrum's peaks with its segment's processing queue applied.  Rows are grouped by segment and data
   * storage and read through the dispatcher.
   */
  @Override
  public List<PeakMatrix> peaks() {
    return dispatcher.run(partitions(), size(), partition -> {
      Segment segment = segments.get(partition.getSegment());
      return segment.queue.apply(segment.backend.peaks(partition.getLocalIndices()));
    });
  }

  public List<double[]> mz() {
    List<PeakMatrix> peaks = peaks();
    List<double[]> result = new ArrayList<>(peaks.size());
    for (PeakMatrix p : peaks) {
      result.add(p.getMz());
    }
    return result;
  }

  public List<double[]> intensity() {
    List<PeakMatrix> peaks = peaks();
    List<double[]> result = new ArrayList<>(peaks.size());
    for (PeakMatrix p : peaks) {
      result.add(p.getIntensity());
    }
    return result;
  }

  /**
   * @return The number of (processed) peaks in each spectrum.
   */
  public int[] lengths() {
    List<PeakMatrix> peaks = peaks();
    int[] lengths = new int[peaks.size()];
    for (int i = 0; i < lengths.length; i++) {
      lengths[i] = peaks.get(i).size();
    }
    return lengths;
  }

  /**
   * @return The summed (processed) intensity of each spectrum; 0 for spectra without peaks.
   */
  public double[] ionCount() {
    List<PeakMatrix> peaks = peaks();
    double[] counts = new double[peaks.size()];
    for (int i = 0; i < counts.length; i++) {
      counts[i] = peaks.get(i).totalIntensity();
    }
    return counts;
  }

  /* Partitions are keyed on (segment, dataStorage) and ordered by their first row. */
  List<Partition> partitions() {
    List<Object> storage = metadata.get(CoreField.DATA_STORAGE);
    Map<Pair<Integer, String>, List<Integer>> groups = new LinkedHashMap<>();
    for (int row = 0; row < size(); row++) {
      Object key = storage.get(row);
      Pair<Integer, String> groupKey = Pair.of(rowSegment[row], key == null ? null : key.toString());
      groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(row);
    }

    List<Partition> partitions = new ArrayList<>(groups.size());
    for (Map.Entry<Pair<Integer, String>, List<Integer>> entry : groups.entrySet()) {
      List<Integer> rows = entry.getValue();
      int[] rowArray = new int[rows.size()];
      int[] local = new int[rows.size()];
      for (int i = 0; i < rowArray.length; i++) {
        rowArray[i] = rows.get(i);
        local[i] = rowLocal[rowArray[i]];
      }
      partitions.add(new Partition(entry.getKey().getLeft(), entry.getKey().getRight(), rowArray, local));
    }
    return partitions;
  }

  /* ----------------------------------------
   * Processing
   */

  public Spectra addProcessing(ProcessingStep step) {
    List<Segment> extended = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      extended.add(new Segment(segment.backend, segment.queue.append(step)));
    }
    return new Spectra(extended, rowSegment, rowLocal, metadata.copy(), processingLog, dispatcher)
        .log(String.format("Queued %s", step));
  }

  public Spectra addProcessing(PeakFunction function, Map<String, ?> params) {
    return addProcessing(new ProcessingStep(function, params));
  }

  /**
   * Drops every queued step and resets the backends.  Peaks read afterwards are the stored peaks.
   */
  public Spectra reset() {
    List<Segment> cleared = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      segment.backend.reset();
      cleared.add(new Segment(segment.backend, ProcessingQueue.EMPTY));
    }
    return new Spectra(cleared, rowSegment, rowLocal, metadata.copy(), processingLog, dispatcher)
        .log("Reset processing queue");
  }

  /**
   * Writes the processed peaks back to storage and empties the queues.  Each processed segment is written through a
   * private subset of its backend, so other collections sharing the backend keep reading the old peaks.  Once applied,
   * {@link #reset()} cannot bring the old peaks back.
   * @throws UnsupportedSpectraOperationException If a segment with queued steps has a read-only backend.  Nothing is
   *   written in that case.
   */
  public Spectra applyProcessing() {
    for (Segment segment : segments) {
      if (!segment.queue.isEmpty() && !segment.backend.supportsWrite()) {
        throw new UnsupportedSpectraOperationException(String.format(
            "Cannot apply %d processing steps: %s is read-only", segment.queue.size(), segment.backend.getName()));
      }
    }

    List<PeakMatrix> processed = peaks();
    List<Segment> written = new ArrayList<>(segments.size());
    for (int s = 0; s < segments.size(); s++) {
      Segment segment = segments.get(s);
      if (segment.queue.isEmpty()) {
        written.add(segment);
        continue;
      }
      int count = segment.backend.spectrumCount();
      int[] all = new int[count];
      for (int i = 0; i < count; i++) {
        all[i] = i;
      }
      PeakMatrix[] byLocal = new PeakMatrix[count];
      for (int row = 0; row < size(); row++) {
        if (rowSegment[row] == s) {
          byLocal[rowLocal[row]] = processed.get(row);
        }
      }
      SpectraBackend target = segment.backend.subset(all);
      target.write(all, SpectraUpdate.ofPeaks(Arrays.asList(byLocal)));
      written.add(new Segment(target, ProcessingQueue.EMPTY));
    }
    return new Spectra(written, rowSegment, rowLocal, metadata.copy(), processingLog, dispatcher)
        .log("Applied processing queue");
  }

  /**
   * Moves the collection to a new backend holding its metadata and processed peaks.  The queue is empty afterwards.
   * {@code dataStorage} is whatever the new backend reports; {@code dataOrigin} is kept.  The old backends are left
   * open: other collections may still use them.
   */
  public Spectra setBackend(BackendFactory factory, BackendOptions options) {
    MetadataTable materialized = metadata.copy();
    // The new backend decides where its spectra are stored.
    materialized.removeColumn(CoreField.DATA_STORAGE.getName());
    SpectraBackend backend = factory.fromData(materialized, peaks(), options);
    Spectra moved = of(backend).withDispatcher(dispatcher);
    // Origin is where the spectra were first read from; backends that write files report themselves instead.
    List<Object> origin = new ArrayList<>(metadata.get(CoreField.DATA_ORIGIN));
    List<Object> reported = moved.metadata.get(CoreField.DATA_ORIGIN);
    for (int i = 0; i < origin.size(); i++) {
      if (origin.get(i) == null) {
        origin.set(i, reported.get(i));
      }
    }
    moved.metadata.setColumn(CoreField.DATA_ORIGIN.getName(), origin);
    List<String> log = new ArrayList<>(processingLog);
    log.addAll(moved.processingLog);
    return new Spectra(moved.segments, moved.rowSegment, moved.rowLocal, moved.metadata, log, dispatcher)
        .log(String.format("Moved %d spectra to %s", size(), backend.getName()));
  }

  /**
   * Writes the collection (processed peaks and metadata) with a backend's export capability.  Fields the format
   * cannot hold are dropped; compare {@link #fieldNames()} with those of a collection read back from the destination
   * to find them.
   * @throws UnsupportedFormatException If the factory cannot write the format.
   */
  public void export(BackendFactory factory, File destination, ExportFormat format) {
    LOGGER.info("Exporting %d spectra to %s as %s", size(), destination.getAbsolutePath(), format);
    factory.export(this, destination, format);
  }

  /* ----------------------------------------
   * Subsetting and filters
   */

  /**
   * Selects spectra by position.  Order and duplicates are kept.  Backends are scoped to the selected spectra with
   * {@link SpectraBackend#subset(int[])}; queues are carried over unchanged.
   * @throws IndexOutOfRangeException If any index is < 0 or >= size().
   */
  public Spectra subset(int... indices) {
    return select(indices, String.format("Selected %d of %d spectra", indices.length, size()));
  }

  private Spectra select(int[] indices, String logMessage) {
    IndexOutOfRangeException.checkIndices(indices, size());

    List<List<Integer>> localsBySegment = new ArrayList<>(segments.size());
    for (int s = 0; s < segments.size(); s++) {
      localsBySegment.add(new ArrayList<>());
    }
    int[] newSegmentOf = new int[segments.size()];
    int[] newRowSegment = new int[indices.length];
    int[] newRowLocal = new int[indices.length];
    for (int i = 0; i < indices.length; i++) {
      List<Integer> locals = localsBySegment.get(rowSegment[indices[i]]);
      newRowLocal[i] = locals.size();
      locals.add(rowLocal[indices[i]]);
    }

    List<Segment> newSegments = new ArrayList<>();
    for (int s = 0; s < segments.size(); s++) {
      List<Integer> locals = localsBySegment.get(s);
      if (locals.isEmpty()) {
        newSegmentOf[s] = -1;
        continue;
      }
      int[] localArray = new int[locals.size()];
      for (int i = 0; i < localArray.length; i++) {
        localArray[i] = locals.get(i);
      }
      newSegmentOf[s] = newSegments.size();
      Segment segment = segments.get(s);
      newSegments.add(new Segment(segment.backend.subset(localArray), segment.queue));
    }
    for (int i = 0; i < indices.length; i++) {
      newRowSegment[i] = newSegmentOf[rowSegment[indices[i]]];
    }

    return new Spectra(newSegments, newRowSegment, newRowLocal, metadata.project(indices), processingLog, dispatcher)
        .log(logMessage);
  }

  /**
   * Keeps the spectra whose metadata row passes a predicate.
   * @param predicate Tested against each row's fields (core fields included, missing values as null).
   */
  public Spectra filter(Predicate<Map<String, Object>> predicate) {
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < size(); i++) {
      if (predicate.test(metadata.row(i))) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("Filtered on a custom predicate: %d of %d spectra kept",
        keep.size(), size()));
  }

  private Spectra filterColumn(CoreField field, Predicate<Object> test, String description) {
    List<Object> column = metadata.get(field);
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < column.size(); i++) {
      Object value = column.get(i);
      // Missing values never match.
      if (value != null && test.test(value)) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("%s: %d of %d spectra kept", description, keep.size(), size()));
  }

  public Spectra filterMsLevel(int... levels) {
    Set<Integer> wanted = toSet(levels);
    return filterColumn(CoreField.MS_LEVEL, v -> wanted.contains(v),
        String.format("Filtered on MS level %s", Arrays.toString(levels)));
  }

  public Spectra filterPolarity(int... polarities) {
    Set<Integer> wanted = toSet(polarities);
    return filterColumn(CoreField.POLARITY, v -> wanted.contains(v),
        String.format("Filtered on polarity %s", Arrays.toString(polarities)));
  }

  /**
   * Keeps spectra with a retention time in [lo, hi].
   */
  public Spectra filterRt(double lo, double hi) {
    return filterColumn(CoreField.RTIME, v -> inRange((Double) v, lo, hi),
        String.format("Filtered on retention time [%s, %s]", lo, hi));
  }

  /**
   * Applies the retention time filter only to spectra of the given MS levels; spectra of other levels (or with no
   * level) are kept.
   */
  public Spectra filterRt(double lo, double hi, int... msLevels) {
    Set<Integer> levels = toSet(msLevels);
    List<Object> rt = metadata.get(CoreField.RTIME);
    List<Object> level = metadata.get(CoreField.MS_LEVEL);
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < size(); i++) {
      if (!levels.contains(level.get(i))) {
        keep.add(i);
      } else if (rt.get(i) != null && inRange((Double) rt.get(i), lo, hi)) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("Filtered MS level %s on retention time [%s, %s]: %d of %d kept",
        Arrays.toString(msLevels), lo, hi, keep.size(), size()));
  }

  public Spectra filterPrecursorMzRange(double lo, double hi) {
    return filterColumn(CoreField.PRECURSOR_MZ, v -> inRange((Double) v, lo, hi),
        String.format("Filtered on precursor m/z [%s, %s]", lo, hi));
  }

  public Spectra filterPrecursorCharge(int... charges) {
    Set<Integer> wanted = toSet(charges);
    return filterColumn(CoreField.PRECURSOR_CHARGE, v -> wanted.contains(v),
        String.format("Filtered on precursor charge %s", Arrays.toString(charges)));
  }

  /**
   * Keeps spectra whose isolation window [lower, upper] contains mz.
   */
  public Spectra filterIsolationWindow(double mz) {
    List<Object> lower = metadata.get(CoreField.ISOLATION_WINDOW_LOWER_MZ);
    List<Object> upper = metadata.get(CoreField.ISOLATION_WINDOW_UPPER_MZ);
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < size(); i++) {
      if (lower.get(i) != null && upper.get(i) != null && inRange(mz, (Double) lower.get(i), (Double) upper.get(i))) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("Filtered on isolation window containing %s: %d of %d kept",
        mz, keep.size(), size()));
  }

  public Spectra filterAcquisitionNum(int... acquisitionNums) {
    Set<Integer> wanted = toSet(acquisitionNums);
    return filterColumn(CoreField.ACQUISITION_NUM, v -> wanted.contains(v),
        String.format("Filtered on acquisition number %s", Arrays.toString(acquisitionNums)));
  }

  /**
   * Filters on acquisition number only among spectra from the given data storages; spectra from other storages are
   * kept.
   */
  public Spectra filterAcquisitionNum(int[] acquisitionNums, String... dataStorages) {
    Set<Integer> wanted = toSet(acquisitionNums);
    Set<String> storages = new HashSet<>(Arrays.asList(dataStorages));
    List<Object> storage = metadata.get(CoreField.DATA_STORAGE);
    List<Object> acquisition = metadata.get(CoreField.ACQUISITION_NUM);
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < size(); i++) {
      if (!storages.contains(storage.get(i)) || wanted.contains(acquisition.get(i))) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("Filtered %s on acquisition number %s: %d of %d kept",
        Arrays.toString(dataStorages), Arrays.toString(acquisitionNums), keep.size(), size()));
  }

  /**
   * Keeps spectra from the given origins.  Relative order is kept; the order of the arguments does not matter.
   */
  public Spectra filterDataOrigin(String... origins) {
    Set<String> wanted = new HashSet<>(Arrays.asList(origins));
    return filterColumn(CoreField.DATA_ORIGIN, v -> wanted.contains(v),
        String.format("Filtered on data origin %s", Arrays.toString(origins)));
  }

  public Spectra filterDataStorage(String... storages) {
    Set<String> wanted = new HashSet<>(Arrays.asList(storages));
    return filterColumn(CoreField.DATA_STORAGE, v -> wanted.contains(v),
        String.format("Filtered on data storage %s", Arrays.toString(storages)));
  }

  /**
   * Drops spectra that have no peaks once the processing queue has been applied.
   */
  public Spectra filterEmptySpectra() {
    int[] lengths = lengths();
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < lengths.length; i++) {
      if (lengths[i] > 0) {
        keep.add(i);
      }
    }
    return select(toArray(keep), String.format("Removed empty spectra: %d of %d kept", keep.size(), size()));
  }

  /* Peak-level filters are queued, not applied. */

  public Spectra filterIntensity(double lower, double upper) {
    return addProcessing(PeakFunctions.filterIntensity(lower, upper));
  }

  public Spectra filterMzRange(double lower, double upper) {
    return filterMzRange(lower, upper, true);
  }

  public Spectra filterMzRange(double lower, double upper, boolean keep) {
    return addProcessing(PeakFunctions.filterMzRange(lower, upper, keep));
  }

  public Spectra filterMzValues(double[] mz, double tolerance, double ppm) {
    return filterMzValues(mz, tolerance, ppm, true);
  }

  public Spectra filterMzValues(double[] mz, double tolerance, double ppm, boolean keep) {
    return addProcessing(PeakFunctions.filterMzValues(mz, tolerance, ppm, keep));
  }

  public Spectra replaceIntensitiesBelow(double threshold, double value) {
    return addProcessing(PeakFunctions.replaceIntensitiesBelow(threshold, value));
  }

  /* ----------------------------------------
   * Bookkeeping
   */

  /**
   * @return Timestamped descriptions of the operations that produced this collection, oldest first.
   */
  public List<String> getProcessingLog() {
    return processingLog;
  }

  /**
   * @return The queue of each segment, in segment order.
   */
  public List<ProcessingQueue> getProcessingQueues() {
    List<ProcessingQueue> queues = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      queues.add(segment.queue);
    }
    return Collections.unmodifiableList(queues);
  }

  public List<SpectraBackend> getBackends() {
    List<SpectraBackend> backends = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      backends.add(segment.backend);
    }
    return Collections.unmodifiableList(backends);
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  /**
   * Closes this collection's backends.  Only backends that own storage release anything; backends obtained through
   * {@link #subset(int...)} or a filter do not close storage they share.
   */
  @Override
  public void close() {
    for (Segment segment : segments) {
      segment.backend.close();
    }
  }

  private Spectra log(String message) {
    List<String> log = new ArrayList<>(processingLog.size() + 1);
    log.addAll(processingLog);
    log.add(String.format("[%s] %s", LOG_TIMESTAMP_FORMAT.print(new DateTime()), message));
    LOGGER.debug(message);
    return new Spectra(segments, rowSegment, rowLocal, metadata, Collections.unmodifiableList(log), dispatcher);
  }

  private static boolean inRange(double value, double lo, double hi) {
    return value >= lo && value <= hi;
  }

  private static Set<Integer> toSet(int[] values) {
    Set<Integer> set = new HashSet<>();
    for (int v : values) {
      set.add(v);
    }
    return set;
  }

  private static int[] toArray(List<Integer> values) {
    int[] array = new int[values.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = values.get(i);
    }
    return array;
  }

  @Override
  public String toString() {
    return String.format("Spectra(spectra=%d, segments=%d, fields=%d)", size(), segments.size(),
        metadata.fieldNames().size());
  }
}
