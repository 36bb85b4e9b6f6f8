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

package com.twentyn.spectra.backend.mzml;

import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts mzML spectrum entries into {@link MzMLSpectrum} objects.
 *
 * Metadata is read from PSI-MS cvParams by name.  Binary arrays may be 32- or 64-bit floats, with or without zlib
 * compression; other compression schemes (numpress) are rejected.  Scan start times given in minutes are converted to
 * seconds.
 */
public class MzMLSpectrumParser extends MzMLParser<MzMLSpectrum> {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MzMLSpectrumParser.class);

  public static final String SPECTRUM_PATH_ID = "/spectrum/@id";
  public static final String SPECTRUM_PATH_MS_LEVEL = "/spectrum/cvParam[@name='ms level']/@value";
  public static final String SPECTRUM_PATH_CENTROID = "//cvParam[@name='centroid spectrum']";
  public static final String SPECTRUM_PATH_PROFILE = "//cvParam[@name='profile spectrum']";
  public static final String SPECTRUM_PATH_POSITIVE = "//cvParam[@name='positive scan']";
  public static final String SPECTRUM_PATH_NEGATIVE = "//cvParam[@name='negative scan']";
  public static final String SPECTRUM_PATH_SCAN_START_TIME =
      "/spectrum/scanList/scan/cvParam[@name='scan start time']/@value";
  public static final String SPECTRUM_PATH_SCAN_START_TIME_UNIT =
      "/spectrum/scanList/scan/cvParam[@name='scan start time']/@unitName";

  private static final String PRECURSOR = "/spectrum/precursorList/precursor[1]";
  public static final String SPECTRUM_PATH_PRECURSOR_REF = PRECURSOR + "/@spectrumRef";
  public static final String SPECTRUM_PATH_PRECURSOR_MZ =
      PRECURSOR + "/selectedIonList/selectedIon/cvParam[@name='selected ion m/z']/@value";
  public static final String SPECTRUM_PATH_PRECURSOR_CHARGE =
      PRECURSOR + "/selectedIonList/selectedIon/cvParam[@name='charge state']/@value";
  public static final String SPECTRUM_PATH_PRECURSOR_INTENSITY =
      PRECURSOR + "/selectedIonList/selectedIon/cvParam[@name='peak intensity']/@value";
  public static final String SPECTRUM_PATH_ISOLATION_TARGET =
      PRECURSOR + "/isolationWindow/cvParam[@name='isolation window target m/z']/@value";
  public static final String SPECTRUM_PATH_ISOLATION_LOWER_OFFSET =
      PRECURSOR + "/isolationWindow/cvParam[@name='isolation window lower offset']/@value";
  public static final String SPECTRUM_PATH_ISOLATION_UPPER_OFFSET =
      PRECURSOR + "/isolationWindow/cvParam[@name='isolation window upper offset']/@value";
  public static final String SPECTRUM_PATH_COLLISION_ENERGY =
      PRECURSOR + "/activation/cvParam[@name='collision energy']/@value";

  private static final String MZ_ARRAY = "/spectrum/binaryDataArrayList/binaryDataArray[./cvParam/@name='m/z array']";
  private static final String INTENSITY_ARRAY =
      "/spectrum/binaryDataArrayList/binaryDataArray[./cvParam/@name='intensity array']";
  private static final String BINARY = "/binary/text()";
  private static final String IS_32_BIT = "/cvParam[@name='32-bit float']";
  private static final String IS_ZLIB = "/cvParam[@name='zlib compression']";
  private static final String IS_NUMPRESS = "/cvParam[starts-with(@name, 'MS-Numpress')]";

  public static final Pattern SCAN_NUMBER_REGEX = Pattern.compile("scan=(\\d+)");

  private static final double SECONDS_PER_MINUTE = 60.0;

  private final boolean readPeaks;

  /**
   * @param readPeaks False to skip binary arrays entirely, which is all a metadata scan needs.
   */
  public MzMLSpectrumParser(boolean readPeaks) {
    super();
    this.readPeaks = readPeaks;
  }

  @Override
  protected MzMLSpectrum handleSpectrumEntry(Document doc, int ordinal) throws XPathException {
    XPath xpath = getXPathFactory().newXPath();

    String id = (String) xpath.evaluate(SPECTRUM_PATH_ID, doc, XPathConstants.STRING);
    Map<String, Object> metadata = new LinkedHashMap<>();

    Integer scanNumber = scanNumber(id);
    // Without a scan number in the native id we fall back on the 1-based position in the file.
    metadata.put(CoreField.ACQUISITION_NUM.getName(), scanNumber != null ? scanNumber : ordinal + 1);
    metadata.put(CoreField.SCAN_INDEX.getName(), ordinal + 1);
    metadata.put(CoreField.MS_LEVEL.getName(), number(xpath, doc, SPECTRUM_PATH_MS_LEVEL));

    if (exists(xpath, doc, SPECTRUM_PATH_CENTROID)) {
      metadata.put(CoreField.CENTROIDED.getName(), true);
    } else if (exists(xpath, doc, SPECTRUM_PATH_PROFILE)) {
      metadata.put(CoreField.CENTROIDED.getName(), false);
    }
    if (exists(xpath, doc, SPECTRUM_PATH_POSITIVE)) {
      metadata.put(CoreField.POLARITY.getName(), CoreField.POLARITY_POSITIVE);
    } else if (exists(xpath, doc, SPECTRUM_PATH_NEGATIVE)) {
      metadata.put(CoreField.POLARITY.getName(), CoreField.POLARITY_NEGATIVE);
    }

    Double scanStartTime = number(xpath, doc, SPECTRUM_PATH_SCAN_START_TIME);
    if (scanStartTime != null) {
      String unit = (String) xpath.evaluate(SPECTRUM_PATH_SCAN_START_TIME_UNIT, doc, XPathConstants.STRING);
      if ("minute".equals(unit)) {
        scanStartTime = scanStartTime * SECONDS_PER_MINUTE;
      }
    }
    metadata.put(CoreField.RTIME.getName(), scanStartTime);

    String precursorRef = (String) xpath.evaluate(SPECTRUM_PATH_PRECURSOR_REF, doc, XPathConstants.STRING);
    metadata.put(CoreField.PREC_SCAN_NUM.getName(), scanNumber(precursorRef));
    metadata.put(CoreField.PRECURSOR_MZ.getName(), number(xpath, doc, SPECTRUM_PATH_PRECURSOR_MZ));
    metadata.put(CoreField.PRECURSOR_CHARGE.getName(), number(xpath, doc, SPECTRUM_PATH_PRECURSOR_CHARGE));
    metadata.put(CoreField.PRECURSOR_INTENSITY.getName(), number(xpath, doc, SPECTRUM_PATH_PRECURSOR_INTENSITY));
    metadata.put(CoreField.COLLISION_ENERGY.getName(), number(xpath, doc, SPECTRUM_PATH_COLLISION_ENERGY));

    Double target = number(xpath, doc, SPECTRUM_PATH_ISOLATION_TARGET);
    Double lowerOffset = number(xpath, doc, SPECTRUM_PATH_ISOLATION_LOWER_OFFSET);
    Double upperOffset = number(xpath, doc, SPECTRUM_PATH_ISOLATION_UPPER_OFFSET);
    metadata.put(CoreField.ISOLATION_WINDOW_TARGET_MZ.getName(), target);
    metadata.put(CoreField.ISOLATION_WINDOW_LOWER_MZ.getName(),
        target != null && lowerOffset != null ? target - lowerOffset : null);
    metadata.put(CoreField.ISOLATION_WINDOW_UPPER_MZ.getName(),
        target != null && upperOffset != null ? target + upperOffset : null);

    PeakMatrix peaks = null;
    if (readPeaks) {
      double[] mz = readArray(xpath, doc, MZ_ARRAY, id);
      double[] intensity = readArray(xpath, doc, INTENSITY_ARRAY, id);
      if (mz.length != intensity.length) {
        throw new SpectraException(String.format(
            "Spectrum %s has %d m/z values but %d intensities", id, mz.length, intensity.length));
      }
      peaks = new PeakMatrix(mz, intensity);
    }

    return new MzMLSpectrum(ordinal, id, metadata, peaks);
  }

  private double[] readArray(XPath xpath, Document doc, String arrayPath, String id) throws XPathException {
    if (!exists(xpath, doc, arrayPath)) {
      LOGGER.warn("No binary array matching %s in spectrum %s, reading it as empty", arrayPath, id);
      return new double[0];
    }
    if (exists(xpath, doc, arrayPath + IS_NUMPRESS)) {
      throw new SpectraException(String.format("Spectrum %s uses MS-Numpress compression, which is not supported", id));
    }
    String data = (String) xpath.evaluate(arrayPath + BINARY, doc, XPathConstants.STRING);
    boolean is32Bit = exists(xpath, doc, arrayPath + IS_32_BIT);
    boolean zlib = exists(xpath, doc, arrayPath + IS_ZLIB);
    return decodeBinaryArray(data, !is32Bit, zlib);
  }

  private static boolean exists(XPath xpath, Document doc, String path) throws XPathException {
    return xpath.evaluate(path, doc, XPathConstants.NODE) != null;
  }

  /* XPath yields NaN rather than null for absent nodes. */
  private static Double number(XPath xpath, Document doc, String path) throws XPathException {
    Double value = (Double) xpath.evaluate(path, doc, XPathConstants.NUMBER);
    return value == null || value.isNaN() ? null : value;
  }

  static Integer scanNumber(String nativeId) {
    if (StringUtils.isEmpty(nativeId)) {
      return null;
    }
    Matcher matcher = SCAN_NUMBER_REGEX.matcher(nativeId);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }
}
