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

import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.List;

/**
 * Writes spectra as a minimal mzML 1.1 document: one {@code <spectrum>} per row carrying the core fields mzML can
 * express as PSI-MS cvParams, and uncompressed 64-bit binary arrays.  Extra fields and the storage fields have no
 * mzML representation and are not written.
 */
public class MzMLWriter implements AutoCloseable {
  public static final String MZML_NAMESPACE = "http://psi.hupo.org/ms/mzml";
  public static final String MZML_VERSION = "1.1.0";

  private final OutputStream out;
  private final XMLStreamWriter xw;

  public MzMLWriter(File destination) throws IOException, XMLStreamException {
    this.out = new BufferedOutputStream(new FileOutputStream(destination));
    this.xw = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "utf-8");
  }

  public void write(MetadataTable metadata, List<PeakMatrix> peaks) throws XMLStreamException {
    xw.writeStartDocument("utf-8", "1.0");
    xw.writeCharacters("\n");
    xw.writeStartElement("mzML");
    xw.writeDefaultNamespace(MZML_NAMESPACE);
    xw.writeAttribute("version", MZML_VERSION);

    xw.writeStartElement("cvList");
    xw.writeAttribute("count", "1");
    xw.writeEmptyElement("cv");
    xw.writeAttribute("id", "MS");
    xw.writeAttribute("fullName", "Proteomics Standards Initiative Mass Spectrometry Ontology");
    xw.writeAttribute("URI", "https://raw.githubusercontent.com/HUPO-PSI/psi-ms-CV/master/psi-ms.obo");
    xw.writeEndElement();

    xw.writeStartElement("run");
    xw.writeAttribute("id", "run");
    xw.writeStartElement("spectrumList");
    xw.writeAttribute("count", Integer.toString(metadata.size()));
    for (int i = 0; i < metadata.size(); i++) {
      writeSpectrum(i, metadata, peaks.get(i));
    }
    xw.writeEndElement(); // spectrumList
    xw.writeEndElement(); // run
    xw.writeEndElement(); // mzML
    xw.writeEndDocument();
    xw.flush();
  }

  private void writeSpectrum(int index, MetadataTable metadata, PeakMatrix peaks) throws XMLStreamException {
    Integer acquisitionNum = (Integer) metadata.getValue(index, CoreField.ACQUISITION_NUM.getName());
    Integer msLevel = (Integer) metadata.getValue(index, CoreField.MS_LEVEL.getName());
    Boolean centroided = (Boolean) metadata.getValue(index, CoreField.CENTROIDED.getName());
    Integer polarity = (Integer) metadata.getValue(index, CoreField.POLARITY.getName());
    Double rtime = (Double) metadata.getValue(index, CoreField.RTIME.getName());

    xw.writeStartElement("spectrum");
    xw.writeAttribute("index", Integer.toString(index));
    xw.writeAttribute("id", "scan=" + (acquisitionNum != null ? acquisitionNum : index + 1));
    xw.writeAttribute("defaultArrayLength", Integer.toString(peaks.size()));

    if (msLevel != null) {
      cvParam("MS:1000511", "ms level", msLevel.toString(), null);
    }
    if (centroided != null) {
      if (centroided) {
        cvParam("MS:1000127", "centroid spectrum", null, null);
      } else {
        cvParam("MS:1000128", "profile spectrum", null, null);
      }
    }
    if (polarity != null) {
      if (polarity == CoreField.POLARITY_POSITIVE) {
        cvParam("MS:1000130", "positive scan", null, null);
      } else if (polarity == CoreField.POLARITY_NEGATIVE) {
        cvParam("MS:1000129", "negative scan", null, null);
      }
    }

    xw.writeStartElement("scanList");
    xw.writeAttribute("count", "1");
    xw.writeStartElement("scan");
    if (rtime != null) {
      cvParam("MS:1000016", "scan start time", rtime.toString(), "second");
    }
    xw.writeEndElement(); // scan
    xw.writeEndElement(); // scanList

    writePrecursor(index, metadata);

    xw.writeStartElement("binaryDataArrayList");
    xw.writeAttribute("count", "2");
    writeBinaryArray("MS:1000514", "m/z array", peaks.getMz());
    writeBinaryArray("MS:1000515", "intensity array", peaks.getIntensity());
    xw.writeEndElement(); // binaryDataArrayList

    xw.writeEndElement(); // spectrum
  }

  private void writePrecursor(int index, MetadataTable metadata) throws XMLStreamException {
    Integer precScanNum = (Integer) metadata.getValue(index, CoreField.PREC_SCAN_NUM.getName());
    Double precursorMz = (Double) metadata.getValue(index, CoreField.PRECURSOR_MZ.getName());
    Integer precursorCharge = (Integer) metadata.getValue(index, CoreField.PRECURSOR_CHARGE.getName());
    Double precursorIntensity = (Double) metadata.getValue(index, CoreField.PRECURSOR_INTENSITY.getName());
    Double collisionEnergy = (Double) metadata.getValue(index, CoreField.COLLISION_ENERGY.getName());
    Double target = (Double) metadata.getValue(index, CoreField.ISOLATION_WINDOW_TARGET_MZ.getName());
    Double lower = (Double) metadata.getValue(index, CoreField.ISOLATION_WINDOW_LOWER_MZ.getName());
    Double upper = (Double) metadata.getValue(index, CoreField.ISOLATION_WINDOW_UPPER_MZ.getName());

    if (precScanNum == null && precursorMz == null && precursorCharge == null && precursorIntensity == null &&
        collisionEnergy == null && target == null && lower == null && upper == null) {
      return;
    }
    // mzML stores the window as a target plus offsets.
    if (target == null && lower != null && upper != null) {
      target = (lower + upper) / 2.0;
    }

    xw.writeStartElement("precursorList");
    xw.writeAttribute("count", "1");
    xw.writeStartElement("precursor");
    if (precScanNum != null) {
      xw.writeAttribute("spectrumRef", "scan=" + precScanNum);
    }

    if (target != null) {
      xw.writeStartElement("isolationWindow");
      cvParam("MS:1000827", "isolation window target m/z", target.toString(), "m/z");
      if (lower != null) {
        cvParam("MS:1000828", "isolation window lower offset", Double.toString(target - lower), "m/z");
      }
      if (upper != null) {
        cvParam("MS:1000829", "isolation window upper offset", Double.toString(upper - target), "m/z");
      }
      xw.writeEndElement();
    }

    if (precursorMz != null || precursorCharge != null || precursorIntensity != null) {
      xw.writeStartElement("selectedIonList");
      xw.writeAttribute("count", "1");
      xw.writeStartElement("selectedIon");
      if (precursorMz != null) {
        cvParam("MS:1000744", "selected ion m/z", precursorMz.toString(), "m/z");
      }
      if (precursorCharge != null) {
        cvParam("MS:1000041", "charge state", precursorCharge.toString(), null);
      }
      if (precursorIntensity != null) {
        cvParam("MS:1000042", "peak intensity", precursorIntensity.toString(), "number of detector counts");
      }
      xw.writeEndElement(); // selectedIon
      xw.writeEndElement(); // selectedIonList
    }

    xw.writeStartElement("activation");
    if (collisionEnergy != null) {
      cvParam("MS:1000045", "collision energy", collisionEnergy.toString(), "electronvolt");
    }
    xw.writeEndElement(); // activation

    xw.writeEndElement(); // precursor
    xw.writeEndElement(); // precursorList
  }

  private void writeBinaryArray(String accession, String name, double[] values) throws XMLStreamException {
    String encoded = encodeBinaryArray(values);
    xw.writeStartElement("binaryDataArray");
    xw.writeAttribute("encodedLength", Integer.toString(encoded.length()));
    cvParam("MS:1000523", "64-bit float", null, null);
    cvParam("MS:1000576", "no compression", null, null);
    cvParam(accession, name, null, null);
    xw.writeStartElement("binary");
    xw.writeCharacters(encoded);
    xw.writeEndElement();
    xw.writeEndElement();
  }

  private void cvParam(String accession, String name, String value, String unitName) throws XMLStreamException {
    xw.writeEmptyElement("cvParam");
    xw.writeAttribute("cvRef", "MS");
    xw.writeAttribute("accession", accession);
    xw.writeAttribute("name", name);
    xw.writeAttribute("value", value == null ? "" : value);
    if (unitName != null) {
      xw.writeAttribute("unitName", unitName);
    }
  }

  static String encodeBinaryArray(double[] values) {
    ByteBuffer buf = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (double v : values) {
      buf.putDouble(v);
    }
    return Base64.getEncoder().encodeToString(buf.array());
  }

  @Override
  public void close() throws IOException, XMLStreamException {
    try {
      xw.close();
    } finally {
      out.close();
    }
  }
}
