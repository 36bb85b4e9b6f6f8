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
import org.apache.commons.io.input.ReaderInputStream;
import org.w3c.dom.Document;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.XMLEvent;
import javax.xml.xpath.XPathException;
import javax.xml.xpath.XPathFactory;
import java.io.ByteArrayOutputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntPredicate;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Streams {@code <spectrum>} entries out of an mzML document.  Each entry is cut out of the event stream, re-read as
 * its own small DOM document and handed to {@link #handleSpectrumEntry(Document, int)}, so only one spectrum is held in
 * memory at a time.
 *
 * @param <S> The type each spectrum entry is converted to.
 */
public abstract class MzMLParser<S> {
  public static final String SPECTRUM_OBJECT_TAG = "spectrum";
  public static final String XML_PREAMBLE = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";

  // XPathFactory is known to be non-thread-safe.
  protected static final ThreadLocal<XPathFactory> XPATH_FACTORY = new ThreadLocal<XPathFactory>() {
    @Override
    protected XPathFactory initialValue() {
      return XPathFactory.newInstance();
    }
  };

  /**
   * Helper function: builds an XML DocumentBuilderFactory that can be used repeatedly in this class.
   *
   * @return An XML DocumentBuilderFactory.
   * @throws ParserConfigurationException
   */
  public static DocumentBuilderFactory mkDocBuilderFactory() throws ParserConfigurationException {
    // from http://stackoverflow.com/questions/155101/make-documentbuilder-parse-ignore-dtd-references
    DocumentBuilderFactory docFactory = DocumentBuilderFactory.newInstance();
    docFactory.setValidating(false);
    docFactory.setNamespaceAware(true);
    docFactory.setFeature("http://xml.org/sax/features/namespaces", false);
    docFactory.setFeature("http://xml.org/sax/features/validation", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-dtd-grammar", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    return docFactory;
  }

  /**
   * Decodes an mzML binary data array: base64 text holding little-endian IEEE 754 floats, optionally zlib compressed.
   * @param b64 The base64 text of the {@code <binary>} element.
   * @param is64Bit True for 64-bit doubles, false for 32-bit floats.
   * @param zlib True if the bytes are zlib compressed.
   * @return The decoded values.
   */
  protected static double[] decodeBinaryArray(String b64, boolean is64Bit, boolean zlib) {
    String trimmed = b64 == null ? "" : b64.trim();
    if (trimmed.isEmpty()) {
      return new double[0];
    }
    byte[] decodedBytes = Base64.getDecoder().decode(trimmed);
    if (zlib) {
      decodedBytes = inflate(decodedBytes);
    }
    ByteBuffer buf = ByteBuffer.wrap(decodedBytes).order(ByteOrder.LITTLE_ENDIAN);
    int width = is64Bit ? Double.BYTES : Float.BYTES;
    double[] values = new double[decodedBytes.length / width];
    for (int i = 0; i < values.length; i++) {
      values[i] = is64Bit ? buf.getDouble() : buf.getFloat();
    }
    return values;
  }

  private static byte[] inflate(byte[] compressed) {
    Inflater inflater = new Inflater();
    inflater.setInput(compressed);
    try (ByteArrayOutputStream bos = new ByteArrayOutputStream(compressed.length * 2)) {
      byte[] chunk = new byte[4096];
      while (!inflater.finished()) {
        int n = inflater.inflate(chunk);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          throw new SpectraException("Truncated zlib data in mzML binary array");
        }
        bos.write(chunk, 0, n);
      }
      return bos.toByteArray();
    } catch (DataFormatException | IOException e) {
      throw new SpectraException("Unable to inflate mzML binary array", e);
    } finally {
      inflater.end();
    }
  }

  public MzMLParser() {
  }

  protected XPathFactory getXPathFactory() {
    return XPATH_FACTORY.get();
  }

  public SpectrumIterator getIterator(String inputFile)
      throws ParserConfigurationException, IOException, XMLStreamException {
    return getIterator(inputFile, ordinal -> true);
  }

  /**
   * Streams the spectra of a file, handling only those whose position among the file's {@code <spectrum>} elements
   * passes a filter.  Skipped entries are never turned into documents.
   * @param inputFile The mzML file to read.
   * @param ordinalFilter Accepts the 0-based position of each spectrum element in the file.
   * @return An iterator over handled spectra; close it if it is not exhausted.
   */
  public SpectrumIterator getIterator(String inputFile, IntPredicate ordinalFilter)
      throws ParserConfigurationException, IOException, XMLStreamException {
    return new SpectrumIterator(inputFile, ordinalFilter);
  }

  public List<S> parse(String inputFile)
      throws ParserConfigurationException, IOException, XMLStreamException {
    List<S> spectra = new ArrayList<>();
    try (SpectrumIterator iter = this.getIterator(inputFile)) {
      while (iter.hasNext()) {
        spectra.add(iter.next());
      }
    }
    return spectra;
  }

  /**
   * Converts one spectrum document.
   * @param doc A document whose root is a {@code <spectrum>} element.
   * @param ordinal The 0-based position of the spectrum element in its file.
   * @return The converted spectrum, or null to skip it.
   */
  protected abstract S handleSpectrumEntry(Document doc, int ordinal) throws XPathException;

  public class SpectrumIterator implements Iterator<S>, AutoCloseable {
    private final XMLOutputFactory xmlOutputFactory = XMLOutputFactory.newInstance();
    private final DocumentBuilder docBuilder;
    private final IntPredicate ordinalFilter;
    private final InputStream inputStream;

    private XMLEventReader xr;
    private StringWriter w;
    private XMLEventWriter xw;
    private boolean inEntry = false;
    private boolean skippingEntry = false;
    private int ordinal = -1;

    private S next = null;

    SpectrumIterator(String inputFile, IntPredicate ordinalFilter)
        throws ParserConfigurationException, IOException, XMLStreamException {
      this.docBuilder = mkDocBuilderFactory().newDocumentBuilder();
      this.ordinalFilter = ordinalFilter;
      this.inputStream = new FileInputStream(inputFile);
      this.xr = XMLInputFactory.newInstance().createXMLEventReader(inputStream, "utf-8");
      resetWriter();
    }

    private void resetWriter() throws XMLStreamException {
      w = new StringWriter().append(XML_PREAMBLE).append("\n");
      xw = xmlOutputFactory.createXMLEventWriter(w);
    }

    /* Because we're handling the XML as a stream, we can only determine whether we have another spectrum to return by
     * attempting to parse the next one. */
    private S getNextSpectrum() {
      S spectrum = null;
      if (xr == null) {
        return null;
      }

      try {
        while (xr.hasNext()) {
          XMLEvent e = xr.nextEvent();
          if (!inEntry && e.isStartElement() &&
              e.asStartElement().getName().getLocalPart().equals(SPECTRUM_OBJECT_TAG)) {
            inEntry = true;
            ordinal++;
            skippingEntry = !ordinalFilter.test(ordinal);
            if (!skippingEntry) {
              xw.add(e);
            }
          } else if (inEntry && e.isEndElement() &&
              e.asEndElement().getName().getLocalPart().equals(SPECTRUM_OBJECT_TAG)) {
            inEntry = false;
            if (skippingEntry) {
              continue;
            }
            xw.add(e);
            xw.flush();
            /* Each entry is serialized and re-read into its own document so it can be handled by XPath. */
            Document doc = docBuilder.parse(
                new ReaderInputStream(new StringReader(w.toString()), StandardCharsets.UTF_8));
            spectrum = handleSpectrumEntry(doc, ordinal);
            xw.close();
            resetWriter();
            // Don't stop parsing if handleSpectrumEntry didn't like this spectrum document.
            if (spectrum != null) {
              break;
            }
          } else if (inEntry && !skippingEntry) {
            xw.add(e);
          }
        }

        // We've reached the end of the document; close the reader to show that we're done.
        if (!xr.hasNext()) {
          close();
        }
      } catch (SpectraException e) {
        close();
        throw e;
      } catch (Exception e) {
        close();
        throw new SpectraException(String.format("Unable to parse mzML spectrum %d", ordinal), e);
      }

      return spectrum;
    }

    @Override
    public boolean hasNext() {
      // Prime the pump if the iterator doesn't have a value stored yet.
      if (this.next == null) {
        this.next = getNextSpectrum();
      }
      return this.next != null;
    }

    @Override
    public S next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      S res = this.next;
      this.next = null;
      return res;
    }

    @Override
    public void close() {
      if (xr == null) {
        return;
      }
      try {
        xr.close();
        inputStream.close();
      } catch (XMLStreamException | IOException e) {
        throw new SpectraException("Unable to close mzML stream", e);
      } finally {
        xr = null;
      }
    }
  }
}
