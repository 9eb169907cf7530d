/* Copyright (c) 2020, Jesse DeGuire
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 * 
 * * Redistributions of source code must retain the above copyright notice, this
 *   list of conditions and the following disclaimer.
 *
 * * Redistributions in binary form must reproduce the above copyright notice,
 *   this list of conditions and the following disclaimer in the documentation
 *   and/or other materials provided with the distribution.
 * 
 * * Neither the name of the copyright holder nor the names of its
 *   contributors may be used to endorse or promote products derived from
 *   this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL
 * DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR
 * SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER
 * CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY,
 * OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.github.jdeguire.edc2svd;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.apache.commons.io.FileUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes an SvdDevice out as an indented SVD document.  Only the elements the converter has data for
 * are written:
 * <pre>
 * device
 *   name
 *   peripherals
 *     peripheral
 *       name, description, baseAddress
 *       registers
 *         register
 *           name, description, addressOffset, size, resetValue
 *           fields (optional)
 *             field
 *               name, bitRange
 * </pre>
 */
public class SvdDocumentWriter {

    private static final String INDENT_AMOUNT = "2";


    /* Write the device to the given file, creating any missing parent directories.  The file is
     * created only after the DOM tree is fully built, so a failure here never leaves a partial
     * file behind unless the write itself fails.
     */
    public void write(SvdDevice device, File svdFile) throws IOException {
        Document doc = buildDocument(device);

        try(OutputStream out = FileUtils.openOutputStream(svdFile)) {
            transform(doc, out);
        }
    }

    /* Write the device to the given stream.  The stream is not closed.
     */
    public void write(SvdDevice device, OutputStream out) throws IOException {
        transform(buildDocument(device), out);
    }

    /* Build the DOM tree for the given device.  This is public so the tree can be checked without
     * going through text.
     */
    public Document buildDocument(SvdDevice device) throws IOException {
        Document doc;

        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch(ParserConfigurationException pce) {
            throw new IOException("Cannot create an XML document for the SVD output.", pce);
        }

        doc.setXmlStandalone(true);

        Element deviceElem = doc.createElement("device");
        addElementWithText(deviceElem, "name", device.getName());

        Element peripheralsElem = doc.createElement("peripherals");
        for(SvdPeripheral peripheral : device.getPeripherals()) {
            peripheralsElem.appendChild(createPeripheralElement(doc, peripheral));
        }

        deviceElem.appendChild(peripheralsElem);
        doc.appendChild(deviceElem);
        return doc;
    }


    private Element createPeripheralElement(Document doc, SvdPeripheral peripheral) {
        Element periphElem = doc.createElement("peripheral");
        addElementWithText(periphElem, "name", peripheral.getName());
        addElementWithText(periphElem, "description", peripheral.getDescription());
        addElementWithText(periphElem, "baseAddress", Utils.toHexString(peripheral.getBaseAddress()));

        Element registersElem = doc.createElement("registers");
        for(SvdRegister register : peripheral.getRegisters()) {
            registersElem.appendChild(createRegisterElement(doc, register));
        }

        periphElem.appendChild(registersElem);
        return periphElem;
    }

    private Element createRegisterElement(Document doc, SvdRegister register) {
        Element regElem = doc.createElement("register");
        addElementWithText(regElem, "name", register.getName());
        addElementWithText(regElem, "description", register.getDescription());
        addElementWithText(regElem, "addressOffset", Utils.toHexString(register.getAddressOffset()));
        addElementWithText(regElem, "size", Integer.toString(register.getSize()));
        addElementWithText(regElem, "resetValue", Long.toString(register.getResetValue()));

        if(register.hasFields()) {
            Element fieldsElem = doc.createElement("fields");

            for(SvdField field : register.getFields()) {
                Element fieldElem = doc.createElement("field");
                addElementWithText(fieldElem, "name", field.getName());
                addElementWithText(fieldElem, "bitRange", field.getBitRange());
                fieldsElem.appendChild(fieldElem);
            }

            regElem.appendChild(fieldsElem);
        }

        return regElem;
    }

    private static void addElementWithText(Element parent, String name, String text) {
        Element elem = parent.getOwnerDocument().createElement(name);
        elem.setTextContent(text);
        parent.appendChild(elem);
    }

    private static void transform(Document doc, OutputStream out) throws IOException {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", INDENT_AMOUNT);
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        } catch(TransformerException te) {
            throw new IOException("Cannot write SVD document.", te);
        }
    }
}
