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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * This is meant to be a convenient wrapper around the EDC documents (the .PIC files) that MPLAB X
 * uses to describe Microchip parts.  The parts of the document we care about look like this, with
 * the "edc:" prefix on every name usually present:
 * <pre>
 * &lt;PIC name="PIC32MX170F256B"&gt;
 *   &lt;PhysicalSpace&gt;
 *     &lt;SFRDataSector regionid="periph"&gt;
 *       &lt;SFRDef name="..." cname="..." _addr="0x..." mclr="..." portals="..."&gt;
 *         &lt;SFRModeList&gt;
 *           &lt;SFRMode&gt; SFRFieldDef and AdjustPoint nodes &lt;/SFRMode&gt;
 * </pre>
 *
 * Consider this class as the "root" of the other Edc___ classes.  Start here and use the objects
 * returned to drill down further.
 */
public class EdcDoc {
    /* Only data sectors whose region ID starts with this hold peripheral SFRs.  Others hold things
     * like the core and debug registers, which do not have a place in an SVD file.
     */
    public static final String PERIPHERAL_REGION_PREFIX = "periph";

    private final Node rootNode_;
    private final Node physicalSpaceNode_;
    private List<EdcSfr> sfrs_ = null;


    /* Create a new EdcDoc by reading the given file.  This will throw an exception if the file
     * cannot be read, is not XML, or does not contain the PhysicalSpace node.
     */
    public EdcDoc(File edcFile) throws ParserConfigurationException, SAXException, IOException {
        this(newDocumentBuilder().parse(edcFile));
    }

    /* Like above, but reads the document from a stream.  The stream is not closed.
     */
    public EdcDoc(InputStream edcStream) throws ParserConfigurationException, SAXException, IOException {
        this(newDocumentBuilder().parse(edcStream));
    }

    /* Wrap an already parsed document.
     */
    public EdcDoc(Document doc) throws EdcFormatException {
        doc.getDocumentElement().normalize();

        rootNode_ = (Node)doc.getDocumentElement();
        physicalSpaceNode_ = Utils.filterFirstChildNode(rootNode_, "PhysicalSpace");

        // Use this as a simple sanity check to see that we have a valid EDC file.
        if(null == physicalSpaceNode_) {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_ELEMENT,
                                         "PhysicalSpace node not found in " +
                                         Utils.describeNode(rootNode_) + ".  Is this an EDC file?");
        }
    }


    /* Return the name of the device described by this document, such as "PIC32MX170F256B".
     */
    public String getName() throws EdcFormatException {
        return Utils.getRequiredNodeAttribute(rootNode_, "name");
    }

    /* Get the peripheral SFRs from every data sector whose region ID starts with "periph", in the
     * order they appear in the document.  Sectors are not sorted or merged, so the caller sees
     * exactly the order MPLAB X has them in.
     */
    public List<EdcSfr> getPeripheralSfrs() {
        if(null == sfrs_) {
            sfrs_ = new ArrayList<>(256);

            for(Node sectorNode : Utils.filterAllChildNodes(physicalSpaceNode_, "SFRDataSector")) {
                String regionId = Utils.getNodeAttribute(sectorNode, "regionid", "");

                if(regionId.startsWith(PERIPHERAL_REGION_PREFIX)) {
                    for(Node sfrNode : Utils.filterAllChildNodes(sectorNode, "SFRDef")) {
                        sfrs_.add(new EdcSfr(sfrNode));
                    }
                }
            }
        }

        return sfrs_;
    }


    /* Not namespace-aware:  the .PIC files do not always declare the "edc" prefix they use.
     */
    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setIgnoringComments(true);
        return factory.newDocumentBuilder();
    }
}
