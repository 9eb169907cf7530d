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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.xml.parsers.DocumentBuilderFactory;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SvdDocumentWriterTests {
    private SvdDevice device;

    @TempDir
    File tempDir;

    @BeforeEach
    public void setupEach() throws EdcFormatException {
        device = new SvdDevice("PIC32MX170F256B");

        SvdPeripheral tmr1 = new SvdPeripheral("TMR1", 0xBF800600L);
        FieldLayout layout = FieldLayoutBuilder.build("T1CON", Arrays.asList(
                EdcModeEntry.adjust(1),
                EdcModeEntry.field("TCS", "TCS", 1),
                EdcModeEntry.adjust(13),
                EdcModeEntry.field("ON", "ON", 1)));
        RegisterSynthesizer.addRegisters(tmr1, "T1CON", 0x0, 0, Portals.CLR_SET_INV, layout);
        RegisterSynthesizer.addRegisters(tmr1, "TMR1", 0x10, 0,
                                         Portals.NONE, FieldLayoutBuilder.build("TMR1", Collections.<EdcModeEntry>emptyList()));

        SvdPeripheral tmr2 = new SvdPeripheral("TMR2", 0xBF800800L);
        RegisterSynthesizer.addRegisters(tmr2, "T2CON", 0x0, 0x80000000L, Portals.NONE, layout);

        device.addPeripheral(tmr1);
        device.addPeripheral(tmr2);
    }

    private static List<Element> childElements(Node parent) {
        List<Element> elements = new ArrayList<>();
        for(Node n : Utils.filterAllChildNodes(parent, null)) {
            elements.add((Element)n);
        }
        return elements;
    }

    private static String childText(Node parent, String name) {
        Node child = Utils.filterFirstChildNode(parent, name);
        return (null != child) ? child.getTextContent() : null;
    }

    private static Document parse(byte[] svd) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new ByteArrayInputStream(svd));
    }

    @Test
    public void documentFollowsTheSvdLayout() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new SvdDocumentWriter().write(device, out);
        Document doc = parse(out.toByteArray());

        Element root = doc.getDocumentElement();
        assertEquals("device", root.getNodeName());

        List<Element> top = childElements(root);
        assertEquals(2, top.size());
        assertEquals("name", top.get(0).getNodeName());
        assertEquals("PIC32MX170F256B", top.get(0).getTextContent());
        assertEquals("peripherals", top.get(1).getNodeName());
        assertEquals(1, Utils.filterAllChildNodes(root, "peripherals").size());

        List<Element> periphs = childElements(top.get(1));
        assertEquals(2, periphs.size());
        assertEquals("TMR1", childText(periphs.get(0), "name"));
        assertEquals("TMR1 peripheral", childText(periphs.get(0), "description"));
        assertEquals("0xbf800600", childText(periphs.get(0), "baseAddress"));
        assertEquals("TMR2", childText(periphs.get(1), "name"));
        assertEquals("0xbf800800", childText(periphs.get(1), "baseAddress"));
    }

    @Test
    public void registersAreWrittenWithHexOffsetsAndDecimalResets() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new SvdDocumentWriter().write(device, out);
        Document doc = parse(out.toByteArray());

        Node peripherals = Utils.filterFirstChildNode(doc.getDocumentElement(), "peripherals");
        List<Node> periphs = Utils.filterAllChildNodes(peripherals, "peripheral");
        List<Node> tmr1Regs = Utils.filterAllChildNodes(Utils.filterFirstChildNode(periphs.get(0), "registers"), "register");

        assertEquals(5, tmr1Regs.size());

        Node t1conInv = tmr1Regs.get(3);
        assertEquals("T1CONINV", childText(t1conInv, "name"));
        assertEquals("T1CONINV register", childText(t1conInv, "description"));
        assertEquals("0xc", childText(t1conInv, "addressOffset"));
        assertEquals("32", childText(t1conInv, "size"));
        assertEquals("0", childText(t1conInv, "resetValue"));

        List<Node> fields = Utils.filterAllChildNodes(Utils.filterFirstChildNode(t1conInv, "fields"), "field");
        assertEquals(2, fields.size());
        assertEquals("TCS", childText(fields.get(0), "name"));
        assertEquals("[1:1]", childText(fields.get(0), "bitRange"));
        assertEquals("[15:15]", childText(fields.get(1), "bitRange"));

        Node tmr1 = tmr1Regs.get(4);
        assertEquals("0x10", childText(tmr1, "addressOffset"));
        assertNull(Utils.filterFirstChildNode(tmr1, "fields"));

        Node t2con = Utils.filterFirstChildNode(Utils.filterFirstChildNode(periphs.get(1), "registers"), "register");
        assertEquals("2147483648", childText(t2con, "resetValue"));
    }

    @Test
    public void outputIsIndented() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new SvdDocumentWriter().write(device, out);
        String text = out.toString(StandardCharsets.UTF_8.name());

        assertTrue(text.startsWith("<?xml"));
        assertTrue(text.contains("\n  <peripherals>"), text);
        assertTrue(text.contains("\n    <peripheral>"), text);
        assertTrue(text.contains("<bitRange>[15:15]</bitRange>"), text);
    }

    @Test
    public void writingToAFileCreatesParentDirectories() throws Exception {
        File svdFile = new File(tempDir, "out/nested/PIC32MX170F256B.svd");
        new SvdDocumentWriter().write(device, svdFile);

        assertTrue(svdFile.isFile());
        Document doc = parse(FileUtils.readFileToByteArray(svdFile));
        assertEquals("PIC32MX170F256B", childText(doc.getDocumentElement(), "name"));
    }
}
