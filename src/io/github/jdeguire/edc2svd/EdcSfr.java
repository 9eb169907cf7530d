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

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Node;

/**
 * This represents a single special function register (an "SFRDef" node) from an EDC document.
 * This is handled in the EdcDoc class, so use methods in there to get EdcSfr objects rather than
 * creating them directly.
 */
public class EdcSfr {
    private final Node sfrNode_;


    public EdcSfr(Node sfrNode) {
        sfrNode_ = sfrNode;
    }


    /* Get the register name as shown in the datasheet.
     */
    public String getName() throws EdcFormatException {
        return Utils.getRequiredNodeAttribute(sfrNode_, "name");
    }

    /* Get the register name as used in the compiler headers.  For SFRs this must match getName().
     */
    public String getCName() throws EdcFormatException {
        return Utils.getRequiredNodeAttribute(sfrNode_, "cname");
    }

    /* Get the physical address of this register.  On MIPS devices this is the physical address and
     * not the kseg0 or kseg1 address the CPU would use.
     */
    public long getPhysicalAddress() throws EdcFormatException {
        return AttributeDecoder.parseAddressLiteral(Utils.getRequiredNodeAttribute(sfrNode_, "_addr"));
    }

    /* Get the value of this register after a device reset.
     */
    public long getResetValue() throws EdcFormatException {
        return AttributeDecoder.decodeResetPattern(Utils.getRequiredNodeAttribute(sfrNode_, "mclr"));
    }

    /* Get the CLR/SET/INV registers this register has.  No "portals" attribute means none.
     */
    public Portals getPortals() throws EdcFormatException {
        return AttributeDecoder.decodePortals(getPortalsText());
    }

    /* Get the raw "portals" text, with "- - -" standing in for a missing attribute.
     */
    public String getPortalsText() {
        return Utils.getNodeAttribute(sfrNode_, "portals", Portals.NONE.getEdcText());
    }

    /* These return the hints used to figure out which peripheral owns this register or null if the
     * attribute is not present.
     */
    public String getBaseOfPeripheral() {
        return Utils.getNodeAttribute(sfrNode_, "baseofperipheral", null);
    }

    public String getMemberOfPeripheral() {
        return Utils.getNodeAttribute(sfrNode_, "memberofperipheral", null);
    }

    public String getGroup() {
        return Utils.getNodeAttribute(sfrNode_, "grp", null);
    }

    public String getModuleSource() {
        return Utils.getNodeAttribute(sfrNode_, "_modsrc", null);
    }

    /* Get the entries of the first mode in this register's mode list.  A register can have a few
     * ways to look at its bits, but the first mode is the one that lists the real fields.  This
     * throws if the register has no mode list or the list is empty.
     */
    public List<EdcModeEntry> getFirstModeEntries() throws EdcFormatException {
        Node modeListNode = Utils.filterFirstChildNode(sfrNode_, "SFRModeList");
        if(null == modeListNode) {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_ELEMENT,
                                         "SFRModeList node missing from " +
                                         Utils.describeNode(sfrNode_) + ".");
        }

        Node modeNode = Utils.filterFirstChildNode(modeListNode, "SFRMode");
        if(null == modeNode) {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_ELEMENT,
                                         "SFRMode node missing from " +
                                         Utils.describeNode(sfrNode_) + ".");
        }

        List<Node> children = Utils.filterAllChildNodes(modeNode, null);
        List<EdcModeEntry> entries = new ArrayList<>(children.size());

        for(Node child : children) {
            entries.add(EdcModeEntry.fromNode(child));
        }

        return entries;
    }
}
