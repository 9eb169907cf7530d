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

import org.w3c.dom.Node;

/**
 * One child of an SFRMode node.  A mode lists the fields of a register from bit 0 upwards without
 * giving their positions; the position of each field is however many bits came before it.  Two
 * kinds of children are expected:
 * <ul>
 * <li>SFRFieldDef, a field with a name and a width ("nzwidth").</li>
 * <li>AdjustPoint, a gap of "offset" unused bits before the next field.</li>
 * </ul>
 * Anything else is kept as UNKNOWN so that the layout code can report it.
 */
public class EdcModeEntry {
    public enum Kind {
        FIELD,
        ADJUST,
        UNKNOWN
    };

    private final Kind kind_;
    private final String elementName_;
    private final String name_;
    private final String cname_;
    private final long bits_;


    private EdcModeEntry(Kind kind, String elementName, String name, String cname, long bits) {
        kind_ = kind;
        elementName_ = elementName;
        name_ = name;
        cname_ = cname;
        bits_ = bits;
    }

    /* Create a field entry.  The name is what the datasheet shows and the cname is what the
     * compiler headers use; they are normally the same.
     */
    public static EdcModeEntry field(String name, String cname, long width) {
        return new EdcModeEntry(Kind.FIELD, "SFRFieldDef", name, cname, width);
    }

    /* Create an entry that skips the given number of bits.
     */
    public static EdcModeEntry adjust(long offset) {
        return new EdcModeEntry(Kind.ADJUST, "AdjustPoint", "", "", offset);
    }

    /* Create an entry for an element that should not be in a mode block.
     */
    public static EdcModeEntry unknown(String elementName) {
        return new EdcModeEntry(Kind.UNKNOWN, elementName, "", "", 0);
    }

    /* Read an entry from a child node of an SFRMode.  Numbers are decoded here, so this will
     * throw if a width or offset is missing or is not a number.
     */
    public static EdcModeEntry fromNode(Node node) throws EdcFormatException {
        String elementName = Utils.getLocalName(node);

        switch(elementName) {
            case "SFRFieldDef": {
                String cname = Utils.getRequiredNodeAttribute(node, "cname");
                String name = Utils.getNodeAttribute(node, "name", cname);
                long width = AttributeDecoder.parseAddressLiteral(Utils.getRequiredNodeAttribute(node, "nzwidth"));
                return field(name, cname, width);
            }
            case "AdjustPoint": {
                long offset = AttributeDecoder.parseAddressLiteral(Utils.getRequiredNodeAttribute(node, "offset"));
                return adjust(offset);
            }
            default:
                return unknown(elementName);
        }
    }


    public Kind getKind() {
        return kind_;
    }

    /* Get the local name of the element this entry was read from.
     */
    public String getElementName() {
        return elementName_;
    }

    public String getName() {
        return name_;
    }

    public String getCName() {
        return cname_;
    }

    /* Get the width of a field.  Only valid for FIELD entries.
     */
    public long getWidth() {
        return bits_;
    }

    /* Get the number of bits an adjust point skips.  Only valid for ADJUST entries.
     */
    public long getOffset() {
        return bits_;
    }
}
