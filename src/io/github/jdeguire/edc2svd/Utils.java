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
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * This is just a place to put simple utility functions for walking EDC documents that do not really
 * fit anywhere else.
 *
 * The .PIC files in the MPLAB X database prefix every element and attribute with "edc:", but other
 * tools strip the prefix when exporting them.  All of the lookups in here compare only the local
 * part of a name (the bit after the colon) so that either flavor can be read.
 */
public class Utils {

    /* Return the given XML name without any namespace prefix.  For example, "edc:SFRDef" returns
     * "SFRDef" and "SFRDef" is returned unchanged.
     */
    public static String stripPrefix(String name) {
        int colon = name.indexOf(':');

        if(colon >= 0)
            return name.substring(colon + 1);
        else
            return name;
    }

    /* Return the local name of the given node.  See stripPrefix().
     */
    public static String getLocalName(Node node) {
        return stripPrefix(node.getNodeName());
    }

    /* Find the first element child of the given node that has the given local name or null if
     * there is no such child.  Set the name to null to allow any element to pass the filter.
     */
    public static Node filterFirstChildNode(Node node, String nodename) {
        if(null != node  &&  node.hasChildNodes()) {
            NodeList children = node.getChildNodes();

            for(int i = 0; i < children.getLength(); ++i) {
                Node child = children.item(i);

                if(Node.ELEMENT_NODE != child.getNodeType()) {
                    continue;
                }

                if(null != nodename  &&  !getLocalName(child).equals(nodename)) {
                    continue;
                }

                return child;
            }
        }

        return null;
    }

    /* Find all element children of the given node that have the given local name.  Set the name
     * to null to get every element child, which is what the field layout needs because anything
     * in a mode block that it does not recognize is an error rather than something to skip.
     * Whitespace and comment nodes are never returned.
     */
    public static List<Node> filterAllChildNodes(Node node, String nodename) {
        ArrayList<Node> filteredChildren = new ArrayList<>(10);

        if(null != node  &&  node.hasChildNodes()) {
            NodeList children = node.getChildNodes();

            for(int i = 0; i < children.getLength(); ++i) {
                Node child = children.item(i);

                if(Node.ELEMENT_NODE != child.getNodeType()) {
                    continue;
                }

                if(null != nodename  &&  !getLocalName(child).equals(nodename)) {
                    continue;
                }

                filteredChildren.add(child);
            }
        }

        return filteredChildren;
    }

    /* Return the given node attribute as a String or return the given fallback value if the node
     * does not have an attribute of the given local name.  An attribute that is present, but empty,
     * returns the empty string and not the fallback.
     */
    public static String getNodeAttribute(Node node, String attrname, String fallback) {
        NamedNodeMap attributes = node.getAttributes();

        if(null != attributes) {
            for(int i = 0; i < attributes.getLength(); ++i) {
                Node attrNode = attributes.item(i);

                if(stripPrefix(attrNode.getNodeName()).equals(attrname))
                    return attrNode.getNodeValue();
            }
        }

        return fallback;
    }

    /* Like above, but throws an exception naming the owning element if the attribute is missing.
     */
    public static String getRequiredNodeAttribute(Node node, String attrname)
                                throws EdcFormatException {
        String value = getNodeAttribute(node, attrname, null);

        if(null == value) {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_ELEMENT,
                                         "Attribute \"" + attrname + "\" missing from " +
                                         describeNode(node) + ".");
        }

        return value;
    }

    /* Return a short human-readable description of an element for use in error messages, such as
     * "SFRDef U1MODE".
     */
    public static String describeNode(Node node) {
        String name = getNodeAttribute(node, "name", null);

        if(null != name)
            return getLocalName(node) + " " + name;
        else
            return getLocalName(node);
    }

    /* Format a 32-bit value the way SVD addresses are written:  lowercase hex with a "0x" prefix
     * and no leading zeroes.
     */
    public static String toHexString(long value) {
        return "0x" + Long.toHexString(value & 0xFFFFFFFFL);
    }
}
