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
import java.util.Collections;
import java.util.List;

/**
 * The CLR, SET, and INV registers that most SFRs on the PIC32 have.  Writing a 1 to a bit of one of
 * these clears, sets, or inverts that bit in the owning register without a read-modify-write.  They
 * sit at offsets of 4, 8, and 12 bytes from the owning register.
 *
 * EDC documents give these as a "portals" attribute with three space-separated slots, using '-' for
 * a missing portal.
 */
public enum Portals {
    NONE("- - -", false, false, false),
    CLR_ONLY("CLR - -", true, false, false),
    CLR_SET_INV("CLR SET INV", true, true, true);

    public static final long CLR_OFFSET = 0x4;
    public static final long SET_OFFSET = 0x8;
    public static final long INV_OFFSET = 0xC;

    private final String edcText_;
    private final boolean hasClr_;
    private final boolean hasSet_;
    private final boolean hasInv_;

    private Portals(String edcText, boolean hasClr, boolean hasSet, boolean hasInv) {
        edcText_ = edcText;
        hasClr_ = hasClr;
        hasSet_ = hasSet;
        hasInv_ = hasInv;
    }


    /* Get the "portals" attribute text that maps to this value.
     */
    public String getEdcText() {
        return edcText_;
    }

    public boolean hasClr() { return hasClr_; }

    public boolean hasSet() { return hasSet_; }

    public boolean hasInv() { return hasInv_; }

    /* Get the suffixes of the portal registers in address order, so "CLR" is always first.  Use
     * getPortalOffset() to find where each one sits.
     */
    public List<String> getPortalNames() {
        if(NONE == this)
            return Collections.emptyList();

        List<String> names = new ArrayList<>(3);
        if(hasClr_)
            names.add("CLR");
        if(hasSet_)
            names.add("SET");
        if(hasInv_)
            names.add("INV");

        return names;
    }

    /* Get the offset in bytes of the given portal from its owning register.  Each portal has a fixed
     * slot, so INV is at +12 whether or not the register has a SET portal.
     */
    public static long getPortalOffset(String suffix) {
        switch(suffix) {
            case "CLR":
                return CLR_OFFSET;
            case "SET":
                return SET_OFFSET;
            case "INV":
                return INV_OFFSET;
            default:
                throw new IllegalArgumentException("Unknown portal \"" + suffix + "\"");
        }
    }
}
