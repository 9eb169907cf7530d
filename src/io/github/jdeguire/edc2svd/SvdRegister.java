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

import java.util.Collections;
import java.util.List;

/**
 * A register in an output peripheral.  Every register converted from an EDC file is 32 bits wide.
 */
public class SvdRegister {
    public static final int SIZE_IN_BITS = 32;

    private final String name_;
    private final long addressOffset_;
    private final long resetValue_;
    private final List<SvdField> fields_;


    /* Create a new register.  Pass null for the fields if the EDC document has no field
     * information for it; the SVD output will then leave out the "fields" element entirely.  The
     * list is wrapped, not copied.
     */
    public SvdRegister(String name, long addressOffset, long resetValue, List<SvdField> fields) {
        name_ = name;
        addressOffset_ = addressOffset;
        resetValue_ = resetValue;
        fields_ = (null != fields) ? Collections.unmodifiableList(fields) : null;
    }


    public String getName() {
        return name_;
    }

    public String getDescription() {
        return name_ + " register";
    }

    /* Get the number of bytes this register is from its peripheral's base address.
     */
    public long getAddressOffset() {
        return addressOffset_;
    }

    public int getSize() {
        return SIZE_IN_BITS;
    }

    public long getResetValue() {
        return resetValue_;
    }

    /* Return True if there is field information for this register.  This can be True with an
     * empty field list when a mode contains nothing but adjust points.
     */
    public boolean hasFields() {
        return null != fields_;
    }

    /* Get the fields of this register or an empty list if hasFields() is False.
     */
    public List<SvdField> getFields() {
        return (null != fields_) ? fields_ : Collections.<SvdField>emptyList();
    }
}
