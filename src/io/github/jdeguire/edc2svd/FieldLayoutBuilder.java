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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Works out the bit range of each field in an SFRMode.  The mode lists fields from bit 0 upwards,
 * so this keeps a running bit position:  a field takes the next 'width' bits and an adjust point
 * skips 'offset' bits.
 */
public class FieldLayoutBuilder {
    private static final Logger LOGGER = LogManager.getLogger();

    private FieldLayoutBuilder() {
    }


    /* Build the layout for the given mode entries, which should come from
     * EdcSfr.getFirstModeEntries().  The register name is used only for messages.
     *
     * This throws if an entry is neither a field nor an adjust point or if a field would not fit
     * in a 32-bit register.
     */
    public static FieldLayout build(String regName, List<EdcModeEntry> entries)
                                throws EdcFormatException {
        ArrayList<SvdField> fields = new ArrayList<>(entries.size());
        long bitpos = 0;

        for(EdcModeEntry entry : entries) {
            switch(entry.getKind()) {
                case FIELD: {
                    String fname = entry.getCName();
                    long width = entry.getWidth();

                    if(!fname.equals(entry.getName())) {
                        LOGGER.warn("cname = {} but name = {} in register {}", fname, entry.getName(), regName);
                    }

                    if(0 == width) {
                        LOGGER.warn("Skipping zero-width field {} in register {}", fname, regName);
                        break;
                    }

                    long msb = bitpos + width - 1;
                    if(msb >= SvdRegister.SIZE_IN_BITS) {
                        throw new EdcFormatException(EdcFormatException.Reason.FIELD_OVERFLOW,
                                                     "Field " + fname + " of register " + regName +
                                                     " would occupy bits [" + msb + ":" + bitpos +
                                                     "], which do not fit in " +
                                                     SvdRegister.SIZE_IN_BITS + " bits.");
                    }

                    LOGGER.info("\t\t[{}:{}]\t{}", msb, bitpos, fname);
                    fields.add(new SvdField(fname, (int)msb, (int)bitpos));
                    bitpos += width;
                    break;
                }
                case ADJUST:
                    bitpos += entry.getOffset();
                    break;
                default:
                    throw new EdcFormatException(EdcFormatException.Reason.UNEXPECTED_FIELD_ENTRY,
                                                 "Unexpected element " + entry.getElementName() +
                                                 " in field definition of register " + regName + ".");
            }
        }

        return new FieldLayout(fields, bitpos);
    }
}
