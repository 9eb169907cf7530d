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

import org.apache.commons.lang3.StringUtils;

/**
 * Functions to turn the strings found in EDC attributes into values we can work with.  These never
 * fall back to a default when the text makes no sense; the caller gets an EdcFormatException that
 * includes the offending text instead.
 */
public class AttributeDecoder {

    private static final long U32_MAX = 0xFFFFFFFFL;
    private static final String HINT_SEPARATORS = " \t\r\n";

    private AttributeDecoder() {
    }


    /* Parse an unsigned 32-bit value given either as hex with a "0x" prefix (for example,
     * "0xBF886000") or as plain decimal.  The value is returned as a long so that addresses with
     * the top bit set stay positive.
     */
    public static long parseAddressLiteral(String text) throws EdcFormatException {
        if(null == text) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Expected a number, but the value is missing.");
        }

        long value;

        try {
            if(text.startsWith("0x"))
                value = Long.parseLong(text.substring(2), 16);
            else
                value = Long.parseLong(text, 10);
        } catch(NumberFormatException nfe) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Cannot parse \"" + text + "\" as a hex or decimal number.",
                                         nfe);
        }

        if(value < 0  ||  value > U32_MAX) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Value \"" + text + "\" does not fit in 32 bits.");
        }

        return value;
    }

    /* Parse the "mclr" attribute of an SFR, which gives the reset value as a string of binary
     * digits from the MSb down.  Unimplemented ('-'), undefined ('x'), and unchanged ('u') bits
     * do not have a value we can give in an SVD file, so they are read as 0.
     */
    public static long decodeResetPattern(String text) throws EdcFormatException {
        if(null == text) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Expected a reset value, but the value is missing.");
        }

        String cleaned = text.replace('-', '0').replace('x', '0').replace('u', '0');
        long value;

        try {
            value = Long.parseLong(cleaned, 2);
        } catch(NumberFormatException nfe) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Cannot parse reset value \"" + text + "\" as binary.",
                                         nfe);
        }

        if(value < 0  ||  value > U32_MAX) {
            throw new EdcFormatException(EdcFormatException.Reason.MALFORMED_NUMBER,
                                         "Reset value \"" + text + "\" does not fit in 32 bits.");
        }

        return value;
    }

    /* Decode the "portals" attribute of an SFR.  Only the three forms in the Portals enum are
     * allowed.  An SFR without the attribute should be given NONE by the caller.
     */
    public static Portals decodePortals(String text) throws EdcFormatException {
        for(Portals p : Portals.values()) {
            if(p.getEdcText().equals(text))
                return p;
        }

        throw new EdcFormatException(EdcFormatException.Reason.UNRECOGNIZED_PORTALS,
                                     "Unexpected portals attribute: \"" + text + "\".");
    }

    /* Return everything before the first whitespace character of the given string.  Peripheral
     * hints sometimes list more than one peripheral, like "UART1 UART2".  Leading whitespace is not
     * skipped, so " UART1" gives an empty string.
     */
    public static String firstToken(String text) {
        int end = StringUtils.indexOfAny(text, HINT_SEPARATORS);

        if(end < 0)
            return text;
        else
            return text.substring(0, end);
    }
}
