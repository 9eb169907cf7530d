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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class AttributeDecoderTests {
    @Test
    public void hexAndDecimalLiteralsAreParsed() throws EdcFormatException {
        assertEquals(26, AttributeDecoder.parseAddressLiteral("0x1A"));
        assertEquals(26, AttributeDecoder.parseAddressLiteral("0x1a"));
        assertEquals(26, AttributeDecoder.parseAddressLiteral("26"));
        assertEquals(0, AttributeDecoder.parseAddressLiteral("0"));
        assertEquals(0xFFFFFFFFL, AttributeDecoder.parseAddressLiteral("0xFFFFFFFF"));
        assertEquals(0x1F886000L, AttributeDecoder.parseAddressLiteral("0x1F886000"));
    }

    @Test
    public void badLiteralsAreRejected() {
        for(String text : new String[] {"", "0x", "0X1A", "1A", "twelve", "-1", "0x100000000", "4294967296"}) {
            EdcFormatException e = assertThrows(EdcFormatException.class,
                                                () -> AttributeDecoder.parseAddressLiteral(text),
                                                text);
            assertEquals(EdcFormatException.Reason.MALFORMED_NUMBER, e.getReason());
        }
    }

    @Test
    public void missingLiteralIsRejected() {
        EdcFormatException e = assertThrows(EdcFormatException.class,
                                            () -> AttributeDecoder.parseAddressLiteral(null));
        assertEquals(EdcFormatException.Reason.MALFORMED_NUMBER, e.getReason());
    }

    @Test
    public void placeholderResetBitsReadAsZero() throws EdcFormatException {
        assertEquals(16, AttributeDecoder.decodeResetPattern("1-0xu"));
        assertEquals(0, AttributeDecoder.decodeResetPattern("--------"));
        assertEquals(0x80000000L, AttributeDecoder.decodeResetPattern("10000000000000000000000000000000"));
        assertEquals(0xFFFFFFFFL, AttributeDecoder.decodeResetPattern("11111111111111111111111111111111"));
    }

    @Test
    public void badResetPatternsAreRejected() {
        for(String text : new String[] {"", "102", "1 0", "111111111111111111111111111111111"}) {
            EdcFormatException e = assertThrows(EdcFormatException.class,
                                                () -> AttributeDecoder.decodeResetPattern(text),
                                                text);
            assertEquals(EdcFormatException.Reason.MALFORMED_NUMBER, e.getReason());
        }
    }

    @Test
    public void portalsFormsAreDecoded() throws EdcFormatException {
        Portals all = AttributeDecoder.decodePortals("CLR SET INV");
        assertEquals(Portals.CLR_SET_INV, all);
        assertTrue(all.hasClr() && all.hasSet() && all.hasInv());

        Portals clr = AttributeDecoder.decodePortals("CLR - -");
        assertEquals(Portals.CLR_ONLY, clr);
        assertTrue(clr.hasClr());
        assertFalse(clr.hasSet() || clr.hasInv());

        Portals none = AttributeDecoder.decodePortals("- - -");
        assertEquals(Portals.NONE, none);
        assertTrue(none.getPortalNames().isEmpty());
    }

    @Test
    public void unknownPortalsAreRejected() {
        for(String text : new String[] {"", "CLR SET -", "clr set inv", "CLR  SET INV", "SET"}) {
            EdcFormatException e = assertThrows(EdcFormatException.class,
                                                () -> AttributeDecoder.decodePortals(text),
                                                text);
            assertEquals(EdcFormatException.Reason.UNRECOGNIZED_PORTALS, e.getReason());
        }
    }

    @Test
    public void firstTokenKeepsOnlyTheFirstWord() {
        assertEquals("UART1", AttributeDecoder.firstToken("UART1 UART2"));
        assertEquals("SPI1", AttributeDecoder.firstToken("SPI1\tSPI2"));
        assertEquals("PPS", AttributeDecoder.firstToken("PPS"));
        assertEquals("", AttributeDecoder.firstToken(""));
        assertEquals("", AttributeDecoder.firstToken("   "));
        assertEquals("", AttributeDecoder.firstToken(" UART1"));
    }
}
