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

import org.xml.sax.SAXException;

/**
 * Thrown when an EDC document is valid XML, but does not describe registers in a way that can be
 * turned into an SVD file.  Every one of these ends the conversion; the input is a static document
 * and so there is nothing to retry.
 *
 * This extends SAXException so that callers can treat it the same as any other problem with a
 * device document, while still being able to look at the reason when they care.
 */
public class EdcFormatException extends SAXException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** An address, width, offset or reset value is not a number we can read. */
        MALFORMED_NUMBER,
        /** The "portals" attribute is not one of the three forms we know. */
        UNRECOGNIZED_PORTALS,
        /** A mode block contains something other than a field definition or an adjust point. */
        UNEXPECTED_FIELD_ENTRY,
        /** An SFR's "cname" and "name" attributes differ. */
        NAME_MISMATCH,
        /** No peripheral name could be inferred for an SFR. */
        MISSING_PERIPHERAL_HINT,
        /** Registers are not grouped by peripheral in ascending address order. */
        ADDRESS_ORDERING,
        /** A required element or attribute is not present. */
        MISSING_ELEMENT,
        /** A field extends past bit 31 of its register. */
        FIELD_OVERFLOW
    };

    private final Reason reason_;


    public EdcFormatException(Reason reason, String message) {
        super(message);
        reason_ = reason;
    }

    public EdcFormatException(Reason reason, String message, Exception cause) {
        super(message, cause);
        reason_ = reason;
    }


    /* Get the reason this exception was thrown.
     */
    public Reason getReason() {
        return reason_;
    }
}
