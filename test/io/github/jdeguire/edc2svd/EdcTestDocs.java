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
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds small EDC documents for tests.  Names are written without the "edc:" prefix; the full
 * prefixed form is covered by the PIC32MXTEST.PIC resource.
 */
final class EdcTestDocs {
    static final String FIXTURE = "PIC32MXTEST.PIC";

    private EdcTestDocs() {
    }

    static EdcDoc parse(String xml) throws Exception {
        return new EdcDoc(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    static EdcDoc fixture() throws Exception {
        try(InputStream in = EdcTestDocs.class.getResourceAsStream(FIXTURE)) {
            return new EdcDoc(in);
        }
    }

    /* Wrap the given SFRDef elements in a device with a single peripheral data sector.
     */
    static String device(String... sfrDefs) {
        StringBuilder sb = new StringBuilder();
        sb.append("<PIC name=\"PIC32TEST\"><PhysicalSpace><SFRDataSector regionid=\"periph\">");
        for(String sfr : sfrDefs) {
            sb.append(sfr);
        }
        sb.append("</SFRDataSector></PhysicalSpace></PIC>");
        return sb.toString();
    }

    /* An SFRDef with no fields.  'hints' is pasted into the element as extra attributes.
     */
    static String sfr(String name, String addr, String hints) {
        return sfr(name, addr, hints, "");
    }

    static String sfr(String name, String addr, String hints, String modeBody) {
        return "<SFRDef name=\"" + name + "\" cname=\"" + name + "\" _addr=\"" + addr + "\" " +
               "mclr=\"00000000000000000000000000000000\" " + hints + ">" +
               "<SFRModeList><SFRMode id=\"DS.0\">" + modeBody + "</SFRMode></SFRModeList>" +
               "</SFRDef>";
    }

    static List<EdcSfr> sfrs(String... sfrDefs) throws Exception {
        return parse(device(sfrDefs)).getPeripheralSfrs();
    }

    static EdcSfr single(String sfrDef) throws Exception {
        return sfrs(sfrDef).get(0);
    }
}
