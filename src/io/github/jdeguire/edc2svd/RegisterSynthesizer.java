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
 * Adds the output registers for a single SFR to a peripheral.  This is the SFR itself plus its CLR,
 * SET, and INV portal registers, if it has them.
 */
public class RegisterSynthesizer {
    private static final Logger LOGGER = LogManager.getLogger();

    private RegisterSynthesizer() {
    }


    /* Add the register with the given name, offset, and reset value to the peripheral, followed by
     * "<name>CLR" at offset+4, "<name>SET" at offset+8, and "<name>INV" at offset+12 as indicated
     * by 'portals'.  The portals get the same fields as the register, but a reset value of 0
     * because reading them is undefined.
     *
     * Returns the registers that were added in the order they were added.
     */
    public static List<SvdRegister> addRegisters(SvdPeripheral peripheral, String name, long offset,
                                                 long resetValue, Portals portals, FieldLayout layout) {
        List<SvdField> fields = layout.hasFieldInfo() ? layout.getFields() : null;
        ArrayList<SvdRegister> added = new ArrayList<>(4);

        added.add(new SvdRegister(name, offset, resetValue, fields));

        for(String portal : portals.getPortalNames()) {
            long portalOffset = offset + Portals.getPortalOffset(portal);

            LOGGER.info("\t{}{}: {}, offset = {}",
                        name, portal,
                        Utils.toHexString(peripheral.getBaseAddress() + portalOffset),
                        Utils.toHexString(portalOffset));

            added.add(new SvdRegister(name + portal, portalOffset, 0, fields));
        }

        for(SvdRegister reg : added) {
            peripheral.addRegister(reg);
        }

        return added;
    }
}
