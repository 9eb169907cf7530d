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
 * A peripheral in the output device, such as "UART1" or "PPS".  EDC documents do not list
 * peripherals as such; they are built up as the PeripheralGrouper works out which registers belong
 * together.  The base address is that of the first register added to the peripheral.
 */
public class SvdPeripheral {
    private final String name_;
    private final long baseAddress_;
    private final ArrayList<SvdRegister> registers_ = new ArrayList<>(16);


    public SvdPeripheral(String name, long baseAddress) {
        name_ = name;
        baseAddress_ = baseAddress;
    }


    public String getName() {
        return name_;
    }

    public String getDescription() {
        return name_ + " peripheral";
    }

    public long getBaseAddress() {
        return baseAddress_;
    }

    /* Add a register to the end of this peripheral's list.  Registers are kept in the order they
     * are added and are never sorted.
     */
    public void addRegister(SvdRegister register) {
        registers_.add(register);
    }

    public List<SvdRegister> getRegisters() {
        return Collections.unmodifiableList(registers_);
    }
}
