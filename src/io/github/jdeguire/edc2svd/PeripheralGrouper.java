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

import java.util.HashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sorts SFRs into peripherals as they are read from an EDC document.  EDC documents do not say
 * outright which peripheral a register belongs to, so this uses a few hints the registers carry.
 * The registers of a peripheral are assumed to come one after another in ascending address order;
 * a new peripheral is started each time the inferred name changes and the address of the register
 * that started it becomes the peripheral's base address.
 *
 * Feed SFRs to addSfr() in document order.  The peripherals end up in the SvdDevice given to the
 * constructor.
 */
public class PeripheralGrouper {
    private static final Logger LOGGER = LogManager.getLogger();

    /* The physical addresses in EDC documents are mapped into kseg1, the uncached window, which is
     * how peripheral registers are accessed on the PIC32.
     */
    public static final long KSEG1_MASK = 0xA0000000L;

    /* Some SFRs carry none of the usual peripheral hints, but do say which module description they
     * came from.  These are the ones we know about.
     */
    private static final HashMap<String, String> MODULE_SOURCE_PERIPHERALS_ = new HashMap<>();
    static {
        MODULE_SOURCE_PERIPHERALS_.put("DOS-01618_RPINRx.Module", "PPS");
        MODULE_SOURCE_PERIPHERALS_.put("DOS-01618_RPORx.Module", "PPS");
        MODULE_SOURCE_PERIPHERALS_.put("DOS-01423_RPINRx.Module", "PPS");
        MODULE_SOURCE_PERIPHERALS_.put("DOS-01423_RPORx.Module", "PPS");
        MODULE_SOURCE_PERIPHERALS_.put("DOS-01475_lpwr_deep_sleep_ctrl_v2.Module", "DSCTRL");
    }

    private final SvdDevice device_;
    private SvdPeripheral currentPeripheral_ = null;


    public PeripheralGrouper(SvdDevice device) {
        device_ = device;
    }


    /* Add the output registers for the given SFR to the device, starting a new peripheral first if
     * the SFR does not belong to the current one.  This throws if the SFR cannot be decoded, if no
     * peripheral can be inferred for it, or if it is out of address order.
     */
    public void addSfr(EdcSfr sfr) throws EdcFormatException {
        String name = sfr.getName();
        long addr = sfr.getPhysicalAddress() | KSEG1_MASK;
        Portals portals = sfr.getPortals();
        long reset = sfr.getResetValue();

        String cname = sfr.getCName();
        if(!name.equals(cname)) {
            throw new EdcFormatException(EdcFormatException.Reason.NAME_MISMATCH,
                                         "SFR " + name + " has a different cname (" + cname + ").");
        }

        String periphName = inferPeripheralName(sfr);
        List<EdcModeEntry> modeEntries = sfr.getFirstModeEntries();

        if(null == currentPeripheral_  ||  !periphName.equals(currentPeripheral_.getName())) {
            if(null != currentPeripheral_  &&  addr <= currentPeripheral_.getBaseAddress()) {
                throw new EdcFormatException(EdcFormatException.Reason.ADDRESS_ORDERING,
                                             "Peripheral " + periphName + " starting at SFR " + name +
                                             " (" + Utils.toHexString(addr) + ") is not above " +
                                             "the previous peripheral " + currentPeripheral_.getName() +
                                             " (" + Utils.toHexString(currentPeripheral_.getBaseAddress()) + ").");
            }

            currentPeripheral_ = new SvdPeripheral(periphName, addr);
            device_.addPeripheral(currentPeripheral_);
            LOGGER.info("{} base_addr = {}", periphName, Utils.toHexString(addr));
        }

        long offset = addr - currentPeripheral_.getBaseAddress();
        if(offset < 0) {
            throw new EdcFormatException(EdcFormatException.Reason.ADDRESS_ORDERING,
                                         "SFR " + name + " (" + Utils.toHexString(addr) + ") is below " +
                                         "the base address of its peripheral " + periphName +
                                         " (" + Utils.toHexString(currentPeripheral_.getBaseAddress()) + ").");
        }

        LOGGER.info("  {}", name);
        LOGGER.info("\t{}   : {}, offset = {}, reset = {} ({})",
                    name, Utils.toHexString(addr), Utils.toHexString(offset),
                    Utils.toHexString(reset), portals.getEdcText());

        FieldLayout layout = FieldLayoutBuilder.build(name, modeEntries);
        RegisterSynthesizer.addRegisters(currentPeripheral_, name, offset, reset, portals, layout);
    }

    /* Get the peripheral that registers are currently being added to or null if no SFR has been
     * added yet.
     */
    public SvdPeripheral getCurrentPeripheral() {
        return currentPeripheral_;
    }

    /* Work out the name of the peripheral that owns the given SFR.  The first of these that is
     * present wins:
     *   - "baseofperipheral", given on the first register of a peripheral
     *   - "memberofperipheral", if it is not empty
     *   - "grp"
     *   - "_modsrc", looked up in the table at the top of this file
     *
     * Only the first word of the result is used, so "UART1 UART2" becomes "UART1".  This throws
     * if none of the hints are present or the result is empty.
     */
    public static String inferPeripheralName(EdcSfr sfr) throws EdcFormatException {
        String periph;
        String member = sfr.getMemberOfPeripheral();

        if(null != sfr.getBaseOfPeripheral()) {
            periph = sfr.getBaseOfPeripheral();
        } else if(null != member  &&  !member.isEmpty()) {
            periph = member;
        } else if(null != sfr.getGroup()) {
            periph = sfr.getGroup();
        } else if(null != sfr.getModuleSource()) {
            periph = MODULE_SOURCE_PERIPHERALS_.getOrDefault(sfr.getModuleSource(), "");
        } else {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_PERIPHERAL_HINT,
                                         "Missing peripheral for " + sfr.getName() + ".");
        }

        periph = AttributeDecoder.firstToken(periph);

        if(periph.isEmpty()) {
            throw new EdcFormatException(EdcFormatException.Reason.MISSING_PERIPHERAL_HINT,
                                         "Empty peripheral info for " + sfr.getName() + ".");
        }

        return periph;
    }
}
