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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.ParserConfigurationException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.xml.sax.SAXException;

/**
 * Command-line entry point.  Converts an MCU register description from Microchip's EDC format (a
 * .PIC file from the MPLAB X device database) to the CMSIS SVD format.
 * <pre>
 * Usage: edc2svd [options] &lt;input.edc&gt; &lt;output.svd&gt;
 * </pre>
 */
public class Edc2Svd {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final String PROGRAM_NAME = "edc2svd";

    /* Verbose output turns on the info-level trace of every peripheral, register, and field.
     */
    private static final String LOGGER_BASE = "io.github.jdeguire.edc2svd";

    private boolean verbose_ = false;
    private boolean help_ = false;
    private final ArrayList<String> paths_ = new ArrayList<>(2);


    public static void main(String[] args) {
        int status = new Edc2Svd().run(args, System.out);

        if(0 != status)
            System.exit(status);
    }

    /* Parse the arguments and run the conversion, writing usage text and error messages to the
     * given stream.  Returns the process exit status.  Bad arguments print the usage text and are
     * not treated as an error.
     */
    public int run(String[] args, PrintStream out) {
        if(!parseArgs(args)  ||  help_  ||  2 != paths_.size()) {
            printUsage(out);
            return 0;
        }

        Configurator.setLevel(LOGGER_BASE, verbose_ ? Level.INFO : Level.ERROR);

        File edcFile = new File(paths_.get(0));
        File svdFile = new File(paths_.get(1));

        try {
            convert(edcFile, svdFile);
        } catch(EdcFormatException efe) {
            LOGGER.info("Conversion of {} stopped: {}", edcFile, efe.getReason());
            out.println(PROGRAM_NAME + ": " + efe.getMessage());
            return 1;
        } catch(SAXException | IOException | ParserConfigurationException ex) {
            LOGGER.info("Conversion of {} failed", edcFile, ex);
            out.println(PROGRAM_NAME + ": " + ex.getMessage());
            return 1;
        }

        return 0;
    }

    /* Read the EDC file, convert it, and write the SVD file.  The output file is not touched
     * unless the conversion succeeds.
     */
    public static void convert(File edcFile, File svdFile)
                    throws ParserConfigurationException, SAXException, IOException {
        EdcDoc edcDoc = new EdcDoc(edcFile);
        SvdDevice device = new EdcConverter().convert(edcDoc);

        new SvdDocumentWriter().write(device, svdFile);
    }

    public boolean isVerbose() {
        return verbose_;
    }

    public List<String> getPaths() {
        return paths_;
    }

    /* Returns False if an unknown option is found.  Anything that does not start with '-' is a
     * path and "--" ends the options.
     */
    boolean parseArgs(String[] args) {
        boolean optionsDone = false;

        for(String arg : args) {
            if(!optionsDone  &&  arg.startsWith("-")  &&  arg.length() > 1) {
                switch(arg) {
                    case "-h":
                    case "--help":
                        help_ = true;
                        break;
                    case "-v":
                    case "--verbose":
                        verbose_ = true;
                        break;
                    case "--":
                        optionsDone = true;
                        break;
                    default:
                        return false;
                }
            } else {
                paths_.add(arg);
            }
        }

        return true;
    }

    private static void printUsage(PrintStream out) {
        out.println();
        out.println("Usage: " + PROGRAM_NAME + " [options] <input.edc> <output.svd>");
        out.println();
        out.println("Options:");
        out.println("    -h, --help          show this help message");
        out.println("    -v, --verbose       activate verbose output");
    }
}
