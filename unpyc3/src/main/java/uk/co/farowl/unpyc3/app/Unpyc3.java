// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.app;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.unpyc3.Decompiler;
import uk.co.farowl.unpyc3.SourceWriter;
import uk.co.farowl.unpyc3.Suite;
import uk.co.farowl.unpyc3.support.DecompileError;

/**
 * Command-line program that decompiles each CPython 3.2 {@code .pyc}
 * file named as an argument and writes the source to standard output.
 */
public class Unpyc3 {

    private static final Logger logger = LoggerFactory.getLogger(Unpyc3.class);

    /** Exit status when some file could not be decompiled. */
    static final int FAILED = 1;
    /** Exit status when the command line is wrong. */
    static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Decompile the files named, continuing after a failure.
     *
     * @param args names of {@code .pyc} files
     * @param out destination of the source text
     * @param err destination of the usage message
     * @return exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println("usage: unpyc3 file.pyc ...");
            return USAGE;
        }
        int status = 0;
        for (String name : args) {
            try {
                Suite suite = Decompiler.decompile(Path.of(name));
                SourceWriter writer = new SourceWriter();
                suite.display(writer);
                if (args.length > 1) { out.println("# " + name); }
                out.println(writer);
            } catch (IOException | DecompileError e) {
                logger.atError().setMessage("{}: {}").addArgument(name)
                        .addArgument(e.getMessage()).log();
                status = FAILED;
            }
        }
        return status;
    }
}
