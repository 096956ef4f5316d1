/* @LICENSE@
 */
package org.xtrms.lexgen;

import static org.xtrms.lexgen.Misc.FS;

import java.io.IOException;
import java.util.logging.FileHandler;
import java.util.logging.SimpleFormatter;

/**
 * Writes one test's log records to <code>log/&lt;testClass&gt;/&lt;testName&gt;.log</code>.
 * A class of its own so that logging.properties can set defaults on it.
 */
public final class LogFileHandler extends FileHandler {

    final String path;

    public LogFileHandler(String testClass, String testName) throws IOException {
        super(pathFor(testClass, testName));
        this.path = pathFor(testClass, testName);
        setFormatter(new SimpleFormatter());
    }

    static String pathFor(String testClass, String testName) {
        return "log" + FS + testClass + FS + testName + ".log";
    }
}
