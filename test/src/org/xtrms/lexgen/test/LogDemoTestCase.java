/*@LICENSE@
 */
package org.xtrms.lexgen.test;

import java.io.File;

import org.xtrms.lexgen.AbstractLexTestCase;
import org.xtrms.lexgen.Lexer;
import org.xtrms.lexgen.NoViableAlternativeException;
import org.xtrms.lexgen.Pattern;

public class LogDemoTestCase extends AbstractLexTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logToFile();
    }

    protected void tearDown() throws Exception {
        super.tearDown();
    }

    private void assertLogged() {
        flushLog();
        File f = logFile();
        assertNotNull(f);
        assertTrue(f.getPath(), f.exists());
        assertTrue(f.getPath(), f.length() > 0);
    }

    public void testFunkyAlt() {
        Pattern.compile("(ab|a)(bc|c)");
        assertLogged();
    }

    public void testDragonBook() {
        Pattern.compile("(a|b)*abb");
        assertLogged();
    }

    public void testPrenex() {
        Pattern.fromPrenex("CONCAT STAR UNION a b CONCAT a CONCAT b b");
        assertLogged();
    }

    public void testLexer() {
        Lexer lexer = new Lexer.Builder()
            .add("IF", "if")
            .add("ID", "[a-z]+")
            .add("NUM", "[0-9]+")
            .add("WS", "(' '|'\\n'|'\\t')+")
            .build();
        lexer.tokenize("if x1 iffy\n\t42");
        try {
            lexer.tokenize("if #");
            fail("should throw");
        } catch (NoViableAlternativeException e) {}
        assertLogged();
    }
}
