/* @LICENSE@
 */


package org.xtrms.lexgen.test;

import org.xtrms.lexgen.DFATestCase;
import org.xtrms.lexgen.NFATestCase;
import org.xtrms.lexgen.PrenexCompilerTestCase;
import org.xtrms.lexgen.PrenexParserTestCase;
import org.xtrms.lexgen.StateSetTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(StateSetTestCase.class);
        suite.addTestSuite(PrenexCompilerTestCase.class);
        suite.addTestSuite(PrenexParserTestCase.class);
        suite.addTestSuite(NFATestCase.class);
        suite.addTestSuite(DFATestCase.class);
        suite.addTestSuite(PatternTestCase.class);
        suite.addTestSuite(LexerTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
