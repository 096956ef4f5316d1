/* @LICENSE@
 */
package org.xtrms.lexgen;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a prenex string does not describe exactly one expression tree:
 * an unknown or multi-character atom, too few operands, or tokens left over
 * after the root is complete. The index is the character offset of the
 * offending token within the prenex text, or its length when the text ended
 * too early.
 */
public class MalformedPrenexException extends PatternSyntaxException {

    private static final long serialVersionUID = -2406328791545107219L;

    public MalformedPrenexException(String desc, String prenex, int index) {
        super(desc, prenex, index);
    }
}
