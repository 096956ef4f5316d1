/* @LICENSE@
 */
package org.xtrms.lexgen;

/**
 * Thrown by {@link Lexer#tokenize(CharSequence)} when no category matches a
 * non-empty prefix of the remaining input. The position is the furthest
 * index any category's automaton reached before giving up: the index of the
 * character it could not take, or the input length if it ran out of input.
 * <p>
 * Lines are counted from 0 and columns from 1; the column is replaced by
 * <code>EOF</code> in the message when the position is the end of input.
 */
public class NoViableAlternativeException extends RuntimeException {

    private static final long serialVersionUID = -7063512987340415221L;

    private final int index;
    private final int line;
    private final int column;
    private final boolean eof;

    NoViableAlternativeException(CharSequence input, int index) {
        this(index, lineOf(input, index), columnOf(input, index),
            index >= input.length());
    }

    private NoViableAlternativeException(int index, int line, int column, boolean eof) {
        super("No viable alternative at character "
            + (eof ? "EOF" : Integer.toString(column)) + ", line " + line);
        this.index = index;
        this.line = line;
        this.column = column;
        this.eof = eof;
    }

    /*
     * newlines strictly before index
     */
    static int lineOf(CharSequence input, int index) {
        int n = 0;
        for (int i = 0; i < index && i < input.length(); ++i) {
            if (input.charAt(i) == '\n') ++n;
        }
        return n;
    }

    /*
     * 1-based offset from the last newline before index, or from the start
     */
    static int columnOf(CharSequence input, int index) {
        int lastNewline = -1;
        for (int i = Math.min(index, input.length()) - 1; i >= 0; --i) {
            if (input.charAt(i) == '\n') {
                lastNewline = i;
                break;
            }
        }
        return index - lastNewline;
    }

    /**
     * @return the offset into the input.
     */
    public int index() {
        return index;
    }

    public int line() {
        return line;
    }

    /**
     * @return the 1-based column, meaningful even at end of input.
     */
    public int column() {
        return column;
    }

    public boolean isEOF() {
        return eof;
    }
}
