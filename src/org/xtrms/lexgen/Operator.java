/* @LICENSE@
 */
package org.xtrms.lexgen;

/**
 * The fixed set of regex operators. Each operator has the glyph it is written
 * with in a regex, the keyword it is written with in prenex form, a rank used
 * by the prenex compiler (higher binds tighter) and an arity. The grouping
 * tokens are structural only: they have no keyword and are never compared by
 * rank.
 */
enum Operator {

    UNION('|', "UNION", 1, 2),
    CONCAT('.', "CONCAT", 2, 2),
    STAR('*', "STAR", 3, 1),
    PLUS('+', "PLUS", 3, 1),
    MAYBE('?', "MAYBE", 3, 1),
    LPAREN('(', null, 0, 0),
    RPAREN(')', null, 0, 0);

    final char glyph;
    final String keyword;
    final int rank;
    final int arity;

    Operator(char glyph, String keyword, int rank, int arity) {
        this.glyph = glyph;
        this.keyword = keyword;
        this.rank = rank;
        this.arity = arity;
    }

    /**
     * @return true for the postfix repetition operators.
     */
    boolean isPostfix() {
        return arity == 1;
    }

    boolean isGrouping() {
        return keyword == null;
    }

    /**
     * @return the operator written as <code>glyph</code> in a regex, or null.
     */
    static Operator forGlyph(char glyph) {
        for (Operator op : values()) {
            if (op.glyph == glyph) return op;
        }
        return null;
    }

    /**
     * @return the operator written as <code>keyword</code> in prenex form, or
     *         null if <code>keyword</code> is not an operator keyword.
     */
    static Operator forKeyword(String keyword) {
        for (Operator op : values()) {
            if (!op.isGrouping() && op.keyword.equals(keyword)) return op;
        }
        return null;
    }
}
