/*
 * @LICENSE@
 */

package org.xtrms.lexgen;

import java.util.HashMap;
import java.util.Map;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");
    private static final MapEscaper ctlEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\b', "\\b").map('\f', "\\f").map('\0', "\\0");
    private static final MapEscaper quoteEscaper =
            new MapEscaper().map('\'', "\\'").map(' ', "' '");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 0) {
                sb.append("0x" + Integer.toHexString(c));
                ret = true;
            } else if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCII and beyond
         * -> \\u codes
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * Symbol escaper for automaton dumps and tree printing - common
         * control characters as backslash codes, a space as a quoted space,
         * everything else non-printable as \\u codes.
         */
        SYMBOL(ctlEscaper, quoteEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
