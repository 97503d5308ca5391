package com.supporters.infrastructure.csv;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180-style helpers: comma separated, double-quote quoting, {@code ""} escapes.
 * Quoted fields may not span lines.
 */
public final class Csv {

    private Csv() {}

    public static String escape(String s) {
        if (s == null) return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }

    /**
     * @throws IllegalArgumentException on an unterminated quote or text after a closing quote
     */
    public static List<String> split(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean afterQuote = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                        afterQuote = true;
                    }
                } else {
                    cur.append(ch);
                }
            } else if (ch == ',') {
                out.add(cur.toString());
                cur.setLength(0);
                afterQuote = false;
            } else if (afterQuote) {
                throw new IllegalArgumentException("unexpected character after closing quote at column " + (i + 1));
            } else if (ch == '"' && cur.length() == 0) {
                quoted = true;
            } else {
                cur.append(ch);
            }
        }
        if (quoted) throw new IllegalArgumentException("unterminated quoted field");
        out.add(cur.toString());
        return out;
    }
}
