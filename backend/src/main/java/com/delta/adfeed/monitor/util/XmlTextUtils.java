package com.delta.adfeed.monitor.util;

import org.jdom2.Verifier;

public final class XmlTextUtils {
    private XmlTextUtils() {
    }

    /**
     * Drops code points that XML 1.0 cannot carry, such as C0 control characters other than tab,
     * newline and carriage return.
     */
    public static String stripIllegalXmlChars(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder out = null;
        int i = 0;
        while (i < value.length()) {
            int codePoint = value.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (Verifier.isXMLCharacter(codePoint)) {
                if (out != null) {
                    out.appendCodePoint(codePoint);
                }
            } else if (out == null) {
                out = new StringBuilder(value.length());
                out.append(value, 0, i);
            }
            i += width;
        }
        return out == null ? value : out.toString();
    }
}
