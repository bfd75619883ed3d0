package org.netpreserve.domainprober.util;

public class LogUtils {
    public static String ellipses(String string) {
        return ellipses(string, 80);
    }

    /**
     * Collapses runs of whitespace and shortens the string to roughly maxLength characters by
     * cutting out the middle, so response bodies fit on one log line.
     */
    public static String ellipses(String string, int maxLength) {
        if (string == null) return null;
        var output = new StringBuilder();
        boolean pendingSpace = false;
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = !output.isEmpty();
            } else {
                if (pendingSpace) output.append(' ');
                output.append(c);
                pendingSpace = false;
            }
        }
        if (output.length() <= maxLength) return output.toString();
        return output.substring(0, maxLength / 2) + "..." +
               output.substring(output.length() - maxLength / 2);
    }
}
