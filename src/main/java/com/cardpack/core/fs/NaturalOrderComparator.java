package com.cardpack.core.fs;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders names the way people read them: {@code page_2.png} before {@code page_10.png}. Digit runs
 * compare numerically, text compares case-insensitively.
 */
public final class NaturalOrderComparator implements Comparator<String> {
    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    @Override
    public int compare(String a, String b) {
        List<String> left = split(a);
        List<String> right = split(b);
        int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            String l = left.get(i);
            String r = right.get(i);
            int cmp;
            if (isDigits(l) && isDigits(r)) {
                cmp = new BigInteger(l).compareTo(new BigInteger(r));
            } else {
                cmp = l.toLowerCase(Locale.ROOT).compareTo(r.toLowerCase(Locale.ROOT));
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    // Alternates text and digit runs, always starting with a (possibly empty) text run.
    private static List<String> split(String value) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inDigits = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean digit = c >= '0' && c <= '9';
            if (digit != inDigits) {
                parts.add(current.toString());
                current.setLength(0);
                inDigits = digit;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static boolean isDigits(String part) {
        return !part.isEmpty() && Character.isDigit(part.charAt(0));
    }
}
