package com.mini.csvtools.utils;

import java.util.Comparator;

/**
 * 自然顺序比较器
 * 数字片段按数值比较（"file2" 排在 "file10" 之前），其余片段按字符比较；
 * 自然顺序相同时退回到普通字符串比较，保证全序
 */
public final class AlphanumericComparator implements Comparator<String> {

    public static final AlphanumericComparator INSTANCE = new AlphanumericComparator();

    private AlphanumericComparator() {
    }

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (isDigit(ca) && isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int result = compareDigitRuns(a, i, endA, b, j, endB);
                if (result != 0) {
                    return result;
                }
                i = endA;
                j = endB;
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }
        int remaining = (a.length() - i) - (b.length() - j);
        if (remaining != 0) {
            return remaining < 0 ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int digitRunEnd(String s, int start) {
        int end = start;
        while (end < s.length() && isDigit(s.charAt(end))) {
            end++;
        }
        return end;
    }

    /**
     * 比较两个数字片段的数值，忽略前导零，不受长度溢出影响
     */
    private static int compareDigitRuns(String a, int startA, int endA, String b, int startB, int endB) {
        while (startA < endA - 1 && a.charAt(startA) == '0') {
            startA++;
        }
        while (startB < endB - 1 && b.charAt(startB) == '0') {
            startB++;
        }
        int lengthA = endA - startA;
        int lengthB = endB - startB;
        if (lengthA != lengthB) {
            return lengthA < lengthB ? -1 : 1;
        }
        for (int k = 0; k < lengthA; k++) {
            int result = Character.compare(a.charAt(startA + k), b.charAt(startB + k));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }
}
