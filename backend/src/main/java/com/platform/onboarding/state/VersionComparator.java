package com.platform.onboarding.state;

import java.util.Comparator;

/**
 * Orders engine versions of the form major.minor.patch-release.
 * Missing segments count as zero; non-numeric segments compare as text.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    /**
     * Version assumed for records written before versions were stamped.
     */
    public static final String UNVERSIONED = "0.0.0-0";

    private VersionComparator() {
    }

    @Override
    public int compare(String left, String right) {
        String[] a = segments(left);
        String[] b = segments(right);
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            int result = compareSegment(x, y);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    public static boolean isOlder(String version, String than) {
        return INSTANCE.compare(version, than) < 0;
    }

    private static String[] segments(String version) {
        String value = version == null || version.isBlank() ? UNVERSIONED : version.trim();
        return value.split("[.-]");
    }

    private static int compareSegment(String x, String y) {
        if (isNumeric(x) && isNumeric(y)) {
            return Long.compare(Long.parseLong(x), Long.parseLong(y));
        }
        return x.compareTo(y);
    }

    private static boolean isNumeric(String segment) {
        if (segment.isEmpty() || segment.length() > 18) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
