package com.phillippitts.parlcorpus.service.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spells out digit sequences as Finnish number words.
 *
 * <p>Thousands groups separated by spaces ({@code 10 000}) are joined first. Values up to
 * 999 999 999 999 are written in standard compound form; millions and milliards are separate
 * words ({@code kaksi miljoonaa sata}). Longer digit runs and runs with a leading zero are read
 * digit by digit.
 */
public final class FinnishNumberExpander {

    private static final Pattern GROUPED = Pattern.compile("(?<!\\d)\\d{1,3}(?:[ \\u00A0]\\d{3})+(?!\\d)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final long MAX_SPELLED = 999_999_999_999L;

    private static final String[] ONES = {
            "nolla", "yksi", "kaksi", "kolme", "neljä", "viisi", "kuusi", "seitsemän", "kahdeksan", "yhdeksän"
    };

    private FinnishNumberExpander() {
        // Prevent instantiation
    }

    /**
     * Replaces every digit run in the text by its spelled-out form, surrounded by spaces.
     */
    public static String expandAll(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher grouped = GROUPED.matcher(text);
        StringBuilder joined = new StringBuilder();
        while (grouped.find()) {
            grouped.appendReplacement(joined, grouped.group().replaceAll("[ \\u00A0]", ""));
        }
        grouped.appendTail(joined);

        Matcher digits = DIGITS.matcher(joined);
        StringBuilder out = new StringBuilder();
        while (digits.find()) {
            digits.appendReplacement(out, Matcher.quoteReplacement(" " + spell(digits.group()) + " "));
        }
        digits.appendTail(out);
        return out.toString();
    }

    /**
     * Spells a digit string.
     *
     * @param digits non-empty string of ASCII digits
     */
    public static String spell(String digits) {
        if (digits == null || digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Not a digit string: '" + digits + "'");
        }
        boolean leadingZero = digits.length() > 1 && digits.charAt(0) == '0';
        if (leadingZero || digits.length() > 12) {
            return digitByDigit(digits);
        }
        long value = Long.parseLong(digits);
        return value > MAX_SPELLED ? digitByDigit(digits) : spell(value);
    }

    static String spell(long value) {
        if (value == 0) {
            return ONES[0];
        }
        StringBuilder sb = new StringBuilder();
        long milliards = value / 1_000_000_000L;
        long millions = (value / 1_000_000L) % 1_000;
        long rest = value % 1_000_000L;
        appendLarge(sb, milliards, "miljardi", "miljardia");
        appendLarge(sb, millions, "miljoona", "miljoonaa");
        if (rest > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(belowMillion((int) rest));
        }
        return sb.toString();
    }

    private static void appendLarge(StringBuilder sb, long count, String singular, String partitive) {
        if (count == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        if (count == 1) {
            sb.append(singular);
        } else {
            sb.append(belowThousand((int) count)).append(' ').append(partitive);
        }
    }

    private static String belowMillion(int value) {
        int thousands = value / 1000;
        int rest = value % 1000;
        StringBuilder sb = new StringBuilder();
        if (thousands == 1) {
            sb.append("tuhat");
        } else if (thousands > 1) {
            sb.append(belowThousand(thousands)).append("tuhatta");
        }
        if (rest > 0) {
            sb.append(belowThousand(rest));
        }
        return sb.toString();
    }

    private static String belowThousand(int value) {
        int hundreds = value / 100;
        int rest = value % 100;
        StringBuilder sb = new StringBuilder();
        if (hundreds == 1) {
            sb.append("sata");
        } else if (hundreds > 1) {
            sb.append(ONES[hundreds]).append("sataa");
        }
        if (rest > 0) {
            sb.append(belowHundred(rest));
        }
        return sb.toString();
    }

    private static String belowHundred(int value) {
        if (value < 10) {
            return ONES[value];
        }
        if (value == 10) {
            return "kymmenen";
        }
        if (value < 20) {
            return ONES[value - 10] + "toista";
        }
        int tens = value / 10;
        int ones = value % 10;
        return ONES[tens] + "kymmentä" + (ones > 0 ? ONES[ones] : "");
    }

    private static String digitByDigit(String digits) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < digits.length(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(ONES[digits.charAt(i) - '0']);
        }
        return sb.toString();
    }
}
