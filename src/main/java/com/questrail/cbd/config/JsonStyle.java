package com.questrail.cbd.config;

/**
 * Separator style of the JSON printer. Neither style indents.
 */
public enum JsonStyle
{
    /** {@code {"key": "value","n": 1}} - one space after each colon. */
    SPACED(": ", ","),

    /** {@code {"key":"value","n":1}} - no insignificant whitespace at all. */
    COMPACT(":", ",");

    private final String memberSeparator;
    private final String elementSeparator;

    JsonStyle(String memberSeparator, String elementSeparator) {
        this.memberSeparator = memberSeparator;
        this.elementSeparator = elementSeparator;
    }

    /** Text between a member name and its value. */
    public String memberSeparator() {
        return memberSeparator;
    }

    /** Text between array elements and between object members. */
    public String elementSeparator() {
        return elementSeparator;
    }
}
