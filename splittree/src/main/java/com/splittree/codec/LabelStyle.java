package com.splittree.codec;

/** How the labels of one side of a split are written. */
public enum LabelStyle {
    /** Every character is a label: {@code b/acde}. */
    CHARACTER,
    /** Labels separated by commas: {@code human,chimp/gorilla,orang}. */
    DELIMITED;

    public static final char LABEL_SEPARATOR = ',';
}
