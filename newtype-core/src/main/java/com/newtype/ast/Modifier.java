package com.newtype.ast;

/**
 * Tri-state property modifier. {@code UNSET} means no annotation was written,
 * {@code PRESENT} the positive form ({@code readonly}, {@code ?}) and
 * {@code ABSENT} the negative form ({@code -readonly}, {@code -?}).
 */
public enum Modifier {
    UNSET,
    PRESENT,
    ABSENT
}
