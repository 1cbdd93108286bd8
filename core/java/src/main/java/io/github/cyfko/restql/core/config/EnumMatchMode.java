package io.github.cyfko.restql.core.config;

/**
 * Mode used to compare filter values received as strings to enum constants.
 */
public enum EnumMatchMode {
    /** Match enum name exactly (case-sensitive). */
    CASE_SENSITIVE,
    /** Match enum ignoring case. */
    CASE_INSENSITIVE
}
