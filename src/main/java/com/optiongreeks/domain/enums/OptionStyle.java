package com.optiongreeks.domain.enums;

/** Call or put. Gamma and vega are identical for both; every other Greek diverges. */
public enum OptionStyle {
    CALL,
    PUT
}
