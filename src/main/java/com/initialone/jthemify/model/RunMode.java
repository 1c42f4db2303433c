package com.initialone.jthemify.model;

public enum RunMode {
    DRY_RUN,
    APPLY
}
