package com.initialone.jthemify.model;

public enum Severity {
    ERROR,
    WARNING
}
