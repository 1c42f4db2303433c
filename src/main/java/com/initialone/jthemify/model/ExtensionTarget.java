package com.initialone.jthemify.model;

/** Property of a theme extension group that receives a non-core color. */
public class ExtensionTarget {
    public String target;
    public String value;

    public ExtensionTarget() {
    }

    public ExtensionTarget(String target) {
        this.target = target;
    }
}
