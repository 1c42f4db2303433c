package com.initialone.jthemify.model;

/** Name mapped onto one canonical slot of the color scheme, e.g. colorScheme.primary */
public class StrictMapping {
    public String target;
    /** 常量原本的 ARGB 值，仅展示用 */
    public String verifyValue;
    public String description;

    public StrictMapping() {
    }

    public StrictMapping(String target) {
        this.target = target;
    }
}
