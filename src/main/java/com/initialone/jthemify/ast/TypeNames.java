package com.initialone.jthemify.ast;

public final class TypeNames {
    private TypeNames() {
    }

    /** com.acme.Foo&lt;Bar&gt;[] -> Foo */
    public static String simple(String typeText) {
        if (typeText == null) return "";
        String t = typeText.trim();
        int lt = t.indexOf('<');
        if (lt >= 0) t = t.substring(0, lt);
        int br = t.indexOf('[');
        if (br >= 0) t = t.substring(0, br);
        if (t.endsWith("...")) t = t.substring(0, t.length() - 3);
        int dot = t.lastIndexOf('.');
        return (dot >= 0 ? t.substring(dot + 1) : t).trim();
    }
}
