package com.initialone.jthemify.model;

/**
 * Naming convention of the target theme API.
 * Defaults describe {@code Theme.of(context)} lookups inside {@code build(BuildContext context)}
 * methods of {@code *Widget} types.
 */
public class ThemeConvention {
    /** 运行时句柄参数类型 */
    public String handleType = "BuildContext";
    /** 句柄参数名 */
    public String handleName = "context";
    /** accessorType.accessorMethod(handleName) */
    public String accessorType = "Theme";
    public String accessorMethod = "of";
    /** accessor 类型全名，import 检查用 */
    public String accessorImport = "ui.material.Theme";
    /** UI 类型的渲染入口方法 */
    public String renderMethod = "build";
    /** 父类型名包含该标记即视为 UI 类型 */
    public String uiTypeMarker = "Widget";
    /** accessor.extensionLookup(Group.class) */
    public String extensionLookup = "extension";

    public static ThemeConvention defaults() {
        return new ThemeConvention();
    }

    /** e.g. Theme.of(context) */
    public String accessorExpression() {
        return accessorType + "." + accessorMethod + "(" + handleName + ")";
    }

    public String accessorPackage() {
        if (accessorImport == null) return "";
        int i = accessorImport.lastIndexOf('.');
        return i < 0 ? "" : accessorImport.substring(0, i);
    }
}
