package com.initialone.jthemify.model;

/**
 * Whether the scope enclosing a rewrite site can supply the theme handle.
 * Recomputed every time a tree is analyzed; never persisted.
 */
public enum ContextAvailability {
    /** 句柄已在作用域内 */
    AVAILABLE,
    /** 可以机械地补一个句柄参数 */
    CAN_INJECT,
    /** 需要人工加参数或换写法 */
    REQUIRES_MANUAL,
    /** 这里不可能做运行时查找 */
    UNAVAILABLE;

    public boolean canAutoInject() {
        return this == AVAILABLE || this == CAN_INJECT;
    }
}
