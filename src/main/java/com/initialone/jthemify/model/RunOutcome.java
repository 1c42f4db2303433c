package com.initialone.jthemify.model;

public enum RunOutcome {
    /** dry-run：只算计划，不写文件 */
    PLANNED,
    /** apply：已备份并写入 */
    APPLIED,
    /** 校验有 ERROR，拒绝写入 */
    BLOCKED,
    /** 中途取消；已写的文件保持原样，可用备份回滚 */
    CANCELLED
}
