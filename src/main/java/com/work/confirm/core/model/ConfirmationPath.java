package com.work.confirm.core.model;

/**
 * 终态由哪条路径产出。
 */
public enum ConfirmationPath {
    PUSH,
    POLLING,
    NONE
}
