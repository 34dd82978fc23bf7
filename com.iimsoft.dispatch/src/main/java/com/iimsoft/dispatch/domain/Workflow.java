package com.iimsoft.dispatch.domain;

public enum Workflow {
    /** 卷材/板材：按长度计速的成型机 */
    FORMING,
    /** 配件：剪板 + 叉车 + 折弯，只有折弯机占机时 */
    SHEARING_BENDING
}
