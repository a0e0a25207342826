package com.lowline.compiler.ast;

/**
 * 访问时机
 */
public enum VisitType {
    /** 进入子节点之前 */
    PRE,
    /** 子节点处理完成之后 */
    POST
}
