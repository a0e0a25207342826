package com.lowline.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * 深度优先遍历本节点及其子节点。
     * 返回值是本节点自身的访问结果，由父节点负责应用替换。
     */
    public abstract VisitResult accept(NodeVisitor visitor);

    /**
     * 深拷贝（宏展开时使用）
     */
    public abstract AstNode copy();
}
