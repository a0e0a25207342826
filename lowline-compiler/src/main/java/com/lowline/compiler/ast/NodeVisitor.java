package com.lowline.compiler.ast;

/**
 * 节点访问回调。
 *
 * <p>每个节点在下降前（{@link VisitType#PRE}）和子节点处理完后（{@link VisitType#POST}）各回调一次。
 * 返回 {@link VisitResult#UNCHANGED} 表示保持原样，或返回替换结果。
 * 用户可修复的错误通过抛出 {@code CompileException} 中止遍历。</p>
 */
@FunctionalInterface
public interface NodeVisitor {

    VisitResult visit(AstNode node, VisitType type);
}
