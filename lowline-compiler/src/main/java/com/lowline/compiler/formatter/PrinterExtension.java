package com.lowline.compiler.formatter;

import com.lowline.compiler.ast.AstNode;

/**
 * 打印扩展钩子：调用方可以自行输出某些节点（例如尚未解析的跳转目标）。
 */
@FunctionalInterface
public interface PrinterExtension {

    /**
     * @return true 表示节点已由扩展输出，打印器不再处理
     */
    boolean print(AstNode node, PrinterContext ctx);
}
