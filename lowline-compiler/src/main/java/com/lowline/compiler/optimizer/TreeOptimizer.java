package com.lowline.compiler.optimizer;

import com.lowline.compiler.ast.decl.Program;

/**
 * 整树优化器接口：就地改写程序。
 */
public interface TreeOptimizer {

    /**
     * 优化器名称（用于日志）
     */
    String getName();

    void optimize(Program program);
}
