package com.lowline.ir.pass;

import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;

/**
 * 转换 pass 接口。每个 pass 完整处理一遍程序后才进入下一个。
 */
public interface LinePass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对程序执行转换。
     */
    Program run(Program program, ConversionContext ctx);
}
