package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.ArrayList;
import java.util.List;

/**
 * 程序用到 line() 或 time() 时，在每行行首插入计数器自增。
 * 合并时已为它预留了字符。
 */
public class TimeTrackingInjection implements LinePass {

    @Override
    public String getName() {
        return "TimeTrackingInjection";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        if (!ctx.isTimeTracking()) return program;
        for (StatementLine line : Lines.of(program)) {
            List<Statement> statements = new ArrayList<>(line.getStatements().size() + 1);
            statements.add(Nodes.increment(line.getLocation(), ctx.getTimeVariable()));
            statements.addAll(line.getStatements());
            line.setStatements(statements);
        }
        return program;
    }
}
