package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.stmt.ExpressionStatement;
import com.lowline.compiler.ast.stmt.GoToStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.ArrayList;
import java.util.List;

/**
 * 执行完最后一行后机器自动回到第 1 行。
 * 最后一行恰好是最大行数时，行尾的 goto 1 可以去掉；
 * 多出的一行只有 goto 1（和计数器）时，整行去掉。
 */
public class TerminalJumpElision implements LinePass {

    @Override
    public String getName() {
        return "TerminalJumpElision";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = new ArrayList<>(Lines.of(program));
        int maxLines = ctx.getConfig().getMaxLines();
        if (lines.isEmpty()) return program;
        StatementLine last = lines.get(lines.size() - 1);
        if (!isJumpToFirstLine(Lines.last(last))) return program;

        if (lines.size() == maxLines) {
            List<Statement> statements = new ArrayList<>(last.getStatements());
            statements.remove(statements.size() - 1);
            last.setStatements(statements);
        } else if (lines.size() == maxLines + 1 && onlyCounterBefore(last, ctx)) {
            lines.remove(lines.size() - 1);
            program.setElements(lines);
        }
        return program;
    }

    private static boolean isJumpToFirstLine(Statement statement) {
        return statement instanceof GoToStatement && ((GoToStatement) statement).getConstantLine() == 1;
    }

    private static boolean onlyCounterBefore(StatementLine line, ConversionContext ctx) {
        List<Statement> statements = line.getStatements();
        for (int i = 0; i < statements.size() - 1; i++) {
            if (!isTimeCounter(statements.get(i), ctx)) return false;
        }
        return true;
    }

    private static boolean isTimeCounter(Statement statement, ConversionContext ctx) {
        if (!ctx.isTimeTracking() || !(statement instanceof ExpressionStatement)) return false;
        Expression expr = ((ExpressionStatement) statement).getExpression();
        return expr instanceof Dereference
                && ((Dereference) expr).getVariable().equals(ctx.getTimeVariable())
                && ((Dereference) expr).hasStep();
    }
}
