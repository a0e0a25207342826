package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.ArrayList;
import java.util.List;

/**
 * 合并后的清理，反复执行直到没有变化：
 * <ul>
 *   <li>行尾跳到下一行的无条件跳转删除</li>
 *   <li>空行删除，其标签转给下一行</li>
 *   <li>紧跟在无条件跳转之后、没有标签的行不可达，删除</li>
 * </ul>
 */
public class FallthroughJumpRemoval implements LinePass {

    @Override
    public String getName() {
        return "FallthroughJumpRemoval";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = new ArrayList<>(Lines.of(program));
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < lines.size(); i++) {
                StatementLine line = lines.get(i);
                StatementLine next = i + 1 < lines.size() ? lines.get(i + 1) : null;

                if (next != null && next.hasLabel() && jumpsTo(Lines.last(line), next.getLabel())) {
                    List<Statement> statements = new ArrayList<>(line.getStatements());
                    statements.remove(statements.size() - 1);
                    line.setStatements(statements);
                    changed = true;
                }

                if (line.getStatements().isEmpty() && (next != null || !line.hasLabel())) {
                    if (line.hasLabel()) {
                        moveLabel(line, next, lines);
                    }
                    lines.remove(i--);
                    changed = true;
                } else if (i > 0 && !line.hasLabel() && lines.get(i - 1).endsWithJump()) {
                    lines.remove(i--);
                    changed = true;
                }
            }
        }
        program.setElements(lines);
        return program;
    }

    private static boolean jumpsTo(Statement statement, String label) {
        return statement instanceof GoToLabelStatement
                && ((GoToLabelStatement) statement).getLabel().equals(label);
    }

    private static void moveLabel(StatementLine from, StatementLine to, List<StatementLine> lines) {
        if (!to.hasLabel()) {
            to.setLabel(from.getLabel());
            return;
        }
        for (GoToLabelStatement jump : Lines.jumps(lines)) {
            if (jump.getLabel().equals(from.getLabel())) {
                jump.setLabel(to.getLabel());
            }
        }
    }
}
