package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 行级 pass 共用的辅助方法
 */
final class Lines {

    private Lines() {
    }

    /**
     * 降级之后程序只由语句行组成，否则是降级的缺陷
     */
    static List<StatementLine> of(Program program) {
        List<StatementLine> lines = new ArrayList<>(program.getElements().size());
        for (Element element : program.getElements()) {
            if (!(element instanceof StatementLine)) {
                throw new IllegalStateException("Unconverted element after lowering: "
                        + element.getClass().getSimpleName());
            }
            lines.add((StatementLine) element);
        }
        return lines;
    }

    /**
     * 标签 → 行下标（从 0 开始）
     */
    static Map<String, Integer> labelIndex(List<StatementLine> lines, ConversionContext ctx) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            StatementLine line = lines.get(i);
            if (!line.hasLabel()) continue;
            if (index.put(line.getLabel(), i) != null) {
                throw ctx.error("Duplicate label '" + line.getLabel() + "'", line.getLocation());
            }
        }
        return index;
    }

    /**
     * 收集所有标签跳转，包括嵌在行内 if 中的
     */
    static List<GoToLabelStatement> jumps(List<StatementLine> lines) {
        List<GoToLabelStatement> jumps = new ArrayList<>();
        for (StatementLine line : lines) {
            line.accept((AstNode node, VisitType type) -> {
                if (type == VisitType.PRE && node instanceof GoToLabelStatement) {
                    jumps.add((GoToLabelStatement) node);
                }
                return VisitResult.UNCHANGED;
            });
        }
        return jumps;
    }

    static Statement last(StatementLine line) {
        List<Statement> statements = line.getStatements();
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }
}
