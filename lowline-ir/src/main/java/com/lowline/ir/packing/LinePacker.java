package com.lowline.ir.packing;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 贪心行合并：从左到右扫描，把后续行尽量并入当前物理行。
 * <p>
 * 下一行带标签或 BOL 标记时必须另起一行；当前行带 EOL 标记或以无条件跳转结尾时结束。
 * 试探合并总是基于不可变快照构造新列表，超出预算时直接丢弃候选。
 */
public class LinePacker {

    private final int budget;
    private final LineLengthEstimator estimator;

    public LinePacker(int budget, LineLengthEstimator estimator) {
        this.budget = budget;
        this.estimator = estimator;
    }

    /**
     * 合并行
     *
     * @throws CompileException 某一行单独就超出预算
     */
    public List<StatementLine> pack(List<StatementLine> lines) {
        List<StatementLine> result = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            StatementLine first = lines.get(i++);
            List<Statement> current = snapshot(first.getStatements());
            if (estimator.lengthOf(current) > budget) {
                throw new CompileException("The line is too long (>" + budget
                        + " characters) to be converted, even after optimization", first.getLocation());
            }
            SourceLocation location = first.getLocation();
            boolean eol = first.hasEOL();

            while (!eol && !endsWithJump(current) && i < lines.size()) {
                StatementLine next = lines.get(i);
                if (next.hasLabel() || next.hasBOL()) break;
                List<Statement> candidate = append(current, next.getStatements());
                if (estimator.lengthOf(candidate) > budget) break;
                current = candidate;
                location = SourceLocation.span(location, next.getLocation());
                eol = next.hasEOL();
                i++;
            }
            result.add(new StatementLine(location, first.getLabel(), current, first.hasBOL(), eol));
        }
        return result;
    }

    /**
     * 把若干行拼成一串语句（不检查长度）。有标签、边界标记或跳转后还有语句时返回 null。
     */
    public static List<Statement> join(List<StatementLine> lines) {
        List<Statement> joined = Collections.emptyList();
        for (StatementLine line : lines) {
            if (line.hasLabel() || line.hasBOL() || line.hasEOL()) return null;
            if (line.getStatements().isEmpty()) continue;
            if (endsWithJump(joined)) return null;
            joined = append(joined, line.getStatements());
        }
        return joined;
    }

    static List<Statement> append(List<Statement> snapshot, List<Statement> extra) {
        List<Statement> merged = new ArrayList<>(snapshot.size() + extra.size());
        merged.addAll(snapshot);
        merged.addAll(extra);
        return Collections.unmodifiableList(merged);
    }

    private static List<Statement> snapshot(List<Statement> statements) {
        return Collections.unmodifiableList(new ArrayList<>(statements));
    }

    private static boolean endsWithJump(List<Statement> statements) {
        return !statements.isEmpty() && statements.get(statements.size() - 1).isUnconditionalJump();
    }
}
