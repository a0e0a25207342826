package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 跳转链折叠：目标行（跳过空行后）只有一条无条件跳转时，直接跳到最终目的地。
 * 先为所有标签算出最终目标，再统一改写，遇到环即停止。
 */
public class JumpChainCollapsing implements LinePass {

    @Override
    public String getName() {
        return "JumpChainCollapsing";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        Map<String, Integer> index = Lines.labelIndex(lines, ctx);

        Map<String, String> targets = new HashMap<>();
        for (String label : index.keySet()) {
            targets.put(label, resolve(label, lines, index));
        }
        for (GoToLabelStatement jump : Lines.jumps(lines)) {
            String target = targets.get(jump.getLabel());
            if (target != null) {
                jump.setLabel(target);
            }
        }
        return program;
    }

    private static String resolve(String label, List<StatementLine> lines, Map<String, Integer> index) {
        Set<String> visited = new HashSet<>();
        String current = label;
        visited.add(current);
        while (true) {
            Integer i = index.get(current);
            if (i == null) return current;
            int target = i;
            // 空行直接落到下一行
            while (lines.get(target).getStatements().isEmpty() && target + 1 < lines.size()) {
                target++;
            }
            List<Statement> statements = lines.get(target).getStatements();
            if (statements.size() != 1 || !(statements.get(0) instanceof GoToLabelStatement)) {
                return current;
            }
            String next = ((GoToLabelStatement) statements.get(0)).getLabel();
            if (!visited.add(next)) {
                return current;
            }
            current = next;
        }
    }
}
