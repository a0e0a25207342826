package com.lowline.compiler.optimizer;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.stmt.Assignment;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 变量名缩短。
 * <p>
 * 本地变量按首次出现的顺序依次映射为 a, b, ..., z, aa, ab, ...（大小写不敏感，映射稳定）。
 * 外部设备字段（以 ':' 开头）只转小写，不改名。
 */
public class VariableNameOptimizer implements TreeOptimizer {

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "if", "then", "else", "end", "goto", "and", "or", "not",
            "abs", "sqrt", "sin", "cos", "tan", "asin", "acos", "atan"));

    /** 原名（小写） → 短名 */
    private final Map<String, String> variables = new HashMap<>();
    /** 短名 → 原名 */
    private final Map<String, String> reversal = new LinkedHashMap<>();
    private int counter = 0;

    @Override
    public String getName() {
        return "VariableNameOptimizer";
    }

    @Override
    public void optimize(Program program) {
        program.accept(this::visit);
    }

    private VisitResult visit(AstNode node, VisitType type) {
        if (type != VisitType.PRE) return VisitResult.UNCHANGED;
        if (node instanceof Dereference) {
            Dereference deref = (Dereference) node;
            deref.setVariable(optimizeVarName(deref.getVariable()));
        } else if (node instanceof Assignment) {
            Assignment assign = (Assignment) node;
            assign.setVariable(optimizeVarName(assign.getVariable()));
        }
        return VisitResult.UNCHANGED;
    }

    /**
     * 返回变量的短名，首次出现时分配
     */
    public String optimizeVarName(String name) {
        String lower = name.toLowerCase();
        if (lower.startsWith(":")) {
            return lower;
        }
        String existing = variables.get(lower);
        if (existing != null) {
            return existing;
        }
        String shortName;
        do {
            shortName = nameFor(counter++);
        } while (KEYWORDS.contains(shortName));
        variables.put(lower, shortName);
        reversal.put(shortName, lower);
        return shortName;
    }

    /**
     * 短名 → 原名，用于调试时还原变量名
     */
    public Map<String, String> getReversalTable() {
        return Collections.unmodifiableMap(reversal);
    }

    /**
     * 双射 26 进制：0→a, 25→z, 26→aa
     */
    static String nameFor(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('a' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }
}
