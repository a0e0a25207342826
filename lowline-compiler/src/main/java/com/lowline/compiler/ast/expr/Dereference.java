package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 按名称读取变量，可带 ++/-- 前缀或后缀。
 * 以 ':' 开头的名称是外部设备字段。
 */
public class Dereference extends Expression {

    public enum Step {
        INCREMENT("++"),
        DECREMENT("--");

        private final String symbol;

        Step(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private String variable;
    private Step step;
    private boolean prefix;

    public Dereference(SourceLocation location, String variable) {
        this(location, variable, null, false);
    }

    public Dereference(SourceLocation location, String variable, Step step, boolean prefix) {
        super(location);
        this.variable = variable;
        this.step = step;
        this.prefix = prefix;
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public Step getStep() {
        return step;
    }

    public boolean hasStep() {
        return step != null;
    }

    public boolean isPrefix() {
        return prefix;
    }

    /**
     * 沿用另一处引用的自增/自减写法
     */
    public void setStep(Step step, boolean prefix) {
        this.step = step;
        this.prefix = prefix;
    }

    public boolean isExternal() {
        return variable.startsWith(":");
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public Dereference copy() {
        return new Dereference(location, variable, step, prefix);
    }

    @Override
    public String toString() {
        if (step == null) return variable;
        return prefix ? step.getSymbol() + variable : variable + step.getSymbol();
    }
}
