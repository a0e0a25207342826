package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

import java.math.BigDecimal;

/**
 * 数值字面量（定点数，最多 3 位小数）
 */
public class NumberConstant extends Expression {
    private final BigDecimal value;

    public NumberConstant(SourceLocation location, BigDecimal value) {
        super(location);
        this.value = value;
    }

    public NumberConstant(SourceLocation location, long value) {
        this(location, BigDecimal.valueOf(value));
    }

    public BigDecimal getValue() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public NumberConstant copy() {
        return new NumberConstant(location, value);
    }

    @Override
    public String toString() {
        return value.stripTrailingZeros().toPlainString();
    }
}
