package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 宏调用点
 */
public class MacroInsertion extends Element {
    private final String function;
    private final List<Expression> arguments;

    public MacroInsertion(SourceLocation location, String function, List<Expression> arguments) {
        super(location);
        this.function = function;
        this.arguments = new ArrayList<>(arguments);
    }

    public String getFunction() {
        return function;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        NodeLists.acceptAll(arguments, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public MacroInsertion copy() {
        List<Expression> args = new ArrayList<>(arguments.size());
        for (Expression arg : arguments) {
            args.add(arg.copy());
        }
        return new MacroInsertion(location, function, args);
    }
}
