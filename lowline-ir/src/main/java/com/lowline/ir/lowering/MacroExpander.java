package com.lowline.ir.lowering;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.block.MacroExitMarker;
import com.lowline.compiler.ast.block.MacroInsertion;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.MacroDefinition;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.stmt.Assignment;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.ir.ConversionContext;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 宏展开：复制宏体，用实参替换形参，给宏体内声明的标签加上本次展开的序号。
 * 展开结果末尾追加退出标记，遍历到标记时弹出宏调用栈。
 */
public class MacroExpander {

    private final ConversionContext ctx;

    public MacroExpander(ConversionContext ctx) {
        this.ctx = ctx;
    }

    public List<Element> expand(MacroInsertion call) {
        MacroDefinition macro = ctx.getMacro(call.getFunction());
        if (macro == null) {
            throw ctx.error("Unknown macro '" + call.getFunction() + "'", call.getLocation());
        }
        List<String> params = macro.getParameters();
        List<Expression> args = call.getArguments();
        if (params.size() != args.size()) {
            throw ctx.error("Macro '" + macro.getName() + "' expects " + params.size()
                    + " argument(s), got " + args.size(), call.getLocation());
        }
        int insertion = ctx.nextMacroInsertion();
        int limit = ctx.getConfig().getMaxMacroInsertions();
        if (insertion > limit) {
            throw ctx.error("Too many macro insertions (limit " + limit + "), is '"
                    + macro.getName() + "' recursive?", call.getLocation());
        }

        Map<String, Expression> bindings = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            bindings.put(params.get(i).toLowerCase(), args.get(i));
        }

        List<Element> body = Element.copyAll(macro.getBody());
        Set<String> labels = collectLabels(body);
        String suffix = "$" + insertion;
        NodeLists.acceptAll(body, Element.class, (node, type) -> {
            if (type != VisitType.PRE) return VisitResult.UNCHANGED;
            if (node instanceof Dereference) {
                return substituteRead((Dereference) node, bindings);
            }
            if (node instanceof Assignment) {
                substituteTarget((Assignment) node, bindings);
            } else if (node instanceof StatementLine) {
                StatementLine line = (StatementLine) node;
                if (line.hasLabel() && labels.contains(line.getLabel())) {
                    line.setLabel(line.getLabel() + suffix);
                }
            } else if (node instanceof GoToLabelStatement) {
                GoToLabelStatement jump = (GoToLabelStatement) node;
                if (labels.contains(jump.getLabel())) {
                    jump.setLabel(jump.getLabel() + suffix);
                }
            }
            return VisitResult.UNCHANGED;
        });

        String frame = macro.getName() + ":" + call.getLocation().getLine();
        ctx.pushMacroFrame(frame);
        body.add(new MacroExitMarker(call.getLocation(), frame));
        return body;
    }

    private VisitResult substituteRead(Dereference deref, Map<String, Expression> bindings) {
        Expression arg = bindings.get(deref.getVariable().toLowerCase());
        if (arg == null) return VisitResult.UNCHANGED;
        Expression value = arg.copy();
        if (deref.hasStep()) {
            if (!(value instanceof Dereference) || ((Dereference) value).hasStep()) {
                throw ctx.error("Macro argument for '" + deref.getVariable()
                        + "' must be a variable to be incremented or decremented", arg.getLocation());
            }
            ((Dereference) value).setStep(deref.getStep(), deref.isPrefix());
        }
        return VisitResult.replaceAndSkip(value);
    }

    private void substituteTarget(Assignment assign, Map<String, Expression> bindings) {
        Expression arg = bindings.get(assign.getVariable().toLowerCase());
        if (arg == null) return;
        if (!(arg instanceof Dereference) || ((Dereference) arg).hasStep()) {
            throw ctx.error("Macro argument for '" + assign.getVariable()
                    + "' must be a variable to be assigned to", arg.getLocation());
        }
        assign.setVariable(((Dereference) arg).getVariable());
    }

    private static Set<String> collectLabels(List<Element> body) {
        Set<String> labels = new HashSet<>();
        for (Element element : body) {
            element.accept((AstNode node, VisitType type) -> {
                if (type == VisitType.PRE && node instanceof StatementLine && ((StatementLine) node).hasLabel()) {
                    labels.add(((StatementLine) node).getLabel());
                }
                return VisitResult.UNCHANGED;
            });
        }
        return labels;
    }
}
