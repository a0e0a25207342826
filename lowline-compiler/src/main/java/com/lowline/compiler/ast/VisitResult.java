package com.lowline.compiler.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 访问回调的返回结果：不变，或用零到多个节点替换当前节点。
 * <p>
 * 替换分两种：
 * <ul>
 *   <li>{@link #replace} 替换后从第一个新节点继续遍历（新内容仍需处理，如宏展开）</li>
 *   <li>{@link #replaceAndSkip} 替换后跳过新节点（新内容已是最终形式，如降级后的控制流）</li>
 * </ul>
 */
public final class VisitResult {

    public static final VisitResult UNCHANGED = new VisitResult(null, false);

    private final List<AstNode> replacement;
    private final boolean skip;

    private VisitResult(List<AstNode> replacement, boolean skip) {
        this.replacement = replacement;
        this.skip = skip;
    }

    public static VisitResult replace(List<? extends AstNode> nodes) {
        return new VisitResult(Collections.unmodifiableList(new ArrayList<>(nodes)), false);
    }

    public static VisitResult replace(AstNode... nodes) {
        return replace(Arrays.asList(nodes));
    }

    public static VisitResult replaceAndSkip(List<? extends AstNode> nodes) {
        return new VisitResult(Collections.unmodifiableList(new ArrayList<>(nodes)), true);
    }

    public static VisitResult replaceAndSkip(AstNode... nodes) {
        return replaceAndSkip(Arrays.asList(nodes));
    }

    /**
     * 删除当前节点
     */
    public static VisitResult remove() {
        return new VisitResult(Collections.<AstNode>emptyList(), true);
    }

    public boolean isReplacement() {
        return replacement != null;
    }

    public boolean isSkip() {
        return skip;
    }

    public List<AstNode> getReplacement() {
        return replacement != null ? replacement : Collections.<AstNode>emptyList();
    }
}
