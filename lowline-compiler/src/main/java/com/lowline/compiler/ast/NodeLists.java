package com.lowline.compiler.ast;

import java.util.List;

/**
 * 遍历期间就地修改子节点的辅助方法。
 */
public final class NodeLists {

    private NodeLists() {
    }

    /**
     * 依次遍历列表中的子节点，并在遍历过程中应用替换。
     * 每轮重新读取列表长度：用 N 个节点替换 1 个节点后，后续下标整体偏移 N-1。
     */
    public static <T extends AstNode> void acceptAll(List<T> children, Class<T> kind, NodeVisitor visitor) {
        for (int i = 0; i < children.size(); i++) {
            VisitResult result = children.get(i).accept(visitor);
            if (!result.isReplacement()) continue;
            int count = patch(children, i, result.getReplacement(), kind);
            if (result.isSkip()) {
                i += count - 1;
            } else {
                // 从第一个新节点处重新开始
                i--;
            }
        }
    }

    /**
     * 遍历单个子节点槽位。替换必须恰好是一个同类节点，否则视为降级 pass 的缺陷。
     */
    public static <T extends AstNode> T acceptOne(T child, Class<T> kind, NodeVisitor visitor) {
        if (child == null) return null;
        T current = child;
        while (true) {
            VisitResult result = current.accept(visitor);
            if (!result.isReplacement()) return current;
            List<AstNode> replacement = result.getReplacement();
            if (replacement.size() != 1) {
                throw new IllegalStateException("Slot of type " + kind.getSimpleName()
                        + " requires exactly one replacement node, got " + replacement.size());
            }
            current = cast(replacement.get(0), kind);
            if (result.isSkip()) return current;
        }
    }

    /**
     * 用 replacement 替换 list[index]，返回插入的节点数。
     */
    public static <T extends AstNode> int patch(List<T> list, int index, List<AstNode> replacement, Class<T> kind) {
        list.remove(index);
        for (int j = 0; j < replacement.size(); j++) {
            list.add(index + j, cast(replacement.get(j), kind));
        }
        return replacement.size();
    }

    private static <T extends AstNode> T cast(AstNode node, Class<T> kind) {
        if (!kind.isInstance(node)) {
            throw new IllegalStateException("Could not patch node list: expected "
                    + kind.getSimpleName() + " but got " + (node == null ? "null" : node.getClass().getSimpleName()));
        }
        return kind.cast(node);
    }
}
