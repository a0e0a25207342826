package com.lowline.compiler;

import com.lowline.compiler.ast.SourceLocation;

/**
 * 结构性编译错误：用户可修复，总是带有源码区间。
 */
public class CompileException extends RuntimeException {
    private final SourceLocation location;

    public CompileException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * 不带位置信息的原始消息
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location != SourceLocation.UNKNOWN) {
            sb.append(" at line ").append(location.getLine());
            sb.append(", column ").append(location.getColumn());
            if (location.getEndLine() != location.getLine() || location.getEndColumn() != location.getColumn()) {
                sb.append(" to line ").append(location.getEndLine());
                sb.append(", column ").append(location.getEndColumn());
            }
        }
        return sb.toString();
    }
}
