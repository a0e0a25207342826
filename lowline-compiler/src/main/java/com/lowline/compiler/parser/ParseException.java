package com.lowline.compiler.parser;

import com.lowline.compiler.ast.SourceLocation;

/**
 * 解析异常（由外部解析器抛出，转换管线原样向上传播）
 */
public class ParseException extends RuntimeException {
    private final SourceLocation location;
    private final String expected;

    public ParseException(String message, SourceLocation location) {
        this(message, location, null);
    }

    public ParseException(String message, SourceLocation location, String expected) {
        super(message);
        this.location = location;
        this.expected = expected;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location != null) {
            sb.append(" at ").append(location.getFile());
            sb.append(" line ").append(location.getLine());
            sb.append(", column ").append(location.getColumn());
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
