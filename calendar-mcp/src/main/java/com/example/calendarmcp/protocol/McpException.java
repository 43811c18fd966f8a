package com.example.calendarmcp.protocol;

public class McpException extends RuntimeException {
    private final int code;
    private final Object data;

    public McpException(int code, String message) {
        this(code, message, null, null);
    }

    public McpException(int code, String message, Object data) {
        this(code, message, data, null);
    }

    public McpException(int code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public Object getData() {
        return data;
    }
}
