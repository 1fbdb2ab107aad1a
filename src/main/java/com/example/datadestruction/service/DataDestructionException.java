package com.example.datadestruction.service;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

public class DataDestructionException extends RuntimeException {

    public enum Code {
        INVALID_REQUEST,
        PROTOCOL_NOT_SUPPORTED,
        EXECUTION_FAILED
    }

    @Getter
    private final Code code;

    private DataDestructionException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static DataDestructionException malformedBody() {
        return new DataDestructionException(Code.INVALID_REQUEST,
                "Request body must be a JSON object", null);
    }

    public static DataDestructionException invalidProtocolParameter() {
        return new DataDestructionException(Code.INVALID_REQUEST,
                "Missing or invalid parameter: protocol (str)", null);
    }

    public static DataDestructionException invalidConnectIds() {
        return new DataDestructionException(Code.INVALID_REQUEST,
                "connect_ids must be a list of strings", null);
    }

    /**
     * @param allowed protocol names in the order they should be listed to the caller
     */
    public static DataDestructionException protocolNotSupported(String protocol, List<String> allowed) {
        String listed = allowed.stream()
                .map(name -> "'" + name + "'")
                .collect(Collectors.joining(", ", "[", "]"));
        return new DataDestructionException(Code.PROTOCOL_NOT_SUPPORTED,
                "'" + protocol + "' is not a supported protocol. Allowed: " + listed, null);
    }

    public static DataDestructionException executionFailed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new DataDestructionException(Code.EXECUTION_FAILED, message, cause);
    }
}
