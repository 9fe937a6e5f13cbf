package com.memfacade.service;

public class MemoryServiceException extends RuntimeException {

    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 200;

    private final ErrorKind kind;

    public MemoryServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MemoryServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static MemoryServiceException notFound(String memoryId) {
        return new MemoryServiceException(ErrorKind.NOT_FOUND, "Memory " + memoryId + " not found");
    }

    public static MemoryServiceException invalid(String message) {
        return new MemoryServiceException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static MemoryServiceException wrap(ErrorKind kind, String prefix, Throwable cause, int maxLength) {
        return new MemoryServiceException(kind, truncate(prefix + ": " + describe(cause), maxLength), cause);
    }

    static String describe(Throwable t) {
        var msg = t.getMessage();
        return msg != null ? msg : t.getClass().getSimpleName();
    }

    static String truncate(String message, int maxLength) {
        if (message == null || maxLength < 4 || message.length() <= maxLength) return message;
        return message.substring(0, maxLength - 3) + "...";
    }
}
