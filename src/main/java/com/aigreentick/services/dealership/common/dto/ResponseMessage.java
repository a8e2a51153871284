package com.aigreentick.services.dealership.common.dto;

/**
 * Response envelope shared by every REST endpoint.
 */
public class ResponseMessage<T> {
    private final String status;
    private final String message;
    private final T data;

    private ResponseMessage(String status, String message, T data) {
        this.status = status;
        this.message = message;
        this.data = data;
    }

    public static <T> ResponseMessage<T> success(String message, T data) {
        return new ResponseMessage<>("SUCCESS", message, data);
    }

    public static <T> ResponseMessage<T> error(String message) {
        return new ResponseMessage<>("ERROR", message, null);
    }

    public String getStatus() { return status; }
    public String getMessage() { return message; }
    public T getData() { return data; }
}
