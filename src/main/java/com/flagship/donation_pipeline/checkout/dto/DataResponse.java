package com.flagship.donation_pipeline.checkout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * {@code {success, message, data}} envelope used by the subscription endpoints.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataResponse<T> {
    boolean success;
    String message;
    T data;

    public static <T> DataResponse<T> of(String message, T data) {
        return new DataResponse<>(true, message, data);
    }

    public static <T> DataResponse<T> of(T data) {
        return new DataResponse<>(true, null, data);
    }
}
