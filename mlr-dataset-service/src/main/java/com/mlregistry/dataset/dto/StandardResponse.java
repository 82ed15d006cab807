package com.mlregistry.dataset.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for successful REST responses
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StandardResponse<T> {

    private Integer statusCode;
    private String message;
    private T data;

    public static <T> StandardResponse<T> of(int statusCode, String message, T data) {
        return new StandardResponse<>(statusCode, message, data);
    }
}
