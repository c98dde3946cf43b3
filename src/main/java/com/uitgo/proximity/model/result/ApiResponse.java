package com.uitgo.proximity.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standardized API response wrapper
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    
    private Boolean ok;
    private T data;
    private String error;
    private String code;
    private String elapsed;
    
    /**
     * Create successful response with the elapsed time measured by the caller
     */
    public static <T> ApiResponse<T> success(T data, String elapsed) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .elapsed(elapsed)
                .build();
    }
    
    /**
     * Create error response
     */
    public static <T> ApiResponse<T> error(String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .error(error)
                .build();
    }
    
    /**
     * Create error response carrying a machine readable error code
     */
    public static <T> ApiResponse<T> error(String code, String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .code(code)
                .error(error)
                .build();
    }
}
