package com.parkalot.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope for every endpoint. Listings may carry {@link PageInfo}; failures carry {@link ErrorResponse}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final PageInfo page;
    private final ErrorResponse error;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, PageInfo page) {
        return new ApiResponse<>(true, data, page, null);
    }

    public static ApiResponse<Void> ok() {
        return new ApiResponse<>(true, null, null, null);
    }

    public static ApiResponse<Void> error(ErrorCode errorCode) {
        return new ApiResponse<>(false, null, null, ErrorResponse.of(errorCode));
    }

    public static ApiResponse<Void> error(ErrorCode errorCode, String message) {
        return new ApiResponse<>(false, null, null, ErrorResponse.of(errorCode, message));
    }

    /**
     * Offset window of a listing. {@code count} is the number of items in this page.
     */
    public record PageInfo(int limit, int offset, int count) {

        public boolean hasMore() {
            return count == limit;
        }
    }
}
