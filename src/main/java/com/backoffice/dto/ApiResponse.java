package com.backoffice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "공통 API 응답")
public class ApiResponse<T> {

    @Schema(description = "성공 여부", example = "true")
    private boolean success;

    @Schema(description = "응답 코드", example = "ORDER_3001")
    private String code;

    @Schema(description = "응답 데이터")
    private T data;

    @Schema(description = "메시지", example = "주문이 생성되었습니다.")
    private String message;

    public static <T> ApiResponse<T> of(ResponseCode responseCode, T data) {
        return new ApiResponse<>(true, responseCode.getCode(), data, responseCode.getMessage());
    }

    public static <T> ApiResponse<T> fail(ResponseCode responseCode, String customMessage) {
        return new ApiResponse<>(false, responseCode.getCode(), null, customMessage);
    }
}
