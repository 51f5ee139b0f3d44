package com.sessionhub.api.response;

import com.sessionhub.types.enums.ResponseCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * REST 统一响应 {@code {code, info, data}}，成功码为 "0000"。
 *
 * @param <T> 响应数据类型
 * @author sessionhub
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = -3391240581937165021L;

    private String code;

    private String info;

    private T data;

    public static <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    /**
     * 失败响应不带 data。
     */
    public static <T> Response<T> failure(String code, String info) {
        return Response.<T>builder()
                .code(code)
                .info(info)
                .build();
    }
}
