package com.chatbi.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装。
 * <p>
 * 所有规划接口返回 {code, info, data}，成功码为 "0000"，失败码见 ResponseCode。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author chatbi
 * @since 2025-01-29
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4188062953510293772L;

    /** 响应码 */
    private String code;

    /** 响应描述 */
    private String info;

    /** 响应数据 */
    private T data;

}
