package com.chatbi.api.dto;

import lombok.Data;

/**
 * 取消执行请求 DTO。
 */
@Data
public class ExecutionCancelRequestDTO {

    private String note;
}
