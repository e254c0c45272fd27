package com.chatbi.api.dto;

import lombok.Data;

/**
 * 多步推进请求 DTO。
 */
@Data
public class ExecutionRunRequestDTO {

    private Integer maxSteps = 20;
}
