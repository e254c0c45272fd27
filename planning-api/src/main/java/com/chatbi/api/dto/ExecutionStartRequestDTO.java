package com.chatbi.api.dto;

import lombok.Data;

/**
 * 创建执行实例请求 DTO。planId 与 question 至少提供一个，planId 优先。
 */
@Data
public class ExecutionStartRequestDTO {

    private String planId;
    private String question;
    private String scene;
    private String category;
    private Boolean autoStart = Boolean.TRUE;
}
