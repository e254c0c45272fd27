package com.chatbi.api.dto;

import lombok.Data;

/**
 * 计划生成请求 DTO。
 */
@Data
public class PlanRequestDTO {

    private String question;
    private String scene;
    /** 分类提示，为空时按问题推断 */
    private String category;
}
