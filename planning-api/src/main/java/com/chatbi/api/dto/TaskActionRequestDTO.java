package com.chatbi.api.dto;

import lombok.Data;

/**
 * 人工任务动作请求 DTO。
 */
@Data
public class TaskActionRequestDTO {

    private String taskId;
    /** start / complete / fail / retry / skip */
    private String action;
    private String note;
}
