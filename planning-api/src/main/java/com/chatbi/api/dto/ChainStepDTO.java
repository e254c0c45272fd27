package com.chatbi.api.dto;

import lombok.Data;

/**
 * 协作链步骤 DTO。
 */
@Data
public class ChainStepDTO {

    private String name;
    private String role;
    private String handoffTo;
}
