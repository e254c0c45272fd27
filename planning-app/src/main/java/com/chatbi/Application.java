package com.chatbi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChatBI 规划编排服务启动类。
 * <p>
 * 位于顶层包路径，扫描 types / domain / infrastructure / trigger 各模块组件。
 * </p>
 *
 * @author chatbi
 * @since 2025-01-29
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
