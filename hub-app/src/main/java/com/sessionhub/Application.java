package com.sessionhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 会话中枢应用启动类。
 * <p>
 * 位于顶层包 {@code com.sessionhub}，以便扫描到 domain / infrastructure / trigger 各模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
