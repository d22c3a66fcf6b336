package com.work.confirm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口体验确认组件。
 */
@SpringBootApplication
public class ConfirmDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfirmDemoApplication.class, args);
    }
}
