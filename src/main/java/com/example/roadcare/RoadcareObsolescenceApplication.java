package com.example.roadcare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class RoadcareObsolescenceApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(RoadcareObsolescenceApplication.class, args);
        // 批处理模式运行结束即退出
        if (context.getBean(ObsolescenceJobRunner.class).isEnabled()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
