package com.orgmind.chat;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.orgmind.chat.mapper")
@EnableScheduling
public class OrgMindChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrgMindChatApplication.class, args);
    }
}
