package com.orgmind.chat.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI orgMindChatOpenApi(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("OrgMind Chat API")
                        .description("知识图谱对话接口：线程管理、消息提交、SSE 流式回答。"
                                + "调用方身份由网关通过 X-User-Id 传入")
                        .version("v1"))
                .servers(List.of(new Server().url("http://localhost:" + port).description("Local")));
    }
}
