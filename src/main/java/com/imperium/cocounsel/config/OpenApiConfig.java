package com.imperium.cocounsel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI coCounselOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lawyrs AI Co-Counsel API")
                        .description("多 Agent 法律协理编排服务接口文档（Kansas / Missouri）")
                        .version("v0")
                        .contact(new Contact().name("Lawyrs Team")))
                .servers(List.of(
                        new Server().url("http://localhost:8093").description("Local")
                ));
    }
}
