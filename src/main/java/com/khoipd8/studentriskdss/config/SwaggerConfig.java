package com.khoipd8.studentriskdss.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI riskDssOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Student Risk DSS API")
                        .description("Scores students with the APS/ARS/FSR/LRS rule table, estimates failure "
                                + "probability with a logistic regression model and reconciles both into a risk tier")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("KhoiPD8")
                                .url("https://github.com/khoipd8")))
                .externalDocs(new ExternalDocumentation()
                        .description("UCI Student Performance dataset")
                        .url("https://archive.ics.uci.edu/dataset/320/student+performance"))
                .tags(List.of(new Tag()
                        .name("Risk Analysis")
                        .description("Single-student assessment, run results, rule catalog and export")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local server")
                ));
    }
}
