package com.catdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class CatdbApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatdbApplication.class, args);
    }
}
