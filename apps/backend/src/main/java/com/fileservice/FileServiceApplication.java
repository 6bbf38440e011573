package com.fileservice;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan(basePackages = "com.fileservice.mapper")
@Slf4j
public class FileServiceApplication {

    public static void main(String[] args) {
        log.info("Starting file service");
        SpringApplication.run(FileServiceApplication.class, args);
        log.info("File service started");
    }

}
