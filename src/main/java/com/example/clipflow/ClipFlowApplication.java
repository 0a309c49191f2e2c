package com.example.clipflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.web.config.EnableSpringDataWebSupport;

import static org.springframework.data.web.config.EnableSpringDataWebSupport.PageSerializationMode.VIA_DTO;

@SpringBootApplication
@EnableSpringDataWebSupport(pageSerializationMode = VIA_DTO)
public class ClipFlowApplication {
    private static final Logger logger = LoggerFactory.getLogger(ClipFlowApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ClipFlowApplication.class, args);
        logger.info("ClipFlow started");
    }
}
