package com.vidnyan.flowchart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flow chart engine - control flow and preprocessor switch diagrams for embedded C functions.
 */
@SpringBootApplication
public class FlowchartApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowchartApplication.class, args);
    }
}
