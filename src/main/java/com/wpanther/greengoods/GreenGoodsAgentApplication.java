package com.wpanther.greengoods;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GreenGoodsAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreenGoodsAgentApplication.class, args);
    }
}
