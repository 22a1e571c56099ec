package com.github.salilvnair.j1ql.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan(basePackages = "com.github.salilvnair.j1ql")
public class J1qlAutoConfiguration {
}
