package com.tradeledger.allocation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AllocationProperties.class)
public class AllocationConfig {
}
