package com.renewalsync.renewal.lock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RenewalLockProperties.class)
public class RenewalLockConfig {
}
