package com.automate.FindingSync.Config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "sync.scheduler", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
