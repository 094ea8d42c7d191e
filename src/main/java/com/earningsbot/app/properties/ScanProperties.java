package com.earningsbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "scan")
public class ScanProperties {
    private int universeCacheTtlHours = 24;
}
