package com.earningsbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/earningsbot";
    private String user = "earningsbot";
    private String pass = "earningsbot";
    private String schema = "earningsbot";
}
