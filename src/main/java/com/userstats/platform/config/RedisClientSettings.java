package com.userstats.platform.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;

/**
 * Connection settings shared by every Jedis client the application opens.
 */
@Component
@Getter
public class RedisClientSettings {

    @Value("${redis.host:localhost}")
    private String host;

    @Value("${redis.port:6379}")
    private int port;

    @Value("${redis.password:}")
    private String password;

    @Value("${redis.ssl:false}")
    private boolean ssl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @Value("${redis.database:0}")
    private int database;

    public HostAndPort hostAndPort() {
        return new HostAndPort(host, port);
    }

    public JedisClientConfig clientConfig() {
        DefaultJedisClientConfig.Builder builder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout)
            .database(database);

        if (ssl) {
            builder.ssl(true);
        }

        if (password != null && !password.isEmpty()) {
            builder.password(password);
        }

        return builder.build();
    }

    public String describe() {
        return host + ":" + port + (ssl ? " (SSL enabled)" : "");
    }
}
