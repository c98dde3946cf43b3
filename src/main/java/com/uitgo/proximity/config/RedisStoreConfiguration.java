package com.uitgo.proximity.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.jedis.JedisClientConfiguration;
import org.springframework.data.redis.connection.jedis.JedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import redis.clients.jedis.JedisPoolConfig;

import java.time.Duration;

/**
 * Connection to the Redis server holding the driver GEO set.
 * Only active with {@code proximity.store.type=redis}.
 */
@Configuration
@ConditionalOnProperty(prefix = "proximity.store", name = "type", havingValue = "redis")
public class RedisStoreConfiguration {
    
    @Value("${proximity.redis.host:localhost}")
    private String host;
    
    @Value("${proximity.redis.port:6379}")
    private int port;
    
    @Value("${proximity.redis.password:}")
    private String password;
    
    @Value("${proximity.redis.database:0}")
    private int database;
    
    @Value("${proximity.redis.timeout:5000}")
    private int timeout;
    
    @Value("${proximity.redis.pool.max-total:50}")
    private int poolMaxTotal;
    
    @Value("${proximity.redis.pool.max-idle:20}")
    private int poolMaxIdle;
    
    @Value("${proximity.redis.pool.min-idle:5}")
    private int poolMinIdle;
    
    @Bean
    public JedisPoolConfig jedisPoolConfig() {
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(poolMaxTotal);
        config.setMaxIdle(poolMaxIdle);
        config.setMinIdle(poolMinIdle);
        config.setTestOnBorrow(true);
        config.setTestWhileIdle(true);
        config.setBlockWhenExhausted(true);
        // Bounded wait so an exhausted pool surfaces as a store failure instead of hanging
        config.setMaxWait(Duration.ofMillis(timeout));
        return config;
    }
    
    @Bean
    public RedisConnectionFactory proximityConnectionFactory(JedisPoolConfig jedisPoolConfig) {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(host);
        config.setPort(port);
        config.setDatabase(database);
        
        if (password != null && !password.trim().isEmpty()) {
            config.setPassword(password);
        }
        
        JedisClientConfiguration clientConfig = JedisClientConfiguration.builder()
                .connectTimeout(Duration.ofMillis(timeout))
                .readTimeout(Duration.ofMillis(timeout))
                .usePooling()
                .poolConfig(jedisPoolConfig)
                .build();
        
        return new JedisConnectionFactory(config, clientConfig);
    }
    
    @Bean
    public StringRedisTemplate proximityRedisTemplate(RedisConnectionFactory proximityConnectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(proximityConnectionFactory);
        template.afterPropertiesSet();
        return template;
    }
}
