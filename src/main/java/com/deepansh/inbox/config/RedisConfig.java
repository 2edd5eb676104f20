package com.deepansh.inbox.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Thread transcripts live under {@code agent:conversation:<userId>:<threadId>} as a single
 * JSON array. ConversationStore owns the (de)serialization, so both sides of the
 * template are plain UTF-8 strings.
 */
@Configuration
public class RedisConfig {

    @Bean
    public StringRedisTemplate conversationRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.string());
        template.setEnableTransactionSupport(false);
        return template;
    }
}
