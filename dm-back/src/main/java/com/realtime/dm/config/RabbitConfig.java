package com.realtime.dm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
public class RabbitConfig {

    public static final String DM_EXCHANGE = "dmExchange";
    public static final String WS_BRIDGE_QUEUE = "dm.ws-bridge";
    public static final String ROUTING_KEY_PREFIX = "dm.conversation.";
    // ChatFanoutService 가 dm.conversation.{conversationId} 로 발행
    public static final String ROUTING_KEY_PATTERN = ROUTING_KEY_PREFIX + "*";

    public static String routingKey(Object conversationId) {
        return ROUTING_KEY_PREFIX + conversationId;
    }

    @Bean
    public TopicExchange dmExchange() {
        return ExchangeBuilder.topicExchange(DM_EXCHANGE).durable(true).build();
    }

    @Bean
    public Queue wsBridgeQueue() {
        return QueueBuilder.durable(WS_BRIDGE_QUEUE).build();
    }

    @Bean
    public Binding wsBridgeBinding(Queue wsBridgeQueue, TopicExchange dmExchange) {
        return BindingBuilder.bind(wsBridgeQueue).to(dmExchange).with(ROUTING_KEY_PATTERN);
    }

    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory cf, Jackson2JsonMessageConverter conv) {
        RabbitTemplate rt = new RabbitTemplate(cf);
        rt.setMessageConverter(conv);
        return rt;
    }

    // spring.rabbitmq.listener.simple.* (auto-startup 등) 설정을 그대로 반영
    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory cf, Jackson2JsonMessageConverter conv) {
        SimpleRabbitListenerContainerFactory f = new SimpleRabbitListenerContainerFactory();
        configurer.configure(f, cf);
        f.setMessageConverter(conv);
        return f;
    }
}
