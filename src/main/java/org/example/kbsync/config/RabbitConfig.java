package org.example.kbsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;


@Configuration
public class RabbitConfig {
    //文档事件交换机
    public static final String DOCUMENT_EXCHANGE = "kb.document.exchange";
    //文档定稿队列，下游索引服务消费
    public static final String PROCESSED_QUEUE = "kb.document.processed.queue";
    public static final String PROCESSED_ROUTING_KEY = "kb.document.processed";
    //同步冲突队列，运维告警
    public static final String CONFLICT_QUEUE = "kb.sync.conflict.queue";
    public static final String CONFLICT_ROUTING_KEY = "kb.sync.conflict";
    //死信流程定义
    public static final String DL_QUEUE = "kb.document.dlq";
    public static final String DL_EXCHANGE = "kb.document.dlx";
    public static final String DL_ROUTING_KEY = "kb.document.dlk";

    @Bean
    public DirectExchange deadLetterExchange() {
        return new DirectExchange(DL_EXCHANGE, true, false);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DL_QUEUE, true);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with(DL_ROUTING_KEY);
    }

    @Bean
    public DirectExchange documentExchange() {
        return new DirectExchange(DOCUMENT_EXCHANGE, true, false);
    }

    @Bean
    public Queue processedQueue() {
        return new Queue(PROCESSED_QUEUE, true, false, false, deadLetterArgs());
    }

    @Bean
    public Binding processedBinding() {
        return BindingBuilder.bind(processedQueue()).to(documentExchange()).with(PROCESSED_ROUTING_KEY);
    }

    @Bean
    public Queue conflictQueue() {
        return new Queue(CONFLICT_QUEUE, true, false, false, deadLetterArgs());
    }

    @Bean
    public Binding conflictBinding() {
        return BindingBuilder.bind(conflictQueue()).to(documentExchange()).with(CONFLICT_ROUTING_KEY);
    }

    //发送时自动把对象转成 JSON，接收时自动把 JSON 转回对象
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    private static Map<String, Object> deadLetterArgs() {
        Map<String, Object> args = new HashMap<>();
        //指定死信交换机和路由键
        args.put("x-dead-letter-exchange", DL_EXCHANGE);
        args.put("x-dead-letter-routing-key", DL_ROUTING_KEY);
        return args;
    }
}
