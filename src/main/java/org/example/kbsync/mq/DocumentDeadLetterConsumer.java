package org.example.kbsync.mq;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.config.RabbitConfig;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class DocumentDeadLetterConsumer {

    @RabbitListener(queues = RabbitConfig.DL_QUEUE)
    public void processDeadLetter(Message message, Channel channel, @Header(AmqpHeaders.DELIVERY_TAG) long tag) {
        String routingKey = message.getMessageProperties().getReceivedRoutingKey();
        try {
            log.error("收到死信队列消息，路由键: {}, 内容: {}，可能处理失败多次，请检查相关问题。",
                    routingKey, new String(message.getBody(), StandardCharsets.UTF_8));
            // 手动确认消息已被处理
            channel.basicAck(tag, false);
        } catch (IOException e) {
            log.error("确认死信消息时发生异常，路由键: {}", routingKey, e);
        }
    }
}
