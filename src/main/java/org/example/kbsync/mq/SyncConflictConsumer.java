package org.example.kbsync.mq;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.config.RabbitConfig;
import org.example.kbsync.entity.dto.SyncConflictMessage;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 同步冲突告警。冲突本身已在 cloud 侧落库，这里只负责把它暴露给运维。
 */
@Slf4j
@Component
public class SyncConflictConsumer {

    @RabbitListener(queues = RabbitConfig.CONFLICT_QUEUE)
    public void processConflict(SyncConflictMessage msg, Channel channel, @Header(AmqpHeaders.DELIVERY_TAG) long tag) throws IOException {
        try {
            log.error("【同步冲突】文档ID: {}, 已接受内容: {}, 被拒绝内容: {}, 来源: {}, 发现时间: {}。请人工核对两次本地处理结果。",
                    msg.getDocumentId(), msg.getAcceptedHash(), msg.getRejectedHash(),
                    msg.getSourceInstance(), msg.getDetectedAt());
            channel.basicAck(tag, false);
        } catch (IOException e) {
            log.error("确认冲突消息失败，文档ID: {}", msg.getDocumentId(), e);
            //拒绝且不重新入队，消息进入死信队列
            channel.basicNack(tag, false, false);
        }
    }
}
