package org.example.kbsync.service.Impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.config.RabbitConfig;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.SyncConflict;
import org.example.kbsync.entity.dto.DocumentEventMessage;
import org.example.kbsync.entity.dto.SyncConflictMessage;
import org.example.kbsync.service.DocumentEventPublisher;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 消息在事务提交之后才发送，回滚的状态变更不会被下游看到。
 * 发送失败只记录日志，文档状态以数据库为准。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RabbitDocumentEventPublisher implements DocumentEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public void publishProcessed(KbDocument document) {
        DocumentEventMessage msg = new DocumentEventMessage(
                document.getId(),
                document.getTitle(),
                document.getProcessingMode(),
                document.getContentHash(),
                document.getSourceInstance(),
                document.getProcessedAt());
        afterCommit(() -> send(RabbitConfig.PROCESSED_ROUTING_KEY, msg, document.getId()));
    }

    @Override
    public void publishConflict(SyncConflict conflict) {
        SyncConflictMessage msg = new SyncConflictMessage(
                conflict.getId(),
                conflict.getDocumentId(),
                conflict.getAcceptedHash(),
                conflict.getRejectedHash(),
                conflict.getSourceInstance(),
                conflict.getDetectedAt());
        afterCommit(() -> send(RabbitConfig.CONFLICT_ROUTING_KEY, msg, conflict.getDocumentId()));
    }

    private void send(String routingKey, Object msg, Long docId) {
        try {
            rabbitTemplate.convertAndSend(RabbitConfig.DOCUMENT_EXCHANGE, routingKey, msg);
            log.info("消息已发送至MQ[{}] 文档ID: {}", routingKey, docId);
        } catch (AmqpException e) {
            log.error("消息发送失败[{}] 文档ID: {}, 错误信息: {}", routingKey, docId, e.getMessage(), e);
        }
    }

    private void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
