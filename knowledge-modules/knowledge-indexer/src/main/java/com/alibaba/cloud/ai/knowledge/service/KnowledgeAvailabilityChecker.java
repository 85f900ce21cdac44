package com.alibaba.cloud.ai.knowledge.service;

import com.alibaba.cloud.ai.knowledge.backend.DisabledKnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.backend.KnowledgeBackend;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 知识库可用性检查器。
 * 通过判断后端是否为 DisabledKnowledgeBackend 来确认知识库是否启用。
 */
@Slf4j
@RequiredArgsConstructor
public class KnowledgeAvailabilityChecker {

    private final KnowledgeBackend backend;

    @PostConstruct
    public void init() {
        if (isAvailable()) {
            log.info("知识库已启用，存储后端: {}", backend.getClass().getSimpleName());
        } else {
            log.warn("知识库功能已禁用（copilot.knowledge.enabled=false），索引操作将被拒绝");
        }
    }

    /**
     * 返回知识库是否可用
     */
    public boolean isAvailable() {
        return !(backend instanceof DisabledKnowledgeBackend);
    }
}
