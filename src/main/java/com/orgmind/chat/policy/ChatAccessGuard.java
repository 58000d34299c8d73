package com.orgmind.chat.policy;

import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.service.ChatThreadService;
import com.orgmind.chat.service.GraphMembershipService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 同步前置校验：成员关系、线程归属、内容长度、限流。
 * <p>
 * 自身不涉及并发；任何失败都在流式管线启动前短路返回。
 * 限流放在最后检查，被拒绝的请求不消耗配额。
 */
@Component
public class ChatAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(ChatAccessGuard.class);

    private final ChatThreadService chatThreadService;
    private final GraphMembershipService graphMembershipService;
    private final RateLimitPolicy rateLimitPolicy;

    public ChatAccessGuard(ChatThreadService chatThreadService,
            GraphMembershipService graphMembershipService,
            RateLimitPolicy rateLimitPolicy) {
        this.chatThreadService = chatThreadService;
        this.graphMembershipService = graphMembershipService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    /** 提交用户消息前的校验 */
    public AuthorizationResult checkSubmission(String graphId, String threadId, String userId, String content) {
        if (MessageContentPolicy.isBlank(content)) {
            return deny(GuardFailure.CONTENT_EMPTY, threadId, userId);
        }
        if (MessageContentPolicy.isTooLong(content)) {
            return deny(GuardFailure.CONTENT_TOO_LONG, threadId, userId);
        }
        return checkThread(graphId, threadId, userId, RateLimitPolicy.SCOPE_MESSAGE);
    }

    /** 打开流式回答前的校验 */
    public AuthorizationResult checkStream(String graphId, String threadId, String userId) {
        return checkThread(graphId, threadId, userId, RateLimitPolicy.SCOPE_STREAM);
    }

    /** 读取线程内容（消息分页）前的校验，不计入限流 */
    public AuthorizationResult checkRead(String graphId, String threadId, String userId) {
        return checkThread(graphId, threadId, userId, null);
    }

    /** 图谱级操作（创建、列出线程）只要求成员关系 */
    public boolean isGraphMember(String graphId, String userId) {
        return graphMembershipService.isMember(graphId, userId);
    }

    private AuthorizationResult checkThread(String graphId, String threadId, String userId, String scope) {
        ChatThread thread = threadId == null ? null : chatThreadService.getById(threadId);
        if (thread == null) {
            return deny(GuardFailure.THREAD_NOT_FOUND, threadId, userId);
        }
        if (!graphMembershipService.isMember(thread.getGraphId(), userId)) {
            return deny(GuardFailure.NOT_MEMBER, threadId, userId);
        }
        if (!Objects.equals(thread.getGraphId(), graphId)) {
            return deny(GuardFailure.THREAD_GRAPH_MISMATCH, threadId, userId);
        }
        if (scope != null && !rateLimitPolicy.allow(userId, scope)) {
            return deny(GuardFailure.RATE_LIMITED, threadId, userId);
        }
        return AuthorizationResult.allow(thread);
    }

    private static AuthorizationResult deny(GuardFailure failure, String threadId, String userId) {
        log.info("Chat request rejected: failure={}, thread={}, user={}", failure, threadId, userId);
        return AuthorizationResult.deny(failure);
    }
}
