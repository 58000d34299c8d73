package com.orgmind.chat.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 提交用户消息请求，POST /api/graphs/{graphId}/chat/threads/{threadId}/messages。
 */
@Data
public class SendMessageRequest {

    /** 必填，1~4000 字符 */
    @NotBlank(message = "content is required")
    @Size(max = 4000, message = "Message content exceeds 4000 characters")
    private String content;
}
