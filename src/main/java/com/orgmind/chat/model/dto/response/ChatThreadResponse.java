package com.orgmind.chat.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.orgmind.chat.model.entity.ChatThread;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatThreadResponse {

    private String id;
    private String graphId;
    private String userId;
    /** 首条用户消息摘要，尚无消息时为 null */
    private String summary;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime updatedAt;

    public static ChatThreadResponse from(ChatThread thread) {
        return ChatThreadResponse.builder()
                .id(thread.getId())
                .graphId(thread.getGraphId())
                .userId(thread.getUserId())
                .summary(thread.getSummary())
                .createdAt(thread.getCreatedAt())
                .updatedAt(thread.getUpdatedAt())
                .build();
    }
}
