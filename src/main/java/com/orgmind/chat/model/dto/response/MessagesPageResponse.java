package com.orgmind.chat.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 线程消息分页，messages 按时间正序。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessagesPageResponse {

    private List<ChatMessageResponse> messages;
    private long total;
    private boolean hasMore;
}
