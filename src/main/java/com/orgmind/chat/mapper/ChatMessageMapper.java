package com.orgmind.chat.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.orgmind.chat.model.entity.ChatMessage;

public interface ChatMessageMapper extends BaseMapper<ChatMessage> {
}
