package com.orgmind.chat.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.orgmind.chat.model.entity.ChatThread;

public interface ChatThreadMapper extends BaseMapper<ChatThread> {
}
