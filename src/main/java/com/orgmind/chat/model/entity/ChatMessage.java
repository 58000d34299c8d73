package com.orgmind.chat.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息表实体，对应 chat_messages 表。
 * <p>
 * 落库后内容不可变；流式过程中的部分内容只存在于内存，不写库。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("chat_messages")
public class ChatMessage {

    /** 消息ID */
    @TableId
    private String id;

    /** 所属线程ID */
    @TableField("thread_id")
    private String threadId;

    /** 角色：user | assistant */
    private String role;

    /** 消息内容（已做 HTML 转义） */
    private String content;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    public boolean hasRole(MessageRole expected) {
        return expected.value().equals(role);
    }
}
