package com.orgmind.chat.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对话线程实体，对应 chat_threads 表。一个线程只属于一个图谱、一个创建者。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("chat_threads")
public class ChatThread {

    /** 线程ID */
    @TableId
    private String id;

    /** 所属图谱ID */
    @TableField("graph_id")
    private String graphId;

    /** 创建者用户ID */
    @TableField("user_id")
    private String userId;

    /** 摘要（取自首条用户消息，最长 200 字符） */
    private String summary;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 最后更新时间，每追加一条消息刷新 */
    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
