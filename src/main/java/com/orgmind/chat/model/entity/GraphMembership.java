package com.orgmind.chat.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 图谱成员关系，对应 graph_memberships 表。本服务只读。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("graph_memberships")
public class GraphMembership {

    @TableId
    private String id;

    @TableField("graph_id")
    private String graphId;

    @TableField("user_id")
    private String userId;

    /** owner | member */
    private String role;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
