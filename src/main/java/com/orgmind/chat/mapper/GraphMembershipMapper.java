package com.orgmind.chat.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.orgmind.chat.model.entity.GraphMembership;

public interface GraphMembershipMapper extends BaseMapper<GraphMembership> {
}
