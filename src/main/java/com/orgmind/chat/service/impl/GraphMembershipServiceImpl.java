package com.orgmind.chat.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.orgmind.chat.mapper.GraphMembershipMapper;
import com.orgmind.chat.model.entity.GraphMembership;
import com.orgmind.chat.service.GraphMembershipService;
import org.springframework.stereotype.Service;

@Service
public class GraphMembershipServiceImpl extends ServiceImpl<GraphMembershipMapper, GraphMembership>
        implements GraphMembershipService {

    @Override
    public boolean isMember(String graphId, String userId) {
        if (graphId == null || userId == null) {
            return false;
        }
        return lambdaQuery()
                .eq(GraphMembership::getGraphId, graphId)
                .eq(GraphMembership::getUserId, userId)
                .count() > 0;
    }
}
