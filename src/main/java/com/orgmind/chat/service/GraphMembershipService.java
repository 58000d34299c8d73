package com.orgmind.chat.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.orgmind.chat.model.entity.GraphMembership;

public interface GraphMembershipService extends IService<GraphMembership> {

    boolean isMember(String graphId, String userId);
}
