package com.sunny.procurehub.platform.module.approval.service;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.platform.module.approval.dto.ApprovalDto;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalEvent;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalAction;
import com.sunny.procurehub.platform.module.approval.model.ApprovalActor;
import java.util.List;

/**
 * 审批服务
 * 每次状态流转与对应的积分冻结操作在同一事务中完成，加锁顺序为 请求 → 冻结 → 账户
 */
public interface ApprovalService {

    ApprovalRequest createRequest(ApprovalActor actor, ApprovalDto.Create dto);

    /**
     * 按动作分发到具体流转
     */
    ApprovalDto.TransitionResult transition(Long requestId, ApprovalAction action, ApprovalActor actor,
                                            ApprovalDto.Transition payload);

    ApprovalDto.TransitionResult submit(Long requestId, ApprovalActor actor);

    ApprovalDto.TransitionResult approve(Long requestId, ApprovalActor actor);

    ApprovalDto.TransitionResult deny(Long requestId, ApprovalActor actor, String reason);

    ApprovalDto.TransitionResult cancel(Long requestId, ApprovalActor actor);

    ApprovalDto.TransitionResult fulfill(Long requestId, ApprovalActor actor, Long actualCredits,
                                         String referenceType, String referenceId);

    ApprovalDto.TransitionResult escalate(Long requestId, ApprovalActor actor);

    /**
     * 后台超时处理：可升级则升级，否则过期并释放冻结
     */
    ApprovalDto.TransitionResult processOverdue(Long requestId);

    /**
     * 扫描超时的待审批请求，每个请求单独一个事务，返回处理成功的数量
     */
    int sweepOverdue();

    ApprovalRequest getRequest(Long requestId, ApprovalActor actor);

    IPage<ApprovalRequest> listPendingForApprover(Long approverId, int limit, int offset);

    IPage<ApprovalRequest> listByRequester(Long requesterId, int limit, int offset);

    List<ApprovalEvent> listEvents(Long requestId, ApprovalActor actor);
}
