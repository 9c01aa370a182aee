package com.sunny.procurehub.platform.module.user.service.impl;

import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.user.entity.VisitorClaim;
import com.sunny.procurehub.platform.module.user.mapper.VisitorClaimMapper;
import com.sunny.procurehub.platform.module.user.service.VisitorService;
import com.sunny.procurehub.platform.storage.InsertResult;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 访客认领服务实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VisitorServiceImpl implements VisitorService {

    private final VisitorClaimMapper visitorClaimMapper;
    private final TransactionExecutor transactionExecutor;
    private final Clock clock;

    @Override
    public boolean claimVisitor(String visitorId, Long userId) {
        if (visitorId == null || userId == null) {
            return false;
        }
        VisitorClaim claim = new VisitorClaim();
        claim.setVisitorId(visitorId);
        claim.setUserId(userId);
        claim.setClaimedAt(LocalDateTime.now(clock));

        InsertResult result = transactionExecutor.execute(DbScene.VISITOR_CLAIM,
                () -> transactionExecutor.insertOrConflict(() -> visitorClaimMapper.insert(claim)));
        if (result.conflicted()) {
            log.debug("security_event event=visitor_claim_skipped userId={}", userId);
            return false;
        }
        log.info("security_event event=visitor_claimed userId={}", userId);
        return true;
    }
}
